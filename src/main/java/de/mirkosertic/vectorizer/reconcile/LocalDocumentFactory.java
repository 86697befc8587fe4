package de.mirkosertic.vectorizer.reconcile;

import de.mirkosertic.vectorizer.corpus.AdmissionFilter;
import de.mirkosertic.vectorizer.corpus.AdmissionResult;
import de.mirkosertic.vectorizer.corpus.CorpusDocument;
import de.mirkosertic.vectorizer.corpus.DocumentFingerprinter;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns raw corpus documents into {@link LocalDocument}s: identity from the path,
 * content through the admission filter, fingerprint over the admitted content.
 */
public class LocalDocumentFactory {

    private final AdmissionFilter admissionFilter;
    private final DocumentFingerprinter fingerprinter;

    public LocalDocumentFactory(final AdmissionFilter admissionFilter, final DocumentFingerprinter fingerprinter) {
        this.admissionFilter = admissionFilter;
        this.fingerprinter = fingerprinter;
    }

    public LocalDocument create(final CorpusDocument document) {
        final AdmissionResult admission = admissionFilter.admit(document.content());
        return new LocalDocument(
                fingerprinter.identityOf(document.relativePath()),
                document.relativePath(),
                admission.content(),
                fingerprinter.fingerprint(admission.content()),
                !admission.admitted(),
                admission.originalLength()
        );
    }

    /**
     * @return local documents keyed by identity, in corpus order
     */
    public Map<String, LocalDocument> index(final Collection<CorpusDocument> documents) {
        final Map<String, LocalDocument> result = new LinkedHashMap<>();
        for (final CorpusDocument document : documents) {
            final LocalDocument local = create(document);
            result.put(local.identity(), local);
        }
        return result;
    }
}
