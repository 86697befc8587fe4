package de.mirkosertic.vectorizer.reconcile;

public record PlanEntry(String identity, SyncAction action) {
}
