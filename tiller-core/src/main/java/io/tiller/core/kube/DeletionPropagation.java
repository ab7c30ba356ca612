package io.tiller.core.kube;

/// How dependents of a deleted object are garbage collected.
public enum DeletionPropagation {
    BACKGROUND,
    FOREGROUND,
    ORPHAN
}
