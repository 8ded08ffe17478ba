package com.example.lazycopy.service;

import com.example.lazycopy.model.AliasPolicy;

/**
 * One queued copy request: the handle to fill, the root to copy at flush time, and
 * the alias policy in force when it was queued.
 */
final class PendingEntry {

    private final PendingHandle<?> handle;
    private final Object root;
    private final AliasPolicy alias;

    /** Size estimate counted against the soft byte cap; 0 without an estimator. */
    private final long bytes;

    PendingEntry(PendingHandle<?> handle, Object root, AliasPolicy alias, long bytes) {
        this.handle = handle;
        this.root = root;
        this.alias = alias;
        this.bytes = bytes;
    }

    PendingHandle<?> getHandle() {
        return handle;
    }

    Object getRoot() {
        return root;
    }

    AliasPolicy getAlias() {
        return alias;
    }

    long getBytes() {
        return bytes;
    }
}
