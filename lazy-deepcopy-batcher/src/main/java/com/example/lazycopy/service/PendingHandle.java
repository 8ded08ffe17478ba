package com.example.lazycopy.service;

import java.util.concurrent.atomic.AtomicReference;

import com.example.lazycopy.api.CopyHandle;
import com.example.lazycopy.exception.CopyException;

/**
 * Mutable cell behind a {@link CopyHandle}.
 *
 * - Created PENDING by {@code defer}, or READY straight away for strict copies.
 * - Moves exactly once to READY or FAILED, only under the batcher lock.
 * - The value (or failure) is written before the status, so a reader that sees
 *   READY through the atomic status also sees the value.
 *
 * This class is package-private and intended for internal use by DeepCopyBatcherImpl.
 */
final class PendingHandle<T> implements CopyHandle<T> {

    /** Lifecycle states of a handle. */
    enum Status { PENDING, READY, FAILED }

    /** Batcher that issued this handle; only it may resolve the handle. */
    private final DeepCopyBatcherImpl owner;

    private final AtomicReference<Status> status = new AtomicReference<>(Status.PENDING);

    private Object value;

    private CopyException failure;

    PendingHandle(DeepCopyBatcherImpl owner) {
        this.owner = owner;
    }

    DeepCopyBatcherImpl getOwner() {
        return owner;
    }

    Status getStatus() {
        return status.get();
    }

    /** Publish the copy. Takes Object because the batcher holds handles of mixed types. */
    void complete(Object copy) {
        this.value = copy;
        if (!status.compareAndSet(Status.PENDING, Status.READY)) {
            throw new IllegalStateException("Handle already resolved: " + status.get());
        }
    }

    /** Record the failure of the flush that drained this handle. */
    void fail(CopyException cause) {
        this.failure = cause;
        if (!status.compareAndSet(Status.PENDING, Status.FAILED)) {
            throw new IllegalStateException("Handle already resolved: " + status.get());
        }
    }

    /**
     * @return the copy; only meaningful once {@link #isReady()}. The copier preserves the
     *         root's runtime class, so the value has the type the handle was deferred with.
     */
    @SuppressWarnings("unchecked")
    T getValue() {
        return (T) value;
    }

    CopyException getFailure() {
        return failure;
    }

    @Override
    public boolean isReady() {
        return status.get() == Status.READY;
    }

    @Override
    public boolean isFailed() {
        return status.get() == Status.FAILED;
    }

    @Override
    public String toString() {
        return "CopyHandle{" + "status=" + status.get() + '}';
    }
}
