package com.example.lazycopy.api;

/**
 * Opaque handle representing one deferred copy.
 * Resolved only through the batcher that issued it; safe to share across threads.
 *
 * @param <T> type of the copied value
 */
public interface CopyHandle<T> {

    /** @return true once the copy has been produced; never reverts */
    boolean isReady();

    /** @return true if the flush that drained this handle failed; never reverts */
    boolean isFailed();
}
