package com.example.lazycopy.api;

import com.example.lazycopy.exception.CopyException;

/**
 * Lazy view of a deferred copy. The first call that needs the real value resolves
 * it through the owning batcher, which flushes the entire pending batch, not just
 * this entry.
 *
 * @param <T> type of the copied value
 */
public interface LazyCopy<T> {

    /**
     * Returns the copied value, flushing the batch if it is still pending.
     */
    T get() throws CopyException;

    /**
     * @return whether the value is already available; never forces resolution
     */
    boolean isMaterialized();

    /** @return the handle this view reads from */
    CopyHandle<T> handle();

    /**
     * Describes the view without forcing resolution: the value's string form when
     * materialized, a placeholder otherwise.
     */
    String describe();
}
