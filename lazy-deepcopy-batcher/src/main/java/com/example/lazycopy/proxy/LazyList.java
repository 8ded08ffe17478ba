package com.example.lazycopy.proxy;

import java.util.List;

import com.example.lazycopy.api.CopyHandle;
import com.example.lazycopy.api.DeepCopyBatcher;
import com.example.lazycopy.api.LazyCopy;
import com.example.lazycopy.exception.CopyException;
import com.google.common.collect.ForwardingList;

/**
 * {@code List} view of a deferred list copy.
 * <p>
 * Every {@code List} operation (indexed get/set, iteration, size, equals, toString)
 * resolves the copy first, flushing the whole pending batch if needed, then runs
 * against the copy. Writes go to the copy, never to the source. A failed copy
 * surfaces as {@link com.example.lazycopy.exception.UncheckedCopyException}.
 */
public final class LazyList<E> extends ForwardingList<E> implements LazyCopy<List<E>> {

    private final HandleLazyCopy<List<E>> lazy;

    public LazyList(DeepCopyBatcher batcher, CopyHandle<List<E>> handle) {
        this.lazy = new HandleLazyCopy<>(batcher, handle);
    }

    @Override
    protected List<E> delegate() {
        return lazy.resolve();
    }

    @Override
    public List<E> get() throws CopyException {
        return lazy.get();
    }

    @Override
    public boolean isMaterialized() {
        return lazy.isMaterialized();
    }

    @Override
    public CopyHandle<List<E>> handle() {
        return lazy.handle();
    }

    @Override
    public String describe() {
        return lazy.describe();
    }
}
