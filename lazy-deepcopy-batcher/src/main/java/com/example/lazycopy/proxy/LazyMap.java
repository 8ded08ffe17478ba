package com.example.lazycopy.proxy;

import java.util.Map;

import com.example.lazycopy.api.CopyHandle;
import com.example.lazycopy.api.DeepCopyBatcher;
import com.example.lazycopy.api.LazyCopy;
import com.example.lazycopy.exception.CopyException;
import com.google.common.collect.ForwardingMap;

/**
 * {@code Map} view of a deferred map copy; see {@link LazyList} for the resolution rules.
 */
public final class LazyMap<K, V> extends ForwardingMap<K, V> implements LazyCopy<Map<K, V>> {

    private final HandleLazyCopy<Map<K, V>> lazy;

    public LazyMap(DeepCopyBatcher batcher, CopyHandle<Map<K, V>> handle) {
        this.lazy = new HandleLazyCopy<>(batcher, handle);
    }

    @Override
    protected Map<K, V> delegate() {
        return lazy.resolve();
    }

    @Override
    public Map<K, V> get() throws CopyException {
        return lazy.get();
    }

    @Override
    public boolean isMaterialized() {
        return lazy.isMaterialized();
    }

    @Override
    public CopyHandle<Map<K, V>> handle() {
        return lazy.handle();
    }

    @Override
    public String describe() {
        return lazy.describe();
    }
}
