package com.example.lazycopy.proxy;

import static com.google.common.base.Preconditions.checkNotNull;

import com.example.lazycopy.api.CopyHandle;
import com.example.lazycopy.api.DeepCopyBatcher;
import com.example.lazycopy.api.LazyCopy;
import com.example.lazycopy.exception.CopyException;
import com.example.lazycopy.exception.UncheckedCopyException;

/**
 * {@link LazyCopy} reading through a batcher handle.
 * Holds no value of its own; every access goes back to the handle.
 */
public class HandleLazyCopy<T> implements LazyCopy<T> {

    private final DeepCopyBatcher batcher;

    private final CopyHandle<T> handle;

    public HandleLazyCopy(DeepCopyBatcher batcher, CopyHandle<T> handle) {
        this.batcher = checkNotNull(batcher, "batcher");
        this.handle = checkNotNull(handle, "handle");
    }

    @Override
    public T get() throws CopyException {
        return batcher.get(handle);
    }

    /**
     * Same as {@link #get()} for callers that cannot declare {@link CopyException}.
     */
    public T resolve() {
        try {
            return batcher.get(handle);
        } catch (CopyException e) {
            throw new UncheckedCopyException(e);
        }
    }

    @Override
    public boolean isMaterialized() {
        return handle.isReady();
    }

    @Override
    public CopyHandle<T> handle() {
        return handle;
    }

    @Override
    public String describe() {
        if (handle.isFailed()) {
            return "<LazyCopy failed>";
        }
        if (!handle.isReady()) {
            return "<LazyCopy unresolved>";
        }
        return String.valueOf(resolve());
    }

    /** Forces resolution. */
    @Override
    public String toString() {
        return String.valueOf(resolve());
    }
}
