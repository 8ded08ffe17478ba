package com.example.lazycopy.api;

import java.util.List;
import java.util.Map;

import com.example.lazycopy.exception.CopyException;
import com.example.lazycopy.model.AliasPolicy;
import com.example.lazycopy.model.BatcherOptions;
import com.example.lazycopy.model.Consistency;
import com.example.lazycopy.proxy.LazyList;
import com.example.lazycopy.proxy.LazyMap;

/**
 * Batches deferred deep-copy requests and resolves them with as few calls to the
 * underlying copier as possible.
 * <p>
 * A {@code null} consistency or alias argument means "use the batcher default".
 * Only operations that may flush (or copy strictly) throw {@link CopyException}.
 */
public interface DeepCopyBatcher {

    /**
     * Queue a copy of {@code root} with the batcher defaults.
     */
    <T> CopyHandle<T> defer(T root) throws CopyException;

    /**
     * Queue a copy of {@code root}. With {@link Consistency#STRICT} the copy is made
     * now and the returned handle is already ready. Otherwise the entry is queued and,
     * if a threshold is reached, the queue is flushed before returning.
     *
     * @throws CopyException if the strict copy or the triggered flush fails
     */
    <T> CopyHandle<T> defer(T root, Consistency consistency, AliasPolicy alias) throws CopyException;

    /**
     * Same as {@link #defer(Object)}, wrapped in a lazy view.
     */
    <T> LazyCopy<T> deferProxy(T root) throws CopyException;

    <T> LazyCopy<T> deferProxy(T root, Consistency consistency, AliasPolicy alias) throws CopyException;

    /**
     * Defers a copy of a list and returns a {@code List} view over it.
     */
    <E> LazyList<E> deferList(List<E> root, Consistency consistency, AliasPolicy alias) throws CopyException;

    /**
     * Defers a copy of a map and returns a {@code Map} view over it.
     */
    <K, V> LazyMap<K, V> deferMap(Map<K, V> root, Consistency consistency, AliasPolicy alias) throws CopyException;

    /**
     * Another lazy view over an existing handle; all views of a handle see the same copy.
     */
    <T> LazyCopy<T> proxy(CopyHandle<T> handle);

    /**
     * Return the copy behind {@code handle}, flushing the whole queue first if it is pending.
     *
     * @throws CopyException if the flush fails, or if the handle was discarded by an earlier failed flush
     * @throws IllegalArgumentException if the handle was issued by another batcher
     */
    <T> T get(CopyHandle<T> handle) throws CopyException;

    /**
     * Resolve every queued entry. No-op on an empty queue.
     * On failure the queue is cleared and every drained handle is marked failed.
     */
    void flush() throws CopyException;

    /** @return number of queued entries */
    int pendingCount();

    /** @return estimated bytes queued; always 0 without a size estimator */
    long pendingBytes();

    BatcherOptions options();

    BatcherStats stats();
}
