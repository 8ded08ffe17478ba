package com.example.lazycopy.service;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.log4j.Logger;

import com.example.lazycopy.api.BatcherStats;
import com.example.lazycopy.api.CopyHandle;
import com.example.lazycopy.api.DeepCopyBatcher;
import com.example.lazycopy.api.LazyCopy;
import com.example.lazycopy.copy.DeepCopier;
import com.example.lazycopy.copy.SerializationCopier;
import com.example.lazycopy.copy.SizeEstimator;
import com.example.lazycopy.exception.CopyException;
import com.example.lazycopy.exception.ValidationException;
import com.example.lazycopy.model.AliasPolicy;
import com.example.lazycopy.model.BatcherOptions;
import com.example.lazycopy.model.Consistency;
import com.example.lazycopy.proxy.HandleLazyCopy;
import com.example.lazycopy.proxy.LazyList;
import com.example.lazycopy.proxy.LazyMap;

/**
 * Implementation of the DeepCopyBatcher API.
 *
 * Responsibilities:
 * - Queue deferred copy requests and resolve them in one flush.
 * - Deduplicate PRESERVE entries by root identity so that one root copied from
 *   several places in a batch yields one shared copy.
 * - Copy DUPLICATE entries one by one so that they never share a copy.
 * - Publish all results of a flush, or none of them.
 *
 * A single reentrant lock guards the queue and the whole flush, copier call included.
 * Strict copies run outside the lock, which is why {@link DeepCopier} requires thread-safe
 * implementations.
 */
public class DeepCopyBatcherImpl implements DeepCopyBatcher {

    private static final Logger log = Logger.getLogger(DeepCopyBatcherImpl.class);

    private final BatcherOptions options;

    private final DeepCopier copier;

    /** Null when byte accounting is off. */
    private final SizeEstimator sizeEstimator;

    /** Guards {@link #queue}, {@link #pendingBytes} and the flush body. */
    private final ReentrantLock lock = new ReentrantLock();

    /** Pending entries in defer order. Never holds a resolved handle. */
    private final List<PendingEntry> queue = new ArrayList<>();

    private long pendingBytes;

    private final AtomicLong flushes = new AtomicLong();
    private final AtomicLong failedFlushes = new AtomicLong();
    private final AtomicLong resolvedEntries = new AtomicLong();
    private final AtomicLong copierCalls = new AtomicLong();
    private final AtomicLong dedupHits = new AtomicLong();
    private final AtomicLong strictCopies = new AtomicLong();

    /**
     * Batcher with default options, copying through Java serialization.
     */
    public DeepCopyBatcherImpl() {
        this.options = BatcherOptions.defaults();
        this.copier = new SerializationCopier();
        this.sizeEstimator = null;
    }

    /**
     * @param options configuration, fixed for the lifetime of the batcher
     * @param copier deep-copy primitive used by every flush and strict copy
     * @throws ValidationException if the options are invalid or the copier is missing
     */
    public DeepCopyBatcherImpl(BatcherOptions options, DeepCopier copier) throws ValidationException {
        validate(options, copier);
        this.options = options;
        this.copier = copier;
        this.sizeEstimator = options.getSizeEstimator().orElse(null);
    }

    private static void validate(BatcherOptions options, DeepCopier copier) throws ValidationException {
        if (options == null) {
            throw new ValidationException("options must not be null");
        }
        if (copier == null) {
            throw new ValidationException("copier must not be null");
        }
        if (options.getMaxItems() <= 0) {
            throw new ValidationException("maxItems must be > 0, got " + options.getMaxItems());
        }
        if (options.getMaxBytes().isPresent() && options.getMaxBytes().getAsLong() <= 0) {
            throw new ValidationException("maxBytes must be > 0, got " + options.getMaxBytes().getAsLong());
        }
        if (options.getConsistency() == null) {
            throw new ValidationException("consistency must not be null");
        }
        if (options.getAlias() == null) {
            throw new ValidationException("alias must not be null");
        }
    }

    @Override
    public <T> CopyHandle<T> defer(T root) throws CopyException {
        return defer(root, null, null);
    }

    @Override
    public <T> CopyHandle<T> defer(T root, Consistency consistency, AliasPolicy alias) throws CopyException {
        if (consistency == null) {
            consistency = options.getConsistency();
        }
        if (alias == null) {
            alias = options.getAlias();
        }

        final PendingHandle<T> handle = new PendingHandle<>(this);

        if (consistency == Consistency.STRICT) {
            // Snapshot now; the entry never joins a batch.
            handle.complete(copyStrict(root));
            return handle;
        }

        lock.lock();
        try {
            final long bytes = sizeEstimator == null ? 0L : sizeEstimator.estimate(root);
            queue.add(new PendingEntry(handle, root, alias, bytes));
            pendingBytes += bytes;
            if (shouldFlushLocked()) {
                flushLocked();
            }
        } finally {
            lock.unlock();
        }
        return handle;
    }

    @Override
    public <T> LazyCopy<T> deferProxy(T root) throws CopyException {
        return deferProxy(root, null, null);
    }

    @Override
    public <T> LazyCopy<T> deferProxy(T root, Consistency consistency, AliasPolicy alias) throws CopyException {
        return new HandleLazyCopy<>(this, defer(root, consistency, alias));
    }

    @Override
    public <E> LazyList<E> deferList(List<E> root, Consistency consistency, AliasPolicy alias) throws CopyException {
        return new LazyList<>(this, defer(root, consistency, alias));
    }

    @Override
    public <K, V> LazyMap<K, V> deferMap(Map<K, V> root, Consistency consistency, AliasPolicy alias)
            throws CopyException {
        return new LazyMap<>(this, defer(root, consistency, alias));
    }

    @Override
    public <T> LazyCopy<T> proxy(CopyHandle<T> handle) {
        return new HandleLazyCopy<>(this, own(handle));
    }

    @Override
    public <T> T get(CopyHandle<T> handle) throws CopyException {
        final PendingHandle<T> h = own(handle);
        if (h.isReady()) {
            return h.getValue();
        }

        lock.lock();
        try {
            if (h.getStatus() == PendingHandle.Status.PENDING) {
                flushLocked();
            }
        } finally {
            lock.unlock();
        }

        switch (h.getStatus()) {
        case READY:
            return h.getValue();
        case FAILED:
            throw new CopyException("Copy was discarded by a failed flush", h.getFailure());
        default:
            // Every pending handle of this batcher is in the queue, so the flush resolved it.
            throw new IllegalStateException("Handle still pending after flush: " + h);
        }
    }

    @Override
    public void flush() throws CopyException {
        lock.lock();
        try {
            if (queue.isEmpty()) {
                return;
            }
            flushLocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int pendingCount() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long pendingBytes() {
        lock.lock();
        try {
            return pendingBytes;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public BatcherOptions options() {
        return options;
    }

    @Override
    public BatcherStats stats() {
        return new BatcherStats(flushes.get(), failedFlushes.get(), resolvedEntries.get(),
                copierCalls.get(), dedupHits.get(), strictCopies.get());
    }

    @Override
    public String toString() {
        return "DeepCopyBatcherImpl{" + "options=" + options + ", copier=" + copier + '}';
    }

    // ------------------------- Internals ----------------------------------

    private boolean shouldFlushLocked() {
        if (queue.size() >= options.getMaxItems()) {
            return true;
        }
        return sizeEstimator != null
                && options.getMaxBytes().isPresent()
                && pendingBytes >= options.getMaxBytes().getAsLong();
    }

    private Object copyStrict(Object root) throws CopyException {
        copierCalls.incrementAndGet();
        strictCopies.incrementAndGet();
        if (log.isDebugEnabled()) {
            log.debug("Strict copy of " + describeRoot(root));
        }
        try {
            return copier.copyOne(root);
        } catch (RuntimeException ex) {
            throw new CopyException("Cannot copy: " + ex.getMessage(), ex);
        }
    }

    /**
     * Resolves the whole queue. Caller holds the lock.
     *
     * The queue is drained up front, so it is empty afterwards whether or not the
     * copier succeeds. Results are published only after every copier call of this
     * flush has returned.
     */
    private void flushLocked() throws CopyException {
        checkState(lock.isHeldByCurrentThread(), "flush requires the batcher lock");
        if (queue.isEmpty()) {
            return;
        }

        final List<PendingEntry> drained = new ArrayList<>(queue);
        queue.clear();
        pendingBytes = 0;
        flushes.incrementAndGet();

        final List<PendingEntry> duplicates = new ArrayList<>();
        final List<PendingEntry> preserved = new ArrayList<>();
        for (PendingEntry e : drained) {
            if (e.getAlias() == AliasPolicy.DUPLICATE) {
                duplicates.add(e);
            } else {
                preserved.add(e);
            }
        }

        final List<Object> duplicateCopies = new ArrayList<>(duplicates.size());
        final int[] preservedIndex = new int[preserved.size()];
        final List<Object> preservedCopies;
        int hits = 0;

        try {
            // One copier call per DUPLICATE entry: identical roots still get distinct copies.
            for (PendingEntry e : duplicates) {
                copierCalls.incrementAndGet();
                duplicateCopies.add(copier.copyOne(e.getRoot()));
            }

            // PRESERVE entries: deduplicate roots by identity, then copy them in one call.
            final Map<Object, Integer> seen = new IdentityHashMap<>();
            final List<Object> inputs = new ArrayList<>();
            for (int i = 0; i < preserved.size(); i++) {
                final Object root = preserved.get(i).getRoot();
                Integer idx = seen.get(root);
                if (idx == null) {
                    idx = inputs.size();
                    seen.put(root, idx);
                    inputs.add(root);
                } else {
                    hits++;
                }
                preservedIndex[i] = idx;
            }

            if (inputs.isEmpty()) {
                preservedCopies = new ArrayList<>();
            } else {
                copierCalls.incrementAndGet();
                preservedCopies = copier.copyMany(inputs);
                checkState(preservedCopies.size() == inputs.size(),
                        "copier returned %s copies for %s roots", preservedCopies.size(), inputs.size());
            }
        } catch (CopyException | RuntimeException ex) {
            throw failLocked(drained, ex);
        } catch (Error err) {
            // Drained handles must not stay pending outside the queue.
            failLocked(drained, err);
            throw err;
        }

        if (log.isDebugEnabled()) {
            log.debug("Flushed " + drained.size() + " entries: duplicate=" + duplicates.size()
                    + ", preserve=" + preserved.size() + ", dedupHits=" + hits);
        }

        for (int i = 0; i < duplicates.size(); i++) {
            duplicates.get(i).getHandle().complete(duplicateCopies.get(i));
        }
        for (int i = 0; i < preserved.size(); i++) {
            preserved.get(i).getHandle().complete(preservedCopies.get(preservedIndex[i]));
        }

        dedupHits.addAndGet(hits);
        resolvedEntries.addAndGet(drained.size());
    }

    /**
     * Marks every drained handle failed and returns the exception to throw.
     */
    private CopyException failLocked(List<PendingEntry> drained, Throwable cause) {
        failedFlushes.incrementAndGet();
        log.warn("Flush failed, discarding " + drained.size() + " queued entries", cause);
        final CopyException failure = new CopyException("Flush failed; " + drained.size()
                + " queued entries discarded: " + cause.getMessage(), cause, drained.size());
        for (PendingEntry e : drained) {
            e.getHandle().fail(failure);
        }
        return failure;
    }

    private <T> PendingHandle<T> own(CopyHandle<T> handle) {
        checkNotNull(handle, "handle");
        checkArgument(handle instanceof PendingHandle && ((PendingHandle<?>) handle).getOwner() == this,
                "Handle was not issued by this batcher: %s", handle);
        return (PendingHandle<T>) handle;
    }

    private static String describeRoot(Object root) {
        return root == null ? "null" : root.getClass().getName() + "@" + Integer.toHexString(System.identityHashCode(root));
    }
}
