package com.example.lazycopy.api;

/**
 * Immutable snapshot of a batcher's counters.
 */
public final class BatcherStats {
    private final long flushes;
    private final long failedFlushes;
    private final long resolvedEntries;
    private final long copierCalls;
    private final long dedupHits;
    private final long strictCopies;

    public BatcherStats(long flushes, long failedFlushes, long resolvedEntries,
                        long copierCalls, long dedupHits, long strictCopies) {
        this.flushes = flushes;
        this.failedFlushes = failedFlushes;
        this.resolvedEntries = resolvedEntries;
        this.copierCalls = copierCalls;
        this.dedupHits = dedupHits;
        this.strictCopies = strictCopies;
    }

    /** @return flushes that drained a non-empty queue, including failed ones */
    public long getFlushes() {
        return flushes;
    }

    public long getFailedFlushes() {
        return failedFlushes;
    }

    /** @return handles made ready by flushes (strict copies not included) */
    public long getResolvedEntries() {
        return resolvedEntries;
    }

    /** @return invocations of the deep-copy primitive, strict copies included */
    public long getCopierCalls() {
        return copierCalls;
    }

    /** @return preserve entries that reused the copy of an earlier entry with the same root */
    public long getDedupHits() {
        return dedupHits;
    }

    public long getStrictCopies() {
        return strictCopies;
    }

    @Override
    public String toString() {
        return "BatcherStats{" +
                "flushes=" + flushes +
                ", failedFlushes=" + failedFlushes +
                ", resolvedEntries=" + resolvedEntries +
                ", copierCalls=" + copierCalls +
                ", dedupHits=" + dedupHits +
                ", strictCopies=" + strictCopies +
                '}';
    }
}
