package com.example.lazycopy.exception;

/**
 * Thrown when the deep-copy primitive cannot copy one of the roots of a flush.
 * The flush that failed has already discarded its queued entries.
 */
public class CopyException extends Exception {

    private final int discardedEntries;

    public CopyException(String message, Throwable cause) {
        this(message, cause, 0);
    }

    public CopyException(String message, Throwable cause, int discardedEntries) {
        super(message, cause);
        this.discardedEntries = discardedEntries;
    }

    /** @return number of queued entries dropped by the failed flush (0 outside a flush) */
    public int getDiscardedEntries() {
        return discardedEntries;
    }
}
