package com.example.lazycopy.exception;

/**
 * Carries a {@link CopyException} out of operations whose signatures are fixed by a JDK
 * interface ({@code List}, {@code Map}, {@code toString}).
 */
public class UncheckedCopyException extends RuntimeException {

    public UncheckedCopyException(CopyException cause) {
        super(cause.getMessage(), cause);
    }

    @Override
    public synchronized CopyException getCause() {
        return (CopyException) super.getCause();
    }
}
