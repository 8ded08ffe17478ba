package com.example.lazycopy.copy;

/**
 * Rough byte-size estimate of a queued root, fed into the batcher's soft byte cap.
 * Called under the batcher lock, so it should be cheap.
 */
@FunctionalInterface
public interface SizeEstimator {

    long estimate(Object root);
}
