package com.example.lazycopy.model;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

import com.example.lazycopy.copy.SizeEstimator;

/**
 * Immutable batcher configuration.
 * Built once and handed to the batcher at construction; validation happens there.
 */
public final class BatcherOptions {

    public static final int DEFAULT_MAX_ITEMS = 64;

    private static final BatcherOptions DEFAULTS = builder().build();

    private final int maxItems;
    private final Long maxBytes;
    private final Consistency consistency;
    private final AliasPolicy alias;
    private final SizeEstimator sizeEstimator;

    private BatcherOptions(Builder builder) {
        this.maxItems = builder.maxItems;
        this.maxBytes = builder.maxBytes;
        this.consistency = builder.consistency;
        this.alias = builder.alias;
        this.sizeEstimator = builder.sizeEstimator;
    }

    public static BatcherOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return queue length at which {@code defer} flushes before returning */
    public int getMaxItems() {
        return maxItems;
    }

    /** @return soft cap on the estimated size of queued roots; only enforced with a size estimator */
    public OptionalLong getMaxBytes() {
        return maxBytes == null ? OptionalLong.empty() : OptionalLong.of(maxBytes);
    }

    public Consistency getConsistency() {
        return consistency;
    }

    public AliasPolicy getAlias() {
        return alias;
    }

    public Optional<SizeEstimator> getSizeEstimator() {
        return Optional.ofNullable(sizeEstimator);
    }

    @Override
    public String toString() {
        return "BatcherOptions{" +
                "maxItems=" + maxItems +
                ", maxBytes=" + maxBytes +
                ", consistency=" + consistency +
                ", alias=" + alias +
                ", sizeEstimator=" + sizeEstimator +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BatcherOptions)) return false;
        BatcherOptions that = (BatcherOptions) o;
        return maxItems == that.maxItems &&
               Objects.equals(maxBytes, that.maxBytes) &&
               consistency == that.consistency &&
               alias == that.alias &&
               Objects.equals(sizeEstimator, that.sizeEstimator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxItems, maxBytes, consistency, alias, sizeEstimator);
    }

    /**
     * Mutable builder. Values are not checked here; an invalid record is rejected
     * by the batcher constructor.
     */
    public static final class Builder {
        private int maxItems = DEFAULT_MAX_ITEMS;
        private Long maxBytes;
        private Consistency consistency = Consistency.AT_ACCESS;
        private AliasPolicy alias = AliasPolicy.PRESERVE;
        private SizeEstimator sizeEstimator;

        private Builder() {
        }

        public Builder maxItems(int maxItems) {
            this.maxItems = maxItems;
            return this;
        }

        public Builder maxBytes(long maxBytes) {
            this.maxBytes = maxBytes;
            return this;
        }

        public Builder consistency(Consistency consistency) {
            this.consistency = consistency;
            return this;
        }

        public Builder alias(AliasPolicy alias) {
            this.alias = alias;
            return this;
        }

        public Builder sizeEstimator(SizeEstimator sizeEstimator) {
            this.sizeEstimator = sizeEstimator;
            return this;
        }

        public BatcherOptions build() {
            return new BatcherOptions(this);
        }
    }
}
