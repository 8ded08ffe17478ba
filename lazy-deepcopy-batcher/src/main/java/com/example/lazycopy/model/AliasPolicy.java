package com.example.lazycopy.model;

/**
 * Whether repeated references to the same source object within one batch share a copy.
 */
public enum AliasPolicy {

    /** Entries whose roots are the same instance resolve to one shared copy. */
    PRESERVE,

    /** Every entry gets its own copy, even when roots are the same instance. */
    DUPLICATE
}
