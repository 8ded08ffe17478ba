package com.example.lazycopy.model;

/**
 * When the snapshot of a source object is taken.
 */
public enum Consistency {

    /** Copy at flush time; later mutations of the source before the flush are visible. */
    AT_ACCESS,

    /** Copy immediately at defer time; the request never joins a batch. */
    STRICT
}
