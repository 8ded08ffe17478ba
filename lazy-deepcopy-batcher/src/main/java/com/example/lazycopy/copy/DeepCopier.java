package com.example.lazycopy.copy;

import java.util.Collections;
import java.util.List;

import com.example.lazycopy.exception.CopyException;

/**
 * Deep-copy primitive invoked by the batcher, once per flush for the aliased entries.
 *
 * Implementations must:
 * - return a list of the same length and order as {@code roots};
 * - map referentially identical roots to referentially identical copies;
 * - terminate on cyclic graphs, producing an isomorphic cyclic copy;
 * - fail the whole call if any object cannot be copied (no partial results).
 * <p>
 * Precondition: implementations must be thread-safe. Strict copies call
 * {@link #copyOne(Object)} outside the batcher lock, possibly concurrently with a
 * flush or with other strict copies, on overlapping or identical roots.
 */
public interface DeepCopier {

    /**
     * Copies every root in one traversal.
     *
     * @param roots the roots to copy; may contain nulls and repeated instances
     * @return the copies, index-aligned with {@code roots}
     * @throws CopyException if some reachable object cannot be copied
     */
    List<Object> copyMany(List<?> roots) throws CopyException;

    /**
     * Copies a single root. Equivalent to {@code copyMany([root]).get(0)}.
     */
    default Object copyOne(Object root) throws CopyException {
        return copyMany(Collections.singletonList(root)).get(0);
    }
}
