package com.example.lazycopy.proxy;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.example.lazycopy.api.DeepCopyBatcher;
import com.example.lazycopy.api.LazyCopy;
import com.example.lazycopy.exception.CopyException;
import com.example.lazycopy.exception.UncheckedCopyException;
import com.example.lazycopy.model.AliasPolicy;
import com.example.lazycopy.model.Consistency;
import com.example.lazycopy.service.DeepCopyBatcherImpl;

public class LazyCopyTest {

    private static List<Integer> list(Integer... values) {
        return new ArrayList<>(Arrays.asList(values));
    }

    /** Not serializable; copying it fails. */
    static final class Opaque {
    }

    /** The proxy stays unresolved until used, then holds a deep copy */
    @Test
    public void testProxyResolvesOnFirstUse() throws Exception {
        DeepCopyBatcher batcher = new DeepCopyBatcherImpl();
        Map<String, Object> original = new HashMap<>();
        original.put("a", list(1, 2));
        original.put("b", 3);

        LazyCopy<Map<String, Object>> proxy = batcher.deferProxy(original);
        assertFalse(proxy.isMaterialized());

        Map<String, Object> copy = proxy.get();

        assertTrue(proxy.isMaterialized());
        assertEquals(original, copy);
        assertNotSame(original, copy);
        assertNotSame(original.get("a"), copy.get("a"));
    }

    /** Touching one proxy resolves every entry of the pending batch */
    @Test
    public void testAccessFlushesWholeBatch() throws Exception {
        DeepCopyBatcher batcher = new DeepCopyBatcherImpl();
        LazyCopy<List<Integer>> p1 = batcher.deferProxy(list(1));
        LazyCopy<List<Integer>> p2 = batcher.deferProxy(list(2));
        LazyCopy<List<Integer>> p3 = batcher.deferProxy(list(3), null, AliasPolicy.DUPLICATE);

        p2.get();

        assertTrue(p1.isMaterialized());
        assertTrue(p3.isMaterialized());
        assertEquals(0, batcher.pendingCount());
        assertEquals(1, batcher.stats().getFlushes());
    }

    /** describe() and isMaterialized() never force resolution */
    @Test
    public void testInspectionDoesNotResolve() throws Exception {
        DeepCopyBatcher batcher = new DeepCopyBatcherImpl();
        LazyCopy<List<Integer>> proxy = batcher.deferProxy(list(4, 5));

        assertEquals("<LazyCopy unresolved>", proxy.describe());
        assertFalse(proxy.isMaterialized());
        assertEquals(1, batcher.pendingCount());

        proxy.get();
        assertEquals("[4, 5]", proxy.describe());
    }

    /** toString() is a string conversion of the value and forces resolution */
    @Test
    public void testToStringResolves() throws Exception {
        DeepCopyBatcher batcher = new DeepCopyBatcherImpl();
        LazyCopy<List<Integer>> proxy = batcher.deferProxy(list(6));

        assertEquals("[6]", proxy.toString());
        assertTrue(proxy.isMaterialized());
    }

    /** Strict proxies are materialized from the start */
    @Test
    public void testStrictProxy() throws Exception {
        DeepCopyBatcher batcher = new DeepCopyBatcherImpl();
        List<Integer> original = list(1);
        LazyCopy<List<Integer>> proxy = batcher.deferProxy(original, Consistency.STRICT, null);

        assertTrue(proxy.isMaterialized());
        original.add(2);
        assertEquals(list(1), proxy.get());
    }

    /** Two views of one handle read the same copy */
    @Test
    public void testProxiesShareHandle() throws Exception {
        DeepCopyBatcher batcher = new DeepCopyBatcherImpl();
        LazyCopy<List<Integer>> first = batcher.deferProxy(list(1, 2));
        LazyCopy<List<Integer>> second = batcher.proxy(first.handle());

        assertSame(first.handle(), second.handle());
        assertSame(first.get(), second.get());
    }

    /** List view: indexed read/write, size, iteration, emptiness, all against the copy */
    @Test
    public void testLazyListOperations() throws Exception {
        DeepCopyBatcher batcher = new DeepCopyBatcherImpl();
        List<Integer> original = list(1, 2, 3);
        LazyList<Integer> view = batcher.deferList(original, null, null);
        assertFalse(view.isMaterialized());

        assertEquals(3, view.size());
        assertTrue(view.isMaterialized());
        assertEquals(Integer.valueOf(2), view.get(1));

        view.set(0, 10);
        assertEquals(Integer.valueOf(10), view.get(0));
        assertEquals(Integer.valueOf(1), original.get(0));

        int sum = 0;
        for (Iterator<Integer> it = view.iterator(); it.hasNext(); ) {
            sum += it.next();
        }
        assertEquals(15, sum);
        assertFalse(view.isEmpty());
        assertEquals(list(10, 2, 3), view);
        assertEquals("[10, 2, 3]", view.toString());
    }

    /** Map view: keyed read/write and size against the copy */
    @Test
    public void testLazyMapOperations() throws Exception {
        DeepCopyBatcher batcher = new DeepCopyBatcherImpl();
        Map<String, List<Integer>> original = new HashMap<>();
        original.put("k", list(1));
        LazyMap<String, List<Integer>> view = batcher.deferMap(original, null, null);
        assertFalse(view.isMaterialized());

        assertEquals(list(1), view.get("k"));
        assertTrue(view.isMaterialized());
        assertNotSame(original.get("k"), view.get("k"));

        view.put("n", list(2));
        assertEquals(2, view.size());
        assertEquals(1, original.size());
        assertTrue(view.containsKey("n"));
    }

    /** Two list views of one root under PRESERVE wrap the same copy */
    @Test
    public void testLazyListsSharePreservedCopy() throws Exception {
        DeepCopyBatcher batcher = new DeepCopyBatcherImpl();
        List<Integer> original = list(1);
        LazyList<Integer> a = batcher.deferList(original, null, AliasPolicy.PRESERVE);
        LazyList<Integer> b = batcher.deferList(original, null, AliasPolicy.PRESERVE);

        a.add(2);

        assertEquals(list(1, 2), b);
        assertSame(a.get(), b.get());
        assertEquals(list(1), original);
    }

    /** A failed copy reaches collection-view callers unchecked */
    @Test
    public void testViewFailureIsUnchecked() throws Exception {
        DeepCopyBatcher batcher = new DeepCopyBatcherImpl();
        List<Object> poisoned = new ArrayList<>();
        poisoned.add(new Opaque());
        LazyList<Object> view = batcher.deferList(poisoned, null, null);

        try {
            view.size();
            fail("expected UncheckedCopyException");
        } catch (UncheckedCopyException e) {
            assertTrue(e.getCause() instanceof CopyException);
        }
        assertEquals("<LazyCopy failed>", view.describe());

        try {
            view.get();
            fail("expected CopyException");
        } catch (CopyException expected) {
        }
    }
}
