package com.example.lazycopy.copy;

import java.util.ArrayList;
import java.util.List;

import org.objenesis.strategy.StdInstantiatorStrategy;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.util.DefaultInstantiatorStrategy;
import com.esotericsoftware.kryo.util.Pool;
import com.example.lazycopy.exception.CopyException;

/**
 * {@link DeepCopier} backed by Kryo's in-memory {@link Kryo#copy(Object)}.
 * <p>
 * Kryo keeps an identity map from original to copy for the duration of one
 * {@code copy} call and registers each copy before descending into its fields,
 * so copying the root list as a whole preserves aliasing and terminates on cycles.
 * Kryo instances are not thread-safe; each call borrows one from a pool.
 */
public class KryoCopier implements DeepCopier {

    private static final int POOL_CAPACITY = 16;

    private final Pool<Kryo> pool = new Pool<Kryo>(true, false, POOL_CAPACITY) {
        @Override
        protected Kryo create() {
            return newKryo();
        }
    };

    /**
     * Configures a fresh {@link Kryo}. Unregistered classes are allowed, and classes
     * without a no-arg constructor are instantiated through objenesis.
     */
    protected Kryo newKryo() {
        Kryo kryo = new Kryo();
        kryo.setRegistrationRequired(false);
        kryo.setReferences(true);
        kryo.setCopyReferences(true);
        kryo.setInstantiatorStrategy(new DefaultInstantiatorStrategy(new StdInstantiatorStrategy()));
        return kryo;
    }

    @Override
    public List<Object> copyMany(List<?> roots) throws CopyException {
        final ArrayList<Object> batch = new ArrayList<>(roots);
        final Kryo kryo = pool.obtain();
        try {
            return kryo.copy(batch);
        } catch (KryoException | IllegalArgumentException ex) {
            throw new CopyException("Cannot copy: " + ex.getMessage(), ex);
        } finally {
            pool.free(kryo);
        }
    }

    @Override
    public String toString() {
        return "KryoCopier";
    }
}
