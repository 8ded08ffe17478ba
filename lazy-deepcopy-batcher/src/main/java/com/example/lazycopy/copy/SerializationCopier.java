package com.example.lazycopy.copy;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.ArrayList;
import java.util.List;

import com.example.lazycopy.exception.CopyException;

/**
 * {@link DeepCopier} using Java default serialization.
 * <p>
 * All roots go through a single object stream, so the stream's handle table keeps
 * shared and cyclic references among them intact in the copies. Every reachable
 * object must be {@link java.io.Serializable}.
 * <p>
 * Stateless, hence thread-safe.
 */
public class SerializationCopier implements DeepCopier {

    @Override
    public List<Object> copyMany(List<?> roots) throws CopyException {

        // ArrayList is serializable whatever list implementation the caller passed.
        final ArrayList<Object> batch = new ArrayList<>(roots);

        final Object copy = deserialize(serialize(batch));

        return new ArrayList<>((List<?>) copy);

    }

    private static byte[] serialize(Object obj) throws CopyException {

        final ByteArrayOutputStream baos = new ByteArrayOutputStream();

        try (ObjectOutputStream oos = new ObjectOutputStream(baos)) {

            oos.writeObject(obj);

        } catch (IOException ex) {

            // NotSerializableException names the offending class.
            throw new CopyException("Cannot copy: " + ex.getMessage(), ex);

        }

        return baos.toByteArray();

    }

    private static Object deserialize(byte[] b) throws CopyException {

        final ByteArrayInputStream bais = new ByteArrayInputStream(b);

        try (ObjectInputStream ois = new ObjectInputStream(bais)) {

            return ois.readObject();

        } catch (IOException | ClassNotFoundException ex) {

            throw new CopyException("Cannot read back copy, len=" + b.length, ex);

        }

    }

    @Override
    public String toString() {
        return "SerializationCopier";
    }
}
