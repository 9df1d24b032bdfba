package com.umitunal.qdispatch.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

import java.util.function.Supplier;

/**
 * Compact binary payloads through Kryo. Workers, the HTTP pool and maintenance timers all touch the
 * store, and Kryo instances are not thread-safe, so each thread keeps its own.
 *
 * @param <T> the payload type
 */
public class KryoCodec<T> implements PayloadCodec<T> {
    private static final int INITIAL_BUFFER = 256;

    private final ThreadLocal<Kryo> kryoThreadLocal;
    private final Class<T> type;

    public KryoCodec(Class<T> type) {
        this(type, KryoCodec::defaultKryo);
    }

    /**
     * Create a Kryo codec with custom Kryo instance configuration, e.g. with registered classes.
     */
    public KryoCodec(Class<T> type, Supplier<Kryo> factory) {
        this.type = type;
        this.kryoThreadLocal = ThreadLocal.withInitial(factory);
    }

    @Override
    public byte[] encode(T payload) {
        try (Output output = new Output(INITIAL_BUFFER, -1)) {
            kryoThreadLocal.get().writeObject(output, payload);
            return output.toBytes();
        } catch (KryoException e) {
            throw new IllegalStateException("Cannot write " + type.getSimpleName() + " payload with Kryo", e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        try (Input input = new Input(bytes)) {
            return kryoThreadLocal.get().readObject(input, type);
        } catch (KryoException e) {
            throw new IllegalStateException("Cannot read " + type.getSimpleName() + " payload with Kryo", e);
        }
    }

    @Override
    public String name() {
        return "kryo:" + type.getName();
    }

    /**
     * Registration off so arbitrary payload classes work without setup; references on for cyclic graphs.
     */
    public static Kryo defaultKryo() {
        Kryo kryo = new Kryo();
        kryo.setRegistrationRequired(false);
        kryo.setReferences(true);
        return kryo;
    }
}
