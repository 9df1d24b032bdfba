package com.umitunal.qdispatch.serialization;

/**
 * Converts job payloads to and from the opaque bytes the store keeps.
 * Implementations throw {@link IllegalStateException} on malformed input.
 *
 * @param <T> the type of payload
 */
public interface PayloadCodec<T> {

    byte[] encode(T payload);

    T decode(byte[] bytes);

    /**
     * Identifies the stored byte format. A job store remembers the name it was created with and
     * refuses to open with a codec of another name, since it could not decode the jobs it holds.
     */
    String name();
}
