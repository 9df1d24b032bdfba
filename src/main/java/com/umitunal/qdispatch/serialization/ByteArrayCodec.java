package com.umitunal.qdispatch.serialization;

/**
 * Codec for payloads the submitter already serialized. A null payload is stored as an empty array.
 */
public class ByteArrayCodec implements PayloadCodec<byte[]> {
    private static final byte[] EMPTY = new byte[0];

    @Override
    public byte[] encode(byte[] payload) {
        return payload == null ? EMPTY : payload;
    }

    @Override
    public byte[] decode(byte[] bytes) {
        return bytes == null ? EMPTY : bytes;
    }

    @Override
    public String name() {
        return "bytes";
    }
}
