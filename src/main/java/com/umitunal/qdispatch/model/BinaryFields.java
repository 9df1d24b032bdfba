package com.umitunal.qdispatch.model;

import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Length-prefixed string helpers shared by the record serializers.
 */
final class BinaryFields {
    private static final int NULL_LENGTH = -1;

    private BinaryFields() {
    }

    static byte[] bytesOrNull(String value) {
        return value != null ? value.getBytes(UTF_8) : null;
    }

    static int sizeOf(byte[] nullable) {
        return 4 + (nullable != null ? nullable.length : 0);
    }

    static void putNullable(ByteBuffer buffer, byte[] nullable) {
        if (nullable == null) {
            buffer.putInt(NULL_LENGTH);
            return;
        }
        buffer.putInt(nullable.length);
        buffer.put(nullable);
    }

    static String getString(ByteBuffer buffer) {
        byte[] bytes = new byte[buffer.getInt()];
        buffer.get(bytes);
        return new String(bytes, UTF_8);
    }

    static String getNullableString(ByteBuffer buffer) {
        int length = buffer.getInt();
        if (length == NULL_LENGTH) {
            return null;
        }
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return new String(bytes, UTF_8);
    }
}
