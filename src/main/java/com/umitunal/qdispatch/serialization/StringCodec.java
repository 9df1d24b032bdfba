package com.umitunal.qdispatch.serialization;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Text payloads. UTF-8 unless another charset is given.
 */
public class StringCodec implements PayloadCodec<String> {
    private final Charset charset;

    public StringCodec() {
        this(StandardCharsets.UTF_8);
    }

    public StringCodec(Charset charset) {
        this.charset = Objects.requireNonNull(charset, "charset");
    }

    @Override
    public byte[] encode(String payload) {
        return payload == null ? new byte[0] : payload.getBytes(charset);
    }

    @Override
    public String decode(byte[] bytes) {
        return new String(bytes, charset);
    }

    @Override
    public String name() {
        return "string:" + charset.name();
    }
}
