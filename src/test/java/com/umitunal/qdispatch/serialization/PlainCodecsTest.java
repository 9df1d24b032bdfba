package com.umitunal.qdispatch.serialization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class PlainCodecsTest {

    @Test
    @DisplayName("Should store null text payloads as empty strings")
    void testStringNull() {
        StringCodec codec = new StringCodec();

        byte[] encoded = codec.encode(null);

        assertThat(encoded).isEmpty();
        assertThat(codec.decode(encoded)).isEmpty();
    }

    @Test
    @DisplayName("Should honor the configured charset")
    void testStringCharset() {
        StringCodec latin = new StringCodec(StandardCharsets.ISO_8859_1);

        byte[] encoded = latin.encode("café");

        assertThat(encoded).hasSize(4);
        assertThat(latin.decode(encoded)).isEqualTo("café");
        assertThat(new StringCodec().encode("café")).hasSize(5);
        assertThat(latin.name()).isNotEqualTo(new StringCodec().name());
    }

    @Test
    @DisplayName("Should pass raw bytes through untouched")
    void testByteArray() {
        ByteArrayCodec codec = new ByteArrayCodec();
        byte[] raw = {1, 2, 3};

        assertThat(codec.decode(codec.encode(raw))).containsExactly(1, 2, 3);
        assertThat(codec.encode(null)).isEmpty();
        assertThat(codec.name()).isEqualTo("bytes");
    }

    @Test
    @DisplayName("Should name codecs after their format and payload type")
    void testNames() {
        assertThat(new JsonCodec<>(String.class).name()).isEqualTo("json:java.lang.String");
        assertThat(new KryoCodec<>(Integer.class).name()).isEqualTo("kryo:java.lang.Integer");
        assertThat(new StringCodec().name()).isEqualTo("string:UTF-8");
    }
}
