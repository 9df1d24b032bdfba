package com.umitunal.qdispatch.model;

import com.umitunal.qdispatch.core.JobState;
import com.umitunal.qdispatch.serialization.JsonCodec;
import com.umitunal.qdispatch.serialization.KryoCodec;
import com.umitunal.qdispatch.serialization.StringCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class WorkUnitSerializerTest {

    private static final long NOW = 1_700_000_000_000L;

    @Test
    @DisplayName("Should preserve lease and attempt bookkeeping of an active job")
    void testActiveJobMetadata() {
        // Given
        WorkUnitSerializer<String> serializer = new WorkUnitSerializer<>(new StringCodec());
        WorkUnit<String> original = new WorkUnit<>("job-1", "Task payload", 5, 2000, NOW, NOW);
        original.lease("worker-1", 30000, NOW + 10);

        // When
        WorkUnit<String> deserialized = serializer.deserialize(serializer.serialize(original));

        // Then
        assertThat(deserialized.getId()).isEqualTo("job-1");
        assertThat(deserialized.getPayload()).isEqualTo("Task payload");
        assertThat(deserialized.getState()).isEqualTo(JobState.ACTIVE);
        assertThat(deserialized.getMaxAttempts()).isEqualTo(5);
        assertThat(deserialized.getTimeoutMillis()).isEqualTo(2000);
        assertThat(deserialized.getLeaseOwner()).isEqualTo("worker-1");
        assertThat(deserialized.getLeaseStartedAt()).isEqualTo(NOW + 10);
        assertThat(deserialized.getLeaseExpiresAt()).isEqualTo(NOW + 30010);
        assertThat(deserialized.getCurrentAttempt()).isEqualTo(1);
        assertThat(deserialized.getVersion()).isEqualTo(original.getVersion());
        assertThat(deserialized.getLease()).isNotNull();
    }

    @Test
    @DisplayName("Should preserve failure details and reclaim count")
    void testFailedJobMetadata() {
        // Given
        WorkUnitSerializer<String> serializer = new WorkUnitSerializer<>(new StringCodec());
        WorkUnit<String> original = new WorkUnit<>("job-2", "Complex task", 2, 0, NOW, NOW);
        original.lease("worker-1", 1000, NOW);
        original.reclaim("lease expired", NOW + 2000);
        original.markWaiting(NOW + 2000);
        original.lease("worker-2", 1000, NOW + 2500);
        original.failAttempt("Connection timeout", NOW + 2600);
        original.markFailed(NOW + 2600);

        // When
        WorkUnit<String> deserialized = serializer.deserialize(serializer.serialize(original));

        // Then
        assertThat(deserialized.getState()).isEqualTo(JobState.FAILED);
        assertThat(deserialized.getAttempts()).isEqualTo(2);
        assertThat(deserialized.getReclaimCount()).isEqualTo(1);
        assertThat(deserialized.getLastError()).isEqualTo("Connection timeout");
        assertThat(deserialized.getFinishedAt()).isEqualTo(NOW + 2600);
        assertThat(deserialized.getLeaseOwner()).isNull();
        assertThat(deserialized.getLease()).isNull();
        assertThat(deserialized.canRetry()).isFalse();
    }

    @Test
    @DisplayName("Should keep a delayed job delayed")
    void testDelayedJob() {
        // Given
        WorkUnitSerializer<String> serializer = new WorkUnitSerializer<>(new StringCodec());
        WorkUnit<String> original = new WorkUnit<>("job-3", "later", 3, 0, NOW, NOW + 60000);

        // When
        WorkUnit<String> deserialized = serializer.deserialize(serializer.serialize(original));

        // Then
        assertThat(deserialized.getState()).isEqualTo(JobState.DELAYED);
        assertThat(deserialized.getEligibleAt()).isEqualTo(NOW + 60000);
        assertThat(deserialized.isClaimable(NOW)).isFalse();
        assertThat(deserialized.isClaimable(NOW + 60000)).isTrue();
    }

    @Test
    @DisplayName("Should work with Kryo and JSON payload codecs")
    void testOtherCodecs() {
        // Given
        WorkUnitSerializer<Order> kryo = new WorkUnitSerializer<>(new KryoCodec<>(Order.class));
        WorkUnitSerializer<Order> json = new WorkUnitSerializer<>(new JsonCodec<>(Order.class));
        WorkUnit<Order> original = new WorkUnit<>("order-1", new Order("ORD-7", 3), 3, 0, NOW, NOW);

        // When
        Order viaKryo = kryo.deserialize(kryo.serialize(original)).getPayload();
        Order viaJson = json.deserialize(json.serialize(original)).getPayload();

        // Then
        assertThat(viaKryo.orderId).isEqualTo("ORD-7");
        assertThat(viaKryo.quantity).isEqualTo(3);
        assertThat(viaJson.orderId).isEqualTo("ORD-7");
        assertThat(viaJson.quantity).isEqualTo(3);
    }

    @Test
    @DisplayName("Should reject truncated and unknown-format records")
    void testCorruptInput() {
        // Given
        WorkUnitSerializer<String> serializer = new WorkUnitSerializer<>(new StringCodec());
        byte[] valid = serializer.serialize(new WorkUnit<>("job-4", "payload", 3, 0, NOW, NOW));
        byte[] truncated = Arrays.copyOf(valid, valid.length / 2);
        byte[] unknownFormat = valid.clone();
        unknownFormat[0] = 99;

        // When / Then
        assertThatThrownBy(() -> serializer.deserialize(truncated))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Corrupt work unit");
        assertThatThrownBy(() -> serializer.deserialize(unknownFormat))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Unsupported work unit format");
    }

    @Test
    @DisplayName("Should reject settling a job that is not running")
    void testIllegalTransitions() {
        // Given
        WorkUnit<String> unit = new WorkUnit<>("job-5", "payload", 3, 0, NOW, NOW);

        // When / Then
        assertThatThrownBy(() -> unit.complete(NOW)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> unit.promote(NOW)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new WorkUnit<>("job-6", "payload", 0, 0, NOW, NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    public static class Order {
        public String orderId;
        public int quantity;

        public Order() {
        }

        Order(String orderId, int quantity) {
            this.orderId = orderId;
            this.quantity = quantity;
        }
    }
}
