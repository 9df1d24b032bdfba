package com.umitunal.qdispatch.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class EngineConfigTest {

    @Test
    @DisplayName("Should derive the liveness window from the heartbeat interval")
    void testDefaultLivenessWindow() {
        EngineConfig config = EngineConfig.newBuilder()
                .withLeaseDuration(9_000)
                .withHeartbeatInterval(2_000)
                .withReaperInterval(1_000)
                .build();

        assertThat(config.getLivenessWindow()).isEqualTo(6_000);
    }

    @Test
    @DisplayName("Should ship defaults that satisfy the lease safety margin")
    void testDefaults() {
        EngineConfig config = EngineConfig.defaults();

        assertThat(config.getHeartbeatInterval() * EngineConfig.LEASE_SAFETY_FACTOR)
                .isLessThanOrEqualTo(config.getLeaseDuration());
        assertThat(config.getReaperInterval() * EngineConfig.LEASE_SAFETY_FACTOR)
                .isLessThanOrEqualTo(config.getLeaseDuration());
        assertThat(config.getDefaultMaxAttempts()).isEqualTo(3);
        assertThat(config.toString()).contains("lease=30000ms");
    }

    @Test
    @DisplayName("Should reject heartbeats too slow for the lease")
    void testHeartbeatTooSlow() {
        assertThatThrownBy(() -> EngineConfig.newBuilder()
                .withLeaseDuration(10_000)
                .withHeartbeatInterval(4_000)
                .withReaperInterval(1_000)
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("heartbeatInterval");
    }

    @Test
    @DisplayName("Should reject a reaper too slow for the lease")
    void testReaperTooSlow() {
        assertThatThrownBy(() -> EngineConfig.newBuilder()
                .withLeaseDuration(10_000)
                .withHeartbeatInterval(1_000)
                .withReaperInterval(5_000)
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("reaperInterval");
    }

    @Test
    @DisplayName("Should reject a liveness window not longer than one heartbeat")
    void testLivenessWindowTooShort() {
        assertThatThrownBy(() -> EngineConfig.newBuilder()
                .withHeartbeatInterval(1_000)
                .withLivenessWindow(1_000)
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("livenessWindow");
    }

    @Test
    @DisplayName("Should reject out of range values")
    void testRanges() {
        assertThatThrownBy(() -> EngineConfig.newBuilder().withDefaultMaxAttempts(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineConfig.newBuilder().withWorkerCount(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineConfig.newBuilder().withBackoff(5_000, 1_000, 0.1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineConfig.newBuilder().withBackoff(100, 1_000, 1.0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineConfig.newBuilder().withCancellationGrace(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StorageConfig.newBuilder(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StorageConfig.newBuilder("data").withWriteBufferSize(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
