package com.sbus.util;

import com.sbus.testing.ManualEventLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class ConcurrentExpiringMapTest {

    private ManualEventLoop loop;
    private ConcurrentExpiringMap<String, String> map;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        map = new ConcurrentExpiringMap<>(loop, Duration.ofMinutes(1));
    }

    @Test
    @DisplayName("Entries are readable until their TTL elapses")
    void testGetBeforeExpiry() {
        map.set("a", "1", Duration.ofSeconds(30));

        loop.advanceBy(Duration.ofSeconds(29));

        assertThat(map.get("a")).isEqualTo("1");
        assertThat(map.has("a")).isTrue();
    }

    @Test
    @DisplayName("Expired entries read as absent before any sweep")
    void testExpiredEntryIsAbsent() {
        map.set("a", "1", Duration.ofSeconds(30));

        loop.advanceBy(Duration.ofSeconds(30));

        assertThat(map.get("a")).isNull();
        assertThat(map.has("a")).isFalse();
    }

    @Test
    void testSetOverwritesValueAndExpiry() {
        map.set("a", "1", Duration.ofSeconds(10));
        loop.advanceBy(Duration.ofSeconds(5));
        map.set("a", "2", Duration.ofSeconds(10));

        loop.advanceBy(Duration.ofSeconds(8));

        assertThat(map.get("a")).isEqualTo("2");
    }

    @Test
    @DisplayName("Periodic sweep removes expired entries")
    void testPeriodicSweep() {
        map.set("short", "1", Duration.ofSeconds(10));
        map.set("long", "2", Duration.ofMinutes(10));
        assertThat(map.size()).isEqualTo(2);

        loop.advanceBy(Duration.ofMinutes(1));

        assertThat(map.size()).isEqualTo(1);
        assertThat(map.get("long")).isEqualTo("2");

        // The sweep keeps rescheduling itself
        loop.advanceBy(Duration.ofMinutes(10));
        assertThat(map.size()).isZero();
    }

    @Test
    void testSweepReturnsRemovedCount() {
        map.set("a", "1", Duration.ofSeconds(1));
        map.set("b", "2", Duration.ofSeconds(1));
        map.set("c", "3", Duration.ofHours(1));
        loop.advanceBy(Duration.ofSeconds(2));

        assertThat(map.sweep()).isEqualTo(2);
    }

    @Test
    void testRemoveAndClear() {
        map.set("a", "1", Duration.ofMinutes(1));
        map.set("b", "2", Duration.ofMinutes(1));

        assertThat(map.remove("a")).isTrue();
        assertThat(map.remove("a")).isFalse();

        map.clear();
        assertThat(map.size()).isZero();
    }

    @Test
    @DisplayName("Close stops the sweep")
    void testCloseCancelsSweep() {
        map.set("a", "1", Duration.ofMinutes(1));

        map.close();

        assertThat(map.size()).isZero();
        assertThat(loop.pendingTimerCount()).isZero();
    }

    @Test
    void testRejectsNonPositiveSweepInterval() {
        assertThatThrownBy(() -> new ConcurrentExpiringMap<String, String>(loop, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
