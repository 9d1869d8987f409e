package com.simfolio.backend.service.marketdata;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SectorCacheTest {

    @Test
    void loadsOncePerSymbol() {
        SectorCache cache = SectorCache.unbounded();
        AtomicInteger loads = new AtomicInteger();

        String first = cache.getOrLoad("aapl", symbol -> {
            loads.incrementAndGet();
            return "Technology";
        });
        String second = cache.getOrLoad("AAPL ", symbol -> {
            loads.incrementAndGet();
            return "Other";
        });

        assertThat(first).isEqualTo("Technology");
        assertThat(second).isEqualTo("Technology");
        assertThat(loads).hasValue(1);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void evictedEntryIsReloaded() {
        SectorCache cache = SectorCache.unbounded();
        cache.getOrLoad("XOM", symbol -> "Energy");

        cache.evict("XOM");

        assertThat(cache.get("XOM")).isEmpty();
        assertThat(cache.getOrLoad("XOM", symbol -> "Oil & Gas")).isEqualTo("Oil & Gas");
    }

    @Test
    void entriesExpireAfterTtl() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        SectorCache cache = new SectorCache(Duration.ofMinutes(10), clock);
        cache.getOrLoad("MSFT", symbol -> "Technology");

        clock.advance(Duration.ofMinutes(5));
        assertThat(cache.get("MSFT")).contains("Technology");

        clock.advance(Duration.ofMinutes(6));
        assertThat(cache.get("MSFT")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
