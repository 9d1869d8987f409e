package com.simfolio.backend.service.marketdata;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Symbol to sector memo. Entries are only a shortcut around the market-data provider, so
 * evicting any of them at any time is safe. A {@code null} ttl keeps entries until evicted.
 */
public class SectorCache {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public SectorCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    static SectorCache unbounded() {
        return new SectorCache(null, Clock.systemUTC());
    }

    public Optional<String> get(String symbol) {
        String key = key(symbol);
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry)) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.sector());
    }

    public String getOrLoad(String symbol, Function<String, String> loader) {
        return get(symbol).orElseGet(() -> {
            String key = key(symbol);
            String sector = loader.apply(key);
            entries.put(key, new Entry(sector, clock.instant()));
            return sector;
        });
    }

    void evict(String symbol) {
        entries.remove(key(symbol));
    }

    public void clear() {
        entries.clear();
    }

    int size() {
        return entries.size();
    }

    private boolean isExpired(Entry entry) {
        return ttl != null && entry.loadedAt().plus(ttl).isBefore(clock.instant());
    }

    private static String key(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
    }

    private record Entry(String sector, Instant loadedAt) {}
}
