package com.handoff.backend.util;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Concurrent map whose entries expire a fixed time after they were written.
 * <p>
 * Expired entries are invisible to reads immediately and are physically removed by a periodic sweep.
 * The sweep walks a snapshot and removes an entry only if it is still the exact entry it observed,
 * so a value written while the sweep runs is never dropped. Pass a zero sweep interval to disable
 * the background sweeper and call {@link #evictExpired()} yourself.
 */
@Slf4j
public class ExpiringMap<K, V> implements AutoCloseable {

    private final String name;
    private final Duration ttl;
    private final Clock clock;
    private final Map<K, Entry<V>> entries = new ConcurrentHashMap<>();
    private final ScheduledExecutorService sweeper;

    public ExpiringMap(String name, Duration ttl, Clock clock, Duration sweepInterval) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.name = name;
        this.ttl = ttl;
        this.clock = clock;
        if (sweepInterval != null && !sweepInterval.isZero() && !sweepInterval.isNegative()) {
            this.sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, name + "-sweeper");
                thread.setDaemon(true);
                return thread;
            });
            long periodMs = sweepInterval.toMillis();
            this.sweeper.scheduleAtFixedRate(this::sweepQuietly, periodMs, periodMs, TimeUnit.MILLISECONDS);
        } else {
            this.sweeper = null;
        }
    }

    public Optional<V> get(K key) {
        Entry<V> entry = entries.get(key);
        if (entry == null || isExpired(entry, clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public void put(K key, V value) {
        entries.put(key, new Entry<>(value, clock.instant()));
    }

    /**
     * Stores the value unless a live entry exists for the key.
     *
     * @return the live value already present, or empty if this call stored {@code value}
     */
    public Optional<V> putIfAbsent(K key, V value) {
        Entry<V> fresh = new Entry<>(value, clock.instant());
        while (true) {
            Entry<V> existing = entries.putIfAbsent(key, fresh);
            if (existing == null) {
                return Optional.empty();
            }
            if (!isExpired(existing, clock.instant())) {
                return Optional.of(existing.value());
            }
            if (entries.replace(key, existing, fresh)) {
                return Optional.empty();
            }
        }
    }

    /**
     * Replaces the value for the key only if it currently maps to {@code expected}. The write time is reset.
     */
    public boolean replace(K key, V expected, V value) {
        Entry<V> current = entries.get(key);
        if (current == null || !current.value().equals(expected)) {
            return false;
        }
        return entries.replace(key, current, new Entry<>(value, clock.instant()));
    }

    public boolean remove(K key, V expected) {
        Entry<V> current = entries.get(key);
        if (current == null || !current.value().equals(expected)) {
            return false;
        }
        return entries.remove(key, current);
    }

    public int evictExpired() {
        Instant now = clock.instant();
        List<Map.Entry<K, Entry<V>>> snapshot = new ArrayList<>(entries.entrySet());
        int removed = 0;
        for (Map.Entry<K, Entry<V>> candidate : snapshot) {
            if (isExpired(candidate.getValue(), now) && entries.remove(candidate.getKey(), candidate.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("{} evicted {} expired entries, {} remain", name, removed, entries.size());
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    public Duration getTtl() {
        return ttl;
    }

    @Override
    public void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
        entries.clear();
    }

    private boolean isExpired(Entry<V> entry, Instant now) {
        return Duration.between(entry.storedAt(), now).compareTo(ttl) > 0;
    }

    private void sweepQuietly() {
        try {
            evictExpired();
        } catch (RuntimeException ex) {
            log.warn("{} sweep failed: {}", name, ex.getMessage(), ex);
        }
    }

    private record Entry<V>(V value, Instant storedAt) {
    }
}
