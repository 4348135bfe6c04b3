package com.z254.argus.snooze;

import com.z254.argus.domain.model.SnoozeAuditEntry;
import com.z254.argus.domain.model.SnoozeRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Process-local snooze store for single-instance deployments and tests.
 * Expiry is evaluated against the supplied {@link Clock}; expired entries are
 * dropped on point reads, on {@link #listActive()} and on audit purges.
 */
public class InMemorySnoozeStore implements SnoozeStore {

    private final Clock clock;
    private final Map<String, Expiring<SnoozeRecord>> records = new ConcurrentHashMap<>();
    private final Map<String, Expiring<String>> hashes = new ConcurrentHashMap<>();
    private final Map<String, List<SnoozeAuditEntry>> audits = new ConcurrentHashMap<>();

    public InMemorySnoozeStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<Boolean> putIfAbsent(SnoozeRecord record, Duration ttl) {
        return Mono.fromSupplier(() -> {
            Instant now = clock.instant();
            AtomicBoolean stored = new AtomicBoolean(false);
            records.compute(record.getAlertId(), (id, existing) -> {
                if (existing != null && existing.isLive(now)) {
                    return existing;
                }
                stored.set(true);
                return new Expiring<>(record, now.plus(ttl));
            });
            return stored.get();
        });
    }

    @Override
    public Mono<Void> put(SnoozeRecord record, Duration ttl) {
        return Mono.fromRunnable(() ->
                records.put(record.getAlertId(), new Expiring<>(record, clock.instant().plus(ttl))));
    }

    @Override
    public Mono<SnoozeRecord> get(String alertId) {
        return Mono.fromSupplier(() -> live(records, alertId));
    }

    @Override
    public Mono<Duration> remainingTtl(String alertId) {
        return Mono.defer(() -> {
            Expiring<SnoozeRecord> entry = records.get(alertId);
            Instant now = clock.instant();
            if (entry == null || !entry.isLive(now)) {
                return Mono.empty();
            }
            return Mono.just(Duration.between(now, entry.expiresAt()));
        });
    }

    @Override
    public Mono<Boolean> delete(String alertId) {
        return Mono.fromSupplier(() -> {
            Expiring<SnoozeRecord> removed = records.remove(alertId);
            hashes.remove(alertId);
            return removed != null && removed.isLive(clock.instant());
        });
    }

    @Override
    public Mono<Void> putContentHash(String alertId, String hash, Duration ttl) {
        return Mono.fromRunnable(() -> hashes.put(alertId, new Expiring<>(hash, clock.instant().plus(ttl))));
    }

    @Override
    public Mono<String> getContentHash(String alertId) {
        return Mono.fromSupplier(() -> live(hashes, alertId));
    }

    @Override
    public Flux<SnoozeRecord> listActive() {
        return Flux.defer(() -> {
            Instant now = clock.instant();
            purgeExpired(now);
            return Flux.fromIterable(records.values().stream()
                    .filter(e -> e.isLive(now))
                    .map(Expiring::value)
                    .sorted(Comparator.comparing(SnoozeRecord::getExpiresAt))
                    .collect(Collectors.toList()));
        });
    }

    @Override
    public Mono<Void> appendAudit(SnoozeAuditEntry entry) {
        return Mono.fromRunnable(() -> audits.compute(entry.getAlertId(), (id, entries) -> {
            List<SnoozeAuditEntry> target = entries == null ? new ArrayList<>() : entries;
            synchronized (target) {
                target.add(entry);
            }
            return target;
        }));
    }

    @Override
    public Flux<SnoozeAuditEntry> history(String alertId, int limit) {
        return Flux.defer(() -> {
            List<SnoozeAuditEntry> entries = audits.getOrDefault(alertId, List.of());
            List<SnoozeAuditEntry> copy;
            synchronized (entries) {
                copy = new ArrayList<>(entries);
            }
            copy.sort(Comparator.comparing(SnoozeAuditEntry::getTimestamp).reversed());
            return Flux.fromIterable(copy).take(limit);
        });
    }

    @Override
    public Mono<Long> purgeAuditBefore(Instant cutoff) {
        return Mono.fromSupplier(() -> {
            purgeExpired(clock.instant());
            AtomicLong removed = new AtomicLong();
            for (String alertId : audits.keySet()) {
                audits.computeIfPresent(alertId, (id, entries) -> {
                    synchronized (entries) {
                        int before = entries.size();
                        entries.removeIf(e -> e.getTimestamp().isBefore(cutoff));
                        removed.addAndGet(before - entries.size());
                        return entries.isEmpty() ? null : entries;
                    }
                });
            }
            return removed.get();
        });
    }

    @Override
    public Mono<Boolean> isAvailable() {
        return Mono.just(true);
    }

    /**
     * Number of records, content hashes and audit lists held, live or not.
     */
    int heldEntries() {
        return records.size() + hashes.size() + audits.size();
    }

    private void purgeExpired(Instant now) {
        records.values().removeIf(entry -> !entry.isLive(now));
        hashes.values().removeIf(entry -> !entry.isLive(now));
    }

    private <T> T live(Map<String, Expiring<T>> map, String alertId) {
        Expiring<T> entry = map.get(alertId);
        if (entry == null) {
            return null;
        }
        if (!entry.isLive(clock.instant())) {
            map.remove(alertId, entry);
            return null;
        }
        return entry.value();
    }

    private record Expiring<T>(T value, Instant expiresAt) {
        boolean isLive(Instant now) {
            return now.isBefore(expiresAt);
        }
    }
}
