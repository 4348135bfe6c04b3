package com.z254.argus.snooze;

import com.z254.argus.config.ArgusProperties;
import com.z254.argus.domain.model.Alert;
import com.z254.argus.domain.model.SnoozeAuditEntry;
import com.z254.argus.domain.model.SnoozeRecord;
import com.z254.argus.observability.ArgusMetrics;
import com.z254.argus.observability.ArgusStructuredLogger;
import com.z254.argus.observability.ArgusStructuredLogger.SnoozeEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Time-bounded suppression of individual alerts.
 * <p>
 * Records live in a {@link SnoozeStore} with a TTL equal to the snooze
 * duration, so expiry needs no sweep. Every transition is written to an audit
 * trail kept for {@code argus.snooze.audit-retention}.
 */
@Slf4j
@Service
public class SnoozeService {

    public static final String SYSTEM_USER = "system";
    public static final String ALERT_CHANGED_REASON = "Alert properties changed";

    private final SnoozeStore store;
    private final ArgusProperties.Snooze config;
    private final ArgusMetrics metrics;
    private final ArgusStructuredLogger structuredLogger;
    private final Clock clock;

    public SnoozeService(SnoozeStore store,
                         ArgusProperties argusProperties,
                         ArgusMetrics metrics,
                         ArgusStructuredLogger structuredLogger,
                         Clock clock) {
        this.store = store;
        this.config = argusProperties.getSnooze();
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    /**
     * Snooze an alert and remember a hash of its content for change detection.
     */
    public Mono<SnoozeRecord> snooze(Alert alert, Duration duration, String reason, String userId) {
        return snooze(alert.getId(), duration, reason, userId)
                .flatMap(record -> store.putContentHash(alert.getId(), contentHash(alert), record.getDuration())
                        .thenReturn(record));
    }

    /**
     * Snooze an alert by id. The duration is clamped to the configured bounds.
     *
     * @return the stored record, or {@link SnoozeConflictException} when the
     * alert is already snoozed
     */
    public Mono<SnoozeRecord> snooze(String alertId, Duration duration, String reason, String userId) {
        SnoozeRecord record = newRecord(alertId, clamp(duration), reason, userId);
        return store.putIfAbsent(record, record.getDuration())
                .flatMap(stored -> {
                    if (!stored) {
                        return conflict(alertId);
                    }
                    metrics.recordSnoozeCreated(record.getDuration());
                    log(alertId, SnoozeEventType.CREATED, "Alert snoozed", record);
                    return audit(record, SnoozeAuditEntry.Action.CREATED, userId, reason)
                            .thenReturn(record);
                })
                .doOnError(SnoozeStoreUnavailableException.class, e -> storeUnavailable(alertId, e));
    }

    /**
     * @return true when an active snooze was removed
     */
    public Mono<Boolean> unsnooze(String alertId, String reason, String userId) {
        return unsnooze(alertId, reason, userId, SnoozeAuditEntry.Action.UNSNOOZED);
    }

    public Mono<Boolean> isSnoozed(String alertId) {
        return store.get(alertId)
                .map(record -> true)
                .defaultIfEmpty(false);
    }

    public Mono<SnoozeRecord> getSnooze(String alertId) {
        return store.get(alertId);
    }

    public Flux<SnoozeRecord> listSnoozed() {
        return store.listActive();
    }

    /**
     * Whether the alert's name, severity, description or labels differ from
     * when it was snoozed. Never modifies the snooze.
     */
    public Mono<Boolean> checkAlertChanged(Alert alert) {
        return store.getContentHash(alert.getId())
                .map(stored -> !stored.equals(contentHash(alert)))
                .defaultIfEmpty(false);
    }

    /**
     * Unsnooze the alert when its content changed since it was snoozed.
     *
     * @return true when the alert was unsnoozed
     */
    public Mono<Boolean> autoUnsnoozeIfChanged(Alert alert) {
        return checkAlertChanged(alert)
                .flatMap(changed -> changed
                        ? unsnooze(alert.getId(), ALERT_CHANGED_REASON, SYSTEM_USER,
                                SnoozeAuditEntry.Action.AUTO_UNSNOOZED)
                        : Mono.just(false));
    }

    /**
     * Re-snooze for the remaining time plus {@code additional}, clamped to the
     * configured bounds.
     *
     * @return the replacement record, or empty when the alert is not snoozed
     */
    public Mono<SnoozeRecord> extend(String alertId, Duration additional, String userId) {
        return store.get(alertId)
                .flatMap(current -> store.remainingTtl(alertId)
                        .defaultIfEmpty(Duration.ZERO)
                        .flatMap(remaining -> {
                            Duration duration = clamp(remaining.plus(additional));
                            SnoozeRecord replacement = newRecord(alertId, duration, current.getReason(), userId);
                            String reason = "Extended by " + additional;
                            return store.put(replacement, duration)
                                    .then(store.getContentHash(alertId)
                                            .flatMap(hash -> store.putContentHash(alertId, hash, duration)))
                                    .then(audit(replacement, SnoozeAuditEntry.Action.EXTENDED, userId, reason))
                                    .then(Mono.fromRunnable(() ->
                                            log(alertId, SnoozeEventType.EXTENDED, "Snooze extended", replacement)))
                                    .thenReturn(replacement);
                        }))
                .doOnError(SnoozeStoreUnavailableException.class, e -> storeUnavailable(alertId, e));
    }

    /**
     * Audit entries for the alert, newest first.
     *
     * @throws IllegalArgumentException if {@code limit} is not positive
     */
    public Flux<SnoozeAuditEntry> history(String alertId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("History limit must be positive: " + limit);
        }
        return store.history(alertId, limit);
    }

    /**
     * Remove audit entries older than the retention window.
     */
    public Mono<Long> cleanupExpiredAudits() {
        Instant cutoff = clock.instant().minus(config.getAuditRetention());
        return store.purgeAuditBefore(cutoff)
                .doOnNext(removed -> {
                    if (removed > 0) {
                        structuredLogger.logSnoozeEvent("*", SnoozeEventType.AUDIT_PURGED,
                                "Expired snooze audit entries removed",
                                Map.of("removed", removed, "cutoff", cutoff.toString()));
                    }
                });
    }

    @Scheduled(fixedDelayString = "${argus.snooze.audit-cleanup-interval:PT1H}",
            initialDelayString = "${argus.snooze.audit-cleanup-interval:PT1H}")
    public void scheduledAuditCleanup() {
        cleanupExpiredAudits()
                .then(store.listActive().count())
                .subscribe(metrics::updateActiveSnoozes,
                        e -> log.warn("Snooze audit cleanup failed: {}", e.getMessage()));
    }

    public Duration clamp(Duration requested) {
        if (requested == null || requested.compareTo(config.getMinDuration()) < 0) {
            return config.getMinDuration();
        }
        if (requested.compareTo(config.getMaxDuration()) > 0) {
            return config.getMaxDuration();
        }
        return requested;
    }

    /**
     * SHA-256 over the alert fields a snooze was granted for.
     */
    static String contentHash(Alert alert) {
        StringBuilder content = new StringBuilder()
                .append(alert.getName()).append('\n')
                .append(alert.getSeverity()).append('\n')
                .append(alert.getDescription()).append('\n');
        new TreeMap<>(alert.getLabels() == null ? Map.<String, String>of() : alert.getLabels())
                .forEach((k, v) -> content.append(k).append('=').append(v).append('\n'));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private Mono<Boolean> unsnooze(String alertId, String reason, String userId, SnoozeAuditEntry.Action action) {
        return store.get(alertId)
                .flatMap(record -> store.delete(alertId)
                        .flatMap(deleted -> {
                            if (!deleted) {
                                return Mono.just(false);
                            }
                            boolean automatic = action == SnoozeAuditEntry.Action.AUTO_UNSNOOZED;
                            metrics.recordUnsnoozed(automatic);
                            log(alertId, automatic ? SnoozeEventType.AUTO_UNSNOOZED : SnoozeEventType.UNSNOOZED,
                                    automatic ? "Snooze lifted after alert changed" : "Alert unsnoozed", record);
                            return audit(record, action, userId, reason).thenReturn(true);
                        }))
                .defaultIfEmpty(false)
                .doOnError(SnoozeStoreUnavailableException.class, e -> storeUnavailable(alertId, e));
    }

    private Mono<SnoozeRecord> conflict(String alertId) {
        metrics.recordSnoozeConflict();
        return store.get(alertId)
                .map(SnoozeRecord::getExpiresAt)
                .defaultIfEmpty(Instant.EPOCH)
                .flatMap(until -> {
                    structuredLogger.logSnoozeEvent(alertId, SnoozeEventType.CONFLICT,
                            "Alert already snoozed", Map.of("activeUntil", until.toString()));
                    return Mono.error(new SnoozeConflictException(alertId, until));
                });
    }

    private SnoozeRecord newRecord(String alertId, Duration duration, String reason, String userId) {
        Instant now = clock.instant();
        return SnoozeRecord.builder()
                .id(UUID.randomUUID().toString())
                .alertId(alertId)
                .createdAt(now)
                .expiresAt(now.plus(duration))
                .duration(duration)
                .reason(reason)
                .createdBy(userId)
                .build();
    }

    private Mono<Void> audit(SnoozeRecord record, SnoozeAuditEntry.Action action, String userId, String reason) {
        return store.appendAudit(SnoozeAuditEntry.builder()
                .snoozeId(record.getId())
                .alertId(record.getAlertId())
                .action(action)
                .timestamp(clock.instant())
                .userId(userId)
                .reason(reason)
                .duration(record.getDuration())
                .build());
    }

    private void log(String alertId, SnoozeEventType type, String message, SnoozeRecord record) {
        Map<String, Object> details = new HashMap<>();
        details.put("snoozeId", record.getId());
        details.put("expiresAt", String.valueOf(record.getExpiresAt()));
        details.put("durationSeconds", record.getDuration().getSeconds());
        details.put("createdBy", record.getCreatedBy());
        structuredLogger.logSnoozeEvent(alertId, type, message, details);
    }

    private void storeUnavailable(String alertId, Throwable error) {
        structuredLogger.logSnoozeEvent(alertId, SnoozeEventType.STORE_UNAVAILABLE,
                "Snooze store unavailable", Map.of("error", String.valueOf(error.getMessage())));
    }
}
