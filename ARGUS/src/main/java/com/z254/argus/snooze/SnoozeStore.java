package com.z254.argus.snooze;

import com.z254.argus.domain.model.SnoozeAuditEntry;
import com.z254.argus.domain.model.SnoozeRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * TTL key-value storage for snooze state and its audit trail.
 * <p>
 * Records expire on their own once their TTL elapses. Backend failures are
 * signalled as {@link SnoozeStoreUnavailableException}.
 */
public interface SnoozeStore {

    /**
     * Store the record unless one is already active for the alert.
     *
     * @return true when stored, false when an active record exists
     */
    Mono<Boolean> putIfAbsent(SnoozeRecord record, Duration ttl);

    /**
     * Store the record, replacing any active one.
     */
    Mono<Void> put(SnoozeRecord record, Duration ttl);

    Mono<SnoozeRecord> get(String alertId);

    /**
     * Time left before the alert's record expires; empty when there is none.
     */
    Mono<Duration> remainingTtl(String alertId);

    /**
     * Remove the alert's record and content hash.
     *
     * @return true when a record was removed
     */
    Mono<Boolean> delete(String alertId);

    Mono<Void> putContentHash(String alertId, String hash, Duration ttl);

    Mono<String> getContentHash(String alertId);

    Flux<SnoozeRecord> listActive();

    Mono<Void> appendAudit(SnoozeAuditEntry entry);

    /**
     * Audit entries for the alert, newest first.
     */
    Flux<SnoozeAuditEntry> history(String alertId, int limit);

    /**
     * Drop audit entries older than the cutoff.
     *
     * @return number of entries removed
     */
    Mono<Long> purgeAuditBefore(Instant cutoff);

    Mono<Boolean> isAvailable();
}
