package com.z254.argus.snooze;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.argus.domain.model.SnoozeAuditEntry;
import com.z254.argus.domain.model.SnoozeRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Redis-backed snooze store.
 * <p>
 * Keys under the configured prefix:
 * <ul>
 *     <li>{@code <prefix>:record:<alertId>} JSON record, TTL = snooze duration</li>
 *     <li>{@code <prefix>:hash:<alertId>} content hash, same TTL</li>
 *     <li>{@code <prefix>:audit:<alertId>} sorted set of JSON audit entries scored by epoch millis</li>
 * </ul>
 */
@Slf4j
public class RedisSnoozeStore implements SnoozeStore {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration auditRetention;

    public RedisSnoozeStore(ReactiveRedisTemplate<String, String> redisTemplate,
                            ObjectMapper objectMapper,
                            String keyPrefix,
                            Duration auditRetention) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
        this.auditRetention = auditRetention;
    }

    @Override
    public Mono<Boolean> putIfAbsent(SnoozeRecord record, Duration ttl) {
        return serialize(record)
                .flatMap(json -> redisTemplate.opsForValue().setIfAbsent(recordKey(record.getAlertId()), json, ttl))
                .onErrorMap(DataAccessException.class, e -> unavailable("store snooze", e));
    }

    @Override
    public Mono<Void> put(SnoozeRecord record, Duration ttl) {
        return serialize(record)
                .flatMap(json -> redisTemplate.opsForValue().set(recordKey(record.getAlertId()), json, ttl))
                .onErrorMap(DataAccessException.class, e -> unavailable("replace snooze", e))
                .then();
    }

    @Override
    public Mono<SnoozeRecord> get(String alertId) {
        return redisTemplate.opsForValue().get(recordKey(alertId))
                .onErrorMap(DataAccessException.class, e -> unavailable("read snooze", e))
                .flatMap(json -> deserialize(json, SnoozeRecord.class));
    }

    @Override
    public Mono<Duration> remainingTtl(String alertId) {
        return redisTemplate.getExpire(recordKey(alertId))
                .onErrorMap(DataAccessException.class, e -> unavailable("read snooze TTL", e))
                .filter(ttl -> !ttl.isNegative() && !ttl.isZero());
    }

    @Override
    public Mono<Boolean> delete(String alertId) {
        return redisTemplate.opsForValue().delete(recordKey(alertId))
                .flatMap(deleted -> redisTemplate.delete(hashKey(alertId)).thenReturn(deleted))
                .onErrorMap(DataAccessException.class, e -> unavailable("delete snooze", e));
    }

    @Override
    public Mono<Void> putContentHash(String alertId, String hash, Duration ttl) {
        return redisTemplate.opsForValue().set(hashKey(alertId), hash, ttl)
                .onErrorMap(DataAccessException.class, e -> unavailable("store content hash", e))
                .then();
    }

    @Override
    public Mono<String> getContentHash(String alertId) {
        return redisTemplate.opsForValue().get(hashKey(alertId))
                .onErrorMap(DataAccessException.class, e -> unavailable("read content hash", e));
    }

    @Override
    public Flux<SnoozeRecord> listActive() {
        return redisTemplate.scan(ScanOptions.scanOptions().match(keyPrefix + ":record:*").count(500).build())
                .flatMap(key -> redisTemplate.opsForValue().get(key))
                .flatMap(json -> deserialize(json, SnoozeRecord.class))
                .onErrorMap(DataAccessException.class, e -> unavailable("list snoozes", e));
    }

    @Override
    public Mono<Void> appendAudit(SnoozeAuditEntry entry) {
        String key = auditKey(entry.getAlertId());
        return serialize(entry)
                .flatMap(json -> redisTemplate.opsForZSet()
                        .add(key, json, entry.getTimestamp().toEpochMilli()))
                .then(redisTemplate.expire(key, auditRetention))
                .onErrorMap(DataAccessException.class, e -> unavailable("write snooze audit", e))
                .then();
    }

    @Override
    public Flux<SnoozeAuditEntry> history(String alertId, int limit) {
        return redisTemplate.opsForZSet()
                .reverseRange(auditKey(alertId), Range.closed(0L, (long) limit - 1))
                .onErrorMap(DataAccessException.class, e -> unavailable("read snooze audit", e))
                .flatMapSequential(json -> deserialize(json, SnoozeAuditEntry.class));
    }

    @Override
    public Mono<Long> purgeAuditBefore(Instant cutoff) {
        double maxScore = cutoff.toEpochMilli() - 1;
        return redisTemplate.scan(ScanOptions.scanOptions().match(keyPrefix + ":audit:*").count(500).build())
                .flatMap(key -> redisTemplate.opsForZSet().removeRangeByScore(key, Range.closed(0.0, maxScore)))
                .reduce(0L, Long::sum)
                .onErrorMap(DataAccessException.class, e -> unavailable("purge snooze audit", e));
    }

    @Override
    public Mono<Boolean> isAvailable() {
        return redisTemplate.getConnectionFactory()
                .getReactiveConnection()
                .ping()
                .map("PONG"::equals)
                .timeout(Duration.ofSeconds(5))
                .onErrorReturn(false);
    }

    String recordKey(String alertId) {
        return keyPrefix + ":record:" + alertId;
    }

    String hashKey(String alertId) {
        return keyPrefix + ":hash:" + alertId;
    }

    String auditKey(String alertId) {
        return keyPrefix + ":audit:" + alertId;
    }

    private Mono<String> serialize(Object value) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(value));
    }

    private <T> Mono<T> deserialize(String json, Class<T> type) {
        return Mono.fromCallable(() -> objectMapper.readValue(json, type))
                .onErrorMap(JsonProcessingException.class,
                        e -> new IllegalStateException("Corrupt " + type.getSimpleName() + " in snooze store", e));
    }

    private SnoozeStoreUnavailableException unavailable(String operation, Throwable cause) {
        log.warn("Snooze store unavailable during {}: {}", operation, cause.getMessage());
        return new SnoozeStoreUnavailableException("Snooze store unavailable: " + operation, cause);
    }
}
