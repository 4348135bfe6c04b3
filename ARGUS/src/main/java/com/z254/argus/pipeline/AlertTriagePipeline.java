package com.z254.argus.pipeline;

import com.z254.argus.config.ArgusProperties;
import com.z254.argus.domain.model.Alert;
import com.z254.argus.domain.model.HistoricalContext;
import com.z254.argus.domain.model.TriageDecision;
import com.z254.argus.grouping.AlertGroupingService;
import com.z254.argus.grouping.GroupAssignment;
import com.z254.argus.observability.ArgusMetrics;
import com.z254.argus.observability.ArgusStructuredLogger;
import com.z254.argus.observability.ArgusStructuredLogger.TriageEventType;
import com.z254.argus.ranker.NoiseRanker;
import com.z254.argus.search.AlertSearchService;
import com.z254.argus.search.SearchResult;
import com.z254.argus.snooze.SnoozeService;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Runs an alert through snooze check, noise scoring, grouping and similar-alert
 * search and decides whether to surface it.
 * <p>
 * Requests for the same alert id run one after another; different ids run in
 * parallel. Every stage has a timeout. A stage that fails or times out is
 * recorded as a degradation and skipped, and the alert is surfaced rather than
 * dropped.
 * <p>
 * A timeout only stops waiting: blocking work already handed to a worker runs
 * to the end, and the next request for the same id waits for it.
 */
@Slf4j
@Service
public class AlertTriagePipeline {

    static final String STAGE_SNOOZE = "snooze";
    static final String STAGE_RANKER = "ranker";
    static final String STAGE_RANKER_NOT_READY = "ranker:not_ready";
    static final String STAGE_GROUPING = "grouping";
    static final String STAGE_SEARCH = "search";

    private final SnoozeService snoozeService;
    private final NoiseRanker ranker;
    private final AlertGroupingService groupingService;
    private final AlertSearchService searchService;
    private final ArgusMetrics metrics;
    private final ArgusStructuredLogger structuredLogger;
    private final ArgusProperties.Pipeline config;
    private final Clock clock;

    private final ConcurrentHashMap<String, CompletableFuture<Void>> inFlight = new ConcurrentHashMap<>();

    public AlertTriagePipeline(SnoozeService snoozeService,
                               NoiseRanker ranker,
                               AlertGroupingService groupingService,
                               AlertSearchService searchService,
                               ArgusMetrics metrics,
                               ArgusStructuredLogger structuredLogger,
                               ArgusProperties argusProperties,
                               Clock clock) {
        this.snoozeService = snoozeService;
        this.ranker = ranker;
        this.groupingService = groupingService;
        this.searchService = searchService;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.config = argusProperties.getPipeline();
        this.clock = clock;
    }

    public Mono<TriageDecision> process(Alert alert) {
        return process(alert, HistoricalContext.empty());
    }

    /**
     * Triage one alert. Chains behind any in-flight request for the same id.
     */
    public Mono<TriageDecision> process(Alert alert, HistoricalContext historical) {
        return Mono.defer(() -> {
            CompletableFuture<Void> done = new CompletableFuture<>();
            AtomicReference<CompletableFuture<Void>> previous = new AtomicReference<>();
            inFlight.compute(alert.getId(), (id, tail) -> {
                previous.set(tail);
                return done;
            });
            Mono<Void> turn = previous.get() == null
                    ? Mono.empty()
                    : Mono.fromFuture(previous.get().copy()).onErrorResume(e -> Mono.empty());
            Triage triage = new Triage();
            return turn
                    .then(Mono.defer(() -> run(alert, historical, triage)))
                    .doFinally(signal -> triage.settled().whenComplete((ignored, error) -> {
                        recordLateAssignment(alert, triage);
                        done.complete(null);
                        inFlight.remove(alert.getId(), done);
                    }));
        });
    }

    /**
     * Triage a stream of alerts with bounded parallelism.
     */
    public Flux<TriageDecision> processAll(Flux<Alert> alerts, int concurrency) {
        return alerts.flatMap(this::process, concurrency);
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private Mono<TriageDecision> run(Alert alert, HistoricalContext historical, Triage triage) {
        Timer.Sample sample = metrics.startPipelineTimer();

        Mono<Boolean> snoozed = stage(alert, STAGE_SNOOZE, triage.degradations,
                snoozeService.autoUnsnoozeIfChanged(alert)
                        .then(Mono.defer(() -> snoozeService.isSnoozed(alert.getId()))))
                .defaultIfEmpty(false);

        return snoozed.flatMap(isSnoozed -> {
            if (isSnoozed) {
                return Mono.fromCallable(() -> finish(sample, TriageDecision.builder()
                        .alertId(alert.getId())
                        .outcome(TriageDecision.Outcome.SNOOZED)
                        .snoozed(true)
                        .degradations(new ArrayList<>(triage.degradations))
                        .decidedAt(clock.instant())
                        .build()));
            }
            return score(alert, historical, triage)
                    .doOnNext(score -> triage.score = score)
                    .then(stage(alert, STAGE_GROUPING, triage.degradations,
                            blocking(triage, () -> {
                                GroupAssignment assignment = groupingService.assign(alert);
                                triage.completedAssignment = assignment;
                                return assignment;
                            })))
                    .doOnNext(assignment -> triage.assignment = assignment)
                    .then(stage(alert, STAGE_SEARCH, triage.degradations,
                            blocking(triage, () -> searchAndIndex(alert))))
                    .doOnNext(similar -> triage.similar = similar)
                    .then(Mono.fromCallable(() -> finish(sample, decide(alert, triage))));
        });
    }

    private Mono<Double> score(Alert alert, HistoricalContext historical, Triage triage) {
        List<String> degradations = triage.degradations;
        return blocking(triage, () -> ranker.score(alert, historical))
                .timeout(config.getStageTimeout())
                .onErrorResume(NoiseRanker.ModelNotReadyException.class, e -> {
                    degrade(alert, STAGE_RANKER_NOT_READY, degradations, e);
                    return Mono.empty();
                })
                .onErrorResume(e -> {
                    degrade(alert, STAGE_RANKER, degradations, e);
                    return Mono.empty();
                });
    }

    private List<SearchResult> searchAndIndex(Alert alert) {
        List<SearchResult> similar = searchService.searchSimilar(alert, config.getSimilarK(), config.getSimilarThreshold());
        if (config.isIndexAlerts()) {
            searchService.index(alert);
        }
        return similar;
    }

    private TriageDecision decide(Alert alert, Triage triage) {
        Double score = triage.score;
        GroupAssignment assignment = triage.assignment;
        boolean suppressed = score != null && score > ranker.effectiveThreshold();
        TriageDecision.Outcome outcome;
        if (suppressed) {
            outcome = TriageDecision.Outcome.SUPPRESS;
        } else if (assignment != null && !assignment.created()) {
            outcome = TriageDecision.Outcome.GROUPED;
        } else {
            outcome = TriageDecision.Outcome.SURFACE;
        }

        TriageDecision.TriageDecisionBuilder decision = TriageDecision.builder()
                .alertId(alert.getId())
                .outcome(outcome)
                .noiseScore(score)
                .suppressed(suppressed)
                .similarAlerts(triage.similar.stream()
                        .map(hit -> new TriageDecision.SimilarAlert(hit.getAlertId(), hit.getScore()))
                        .collect(Collectors.toList()))
                .degradations(new ArrayList<>(triage.degradations))
                .decidedAt(clock.instant());
        if (assignment != null) {
            decision.groupId(assignment.group().getId())
                    .groupKey(assignment.group().getGroupKey())
                    .newGroup(assignment.created())
                    .groupSize(assignment.group().getAlertCount());
        }
        return decision.build();
    }

    private TriageDecision finish(Timer.Sample sample, TriageDecision decision) {
        metrics.recordTriage(sample, decision.getOutcome().name(), decision.isSuppressed());

        Map<String, Object> details = new HashMap<>();
        details.put("outcome", decision.getOutcome().name());
        details.put("noiseScore", decision.getNoiseScore());
        details.put("groupId", decision.getGroupId());
        details.put("groupSize", decision.getGroupSize());
        details.put("similar", decision.getSimilarAlerts().size());
        if (!decision.getDegradations().isEmpty()) {
            details.put("degradations", String.join(",", decision.getDegradations()));
        }
        TriageEventType type = switch (decision.getOutcome()) {
            case SUPPRESS -> TriageEventType.SUPPRESSED;
            case SNOOZED -> TriageEventType.SNOOZED;
            case GROUPED -> TriageEventType.GROUPED;
            case SURFACE -> TriageEventType.SURFACED;
        };
        structuredLogger.logTriageEvent(decision.getAlertId(), type, "Alert triaged", details);
        return decision;
    }

    private <T> Mono<T> stage(Alert alert, String name, List<String> degradations, Mono<T> work) {
        return work
                .timeout(config.getStageTimeout())
                .onErrorResume(e -> {
                    degrade(alert, name, degradations, e);
                    return Mono.empty();
                });
    }

    private void degrade(Alert alert, String stage, List<String> degradations, Throwable error) {
        degradations.add(stage);
        metrics.recordDegradation(stage);
        String reason = error instanceof TimeoutException
                ? "timed out after " + config.getStageTimeout().toMillis() + "ms"
                : String.valueOf(error.getMessage());
        structuredLogger.logTriageEvent(alert.getId(), TriageEventType.DEGRADED,
                "Triage stage skipped", Map.of("stage", stage, "reason", reason));
    }

    /**
     * The alert was merged into a group after the grouping stage had already
     * timed out, so the emitted decision does not carry it.
     */
    private void recordLateAssignment(Alert alert, Triage triage) {
        GroupAssignment late = triage.completedAssignment;
        if (late == null || triage.assignment != null) {
            return;
        }
        Map<String, Object> details = new HashMap<>();
        details.put("groupId", late.group().getId());
        details.put("groupKey", late.group().getGroupKey());
        details.put("newGroup", late.created());
        details.put("groupSize", late.group().getAlertCount());
        structuredLogger.logTriageEvent(alert.getId(), TriageEventType.GROUPED,
                "Group assignment completed after stage timeout", details);
        log.info("Alert {} joined group {} after the grouping stage timed out", alert.getId(), late.group().getId());
    }

    /**
     * Runs {@code work} on a worker thread. Once scheduled it runs to completion
     * even if the returned Mono is cancelled; {@link Triage#settled()} tracks it.
     */
    private static <T> Mono<T> blocking(Triage triage, Callable<T> work) {
        return Mono.defer(() -> {
            CompletableFuture<T> result = new CompletableFuture<>();
            CompletableFuture<Void> finished = new CompletableFuture<>();
            Schedulers.boundedElastic().schedule(() -> {
                try {
                    result.complete(work.call());
                } catch (Exception e) {
                    result.completeExceptionally(e);
                } finally {
                    finished.complete(null);
                }
            });
            triage.work.add(finished);
            return Mono.fromFuture(result);
        });
    }

    /**
     * Intermediate results of one pipeline run.
     */
    private static final class Triage {
        final List<String> degradations = Collections.synchronizedList(new ArrayList<>());
        final List<CompletableFuture<Void>> work = Collections.synchronizedList(new ArrayList<>());
        volatile Double score;
        volatile GroupAssignment assignment;
        volatile GroupAssignment completedAssignment;
        volatile List<SearchResult> similar = List.of();

        CompletableFuture<Void> settled() {
            synchronized (work) {
                return CompletableFuture.allOf(work.toArray(new CompletableFuture<?>[0]));
            }
        }
    }
}
