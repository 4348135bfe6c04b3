package com.z254.argus.grouping;

import com.z254.argus.config.ArgusProperties;
import com.z254.argus.domain.model.Alert;
import com.z254.argus.domain.model.AlertGroup;
import com.z254.argus.domain.model.MergeSuggestion;
import com.z254.argus.observability.ArgusMetrics;
import com.z254.argus.observability.ArgusStructuredLogger;
import com.z254.argus.rules.RuleEngine;
import com.z254.argus.rules.RuleEvaluation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Folds alerts into groups of related alerts.
 * <p>
 * Open groups are partitioned by group key. Placing an alert (find the best
 * open group or open a new one) runs inside {@link ConcurrentHashMap#compute}
 * on the key's partition, so two alerts with the same key can never both open
 * a group, and no caller ever sees a half-applied merge. Groups handed out are
 * detached copies.
 */
@Slf4j
@Service
public class AlertGroupingService {

    private final RuleEngine ruleEngine;
    private final AlertSimilarity similarity;
    private final ArgusMetrics metrics;
    private final ArgusStructuredLogger structuredLogger;
    private final ArgusProperties.Grouping config;
    private final Clock clock;

    private final ConcurrentHashMap<String, List<OpenGroup>> openByKey = new ConcurrentHashMap<>();
    private final Deque<OpenGroup> recentlyClosed = new ArrayDeque<>();

    public AlertGroupingService(RuleEngine ruleEngine,
                                AlertSimilarity similarity,
                                ArgusMetrics metrics,
                                ArgusStructuredLogger structuredLogger,
                                ArgusProperties argusProperties,
                                Clock clock) {
        this.ruleEngine = ruleEngine;
        this.similarity = similarity;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.config = argusProperties.getGrouping();
        this.clock = clock;
    }

    /**
     * Merge the alert into its best open group or open a new one.
     */
    public GroupAssignment assign(Alert alert) {
        RuleEvaluation evaluation = ruleEngine.evaluate(alert);
        AtomicReference<GroupAssignment> result = new AtomicReference<>();
        openByKey.compute(evaluation.getGroupKey(), (key, groups) -> {
            List<OpenGroup> partition = groups != null ? groups : new ArrayList<>();
            result.set(place(alert, evaluation, partition));
            return partition;
        });

        GroupAssignment assignment = result.get();
        AlertGroup group = assignment.group();
        if (assignment.created()) {
            metrics.recordGroupCreated();
            structuredLogger.logGroupEvent(group.getId(), ArgusStructuredLogger.GroupEventType.CREATED,
                    "Alert group opened", Map.of(
                            "alertId", alert.getId(),
                            "groupKey", group.getGroupKey(),
                            "rule", evaluation.matchingRuleName().orElse("default")));
        } else {
            metrics.recordAlertMerged();
            structuredLogger.logGroupEvent(group.getId(), ArgusStructuredLogger.GroupEventType.MERGED,
                    "Alert merged into group", Map.of(
                            "alertId", alert.getId(),
                            "groupKey", group.getGroupKey(),
                            "alertCount", group.getAlertCount(),
                            "similarity", assignment.similarity()));
        }
        return assignment;
    }

    /**
     * Place an alert among caller-supplied open groups, appending a new entry
     * when no group qualifies. Does not touch the service's own registry.
     */
    public GroupAssignment assign(Alert alert, List<OpenGroup> openGroups) {
        return place(alert, ruleEngine.evaluate(alert), openGroups);
    }

    /**
     * Group a batch from scratch, in fired-at order.
     *
     * @return the resulting groups in creation order
     */
    public List<AlertGroup> group(List<Alert> alerts) {
        Map<String, List<OpenGroup>> partitions = new LinkedHashMap<>();
        List<OpenGroup> created = new ArrayList<>();
        alerts.stream()
                .sorted(Comparator.comparing(Alert::getFiredAt))
                .forEach(alert -> {
                    RuleEvaluation evaluation = ruleEngine.evaluate(alert);
                    List<OpenGroup> partition = partitions.computeIfAbsent(
                            evaluation.getGroupKey(), k -> new ArrayList<>());
                    int before = partition.size();
                    place(alert, evaluation, partition);
                    if (partition.size() > before) {
                        created.add(partition.get(partition.size() - 1));
                    }
                });
        return created.stream().map(o -> o.group().copy()).collect(Collectors.toList());
    }

    /**
     * Close every group that has been idle longer than its window.
     *
     * @return the groups closed by this call
     */
    public List<AlertGroup> expireGroups(Instant now) {
        List<AlertGroup> closed = new ArrayList<>();
        for (String key : openByKey.keySet()) {
            openByKey.computeIfPresent(key, (k, groups) -> {
                Iterator<OpenGroup> it = groups.iterator();
                while (it.hasNext()) {
                    OpenGroup open = it.next();
                    if (open.group().isExpired(now)) {
                        it.remove();
                        open.group().setStatus(AlertGroup.GroupStatus.CLOSED);
                        retainClosed(open);
                        closed.add(open.group().copy());
                    }
                }
                return groups.isEmpty() ? null : groups;
            });
        }
        if (!closed.isEmpty()) {
            metrics.recordGroupsExpired(closed.size());
            for (AlertGroup group : closed) {
                structuredLogger.logGroupEvent(group.getId(), ArgusStructuredLogger.GroupEventType.EXPIRED,
                        "Alert group closed", Map.of(
                                "groupKey", group.getGroupKey(),
                                "alertCount", group.getAlertCount()));
            }
        }
        return closed;
    }

    @Scheduled(fixedDelayString = "${argus.grouping.expiry-interval:PT60S}")
    public void expireStaleGroups() {
        expireGroups(clock.instant());
    }

    /**
     * Pairs of groups whose representatives are more similar than the merge
     * suggestion threshold. Advisory only; nothing is merged.
     */
    public List<MergeSuggestion> suggestMerges(List<AlertGroup> groups) {
        Map<String, Alert> representatives = new LinkedHashMap<>();
        for (OpenGroup open : snapshotAll()) {
            representatives.put(open.group().getId(), open.representative());
        }
        List<MergeSuggestion> suggestions = new ArrayList<>();
        for (int i = 0; i < groups.size(); i++) {
            for (int j = i + 1; j < groups.size(); j++) {
                AlertGroup a = groups.get(i);
                AlertGroup b = groups.get(j);
                Alert repA = representatives.get(a.getId());
                Alert repB = representatives.get(b.getId());
                double score = repA != null && repB != null
                        ? similarity.similarity(repA, repB)
                        : AlertSimilarity.nameSimilarity(a.getGroupKey(), b.getGroupKey());
                if (score > config.getMergeSuggestionThreshold()) {
                    suggestions.add(new MergeSuggestion(a.getId(), b.getId(), score));
                    structuredLogger.logGroupEvent(a.getId(), ArgusStructuredLogger.GroupEventType.MERGE_SUGGESTED,
                            "Groups look alike", Map.of("otherGroupId", b.getId(), "similarity", score));
                }
            }
        }
        return suggestions;
    }

    /**
     * Merge suggestions across all open and recently closed groups.
     */
    public List<MergeSuggestion> suggestMerges() {
        return suggestMerges(snapshotAll().stream()
                .map(o -> o.group().copy())
                .collect(Collectors.toList()));
    }

    public List<AlertGroup> openGroups() {
        List<AlertGroup> open = new ArrayList<>();
        for (String key : openByKey.keySet()) {
            openByKey.computeIfPresent(key, (k, groups) -> {
                groups.forEach(o -> open.add(o.group().copy()));
                return groups;
            });
        }
        return open;
    }

    public int openGroupCount() {
        return openGroups().size();
    }

    public Optional<AlertGroup> findGroup(String groupId) {
        return snapshotAll().stream()
                .filter(o -> o.group().getId().equals(groupId))
                .map(o -> o.group().copy())
                .findFirst();
    }

    private GroupAssignment place(Alert alert, RuleEvaluation evaluation, List<OpenGroup> candidates) {
        OpenGroup best = null;
        double bestScore = -1.0;
        for (OpenGroup candidate : candidates) {
            AlertGroup group = candidate.group();
            if (!group.isOpen()
                    || !group.getGroupKey().equals(evaluation.getGroupKey())
                    || !group.withinWindow(alert.getFiredAt())) {
                continue;
            }
            double score = similarity.similarity(alert, candidate.representative());
            if (score < group.getSimilarityThreshold()) {
                continue;
            }
            if (best == null || score > bestScore
                    || (score == bestScore && group.getLastSeen().isAfter(best.group().getLastSeen()))) {
                best = candidate;
                bestScore = score;
            }
        }

        if (best != null) {
            AlertGroup group = best.group();
            group.getMemberAlertIds().add(alert.getId());
            group.setAlertCount(group.getAlertCount() + 1);
            if (alert.getFiredAt().isAfter(group.getLastSeen())) {
                group.setLastSeen(alert.getFiredAt());
            }
            if (alert.getFiredAt().isBefore(group.getFirstSeen())) {
                group.setFirstSeen(alert.getFiredAt());
            }
            return new GroupAssignment(group.copy(), false, bestScore);
        }

        AlertGroup group = AlertGroup.builder()
                .id(UUID.randomUUID().toString())
                .groupKey(evaluation.getGroupKey())
                .representativeAlertId(alert.getId())
                .alertCount(1)
                .firstSeen(alert.getFiredAt())
                .lastSeen(alert.getFiredAt())
                .similarityThreshold(evaluation.getSimilarityThreshold())
                .timeWindow(evaluation.getTimeWindow())
                .matchedRule(evaluation.getMatchingRule())
                .build();
        group.getMemberAlertIds().add(alert.getId());
        candidates.add(new OpenGroup(group, alert));
        return new GroupAssignment(group.copy(), true, 1.0);
    }

    private void retainClosed(OpenGroup group) {
        synchronized (recentlyClosed) {
            recentlyClosed.addLast(group);
            while (recentlyClosed.size() > config.getClosedRetention()) {
                recentlyClosed.removeFirst();
            }
        }
    }

    private List<OpenGroup> snapshotAll() {
        List<OpenGroup> all = new ArrayList<>();
        for (String key : openByKey.keySet()) {
            openByKey.computeIfPresent(key, (k, groups) -> {
                groups.forEach(o -> all.add(new OpenGroup(o.group().copy(), o.representative())));
                return groups;
            });
        }
        synchronized (recentlyClosed) {
            recentlyClosed.forEach(o -> all.add(new OpenGroup(o.group().copy(), o.representative())));
        }
        return all;
    }
}
