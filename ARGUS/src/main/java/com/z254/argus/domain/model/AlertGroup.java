package com.z254.argus.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A cluster of related alerts sharing a group key.
 * <p>
 * The similarity threshold and time window are captured from the rule that
 * was active when the group was opened and never change afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertGroup {

    private String id;
    private String groupKey;

    @Builder.Default
    private Set<String> memberAlertIds = new LinkedHashSet<>();

    private String representativeAlertId;
    private int alertCount;
    private Instant firstSeen;
    private Instant lastSeen;
    private double similarityThreshold;
    private Duration timeWindow;
    private String matchedRule;

    @Builder.Default
    private GroupStatus status = GroupStatus.OPEN;

    public boolean isOpen() {
        return status == GroupStatus.OPEN;
    }

    /**
     * Whether an alert fired at the given instant falls inside this group's window.
     */
    public boolean withinWindow(Instant firedAt) {
        Duration gap = Duration.between(lastSeen, firedAt).abs();
        return gap.compareTo(timeWindow) <= 0;
    }

    /**
     * Whether the group has been idle longer than its window at {@code now}.
     */
    public boolean isExpired(Instant now) {
        return Duration.between(lastSeen, now).compareTo(timeWindow) > 0;
    }

    /**
     * Detached copy, safe to hand out while the original keeps changing.
     */
    public AlertGroup copy() {
        return new AlertGroup(id, groupKey, new LinkedHashSet<>(memberAlertIds), representativeAlertId,
                alertCount, firstSeen, lastSeen, similarityThreshold, timeWindow, matchedRule, status);
    }

    public enum GroupStatus {
        OPEN, CLOSED
    }
}
