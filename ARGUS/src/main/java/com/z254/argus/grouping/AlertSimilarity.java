package com.z254.argus.grouping;

import com.z254.argus.config.ArgusProperties;
import com.z254.argus.domain.model.Alert;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Weighted similarity of two alerts in [0, 1].
 * <p>
 * Combines Jaccard similarity of label pairs, normalized edit distance of
 * names and the share of matching service/environment/region fields. Weights
 * are normalized to sum to one.
 */
@Component
public class AlertSimilarity {

    private final double labelWeight;
    private final double nameWeight;
    private final double contextWeight;

    @Autowired
    public AlertSimilarity(ArgusProperties argusProperties) {
        this(argusProperties.getGrouping().getLabelWeight(),
                argusProperties.getGrouping().getNameWeight(),
                argusProperties.getGrouping().getContextWeight());
    }

    public AlertSimilarity(double labelWeight, double nameWeight, double contextWeight) {
        if (labelWeight < 0 || nameWeight < 0 || contextWeight < 0) {
            throw new IllegalArgumentException("Similarity weights must be non-negative");
        }
        double total = labelWeight + nameWeight + contextWeight;
        if (total <= 0) {
            throw new IllegalArgumentException("At least one similarity weight must be positive");
        }
        this.labelWeight = labelWeight / total;
        this.nameWeight = nameWeight / total;
        this.contextWeight = contextWeight / total;
    }

    public double similarity(Alert a, Alert b) {
        double score = labelWeight * jaccard(a.getLabels(), b.getLabels())
                + nameWeight * nameSimilarity(a.getName(), b.getName())
                + contextWeight * contextSimilarity(a, b);
        return Math.max(0.0, Math.min(1.0, score));
    }

    /**
     * Jaccard similarity of the (key, value) pairs. Two empty maps are identical;
     * one empty map shares nothing with a non-empty one.
     */
    public static double jaccard(Map<String, String> a, Map<String, String> b) {
        Set<Map.Entry<String, String>> left = a == null ? Set.of() : a.entrySet();
        Set<Map.Entry<String, String>> right = b == null ? Set.of() : b.entrySet();
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        Set<Map.Entry<String, String>> union = new HashSet<>(left);
        union.addAll(right);
        int intersection = left.size() + right.size() - union.size();
        return (double) intersection / union.size();
    }

    /**
     * {@code 1 - distance / max(len)}, or 1 when both names are empty.
     */
    public static double nameSimilarity(String a, String b) {
        String left = a == null ? "" : a;
        String right = b == null ? "" : b;
        int maxLength = Math.max(left.length(), right.length());
        if (maxLength == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(left, right) / maxLength;
    }

    /**
     * Fraction of service, environment and region that are equal.
     */
    public static double contextSimilarity(Alert a, Alert b) {
        int matches = 0;
        if (Objects.equals(a.effectiveService(), b.effectiveService())) {
            matches++;
        }
        if (Objects.equals(a.getEnvironment(), b.getEnvironment())) {
            matches++;
        }
        if (Objects.equals(a.getRegion(), b.getRegion())) {
            matches++;
        }
        return matches / 3.0;
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
