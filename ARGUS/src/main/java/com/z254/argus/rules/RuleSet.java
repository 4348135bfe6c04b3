package com.z254.argus.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable rules partitioned by service, each partition sorted by
 * descending priority. Equal priorities keep declaration order.
 */
public final class RuleSet {

    public static final String DEFAULT_PARTITION = "default";

    private static final RuleSet EMPTY = new RuleSet(Map.of());

    private final Map<String, List<GroupingRule>> rulesByService;

    private RuleSet(Map<String, List<GroupingRule>> rulesByService) {
        this.rulesByService = rulesByService;
    }

    public static RuleSet empty() {
        return EMPTY;
    }

    public static RuleSet of(Map<String, List<GroupingRule>> declared) {
        Map<String, List<GroupingRule>> sorted = new LinkedHashMap<>();
        declared.forEach((service, rules) -> sorted.put(service, rules.stream()
                .sorted(Comparator.comparingInt(GroupingRule::getPriority).reversed())
                .collect(Collectors.toUnmodifiableList())));
        return new RuleSet(Collections.unmodifiableMap(sorted));
    }

    /**
     * Candidate rules for a service: its own partition followed by the default partition.
     */
    public List<GroupingRule> candidates(String service) {
        List<GroupingRule> own = service != null ? rulesByService.get(service) : null;
        List<GroupingRule> defaults = rulesByService.getOrDefault(DEFAULT_PARTITION, List.of());
        if (own == null || DEFAULT_PARTITION.equals(service)) {
            return defaults;
        }
        if (defaults.isEmpty()) {
            return own;
        }
        List<GroupingRule> combined = new ArrayList<>(own);
        combined.addAll(defaults);
        return combined;
    }

    public Map<String, List<GroupingRule>> asMap() {
        return rulesByService;
    }

    public int size() {
        return rulesByService.values().stream().mapToInt(List::size).sum();
    }
}
