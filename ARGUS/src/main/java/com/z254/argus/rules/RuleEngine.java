package com.z254.argus.rules;

import com.z254.argus.config.ArgusProperties;
import com.z254.argus.domain.model.Alert;
import com.z254.argus.observability.ArgusStructuredLogger;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Evaluates per-service grouping rules.
 * <p>
 * The active {@link RuleSet} is swapped atomically on load, so a failed load
 * leaves the previous rules in place. The first rule (by descending priority,
 * then declaration order) whose conditions hold wins; otherwise the default
 * key {@code service:name:severity} with the configured threshold and window
 * applies.
 */
@Slf4j
@Service
public class RuleEngine {

    private final ArgusProperties.Rules config;
    private final RuleConfigLoader loader;
    private final ResourceLoader resourceLoader;
    private final ArgusStructuredLogger structuredLogger;
    private final AtomicReference<RuleSet> rules = new AtomicReference<>(RuleSet.empty());

    public RuleEngine(ArgusProperties argusProperties,
                      RuleConfigLoader loader,
                      ResourceLoader resourceLoader,
                      ArgusStructuredLogger structuredLogger) {
        this.config = argusProperties.getRules();
        this.loader = loader;
        this.resourceLoader = resourceLoader;
        this.structuredLogger = structuredLogger;
    }

    @PostConstruct
    public void loadConfiguredRules() {
        reload();
    }

    /**
     * Re-read the configured rule document. A missing document clears the rules.
     */
    public RuleSet reload() {
        Resource resource = resourceLoader.getResource(config.getLocation());
        if (!resource.exists()) {
            log.warn("Rule document not found at {}, using default grouping only", config.getLocation());
            rules.set(RuleSet.empty());
            return RuleSet.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            return loadYaml(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RuleConfigurationException("Failed to read rule document " + config.getLocation(), e);
        }
    }

    /**
     * Parse and activate a YAML rule document.
     */
    public RuleSet loadYaml(String yaml) {
        RuleSet parsed = loader.parse(yaml);
        load(parsed);
        return parsed;
    }

    public void load(RuleSet ruleSet) {
        rules.set(ruleSet);
        Map<String, List<String>> problems = validate();
        structuredLogger.logControlEvent(ArgusStructuredLogger.ControlEventType.RULES_LOADED,
                "Grouping rules loaded", Map.of(
                        "services", ruleSet.asMap().size(),
                        "rules", ruleSet.size(),
                        "servicesWithErrors", problems.size()));
        problems.forEach((service, errors) ->
                log.warn("Rule validation errors for service {}: {}", service, errors));
    }

    public Map<String, List<GroupingRule>> rules() {
        return rules.get().asMap();
    }

    public RuleEvaluation evaluate(Alert alert) {
        String service = alert.effectiveService();
        for (GroupingRule rule : rules.get().candidates(service)) {
            if (rule.matches(alert)) {
                String key = rule.getGroupingKeys().isEmpty() ? defaultKey(alert) : rule.groupKey(alert);
                return new RuleEvaluation(rule.getName(), key, rule.getSimilarityThreshold(),
                        rule.getTimeWindow(), rule.getPriority());
            }
        }
        return new RuleEvaluation(null, defaultKey(alert), config.getDefaultSimilarityThreshold(),
                config.getDefaultTimeWindow(), 0);
    }

    /**
     * Advisory validation: duplicate names, unknown operators, invalid patterns
     * and empty grouping keys, per service. Services without problems are omitted.
     */
    public Map<String, List<String>> validate() {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        rules.get().asMap().forEach((service, serviceRules) -> {
            List<String> serviceErrors = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            Set<String> reported = new HashSet<>();
            for (GroupingRule rule : serviceRules) {
                if (!seen.add(rule.getName()) && reported.add(rule.getName())) {
                    serviceErrors.add("Duplicate rule name: " + rule.getName());
                }
                for (RuleCondition condition : rule.getConditions()) {
                    if (!condition.isParseable()) {
                        serviceErrors.add("Invalid operator in rule " + rule.getName()
                                + ": " + condition.getOperatorToken());
                    } else if (condition.hasInvalidPattern()) {
                        serviceErrors.add("Invalid pattern in rule " + rule.getName()
                                + ": " + condition.getValue());
                    }
                }
                if (rule.getGroupingKeys().isEmpty()) {
                    serviceErrors.add("No grouping keys in rule " + rule.getName());
                }
            }
            if (!serviceErrors.isEmpty()) {
                errors.put(service, serviceErrors);
            }
        });
        return errors;
    }

    /**
     * Per-service rule counts and outlines.
     */
    public Map<String, Map<String, Object>> summary() {
        Map<String, Map<String, Object>> summary = new LinkedHashMap<>();
        rules.get().asMap().forEach((service, serviceRules) -> {
            List<Map<String, Object>> outlines = new ArrayList<>();
            for (GroupingRule rule : serviceRules) {
                Map<String, Object> outline = new LinkedHashMap<>();
                outline.put("name", rule.getName());
                outline.put("priority", rule.getPriority());
                outline.put("conditions", rule.getConditions().size());
                outline.put("logic", rule.getLogic().name().toLowerCase());
                outline.put("groupingKeys", rule.getGroupingKeys());
                outlines.add(outline);
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("ruleCount", serviceRules.size());
            entry.put("rules", outlines);
            summary.put(service, entry);
        });
        return summary;
    }

    String defaultKey(Alert alert) {
        String service = alert.effectiveService();
        String severity = alert.getSeverity() != null ? alert.getSeverity().wireName() : "unknown";
        return (service != null ? service : "unknown") + ":" + alert.getName() + ":" + severity;
    }
}
