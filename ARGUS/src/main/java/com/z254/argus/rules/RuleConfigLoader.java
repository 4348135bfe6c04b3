package com.z254.argus.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.z254.argus.config.ArgusProperties;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses YAML rule documents of the form:
 * <pre>
 * services:
 *   checkout:
 *     rules:
 *       - name: High CPU alerts
 *         priority: 10
 *         conditions:
 *           - field: name
 *             operator: contains
 *             value: CPU
 *         logic: and
 *         grouping_keys: [service, environment, labels.instance]
 *         similarity_threshold: 0.8
 *         time_window: 600      # seconds, or a duration such as 10m
 * </pre>
 * Any structural problem fails the whole document.
 */
@Component
public class RuleConfigLoader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final ArgusProperties.Rules defaults;

    public RuleConfigLoader(ArgusProperties argusProperties) {
        this.defaults = argusProperties.getRules();
    }

    public RuleSet parse(String yaml) {
        JsonNode root;
        try {
            root = yamlMapper.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new RuleConfigurationException("Rule document is not valid YAML: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return RuleSet.empty();
        }
        if (!root.isObject()) {
            throw new RuleConfigurationException("Rule document must be a mapping with a 'services' key");
        }

        JsonNode services = root.path("services");
        if (services.isMissingNode() || services.isNull()) {
            return RuleSet.empty();
        }
        if (!services.isObject()) {
            throw new RuleConfigurationException("'services' must be a mapping of service name to rules");
        }

        Map<String, List<GroupingRule>> declared = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = services.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            declared.put(entry.getKey(), parseService(entry.getKey(), entry.getValue()));
        }
        return RuleSet.of(declared);
    }

    private List<GroupingRule> parseService(String service, JsonNode node) {
        List<GroupingRule> rules = new ArrayList<>();
        if (node == null || node.isNull()) {
            return rules;
        }
        if (!node.isObject()) {
            throw error(service, null, "service entry must be a mapping");
        }
        JsonNode rulesNode = node.path("rules");
        if (rulesNode.isMissingNode() || rulesNode.isNull()) {
            return rules;
        }
        if (!rulesNode.isArray()) {
            throw error(service, null, "'rules' must be a list");
        }
        int index = 0;
        for (JsonNode ruleNode : rulesNode) {
            rules.add(parseRule(service, index++, ruleNode));
        }
        return rules;
    }

    private GroupingRule parseRule(String service, int index, JsonNode node) {
        String position = "#" + index;
        if (!node.isObject()) {
            throw error(service, position, "rule must be a mapping");
        }
        JsonNode nameNode = node.path("name");
        if (!nameNode.isTextual() || nameNode.asText().isBlank()) {
            throw error(service, position, "missing required field 'name'");
        }
        String name = nameNode.asText();

        GroupingRule.GroupingRuleBuilder builder = GroupingRule.builder().name(name);

        JsonNode priority = node.path("priority");
        if (!priority.isMissingNode() && !priority.isNull()) {
            if (!priority.canConvertToInt() || !priority.isIntegralNumber()) {
                throw error(service, name, "'priority' must be an integer, got " + priority);
            }
            builder.priority(priority.asInt());
        }

        JsonNode logic = node.path("logic");
        if (!logic.isMissingNode() && !logic.isNull()) {
            try {
                builder.logic(RuleLogic.parse(logic.asText()));
            } catch (IllegalArgumentException e) {
                throw error(service, name, "'logic' must be 'and' or 'or', got '" + logic.asText() + "'");
            }
        }

        JsonNode conditions = node.path("conditions");
        if (!conditions.isMissingNode() && !conditions.isNull()) {
            if (!conditions.isArray()) {
                throw error(service, name, "'conditions' must be a list");
            }
            int i = 0;
            for (JsonNode condition : conditions) {
                builder.condition(parseCondition(service, name, i++, condition));
            }
        }

        JsonNode keys = node.path("grouping_keys");
        if (!keys.isMissingNode() && !keys.isNull()) {
            if (!keys.isArray()) {
                throw error(service, name, "'grouping_keys' must be a list");
            }
            for (JsonNode key : keys) {
                if (!key.isTextual()) {
                    throw error(service, name, "grouping key must be a string, got " + key);
                }
                builder.groupingKey(key.asText());
            }
        }

        double threshold = defaults.getDefaultSimilarityThreshold();
        JsonNode thresholdNode = node.path("similarity_threshold");
        if (!thresholdNode.isMissingNode() && !thresholdNode.isNull()) {
            if (!thresholdNode.isNumber()) {
                throw error(service, name, "'similarity_threshold' must be a number");
            }
            threshold = thresholdNode.asDouble();
            if (threshold < 0.0 || threshold > 1.0) {
                throw error(service, name, "'similarity_threshold' must be within [0, 1], got " + threshold);
            }
        }
        builder.similarityThreshold(threshold);
        builder.timeWindow(parseWindow(service, name, node.path("time_window")));

        return builder.build();
    }

    private RuleCondition parseCondition(String service, String rule, int index, JsonNode node) {
        if (!node.isObject()) {
            throw error(service, rule, "condition #" + index + " must be a mapping");
        }
        JsonNode field = node.path("field");
        JsonNode operator = node.path("operator");
        if (!field.isTextual() || field.asText().isBlank()) {
            throw error(service, rule, "condition #" + index + " is missing 'field'");
        }
        if (!operator.isTextual() || operator.asText().isBlank()) {
            throw error(service, rule, "condition #" + index + " is missing 'operator'");
        }
        if (!node.has("value")) {
            throw error(service, rule, "condition #" + index + " is missing 'value'");
        }
        Object value = yamlMapper.convertValue(node.get("value"), Object.class);
        return new RuleCondition(field.asText(), operator.asText(), value);
    }

    private Duration parseWindow(String service, String rule, JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return defaults.getDefaultTimeWindow();
        }
        Duration window;
        if (node.isIntegralNumber()) {
            window = Duration.ofSeconds(node.asLong());
        } else if (node.isTextual()) {
            try {
                window = DurationStyle.detectAndParse(node.asText());
            } catch (IllegalArgumentException e) {
                throw error(service, rule, "'time_window' is not a duration: '" + node.asText() + "'");
            }
        } else {
            throw error(service, rule, "'time_window' must be seconds or a duration string");
        }
        if (window.isNegative() || window.isZero()) {
            throw error(service, rule, "'time_window' must be positive, got " + window);
        }
        return window;
    }

    private static RuleConfigurationException error(String service, String rule, String problem) {
        StringBuilder message = new StringBuilder("Invalid rule configuration for service '")
                .append(service).append("'");
        if (rule != null) {
            message.append(", rule '").append(rule).append("'");
        }
        return new RuleConfigurationException(message.append(": ").append(problem).toString());
    }
}
