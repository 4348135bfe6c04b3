package com.z254.argus.rules;

import com.z254.argus.domain.model.Alert;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves dotted field paths against an alert.
 * <p>
 * The first segment is looked up in {@link AlertField}; further segments walk
 * into maps. Paths whose first segment is not a known attribute are looked up
 * in the label map, first as a whole (labels may contain dots) and then by
 * segment. Resolution never throws: anything unresolvable is empty.
 */
public final class FieldResolver {

    private FieldResolver() {
    }

    public static Optional<Object> resolve(Alert alert, String path) {
        if (alert == null || path == null || path.isBlank()) {
            return Optional.empty();
        }
        String[] parts = path.split("\\.");
        Optional<AlertField> field = AlertField.fromName(parts[0]);
        if (field.isPresent()) {
            Object value = field.get().read(alert);
            return walk(value, parts, 1);
        }

        Map<String, String> labels = alert.getLabels();
        if (labels == null) {
            return Optional.empty();
        }
        if (labels.containsKey(path)) {
            return Optional.ofNullable(labels.get(path));
        }
        return walk(labels, parts, 0);
    }

    private static Optional<Object> walk(Object value, String[] parts, int from) {
        Object current = value;
        for (int i = from; i < parts.length; i++) {
            if (!(current instanceof Map)) {
                return Optional.empty();
            }
            Map<?, ?> map = (Map<?, ?>) current;
            String rest = String.join(".", Arrays.copyOfRange(parts, i, parts.length));
            if (i < parts.length - 1 && map.containsKey(rest)) {
                return Optional.ofNullable(map.get(rest));
            }
            current = map.get(parts[i]);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(current);
    }
}
