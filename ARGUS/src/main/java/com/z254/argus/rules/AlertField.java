package com.z254.argus.rules;

import com.z254.argus.domain.model.Alert;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Alert attributes addressable from rule conditions and grouping keys.
 */
public enum AlertField {
    ID(Alert::getId, "id"),
    NAME(Alert::getName, "name"),
    DESCRIPTION(Alert::getDescription, "description"),
    SUMMARY(Alert::getSummary, "summary"),
    SEVERITY(alert -> alert.getSeverity() != null ? alert.getSeverity().wireName() : null, "severity"),
    SERVICE(Alert::effectiveService, "service"),
    ENVIRONMENT(Alert::getEnvironment, "environment", "env"),
    REGION(Alert::getRegion, "region"),
    FIRED_AT(Alert::getFiredAt, "fired_at", "firedat", "timestamp"),
    LABELS(Alert::getLabels, "labels");

    private static final Map<String, AlertField> BY_NAME = new HashMap<>();

    static {
        for (AlertField field : values()) {
            for (String name : field.names) {
                BY_NAME.put(name, field);
            }
        }
    }

    private final Function<Alert, Object> accessor;
    private final String[] names;

    AlertField(Function<Alert, Object> accessor, String... names) {
        this.accessor = accessor;
        this.names = names;
    }

    public Object read(Alert alert) {
        return accessor.apply(alert);
    }

    public static Optional<AlertField> fromName(String name) {
        return Optional.ofNullable(BY_NAME.get(name.toLowerCase(Locale.ROOT)));
    }
}
