package com.z254.argus.encoder;

import com.z254.argus.domain.model.Alert;

import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Builds the text an alert is encoded from.
 */
public final class AlertText {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private AlertText() {
    }

    /**
     * {@code name description summary}, skipping blank parts.
     */
    public static String of(Alert alert) {
        StringJoiner joiner = new StringJoiner(" ");
        for (String part : new String[]{alert.getName(), alert.getDescription(), alert.getSummary()}) {
            if (part != null && !part.isBlank()) {
                joiner.add(part.trim());
            }
        }
        return joiner.toString();
    }

    /**
     * Collapse whitespace and truncate to {@code maxChars}.
     */
    public static String clean(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(text).replaceAll(" ").trim();
        return collapsed.length() > maxChars ? collapsed.substring(0, maxChars) : collapsed;
    }
}
