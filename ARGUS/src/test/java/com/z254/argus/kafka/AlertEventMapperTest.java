package com.z254.argus.kafka;

import com.z254.argus.domain.model.Alert;
import com.z254.argus.domain.model.Severity;
import com.z254.argus.fixtures.AlertFixtures;
import com.z254.argus.kafka.AlertEventMapper.AlertEvent;
import com.z254.argus.kafka.AlertEventMapper.InvalidAlertEventException;
import com.z254.argus.testing.time.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlertEventMapperTest {

    private final AlertEventMapper mapper = new AlertEventMapper(new MutableClock(AlertFixtures.T0));

    @Test
    @DisplayName("should map a snake_case collector event with history")
    void collectorEvent() {
        Map<String, Object> data = new HashMap<>();
        data.put("alert_id", "a-1");
        data.put("alert_name", "HighCPUUsage");
        data.put("description", "CPU above 90%");
        data.put("severity", "high");
        data.put("service", "api");
        data.put("environment", "production");
        data.put("labels", Map.of("host", "web-1", "port", 8080));
        data.put("fired_at", "2024-03-05T13:55:00Z");
        data.put("historical", Map.of("count_24h", 12, "false_positive_rate", "0.4"));

        AlertEvent event = mapper.map(data);
        Alert alert = event.alert();

        assertThat(alert.getId()).isEqualTo("a-1");
        assertThat(alert.getName()).isEqualTo("HighCPUUsage");
        assertThat(alert.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(alert.getLabels()).containsEntry("port", "8080");
        assertThat(alert.getFiredAt()).isEqualTo(Instant.parse("2024-03-05T13:55:00Z"));
        assertThat(event.historical().getCount24h()).isEqualTo(12.0);
        assertThat(event.historical().getFalsePositiveRate()).isEqualTo(0.4);
    }

    @Test
    @DisplayName("should map an Alertmanager style event")
    void alertmanagerEvent() {
        Map<String, Object> data = Map.of(
                "fingerprint", "3f2a9c",
                "labels", Map.of("alertname", "DiskSpaceLow", "severity", "warning",
                        "env", "staging", "region", "eu-west-1"),
                "annotations", Map.of("description", "Disk 91% full", "summary", "disk"),
                "startsAt", "2024-03-05T12:00:00Z");

        Alert alert = mapper.map(data).alert();

        assertThat(alert.getId()).isEqualTo("3f2a9c");
        assertThat(alert.getName()).isEqualTo("DiskSpaceLow");
        assertThat(alert.getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(alert.getEnvironment()).isEqualTo("staging");
        assertThat(alert.getRegion()).isEqualTo("eu-west-1");
        assertThat(alert.getDescription()).isEqualTo("Disk 91% full");
        assertThat(alert.getSummary()).isEqualTo("disk");
    }

    @Test
    @DisplayName("should default missing timestamps to now and history to empty")
    void defaults() {
        AlertEvent event = mapper.map(Map.of("id", "a-2", "name", "Heartbeat", "timestamp", 1_709_640_000_000L));
        AlertEvent noTime = mapper.map(Map.of("id", "a-3", "name", "Heartbeat"));

        assertThat(event.alert().getFiredAt()).isEqualTo(Instant.ofEpochMilli(1_709_640_000_000L));
        assertThat(noTime.alert().getFiredAt()).isEqualTo(AlertFixtures.T0);
        assertThat(noTime.alert().getSeverity()).isEqualTo(Severity.INFO);
        assertThat(noTime.historical().getCount24h()).isZero();
    }

    @Test
    @DisplayName("should reject events without id or name")
    void rejectsIncomplete() {
        assertThatThrownBy(() -> mapper.map(null)).isInstanceOf(InvalidAlertEventException.class);
        assertThatThrownBy(() -> mapper.map(Map.of("name", "X")))
                .isInstanceOf(InvalidAlertEventException.class)
                .hasMessageContaining("no id");
        assertThatThrownBy(() -> mapper.map(Map.of("id", "a-4", "labels", Map.of())))
                .isInstanceOf(InvalidAlertEventException.class)
                .hasMessageContaining("no name");
    }

    @Test
    @DisplayName("should reject unparseable timestamps and history values")
    void rejectsMalformedFields() {
        assertThatThrownBy(() -> mapper.map(Map.of("id", "a-5", "name", "X", "fired_at", "yesterday")))
                .isInstanceOf(InvalidAlertEventException.class)
                .hasMessageContaining("fired_at");
        assertThatThrownBy(() -> mapper.map(Map.of("id", "a-6", "name", "X",
                "historical", Map.of("ack_rate", "high"))))
                .isInstanceOf(InvalidAlertEventException.class)
                .hasMessageContaining("ack_rate");
    }
}
