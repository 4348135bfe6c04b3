package com.z254.argus.fixtures;

import com.z254.argus.domain.model.Alert;
import com.z254.argus.domain.model.Severity;
import com.z254.argus.testing.fixtures.TestDataFactories;

import java.time.Instant;
import java.util.Map;

/**
 * Alert builders shared by the ARGUS tests.
 */
public final class AlertFixtures {

    public static final Instant T0 = Instant.parse("2024-03-05T14:00:00Z");

    private AlertFixtures() {
    }

    /**
     * A production CPU alert for the {@code api} service fired at {@link #T0}.
     */
    public static Alert.AlertBuilder cpuAlert(String id) {
        return Alert.builder()
                .id(id)
                .name("HighCPUUsage")
                .description("CPU usage above 90% for 5 minutes")
                .summary("CPU saturation on web-1")
                .severity(Severity.WARNING)
                .labels(Map.of("host", "web-1", "service", "api"))
                .service("api")
                .environment("production")
                .region("us-east-1")
                .firedAt(T0);
    }

    public static Alert alert(String id, String name, Severity severity, Map<String, String> labels) {
        return Alert.builder()
                .id(id)
                .name(name)
                .description(name + " triggered")
                .severity(severity)
                .labels(labels)
                .service(labels.get("service"))
                .environment("production")
                .region("us-east-1")
                .firedAt(T0)
                .build();
    }

    /**
     * A random but well-formed alert.
     */
    public static Alert randomAlert() {
        String service = TestDataFactories.randomService();
        String name = TestDataFactories.randomAlertName();
        return Alert.builder()
                .id(TestDataFactories.uniqueId("alert"))
                .name(name)
                .description(name + " on " + service)
                .severity(Severity.values()[Math.abs(name.hashCode()) % Severity.values().length])
                .labels(TestDataFactories.labels(service, service + "-1"))
                .service(service)
                .environment(TestDataFactories.randomEnvironment())
                .region(TestDataFactories.randomRegion())
                .firedAt(T0)
                .build();
    }
}
