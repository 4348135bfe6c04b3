package com.z254.argus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * ARGUS - Alert Intelligence for the operational monitoring pipeline.
 *
 * <p>For every incoming alert ARGUS decides whether it is:
 * <ul>
 *   <li>Noise - scored by the noise ranker and suppressed or snoozed</li>
 *   <li>A duplicate - merged into an open alert group</li>
 *   <li>A novel signal - surfaced with semantically similar history attached</li>
 * </ul>
 *
 * <p>ARGUS integrates with:
 * <ul>
 *   <li>The alert collector - consumes alert events over Kafka</li>
 *   <li>An embedding runtime - optional remote text encoder</li>
 *   <li>Redis - TTL store for snooze state and audit</li>
 *   <li>The model promotion workflow - drops ranker bundles on disk</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class ArgusApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArgusApplication.class, args);
    }
}
