package com.z254.argus.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.argus.encoder.EmbeddingRuntimeClient;
import com.z254.argus.encoder.HashingTextEncoder;
import com.z254.argus.encoder.RemoteTextEncoder;
import com.z254.argus.encoder.TextEncoder;
import com.z254.argus.search.IndexParameters;
import com.z254.argus.search.VectorSearchEngine;
import com.z254.argus.snooze.InMemorySnoozeStore;
import com.z254.argus.snooze.RedisSnoozeStore;
import com.z254.argus.snooze.SnoozeStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveRedisTemplate;

import java.time.Clock;

/**
 * Wiring for the components whose implementation is chosen by configuration.
 */
@Slf4j
@Configuration
public class ArgusConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "argus.encoder", name = "provider", havingValue = "hashing", matchIfMissing = true)
    public TextEncoder hashingTextEncoder(ArgusProperties argusProperties) {
        return new HashingTextEncoder(argusProperties.getEncoder()).initialize();
    }

    /**
     * The remote encoder asks the runtime for its dimension on first use,
     * which the index bean below triggers at startup.
     */
    @Bean
    @ConditionalOnProperty(prefix = "argus.encoder", name = "provider", havingValue = "remote")
    public TextEncoder remoteTextEncoder(EmbeddingRuntimeClient client, ArgusProperties argusProperties) {
        return new RemoteTextEncoder(client, argusProperties.getEncoder());
    }

    @Bean
    public VectorSearchEngine vectorSearchEngine(TextEncoder textEncoder,
                                                 ArgusProperties argusProperties,
                                                 ObjectMapper objectMapper) {
        ArgusProperties.Search search = argusProperties.getSearch();
        log.info("Creating {} vector index, dimension={}", search.getIndexType(), textEncoder.dimension());
        return new VectorSearchEngine(search.getIndexType(), textEncoder.dimension(),
                IndexParameters.from(search), objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "argus.snooze", name = "store", havingValue = "redis", matchIfMissing = true)
    public SnoozeStore redisSnoozeStore(ReactiveRedisTemplate<String, String> reactiveRedisTemplate,
                                        ObjectMapper objectMapper,
                                        ArgusProperties argusProperties) {
        ArgusProperties.Snooze snooze = argusProperties.getSnooze();
        return new RedisSnoozeStore(reactiveRedisTemplate, objectMapper, snooze.getKeyPrefix(),
                snooze.getAuditRetention());
    }

    @Bean
    @ConditionalOnProperty(prefix = "argus.snooze", name = "store", havingValue = "memory")
    public SnoozeStore inMemorySnoozeStore(Clock clock) {
        log.warn("Snooze state is held in memory and will not survive a restart");
        return new InMemorySnoozeStore(clock);
    }
}
