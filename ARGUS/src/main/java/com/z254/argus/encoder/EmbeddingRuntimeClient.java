package com.z254.argus.encoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.argus.config.ArgusProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Client for the external embedding runtime.
 * <p>
 * Expects an OpenAI-style response: {@code {"data": [{"embedding": [...]}, ...]}}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "argus.encoder", name = "provider", havingValue = "remote")
public class EmbeddingRuntimeClient {

    private final WebClient webClient;
    private final ArgusProperties.Encoder.Remote config;

    public EmbeddingRuntimeClient(WebClient.Builder webClientBuilder, ArgusProperties argusProperties) {
        this.config = argusProperties.getEncoder().getRemote();
        this.webClient = webClientBuilder
                .baseUrl(config.getUrl())
                .build();
    }

    /**
     * Embed a batch of already-cleaned texts.
     */
    @CircuitBreaker(name = "embedding-runtime", fallbackMethod = "embedFallback")
    @Retry(name = "embedding-runtime")
    public Mono<List<float[]>> embed(List<String> texts) {
        Map<String, Object> body = Map.of(
                "model", config.getModel(),
                "input", texts
        );

        return webClient.post()
                .uri(config.getEmbedPath())
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout())
                .map(this::parseEmbeddings)
                .doOnError(error -> log.error("Embedding request failed: batch={}, error={}",
                        texts.size(), error.getMessage()));
    }

    /**
     * Fallback when the runtime is unavailable.
     */
    public Mono<List<float[]>> embedFallback(List<String> texts, Throwable throwable) {
        log.warn("Embedding runtime unavailable for batch of {}: {}", texts.size(), throwable.getMessage());
        return Mono.error(new EmbeddingUnavailableException(
                "Embedding runtime unavailable: " + throwable.getMessage(), throwable));
    }

    private List<float[]> parseEmbeddings(JsonNode json) {
        JsonNode data = json.get("data");
        if (data == null || !data.isArray()) {
            throw new EmbeddingUnavailableException("Embedding response has no data array", null);
        }
        List<float[]> out = new ArrayList<>(data.size());
        for (JsonNode item : data) {
            JsonNode embedding = item.get("embedding");
            float[] vector = new float[embedding.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = embedding.get(i).floatValue();
            }
            out.add(vector);
        }
        return out;
    }

    /**
     * Raised when the embedding runtime cannot produce vectors. Retryable.
     */
    public static class EmbeddingUnavailableException extends RuntimeException {
        public EmbeddingUnavailableException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
