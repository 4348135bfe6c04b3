package com.z254.argus.kafka;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.z254.argus.config.ArgusProperties;
import com.z254.argus.domain.model.MergeSuggestion;
import com.z254.argus.grouping.AlertGroupingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Periodically publishes advisory merge suggestions for groups, once per pair.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "argus.kafka", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MergeSuggestionPublisher {

    private final AlertGroupingService groupingService;
    private final TriageDecisionProducer producer;
    private final Cache<String, Boolean> published;

    public MergeSuggestionPublisher(AlertGroupingService groupingService,
                                    TriageDecisionProducer producer,
                                    ArgusProperties argusProperties) {
        this.groupingService = groupingService;
        this.producer = producer;
        this.published = Caffeine.newBuilder()
                .expireAfterWrite(argusProperties.getKafka().getMergeSuggestionDedupWindow())
                .maximumSize(100_000)
                .build();
    }

    @Scheduled(fixedDelayString = "${argus.kafka.merge-suggestion-interval:PT5M}")
    public void scheduledPublish() {
        int count = publishNew();
        if (count > 0) {
            log.info("Published {} merge suggestions", count);
        }
    }

    /**
     * Publish suggestions not yet published within the dedup window.
     *
     * @return number of suggestions sent
     */
    public int publishNew() {
        List<MergeSuggestion> fresh = groupingService.suggestMerges().stream()
                .filter(s -> published.asMap().putIfAbsent(pairKey(s), Boolean.TRUE) == null)
                .collect(Collectors.toList());
        if (fresh.isEmpty()) {
            return 0;
        }
        producer.publishMergeSuggestions(fresh);
        return fresh.size();
    }

    static String pairKey(MergeSuggestion suggestion) {
        String a = suggestion.getGroupIdA();
        String b = suggestion.getGroupIdB();
        return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
    }
}
