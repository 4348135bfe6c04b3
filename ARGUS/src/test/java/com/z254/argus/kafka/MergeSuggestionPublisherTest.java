package com.z254.argus.kafka;

import com.z254.argus.config.ArgusProperties;
import com.z254.argus.domain.model.MergeSuggestion;
import com.z254.argus.grouping.AlertGroupingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MergeSuggestionPublisherTest {

    @Mock
    private AlertGroupingService groupingService;

    @Mock
    private TriageDecisionProducer producer;

    private MergeSuggestionPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new MergeSuggestionPublisher(groupingService, producer, new ArgusProperties());
    }

    @Test
    @SuppressWarnings("unchecked")
    void publishesEachPairOnce() {
        MergeSuggestion ab = new MergeSuggestion("g-a", "g-b", 0.9);
        MergeSuggestion ba = new MergeSuggestion("g-b", "g-a", 0.9);
        MergeSuggestion cd = new MergeSuggestion("g-c", "g-d", 0.86);
        when(groupingService.suggestMerges())
                .thenReturn(List.of(ab))
                .thenReturn(List.of(ba, cd));

        assertThat(publisher.publishNew()).isEqualTo(1);
        assertThat(publisher.publishNew()).isEqualTo(1);

        ArgumentCaptor<List<MergeSuggestion>> batches = ArgumentCaptor.forClass(List.class);
        verify(producer, times(2)).publishMergeSuggestions(batches.capture());
        assertThat(batches.getAllValues().get(1)).containsExactly(cd);
    }

    @Test
    void sendsNothingWithoutSuggestions() {
        when(groupingService.suggestMerges()).thenReturn(List.of());

        publisher.scheduledPublish();

        verify(producer, never()).publishMergeSuggestions(anyList());
    }

    @Test
    void pairKeyIgnoresOrder() {
        assertThat(MergeSuggestionPublisher.pairKey(new MergeSuggestion("x", "y", 0.9)))
                .isEqualTo(MergeSuggestionPublisher.pairKey(new MergeSuggestion("y", "x", 0.9)))
                .isEqualTo("x|y");
    }
}
