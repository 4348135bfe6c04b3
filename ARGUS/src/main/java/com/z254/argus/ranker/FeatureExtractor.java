package com.z254.argus.ranker;

import com.z254.argus.domain.model.Alert;
import com.z254.argus.domain.model.AlertFeatures;
import com.z254.argus.domain.model.HistoricalContext;
import com.z254.argus.encoder.AlertText;
import com.z254.argus.encoder.TextEncoder;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Builds the ranker's feature blocks for an alert.
 * <p>
 * Temporal features are evaluated on the alert's fired-at time in UTC so that
 * scoring is reproducible.
 */
@Component
public class FeatureExtractor {

    static final int TEMPORAL_FEATURES = 6;
    static final int HISTORICAL_FEATURES = 8;
    static final int SERVICE_FEATURES = 5;

    private static final Set<String> PRODUCTION = Set.of("production", "prod");

    private final TextEncoder encoder;
    private final ServiceProfileProvider profiles;

    public FeatureExtractor(TextEncoder encoder, ServiceProfileProvider profiles) {
        this.encoder = encoder;
        this.profiles = profiles;
    }

    public AlertFeatures extract(Alert alert, HistoricalContext historical, TfidfVectorizer lexical) {
        String text = AlertText.of(alert);
        return assemble(alert, historical, encoder.embed(text), lexical.transform(text));
    }

    /**
     * Extract features for many alerts with one batched encoder call.
     */
    public List<AlertFeatures> extractBatch(List<Alert> alerts, List<HistoricalContext> historical,
                                            TfidfVectorizer lexical) {
        List<String> texts = alerts.stream().map(AlertText::of).toList();
        List<float[]> embeddings = encoder.embedBatch(texts);
        return IntStream.range(0, alerts.size())
                .mapToObj(i -> assemble(alerts.get(i), historical.get(i), embeddings.get(i),
                        lexical.transform(texts.get(i))))
                .toList();
    }

    /**
     * Width of a concatenated feature row for the given vocabulary size.
     */
    public int rowWidth(int vocabularySize) {
        return encoder.dimension() + vocabularySize + TEMPORAL_FEATURES + HISTORICAL_FEATURES + SERVICE_FEATURES;
    }

    private AlertFeatures assemble(Alert alert, HistoricalContext historical, float[] embedding, float[] lexical) {
        return AlertFeatures.builder()
                .textEmbedding(embedding)
                .lexicalFeatures(lexical)
                .temporalFeatures(temporal(alert))
                .historicalFeatures((historical != null ? historical : HistoricalContext.empty()).toFeatures())
                .serviceFeatures(service(alert))
                .build();
    }

    static float[] temporal(Alert alert) {
        ZonedDateTime at = alert.getFiredAt().atZone(ZoneOffset.UTC);
        int hour = at.getHour();
        DayOfWeek day = at.getDayOfWeek();
        boolean weekend = day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
        boolean night = hour >= 22 || hour <= 6;
        return new float[]{
                hour,
                day.getValue() - 1,
                at.getDayOfMonth(),
                at.getMonthValue(),
                weekend ? 1f : 0f,
                night ? 1f : 0f
        };
    }

    private float[] service(Alert alert) {
        String service = alert.effectiveService();
        String environment = alert.getEnvironment();
        boolean production = environment != null && PRODUCTION.contains(environment.toLowerCase(Locale.ROOT));
        return new float[]{
                (float) profiles.criticality(service),
                (float) profiles.alertRate(service),
                (float) profiles.falsePositiveRate(service),
                production ? 1f : 0f,
                (float) alert.getSeverity().score()
        };
    }
}
