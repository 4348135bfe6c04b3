package com.z254.argus.config;

import com.z254.argus.search.IndexType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the ARGUS service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Text encoder selection and limits</li>
 *     <li>Grouping rules, similarity weights and windows</li>
 *     <li>Vector index strategy, tuning targets and snapshots</li>
 *     <li>Noise ranker model, cache and dynamic threshold</li>
 *     <li>Snooze bounds, audit retention and thresholds persistence</li>
 *     <li>Kafka topics and pipeline timeouts</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "argus")
public class ArgusProperties {

    private final Encoder encoder = new Encoder();
    private final Rules rules = new Rules();
    private final Search search = new Search();
    private final Ranker ranker = new Ranker();
    private final Grouping grouping = new Grouping();
    private final Snooze snooze = new Snooze();
    private final Thresholds thresholds = new Thresholds();
    private final Pipeline pipeline = new Pipeline();
    private final Kafka kafka = new Kafka();

    /**
     * Text encoder configuration.
     */
    @Data
    public static class Encoder {
        /** Encoder implementation: {@code hashing} (in-process) or {@code remote} */
        private String provider = "hashing";

        /** Embedding dimension for the in-process encoder */
        @Positive
        private int dimension = 384;

        /** Input text is cleaned and truncated to this many characters */
        @Positive
        private int maxInputChars = 512;

        /** Version tag reported by the in-process encoder */
        private String modelVersion = "hashing-v1";

        private final Remote remote = new Remote();

        @Data
        public static class Remote {
            private String url = "http://localhost:8090";
            private String embedPath = "/v1/embeddings";
            private String model = "all-MiniLM-L6-v2";
            private Duration timeout = Duration.ofSeconds(5);
        }
    }

    /**
     * Grouping rule configuration.
     */
    @Data
    public static class Rules {
        /** Location of the YAML rule document; a missing file yields an empty rule set */
        private String location = "classpath:grouping-rules.yml";

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double defaultSimilarityThreshold = 0.7;

        private Duration defaultTimeWindow = Duration.ofMinutes(15);
    }

    /**
     * Vector search engine configuration.
     */
    @Data
    public static class Search {
        private IndexType indexType = IndexType.HNSW;

        /** Default number of neighbours returned */
        @Positive
        private int defaultK = 10;

        /** Minimum similarity score kept in results */
        private double similarityThreshold = 0.5;

        /** Snapshot base path; {@code .index} and {@code .meta} are appended */
        private String snapshotPath = "data/index/alerts";

        /** Interval between snapshots and compaction checks */
        private Duration maintenanceInterval = Duration.ofMinutes(10);

        /** Rebuild the index once this share of entries is tombstoned */
        private double compactionRatio = 0.2;

        private final Hnsw hnsw = new Hnsw();
        private final Ivf ivf = new Ivf();
        private final Lsh lsh = new Lsh();
        private final Pq pq = new Pq();
        private final Tuner tuner = new Tuner();

        @Data
        public static class Hnsw {
            private int m = 16;
            private int efConstruction = 200;
            private int efSearch = 64;
        }

        @Data
        public static class Ivf {
            private int nlist = 100;
            private int nprobe = 10;
        }

        @Data
        public static class Lsh {
            /** Signature bits; 0 means twice the dimension */
            private int nbits = 0;
        }

        @Data
        public static class Pq {
            /** Number of sub-vectors; must divide the dimension */
            private int subVectors = 16;
            /** Bits per sub-vector code */
            private int bits = 8;
            private int opqIterations = 5;
        }

        @Data
        public static class Tuner {
            private double targetP99Ms = 10.0;
            private double minRecall = 0.95;
            private int recallK = 10;
            private List<Integer> hnswM = new ArrayList<>(List.of(8, 16, 32, 64));
            private List<Integer> hnswEfConstruction = new ArrayList<>(List.of(100, 200, 400));
            private List<Integer> hnswEfSearch = new ArrayList<>(List.of(16, 32, 64, 128, 256));
            private List<Integer> pqSubVectors = new ArrayList<>(List.of(8, 16, 32));
            private List<Integer> pqBits = new ArrayList<>(List.of(4, 6, 8));
            private List<Integer> opqHnswM = new ArrayList<>(List.of(8, 16, 32));
        }
    }

    /**
     * Noise ranker configuration.
     */
    @Data
    public static class Ranker {
        /** Model bundle location watched for promotions */
        private String modelPath = "data/models/noise-ranker.json";

        private Duration reloadCheckInterval = Duration.ofMinutes(1);

        /** Ceiling on the observed false-negative rate before backing off */
        private double falseNegativeTarget = 0.02;

        /** Added to the nominal threshold while the ceiling is exceeded */
        private double thresholdBoost = 0.1;

        /** Cap on the effective threshold */
        private double maxEffectiveThreshold = 0.9;

        private Duration scoreCacheTtl = Duration.ofMinutes(5);
        private long scoreCacheMaxSize = 100_000;

        @Positive
        private int maxLexicalFeatures = 100;

        private List<String> criticalServices = new ArrayList<>(List.of("api", "database", "payment", "auth"));
        private double criticalServiceWeight = 5.0;
        private double defaultServiceWeight = 3.0;

        /** Alerts per hour assumed for services without a profile */
        private double defaultAlertRate = 10.0;
        private double defaultFalsePositiveRate = 0.1;

        /** Per-service profiles keyed by service name */
        private Map<String, ServiceProfile> serviceProfiles = new HashMap<>();

        private final Forest forest = new Forest();

        @Data
        public static class ServiceProfile {
            private Double criticality;
            private Double alertRate;
            private Double falsePositiveRate;
        }

        @Data
        public static class Forest {
            private int trees = 200;
            private int maxDepth = 15;
            private int minSamplesSplit = 5;
            private int minSamplesLeaf = 2;
            private long seed = 42L;
        }
    }

    /**
     * Grouping service configuration.
     */
    @Data
    public static class Grouping {
        private double labelWeight = 0.4;
        private double nameWeight = 0.3;
        private double contextWeight = 0.3;

        /** Representative similarity above which two groups are suggested for merge */
        private double mergeSuggestionThreshold = 0.85;

        private Duration expiryInterval = Duration.ofSeconds(60);

        /** Closed groups retained for merge suggestions */
        private int closedRetention = 1000;
    }

    /**
     * Snooze configuration.
     */
    @Data
    public static class Snooze {
        /** Backing store: {@code redis} or {@code memory} */
        private String store = "redis";

        @NotBlank
        private String keyPrefix = "argus:snooze";

        private Duration minDuration = Duration.ofMinutes(5);
        private Duration maxDuration = Duration.ofHours(24);
        private Duration auditRetention = Duration.ofDays(30);
        private Duration auditCleanupInterval = Duration.ofHours(1);
    }

    /**
     * Threshold control loop configuration.
     */
    @Data
    public static class Thresholds {
        private String configPath = "data/thresholds.json";
        private Duration calibrationInterval = Duration.ofHours(1);

        /** Outcomes required before a calibration run adjusts anything */
        private int minSamples = 100;

        /** Sliding window of suppression outcomes */
        private int outcomeWindow = 5000;
    }

    /**
     * Triage pipeline configuration.
     */
    @Data
    public static class Pipeline {
        private Duration stageTimeout = Duration.ofSeconds(2);
        private int similarK = 5;
        private double similarThreshold = 0.6;
        private boolean indexAlerts = true;
    }

    /**
     * Kafka topics.
     */
    @Data
    public static class Kafka {
        /** Kafka listeners and producers are only wired when enabled */
        private boolean enabled = true;
        private String consumerGroup = "argus-triage";
        private int partitions = 6;
        private short replicas = 1;

        /** Upper bound on one alert's pass through the pipeline before the offset is acknowledged */
        private Duration processTimeout = Duration.ofSeconds(10);

        private Duration mergeSuggestionInterval = Duration.ofMinutes(5);

        /** How long a published merge pair is remembered to avoid republishing it */
        private Duration mergeSuggestionDedupWindow = Duration.ofHours(24);

        private final Topics topics = new Topics();

        @Data
        public static class Topics {
            private String alertsInput = "argus.alerts.incoming";
            private String triageDecisions = "argus.alerts.triaged";
            private String mergeSuggestions = "argus.groups.merge-suggestions";
            private String suppressionFeedback = "argus.alerts.feedback";
        }
    }
}
