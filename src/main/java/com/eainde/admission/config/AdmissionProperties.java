package com.eainde.admission.config;

import com.eainde.admission.stage.decide.AggregationMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables of the admission pipeline, bound from {@code admission.*}.
 *
 * <pre>
 * admission:
 *   workflow:
 *     max-concurrent-applications: 4
 *   retry:
 *     max-attempts: 3
 *     initial-backoff: 500ms
 *   decision:
 *     review-threshold: 0.8
 *     aggregation: STRICT
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "admission")
public class AdmissionProperties {

    private Workflow workflow = new Workflow();
    private Retry retry = new Retry();
    private Classification classification = new Classification();
    private Extraction extraction = new Extraction();
    private Decision decision = new Decision();
    private Rules rules = new Rules();

    @Data
    public static class Workflow {
        /** Upper bound of applications advanced in parallel. */
        private int maxConcurrentApplications = 4;
        private String defaultEntity = "DE";
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(10);
    }

    @Data
    public static class Classification {
        private double confidenceThreshold = 0.5;
        private int excerptLength = 1000;
    }

    @Data
    public static class Extraction {
        /** An extraction stage with no document above this confidence fails. */
        private double minConfidence = 0.1;
        /** Fields from documents below this confidence are flagged low-confidence. */
        private double lowConfidenceThreshold = 0.5;
    }

    @Data
    public static class Decision {
        private double reviewThreshold = 0.8;
        private int topK = 5;
        private AggregationMode aggregation = AggregationMode.STRICT;
        private double lowConfidenceCutoff = 0.6;
        private double confidencePenalty = 0.85;
        /** Document labels every applicant of an entity must provide. */
        private Map<String, List<String>> requiredDocuments = new LinkedHashMap<>(Map.of(
                "DE", List.of("qualification-certificate"),
                "UK", List.of("qualification-certificate"),
                "CA", List.of("transcript")));
    }

    @Data
    public static class Rules {
        private String rulebookPath = "data/rulebook.pdf";
        private String indexPath = "data/rule-index.json";
        private int chunkSize = 1500;
        private int chunkOverlap = 200;
        private int embeddingDimension = 384;
        private boolean initializeOnStartup = true;
        private int queryTopK = 5;
    }
}
