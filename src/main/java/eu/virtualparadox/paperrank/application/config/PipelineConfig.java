package eu.virtualparadox.paperrank.application.config;

import eu.virtualparadox.paperrank.rank.aggregate.RubricWeights;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Tunables of the review pipeline, bound from {@code paperrank.pipeline.*}.
 * Every option affects exactly one stage; see the field comments.
 */
@Configuration
@ConfigurationProperties(prefix = "paperrank.pipeline")
@Getter @Setter
public class PipelineConfig {

    // selection
    private int topK = 100;
    private double minRelevanceScore = 0.0;
    private Double minRating;
    private boolean acceptedOnly = true;

    // generation
    private String modelIdentifier = "gpt-4o-mini";
    private double temperature = 0.0;
    private Duration generationTimeout = Duration.ofSeconds(60);

    // keywords and synonyms
    private int maxKeywords = 10;
    private int minKeywords = 3;
    private int maxSynonymsPerKeyword = 10;

    // rubric evaluation
    private boolean skipLlmEvaluation = false;
    private int maxEvaluationRetries = 2;
    private double weightRelevance = 0.4;
    private double weightNovelty = 0.25;
    private double weightImpact = 0.25;
    private double weightPracticality = 0.1;

    // final blend
    private double initialScoreWeight = 0.0;
    private double reviewSignalWeight = 0.0;
    private double fastModeReviewSignalWeight = 0.3;

    // worker pools
    private int evaluationWorkers = 4;
    private int expansionWorkers = 4;
    private int generationWorkers = 8;

    // upstream retry
    private int upstreamMaxAttempts = 3;
    private Duration upstreamInitialBackoff = Duration.ofMillis(500);

    // memoization
    private boolean persistentCache = false;
    private Duration cacheTtl = Duration.ofHours(24);

    @PostConstruct
    public void validate() {
        if (topK <= 0) {
            throw new IllegalStateException("paperrank.pipeline.top-k must be positive, got " + topK);
        }
        if (maxKeywords <= 0 || minKeywords > maxKeywords) {
            throw new IllegalStateException("Invalid keyword bounds: min=" + minKeywords + ", max=" + maxKeywords);
        }
        if (maxSynonymsPerKeyword < 0 || maxEvaluationRetries < 0) {
            throw new IllegalStateException("Synonym and retry bounds must not be negative");
        }
        if (upstreamMaxAttempts < 1) {
            throw new IllegalStateException("paperrank.pipeline.upstream-max-attempts must be at least 1");
        }
        requireUnit("initial-score-weight", initialScoreWeight);
        requireUnit("review-signal-weight", reviewSignalWeight);
        requireUnit("fast-mode-review-signal-weight", fastModeReviewSignalWeight);
        if (initialScoreWeight + reviewSignalWeight > 1.0) {
            throw new IllegalStateException("initial-score-weight + review-signal-weight must not exceed 1");
        }
        // fails on negative or all-zero rubric weights
        getRubricWeights();
    }

    /**
     * @return the configured rubric weights, normalised to sum 1
     */
    public RubricWeights getRubricWeights() {
        return RubricWeights.of(weightRelevance, weightNovelty, weightImpact, weightPracticality);
    }

    private static void requireUnit(final String name, final double value) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalStateException("paperrank.pipeline." + name + " must be in [0,1], got " + value);
        }
    }
}
