package eu.virtualparadox.paperrank.rank.evaluate;

import eu.virtualparadox.paperrank.application.config.PipelineConfig;
import eu.virtualparadox.paperrank.application.executor.EvaluationExecutor;
import eu.virtualparadox.paperrank.cache.KeyValueStore;
import eu.virtualparadox.paperrank.generation.TextGenerationService;
import eu.virtualparadox.paperrank.review.exception.GenerationTimeoutException;
import eu.virtualparadox.paperrank.review.exception.SchemaViolationException;
import eu.virtualparadox.paperrank.review.exception.UpstreamUnavailableException;
import eu.virtualparadox.paperrank.util.CancellationSignal;
import eu.virtualparadox.paperrank.util.Fingerprints;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Scores every selected candidate with one structured rubric call.
 * <p>
 * Per candidate the response is decoded strictly; a schema violation or a
 * timeout is retried with the same context up to
 * {@code max-evaluation-retries} times. When the budget is spent, or the
 * generator is unreachable, the candidate gets a degraded score
 * ({@link RubricScore#degraded}) and the batch continues. Candidates are
 * evaluated concurrently on the {@link EvaluationExecutor} and collected by
 * paper id. After cancellation no new call is issued: finished results are
 * kept and the remaining candidates are degraded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UnifiedEvaluator {

    static final String REASON_CANCELLED = "Evaluation cancelled before a rubric score was produced";

    private final TextGenerationService textGenerationService;
    private final RubricPromptBuilder rubricPromptBuilder;
    private final RubricResponseDecoder rubricResponseDecoder;
    private final PipelineConfig pipelineConfig;
    private final KeyValueStore<RubricScore> rubricStore;
    private final EvaluationExecutor evaluationExecutor;

    /**
     * @return one rubric score per candidate, keyed by paper id, in candidate order
     */
    public Map<String, RubricScore> evaluate(final List<EvaluationCandidate> candidates,
                                             final CancellationSignal cancellation) {
        final Map<String, CompletableFuture<RubricScore>> futures = new LinkedHashMap<>();
        for (final EvaluationCandidate candidate : candidates) {
            final CompletableFuture<RubricScore> future = CompletableFuture
                    .supplyAsync(() -> evaluateOne(candidate, cancellation), evaluationExecutor)
                    .exceptionally(e -> {
                        log.warn("Evaluation of {} failed unexpectedly", candidate.paperId(), e);
                        return RubricScore.degraded(candidate.paperId(), candidate.initialScore(),
                                "Evaluation failed: " + e.getMessage());
                    });
            futures.put(candidate.paperId(), future);
        }

        final Map<String, RubricScore> scores = new LinkedHashMap<>();
        futures.forEach((paperId, future) -> scores.put(paperId, future.join()));

        final long degraded = scores.values().stream().filter(s -> !s.schemaValid()).count();
        log.info("Rubric scored {} candidates, {} degraded", scores.size(), degraded);
        return scores;
    }

    RubricScore evaluateOne(final EvaluationCandidate candidate, final CancellationSignal cancellation) {
        final String paperId = candidate.paperId();
        final String key = Fingerprints.of("rubric", paperId, candidate.context().fingerprint(),
                pipelineConfig.getModelIdentifier());

        final Optional<RubricScore> cached = rubricStore.get(key);
        if (cached.isPresent()) {
            log.debug("Rubric cache hit for {}", paperId);
            return cached.get();
        }

        final int attempts = 1 + pipelineConfig.getMaxEvaluationRetries();
        String lastFailure = "no attempt made";
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (cancellation.isCancelled()) {
                log.warn("Run cancelled, {} is ranked with a degraded score", paperId);
                return RubricScore.degraded(paperId, candidate.initialScore(), REASON_CANCELLED);
            }
            try {
                final String raw = textGenerationService.generate(rubricPromptBuilder.build(candidate.context()));
                final RubricScore score = rubricResponseDecoder.decode(paperId, raw);
                rubricStore.put(key, score);
                log.debug("Rubric for {}: r={} n={} i={} p={}", paperId,
                        score.relevance(), score.novelty(), score.impact(), score.practicality());
                return score;
            } catch (SchemaViolationException | GenerationTimeoutException e) {
                lastFailure = e.getMessage();
                log.warn("Rubric attempt {}/{} for {} rejected: {}", attempt, attempts, paperId, lastFailure);
            } catch (UpstreamUnavailableException e) {
                log.warn("Generator unavailable for {}, using degraded score: {}", paperId, e.getMessage());
                return RubricScore.degraded(paperId, candidate.initialScore(), "Generator unavailable: " + e.getMessage());
            }
        }

        log.warn("No valid rubric for {} after {} attempts, using degraded score", paperId, attempts);
        return RubricScore.degraded(paperId, candidate.initialScore(),
                "No valid rubric after " + attempts + " attempts: " + lastFailure);
    }
}
