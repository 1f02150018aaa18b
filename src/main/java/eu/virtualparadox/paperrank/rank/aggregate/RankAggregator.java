package eu.virtualparadox.paperrank.rank.aggregate;

import eu.virtualparadox.paperrank.application.config.PipelineConfig;
import eu.virtualparadox.paperrank.corpus.model.PaperRecord;
import eu.virtualparadox.paperrank.corpus.signal.ReviewSignalResolver;
import eu.virtualparadox.paperrank.rank.evaluate.RubricScore;
import eu.virtualparadox.paperrank.rank.match.CandidateScore;
import eu.virtualparadox.paperrank.rank.select.RankingOrder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Combines retrieval score, rubric dimensions and review signal into the final ranking.
 * <p>
 * Full mode: the rubric part is the weighted sum of the four dimensions
 * ({@link RubricWeights}). It is blended with the initial score and the
 * review signal by {@code initial-score-weight} and
 * {@code review-signal-weight}; a missing review signal drops its share and
 * the remaining weights are renormalised. Fast mode (evaluation skipped, or a
 * candidate without rubric score) ranks on
 * {@code (1 - w) * initial + w * reviewSignal} with
 * {@code w = fast-mode-review-signal-weight}.
 * <p>
 * Ties are broken as in candidate selection ({@link RankingOrder}); the same
 * inputs always give the same ordering.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RankAggregator {

    private final PipelineConfig pipelineConfig;
    private final ReviewSignalResolver reviewSignalResolver;

    /**
     * @param candidates selected candidates
     * @param rubric     rubric scores by paper id; empty in fast mode
     * @param papers     corpus papers by id
     * @return ranked results, rank 1 first
     */
    public List<RankedResult> aggregate(final List<CandidateScore> candidates,
                                        final Map<String, RubricScore> rubric,
                                        final Map<String, PaperRecord> papers) {
        final RubricWeights weights = pipelineConfig.getRubricWeights();

        final List<Scored> scored = new ArrayList<>();
        for (final CandidateScore candidate : candidates) {
            final PaperRecord paper = papers.get(candidate.paperId());
            final Double signal = paper == null ? null : reviewSignalResolver.resolve(paper);
            final RubricScore rubricScore = pipelineConfig.isSkipLlmEvaluation() ? null : rubric.get(candidate.paperId());

            final double finalScore = rubricScore == null
                    ? fastScore(candidate.initialScore(), signal)
                    : fullScore(weights.combine(rubricScore), candidate.initialScore(), signal);

            final ScoreComponents components = new ScoreComponents(candidate.initialScore(), rubricScore, signal);
            final Double reviewAverage = paper == null ? null : paper.reviewAverage();
            scored.add(new Scored(new RankingOrder.Key(candidate.paperId(), finalScore, reviewAverage), components));
        }

        scored.sort((a, b) -> RankingOrder.COMPARATOR.compare(a.key(), b.key()));

        final List<RankedResult> results = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            final Scored s = scored.get(i);
            final boolean degraded = s.components().rubric() != null && !s.components().rubric().schemaValid();
            results.add(new RankedResult(s.key().paperId(), s.key().score(), i + 1, s.components(), degraded));
        }

        if (!results.isEmpty()) {
            log.info("Ranked {} papers, top: {} ({})", results.size(), results.get(0).paperId(), results.get(0).finalScore());
        }
        return List.copyOf(results);
    }

    double fullScore(final double rubricPart, final double initialScore, final Double signal) {
        final double initialWeight = pipelineConfig.getInitialScoreWeight();
        final double signalWeight = signal == null ? 0.0 : pipelineConfig.getReviewSignalWeight();
        final double rubricWeight = 1.0 - pipelineConfig.getInitialScoreWeight() - pipelineConfig.getReviewSignalWeight();
        if (initialWeight == 0.0 && signalWeight == 0.0) {
            return rubricPart;
        }

        final double total = rubricWeight + initialWeight + signalWeight;
        if (total <= 0.0) {
            return rubricPart;
        }
        final double sum = rubricWeight * rubricPart
                + initialWeight * initialScore
                + (signal == null ? 0.0 : signalWeight * signal);
        return sum / total;
    }

    double fastScore(final double initialScore, final Double signal) {
        if (signal == null) {
            return initialScore;
        }
        final double w = pipelineConfig.getFastModeReviewSignalWeight();
        return (1.0 - w) * initialScore + w * signal;
    }

    private record Scored(RankingOrder.Key key, ScoreComponents components) {
    }
}
