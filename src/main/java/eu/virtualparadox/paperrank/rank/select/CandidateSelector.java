package eu.virtualparadox.paperrank.rank.select;

import eu.virtualparadox.paperrank.application.config.PipelineConfig;
import eu.virtualparadox.paperrank.corpus.model.PaperRecord;
import eu.virtualparadox.paperrank.rank.match.CandidateScore;
import eu.virtualparadox.paperrank.review.exception.InsufficientCandidatesException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Bounds the working set handed to rubric evaluation.
 * <p>
 * Candidates below {@code min-relevance-score}, or with a review average
 * below {@code min-rating}, are dropped (papers without reviews pass the
 * rating floor). The rest is ordered by {@link RankingOrder} and cut to
 * {@code top-k}. A small or even empty selection is valid; only an empty
 * corpus is an error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateSelector {

    private final PipelineConfig pipelineConfig;

    /**
     * @param scores one score per corpus paper
     * @param papers corpus papers by id, for the review tie-break and the rating floor
     * @return at most {@code top-k} candidates, best first
     * @throws InsufficientCandidatesException if {@code scores} is empty
     */
    public List<CandidateScore> select(final List<CandidateScore> scores, final Map<String, PaperRecord> papers) {
        if (scores.isEmpty()) {
            throw new InsufficientCandidatesException("No paper to select candidates from");
        }

        final Double minRating = pipelineConfig.getMinRating();
        final Comparator<CandidateScore> order = Comparator.comparing(
                (CandidateScore s) -> new RankingOrder.Key(s.paperId(), s.initialScore(), reviewAverage(papers, s.paperId())),
                RankingOrder.COMPARATOR);

        final List<CandidateScore> selected = scores.stream()
                .filter(s -> s.initialScore() >= pipelineConfig.getMinRelevanceScore())
                .filter(s -> meetsRating(reviewAverage(papers, s.paperId()), minRating))
                .sorted(order)
                .limit(pipelineConfig.getTopK())
                .toList();

        log.info("Selected {} of {} candidates (top-k {})", selected.size(), scores.size(), pipelineConfig.getTopK());
        return selected;
    }

    private static boolean meetsRating(final Double average, final Double minRating) {
        return minRating == null || average == null || average >= minRating;
    }

    private static Double reviewAverage(final Map<String, PaperRecord> papers, final String paperId) {
        final PaperRecord paper = papers.get(paperId);
        return paper == null ? null : paper.reviewAverage();
    }
}
