package eu.virtualparadox.paperrank.review;

import eu.virtualparadox.paperrank.application.config.PipelineConfig;
import eu.virtualparadox.paperrank.application.executor.RunExecutor;
import eu.virtualparadox.paperrank.corpus.model.PaperRecord;
import eu.virtualparadox.paperrank.corpus.service.CorpusService;
import eu.virtualparadox.paperrank.query.keyword.KeywordExtractor;
import eu.virtualparadox.paperrank.query.synonym.SynonymExpander;
import eu.virtualparadox.paperrank.query.synonym.SynonymSet;
import eu.virtualparadox.paperrank.rank.aggregate.RankAggregator;
import eu.virtualparadox.paperrank.rank.aggregate.RankedResult;
import eu.virtualparadox.paperrank.rank.evaluate.EvaluationCandidate;
import eu.virtualparadox.paperrank.rank.evaluate.EvaluationContextBuilder;
import eu.virtualparadox.paperrank.rank.evaluate.RubricScore;
import eu.virtualparadox.paperrank.rank.evaluate.UnifiedEvaluator;
import eu.virtualparadox.paperrank.rank.match.CandidateMatcher;
import eu.virtualparadox.paperrank.rank.match.CandidateScore;
import eu.virtualparadox.paperrank.rank.select.CandidateSelector;
import eu.virtualparadox.paperrank.review.exception.StageFailedException;
import eu.virtualparadox.paperrank.util.CancellationSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static eu.virtualparadox.paperrank.review.ERunStatus.*;

/**
 * Drives a review run through its stages:
 * keywords, synonyms, candidate scoring, selection, rubric evaluation and ranking.
 * <p>
 * Any failure up to candidate selection aborts the run ({@link ERunStatus#FAILED}
 * with the stage recorded). Later stages degrade per candidate and always
 * reach {@link ERunStatus#DONE}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaperReviewManager {

    private final KeywordExtractor keywordExtractor;
    private final SynonymExpander synonymExpander;
    private final CorpusService corpusService;
    private final CandidateMatcher candidateMatcher;
    private final CandidateSelector candidateSelector;
    private final EvaluationContextBuilder evaluationContextBuilder;
    private final UnifiedEvaluator unifiedEvaluator;
    private final RankAggregator rankAggregator;
    private final PipelineConfig pipelineConfig;
    private final RunRegistry registry;
    private final RunExecutor runExecutor;

    /**
     * Queues a run on the run executor and returns immediately.
     */
    public ReviewRun submit(final ReviewRequest request) {
        final ReviewRun run = registry.createRun(request);
        runExecutor.submit(() -> process(run));
        return run;
    }

    /**
     * Executes a run on the calling thread.
     *
     * @throws StageFailedException if the run aborts
     */
    public ReviewOutcome run(final ReviewRequest request) {
        return execute(registry.createRun(request));
    }

    public Optional<ReviewRun> getRun(final long runId) {
        return registry.getRun(runId);
    }

    /**
     * @return {@code false} if the run is unknown or already ended
     */
    public boolean cancel(final long runId) {
        final boolean cancelled = registry.cancel(runId);
        if (cancelled) {
            log.info("Run {} cancellation requested", runId);
        }
        return cancelled;
    }

    private void process(final ReviewRun run) {
        try {
            execute(run);
        } catch (StageFailedException e) {
            // already recorded on the run
            log.debug("Run {} ended as {}", run.getId(), run.getStatus());
        }
    }

    ReviewOutcome execute(final ReviewRun run) {
        final ReviewRequest request = run.getRequest();
        final CancellationSignal cancellation = run.getCancellation();
        ERunStatus stage = KEYWORDS_READY;
        try {
            final List<String> keywords = keywordExtractor.extract(request.query());
            advance(run, KEYWORDS_READY);

            stage = SYNONYMS_READY;
            final List<SynonymSet> synonyms = synonymExpander.expand(keywords, cancellation);
            advance(run, SYNONYMS_READY);

            stage = CANDIDATES_SCORED;
            final Map<String, PaperRecord> papers = byId(corpusService.load(request.venue(), request.year()));
            final List<CandidateScore> scores = candidateMatcher.score(List.copyOf(papers.values()), synonyms);
            advance(run, CANDIDATES_SCORED);

            stage = CANDIDATES_SELECTED;
            final List<CandidateScore> selected = candidateSelector.select(scores, papers);
            advance(run, CANDIDATES_SELECTED);

            stage = RUBRIC_SCORED;
            final Map<String, RubricScore> rubric = evaluate(request, keywords, selected, papers, cancellation);
            advance(run, RUBRIC_SCORED);

            stage = RANKED;
            final List<RankedResult> ranking = rankAggregator.aggregate(selected, rubric, papers);
            advance(run, RANKED);

            final ReviewOutcome outcome = new ReviewOutcome(ranking, scores, selected, rubric, keywords, synonyms,
                    cancellation.isCancelled());
            run.complete(outcome);
            log.info("Run {} -> {}", run.getId(), DONE);
            return outcome;
        } catch (RuntimeException e) {
            log.error("Run {} failed at {}", run.getId(), stage, e);
            run.fail(stage, e.getMessage());
            throw new StageFailedException(stage, e);
        }
    }

    private Map<String, RubricScore> evaluate(final ReviewRequest request,
                                              final List<String> keywords,
                                              final List<CandidateScore> selected,
                                              final Map<String, PaperRecord> papers,
                                              final CancellationSignal cancellation) {
        if (pipelineConfig.isSkipLlmEvaluation()) {
            log.info("Rubric evaluation skipped, ranking on initial score and review signal");
            return Map.of();
        }
        final List<EvaluationCandidate> candidates = selected.stream()
                .map(s -> new EvaluationCandidate(
                        evaluationContextBuilder.build(papers.get(s.paperId()), request.query(), keywords),
                        s.initialScore()))
                .toList();
        return unifiedEvaluator.evaluate(candidates, cancellation);
    }

    private static void advance(final ReviewRun run, final ERunStatus next) {
        run.advance(next);
        log.info("Run {} -> {}", run.getId(), next);
    }

    private static Map<String, PaperRecord> byId(final List<PaperRecord> papers) {
        final Map<String, PaperRecord> byId = new LinkedHashMap<>();
        for (final PaperRecord paper : papers) {
            if (byId.putIfAbsent(paper.id(), paper) != null) {
                log.debug("Duplicate paper id {} ignored", paper.id());
            }
        }
        return byId;
    }
}
