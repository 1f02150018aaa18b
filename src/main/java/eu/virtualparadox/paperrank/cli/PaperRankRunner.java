package eu.virtualparadox.paperrank.cli;

import eu.virtualparadox.paperrank.application.config.PipelineConfig;
import eu.virtualparadox.paperrank.query.model.ResearchQuery;
import eu.virtualparadox.paperrank.rank.aggregate.RankedResult;
import eu.virtualparadox.paperrank.review.PaperReviewManager;
import eu.virtualparadox.paperrank.review.ReviewOutcome;
import eu.virtualparadox.paperrank.review.ReviewRequest;
import eu.virtualparadox.paperrank.review.exception.FatalInputException;
import eu.virtualparadox.paperrank.review.exception.StageFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Command-line entry point.
 * <pre>
 * --venue=NeurIPS --year=2024
 * --research-description="..."  or  --research-interests=graph generation,drug discovery
 * [--top-k=50] [--model=gpt-4o-mini] [--min-rating=6] [--no-llm-eval]
 * </pre>
 * Without {@code --venue} nothing runs. The process exits with
 * {@value #EXIT_RUN_FAILED} when the run aborts and with
 * {@value #EXIT_INVALID_ARGUMENTS} on invalid arguments.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaperRankRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String OPT_VENUE = "venue";
    static final String OPT_YEAR = "year";
    static final String OPT_DESCRIPTION = "research-description";
    static final String OPT_INTERESTS = "research-interests";
    static final String OPT_TOP_K = "top-k";
    static final String OPT_MODEL = "model";
    static final String OPT_MIN_RATING = "min-rating";
    static final String OPT_NO_LLM_EVAL = "no-llm-eval";

    static final int EXIT_RUN_FAILED = 1;
    static final int EXIT_INVALID_ARGUMENTS = 2;

    private static final int RATIONALE_PREVIEW = 160;

    private final PaperReviewManager paperReviewManager;
    private final PipelineConfig pipelineConfig;

    private volatile int exitCode = 0;

    @Override
    public void run(final ApplicationArguments args) {
        final Optional<ReviewRequest> request;
        try {
            applyOverrides(args, pipelineConfig);
            request = parse(args);
        } catch (FatalInputException | IllegalStateException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            exitCode = EXIT_INVALID_ARGUMENTS;
            return;
        }
        if (request.isEmpty()) {
            log.info("No --venue given, nothing to review");
            return;
        }

        try {
            final ReviewOutcome outcome = paperReviewManager.run(request.get());
            logRanking(outcome);
        } catch (StageFailedException e) {
            log.error("Review failed at {}: {}", e.getStage(), e.getCause().getMessage());
            exitCode = EXIT_RUN_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static Optional<ReviewRequest> parse(final ApplicationArguments args) {
        final String venue = single(args, OPT_VENUE);
        if (venue == null) {
            return Optional.empty();
        }
        final String year = single(args, OPT_YEAR);
        if (year == null) {
            throw new FatalInputException("--year is required");
        }

        final String description = single(args, OPT_DESCRIPTION);
        final String interests = single(args, OPT_INTERESTS);
        final List<String> terms = interests == null
                ? List.of()
                : Arrays.stream(interests.split(","))
                        .map(String::trim)
                        .filter(StringUtils::isNotEmpty)
                        .toList();

        return Optional.of(new ReviewRequest(venue, parseInt(OPT_YEAR, year),
                new ResearchQuery(description, terms, ResearchQuery.DEFAULT_LANGUAGE)));
    }

    static void applyOverrides(final ApplicationArguments args, final PipelineConfig config) {
        final String topK = single(args, OPT_TOP_K);
        if (topK != null) {
            config.setTopK(parseInt(OPT_TOP_K, topK));
        }
        final String model = single(args, OPT_MODEL);
        if (model != null) {
            config.setModelIdentifier(model);
        }
        final String minRating = single(args, OPT_MIN_RATING);
        if (minRating != null) {
            try {
                config.setMinRating(Double.valueOf(minRating));
            } catch (NumberFormatException e) {
                throw new FatalInputException("--" + OPT_MIN_RATING + " must be a number: " + minRating);
            }
        }
        if (args.containsOption(OPT_NO_LLM_EVAL)) {
            config.setSkipLlmEvaluation(true);
        }
        config.validate();
    }

    private void logRanking(final ReviewOutcome outcome) {
        log.info("Keywords: {}", outcome.keywords());
        if (outcome.cancelled()) {
            log.warn("Run was cancelled, the ranking contains degraded entries");
        }
        for (final RankedResult result : outcome.ranking()) {
            final String rationale = result.components().rubric() == null
                    ? ""
                    : StringUtils.abbreviate(result.components().rubric().rationale(), RATIONALE_PREVIEW);
            log.info("#{} {} score={} initial={}{} {}",
                    result.rank(),
                    result.paperId(),
                    String.format("%.4f", result.finalScore()),
                    String.format("%.2f", result.components().initialScore()),
                    result.degraded() ? " [degraded]" : "",
                    rationale);
        }
    }

    private static String single(final ApplicationArguments args, final String name) {
        final List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0).trim();
    }

    private static int parseInt(final String name, final String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new FatalInputException("--" + name + " must be an integer: " + value);
        }
    }
}
