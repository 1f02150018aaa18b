package eu.virtualparadox.paperrank.review;

import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.paperrank.application.config.PipelineConfig;
import eu.virtualparadox.paperrank.application.config.ResilienceConfig;
import eu.virtualparadox.paperrank.application.executor.EvaluationExecutor;
import eu.virtualparadox.paperrank.application.executor.ExecutorFixtures;
import eu.virtualparadox.paperrank.application.executor.ExpansionExecutor;
import eu.virtualparadox.paperrank.application.executor.RunExecutor;
import eu.virtualparadox.paperrank.cache.CaffeineKeyValueStore;
import eu.virtualparadox.paperrank.corpus.model.PaperRecord;
import eu.virtualparadox.paperrank.corpus.service.CorpusService;
import eu.virtualparadox.paperrank.corpus.signal.FivePointRecommendationExtractor;
import eu.virtualparadox.paperrank.corpus.signal.InferredScaleExtractor;
import eu.virtualparadox.paperrank.corpus.signal.ReviewSignalResolver;
import eu.virtualparadox.paperrank.corpus.signal.TenPointRatingExtractor;
import eu.virtualparadox.paperrank.generation.GenerationRequest;
import eu.virtualparadox.paperrank.generation.ScriptedTextGenerationService;
import eu.virtualparadox.paperrank.query.keyword.KeywordExtractor;
import eu.virtualparadox.paperrank.query.keyword.TermListDecoder;
import eu.virtualparadox.paperrank.query.model.ResearchQuery;
import eu.virtualparadox.paperrank.query.synonym.SynonymExpander;
import eu.virtualparadox.paperrank.rank.aggregate.RankAggregator;
import eu.virtualparadox.paperrank.rank.aggregate.RankedResult;
import eu.virtualparadox.paperrank.rank.evaluate.EvaluationContextBuilder;
import eu.virtualparadox.paperrank.rank.evaluate.RubricPromptBuilder;
import eu.virtualparadox.paperrank.rank.evaluate.RubricResponseDecoder;
import eu.virtualparadox.paperrank.rank.evaluate.RubricScore;
import eu.virtualparadox.paperrank.rank.evaluate.UnifiedEvaluator;
import eu.virtualparadox.paperrank.rank.match.CandidateMatcher;
import eu.virtualparadox.paperrank.rank.match.CandidateScore;
import eu.virtualparadox.paperrank.rank.select.CandidateSelector;
import eu.virtualparadox.paperrank.review.exception.CorpusEmptyException;
import eu.virtualparadox.paperrank.review.exception.StageFailedException;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static eu.virtualparadox.paperrank.corpus.PaperFixtures.paper;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PaperReviewManagerTest {

    private static final String HIGH = "{\"relevance\":0.9,\"novelty\":0.8,\"impact\":0.8,\"practicality\":0.7,\"rationale\":\"close match\"}";
    private static final String LOW = "{\"relevance\":0.1,\"novelty\":0.3,\"impact\":0.2,\"practicality\":0.4,\"rationale\":\"off topic\"}";

    private final List<PaperRecord> corpus = new ArrayList<>();
    private ScriptedTextGenerationService generator;
    private PipelineConfig config;
    private RunRegistry registry;
    private ExpansionExecutor expansionExecutor;
    private EvaluationExecutor evaluationExecutor;
    private RunExecutor runExecutor;

    @BeforeEach
    void setUp() {
        generator = new ScriptedTextGenerationService();
        generator.on(GenerationRequest.SCHEMA_SYNONYMS, r -> {
            if (r.context().contains("graph generation")) {
                return "[\"molecular graph synthesis\"]";
            }
            return r.context().contains("drug discovery") ? "[\"drug design\"]" : "[]";
        });
        generator.on(GenerationRequest.SCHEMA_RUBRIC, r -> r.context().contains("Title: Paper X") ? HIGH : LOW);

        config = new PipelineConfig();
        config.setUpstreamInitialBackoff(Duration.ofMillis(1));
        registry = new RunRegistry();
        expansionExecutor = ExecutorFixtures.expansion(2);
        evaluationExecutor = ExecutorFixtures.evaluation(2);
        runExecutor = ExecutorFixtures.run();

        corpus.add(paper("x", "Paper X", "A method for molecular graph synthesis applied to drug design."));
        corpus.add(paper("y", "Paper Y", "Image classification with vision transformers."));
        corpus.add(paper("z", "Paper Z", "Graph generation with diffusion models."));
    }

    @AfterEach
    void tearDown() {
        expansionExecutor.shutdown();
        evaluationExecutor.shutdown();
        runExecutor.shutdown();
    }

    @Test
    @DisplayName("Synonyms find papers the seed keywords miss; unmatched papers stay ranked")
    void testEndToEnd() {
        final ReviewOutcome outcome = manager().run(request());

        assertThat(outcome.keywords()).containsExactly("graph generation", "drug discovery");
        final CandidateScore x = score(outcome, "x");
        final CandidateScore y = score(outcome, "y");
        assertEquals(1.0, x.initialScore());
        assertThat(x.matchedTerms()).containsExactly("drug design", "molecular graph synthesis");
        assertEquals(0.0, y.initialScore());
        assertEquals(0.5, score(outcome, "z").initialScore());

        assertThat(outcome.ranking()).extracting(RankedResult::paperId).contains("x", "y", "z");
        assertEquals("x", outcome.ranking().get(0).paperId());
        assertEquals(1, outcome.ranking().get(0).rank());
        assertFalse(outcome.cancelled());
        assertEquals(ERunStatus.DONE, registry.getRun(1).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("An unparsable rubric degrades one paper without failing the run")
    void testDegradation() {
        generator.on(GenerationRequest.SCHEMA_RUBRIC, r -> {
            if (r.context().contains("Title: Paper Z")) {
                return "I would rather not answer in JSON.";
            }
            return r.context().contains("Title: Paper X") ? HIGH : LOW;
        });

        final ReviewOutcome outcome = manager().run(request());

        final RubricScore z = outcome.rubricScores().get("z");
        assertFalse(z.schemaValid());
        assertEquals(0.5, z.relevance());
        final RankedResult ranked = outcome.ranking().stream()
                .filter(r -> r.paperId().equals("z"))
                .findFirst()
                .orElseThrow();
        assertTrue(ranked.degraded());
        assertEquals(3, outcome.ranking().size());
    }

    @Test
    @DisplayName("A second run on the same inputs reuses the caches and ranks identically")
    void testIdempotent() {
        final PaperReviewManager manager = manager();

        final ReviewOutcome first = manager.run(request());
        final int synonymCalls = generator.calls(GenerationRequest.SCHEMA_SYNONYMS);
        final int rubricCalls = generator.calls(GenerationRequest.SCHEMA_RUBRIC);
        final ReviewOutcome second = manager.run(request());

        assertEquals(first.ranking(), second.ranking());
        assertEquals(synonymCalls, generator.calls(GenerationRequest.SCHEMA_SYNONYMS));
        assertEquals(rubricCalls, generator.calls(GenerationRequest.SCHEMA_RUBRIC));
    }

    @Test
    @DisplayName("An empty corpus fails the run at candidate scoring")
    void testEmptyCorpus() {
        corpus.clear();

        final StageFailedException e = assertThrows(StageFailedException.class, () -> manager().run(request()));

        assertEquals(ERunStatus.CANDIDATES_SCORED, e.getStage());
        assertInstanceOf(CorpusEmptyException.class, e.getCause());
        final ReviewRun run = registry.getRun(1).orElseThrow();
        assertEquals(ERunStatus.FAILED, run.getStatus());
        assertEquals(ERunStatus.CANDIDATES_SCORED, run.getFailedStage());
        assertNull(run.getOutcome());
    }

    @Test
    @DisplayName("Skipping rubric evaluation ranks on the initial score")
    void testFastMode() {
        config.setSkipLlmEvaluation(true);

        final ReviewOutcome outcome = manager().run(request());

        assertTrue(outcome.rubricScores().isEmpty());
        assertEquals(0, generator.calls(GenerationRequest.SCHEMA_RUBRIC));
        assertThat(outcome.ranking()).extracting(RankedResult::paperId).containsExactly("x", "z", "y");
    }

    @Test
    @DisplayName("Submitted runs execute in the background and can be polled")
    void testSubmit() throws InterruptedException {
        final PaperReviewManager manager = manager();

        final ReviewRun run = manager.submit(request());
        final long deadline = System.currentTimeMillis() + 10_000;
        while (!run.getStatus().isTerminal() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }

        assertEquals(ERunStatus.DONE, run.getStatus());
        assertSame(run, manager.getRun(run.getId()).orElseThrow());
        assertEquals("x", run.getOutcome().ranking().get(0).paperId());
        assertFalse(manager.cancel(run.getId()));
        assertFalse(manager.cancel(999));
    }

    @Test
    @DisplayName("Cancelling during evaluation still ends with a complete, partly degraded ranking")
    void testCancel() {
        evaluationExecutor.shutdown();
        evaluationExecutor = ExecutorFixtures.evaluation(1);
        final PaperReviewManager manager = manager();
        final AtomicBoolean first = new AtomicBoolean(true);
        generator.on(GenerationRequest.SCHEMA_RUBRIC, r -> {
            if (first.getAndSet(false)) {
                manager.cancel(1);
            }
            return HIGH;
        });

        final ReviewOutcome outcome = manager.run(request());

        assertTrue(outcome.cancelled());
        assertEquals(1, generator.calls(GenerationRequest.SCHEMA_RUBRIC));
        assertEquals(3, outcome.ranking().size());
        assertEquals(2, outcome.ranking().stream().filter(RankedResult::degraded).count());
        assertEquals(ERunStatus.DONE, registry.getRun(1).orElseThrow().getStatus());
    }

    private PaperReviewManager manager() {
        final ObjectMapper mapper = new ObjectMapper();
        final TermListDecoder decoder = new TermListDecoder(mapper);
        final ReviewSignalResolver signals = new ReviewSignalResolver(List.of(
                new TenPointRatingExtractor(), new FivePointRecommendationExtractor(), new InferredScaleExtractor()));
        return new PaperReviewManager(
                new KeywordExtractor(generator, decoder, config),
                new SynonymExpander(generator, decoder, config, new CaffeineKeyValueStore<>(100), expansionExecutor),
                new CorpusService((venue, year) -> List.copyOf(corpus), config,
                        RetryRegistry.of(ResilienceConfig.upstreamRetryConfig(config))),
                new CandidateMatcher(),
                new CandidateSelector(config),
                new EvaluationContextBuilder(),
                new UnifiedEvaluator(generator, new RubricPromptBuilder(), new RubricResponseDecoder(mapper), config,
                        new CaffeineKeyValueStore<>(100), evaluationExecutor),
                new RankAggregator(config, signals),
                config,
                registry,
                runExecutor);
    }

    private static ReviewRequest request() {
        return new ReviewRequest("NeurIPS", 2024, ResearchQuery.ofTerms(List.of("Graph Generation", "drug discovery")));
    }

    private static CandidateScore score(final ReviewOutcome outcome, final String paperId) {
        return outcome.candidateScores().stream()
                .filter(s -> s.paperId().equals(paperId))
                .findFirst()
                .orElseThrow();
    }
}
