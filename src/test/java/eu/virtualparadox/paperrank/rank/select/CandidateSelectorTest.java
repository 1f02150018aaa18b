package eu.virtualparadox.paperrank.rank.select;

import eu.virtualparadox.paperrank.application.config.PipelineConfig;
import eu.virtualparadox.paperrank.corpus.model.PaperRecord;
import eu.virtualparadox.paperrank.rank.match.CandidateScore;
import eu.virtualparadox.paperrank.review.exception.InsufficientCandidatesException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static eu.virtualparadox.paperrank.corpus.PaperFixtures.paper;
import static eu.virtualparadox.paperrank.corpus.PaperFixtures.reviewed;
import static org.junit.jupiter.api.Assertions.*;

class CandidateSelectorTest {

    private PipelineConfig config;
    private CandidateSelector selector;

    private final Map<String, PaperRecord> papers = Map.of(
            "a", reviewed("a", "A", "", List.of(6.0)),
            "b", reviewed("b", "B", "", List.of(8.0)),
            "c", paper("c", "C", ""),
            "d", reviewed("d", "D", "", List.of(8.0)),
            "e", reviewed("e", "E", "", List.of(3.0)));

    @BeforeEach
    void setUp() {
        config = new PipelineConfig();
        selector = new CandidateSelector(config);
    }

    @Test
    @DisplayName("Orders by score, then review average, then paper id")
    void testOrder() {
        final List<CandidateScore> scores = List.of(
                score("c", 0.5), score("a", 0.5), score("d", 0.5), score("b", 0.5), score("e", 1.0));

        final List<String> ids = ids(selector.select(scores, papers));

        // b and d tie on average 8.0, c has no reviews and goes last among the 0.5s
        assertEquals(List.of("e", "b", "d", "a", "c"), ids);
    }

    @Test
    @DisplayName("Output never exceeds top-k and selection is idempotent")
    void testTopKAndIdempotence() {
        config.setTopK(2);
        final List<CandidateScore> scores = List.of(score("a", 0.2), score("b", 0.9), score("c", 0.0), score("d", 0.4));

        final List<CandidateScore> first = selector.select(scores, papers);
        final List<CandidateScore> second = selector.select(List.copyOf(first), papers);

        assertEquals(List.of("b", "d"), ids(first));
        assertEquals(first, second);
    }

    @Test
    @DisplayName("Zero-score candidates are a valid selection")
    void testZeroScores() {
        assertEquals(List.of("a", "c"), ids(selector.select(List.of(score("c", 0.0), score("a", 0.0)), papers)));
    }

    @Test
    @DisplayName("Relevance and rating floors drop candidates; unreviewed papers pass the rating floor")
    void testFloors() {
        config.setMinRelevanceScore(0.3);
        config.setMinRating(5.0);
        final List<CandidateScore> scores = List.of(
                score("a", 0.5), score("b", 0.2), score("c", 0.6), score("e", 0.9));

        assertEquals(List.of("c", "a"), ids(selector.select(scores, papers)));
    }

    @Test
    @DisplayName("An empty corpus is an error")
    void testEmpty() {
        assertThrows(InsufficientCandidatesException.class, () -> selector.select(List.of(), papers));
    }

    private static CandidateScore score(final String id, final double value) {
        return new CandidateScore(id, value, new TreeSet<>());
    }

    private static List<String> ids(final List<CandidateScore> scores) {
        return scores.stream().map(CandidateScore::paperId).toList();
    }
}
