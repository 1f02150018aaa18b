package eu.virtualparadox.paperrank.rank.evaluate;

import eu.virtualparadox.paperrank.corpus.model.PaperRecord;
import eu.virtualparadox.paperrank.query.model.ResearchQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class EvaluationContextBuilderTest {

    private final EvaluationContextBuilder builder = new EvaluationContextBuilder();

    @Test
    @DisplayName("Long fields are cut to their limits")
    void testTruncation() {
        final PaperRecord paper = PaperRecord.builder()
                .id("p")
                .title("Title")
                .abstractText("a".repeat(3000))
                .keywords(List.of("k1", "k2", "k3", "k4", "k5", "k6", "k7", "k8", "k9", "k10"))
                .decisionComment("c".repeat(900))
                .reviewTexts(Collections.nCopies(7, "r".repeat(400)))
                .reviewScores(List.of(6.0, 8.0))
                .build();

        final EvaluationContext context = builder.build(paper, ResearchQuery.ofTerms(List.of("x")), List.of("x"));

        assertEquals(EvaluationContextBuilder.MAX_ABSTRACT, context.abstractText().length());
        assertEquals(EvaluationContextBuilder.MAX_KEYWORDS, context.keywords().size());
        assertEquals(EvaluationContextBuilder.MAX_DECISION_COMMENT, context.decisionComment().length());
        assertThat(context.reviewSummary())
                .contains("average 7.00")
                .contains("Review 5:")
                .doesNotContain("Review 6:")
                .contains("2 more reviews omitted");
        assertEquals("N/A", context.decision());
        assertEquals("Keywords: x", context.researchInterest());
    }

    @Test
    @DisplayName("Description is the research interest when given; fingerprint follows the content")
    void testInterestAndFingerprint() {
        final PaperRecord paper = PaperRecord.builder().id("p").title("T").build();

        final EvaluationContext described = builder.build(paper,
                ResearchQuery.ofDescription(" molecule generation "), List.of("molecule generation"));
        final EvaluationContext same = builder.build(paper,
                ResearchQuery.ofDescription("molecule generation"), List.of("other"));
        final EvaluationContext other = builder.build(paper,
                ResearchQuery.ofTerms(List.of("x")), List.of("x"));

        assertEquals("molecule generation", described.researchInterest());
        assertEquals("No review data available.", described.reviewSummary());
        assertEquals(described.fingerprint(), same.fingerprint());
        assertNotEquals(described.fingerprint(), other.fingerprint());
    }
}
