package eu.virtualparadox.paperrank.corpus.signal;

import eu.virtualparadox.paperrank.corpus.model.PaperRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReviewSignalResolverTest {

    private final ReviewSignalResolver resolver = new ReviewSignalResolver(List.of(
            new TenPointRatingExtractor(),
            new FivePointRecommendationExtractor(),
            new InferredScaleExtractor()));

    @Test
    @DisplayName("NeurIPS and ICLR ratings are read on a 10-point scale")
    void testTenPoint() {
        assertEquals(0.7, resolver.resolve(paper("NeurIPS", 6.0, 8.0)), 1e-9);
        assertEquals(0.3, resolver.resolve(paper("iclr", 3.0)), 1e-9);
    }

    @Test
    @DisplayName("ICML recommendations are read on a 5-point scale")
    void testFivePoint() {
        assertEquals(0.6, resolver.resolve(paper("ICML", 3.0)), 1e-9);
    }

    @Test
    @DisplayName("Unknown venues infer the scale from the highest score")
    void testInferred() {
        assertEquals(0.8, resolver.resolve(paper("AAAI", 4.0)), 1e-9);
        assertEquals(0.7, resolver.resolve(paper("AAAI", 7.0)), 1e-9);
    }

    @Test
    @DisplayName("Signal is clamped to [0,1] and null without scores")
    void testBounds() {
        assertEquals(1.0, resolver.resolve(paper("ICML", 7.0)), 1e-9);
        assertNull(resolver.resolve(paper("NeurIPS")));
    }

    private static PaperRecord paper(final String venue, final Double... scores) {
        return PaperRecord.builder().id("p").venue(venue).reviewScores(List.of(scores)).build();
    }
}
