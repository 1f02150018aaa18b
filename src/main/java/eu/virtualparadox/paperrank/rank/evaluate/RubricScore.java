package eu.virtualparadox.paperrank.rank.evaluate;

/**
 * Structured evaluation of one candidate. Every dimension is in [0,1].
 * {@code reviewSummary} distils the reviews for the report and
 * {@code fieldInsights} names the corpus fields the evaluation relied on;
 * both are empty when the generator left them out.
 * A score with {@code schemaValid == false} was produced by the fallback
 * rule and not by the generator.
 */
public record RubricScore(String paperId,
                          double relevance,
                          double novelty,
                          double impact,
                          double practicality,
                          String rationale,
                          String reviewSummary,
                          String fieldInsights,
                          boolean schemaValid) {

    public static final double NEUTRAL = 0.5;

    /**
     * Fallback score: relevance carries the retrieval score, the other
     * dimensions sit at the neutral midpoint.
     */
    public static RubricScore degraded(final String paperId, final double initialScore, final String reason) {
        return new RubricScore(paperId, initialScore, NEUTRAL, NEUTRAL, NEUTRAL, reason, "", "", false);
    }
}
