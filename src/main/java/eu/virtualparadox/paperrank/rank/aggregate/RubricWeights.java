package eu.virtualparadox.paperrank.rank.aggregate;

import eu.virtualparadox.paperrank.rank.evaluate.RubricScore;

/**
 * Convex weights of the four rubric dimensions.
 * Instances are always normalised so the weights sum to 1.
 */
public record RubricWeights(double relevance, double novelty, double impact, double practicality) {

    private static final double EPSILON = 1e-9;

    public static RubricWeights of(final double relevance,
                                   final double novelty,
                                   final double impact,
                                   final double practicality) {
        if (relevance < 0 || novelty < 0 || impact < 0 || practicality < 0) {
            throw new IllegalStateException("Rubric weights must not be negative");
        }
        final double sum = relevance + novelty + impact + practicality;
        if (sum <= 0) {
            throw new IllegalStateException("At least one rubric weight must be positive");
        }
        if (Math.abs(sum - 1.0) < EPSILON) {
            return new RubricWeights(relevance, novelty, impact, practicality);
        }
        return new RubricWeights(relevance / sum, novelty / sum, impact / sum, practicality / sum);
    }

    public double combine(final RubricScore score) {
        return relevance * score.relevance()
                + novelty * score.novelty()
                + impact * score.impact()
                + practicality * score.practicality();
    }
}
