package eu.virtualparadox.paperrank.rank.aggregate;

import eu.virtualparadox.paperrank.rank.evaluate.RubricScore;

/**
 * Inputs a final score was computed from.
 *
 * @param initialScore retrieval score
 * @param rubric       rubric score, {@code null} when evaluation was skipped
 * @param reviewSignal normalised corpus review signal, {@code null} without reviews
 */
public record ScoreComponents(double initialScore, RubricScore rubric, Double reviewSignal) {
}
