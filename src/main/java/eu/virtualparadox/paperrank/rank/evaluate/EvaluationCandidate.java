package eu.virtualparadox.paperrank.rank.evaluate;

/**
 * A selected candidate ready for rubric evaluation.
 *
 * @param context      distilled paper context
 * @param initialScore retrieval score, used by the fallback rule
 */
public record EvaluationCandidate(EvaluationContext context, double initialScore) {

    public String paperId() {
        return context.paperId();
    }
}
