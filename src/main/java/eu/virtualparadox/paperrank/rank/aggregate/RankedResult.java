package eu.virtualparadox.paperrank.rank.aggregate;

/**
 * One entry of the final ranking.
 *
 * @param paperId    paper id
 * @param finalScore aggregated score
 * @param rank       1-based position
 * @param components inputs of the final score
 * @param degraded   {@code true} if the rubric part came from the fallback rule
 */
public record RankedResult(String paperId, double finalScore, int rank, ScoreComponents components, boolean degraded) {
}
