package eu.virtualparadox.paperrank.review;

/**
 * Stages of a review run, in order. A run only moves forward; {@link #FAILED}
 * is reachable from any stage before {@link #DONE}.
 */
public enum ERunStatus {
    INIT,
    KEYWORDS_READY,
    SYNONYMS_READY,
    CANDIDATES_SCORED,
    CANDIDATES_SELECTED,
    RUBRIC_SCORED,
    RANKED,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
