package eu.virtualparadox.paperrank.rank.match;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Retrieval-stage score of one paper.
 *
 * @param paperId      paper id
 * @param initialScore share of keyword groups matched, in [0,1]
 * @param matchedTerms surface variants that hit, sorted
 */
public record CandidateScore(String paperId, double initialScore, SortedSet<String> matchedTerms) {

    public CandidateScore {
        if (initialScore < 0.0 || initialScore > 1.0) {
            throw new IllegalArgumentException("initial score out of range: " + initialScore);
        }
        matchedTerms = Collections.unmodifiableSortedSet(
                matchedTerms == null ? new TreeSet<>() : new TreeSet<>(matchedTerms));
    }
}
