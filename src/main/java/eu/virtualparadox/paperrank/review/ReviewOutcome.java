package eu.virtualparadox.paperrank.review;

import eu.virtualparadox.paperrank.query.synonym.SynonymSet;
import eu.virtualparadox.paperrank.rank.aggregate.RankedResult;
import eu.virtualparadox.paperrank.rank.evaluate.RubricScore;
import eu.virtualparadox.paperrank.rank.match.CandidateScore;

import java.util.List;
import java.util.Map;

/**
 * Result of a finished run, handed to reporting: the ranking plus the
 * intermediate score sets it was built from.
 *
 * @param ranking         final ranking, rank 1 first
 * @param candidateScores initial scores of every corpus paper
 * @param selected        candidates that went into evaluation
 * @param rubricScores    rubric scores by paper id, empty in fast mode
 * @param keywords        seed keywords
 * @param synonyms        keyword groups
 * @param cancelled       {@code true} if the run was cancelled while evaluating
 */
public record ReviewOutcome(List<RankedResult> ranking,
                            List<CandidateScore> candidateScores,
                            List<CandidateScore> selected,
                            Map<String, RubricScore> rubricScores,
                            List<String> keywords,
                            List<SynonymSet> synonyms,
                            boolean cancelled) {
}
