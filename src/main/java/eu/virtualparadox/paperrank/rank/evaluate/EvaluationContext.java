package eu.virtualparadox.paperrank.rank.evaluate;

import eu.virtualparadox.paperrank.util.Fingerprints;

import java.util.List;

/**
 * Everything the rubric call sees about one candidate, already truncated.
 */
public record EvaluationContext(String paperId,
                                String title,
                                String abstractText,
                                List<String> keywords,
                                String decision,
                                String decisionComment,
                                String presentationType,
                                String reviewSummary,
                                String researchInterest) {

    public EvaluationContext {
        keywords = List.copyOf(keywords);
    }

    /**
     * @return hash over every field, part of the rubric cache key
     */
    public String fingerprint() {
        return Fingerprints.of(paperId, title, abstractText, String.join(",", keywords), decision,
                decisionComment, presentationType, reviewSummary, researchInterest);
    }
}
