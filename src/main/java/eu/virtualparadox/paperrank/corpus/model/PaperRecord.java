package eu.virtualparadox.paperrank.corpus.model;

import lombok.Builder;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Objects;

/**
 * A paper of a venue/year corpus together with its review material.
 * Read-only inside the pipeline. Text fields are never {@code null}.
 */
@Builder
public record PaperRecord(String id,
                          String title,
                          String abstractText,
                          List<String> keywords,
                          String decision,
                          String decisionComment,
                          String presentationType,
                          List<Double> reviewScores,
                          String metaReviewText,
                          List<String> reviewTexts,
                          String venue,
                          Integer year) {

    public PaperRecord {
        Objects.requireNonNull(id, "paper id");
        title = StringUtils.defaultString(title);
        abstractText = StringUtils.defaultString(abstractText);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        decision = StringUtils.defaultString(decision);
        decisionComment = StringUtils.defaultString(decisionComment);
        presentationType = StringUtils.defaultString(presentationType);
        reviewScores = reviewScores == null ? List.of() : List.copyOf(reviewScores);
        metaReviewText = StringUtils.defaultString(metaReviewText);
        reviewTexts = reviewTexts == null ? List.of() : List.copyOf(reviewTexts);
        venue = StringUtils.defaultString(venue);
    }

    /**
     * @return mean of the raw review scores, or {@code null} without scores
     */
    public Double reviewAverage() {
        if (reviewScores.isEmpty()) {
            return null;
        }
        return reviewScores.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
    }
}
