package eu.virtualparadox.paperrank.rank.evaluate;

import eu.virtualparadox.paperrank.corpus.model.PaperRecord;
import eu.virtualparadox.paperrank.query.model.ResearchQuery;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Distills a paper and its reviews into an {@link EvaluationContext} of bounded size.
 */
@Component
public class EvaluationContextBuilder {

    static final int MAX_ABSTRACT = 1500;
    static final int MAX_KEYWORDS = 8;
    static final int MAX_DECISION_COMMENT = 500;
    static final int MAX_META_REVIEW = 500;
    static final int MAX_REVIEWS = 5;
    static final int MAX_REVIEW_TEXT = 300;

    private static final String NOT_AVAILABLE = "N/A";

    public EvaluationContext build(final PaperRecord paper,
                                   final ResearchQuery query,
                                   final List<String> keywords) {
        final List<String> paperKeywords = paper.keywords().size() > MAX_KEYWORDS
                ? paper.keywords().subList(0, MAX_KEYWORDS)
                : paper.keywords();

        return new EvaluationContext(
                paper.id(),
                paper.title(),
                StringUtils.abbreviate(paper.abstractText(), MAX_ABSTRACT),
                paperKeywords,
                StringUtils.defaultIfBlank(paper.decision(), NOT_AVAILABLE),
                StringUtils.defaultIfBlank(StringUtils.abbreviate(paper.decisionComment(), MAX_DECISION_COMMENT), NOT_AVAILABLE),
                StringUtils.defaultIfBlank(paper.presentationType(), NOT_AVAILABLE),
                reviewSummary(paper),
                researchInterest(query, keywords));
    }

    static String researchInterest(final ResearchQuery query, final List<String> keywords) {
        if (query.hasDescription()) {
            return query.rawDescription().trim();
        }
        return "Keywords: " + String.join(", ", keywords);
    }

    private static String reviewSummary(final PaperRecord paper) {
        final StringBuilder sb = new StringBuilder();
        final Double average = paper.reviewAverage();
        if (average != null) {
            sb.append(String.format(Locale.ROOT, "Review scores: %s (average %.2f)%n",
                    paper.reviewScores(), average));
        }
        if (!paper.metaReviewText().isBlank()) {
            sb.append("Meta review: ")
                    .append(StringUtils.abbreviate(paper.metaReviewText().trim(), MAX_META_REVIEW))
                    .append('\n');
        }
        final List<String> reviews = paper.reviewTexts();
        for (int i = 0; i < Math.min(MAX_REVIEWS, reviews.size()); i++) {
            sb.append("Review ").append(i + 1).append(": ")
                    .append(StringUtils.abbreviate(reviews.get(i).trim(), MAX_REVIEW_TEXT))
                    .append('\n');
        }
        if (reviews.size() > MAX_REVIEWS) {
            sb.append("(").append(reviews.size() - MAX_REVIEWS).append(" more reviews omitted)\n");
        }
        return sb.length() == 0 ? "No review data available." : sb.toString().trim();
    }
}
