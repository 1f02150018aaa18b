package eu.virtualparadox.paperrank.corpus.provider;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a numeric review score from the free-form values found in review
 * forms: {@code "8: accept"}, {@code "5/10"}, {@code "3"} or {@code 6.5}.
 */
public final class ReviewScoreParser {

    /** Score fields in lookup order; the first present one wins. */
    public static final List<String> SCORE_FIELDS = List.of("rating", "overall_recommendation", "score", "recommendation");

    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*([-+]?\\d+(?:\\.\\d+)?)");

    private ReviewScoreParser() {
        // prevent instantiation
    }

    /**
     * @return the score, or {@code null} when the value carries no number
     */
    public static Double parse(final String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        final Matcher matcher = LEADING_NUMBER.matcher(value);
        if (!matcher.find()) {
            return null;
        }
        return Double.valueOf(matcher.group(1));
    }
}
