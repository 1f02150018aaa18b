package eu.virtualparadox.paperrank.generation;

import eu.virtualparadox.paperrank.review.exception.SchemaViolationException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates the JSON payload inside generated text: strips Markdown code fences
 * and cuts out the first balanced object or array.
 */
public final class JsonResponseExtractor {

    private static final Pattern FENCE = Pattern.compile("```(?:json|JSON)?\\s*(.*?)\\s*```", Pattern.DOTALL);

    private JsonResponseExtractor() {
        // prevent instantiation
    }

    public static String extractObject(final String raw) {
        return extract(raw, '{', '}');
    }

    public static String extractArray(final String raw) {
        return extract(raw, '[', ']');
    }

    public static String stripFences(final String raw) {
        final Matcher matcher = FENCE.matcher(raw);
        return matcher.find() ? matcher.group(1) : raw.trim();
    }

    private static String extract(final String raw, final char open, final char close) {
        if (raw == null || raw.isBlank()) {
            throw new SchemaViolationException("Empty response");
        }
        final String text = stripFences(raw);
        final int start = text.indexOf(open);
        if (start < 0) {
            throw new SchemaViolationException("No '" + open + "' in response");
        }

        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return text.substring(start, i + 1);
                }
            }
        }
        throw new SchemaViolationException("Unbalanced '" + open + "' in response (truncated?)");
    }
}
