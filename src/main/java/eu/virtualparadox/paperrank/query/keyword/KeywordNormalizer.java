package eu.virtualparadox.paperrank.query.keyword;

import org.apache.commons.lang3.StringUtils;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Normal form shared by keywords and synonym variants: trimmed, lowercased,
 * inner whitespace collapsed to a single space.
 */
public final class KeywordNormalizer {

    private KeywordNormalizer() {
        // prevent instantiation
    }

    /**
     * @return the normal form, or an empty string for {@code null}/blank input
     */
    public static String normalize(final String term) {
        if (term == null) {
            return "";
        }
        return StringUtils.normalizeSpace(term).toLowerCase(Locale.ROOT);
    }

    /**
     * Normalises every term, drops empty ones and duplicates. First occurrence wins.
     */
    public static List<String> normalizeAll(final Collection<String> terms) {
        final Set<String> unique = new LinkedHashSet<>();
        for (final String term : terms) {
            final String normalized = normalize(term);
            if (!normalized.isEmpty()) {
                unique.add(normalized);
            }
        }
        return List.copyOf(unique);
    }
}
