package eu.virtualparadox.paperrank.query.model;

import java.util.List;

/**
 * A research interest as given by the caller: either a free-text description,
 * an explicit list of terms, or both (explicit terms win).
 *
 * @param rawDescription free-text description, may be {@code null}
 * @param explicitTerms  caller supplied terms in the given order, never {@code null}
 * @param languageHint   language of the description, e.g. {@code en}
 */
public record ResearchQuery(String rawDescription, List<String> explicitTerms, String languageHint) {

    public static final String DEFAULT_LANGUAGE = "en";

    public ResearchQuery {
        explicitTerms = explicitTerms == null ? List.of() : List.copyOf(explicitTerms);
        languageHint = languageHint == null || languageHint.isBlank() ? DEFAULT_LANGUAGE : languageHint;
    }

    public static ResearchQuery ofDescription(final String description) {
        return new ResearchQuery(description, List.of(), DEFAULT_LANGUAGE);
    }

    public static ResearchQuery ofTerms(final List<String> terms) {
        return new ResearchQuery(null, terms, DEFAULT_LANGUAGE);
    }

    public boolean hasExplicitTerms() {
        return !explicitTerms.isEmpty();
    }

    public boolean hasDescription() {
        return rawDescription != null && !rawDescription.isBlank();
    }
}
