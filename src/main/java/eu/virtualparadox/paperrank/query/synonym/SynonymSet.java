package eu.virtualparadox.paperrank.query.synonym;

import java.util.List;

/**
 * A keyword group: the seed keyword followed by its normalised variants.
 * The keyword itself is always the first variant; variants are unique and
 * never blank.
 */
public record SynonymSet(String keyword, List<String> variants) {

    public SynonymSet {
        if (keyword == null || keyword.isBlank()) {
            throw new IllegalArgumentException("Synonym set needs a keyword");
        }
        variants = variants == null || variants.isEmpty() ? List.of(keyword) : List.copyOf(variants);
        if (!variants.get(0).equals(keyword)) {
            throw new IllegalArgumentException("First variant must be the keyword itself: " + keyword);
        }
        if (variants.stream().distinct().count() != variants.size()
                || variants.stream().anyMatch(String::isBlank)) {
            throw new IllegalArgumentException("Variants of '" + keyword + "' must be unique and non-blank");
        }
    }

    public static SynonymSet identity(final String keyword) {
        return new SynonymSet(keyword, List.of(keyword));
    }

    public List<String> synonyms() {
        return variants.subList(1, variants.size());
    }
}
