package eu.virtualparadox.paperrank.query.keyword;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeywordNormalizerTest {

    @Test
    @DisplayName("Trims, lowercases and collapses whitespace")
    void testNormalize() {
        assertEquals("graph generation", KeywordNormalizer.normalize("  Graph\t Generation \n"));
        assertEquals("", KeywordNormalizer.normalize(null));
    }

    @Test
    @DisplayName("Drops empty terms and keeps the first of duplicates in order")
    void testNormalizeAll() {
        final List<String> terms = Arrays.asList("Drug Discovery", "", null, "graph generation", "drug discovery ");
        assertEquals(List.of("drug discovery", "graph generation"), KeywordNormalizer.normalizeAll(terms));
    }
}
