package eu.virtualparadox.paperrank.corpus.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReviewScoreParserTest {

    @Test
    @DisplayName("Reads the leading number of review form values")
    void testFormats() {
        assertEquals(8.0, ReviewScoreParser.parse("8: accept, good paper"));
        assertEquals(5.0, ReviewScoreParser.parse("5/10"));
        assertEquals(3.0, ReviewScoreParser.parse(" 3 "));
        assertEquals(6.5, ReviewScoreParser.parse("6.5"));
    }

    @Test
    @DisplayName("Values without a number yield null")
    void testNoNumber() {
        assertNull(ReviewScoreParser.parse(null));
        assertNull(ReviewScoreParser.parse(""));
        assertNull(ReviewScoreParser.parse("Strong accept"));
    }
}
