package eu.virtualparadox.paperrank.query.keyword;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.paperrank.generation.JsonResponseExtractor;
import eu.virtualparadox.paperrank.review.exception.SchemaViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Decodes a generated term list. A JSON array of strings is preferred; a plain
 * delimited list (commas, semicolons or one term per line, optionally
 * bulleted or numbered) is accepted as well. The result is normalised.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TermListDecoder {

    private static final Pattern DELIMITERS = Pattern.compile("[,;\\n\\r]+");
    private static final Pattern LIST_MARKER = Pattern.compile("^(?:[-*•]|\\d+[.)])\\s*");
    private static final String QUOTES = "\"'`";

    private final ObjectMapper objectMapper;

    /**
     * @throws SchemaViolationException if not a single term can be read
     */
    public List<String> decode(final String raw) {
        if (raw == null || raw.isBlank()) {
            throw new SchemaViolationException("Empty term list");
        }

        List<String> terms;
        try {
            terms = fromJson(JsonResponseExtractor.extractArray(raw));
        } catch (SchemaViolationException | JsonProcessingException e) {
            log.debug("Term list is not a JSON array ({}), reading it as a delimited list", e.getMessage());
            terms = fromDelimited(raw);
        }

        final List<String> normalized = KeywordNormalizer.normalizeAll(terms);
        if (normalized.isEmpty()) {
            throw new SchemaViolationException("No terms in response");
        }
        return normalized;
    }

    private List<String> fromJson(final String array) throws JsonProcessingException {
        final JsonNode node = objectMapper.readTree(array);
        final List<String> terms = new ArrayList<>();
        for (final JsonNode element : node) {
            if (element.isTextual() || element.isNumber()) {
                terms.add(element.asText());
            }
        }
        return terms;
    }

    private List<String> fromDelimited(final String raw) {
        final List<String> terms = new ArrayList<>();
        for (final String part : DELIMITERS.split(JsonResponseExtractor.stripFences(raw))) {
            String term = LIST_MARKER.matcher(part.trim()).replaceFirst("");
            term = StringUtils.strip(term, QUOTES + "[] ");
            terms.add(term);
        }
        return terms;
    }
}
