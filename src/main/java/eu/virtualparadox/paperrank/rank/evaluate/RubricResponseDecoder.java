package eu.virtualparadox.paperrank.rank.evaluate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.paperrank.generation.JsonResponseExtractor;
import eu.virtualparadox.paperrank.review.exception.SchemaViolationException;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Strict decoder of rubric responses. The four dimensions must be present,
 * numeric and within [0,1]; nothing is clamped or defaulted. The text fields
 * are optional: rationale and review summary are cut to {@value #MAX_RATIONALE}
 * characters, field insights to {@value #MAX_FIELD_INSIGHTS}.
 */
@Component
@RequiredArgsConstructor
public class RubricResponseDecoder {

    static final int MAX_RATIONALE = 500;
    static final int MAX_FIELD_INSIGHTS = 300;

    static final List<String> DIMENSIONS = List.of("relevance", "novelty", "impact", "practicality");

    private final ObjectMapper objectMapper;

    /**
     * @throws SchemaViolationException if the response does not satisfy the schema
     */
    public RubricScore decode(final String paperId, final String raw) {
        final JsonNode root;
        try {
            root = objectMapper.readTree(JsonResponseExtractor.extractObject(raw));
        } catch (JsonProcessingException e) {
            throw new SchemaViolationException("Rubric response is not valid JSON: " + e.getOriginalMessage(), e);
        }

        final double[] values = new double[DIMENSIONS.size()];
        for (int i = 0; i < DIMENSIONS.size(); i++) {
            values[i] = dimension(root, DIMENSIONS.get(i));
        }

        return new RubricScore(paperId, values[0], values[1], values[2], values[3],
                text(root, "rationale", MAX_RATIONALE),
                text(root, "review_summary", MAX_RATIONALE),
                text(root, "field_insights", MAX_FIELD_INSIGHTS),
                true);
    }

    private static String text(final JsonNode root, final String name, final int maxLength) {
        final JsonNode node = root.path(name);
        return node.isTextual() ? StringUtils.truncate(node.asText().trim(), maxLength) : "";
    }

    private static double dimension(final JsonNode root, final String name) {
        final JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            throw new SchemaViolationException("Missing rubric field '" + name + "'");
        }
        if (!node.isNumber()) {
            throw new SchemaViolationException("Rubric field '" + name + "' is not numeric: " + node);
        }
        final double value = node.asDouble();
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new SchemaViolationException("Rubric field '" + name + "' out of [0,1]: " + value);
        }
        return value;
    }
}
