package eu.virtualparadox.paperrank.corpus.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.paperrank.application.config.ApplicationConfig;
import eu.virtualparadox.paperrank.corpus.model.PaperRecord;
import eu.virtualparadox.paperrank.review.exception.CorpusEmptyException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads corpora written by the paper fetcher:
 * {@code {corpus}/{venue}_{year}/all_papers.json}, a JSON array of papers.
 * <p>
 * Reviews are objects of string fields whose names differ per venue. The
 * numeric score is taken from the first field of
 * {@link ReviewScoreParser#SCORE_FIELDS} that a review carries; the remaining
 * fields become the review text, summary first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JsonFileCorpusProvider implements CorpusProvider {

    public static final String CORPUS_FILE = "all_papers.json";

    private static final String FIELD_SUMMARY = "summary";

    private final ApplicationConfig applicationConfig;
    private final ObjectMapper objectMapper;

    @Override
    public List<PaperRecord> fetch(final String venue, final int year) throws IOException {
        final Path file = corpusFile(venue, year);
        if (!Files.isRegularFile(file)) {
            throw new CorpusEmptyException("No corpus for " + venue + " " + year + " at " + file);
        }

        final JsonNode root = objectMapper.readTree(file.toFile());
        final List<PaperRecord> papers = new ArrayList<>();
        for (final JsonNode node : root) {
            final String id = node.path("id").asText("");
            if (id.isBlank()) {
                log.debug("Skipping paper without id in {}", file);
                continue;
            }
            papers.add(toRecord(node, venue, year));
        }
        log.info("Read {} papers from {}", papers.size(), file);
        return papers;
    }

    public Path corpusFile(final String venue, final int year) {
        return applicationConfig.getCorpus().resolve(venue + "_" + year).resolve(CORPUS_FILE);
    }

    private PaperRecord toRecord(final JsonNode node, final String venue, final int year) {
        final List<Double> scores = new ArrayList<>();
        final List<String> reviewTexts = new ArrayList<>();
        for (final JsonNode review : node.path("reviews")) {
            final Map<String, String> fields = fields(review);
            final Double score = reviewScore(fields);
            if (score != null) {
                scores.add(score);
            }
            final String text = reviewText(fields);
            if (!text.isEmpty()) {
                reviewTexts.add(text);
            }
        }
        // explicit score list wins over what the review forms carried
        if (node.path("review_scores").isArray()) {
            scores.clear();
            node.path("review_scores").forEach(s -> scores.add(s.asDouble()));
        } else if (scores.isEmpty() && node.path("rating_avg").isNumber()) {
            scores.add(node.path("rating_avg").asDouble());
        }

        final String decision = node.path("decision").asText("");
        final String presentation = node.hasNonNull("presentation_type")
                ? node.path("presentation_type").asText()
                : presentationType(decision);

        return PaperRecord.builder()
                .id(node.path("id").asText())
                .title(node.path("title").asText(""))
                .abstractText(node.path("abstract").asText(""))
                .keywords(textList(node.path("keywords")))
                .decision(decision)
                .decisionComment(node.path("decision_comment").asText(""))
                .presentationType(presentation)
                .reviewScores(scores)
                .metaReviewText(node.path("meta_review").asText(""))
                .reviewTexts(reviewTexts)
                .venue(node.hasNonNull("venue") ? node.path("venue").asText() : venue)
                .year(node.path("year").isInt() ? node.path("year").asInt() : year)
                .build();
    }

    static String presentationType(final String decision) {
        final String lower = decision.toLowerCase(Locale.ROOT);
        if (lower.contains("oral")) {
            return "oral";
        }
        if (lower.contains("spotlight")) {
            return "spotlight";
        }
        if (lower.contains("poster")) {
            return "poster";
        }
        return "";
    }

    private static Map<String, String> fields(final JsonNode review) {
        final Map<String, String> fields = new TreeMap<>();
        final Iterator<Map.Entry<String, JsonNode>> it = review.fields();
        while (it.hasNext()) {
            final Map.Entry<String, JsonNode> entry = it.next();
            final JsonNode value = entry.getValue();
            // OpenReview wraps values as {"value": ...}
            final JsonNode unwrapped = value.isObject() && value.has("value") ? value.get("value") : value;
            if (!unwrapped.isNull() && !unwrapped.isContainerNode()) {
                fields.put(entry.getKey(), unwrapped.asText());
            }
        }
        return fields;
    }

    private static Double reviewScore(final Map<String, String> fields) {
        for (final String field : ReviewScoreParser.SCORE_FIELDS) {
            final Double score = ReviewScoreParser.parse(fields.get(field));
            if (score != null) {
                return score;
            }
        }
        return null;
    }

    private static String reviewText(final Map<String, String> fields) {
        final StringBuilder sb = new StringBuilder();
        final String summary = fields.get(FIELD_SUMMARY);
        if (summary != null && !summary.isBlank()) {
            sb.append(summary.trim());
        }
        for (final Map.Entry<String, String> entry : fields.entrySet()) {
            if (FIELD_SUMMARY.equals(entry.getKey()) || ReviewScoreParser.SCORE_FIELDS.contains(entry.getKey())
                    || entry.getValue().isBlank()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(entry.getKey().replace('_', ' ')).append(": ").append(entry.getValue().trim());
        }
        return sb.toString();
    }

    private static List<String> textList(final JsonNode node) {
        final List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(v -> values.add(v.asText()));
        } else if (node.isTextual() && !node.asText().isBlank()) {
            for (final String part : node.asText().split(",")) {
                values.add(part.trim());
            }
        }
        return values;
    }
}
