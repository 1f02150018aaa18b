package eu.virtualparadox.paperrank.query.keyword;

import eu.virtualparadox.paperrank.application.config.PipelineConfig;
import eu.virtualparadox.paperrank.generation.GenerationRequest;
import eu.virtualparadox.paperrank.generation.TextGenerationService;
import eu.virtualparadox.paperrank.query.model.ResearchQuery;
import eu.virtualparadox.paperrank.review.exception.EmptyInputException;
import eu.virtualparadox.paperrank.review.exception.GenerationTimeoutException;
import eu.virtualparadox.paperrank.review.exception.SchemaViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Derives the seed keywords of a run.
 * <ul>
 *     <li>explicit terms: used as given after normalisation</li>
 *     <li>free-text description: keywords are generated, normalised and capped
 *     at {@code max-keywords}</li>
 * </ul>
 * An empty result is fatal to the run and not retried.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class KeywordExtractor {

    private static final String INSTRUCTIONS = String.join("\n",
            "Extract the key research topics from the research description given by the user.",
            "Return 5-8 keywords or short phrases that represent the main research interests.",
            "Rules:",
            "- use lowercase",
            "- be specific and technical",
            "- focus on the most important topics"
    );

    private final TextGenerationService textGenerationService;
    private final TermListDecoder termListDecoder;
    private final PipelineConfig pipelineConfig;

    /**
     * @param query research query of the run
     * @return ordered, unique, normalised keywords; never empty
     * @throws EmptyInputException if no keyword can be derived
     */
    public List<String> extract(final ResearchQuery query) {
        final List<String> keywords;
        if (query.hasExplicitTerms()) {
            keywords = KeywordNormalizer.normalizeAll(query.explicitTerms());
        } else if (query.hasDescription()) {
            keywords = generate(query);
        } else {
            throw new EmptyInputException("Research query has neither terms nor a description");
        }

        if (keywords.isEmpty()) {
            throw new EmptyInputException("No keyword could be derived from the research query");
        }
        if (keywords.size() < pipelineConfig.getMinKeywords()) {
            log.warn("Only {} keyword(s) derived, matching may be narrow: {}", keywords.size(), keywords);
        }
        log.info("Keywords ({}): {}", keywords.size(), keywords);
        return keywords;
    }

    private List<String> generate(final ResearchQuery query) {
        final GenerationRequest request = new GenerationRequest(
                INSTRUCTIONS + "\n- write the keywords in language: " + query.languageHint(),
                "Research description:\n" + query.rawDescription().trim(),
                GenerationRequest.SCHEMA_KEYWORDS);
        try {
            final List<String> generated = termListDecoder.decode(textGenerationService.generate(request));
            return generated.size() > pipelineConfig.getMaxKeywords()
                    ? generated.subList(0, pipelineConfig.getMaxKeywords())
                    : generated;
        } catch (SchemaViolationException | GenerationTimeoutException e) {
            log.warn("Keyword extraction produced no usable answer: {}", e.getMessage());
            return List.of();
        }
    }
}
