package eu.virtualparadox.paperrank.query.synonym;

import eu.virtualparadox.paperrank.application.config.PipelineConfig;
import eu.virtualparadox.paperrank.application.executor.ExpansionExecutor;
import eu.virtualparadox.paperrank.cache.KeyValueStore;
import eu.virtualparadox.paperrank.generation.GenerationRequest;
import eu.virtualparadox.paperrank.generation.TextGenerationService;
import eu.virtualparadox.paperrank.query.keyword.KeywordNormalizer;
import eu.virtualparadox.paperrank.query.keyword.TermListDecoder;
import eu.virtualparadox.paperrank.review.exception.ReviewPipelineException;
import eu.virtualparadox.paperrank.util.CancellationSignal;
import eu.virtualparadox.paperrank.util.Fingerprints;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Expands every keyword into its keyword group.
 * <p>
 * Keywords are expanded concurrently on the {@link ExpansionExecutor}; each
 * keyword keeps its own set, overlapping variants of different keywords are
 * not merged. A failed expansion degrades to the keyword alone and the run
 * goes on. Successful expansions are memoised per keyword and model.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SynonymExpander {

    private static final String INSTRUCTIONS = String.join("\n",
            "Generate synonyms and related terms for the research topic given by the user.",
            "Include:",
            "- common abbreviations (e.g. \"llm\" for \"large language model\")",
            "- related terms",
            "- alternative phrasings",
            "Keep terms concise, technical and lowercase."
    );

    private final TextGenerationService textGenerationService;
    private final TermListDecoder termListDecoder;
    private final PipelineConfig pipelineConfig;
    private final KeyValueStore<SynonymSet> synonymStore;
    private final ExpansionExecutor expansionExecutor;

    /**
     * @param keywords     normalised seed keywords
     * @param cancellation run cancellation; once raised no new generation call is made
     * @return one synonym set per keyword, in keyword order
     */
    public List<SynonymSet> expand(final List<String> keywords, final CancellationSignal cancellation) {
        final List<CompletableFuture<SynonymSet>> futures = new ArrayList<>();
        for (final String keyword : keywords) {
            futures.add(CompletableFuture.supplyAsync(() -> expandOne(keyword, cancellation), expansionExecutor));
        }

        final List<SynonymSet> sets = futures.stream()
                .map(CompletableFuture::join)
                .toList();

        final long expanded = sets.stream().filter(s -> !s.synonyms().isEmpty()).count();
        log.info("Expanded {}/{} keywords", expanded, sets.size());
        return sets;
    }

    SynonymSet expandOne(final String keyword, final CancellationSignal cancellation) {
        final String key = Fingerprints.of("synonyms", keyword, pipelineConfig.getModelIdentifier(),
                String.valueOf(pipelineConfig.getMaxSynonymsPerKeyword()));

        final Optional<SynonymSet> cached = synonymStore.get(key);
        if (cached.isPresent()) {
            log.debug("Synonym cache hit for '{}'", keyword);
            return cached.get();
        }
        if (pipelineConfig.getMaxSynonymsPerKeyword() == 0) {
            return SynonymSet.identity(keyword);
        }
        if (cancellation.isCancelled()) {
            log.warn("Run cancelled, '{}' is matched without synonyms", keyword);
            return SynonymSet.identity(keyword);
        }

        try {
            final GenerationRequest request = new GenerationRequest(
                    INSTRUCTIONS + "\nReturn at most " + pipelineConfig.getMaxSynonymsPerKeyword() + " terms.",
                    "Topic: \"" + keyword + "\"",
                    GenerationRequest.SCHEMA_SYNONYMS);
            final List<String> generated = termListDecoder.decode(textGenerationService.generate(request));
            final SynonymSet set = build(keyword, generated, pipelineConfig.getMaxSynonymsPerKeyword());
            synonymStore.put(key, set);
            log.debug("Synonyms for '{}': {}", keyword, set.synonyms());
            return set;
        } catch (ReviewPipelineException e) {
            log.warn("Synonym expansion failed for '{}', using the keyword alone: {}", keyword, e.getMessage());
            return SynonymSet.identity(keyword);
        }
    }

    static SynonymSet build(final String keyword, final List<String> generated, final int maxSynonyms) {
        final Set<String> variants = new LinkedHashSet<>();
        variants.add(keyword);
        for (final String variant : KeywordNormalizer.normalizeAll(generated)) {
            if (variants.size() > maxSynonyms) {
                break;
            }
            variants.add(variant);
        }
        return new SynonymSet(keyword, new ArrayList<>(variants));
    }
}
