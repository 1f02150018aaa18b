package eu.virtualparadox.paperrank.corpus.signal;

import eu.virtualparadox.paperrank.corpus.model.PaperRecord;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Picks the extractor matching a paper's venue tag. Extractors are consulted
 * in their {@code @Order}; the inferred-scale fallback accepts any venue.
 */
@Service
public class ReviewSignalResolver {

    private final List<ReviewSignalExtractor> extractors;

    public ReviewSignalResolver(final List<ReviewSignalExtractor> extractors) {
        this.extractors = List.copyOf(extractors);
    }

    /**
     * @return review signal in [0,1], or {@code null} when the paper has no review score
     */
    public Double resolve(final PaperRecord paper) {
        for (final ReviewSignalExtractor extractor : extractors) {
            if (extractor.supports(paper.venue())) {
                return extractor.extract(paper);
            }
        }
        return null;
    }
}
