package eu.virtualparadox.paperrank.corpus.signal;

import eu.virtualparadox.paperrank.corpus.model.PaperRecord;

import java.util.Locale;
import java.util.Set;

/**
 * Divides the review average by the maximum of the venue's rating scale.
 */
public abstract class ScaledReviewSignalExtractor implements ReviewSignalExtractor {

    private final Set<String> venues;

    protected ScaledReviewSignalExtractor(final String... venues) {
        this.venues = Set.of(venues);
    }

    protected abstract double scaleMax(PaperRecord paper);

    @Override
    public boolean supports(final String venue) {
        return venue != null && venues.contains(venue.toLowerCase(Locale.ROOT));
    }

    @Override
    public Double extract(final PaperRecord paper) {
        final Double average = paper.reviewAverage();
        if (average == null) {
            return null;
        }
        return Math.max(0.0, Math.min(1.0, average / scaleMax(paper)));
    }
}
