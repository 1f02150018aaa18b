package eu.virtualparadox.paperrank.review;

import eu.virtualparadox.paperrank.query.model.ResearchQuery;
import eu.virtualparadox.paperrank.review.exception.FatalInputException;

/**
 * What a run reviews: one venue/year corpus against one research query.
 */
public record ReviewRequest(String venue, int year, ResearchQuery query) {

    public ReviewRequest {
        if (venue == null || venue.isBlank()) {
            throw new FatalInputException("Venue is required");
        }
        if (query == null) {
            throw new FatalInputException("Research query is required");
        }
        venue = venue.trim();
    }
}
