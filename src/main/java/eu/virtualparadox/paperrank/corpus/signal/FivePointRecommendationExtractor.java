package eu.virtualparadox.paperrank.corpus.signal;

import eu.virtualparadox.paperrank.corpus.model.PaperRecord;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * ICML: {@code overall_recommendation} on a 1-5 scale.
 */
@Component
@Order(2)
public class FivePointRecommendationExtractor extends ScaledReviewSignalExtractor {

    public FivePointRecommendationExtractor() {
        super("icml");
    }

    @Override
    protected double scaleMax(final PaperRecord paper) {
        return 5.0;
    }
}
