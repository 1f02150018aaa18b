package eu.virtualparadox.paperrank.corpus.signal;

import eu.virtualparadox.paperrank.corpus.model.PaperRecord;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Fallback for venues without a known scale: a paper whose highest review
 * score fits a 5-point scale is read on that scale, otherwise on 10 points.
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class InferredScaleExtractor extends ScaledReviewSignalExtractor {

    @Override
    public boolean supports(final String venue) {
        return true;
    }

    @Override
    protected double scaleMax(final PaperRecord paper) {
        final double max = paper.reviewScores().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        return max <= 5.0 ? 5.0 : 10.0;
    }
}
