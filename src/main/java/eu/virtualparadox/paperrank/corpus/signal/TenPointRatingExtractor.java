package eu.virtualparadox.paperrank.corpus.signal;

import eu.virtualparadox.paperrank.corpus.model.PaperRecord;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * NeurIPS and ICLR: {@code rating} on a 1-10 scale.
 */
@Component
@Order(1)
public class TenPointRatingExtractor extends ScaledReviewSignalExtractor {

    public TenPointRatingExtractor() {
        super("neurips", "iclr");
    }

    @Override
    protected double scaleMax(final PaperRecord paper) {
        return 10.0;
    }
}
