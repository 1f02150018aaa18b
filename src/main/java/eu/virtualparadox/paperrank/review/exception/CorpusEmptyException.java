package eu.virtualparadox.paperrank.review.exception;

/**
 * The venue/year corpus holds no paper at all.
 */
public class CorpusEmptyException extends ReviewPipelineException {

    public CorpusEmptyException(final String message) {
        super(message);
    }
}
