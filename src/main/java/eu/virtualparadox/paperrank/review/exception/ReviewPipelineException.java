package eu.virtualparadox.paperrank.review.exception;

/**
 * Root of the failures raised by the review pipeline.
 */
public class ReviewPipelineException extends RuntimeException {

    public ReviewPipelineException(final String message) {
        super(message);
    }

    public ReviewPipelineException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
