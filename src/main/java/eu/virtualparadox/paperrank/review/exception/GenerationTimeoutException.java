package eu.virtualparadox.paperrank.review.exception;

/**
 * A generation call did not answer within the configured timeout.
 * Callers treat it like a malformed response.
 */
public class GenerationTimeoutException extends ReviewPipelineException {

    public GenerationTimeoutException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
