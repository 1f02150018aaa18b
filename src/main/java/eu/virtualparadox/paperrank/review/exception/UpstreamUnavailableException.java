package eu.virtualparadox.paperrank.review.exception;

/**
 * The text-generation service or the corpus provider could not be reached.
 * Retried with backoff where it is raised.
 */
public class UpstreamUnavailableException extends ReviewPipelineException {

    public UpstreamUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
