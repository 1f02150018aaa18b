package eu.virtualparadox.paperrank.review.exception;

/**
 * Generated text could not be decoded into the expected structure.
 */
public class SchemaViolationException extends ReviewPipelineException {

    public SchemaViolationException(final String message) {
        super(message);
    }

    public SchemaViolationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
