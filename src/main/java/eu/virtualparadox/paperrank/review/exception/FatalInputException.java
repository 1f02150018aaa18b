package eu.virtualparadox.paperrank.review.exception;

/**
 * The research query is empty or invalid. Aborts the run.
 */
public class FatalInputException extends ReviewPipelineException {

    public FatalInputException(final String message) {
        super(message);
    }
}
