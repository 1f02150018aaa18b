package eu.virtualparadox.paperrank.review.exception;

/**
 * No keyword survived normalisation.
 */
public class EmptyInputException extends FatalInputException {

    public EmptyInputException(final String message) {
        super(message);
    }
}
