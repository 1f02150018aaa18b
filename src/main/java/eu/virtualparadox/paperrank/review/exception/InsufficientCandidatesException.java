package eu.virtualparadox.paperrank.review.exception;

public class InsufficientCandidatesException extends CorpusEmptyException {

    public InsufficientCandidatesException(final String message) {
        super(message);
    }
}
