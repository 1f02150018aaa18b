package eu.virtualparadox.paperrank.review.exception;

import eu.virtualparadox.paperrank.review.ERunStatus;
import lombok.Getter;

/**
 * A review run aborted; {@link #getStage()} names the stage that was being
 * entered when the failure happened.
 */
@Getter
public class StageFailedException extends ReviewPipelineException {

    private final ERunStatus stage;

    public StageFailedException(final ERunStatus stage, final Throwable cause) {
        super("Review run failed before " + stage + ": " + cause.getMessage(), cause);
        this.stage = stage;
    }
}
