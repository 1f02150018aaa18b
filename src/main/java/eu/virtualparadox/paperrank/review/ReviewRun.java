package eu.virtualparadox.paperrank.review;

import eu.virtualparadox.paperrank.util.CancellationSignal;

import java.time.Instant;

public class ReviewRun {
    private final long id;
    private final ReviewRequest request;
    private final CancellationSignal cancellation;
    private final Instant createdAt;
    private volatile ERunStatus status;
    private volatile ERunStatus failedStage;
    private volatile String error;
    private volatile ReviewOutcome outcome;

    public ReviewRun(long id, ReviewRequest request) {
        this.id = id;
        this.request = request;
        this.cancellation = new CancellationSignal();
        this.createdAt = Instant.now();
        this.status = ERunStatus.INIT;
    }

    public long getId() { return id; }
    public ReviewRequest getRequest() { return request; }
    public CancellationSignal getCancellation() { return cancellation; }
    public Instant getCreatedAt() { return createdAt; }
    public ERunStatus getStatus() { return status; }
    public ERunStatus getFailedStage() { return failedStage; }
    public String getError() { return error; }
    public ReviewOutcome getOutcome() { return outcome; }

    /**
     * Moves the run to a later stage.
     *
     * @throws IllegalStateException on a backward move or when the run already ended
     */
    public synchronized void advance(ERunStatus next) {
        if (status.isTerminal() || next == ERunStatus.FAILED || next.ordinal() <= status.ordinal()) {
            throw new IllegalStateException("Run " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    public synchronized void complete(ReviewOutcome outcome) {
        this.outcome = outcome;
        advance(ERunStatus.DONE);
    }

    public synchronized void fail(ERunStatus stage, String error) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Run " + id + " already ended as " + status);
        }
        this.failedStage = stage;
        this.error = error;
        this.status = ERunStatus.FAILED;
    }

    public void cancel() {
        cancellation.cancel();
    }
}
