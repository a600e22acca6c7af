package co.deferworks.lode.driver;

/**
 * What happened when a worker asked for the next job.
 */
public enum ProcessOutcome {
    // Nothing was eligible.
    IDLE,

    SUCCEEDED,

    // The job failed and was put back with a later available_at.
    RETRY_SCHEDULED,

    // The job failed for the last time and moved to failed_jobs.
    DEAD_LETTERED,

    // The job ran, but recording the result failed or the reservation had been lost.
    // The row is left for lease recovery.
    ACK_FAILED;

    public boolean processed() {
        return this != IDLE;
    }

    public boolean succeeded() {
        return this == SUCCEEDED;
    }
}
