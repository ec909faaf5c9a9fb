package com.skeinsystems.timer;

/**
 * Schedules and cancels timed jobs identified by an opaque job id.
 * <p>
 * Callbacks run asynchronously on the manager's own thread(s), which are not any
 * particular component's loop thread. Callers that need thread affinity must redeliver
 * the expiration themselves.
 */
public interface TimerManager {

    /** Job id that never refers to a scheduled job. */
    long INVALID_JOB_ID = 0L;

    /**
     * Schedules a job.
     *
     * @param durationMillis delay before the first firing, and the period when cyclic
     * @param callback       action run on expiry
     * @param cyclic         whether the job re-arms itself after each firing
     * @return the job id, or {@link #INVALID_JOB_ID} if the job could not be scheduled
     */
    long start(long durationMillis, Runnable callback, boolean cyclic);

    /**
     * Cancels a job. Unknown or invalid ids are ignored.
     *
     * @param jobId the job to cancel
     */
    void stop(long jobId);

    /**
     * Re-arms a known job with its original duration, counted from now.
     *
     * @param jobId the job to restart
     */
    void restart(long jobId);

    /**
     * Returns true if the job is scheduled and has not finished.
     *
     * @param jobId the job id
     * @return whether the job is still pending
     */
    boolean isRunning(long jobId);

    /**
     * Changes whether a job re-arms itself after firing.
     *
     * @param jobId  the job id
     * @param cyclic the new cyclic flag
     */
    void setCyclic(long jobId, boolean cyclic);

    /**
     * Cancels every job and releases the manager's threads. After shutdown,
     * {@link #start(long, Runnable, boolean)} returns {@link #INVALID_JOB_ID}.
     */
    void shutdown();

    /**
     * Returns the sentinel id used for "no job".
     *
     * @return {@link #INVALID_JOB_ID}
     */
    static long invalidJobId() {
        return INVALID_JOB_ID;
    }
}
