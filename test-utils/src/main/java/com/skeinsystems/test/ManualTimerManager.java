package com.skeinsystems.test;

import com.skeinsystems.timer.TimerManager;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link TimerManager} driven by the test instead of a clock.
 * <p>
 * Jobs never fire on their own; {@link #fire(long)} runs a job's callback on the calling
 * thread, as a real manager would on its timer thread. Every {@link #stop(long)} is
 * recorded so tests can check that a job was cancelled.
 *
 * <pre>{@code
 * ManualTimerManager timers = new ManualTimerManager();
 * Component component = Component.create("c", new ComponentConfig().setTimerManagerFactory(name -> timers));
 * ...
 * timers.fire(timers.lastJobId());
 * }</pre>
 */
public class ManualTimerManager implements TimerManager {

    private final Map<Long, Job> jobs = new ConcurrentHashMap<>();
    private final List<Long> stoppedJobs = new CopyOnWriteArrayList<>();
    private final AtomicLong idGenerator = new AtomicLong(INVALID_JOB_ID);
    private volatile boolean shutdown = false;

    @Override
    public long start(long durationMillis, Runnable callback, boolean cyclic) {
        if (shutdown) {
            return INVALID_JOB_ID;
        }
        long jobId = idGenerator.incrementAndGet();
        jobs.put(jobId, new Job(durationMillis, callback, cyclic));
        return jobId;
    }

    @Override
    public void stop(long jobId) {
        stoppedJobs.add(jobId);
        Job job = jobs.get(jobId);
        if (job != null) {
            job.running = false;
        }
    }

    @Override
    public void restart(long jobId) {
        Job job = jobs.get(jobId);
        if (job != null && !shutdown) {
            job.running = true;
            job.restarts++;
        }
    }

    @Override
    public boolean isRunning(long jobId) {
        Job job = jobs.get(jobId);
        return job != null && job.running;
    }

    @Override
    public void setCyclic(long jobId, boolean cyclic) {
        Job job = jobs.get(jobId);
        if (job != null) {
            job.cyclic = cyclic;
        }
    }

    @Override
    public void shutdown() {
        shutdown = true;
        for (Job job : jobs.values()) {
            job.running = false;
        }
    }

    /**
     * Fires a job as its expiry would, even if it was stopped or the manager is shut down.
     * This lets tests replay an expiration that raced with a cancellation.
     *
     * @param jobId the job to fire
     */
    public void fire(long jobId) {
        Job job = jobs.get(jobId);
        if (job == null) {
            throw new IllegalArgumentException("Unknown job " + jobId);
        }
        if (!job.cyclic) {
            job.running = false;
        }
        job.callback.run();
    }

    public long lastJobId() {
        return idGenerator.get();
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public boolean isCyclic(long jobId) {
        Job job = jobs.get(jobId);
        return job != null && job.cyclic;
    }

    public long getDuration(long jobId) {
        Job job = jobs.get(jobId);
        return job == null ? -1 : job.durationMillis;
    }

    public int getRestartCount(long jobId) {
        Job job = jobs.get(jobId);
        return job == null ? 0 : job.restarts;
    }

    public List<Long> stoppedJobs() {
        return new ArrayList<>(stoppedJobs);
    }

    private static final class Job {
        private final long durationMillis;
        private final Runnable callback;
        private volatile boolean cyclic;
        private volatile boolean running = true;
        private volatile int restarts;

        private Job(long durationMillis, Runnable callback, boolean cyclic) {
            this.durationMillis = durationMillis;
            this.callback = callback;
            this.cyclic = cyclic;
        }
    }
}
