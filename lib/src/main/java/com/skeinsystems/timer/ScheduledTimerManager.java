package com.skeinsystems.timer;

import com.skeinsystems.config.ThreadPoolFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link TimerManager} backed by a {@link ScheduledExecutorService}.
 * <p>
 * Every firing schedules the next one for cyclic jobs, so a job can be switched between
 * one-shot and cyclic at any time. One-shot jobs are forgotten as soon as they fire.
 */
public class ScheduledTimerManager implements TimerManager {
    private static final Logger logger = LoggerFactory.getLogger(ScheduledTimerManager.class);

    private final String name;
    private final ScheduledExecutorService scheduler;
    private final Map<Long, TimerJob> jobs = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(INVALID_JOB_ID);
    private volatile boolean shutdown = false;

    /**
     * Creates a manager with a default single-threaded scheduler.
     */
    public ScheduledTimerManager() {
        this("skein", new ThreadPoolFactory());
    }

    /**
     * Creates a manager whose scheduler threads come from the given factory.
     *
     * @param name              prefix for the scheduler thread names
     * @param threadPoolFactory the thread factory configuration
     */
    public ScheduledTimerManager(String name, ThreadPoolFactory threadPoolFactory) {
        this.name = name;
        this.scheduler = threadPoolFactory.createScheduledExecutorService(name);
    }

    @Override
    public long start(long durationMillis, Runnable callback, boolean cyclic) {
        Objects.requireNonNull(callback, "callback cannot be null");
        if (durationMillis < 0) {
            throw new IllegalArgumentException("Duration cannot be negative: " + durationMillis);
        }
        if (cyclic && durationMillis == 0) {
            throw new IllegalArgumentException("Cyclic jobs need a positive duration");
        }
        if (shutdown) {
            logger.warn("Timer manager {} is shut down, job not scheduled", name);
            return INVALID_JOB_ID;
        }

        long jobId = idGenerator.incrementAndGet();
        TimerJob job = new TimerJob(jobId, durationMillis, callback, cyclic);
        jobs.put(jobId, job);
        synchronized (job) {
            arm(job);
        }
        logger.debug("Timer manager {} scheduled job {} in {} ms (cyclic={})", name, jobId, durationMillis, cyclic);
        return jobId;
    }

    @Override
    public void stop(long jobId) {
        TimerJob job = jobs.remove(jobId);
        if (job == null) {
            return;
        }
        synchronized (job) {
            job.cancelled = true;
            if (job.future != null) {
                job.future.cancel(false);
            }
        }
        logger.debug("Timer manager {} stopped job {}", name, jobId);
    }

    @Override
    public void restart(long jobId) {
        TimerJob job = jobs.get(jobId);
        if (job == null) {
            logger.debug("Timer manager {} has no job {} to restart", name, jobId);
            return;
        }
        synchronized (job) {
            if (job.cancelled) {
                return;
            }
            if (job.future != null) {
                job.future.cancel(false);
            }
            arm(job);
        }
    }

    @Override
    public boolean isRunning(long jobId) {
        return jobId != INVALID_JOB_ID && jobs.containsKey(jobId);
    }

    @Override
    public void setCyclic(long jobId, boolean cyclic) {
        TimerJob job = jobs.get(jobId);
        if (job != null) {
            synchronized (job) {
                job.cyclic = cyclic;
            }
        }
    }

    @Override
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        for (Long jobId : List.copyOf(jobs.keySet())) {
            stop(jobId);
        }
        List<Runnable> pending = scheduler.shutdownNow();
        logger.debug("Timer manager {} shut down, {} pending tasks discarded", name, pending.size());
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Returns the number of jobs still scheduled.
     */
    public int getActiveJobCount() {
        return jobs.size();
    }

    // Must hold the job's monitor
    private void arm(TimerJob job) {
        long generation = ++job.generation;
        try {
            job.future = scheduler.schedule(() -> fire(job, generation), job.durationMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Timer manager {} rejected job {}: scheduler is shut down", name, job.id);
            job.cancelled = true;
            jobs.remove(job.id, job);
        }
    }

    private void fire(TimerJob job, long generation) {
        synchronized (job) {
            if (job.cancelled || job.generation != generation) {
                return;
            }
            if (job.cyclic) {
                arm(job);
            } else {
                // forget one-shot jobs before the callback runs, so isRunning is already false inside it
                jobs.remove(job.id, job);
            }
        }
        try {
            job.callback.run();
        } catch (Throwable e) {
            logger.error("Timer manager {} job {} callback failed", name, job.id, e);
        }
    }

    private static final class TimerJob {
        private final long id;
        private final long durationMillis;
        private final Runnable callback;
        private boolean cyclic;
        private boolean cancelled;
        private long generation;
        private ScheduledFuture<?> future;

        private TimerJob(long id, long durationMillis, Runnable callback, boolean cyclic) {
            this.id = id;
            this.durationMillis = durationMillis;
            this.callback = callback;
            this.cyclic = cyclic;
        }
    }
}
