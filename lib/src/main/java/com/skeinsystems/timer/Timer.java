package com.skeinsystems.timer;

import com.skeinsystems.Component;
import com.skeinsystems.ComponentRef;
import com.skeinsystems.message.TimeoutMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Timer bound to the component that is active when it is started.
 * <p>
 * Expirations never run the callback on the timer manager's thread. They are posted to the
 * owning component as a {@link TimeoutMessage}, so the callback runs on that component's loop
 * thread like any other handler. If the owner has been closed by the time the timer fires,
 * the expiration is dropped, and a cyclic timer is cancelled.
 *
 * <pre>{@code
 * // inside a handler or onEntry hook of a running component
 * Timer heartbeat = new Timer(true);
 * heartbeat.start(1000, this::sendHeartbeat);
 * }</pre>
 */
public class Timer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Timer.class);

    private final AtomicLong id = new AtomicLong(TimerManager.INVALID_JOB_ID);
    private volatile boolean cyclic;
    private volatile TimerManager manager;

    /**
     * Creates a one-shot timer.
     */
    public Timer() {
        this(false);
    }

    /**
     * Creates a timer.
     *
     * @param cyclic whether the timer re-arms itself after each expiration
     */
    public Timer(boolean cyclic) {
        this.cyclic = cyclic;
    }

    /**
     * Starts the timer on the active component's timer manager. A running timer is stopped
     * and started again. Must be called from a component's loop thread.
     *
     * @param durationMillis time until expiration, and the period of a cyclic timer
     * @param callback       run on the owning component's thread on each expiration
     */
    public void start(long durationMillis, Runnable callback) {
        if (callback == null) {
            logger.error("Timer callback cannot be null");
            return;
        }
        Optional<TimerManager> activeManager = Component.getTimerManager();
        if (activeManager.isEmpty()) {
            logger.warn("No running component on thread {}, timer not started", Thread.currentThread().getName());
            return;
        }
        if (running()) {
            logger.info("Timer {} is still running, stopping it first", id.get());
            stop();
        }

        TimerManager boundManager = activeManager.get();
        ComponentRef owner = Component.getActiveRef();
        AtomicLong jobId = new AtomicLong(TimerManager.INVALID_JOB_ID);
        manager = boundManager;
        long newId;
        // an expiration that fires before start returns waits here until its job id is known
        synchronized (jobId) {
            newId = boundManager.start(durationMillis,
                    () -> onExpired(owner, boundManager, publishedId(jobId), callback), cyclic);
            jobId.set(newId);
            id.set(newId);
        }
        logger.debug("Started timer {} for {} ms (cyclic={}) on {}", newId, durationMillis, cyclic, owner);
    }

    /**
     * Restarts the countdown of a running timer from its full duration.
     */
    public void restart() {
        TimerManager boundManager = manager;
        if (boundManager != null) {
            boundManager.restart(id.get());
        }
    }

    /**
     * Stops the timer. Expirations already posted to the owner are not delivered to a
     * cyclic timer's callback after this call.
     */
    public void stop() {
        TimerManager boundManager = manager;
        long jobId = id.getAndSet(TimerManager.INVALID_JOB_ID);
        if (boundManager != null && jobId != TimerManager.INVALID_JOB_ID) {
            boundManager.stop(jobId);
        }
    }

    public boolean running() {
        TimerManager boundManager = manager;
        return boundManager != null && boundManager.isRunning(id.get());
    }

    public boolean isCyclic() {
        return cyclic;
    }

    public void setCyclic(boolean cyclic) {
        if (cyclic == this.cyclic) {
            return;
        }
        this.cyclic = cyclic;
        TimerManager boundManager = manager;
        if (boundManager != null) {
            boundManager.setCyclic(id.get(), cyclic);
        }
    }

    @Override
    public void close() {
        stop();
    }

    private static long publishedId(AtomicLong jobId) {
        synchronized (jobId) {
            return jobId.get();
        }
    }

    // Runs on the timer manager's thread
    private void onExpired(ComponentRef owner, TimerManager boundManager, long jobId, Runnable callback) {
        boolean repeating = cyclic;
        if (!repeating) {
            // a one-shot timer's lifecycle ends at its single firing
            id.compareAndSet(jobId, TimerManager.INVALID_JOB_ID);
        }

        Runnable delivery = repeating ? () -> deliverIfCurrent(jobId, callback) : callback;
        TimeoutMessage timeout = new TimeoutMessage(jobId, delivery);

        Optional<Component> component = owner.get();
        if (component.isPresent()) {
            component.get().postMessage(timeout);
        } else {
            logger.debug("Owner of timer {} is gone, dropping expiration", jobId);
            if (repeating) {
                boundManager.stop(jobId);
            }
            id.compareAndSet(jobId, TimerManager.INVALID_JOB_ID);
        }
    }

    // Runs on the owner's loop thread
    private void deliverIfCurrent(long jobId, Runnable callback) {
        if (id.get() == jobId) {
            callback.run();
        } else {
            logger.debug("Timer job {} was stopped, skipping queued expiration", jobId);
        }
    }
}
