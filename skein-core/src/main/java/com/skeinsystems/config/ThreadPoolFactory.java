package com.skeinsystems.config;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the threads used by components.
 * Centralizes creation of component worker threads and timer scheduler pools,
 * so naming, daemon status and shutdown timeouts are tuned in one place.
 */
public class ThreadPoolFactory {
    // Default values
    private static final int DEFAULT_SCHEDULER_THREADS = 1;
    private static final int DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 10;
    private static final boolean DEFAULT_DAEMON_THREADS = false;

    private int schedulerThreads = DEFAULT_SCHEDULER_THREADS;
    private int shutdownTimeoutSeconds = DEFAULT_SHUTDOWN_TIMEOUT_SECONDS;
    private boolean daemonThreads = DEFAULT_DAEMON_THREADS;
    private boolean useNamedThreads = true;

    /**
     * Creates a new ThreadPoolFactory with default settings.
     */
    public ThreadPoolFactory() {
        // Use defaults
    }

    /**
     * Creates an unstarted worker thread that will run a component's message loop.
     *
     * @param componentName the name of the owning component, used in the thread name
     * @param loop          the message loop body
     * @return a new, unstarted thread
     */
    public Thread createWorkerThread(String componentName, Runnable loop) {
        Thread thread = useNamedThreads
                ? new Thread(loop, "component-" + componentName)
                : new Thread(loop);
        thread.setDaemon(daemonThreads);
        return thread;
    }

    /**
     * Creates a scheduled executor service based on the current configuration.
     *
     * @param poolName Name prefix for the threads in this pool
     * @return A new scheduled executor service
     */
    public ScheduledExecutorService createScheduledExecutorService(String poolName) {
        if (useNamedThreads) {
            return Executors.newScheduledThreadPool(schedulerThreads,
                    createNamedThreadFactory(poolName + "-timer"));
        } else {
            return Executors.newScheduledThreadPool(schedulerThreads, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setDaemon(true);
                return thread;
            });
        }
    }

    /**
     * Creates a named thread factory for better thread identification in logs and profilers.
     * Scheduler threads are always daemons; they never keep the process alive on their own.
     *
     * @param prefix The prefix for thread names
     * @return A thread factory that creates named threads
     */
    private ThreadFactory createNamedThreadFactory(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, prefix + "-" + threadNumber.getAndIncrement());
                thread.setDaemon(true);
                return thread;
            }
        };
    }

    // Getters and setters

    public int getSchedulerThreads() {
        return schedulerThreads;
    }

    public ThreadPoolFactory setSchedulerThreads(int schedulerThreads) {
        if (schedulerThreads < 1) {
            throw new IllegalArgumentException("Scheduler threads must be at least 1, got " + schedulerThreads);
        }
        this.schedulerThreads = schedulerThreads;
        return this;
    }

    public int getShutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    public ThreadPoolFactory setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) {
        if (shutdownTimeoutSeconds < 0) {
            throw new IllegalArgumentException("Shutdown timeout cannot be negative, got " + shutdownTimeoutSeconds);
        }
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
        return this;
    }

    public boolean isDaemonThreads() {
        return daemonThreads;
    }

    public ThreadPoolFactory setDaemonThreads(boolean daemonThreads) {
        this.daemonThreads = daemonThreads;
        return this;
    }

    public boolean isUseNamedThreads() {
        return useNamedThreads;
    }

    public ThreadPoolFactory setUseNamedThreads(boolean useNamedThreads) {
        this.useNamedThreads = useNamedThreads;
        return this;
    }

    @Override
    public String toString() {
        return "ThreadPoolFactory{" +
                "schedulerThreads=" + schedulerThreads +
                ", shutdownTimeoutSeconds=" + shutdownTimeoutSeconds +
                ", daemonThreads=" + daemonThreads +
                ", useNamedThreads=" + useNamedThreads +
                '}';
    }
}
