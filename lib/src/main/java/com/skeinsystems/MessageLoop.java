package com.skeinsystems;

import com.skeinsystems.config.ThreadPoolFactory;
import com.skeinsystems.queue.MessageQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Encapsulates queue consumption and message dispatch for a component.
 * Owns the worker thread, handles interruption and routes handler exceptions.
 *
 * @param <T> The type of messages in the queue
 */
public class MessageLoop<T> {
    private static final Logger logger = LoggerFactory.getLogger(MessageLoop.class);

    private final Supplier<String> ownerName;
    private final MessageQueue<T> queue;
    private final BiConsumer<T, Throwable> exceptionHandler;
    private final ComponentLifecycle<T> lifecycle;
    private final ThreadPoolFactory threadPoolFactory;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean running = false;
    private volatile Thread worker;
    private volatile Thread loopThread;

    /**
     * Creates a new message loop.
     *
     * @param ownerName         Supplies the owning component's name for logging and thread naming
     * @param queue             The queue to consume messages from
     * @param exceptionHandler  Handler to route message processing errors
     * @param lifecycle         Lifecycle hooks (onEntry/dispatch/onExit)
     * @param threadPoolFactory The factory for the worker thread
     */
    public MessageLoop(
            Supplier<String> ownerName,
            MessageQueue<T> queue,
            BiConsumer<T, Throwable> exceptionHandler,
            ComponentLifecycle<T> lifecycle,
            ThreadPoolFactory threadPoolFactory) {
        this.ownerName = ownerName;
        this.queue = queue;
        this.exceptionHandler = exceptionHandler;
        this.lifecycle = lifecycle;
        this.threadPoolFactory = threadPoolFactory;
    }

    /**
     * Starts consuming the queue. In {@link LaunchMode#ASYNC} a worker thread is started and
     * this method returns; in {@link LaunchMode#SYNC} the loop runs on the calling thread until
     * the queue is closed and drained.
     *
     * @param mode where the loop runs
     * @throws ComponentException if the loop was already started or closed
     */
    public void start(LaunchMode mode) {
        if (closed.get()) {
            throw new ComponentException("Component has been stopped and cannot run again", ownerName.get());
        }
        if (!started.compareAndSet(false, true)) {
            throw new ComponentException("Component is already running", ownerName.get());
        }
        logger.info("Starting component {} ({})", ownerName.get(), mode);

        if (mode == LaunchMode.ASYNC) {
            worker = threadPoolFactory.createWorkerThread(ownerName.get(), this::processQueueLoop);
            worker.start();
        } else {
            processQueueLoop();
        }
    }

    /**
     * Appends a message to the queue.
     *
     * @param message The message to enqueue
     * @return true if queued, false if the queue refused it (closed or full)
     */
    public boolean post(T message) {
        return queue.push(message);
    }

    /**
     * Closes the queue so the loop ends once it has drained what is already queued.
     *
     * @return true on the first call, false if the loop was already closed
     */
    public boolean close() {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        logger.debug("Closing queue of component {} ({} pending)", ownerName.get(), queue.size());
        queue.close();
        return true;
    }

    /**
     * Waits for the worker thread to finish. Does nothing for a loop run in
     * {@link LaunchMode#SYNC}, or when called from the worker thread itself, which could
     * never finish while it waits on itself.
     */
    public void awaitTermination() {
        Thread worker = this.worker;
        if (worker == null || worker == Thread.currentThread()) {
            return;
        }
        try {
            worker.join(TimeUnit.SECONDS.toMillis(threadPoolFactory.getShutdownTimeoutSeconds()));
            if (worker.isAlive()) {
                logger.warn("Component {} did not finish within {} seconds",
                        ownerName.get(), threadPoolFactory.getShutdownTimeoutSeconds());
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for component {} to finish", ownerName.get());
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Returns true while the loop is consuming the queue.
     */
    public boolean isRunning() {
        return running;
    }

    /**
     * Returns true once {@link #start(LaunchMode)} has been called.
     */
    public boolean isStarted() {
        return started.get();
    }

    /**
     * Returns true once {@link #close()} has been called.
     */
    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Returns true if the calling thread is the one running this loop.
     */
    public boolean isLoopThread() {
        return loopThread == Thread.currentThread();
    }

    /**
     * Gets the current number of messages in the queue.
     */
    public int getCurrentSize() {
        return queue.size();
    }

    private void processQueueLoop() {
        loopThread = Thread.currentThread();
        running = true;
        try {
            lifecycle.onEntry();
            while (true) {
                T message;
                try {
                    message = queue.awaitNext();
                } catch (InterruptedException e) {
                    // an interrupt from outside ends the loop, so the component must stop accepting messages
                    logger.warn("Component {} loop interrupted, stopping with {} messages pending",
                            ownerName.get(), queue.size());
                    close();
                    Thread.currentThread().interrupt();
                    break;
                }
                if (message == null) {
                    // closed and drained
                    break;
                }
                try {
                    lifecycle.dispatch(message);
                } catch (Throwable e) {
                    exceptionHandler.accept(message, e);
                }
                if (Thread.interrupted()) {
                    logger.warn("Component {} handler left the thread interrupted, clearing the flag",
                            ownerName.get());
                }
            }
        } finally {
            running = false;
            try {
                lifecycle.onExit();
            } finally {
                loopThread = null;
            }
            logger.debug("Component {} loop finished", ownerName.get());
        }
    }
}
