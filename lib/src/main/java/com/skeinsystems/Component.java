package com.skeinsystems;

import com.skeinsystems.handler.MessageHandler;
import com.skeinsystems.message.CallbackMessage;
import com.skeinsystems.message.Message;
import com.skeinsystems.message.TimeoutMessage;
import com.skeinsystems.timer.TimerManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An active object: a message queue, a table of per-type handlers and a thread that
 * runs them one message at a time.
 * <p>
 * Other threads interact with a component only by {@link #postMessage(Message) posting}
 * messages. Handlers run on the component's loop thread and never concurrently with each
 * other, so state touched only by handlers needs no further synchronization.
 *
 * <pre>{@code
 * Component worker = Component.create("worker");
 * worker.registerMessageHandler(Job.class, job -> process(job));
 * worker.run(LaunchMode.ASYNC);
 * worker.postMessage(new Job(42));
 * ...
 * worker.close();
 * }</pre>
 */
public class Component implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Component.class);
    private static final AtomicInteger INSTANCE_COUNTER = new AtomicInteger();

    private final int instanceId = INSTANCE_COUNTER.incrementAndGet();
    private final ComponentConfig config;
    private final ComponentRef ref;
    private final MessageLoop<Message> loop;

    // guarded by itself
    private final Map<Class<? extends Message>, MessageHandler<Message>> handlers = new HashMap<>();

    private final Object timerLock = new Object();
    // guarded by timerLock
    private TimerManager timerManager;

    private volatile String name;
    private volatile Logger componentLogger;
    private volatile boolean alive = true;
    private volatile Runnable entryHook;
    private volatile Runnable exitHook;

    /**
     * Creates a new, not yet running component with an empty name.
     *
     * @return the component
     */
    public static Component create() {
        return create("");
    }

    /**
     * Creates a new, not yet running component.
     *
     * @param name the component name
     * @return the component
     */
    public static Component create(String name) {
        return create(name, new ComponentConfig());
    }

    /**
     * Creates a new, not yet running component with custom queue, thread and timer settings.
     *
     * @param name   the component name
     * @param config the component configuration
     * @return the component
     */
    public static Component create(String name, ComponentConfig config) {
        return new Component(name, config);
    }

    private Component(String name, ComponentConfig config) {
        this.config = config != null ? config : new ComponentConfig();
        this.name = name != null ? name : "";
        this.componentLogger = createLogger();
        this.ref = ComponentRef.of(this);
        this.loop = new MessageLoop<>(
                this::describe,
                this.config.getQueueProvider().createQueue(this.config.getQueueConfig()),
                this::handleException,
                new ComponentLifecycle<Message>() {
                    @Override
                    public void onEntry() {
                        ActiveComponentRegistry.enter(ref);
                        runHook(entryHook, "entry");
                    }

                    @Override
                    public void dispatch(Message message) {
                        Component.this.dispatch(message);
                    }

                    @Override
                    public void onExit() {
                        try {
                            runHook(exitHook, "exit");
                        } finally {
                            ActiveComponentRegistry.exit(ref);
                        }
                    }
                },
                this.config.getThreadPoolFactory());

        registerMessageHandler(TimeoutMessage.class, TimeoutMessage::execute);
        registerMessageHandler(CallbackMessage.class, CallbackMessage::execute);
        logger.debug("Component {} created with {}", describe(), this.config.getQueueConfig());
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name != null ? name : "";
        this.componentLogger = createLogger();
    }

    /**
     * Runs the message loop without entry or exit hooks.
     *
     * @param mode where the loop runs
     * @see #run(LaunchMode, Runnable, Runnable)
     */
    public void run(LaunchMode mode) {
        run(mode, null, null);
    }

    /**
     * Runs the message loop.
     * <p>
     * {@code onEntry} runs on the loop thread before the first message, {@code onExit} after
     * the queue has been closed and drained; each only if the component is still alive.
     * In {@link LaunchMode#SYNC} this method blocks until the component is stopped.
     *
     * @param mode    where the loop runs
     * @param onEntry hook run on the loop thread before any message, may be null
     * @param onExit  hook run on the loop thread after the last message, may be null
     * @throws ComponentException if the component is already running or has been stopped
     */
    public void run(LaunchMode mode, Runnable onEntry, Runnable onExit) {
        if (mode == null) {
            throw new IllegalArgumentException("Launch mode cannot be null");
        }
        this.entryHook = onEntry;
        this.exitHook = onExit;
        loop.start(mode);
    }

    /**
     * Stops the component: closes its queue, shuts its timer manager down and, unless called
     * from the component's own thread, waits for the worker thread to finish the messages that
     * were already queued. Idempotent.
     */
    public void stop() {
        if (loop.close()) {
            logger.info("Stopping component {}", describe());
        }
        shutdownTimerManager();
        loop.awaitTermination();
    }

    /**
     * Destroys the component. Every {@link ComponentRef} to it resolves to empty from now on,
     * so pending timers never deliver to it, and the component is stopped.
     */
    @Override
    public void close() {
        alive = false;
        stop();
    }

    /**
     * Posts a message to this component's queue. Never throws: a refused message
     * (component stopped, queue full, null message) is logged and dropped.
     *
     * @param message the message
     */
    public void postMessage(Message message) {
        try {
            if (!loop.post(message)) {
                if (loop.isClosed()) {
                    logger.debug("Component {} is stopped, dropping {}", describe(), message);
                } else {
                    logger.warn("Queue overflow in component {}, dropping {}", describe(), message);
                }
            }
        } catch (OutOfMemoryError e) {
            logger.error("Queue overflow in component {}: {}", describe(), e.getMessage());
        } catch (Exception e) {
            logger.error("Exception occurred when posting {} to component {}", message, describe(), e);
        }
    }

    /**
     * Runs a callback on this component's thread, after the messages already queued.
     *
     * @param callback the work to run
     */
    public void execute(Runnable callback) {
        if (callback == null) {
            logger.error("Component {}: cannot execute a null callback", describe());
            return;
        }
        postMessage(new CallbackMessage(callback));
    }

    /**
     * Registers the handler for a message type, replacing any previous one.
     * Safe to call from any thread, before or after {@link #run}.
     *
     * @param <M>     the message type
     * @param type    the message type tag
     * @param handler the handler; null is ignored
     */
    @SuppressWarnings("unchecked")
    public <M extends Message> void registerMessageHandler(Class<M> type, MessageHandler<? super M> handler) {
        if (type == null || handler == null) {
            logger.error("Component {}: cannot register a handler without type or function (type={})",
                    describe(), type);
            return;
        }
        synchronized (handlers) {
            handlers.put(type, (MessageHandler<Message>) handler);
        }
        logger.debug("Component {} registered handler for {}", describe(), type.getName());
    }

    /**
     * Returns true if the loop has been started and the component has not been stopped.
     */
    public boolean isRunning() {
        return loop.isStarted() && !loop.isClosed();
    }

    /**
     * Returns false once the component has been {@link #close() closed}.
     */
    public boolean isAlive() {
        return alive;
    }

    /**
     * Returns a weak handle to this component.
     *
     * @return the handle
     */
    public ComponentRef ref() {
        return ref;
    }

    /**
     * Gets a logger for this component with the component name as context.
     *
     * @return A logger instance configured for this component
     */
    public Logger getLogger() {
        return componentLogger;
    }

    /**
     * Returns the component whose message loop runs on the calling thread.
     *
     * @return the active component, or empty outside any loop or if it has been closed
     */
    public static Optional<Component> getActiveComponent() {
        return ActiveComponentRegistry.current().get();
    }

    /**
     * Returns a weak handle to the component whose message loop runs on the calling thread.
     *
     * @return the handle, {@link ComponentRef#empty()} outside any loop
     */
    public static ComponentRef getActiveRef() {
        return ActiveComponentRegistry.current();
    }

    /**
     * Returns the timer manager of the active component, creating it on first use.
     *
     * @return the manager, or empty outside any loop or once the component is stopped
     */
    public static Optional<TimerManager> getTimerManager() {
        return getActiveComponent().flatMap(Component::timerManager);
    }

    private Optional<TimerManager> timerManager() {
        synchronized (timerLock) {
            if (timerManager == null) {
                if (loop.isClosed()) {
                    logger.debug("Component {} is stopped, no timer manager available", describe());
                    return Optional.empty();
                }
                timerManager = config.getTimerManagerFactory().apply(describe());
                logger.debug("Component {} created timer manager", describe());
            }
            return Optional.of(timerManager);
        }
    }

    private void shutdownTimerManager() {
        TimerManager manager;
        synchronized (timerLock) {
            manager = timerManager;
            timerManager = null;
        }
        if (manager != null) {
            manager.shutdown();
        }
    }

    private void dispatch(Message message) {
        Class<? extends Message> type = message.type();
        MessageHandler<Message> handler;
        synchronized (handlers) {
            handler = handlers.get(type);
        }
        if (handler == null) {
            logger.warn("Component {} has no handler for message {}", describe(), type.getName());
            return;
        }
        handler.onMessage(message);
    }

    private void handleException(Message message, Throwable exception) {
        logger.error("Component {} error processing message {}: {}",
                describe(), message.type().getName(), message, exception);
    }

    private void runHook(Runnable hook, String phase) {
        if (hook == null || !ref.isAlive()) {
            return;
        }
        try {
            hook.run();
        } catch (Exception e) {
            logger.error("Component {} {} hook failed", describe(), phase, e);
        }
    }

    private Logger createLogger() {
        return LoggerFactory.getLogger(Component.class.getName() + "." + describe());
    }

    /**
     * Name used in logs and thread names; falls back to the instance number for unnamed components.
     */
    String describe() {
        return name.isEmpty() ? "#" + instanceId : name;
    }

    @Override
    public String toString() {
        return "Component[" + describe() + "]";
    }
}
