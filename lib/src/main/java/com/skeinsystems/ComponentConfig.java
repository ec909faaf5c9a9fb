package com.skeinsystems;

import com.skeinsystems.config.ThreadPoolFactory;
import com.skeinsystems.message.Message;
import com.skeinsystems.queue.config.DefaultQueueProvider;
import com.skeinsystems.queue.config.QueueConfig;
import com.skeinsystems.queue.config.QueueProvider;
import com.skeinsystems.timer.ScheduledTimerManager;
import com.skeinsystems.timer.TimerManager;

import java.util.function.Function;

/**
 * Settings a component is built with: its queue, its threads and how its timer manager is made.
 */
public class ComponentConfig {

    private QueueConfig queueConfig = new QueueConfig();
    private ThreadPoolFactory threadPoolFactory = new ThreadPoolFactory();
    private QueueProvider<Message> queueProvider = new DefaultQueueProvider<>();
    private Function<String, TimerManager> timerManagerFactory;

    /**
     * Creates a new ComponentConfig with default settings: an unbounded linked queue,
     * non-daemon worker threads and a {@link ScheduledTimerManager} per component.
     */
    public ComponentConfig() {
        this.timerManagerFactory = name -> new ScheduledTimerManager(name, threadPoolFactory);
    }

    public QueueConfig getQueueConfig() {
        return queueConfig;
    }

    public ComponentConfig setQueueConfig(QueueConfig queueConfig) {
        if (queueConfig == null) {
            throw new IllegalArgumentException("Queue config cannot be null");
        }
        this.queueConfig = queueConfig;
        return this;
    }

    public ThreadPoolFactory getThreadPoolFactory() {
        return threadPoolFactory;
    }

    public ComponentConfig setThreadPoolFactory(ThreadPoolFactory threadPoolFactory) {
        if (threadPoolFactory == null) {
            throw new IllegalArgumentException("Thread pool factory cannot be null");
        }
        this.threadPoolFactory = threadPoolFactory;
        return this;
    }

    public QueueProvider<Message> getQueueProvider() {
        return queueProvider;
    }

    public ComponentConfig setQueueProvider(QueueProvider<Message> queueProvider) {
        if (queueProvider == null) {
            throw new IllegalArgumentException("Queue provider cannot be null");
        }
        this.queueProvider = queueProvider;
        return this;
    }

    public Function<String, TimerManager> getTimerManagerFactory() {
        return timerManagerFactory;
    }

    /**
     * Sets how the component creates its timer manager on first use.
     * The function receives the component name.
     *
     * @param timerManagerFactory the factory
     * @return This ComponentConfig instance
     */
    public ComponentConfig setTimerManagerFactory(Function<String, TimerManager> timerManagerFactory) {
        if (timerManagerFactory == null) {
            throw new IllegalArgumentException("Timer manager factory cannot be null");
        }
        this.timerManagerFactory = timerManagerFactory;
        return this;
    }
}
