package com.skeinsystems.queue.config;

import com.skeinsystems.queue.MessageQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Default queue provider. Picks a creation strategy from {@link QueueConfig#getQueueType()}.
 *
 * - LINKED: {@link com.skeinsystems.queue.LinkedMessageQueue}, bounded or unbounded
 * - MPSC: {@link com.skeinsystems.queue.MpscMessageQueue}, unbounded only; a bounded
 *   request falls back to LINKED
 */
public class DefaultQueueProvider<M> implements QueueProvider<M> {
    private static final Logger logger = LoggerFactory.getLogger(DefaultQueueProvider.class);

    private final Map<QueueType, QueueCreationStrategy<M>> strategies;
    private final QueueCreationStrategy<M> defaultStrategy;

    public DefaultQueueProvider() {
        this.strategies = new EnumMap<>(QueueType.class);
        this.strategies.put(QueueType.LINKED, new LinkedQueueStrategy<>());
        this.strategies.put(QueueType.MPSC, new MpscQueueStrategy<>());
        this.defaultStrategy = strategies.get(QueueType.LINKED);
    }

    @Override
    public MessageQueue<M> createQueue(QueueConfig config) {
        QueueConfig effectiveConfig = (config != null) ? config : new QueueConfig();

        logger.debug("DefaultQueueProvider creating queue - config: {}", effectiveConfig);

        if (effectiveConfig.getQueueType() == QueueType.MPSC && effectiveConfig.isBounded()) {
            logger.warn("MPSC queues are unbounded; using a LINKED queue to honour capacity {}",
                    effectiveConfig.getCapacity());
            return defaultStrategy.createQueue(effectiveConfig);
        }

        return strategies.getOrDefault(effectiveConfig.getQueueType(), defaultStrategy)
                .createQueue(effectiveConfig);
    }
}
