package com.bayousystems.mailbox.config;

import com.bayousystems.mailbox.LinkedMailbox;
import com.bayousystems.mailbox.Mailbox;
import com.bayousystems.mailbox.PriorityMailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.ToIntFunction;

/**
 * Default mailbox provider. Picks a creation strategy from the configured ordering:
 * - FIFO: LinkedMailbox
 * - PRIORITY: PriorityMailbox keyed by the supplied priority function
 */
public class DefaultMailboxProvider<M> implements MailboxProvider<M> {
    private static final Logger logger = LoggerFactory.getLogger(DefaultMailboxProvider.class);

    private final Map<MailboxOrdering, MailboxCreationStrategy<M>> strategies;

    public DefaultMailboxProvider() {
        this.strategies = new EnumMap<>(MailboxOrdering.class);
        this.strategies.put(MailboxOrdering.FIFO, (config, priorityOf) -> config.isBounded()
                ? new LinkedMailbox<>(config.getCapacity())
                : new LinkedMailbox<>());
        this.strategies.put(MailboxOrdering.PRIORITY, (config, priorityOf) -> {
            if (priorityOf == null) {
                throw new IllegalArgumentException("A priority function is required for PRIORITY mailboxes");
            }
            return new PriorityMailbox<>(priorityOf, config.getCapacity());
        });
    }

    /**
     * Replaces the creation strategy used for one ordering.
     *
     * @param ordering The ordering the strategy serves
     * @param strategy The strategy
     * @return This provider
     */
    public DefaultMailboxProvider<M> withStrategy(MailboxOrdering ordering, MailboxCreationStrategy<M> strategy) {
        strategies.put(ordering, strategy);
        return this;
    }

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config, ToIntFunction<? super M> priorityOf) {
        MailboxConfig effectiveConfig = (config != null) ? config : new MailboxConfig();
        logger.debug("DefaultMailboxProvider creating mailbox - config: {}", effectiveConfig);
        return strategies.get(effectiveConfig.getOrdering()).createMailbox(effectiveConfig, priorityOf);
    }
}
