package com.bayousystems.mailbox.config;

import com.bayousystems.mailbox.LinkedMailbox;
import com.bayousystems.mailbox.Mailbox;
import com.bayousystems.mailbox.PriorityMailbox;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DefaultMailboxProviderTest {

    private final DefaultMailboxProvider<Integer> provider = new DefaultMailboxProvider<>();

    @Test
    void testDefaultsToUnboundedFifo() {
        Mailbox<Integer> mailbox = provider.createMailbox(null, null);
        assertInstanceOf(LinkedMailbox.class, mailbox);
        assertFalse(mailbox.isBounded());
    }

    @Test
    void testBoundedFifo() {
        Mailbox<Integer> mailbox = provider.createMailbox(new MailboxConfig().setCapacity(8), null);
        assertInstanceOf(LinkedMailbox.class, mailbox);
        assertEquals(8, mailbox.capacity());
    }

    @Test
    void testPriorityOrderingUsesPriorityFunction() {
        MailboxConfig config = new MailboxConfig().setOrdering(MailboxOrdering.PRIORITY).setCapacity(4);
        Mailbox<Integer> mailbox = provider.createMailbox(config, value -> value);

        assertInstanceOf(PriorityMailbox.class, mailbox);
        mailbox.offer(1);
        mailbox.offer(7);
        mailbox.offer(3);
        assertEquals(7, mailbox.poll());
        assertEquals(3, mailbox.poll());
        assertEquals(1, mailbox.poll());
    }

    @Test
    void testPriorityOrderingRequiresPriorityFunction() {
        MailboxConfig config = new MailboxConfig().setOrdering(MailboxOrdering.PRIORITY);
        assertThrows(IllegalArgumentException.class, () -> provider.createMailbox(config, null));
    }

    @Test
    void testCustomStrategyOverridesDefault() {
        provider.withStrategy(MailboxOrdering.FIFO, (config, priorityOf) -> new LinkedMailbox<>(2));
        Mailbox<Integer> mailbox = provider.createMailbox(new MailboxConfig(), null);
        assertEquals(2, mailbox.capacity());
    }

    @Test
    void testConfigRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new MailboxConfig().setCapacity(0));
    }
}
