package com.cairnsystems.config;

import com.cairnsystems.mailbox.LinkedMailbox;
import com.cairnsystems.mailbox.Mailbox;
import com.cairnsystems.mailbox.MpscMailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default mailbox provider choosing the queue implementation from {@link MailboxConfig#getMailboxType()}.
 *
 * @param <M> The type of messages
 */
public class DefaultMailboxProvider<M> implements MailboxProvider<M> {
    private static final Logger logger = LoggerFactory.getLogger(DefaultMailboxProvider.class);

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config) {
        MailboxConfig effectiveConfig = config != null ? config : new MailboxConfig();
        logger.debug("Creating mailbox with {}", effectiveConfig);

        return switch (effectiveConfig.getMailboxType()) {
            case MPSC -> new MpscMailbox<>(effectiveConfig.getInitialCapacity());
            case LINKED -> effectiveConfig.isUnbounded()
                    ? new LinkedMailbox<>()
                    : new LinkedMailbox<>(effectiveConfig.getMaxCapacity());
        };
    }
}
