package com.cairnsystems.config;

import com.cairnsystems.mailbox.Mailbox;

/**
 * An interface for providing actor mailboxes.
 *
 * @param <M> The type of messages the mailbox will hold.
 */
public interface MailboxProvider<M> {

    /**
     * Creates a mailbox based on the provided configuration.
     *
     * @param config The mailbox configuration
     * @return A {@link Mailbox} instance suitable for an actor's mailbox.
     */
    Mailbox<M> createMailbox(MailboxConfig config);
}
