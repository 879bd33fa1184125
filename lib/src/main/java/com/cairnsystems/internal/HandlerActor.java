package com.cairnsystems.internal;

import com.cairnsystems.Actor;
import com.cairnsystems.ActorContext;
import com.cairnsystems.ActorContextImpl;
import com.cairnsystems.ActorSystem;
import com.cairnsystems.config.MailboxConfig;
import com.cairnsystems.config.MailboxProvider;
import com.cairnsystems.config.ThreadPoolFactory;
import com.cairnsystems.handler.Handler;

/**
 * Internal implementation of an Actor that delegates to a Handler.
 * This class is not meant to be used directly by users.
 *
 * @param <Message> The type of messages this actor processes
 */
public class HandlerActor<Message> extends Actor<Message> {

    private final Handler<Message> handler;
    private final ActorContext context;

    /**
     * Creates a new HandlerActor with the specified handler.
     *
     * @param system The actor system
     * @param actorId The actor ID
     * @param handler The handler to delegate to
     * @param mailboxConfig The mailbox configuration, or null for the system default
     * @param threadPoolFactory The thread pool factory, or null for the system default
     * @param mailboxProvider The mailbox provider, or null for the system default
     */
    public HandlerActor(
            ActorSystem system,
            String actorId,
            Handler<Message> handler,
            MailboxConfig mailboxConfig,
            ThreadPoolFactory threadPoolFactory,
            MailboxProvider<Message> mailboxProvider) {
        super(system, actorId, mailboxConfig, threadPoolFactory, mailboxProvider);
        this.handler = handler;
        this.context = new ActorContextImpl(this);
    }

    @Override
    protected void receive(Message message) {
        handler.receive(message, context);
    }

    @Override
    protected void preStart() {
        super.preStart();
        handler.preStart(context);
    }

    @Override
    protected void postStop() {
        handler.postStop(context);
        super.postStop();
    }

    @Override
    protected void handleException(Message message, Throwable exception) {
        boolean handled = handler.onError(message, exception, context);
        if (!handled) {
            super.handleException(message, exception);
        }
    }
}
