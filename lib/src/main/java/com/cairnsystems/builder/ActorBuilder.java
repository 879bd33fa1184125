package com.cairnsystems.builder;

import com.cairnsystems.ActorSystem;
import com.cairnsystems.Pid;
import com.cairnsystems.SupervisionStrategy;
import com.cairnsystems.config.MailboxConfig;
import com.cairnsystems.config.MailboxProvider;
import com.cairnsystems.config.ThreadPoolFactory;
import com.cairnsystems.handler.Handler;
import com.cairnsystems.internal.HandlerActor;

/**
 * Builder for creating actors with a fluent API.
 *
 * @param <Message> The type of messages this actor processes
 */
public class ActorBuilder<Message> {

    private final ActorSystem system;
    private final Handler<Message> handler;
    private String id;
    private MailboxConfig mailboxConfig;
    private SupervisionStrategy supervisionStrategy;
    private ThreadPoolFactory threadPoolFactory;
    private MailboxProvider<Message> mailboxProvider;

    /**
     * Creates a new ActorBuilder with the specified system and handler.
     *
     * @param system The actor system
     * @param handler The handler to delegate to
     */
    public ActorBuilder(ActorSystem system, Handler<Message> handler) {
        this.system = system;
        this.handler = handler;
    }

    /**
     * Sets the ID for the actor. Without one, a random UUID is used.
     *
     * @param id The ID for the actor
     * @return This builder for method chaining
     */
    public ActorBuilder<Message> withId(String id) {
        this.id = id;
        return this;
    }

    public ActorBuilder<Message> withMailboxConfig(MailboxConfig mailboxConfig) {
        this.mailboxConfig = mailboxConfig;
        return this;
    }

    public ActorBuilder<Message> withSupervisionStrategy(SupervisionStrategy supervisionStrategy) {
        this.supervisionStrategy = supervisionStrategy;
        return this;
    }

    public ActorBuilder<Message> withThreadPoolFactory(ThreadPoolFactory threadPoolFactory) {
        this.threadPoolFactory = threadPoolFactory;
        return this;
    }

    public ActorBuilder<Message> withMailboxProvider(MailboxProvider<Message> mailboxProvider) {
        this.mailboxProvider = mailboxProvider;
        return this;
    }

    /**
     * Creates and starts the actor with the configured settings.
     *
     * @return The PID of the created actor
     * @throws IllegalStateException if an actor with the same id is already registered
     */
    public Pid spawn() {
        String finalId = id != null ? id : system.generateActorId();

        HandlerActor<Message> actor = new HandlerActor<>(
                system,
                finalId,
                handler,
                mailboxConfig,
                threadPoolFactory,
                mailboxProvider);

        if (supervisionStrategy != null) {
            actor.withSupervisionStrategy(supervisionStrategy);
        }

        if (!system.registerActor(actor)) {
            throw new IllegalStateException("Actor id already in use: " + finalId);
        }
        actor.start();

        return actor.self();
    }
}
