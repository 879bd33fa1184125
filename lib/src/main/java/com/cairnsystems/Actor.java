package com.cairnsystems;

import com.cairnsystems.config.MailboxConfig;
import com.cairnsystems.config.MailboxProvider;
import com.cairnsystems.config.ThreadPoolFactory;
import com.cairnsystems.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.UUID;

/**
 * Core Actor class for the Cairn actor system.
 * Owns one mailbox and one {@link MailboxProcessor}; messages for one actor are never processed concurrently.
 *
 * @param <Message> The type of messages this actor processes
 */
public abstract class Actor<Message> {

    private static final Logger logger = LoggerFactory.getLogger(Actor.class);

    // Per-actor logger with actor ID context
    private final Logger actorLogger;

    private final String actorId;
    private final Pid pid;
    private final ActorSystem system;
    private SupervisionStrategy supervisionStrategy = SupervisionStrategy.RESUME;
    private final MailboxProcessor<Message> mailboxProcessor;

    // Sender context for ask pattern, holds the actor ID of the reply target
    private final ThreadLocal<String> senderContext = new ThreadLocal<>();

    /**
     * Creates a new Actor using the system's default mailbox and thread configuration.
     *
     * @param system  The actor system
     * @param actorId The actor ID, or null to generate one
     */
    protected Actor(ActorSystem system, String actorId) {
        this(system, actorId, system.getMailboxConfig(), system.getThreadPoolFactory(), system.getMailboxProvider());
    }

    /**
     * Creates a new Actor.
     *
     * @param system            The actor system
     * @param actorId           The actor ID, or null to generate one
     * @param mailboxConfig     The mailbox configuration, or null to use the system's default
     * @param threadPoolFactory The thread pool factory, or null to use the system's default
     * @param mailboxProvider   The mailbox provider, or null to use the system's default
     */
    protected Actor(ActorSystem system,
                    String actorId,
                    MailboxConfig mailboxConfig,
                    ThreadPoolFactory threadPoolFactory,
                    MailboxProvider<Message> mailboxProvider) {
        this.system = system;
        this.actorId = actorId == null ? generateDefaultActorId() : actorId;
        this.pid = new Pid(this.actorId, system);
        this.actorLogger = LoggerFactory.getLogger(this.getClass().getName() + "." + this.actorId);

        ThreadPoolFactory effectiveTpf = threadPoolFactory != null ? threadPoolFactory : system.getThreadPoolFactory();
        MailboxProvider<Message> effectiveMp = mailboxProvider != null ? mailboxProvider : system.getMailboxProvider();
        MailboxConfig effectiveMailboxConfig = mailboxConfig != null ? mailboxConfig : system.getMailboxConfig();

        Mailbox<Message> mailbox = effectiveMp.createMailbox(effectiveMailboxConfig);
        int batchSize = effectiveTpf.getActorBatchSize();

        this.mailboxProcessor = new MailboxProcessor<>(
                this.actorId,
                mailbox,
                batchSize,
                this::handleException,
                new ActorLifecycle<Message>() {
                    @Override
                    public void preStart() {
                        Actor.this.preStart();
                    }

                    @Override
                    public void receive(Message message) {
                        if (message instanceof ActorSystem.AskPayload<?> ask) {
                            senderContext.set(ask.replyTo());
                            try {
                                @SuppressWarnings("unchecked")
                                Message request = (Message) ask.message();
                                Actor.this.receive(request);
                            } finally {
                                senderContext.remove();
                            }
                        } else {
                            Actor.this.receive(message);
                        }
                    }

                    @Override
                    public void postStop() {
                        Actor.this.postStop();
                    }
                },
                effectiveTpf);
        logger.debug("Actor {} created with batch size {}", this.actorId, batchSize);
    }

    /**
     * Processes a received message.
     *
     * @param message the message to process
     */
    protected abstract void receive(Message message);

    /**
     * Called before the actor starts processing messages.
     */
    protected void preStart() {
        // Default implementation does nothing
    }

    /**
     * Called after the actor has stopped processing messages.
     */
    protected void postStop() {
        logger.debug("Actor {} stopped.", actorId);
    }

    /**
     * Called when an exception occurs during message processing.
     *
     * @param message   The message that caused the exception
     * @param exception The exception that was thrown
     * @return true if the message should be reprocessed after a restart, false otherwise
     */
    protected boolean onError(Message message, Throwable exception) {
        return false;
    }

    /**
     * Starts the actor and begins processing messages.
     */
    public void start() {
        mailboxProcessor.start();
    }

    public Pid getPid() {
        return pid;
    }

    /**
     * Gets the PID of this actor. Alias for getPid().
     *
     * @return The PID of this actor
     */
    public Pid self() {
        return pid;
    }

    public String getActorId() {
        return actorId;
    }

    public ActorSystem getSystem() {
        return system;
    }

    public void tell(Message message) {
        mailboxProcessor.tell(message);
    }

    /**
     * Gets the sender of the current message being processed.
     *
     * @return An Optional containing the PID of the sender, or empty if no sender context
     */
    public Optional<Pid> getSender() {
        String senderActorId = senderContext.get();
        return Optional.ofNullable(senderActorId).map(id -> new Pid(id, system));
    }

    public Logger getLogger() {
        return actorLogger;
    }

    public boolean isRunning() {
        return mailboxProcessor.isRunning();
    }

    /**
     * Stops the mailbox processor and unregisters this actor, which tells its watchers through
     * {@link Terminated}.
     */
    public void stop() {
        if (!mailboxProcessor.isRunning()) {
            return;
        }
        logger.debug("Stopping actor {}", actorId);
        mailboxProcessor.stop();
        system.shutdown(actorId);
    }

    /**
     * Runs the stop and start hooks in place on the mailbox thread, keeping queued messages.
     *
     * @param failedMessage the message that caused the restart
     * @param reprocess     whether {@code failedMessage} is enqueued again afterwards
     */
    void restart(Message failedMessage, boolean reprocess) {
        postStop();
        preStart();
        if (reprocess) {
            tell(failedMessage);
        }
    }

    public Actor<Message> withSupervisionStrategy(SupervisionStrategy strategy) {
        this.supervisionStrategy = strategy;
        return this;
    }

    public SupervisionStrategy getSupervisionStrategy() {
        return supervisionStrategy;
    }

    protected static String generateDefaultActorId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Handles exceptions according to the current supervision strategy.
     * Delegates to {@link Supervisor}.
     *
     * @param message   The message that caused the exception
     * @param exception The exception that was thrown
     */
    protected void handleException(Message message, Throwable exception) {
        Supervisor.handleException(this, message, exception);
    }
}
