package com.cairnsystems;

import com.cairnsystems.builder.ActorBuilder;
import com.cairnsystems.config.DefaultMailboxProvider;
import com.cairnsystems.config.MailboxConfig;
import com.cairnsystems.config.MailboxProvider;
import com.cairnsystems.config.ThreadPoolFactory;
import com.cairnsystems.handler.Handler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * ActorSystem is the main entry point for creating and managing actors.
 */
public class ActorSystem {

    private static final Logger logger = LoggerFactory.getLogger(ActorSystem.class);

    private static final String ASK_PROMISE_PREFIX = "ask-promise-";

    /**
     * Envelope for the ask pattern. {@link Actor} unwraps it and exposes {@code replyTo} as the sender
     * while the request is being handled.
     */
    public record AskPayload<RequestMessage>(RequestMessage message, String replyTo) {}

    private final ConcurrentHashMap<String, Actor<?>> actors;
    private final ScheduledExecutorService delayScheduler;
    private final ConcurrentHashMap<String, ScheduledFuture<?>> pendingDelayedMessages;
    private final ConcurrentHashMap<String, CompletableFuture<Object>> pendingAskPromises;
    // watched actor id -> ids of the actors watching it
    private final ConcurrentHashMap<String, Set<String>> watchers;
    private final ThreadPoolFactory threadPoolConfig;
    private final MailboxConfig mailboxConfig;
    private final MailboxProvider<?> mailboxProvider;
    private volatile boolean terminating = false;

    /**
     * Creates a new ActorSystem with the default configuration.
     */
    public ActorSystem() {
        this(new ThreadPoolFactory(), new MailboxConfig(), new DefaultMailboxProvider<>());
    }

    /**
     * Creates a new ActorSystem with the specified thread pool configuration.
     *
     * @param threadPoolConfig The thread pool configuration
     */
    public ActorSystem(ThreadPoolFactory threadPoolConfig) {
        this(threadPoolConfig, new MailboxConfig(), new DefaultMailboxProvider<>());
    }

    /**
     * Primary constructor for ActorSystem.
     *
     * @param threadPoolConfig The thread pool configuration
     * @param mailboxConfig The default mailbox configuration
     * @param mailboxProvider The mailbox provider implementation
     */
    public ActorSystem(ThreadPoolFactory threadPoolConfig,
                       MailboxConfig mailboxConfig,
                       MailboxProvider<?> mailboxProvider) {
        this.actors = new ConcurrentHashMap<>();
        this.threadPoolConfig = threadPoolConfig != null ? threadPoolConfig : new ThreadPoolFactory();
        this.mailboxConfig = mailboxConfig != null ? mailboxConfig : new MailboxConfig();
        this.mailboxProvider = mailboxProvider != null ? mailboxProvider : new DefaultMailboxProvider<>();

        this.delayScheduler = this.threadPoolConfig.createScheduledExecutorService("actor-system");
        this.pendingDelayedMessages = new ConcurrentHashMap<>();
        this.pendingAskPromises = new ConcurrentHashMap<>();
        this.watchers = new ConcurrentHashMap<>();

        logger.debug("ActorSystem created with {} scheduler threads", this.threadPoolConfig.getSchedulerThreads());
    }

    /**
     * Creates a builder for a new actor with the specified handler instance.
     *
     * @param <Message> The type of messages the actor will handle
     * @param handler The handler instance to use
     * @return A builder for configuring and creating the actor
     */
    public <Message> ActorBuilder<Message> actorOf(Handler<Message> handler) {
        return new ActorBuilder<>(this, handler);
    }

    /**
     * Registers an actor with this system.
     * This method is used by the builder classes.
     *
     * @param actor The actor to register
     * @return false if another actor is already registered under the same id
     */
    public boolean registerActor(Actor<?> actor) {
        return actors.putIfAbsent(actor.getActorId(), actor) == null;
    }

    /**
     * Gets the actor for a Pid.
     *
     * @param pid The actor's Pid
     * @return the actor, or null if it is not registered
     */
    public Actor<?> getActor(Pid pid) {
        return actors.get(pid.actorId());
    }

    /**
     * Liveness check for a Pid. Pending ask promises count as alive until they complete or time out.
     *
     * @param pid The actor's Pid
     * @return true if the Pid can still receive messages
     */
    public boolean isAlive(Pid pid) {
        if (pid == null) {
            return false;
        }
        if (pid.actorId().startsWith(ASK_PROMISE_PREFIX)) {
            return pendingAskPromises.containsKey(pid.actorId());
        }
        Actor<?> actor = actors.get(pid.actorId());
        return actor != null && actor.isRunning();
    }

    /**
     * Registers {@code watcher} for a {@link Terminated} message when {@code target} stops.
     *
     * @param watcher the actor to notify
     * @param target the actor to watch
     */
    public void watch(Pid watcher, Pid target) {
        Set<String> targetWatchers = watchers.computeIfAbsent(target.actorId(), k -> ConcurrentHashMap.newKeySet());
        targetWatchers.add(watcher.actorId());
        // The target may have stopped before the registration landed
        if (!isAlive(target) && targetWatchers.remove(watcher.actorId())) {
            routeMessage(watcher.actorId(), new Terminated(target));
        }
    }

    public void unwatch(Pid watcher, Pid target) {
        Set<String> targetWatchers = watchers.get(target.actorId());
        if (targetWatchers != null) {
            targetWatchers.remove(watcher.actorId());
        }
    }

    /**
     * Shuts down and removes the actor with the specified ID, then notifies its watchers.
     *
     * @param actorId The ID of the actor to shut down
     */
    public void shutdown(String actorId) {
        Actor<?> actor = actors.remove(actorId);
        if (actor != null && actor.isRunning()) {
            actor.stop();
        }
        if (actor == null) {
            return;
        }
        for (Set<String> watchedBy : watchers.values()) {
            watchedBy.remove(actorId);
        }
        Set<String> toNotify = watchers.remove(actorId);
        if (toNotify != null && !terminating) {
            Terminated terminated = new Terminated(new Pid(actorId, this));
            for (String watcherId : toNotify) {
                routeMessage(watcherId, terminated);
            }
        }
    }

    /**
     * Stops an actor identified by its Pid.
     *
     * @param pid The Pid of the actor to stop
     */
    public void stopActor(Pid pid) {
        Actor<?> actor = getActor(pid);
        if (actor != null) {
            actor.stop();
        }
    }

    public ThreadPoolFactory getThreadPoolFactory() {
        return threadPoolConfig;
    }

    public MailboxConfig getMailboxConfig() {
        return mailboxConfig;
    }

    @SuppressWarnings("unchecked")
    public <T> MailboxProvider<T> getMailboxProvider() {
        return (MailboxProvider<T>) mailboxProvider;
    }

    public String generateActorId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Stops every actor, fails pending asks and releases the scheduler.
     */
    public void shutdown() {
        logger.info("Shutting down all actors in the system");
        terminating = true;

        List<String> actorIds = new ArrayList<>(actors.keySet());
        for (String actorId : actorIds) {
            Actor<?> actor = actors.get(actorId);
            if (actor != null && actor.isRunning()) {
                try {
                    actor.stop();
                    logger.debug("Actor {} shut down successfully", actorId);
                } catch (RuntimeException e) {
                    logger.warn("Error shutting down actor {}", actorId, e);
                }
            }
        }
        actors.clear();
        watchers.clear();

        for (CompletableFuture<Object> promise : pendingAskPromises.values()) {
            promise.completeExceptionally(new IllegalStateException("Actor system shutting down"));
        }
        pendingAskPromises.clear();

        for (ScheduledFuture<?> future : pendingDelayedMessages.values()) {
            future.cancel(true);
        }
        pendingDelayedMessages.clear();

        safeShutdownScheduler(delayScheduler);
        logger.info("Actor system shut down successfully");
    }

    private void safeShutdownScheduler(ExecutorService scheduler) {
        if (scheduler == null || scheduler.isShutdown()) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(threadPoolConfig.getSchedulerShutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    boolean completeAskPromise(String promiseId, Object response) {
        CompletableFuture<Object> promise = pendingAskPromises.remove(promiseId);
        if (promise != null) {
            promise.complete(response);
            return true;
        }
        return false;
    }

    /**
     * Routes a message to an actor by ID, or completes a pending ask when the ID names a promise.
     *
     * @param <Message> The type of the message
     * @param actorId The ID of the actor to route the message to
     * @param message The message to route
     */
    <Message> void routeMessage(String actorId, Message message) {
        if (actorId.startsWith(ASK_PROMISE_PREFIX)) {
            if (!completeAskPromise(actorId, message)) {
                logger.debug("Promise {} not found (may have timed out), ignoring reply", actorId);
            }
            return;
        }

        Actor<?> actor = actors.get(actorId);
        if (actor == null) {
            if (terminating) {
                logger.debug("Dropping message for actor {} during shutdown", actorId);
            } else {
                logger.warn("Failed to route message to actor {}: Actor not found", actorId);
            }
            return;
        }
        @SuppressWarnings("unchecked")
        Actor<Message> typedActor = (Actor<Message>) actor;
        typedActor.tell(message);
    }

    /**
     * Sends a message to an actor.
     *
     * @param <T> The type of the message
     * @param pid The PID of the actor to send the message to
     * @param message The message to send
     */
    public <T> void tell(Pid pid, T message) {
        routeMessage(pid.actorId(), message);
    }

    /**
     * Sends a message to an actor after a delay.
     *
     * @param <T> The type of the message
     * @param pid The PID of the actor to send the message to
     * @param message The message to send
     * @param delay The delay amount
     * @param timeUnit The time unit for the delay
     */
    public <T> void tell(Pid pid, T message, long delay, TimeUnit timeUnit) {
        routeMessage(pid.actorId(), message, delay, timeUnit);
    }

    <Message> void routeMessage(String actorId, Message message, long delay, TimeUnit timeUnit) {
        String taskId = generateActorId();
        ScheduledFuture<?> future = delayScheduler.schedule(() -> {
            pendingDelayedMessages.remove(taskId);
            routeMessage(actorId, message);
        }, delay, timeUnit);
        pendingDelayedMessages.put(taskId, future);
    }

    /**
     * Sends a message to the target actor and returns a CompletableFuture that will be completed with the reply.
     * The reply address is a lightweight promise, not an actor; the target answers through
     * {@link ActorContext#getSender()}.
     *
     * @param target The Pid of the target actor.
     * @param message The message to send.
     * @param timeout The maximum time to wait for a reply.
     * @param <RequestMessage> The type of the request message.
     * @param <ResponseMessage> The type of the expected response message.
     * @return A CompletableFuture completed with the response, or exceptionally with a TimeoutException
     */
    @SuppressWarnings("unchecked")
    public <RequestMessage, ResponseMessage> CompletableFuture<ResponseMessage> ask(
            Pid target, RequestMessage message, Duration timeout) {

        CompletableFuture<ResponseMessage> result = new CompletableFuture<>();
        String promiseId = ASK_PROMISE_PREFIX + generateActorId();

        // Register the promise before sending so a fast reply cannot be lost
        CompletableFuture<Object> promise = new CompletableFuture<>();
        pendingAskPromises.put(promiseId, promise);

        ScheduledFuture<?> timeoutFuture = delayScheduler.schedule(() -> {
            CompletableFuture<Object> timedOutPromise = pendingAskPromises.remove(promiseId);
            if (timedOutPromise != null) {
                timedOutPromise.completeExceptionally(
                        new TimeoutException("Timeout waiting for response from " + target.actorId()));
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);

        promise.whenComplete((response, error) -> {
            timeoutFuture.cancel(false);
            if (error != null) {
                result.completeExceptionally(error);
            } else {
                try {
                    result.complete((ResponseMessage) response);
                } catch (ClassCastException e) {
                    result.completeExceptionally(new IllegalArgumentException(
                            "Received response of unexpected type: " + response.getClass().getName(), e));
                }
            }
        });

        if (getActor(target) != null) {
            routeMessage(target.actorId(), new AskPayload<>(message, promiseId));
        } else {
            pendingAskPromises.remove(promiseId);
            timeoutFuture.cancel(false);
            result.completeExceptionally(new IllegalArgumentException("Target actor not found: " + target.actorId()));
        }
        return result;
    }
}
