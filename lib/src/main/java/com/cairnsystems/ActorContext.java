package com.cairnsystems;

import org.slf4j.Logger;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Provides a restricted view of actor functionality to handlers.
 * This allows handlers to access necessary actor features without exposing internal implementation details.
 */
public interface ActorContext {

    /**
     * Gets the PID of this actor.
     *
     * @return The PID of this actor
     */
    Pid self();

    String getActorId();

    /**
     * Sends a message to another actor.
     *
     * @param <T> The type of the message
     * @param target The target actor's PID
     * @param message The message to send
     */
    <T> void tell(Pid target, T message);

    /**
     * Replies to a message that implements {@link ReplyingMessage}.
     *
     * @param <T> The type of the response message
     * @param request The original request message that implements ReplyingMessage
     * @param response The response message to send
     */
    <T> void reply(ReplyingMessage request, T response);

    /**
     * Sends a message to this actor after a delay.
     *
     * @param <T> The type of the message
     * @param message The message to send
     * @param delay The delay amount
     * @param timeUnit The time unit for the delay
     */
    <T> void tellSelf(T message, long delay, TimeUnit timeUnit);

    /**
     * Sends a message to this actor. The message is enqueued behind everything already in the
     * mailbox, which makes this the way to hand results computed on other threads back to the
     * actor's own thread.
     *
     * @param <T> The type of the message
     * @param message The message to send
     */
    <T> void tellSelf(T message);

    /**
     * Registers interest in the termination of another actor. When {@code target} stops, this actor
     * receives a {@link Terminated} message. Watching an actor that is already gone delivers
     * {@code Terminated} immediately.
     *
     * @param target the actor to watch
     */
    void watch(Pid target);

    /**
     * Removes a registration made with {@link #watch(Pid)}.
     *
     * @param target the actor no longer watched
     */
    void unwatch(Pid target);

    /**
     * @param target the actor to check
     * @return true while {@code target} is registered with the system and processing messages
     */
    boolean isAlive(Pid target);

    ActorSystem getSystem();

    /**
     * Stops this actor.
     */
    void stop();

    /**
     * Gets the reply address of the current message when it arrived through
     * {@link ActorSystem#ask}. Plain {@code tell} messages carry no sender.
     *
     * @return An Optional containing the PID of the sender, or empty if no sender context
     */
    Optional<Pid> getSender();

    /**
     * Gets a logger for this actor with the actor ID as context.
     *
     * @return A logger instance configured for this actor
     */
    Logger getLogger();
}
