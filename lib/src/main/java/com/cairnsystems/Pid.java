package com.cairnsystems;

import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.Serial;
import java.io.Serializable;
import java.util.concurrent.TimeUnit;

/**
 * Process ID (Pid) for an actor, used to send messages to the actor.
 * <p>
 * Two Pids are equal when they name the same actor id in the same system, so a Pid can be
 * used as a key in subscriber sets and watch tables.
 * <p>
 * Note: Pid implements Serializable so it can travel inside persisted messages.
 * The ActorSystem reference is not serialized and will be null after deserialization.
 */
public record Pid(String actorId, ActorSystem system) implements Serializable {

    @Serial
    private Object writeReplace() {
        return new SerializationProxy(this);
    }

    @Serial
    private void readObject(ObjectInputStream stream) throws InvalidObjectException {
        throw new InvalidObjectException("Proxy required");
    }

    private static class SerializationProxy implements Serializable {
        @Serial
        private static final long serialVersionUID = 1L;

        private final String actorId;

        SerializationProxy(Pid pid) {
            this.actorId = pid.actorId;
        }

        @Serial
        private Object readResolve() {
            return new Pid(actorId, null);
        }
    }

    /**
     * Sends a message to the actor.
     *
     * @param message The message to send
     * @param <Message> The type of the message
     */
    public <Message> void tell(Message message) {
        if (system == null) {
            throw new IllegalStateException("Pid " + actorId + " is not bound to an actor system");
        }
        system.routeMessage(actorId, message);
    }

    /**
     * Sends a message to the actor after the given delay.
     *
     * @param message The message to send
     * @param delay The delay amount
     * @param timeUnit The time unit for the delay
     * @param <Message> The type of the message
     */
    public <Message> void tell(Message message, long delay, TimeUnit timeUnit) {
        if (system == null) {
            throw new IllegalStateException("Pid " + actorId + " is not bound to an actor system");
        }
        system.routeMessage(actorId, message, delay, timeUnit);
    }

    @Override
    public String toString() {
        return actorId + "@local";
    }
}
