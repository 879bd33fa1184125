package com.cairnsystems;

import org.slf4j.Logger;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Implementation of the ActorContext interface that delegates to an underlying Actor instance.
 */
public class ActorContextImpl implements ActorContext {

    private final Actor<?> actor;

    public ActorContextImpl(Actor<?> actor) {
        this.actor = actor;
    }

    @Override
    public Pid self() {
        return actor.self();
    }

    @Override
    public String getActorId() {
        return actor.getActorId();
    }

    @Override
    public <T> void tell(Pid target, T message) {
        actor.getSystem().tell(target, message);
    }

    @Override
    public <T> void reply(ReplyingMessage request, T response) {
        Pid replyTo = request.replyTo();
        if (replyTo == null) {
            actor.getLogger().debug("Dropping reply {}: request carries no replyTo", response);
            return;
        }
        tell(replyTo, response);
    }

    @Override
    public <T> void tellSelf(T message, long delay, TimeUnit timeUnit) {
        actor.getSystem().tell(actor.self(), message, delay, timeUnit);
    }

    @Override
    public <T> void tellSelf(T message) {
        actor.getSystem().tell(actor.self(), message);
    }

    @Override
    public void watch(Pid target) {
        actor.getSystem().watch(actor.self(), target);
    }

    @Override
    public void unwatch(Pid target) {
        actor.getSystem().unwatch(actor.self(), target);
    }

    @Override
    public boolean isAlive(Pid target) {
        return actor.getSystem().isAlive(target);
    }

    @Override
    public ActorSystem getSystem() {
        return actor.getSystem();
    }

    @Override
    public void stop() {
        actor.stop();
    }

    @Override
    public Optional<Pid> getSender() {
        return actor.getSender();
    }

    @Override
    public Logger getLogger() {
        return actor.getLogger();
    }
}
