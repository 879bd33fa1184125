package com.cairnsystems;

/**
 * Delivered to every watcher of an actor once that actor has stopped.
 *
 * @param actor the actor that stopped
 * @see ActorContext#watch(Pid)
 */
public record Terminated(Pid actor) {
}
