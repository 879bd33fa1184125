package com.cairnsystems;

/**
 * A message that carries the address its answers go to.
 * <p>
 * {@link ActorContext#reply(ReplyingMessage, Object)} uses {@link #replyTo()} so handlers do not
 * need to unpack the address themselves.
 */
public interface ReplyingMessage {

    /**
     * @return the PID that should receive responses to this message
     */
    Pid replyTo();
}
