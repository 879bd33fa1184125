package com.cairnsystems.persistence.journal;

import java.io.Serializable;
import java.util.Objects;
import java.util.Set;

/**
 * Envelope that attaches tags to an event on the write path. The journal stores the inner payload
 * and indexes the tags; the envelope itself is never stored.
 *
 * @param payload the event
 * @param tags    tag names; none of them may contain {@value #DELIMITER}
 */
public record Tagged(Object payload, Set<String> tags) implements Serializable {

    /**
     * Separator used by the storage encoding of tags.
     */
    public static final char DELIMITER = ';';

    public Tagged {
        Objects.requireNonNull(payload, "payload");
        tags = Set.copyOf(tags);
    }

    public static Tagged of(Object payload, String... tags) {
        return new Tagged(payload, Set.of(tags));
    }
}
