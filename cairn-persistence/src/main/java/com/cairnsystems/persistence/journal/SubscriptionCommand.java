package com.cairnsystems.persistence.journal;

import com.cairnsystems.Pid;

import java.util.Objects;

/**
 * Registrations for change notifications. A subscriber stays registered until it sends
 * {@link Unsubscribe} or terminates.
 */
public sealed interface SubscriptionCommand
        permits SubscriptionCommand.SubscribePersistenceId,
                SubscriptionCommand.SubscribeTag,
                SubscriptionCommand.SubscribeAllPersistenceIds,
                SubscriptionCommand.Unsubscribe {

    Pid subscriber();

    /**
     * Receive {@link SubscriptionNotification.EventAppended} for one stream.
     */
    record SubscribePersistenceId(String persistenceId, Pid subscriber) implements SubscriptionCommand {
        public SubscribePersistenceId {
            Objects.requireNonNull(persistenceId, "persistenceId");
            Objects.requireNonNull(subscriber, "subscriber");
        }
    }

    /**
     * Receive {@link SubscriptionNotification.TaggedEventAppended} for one tag.
     */
    record SubscribeTag(String tag, Pid subscriber) implements SubscriptionCommand {
        public SubscribeTag {
            Objects.requireNonNull(tag, "tag");
            Objects.requireNonNull(subscriber, "subscriber");
        }
    }

    /**
     * Receive {@link SubscriptionNotification.CurrentPersistenceIds} once, then
     * {@link SubscriptionNotification.PersistenceIdAdded} for each new stream.
     */
    record SubscribeAllPersistenceIds(Pid subscriber) implements SubscriptionCommand {
        public SubscribeAllPersistenceIds {
            Objects.requireNonNull(subscriber, "subscriber");
        }
    }

    /**
     * Removes the subscriber from every registration.
     */
    record Unsubscribe(Pid subscriber) implements SubscriptionCommand {
        public Unsubscribe {
            Objects.requireNonNull(subscriber, "subscriber");
        }
    }
}
