package com.cairnsystems.persistence.journal;

import java.util.Set;

/**
 * Change notifications pushed to subscribers.
 */
public sealed interface SubscriptionNotification
        permits SubscriptionNotification.EventAppended,
                SubscriptionNotification.TaggedEventAppended,
                SubscriptionNotification.PersistenceIdAdded,
                SubscriptionNotification.CurrentPersistenceIds {

    record EventAppended(String persistenceId) implements SubscriptionNotification {
    }

    record TaggedEventAppended(String tag) implements SubscriptionNotification {
    }

    record PersistenceIdAdded(String persistenceId) implements SubscriptionNotification {
    }

    record CurrentPersistenceIds(Set<String> allPersistenceIds) implements SubscriptionNotification {
        public CurrentPersistenceIds {
            allPersistenceIds = Set.copyOf(allPersistenceIds);
        }
    }
}
