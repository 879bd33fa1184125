package com.cairnsystems.persistence.journal;

import com.cairnsystems.ActorContext;
import com.cairnsystems.Pid;
import com.cairnsystems.persistence.journal.SubscriptionNotification.CurrentPersistenceIds;
import com.cairnsystems.persistence.journal.SubscriptionNotification.EventAppended;
import com.cairnsystems.persistence.journal.SubscriptionNotification.PersistenceIdAdded;
import com.cairnsystems.persistence.journal.SubscriptionNotification.TaggedEventAppended;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Subscribers of the journal, per stream, per tag and for the set of all streams.
 * <p>
 * Confined to the journal's actor thread. Every subscriber is death-watched through the
 * {@link ActorContext}; a {@code Terminated} message, an {@link SubscriptionCommand.Unsubscribe}
 * or a failed liveness check before a notification removes it from every set.
 * <p>
 * The set of known persistence ids is seeded by one asynchronous scan, requested when the first
 * all-ids subscriber arrives. Ids observed through writes before the scan completes are merged into
 * its result.
 */
public class SubscriptionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final ActorContext context;
    private final Map<String, Set<Pid>> persistenceIdSubscribers = new HashMap<>();
    private final Map<String, Set<Pid>> tagSubscribers = new HashMap<>();
    private final Set<Pid> allPersistenceIdsSubscribers = new LinkedHashSet<>();

    private final Set<String> knownPersistenceIds = new HashSet<>();
    private boolean knownPersistenceIdsSeeded = false;
    private boolean scanInFlight = false;

    public SubscriptionRegistry(ActorContext context) {
        this.context = context;
    }

    public void subscribeToPersistenceId(String persistenceId, Pid subscriber) {
        context.watch(subscriber);
        persistenceIdSubscribers.computeIfAbsent(persistenceId, k -> new LinkedHashSet<>()).add(subscriber);
    }

    public void subscribeToTag(String tag, Pid subscriber) {
        context.watch(subscriber);
        tagSubscribers.computeIfAbsent(tag, k -> new LinkedHashSet<>()).add(subscriber);
    }

    /**
     * Registers an all-ids subscriber. Once the known ids are seeded the subscriber immediately
     * receives {@link CurrentPersistenceIds}; otherwise it receives them when the scan completes.
     *
     * @return true when the caller must start the persistence id scan and report its result through
     * {@link #onPersistenceIdsScanned(Set)} or {@link #onPersistenceIdsScanFailed(Throwable)}
     */
    public boolean subscribeToAllPersistenceIds(Pid subscriber) {
        context.watch(subscriber);
        allPersistenceIdsSubscribers.add(subscriber);
        if (knownPersistenceIdsSeeded) {
            context.tell(subscriber, new CurrentPersistenceIds(knownPersistenceIds));
            return false;
        }
        if (scanInFlight) {
            return false;
        }
        scanInFlight = true;
        return true;
    }

    public void onPersistenceIdsScanned(Set<String> persistenceIds) {
        scanInFlight = false;
        knownPersistenceIds.addAll(persistenceIds);
        knownPersistenceIdsSeeded = true;
        logger.debug("Seeded {} known persistence ids", knownPersistenceIds.size());
        CurrentPersistenceIds current = new CurrentPersistenceIds(knownPersistenceIds);
        for (Pid subscriber : liveSubscribers(allPersistenceIdsSubscribers)) {
            context.tell(subscriber, current);
        }
    }

    /**
     * Clears the in-flight scan; the next all-ids subscriber triggers a new one.
     */
    public void onPersistenceIdsScanFailed(Throwable cause) {
        scanInFlight = false;
        logger.error("Failed to load the known persistence ids", cause);
    }

    /**
     * Removes the subscriber from every set.
     */
    public void unsubscribe(Pid subscriber) {
        remove(subscriber);
        context.unwatch(subscriber);
    }

    /**
     * Removes a subscriber that has terminated.
     */
    public void onTerminated(Pid subscriber) {
        if (remove(subscriber)) {
            logger.debug("Removed terminated subscriber {}", subscriber);
        }
    }

    /**
     * Records a persistence id observed by a committed write. Only the first observation of an id
     * notifies the all-ids subscribers, and only once the known ids are seeded.
     */
    public void addKnownPersistenceId(String persistenceId) {
        if (knownPersistenceIds.add(persistenceId) && knownPersistenceIdsSeeded) {
            PersistenceIdAdded added = new PersistenceIdAdded(persistenceId);
            for (Pid subscriber : liveSubscribers(allPersistenceIdsSubscribers)) {
                context.tell(subscriber, added);
            }
        }
    }

    public void notifyPersistenceIdChanged(String persistenceId) {
        Set<Pid> subscribers = persistenceIdSubscribers.get(persistenceId);
        if (subscribers == null) {
            return;
        }
        EventAppended appended = new EventAppended(persistenceId);
        for (Pid subscriber : liveSubscribers(subscribers)) {
            context.tell(subscriber, appended);
        }
    }

    public void notifyTagChanged(String tag) {
        Set<Pid> subscribers = tagSubscribers.get(tag);
        if (subscribers == null) {
            return;
        }
        TaggedEventAppended appended = new TaggedEventAppended(tag);
        for (Pid subscriber : liveSubscribers(subscribers)) {
            context.tell(subscriber, appended);
        }
    }

    public boolean hasPersistenceIdSubscribers() {
        return !persistenceIdSubscribers.isEmpty();
    }

    public boolean hasTagSubscribers() {
        return !tagSubscribers.isEmpty();
    }

    public boolean hasAllPersistenceIdsSubscribers() {
        return !allPersistenceIdsSubscribers.isEmpty();
    }

    public boolean isSubscribed(Pid subscriber) {
        if (allPersistenceIdsSubscribers.contains(subscriber)) {
            return true;
        }
        for (Set<Pid> subscribers : persistenceIdSubscribers.values()) {
            if (subscribers.contains(subscriber)) {
                return true;
            }
        }
        for (Set<Pid> subscribers : tagSubscribers.values()) {
            if (subscribers.contains(subscriber)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> getKnownPersistenceIds() {
        return Set.copyOf(knownPersistenceIds);
    }

    /**
     * @return a copy of {@code subscribers} without dead recipients; dead ones are removed everywhere
     */
    private Set<Pid> liveSubscribers(Set<Pid> subscribers) {
        Set<Pid> live = new LinkedHashSet<>(subscribers.size());
        Set<Pid> dead = null;
        for (Pid subscriber : subscribers) {
            if (context.isAlive(subscriber)) {
                live.add(subscriber);
            } else {
                if (dead == null) {
                    dead = new HashSet<>();
                }
                dead.add(subscriber);
            }
        }
        if (dead != null) {
            for (Pid subscriber : dead) {
                logger.debug("Pruning dead subscriber {}", subscriber);
                remove(subscriber);
            }
        }
        return live;
    }

    private boolean remove(Pid subscriber) {
        boolean removed = allPersistenceIdsSubscribers.remove(subscriber);
        removed |= removeFrom(persistenceIdSubscribers, subscriber);
        removed |= removeFrom(tagSubscribers, subscriber);
        return removed;
    }

    private static boolean removeFrom(Map<String, Set<Pid>> subscriptions, Pid subscriber) {
        boolean removed = false;
        Iterator<Set<Pid>> it = subscriptions.values().iterator();
        while (it.hasNext()) {
            Set<Pid> subscribers = it.next();
            if (subscribers.remove(subscriber)) {
                removed = true;
                if (subscribers.isEmpty()) {
                    it.remove();
                }
            }
        }
        return removed;
    }
}
