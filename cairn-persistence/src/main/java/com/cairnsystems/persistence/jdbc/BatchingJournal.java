package com.cairnsystems.persistence.jdbc;

import com.cairnsystems.ActorContext;
import com.cairnsystems.ActorSystem;
import com.cairnsystems.Pid;
import com.cairnsystems.Terminated;
import com.cairnsystems.handler.Handler;
import com.cairnsystems.pattern.CircuitBreaker;
import com.cairnsystems.persistence.JournalException;
import com.cairnsystems.persistence.journal.Chunk;
import com.cairnsystems.persistence.journal.ChunkOutcome;
import com.cairnsystems.persistence.journal.ConcurrencyGate;
import com.cairnsystems.persistence.journal.JournalRequest;
import com.cairnsystems.persistence.journal.JournalRequest.DeleteMessagesTo;
import com.cairnsystems.persistence.journal.JournalRequest.ReadHighestSequenceNr;
import com.cairnsystems.persistence.journal.JournalRequest.ReplayMessages;
import com.cairnsystems.persistence.journal.JournalRequest.ReplayTaggedMessages;
import com.cairnsystems.persistence.journal.JournalRequest.WriteMessages;
import com.cairnsystems.persistence.journal.JournalResponse;
import com.cairnsystems.persistence.journal.RequestBuffer;
import com.cairnsystems.persistence.journal.SubscriptionCommand;
import com.cairnsystems.persistence.journal.SubscriptionCommand.SubscribeAllPersistenceIds;
import com.cairnsystems.persistence.journal.SubscriptionCommand.SubscribePersistenceId;
import com.cairnsystems.persistence.journal.SubscriptionCommand.SubscribeTag;
import com.cairnsystems.persistence.journal.SubscriptionCommand.Unsubscribe;
import com.cairnsystems.persistence.journal.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Batching event journal hosted on an actor.
 * <p>
 * Requests are buffered in arrival order and cut into chunks of at most {@code maxBatchSize}. At
 * most {@code maxConcurrentOperations} chunks execute at once, on a storage thread pool and under a
 * circuit breaker. Buffer, subscriptions and the token counter belong to the actor thread; a
 * finished chunk comes back as a message and only then are its responses sent, its notifications
 * published and its token returned.
 * <p>
 * A chunk that fails as a whole (no connection, failed commit, open circuit breaker, timeout) is
 * rolled back and logged, and none of its requests is answered. Callers must apply their own
 * timeout to every request.
 */
public class BatchingJournal implements Handler<Object> {

    private static final Logger logger = LoggerFactory.getLogger(BatchingJournal.class);

    private final JournalSettings settings;
    private final StorageDriver driver;

    private RequestBuffer buffer;
    private SubscriptionRegistry subscriptions;
    private ConcurrencyGate gate;
    private ChunkExecutor chunkExecutor;
    private ExecutorService storageExecutor;
    private AtomicBoolean cancelled;
    private boolean initialized;
    private boolean scanPending;
    private long incarnation;

    public BatchingJournal(JournalSettings settings) {
        this(settings, new JdbcStorageDriver(settings));
    }

    public BatchingJournal(JournalSettings settings, StorageDriver driver) {
        this.settings = settings;
        this.driver = driver;
    }

    /**
     * Starts a journal actor on {@code system}.
     *
     * @return the journal's pid; send it {@link JournalRequest}s and {@link SubscriptionCommand}s
     */
    public static Pid spawn(ActorSystem system, String journalId, JournalSettings settings) {
        return spawn(system, journalId, settings, new JdbcStorageDriver(settings));
    }

    public static Pid spawn(ActorSystem system, String journalId, JournalSettings settings, StorageDriver driver) {
        return system.actorOf(new BatchingJournal(settings, driver))
                .withId(journalId)
                .spawn();
    }

    @Override
    public void preStart(ActorContext context) {
        incarnation++;
        cancelled = new AtomicBoolean(false);
        buffer = new RequestBuffer(settings.getMaxBufferSize());
        subscriptions = new SubscriptionRegistry(context);
        storageExecutor = context.getSystem().getThreadPoolFactory()
                .createFixedExecutorService("journal-" + context.getActorId(), settings.getMaxConcurrentOperations());
        chunkExecutor = new ChunkExecutor(driver, settings, cancelled);

        CircuitBreakerSettings breakerSettings = settings.getCircuitBreaker();
        CircuitBreaker circuitBreaker = new CircuitBreaker("journal-" + context.getActorId(),
                breakerSettings.getMaxFailures(), breakerSettings.getCallTimeout(), breakerSettings.getResetTimeout());
        gate = new ConcurrencyGate(settings.getMaxConcurrentOperations(), circuitBreaker, storageExecutor,
                chunkExecutor::execute);

        driver.open();
        scanPending = false;
        if (settings.isAutoInitialize()) {
            initialized = false;
            long current = incarnation;
            CompletableFuture.runAsync(chunkExecutor::createTables, storageExecutor)
                    .whenComplete((ignored, error) ->
                            context.tellSelf(new SchemaInitialized(current, unwrap(error))));
        } else {
            initialized = true;
        }
        logger.info("Journal {} started with {}", context.getActorId(), settings);
    }

    @Override
    public void receive(Object message, ActorContext context) {
        if (message instanceof JournalRequest request) {
            enqueue(request, context);
        } else if (message instanceof ChunkCompleted completed) {
            onChunkCompleted(completed, context);
        } else if (message instanceof SubscriptionCommand command) {
            onSubscriptionCommand(command, context);
        } else if (message instanceof Terminated terminated) {
            subscriptions.onTerminated(terminated.actor());
        } else if (message instanceof PersistenceIdsScanned scanned) {
            onPersistenceIdsScanned(scanned);
        } else if (message instanceof SchemaInitialized schema) {
            onSchemaInitialized(schema, context);
        } else {
            logger.warn("Journal {} ignoring unsupported message of type {}",
                    context.getActorId(), message.getClass().getName());
        }
    }

    @Override
    public void postStop(ActorContext context) {
        cancelled.set(true);
        storageExecutor.shutdownNow();
        driver.close();
        int dropped = buffer.clear();
        logger.info("Journal {} stopped; {} chunk(s) in flight and {} buffered request(s) were abandoned",
                context.getActorId(), gate.getInFlight(), dropped);
    }

    private void enqueue(JournalRequest request, ActorContext context) {
        if (!buffer.offer(request)) {
            JournalException.BufferOverflowException overflow =
                    new JournalException.BufferOverflowException(buffer.getMaxBufferSize());
            logger.warn("Journal {} rejected {}: buffer holds {} requests",
                    context.getActorId(), request.getClass().getSimpleName(), buffer.size());
            if (request.replyTo() != null) {
                context.tell(request.replyTo(), request.accept(new OverflowResponse(overflow)));
            }
            return;
        }
        tryDispatch(context);
    }

    private void tryDispatch(ActorContext context) {
        if (!initialized) {
            return;
        }
        while (gate.hasCapacity() && !buffer.isEmpty()) {
            Chunk chunk = buffer.dequeueChunk(settings.getMaxBatchSize());
            long current = incarnation;
            long admitted = System.nanoTime();
            gate.admit(chunk).whenComplete((outcome, error) ->
                    context.tellSelf(new ChunkCompleted(current, chunk, outcome, unwrap(error),
                            Duration.ofNanos(System.nanoTime() - admitted))));
        }
    }

    private void onChunkCompleted(ChunkCompleted completed, ActorContext context) {
        if (completed.incarnation() != incarnation) {
            logger.debug("Journal {} ignoring completion of chunk {} from a previous incarnation",
                    context.getActorId(), completed.chunk().chunkId());
            return;
        }
        gate.release();
        Chunk chunk = completed.chunk();

        if (completed.failure() == null) {
            ChunkOutcome outcome = completed.outcome();
            for (ChunkOutcome.Delivery delivery : outcome.deliveries()) {
                context.tell(delivery.recipient(), delivery.message());
            }
            for (String persistenceId : outcome.writtenPersistenceIds()) {
                subscriptions.addKnownPersistenceId(persistenceId);
                subscriptions.notifyPersistenceIdChanged(persistenceId);
            }
            for (String tag : outcome.writtenTags()) {
                subscriptions.notifyTagChanged(tag);
            }
            Pid tap = settings.getRequestTap();
            if (tap != null) {
                for (JournalRequest request : chunk.requests()) {
                    context.tell(tap, request);
                }
            }
            logger.debug("Journal {} completed chunk {} with {} operation(s) in {} ms",
                    context.getActorId(), chunk.chunkId(), chunk.size(), outcome.elapsed().toMillis());
        } else {
            logger.error("Journal {} failed chunk {} with {} operation(s) after {} ms; none of them is answered",
                    context.getActorId(), chunk.chunkId(), chunk.size(), completed.elapsed().toMillis(),
                    completed.failure());
        }

        tryDispatch(context);
    }

    private void onSubscriptionCommand(SubscriptionCommand command, ActorContext context) {
        if (command instanceof SubscribePersistenceId subscribe) {
            subscriptions.subscribeToPersistenceId(subscribe.persistenceId(), subscribe.subscriber());
        } else if (command instanceof SubscribeTag subscribe) {
            subscriptions.subscribeToTag(subscribe.tag(), subscribe.subscriber());
        } else if (command instanceof SubscribeAllPersistenceIds) {
            if (subscriptions.subscribeToAllPersistenceIds(command.subscriber())) {
                if (initialized) {
                    startPersistenceIdScan(context);
                } else {
                    scanPending = true;
                }
            }
        } else if (command instanceof Unsubscribe) {
            subscriptions.unsubscribe(command.subscriber());
        }
    }

    private void startPersistenceIdScan(ActorContext context) {
        long current = incarnation;
        CompletableFuture.supplyAsync(chunkExecutor::loadPersistenceIds, storageExecutor)
                .whenComplete((ids, error) ->
                        context.tellSelf(new PersistenceIdsScanned(current, ids, unwrap(error))));
    }

    private void onPersistenceIdsScanned(PersistenceIdsScanned scanned) {
        if (scanned.incarnation() != incarnation) {
            return;
        }
        if (scanned.failure() == null) {
            subscriptions.onPersistenceIdsScanned(scanned.persistenceIds());
        } else {
            subscriptions.onPersistenceIdsScanFailed(scanned.failure());
        }
    }

    private void onSchemaInitialized(SchemaInitialized message, ActorContext context) {
        if (message.incarnation() != incarnation) {
            return;
        }
        if (message.failure() != null) {
            logger.error("Journal {} could not create its tables and stops", context.getActorId(), message.failure());
            context.stop();
            return;
        }
        initialized = true;
        if (scanPending) {
            scanPending = false;
            startPersistenceIdScan(context);
        }
        tryDispatch(context);
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    /**
     * Failure response for a request refused by a full buffer.
     */
    private static final class OverflowResponse implements JournalRequest.Visitor<JournalResponse> {
        private final JournalException.BufferOverflowException cause;

        OverflowResponse(JournalException.BufferOverflowException cause) {
            this.cause = cause;
        }

        @Override
        public JournalResponse visitWrite(WriteMessages request) {
            return new JournalResponse.WriteMessagesFailed(cause);
        }

        @Override
        public JournalResponse visitReplay(ReplayMessages request) {
            return new JournalResponse.ReplayMessagesFailure(cause);
        }

        @Override
        public JournalResponse visitReadHighest(ReadHighestSequenceNr request) {
            return new JournalResponse.ReadHighestSequenceNrFailure(cause);
        }

        @Override
        public JournalResponse visitDelete(DeleteMessagesTo request) {
            return new JournalResponse.DeleteMessagesFailure(cause, request.toSequenceNr());
        }

        @Override
        public JournalResponse visitReplayTagged(ReplayTaggedMessages request) {
            return new JournalResponse.ReplayMessagesFailure(cause);
        }
    }

    /**
     * A chunk finished executing, successfully ({@code outcome}) or not ({@code failure}).
     */
    record ChunkCompleted(long incarnation, Chunk chunk, ChunkOutcome outcome, Throwable failure, Duration elapsed) {
    }

    record PersistenceIdsScanned(long incarnation, Set<String> persistenceIds, Throwable failure) {
    }

    record SchemaInitialized(long incarnation, Throwable failure) {
    }
}
