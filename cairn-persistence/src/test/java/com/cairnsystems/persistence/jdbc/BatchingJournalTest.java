package com.cairnsystems.persistence.jdbc;

import com.cairnsystems.Pid;
import com.cairnsystems.persistence.JournalException;
import com.cairnsystems.persistence.journal.AtomicWrite;
import com.cairnsystems.persistence.journal.JournalRequest.DeleteMessagesTo;
import com.cairnsystems.persistence.journal.JournalRequest.ReadHighestSequenceNr;
import com.cairnsystems.persistence.journal.JournalRequest.ReplayMessages;
import com.cairnsystems.persistence.journal.JournalRequest.ReplayTaggedMessages;
import com.cairnsystems.persistence.journal.JournalRequest.WriteMessages;
import com.cairnsystems.persistence.journal.JournalResponse;
import com.cairnsystems.persistence.journal.PersistentRecord;
import com.cairnsystems.persistence.journal.SubscriptionCommand;
import com.cairnsystems.persistence.journal.SubscriptionNotification;
import com.cairnsystems.persistence.journal.Tagged;
import com.cairnsystems.test.AsyncAssertion;
import com.cairnsystems.test.TestKit;
import com.cairnsystems.test.TestProbe;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the journal actor on an in-memory HSQLDB database.
 */
class BatchingJournalTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final Duration QUIET = Duration.ofMillis(300);

    private TestKit testKit;
    private TestProbe<Object> probe;

    @BeforeEach
    void setUp() {
        testKit = TestKit.create();
        probe = testKit.createProbe();
    }

    @AfterEach
    void tearDown() {
        testKit.close();
    }

    private static JournalSettings.Builder settings() {
        return JournalSettings.builder()
                .connectionUrl("jdbc:hsqldb:mem:journal-" + UUID.randomUUID())
                .keepAnchorConnection(true)
                .autoInitialize(true);
    }

    private Pid spawn(JournalSettings settings) {
        return BatchingJournal.spawn(testKit.system(), "journal-" + UUID.randomUUID(), settings);
    }

    private Pid spawn(JournalSettings settings, StorageDriver driver) {
        return BatchingJournal.spawn(testKit.system(), "journal-" + UUID.randomUUID(), settings, driver);
    }

    private WriteMessages write(String persistenceId, long from, long to) {
        List<PersistentRecord> records = new ArrayList<>();
        for (long seq = from; seq <= to; seq++) {
            records.add(new PersistentRecord(persistenceId, seq, "event-" + seq));
        }
        return new WriteMessages(List.of(new AtomicWrite(records)), probe.ref(), 7);
    }

    private WriteMessages write(PersistentRecord record) {
        return new WriteMessages(List.of(new AtomicWrite(record)), probe.ref(), 7);
    }

    private void awaitWrite(int records) {
        probe.expectMessage(JournalResponse.WriteMessagesSuccessful.class, TIMEOUT);
        for (int i = 0; i < records; i++) {
            probe.expectMessage(JournalResponse.WriteMessageSuccess.class, TIMEOUT);
        }
    }

    @Test
    void testAccountScenario() {
        Pid journal = spawn(settings().build());

        journal.tell(write("acct-1", 1, 3));
        awaitWrite(3);

        journal.tell(new ReadHighestSequenceNr(0, "acct-1", probe.ref()));
        assertEquals(new JournalResponse.ReadHighestSequenceNrSuccess(3), probe.expectMessage(TIMEOUT));

        journal.tell(new DeleteMessagesTo("acct-1", 2, probe.ref()));
        assertEquals(new JournalResponse.DeleteMessagesSuccess(2), probe.expectMessage(TIMEOUT));

        journal.tell(new ReplayMessages(1, 10, 10, "acct-1", probe.ref()));
        List<Object> replay = probe.receiveUntil(JournalResponse.RecoverySuccess.class, TIMEOUT);
        assertEquals(2, replay.size());
        JournalResponse.ReplayedMessage replayed = assertInstanceOf(JournalResponse.ReplayedMessage.class, replay.get(0));
        assertEquals(3, replayed.persistent().sequenceNr());
        assertEquals("event-3", replayed.persistent().payload());
        assertEquals(new JournalResponse.RecoverySuccess(3), replay.get(1));
    }

    @Test
    void testReplayPreservesSubmissionOrder() {
        Pid journal = spawn(settings().build());

        for (long seq = 1; seq <= 25; seq++) {
            journal.tell(write(new PersistentRecord("ordered", seq, "event-" + seq)));
        }
        for (int i = 0; i < 25; i++) {
            awaitWrite(1);
        }

        journal.tell(new ReplayMessages(1, Long.MAX_VALUE, Long.MAX_VALUE, "ordered", probe.ref()));
        List<Object> replay = probe.receiveUntil(JournalResponse.RecoverySuccess.class, TIMEOUT);

        List<Long> sequenceNrs = replay.stream()
                .filter(m -> m instanceof JournalResponse.ReplayedMessage)
                .map(m -> ((JournalResponse.ReplayedMessage) m).persistent().sequenceNr())
                .collect(Collectors.toList());
        List<Long> expected = new ArrayList<>();
        for (long seq = 1; seq <= 25; seq++) {
            expected.add(seq);
        }
        assertEquals(expected, sequenceNrs);
    }

    @Test
    void testPayloadRoundTrip() {
        Pid journal = spawn(settings().build());
        Withdrawal withdrawal = new Withdrawal("acct-7", 4_200L, List.of("atm", "night"));

        journal.tell(write(new PersistentRecord("acct-7", 1, withdrawal)));
        awaitWrite(1);

        journal.tell(new ReplayMessages(1, 1, 1, "acct-7", probe.ref()));
        JournalResponse.ReplayedMessage replayed = probe.expectMessage(JournalResponse.ReplayedMessage.class, TIMEOUT);
        assertEquals(withdrawal, replayed.persistent().payload());
        probe.expectMessage(JournalResponse.RecoverySuccess.class, TIMEOUT);
    }

    @Test
    void testConcurrentExecutionsNeverExceedLimit() {
        JournalSettings settings = settings()
                .maxConcurrentOperations(3)
                .maxBatchSize(1)
                .build();
        InstrumentedStorageDriver driver = new InstrumentedStorageDriver(new JdbcStorageDriver(settings));
        Pid journal = spawn(settings, driver);

        journal.tell(new ReadHighestSequenceNr(0, "warm-up", probe.ref()));
        probe.expectMessage(JournalResponse.ReadHighestSequenceNrSuccess.class, TIMEOUT);

        driver.delayConnections(20);
        for (int i = 0; i < 30; i++) {
            journal.tell(new ReadHighestSequenceNr(0, "p-" + i, probe.ref()));
        }
        List<Object> responses = probe.expectMessages(30, TIMEOUT);

        assertTrue(responses.stream().allMatch(r -> r instanceof JournalResponse.ReadHighestSequenceNrSuccess));
        assertTrue(driver.getMaxOpenConnections() <= 3,
                "at most 3 chunks may run at once, saw " + driver.getMaxOpenConnections());
        assertTrue(driver.getMaxOpenConnections() >= 2, "requests should have overlapped");
    }

    @Test
    void testBufferOverflowIsAnsweredImmediately() {
        JournalSettings settings = settings()
                .maxConcurrentOperations(1)
                .maxBatchSize(1)
                .maxBufferSize(1)
                .build();
        InstrumentedStorageDriver driver = new InstrumentedStorageDriver(new JdbcStorageDriver(settings));
        Pid journal = spawn(settings, driver);

        journal.tell(new ReadHighestSequenceNr(0, "warm-up", probe.ref()));
        probe.expectMessage(JournalResponse.ReadHighestSequenceNrSuccess.class, TIMEOUT);

        driver.hold();
        journal.tell(new ReadHighestSequenceNr(0, "in-flight", probe.ref()));
        journal.tell(new ReadHighestSequenceNr(0, "buffered", probe.ref()));
        journal.tell(new DeleteMessagesTo("overflow", 4, probe.ref()));

        JournalResponse.DeleteMessagesFailure failure =
                probe.expectMessage(JournalResponse.DeleteMessagesFailure.class, TIMEOUT);
        assertEquals(4, failure.toSequenceNr());
        assertInstanceOf(JournalException.BufferOverflowException.class, failure.cause());

        driver.release();
        List<Object> answered = probe.expectMessages(2, TIMEOUT);
        assertTrue(answered.stream().allMatch(r -> r instanceof JournalResponse.ReadHighestSequenceNrSuccess));
    }

    @Test
    void testFailedChunksStaySilentAndBreakerRecovers() {
        JournalSettings settings = settings()
                .autoInitialize(false)
                .maxConcurrentOperations(1)
                .circuitBreaker(CircuitBreakerSettings.builder()
                        .maxFailures(1)
                        .callTimeout(Duration.ofSeconds(5))
                        .resetTimeout(Duration.ofSeconds(1))
                        .build())
                .build();
        JdbcStorageDriver jdbc = new JdbcStorageDriver(settings);
        jdbc.open();
        new ChunkExecutor(jdbc, settings, new AtomicBoolean()).createTables();
        InstrumentedStorageDriver driver = new InstrumentedStorageDriver(jdbc);
        Pid journal = spawn(settings, driver);

        driver.setFailing(true);
        journal.tell(new ReadHighestSequenceNr(0, "p", probe.ref()));
        probe.expectNoMessage(Duration.ofMillis(200));

        // breaker is open now: the request is dropped without touching storage
        driver.setFailing(false);
        int opened = driver.getConnectionsOpened();
        journal.tell(new ReadHighestSequenceNr(0, "p", probe.ref()));
        probe.expectNoMessage(Duration.ofMillis(100));
        assertEquals(opened, driver.getConnectionsOpened());

        probe.expectNoMessage(Duration.ofMillis(1000));
        journal.tell(new ReadHighestSequenceNr(0, "p", probe.ref()));
        assertEquals(new JournalResponse.ReadHighestSequenceNrSuccess(0), probe.expectMessage(TIMEOUT));
    }

    @Test
    void testNewPersistenceIdIsAnnouncedOnce() {
        Pid journal = spawn(settings().build());
        TestProbe<Object> subscriber = testKit.createProbe();

        journal.tell(write("existing", 1, 1));
        awaitWrite(1);

        journal.tell(new SubscriptionCommand.SubscribeAllPersistenceIds(subscriber.ref()));
        assertEquals(new SubscriptionNotification.CurrentPersistenceIds(Set.of("existing")),
                subscriber.expectMessage(TIMEOUT));

        journal.tell(write("fresh", 1, 1));
        awaitWrite(1);
        journal.tell(write("fresh", 2, 2));
        awaitWrite(1);
        journal.tell(write("existing", 2, 2));
        awaitWrite(1);

        assertEquals(new SubscriptionNotification.PersistenceIdAdded("fresh"), subscriber.expectMessage(TIMEOUT));
        subscriber.expectNoMessage(QUIET);
    }

    @Test
    void testLateAllIdsSubscriberGetsCachedIds() {
        Pid journal = spawn(settings().build());
        TestProbe<Object> first = testKit.createProbe();
        TestProbe<Object> second = testKit.createProbe();

        journal.tell(new SubscriptionCommand.SubscribeAllPersistenceIds(first.ref()));
        assertEquals(new SubscriptionNotification.CurrentPersistenceIds(Set.of()), first.expectMessage(TIMEOUT));

        journal.tell(write("a", 1, 1));
        awaitWrite(1);
        assertEquals(new SubscriptionNotification.PersistenceIdAdded("a"), first.expectMessage(TIMEOUT));

        journal.tell(new SubscriptionCommand.SubscribeAllPersistenceIds(second.ref()));
        assertEquals(new SubscriptionNotification.CurrentPersistenceIds(Set.of("a")), second.expectMessage(TIMEOUT));
    }

    @Test
    void testStreamAndTagSubscribersAreNotified() {
        Pid journal = spawn(settings().build());
        TestProbe<Object> streamSubscriber = testKit.createProbe();
        TestProbe<Object> tagSubscriber = testKit.createProbe();

        journal.tell(new SubscriptionCommand.SubscribePersistenceId("orders", streamSubscriber.ref()));
        journal.tell(new SubscriptionCommand.SubscribeTag("priority", tagSubscriber.ref()));

        journal.tell(write(new PersistentRecord("orders", 1, Tagged.of("order-1", "priority"))));
        awaitWrite(1);
        journal.tell(write(new PersistentRecord("returns", 1, "return-1")));
        awaitWrite(1);

        assertEquals(new SubscriptionNotification.EventAppended("orders"), streamSubscriber.expectMessage(TIMEOUT));
        assertEquals(new SubscriptionNotification.TaggedEventAppended("priority"), tagSubscriber.expectMessage(TIMEOUT));
        streamSubscriber.expectNoMessage(QUIET);
        tagSubscriber.expectNoMessage(Duration.ofMillis(50));

        journal.tell(new SubscriptionCommand.Unsubscribe(streamSubscriber.ref()));
        journal.tell(write(new PersistentRecord("orders", 2, "order-2")));
        awaitWrite(1);
        streamSubscriber.expectNoMessage(QUIET);
    }

    @Test
    void testTerminatedSubscriberIsDropped() {
        Pid journal = spawn(settings().build());
        TestProbe<Object> leaving = testKit.createProbe();
        TestProbe<Object> staying = testKit.createProbe();

        journal.tell(new SubscriptionCommand.SubscribePersistenceId("p", leaving.ref()));
        journal.tell(new SubscriptionCommand.SubscribePersistenceId("p", staying.ref()));
        testKit.stop(leaving.ref());

        journal.tell(write("p", 1, 1));
        awaitWrite(1);

        assertEquals(new SubscriptionNotification.EventAppended("p"), staying.expectMessage(TIMEOUT));
        assertTrue(leaving.receivedMessages().isEmpty());
    }

    @Test
    void testTagReplayThroughJournal() {
        Pid journal = spawn(settings().build());
        for (long seq = 1; seq <= 6; seq++) {
            Object payload = seq % 2 == 0 ? Tagged.of("even-" + seq, "even") : "odd-" + seq;
            journal.tell(write(new PersistentRecord("numbers", seq, payload)));
            awaitWrite(1);
        }

        journal.tell(new ReplayTaggedMessages(0, Long.MAX_VALUE, 10, "even", probe.ref()));
        List<Object> replay = probe.receiveUntil(JournalResponse.RecoverySuccess.class, TIMEOUT);

        List<Object> payloads = replay.stream()
                .filter(m -> m instanceof JournalResponse.ReplayedTaggedMessage)
                .map(m -> ((JournalResponse.ReplayedTaggedMessage) m).persistent().payload())
                .collect(Collectors.toList());
        assertEquals(List.of("even-2", "even-4", "even-6"), payloads);
        assertEquals(new JournalResponse.RecoverySuccess(6), replay.get(replay.size() - 1));
    }

    @Test
    void testExecutedRequestsArePublishedToTap() {
        TestProbe<Object> tap = testKit.createProbe();
        Pid journal = spawn(settings().requestTap(tap.ref()).build());

        WriteMessages request = write("tapped", 1, 1);
        journal.tell(request);
        awaitWrite(1);

        assertEquals(request, tap.expectMessage(TIMEOUT));
    }

    @Test
    void testJournalStopsWhenTablesCannotBeCreated() {
        JournalSettings settings = settings().build();
        InstrumentedStorageDriver driver = new InstrumentedStorageDriver(new JdbcStorageDriver(settings));
        driver.setFailing(true);

        Pid journal = spawn(settings, driver);

        AsyncAssertion.eventually(() -> !testKit.system().isAlive(journal), TIMEOUT);
    }

    record Withdrawal(String account, long cents, List<String> labels) implements Serializable {
    }
}
