package com.cairnsystems;

import com.cairnsystems.handler.Handler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for message routing, ask, death watch and supervision.
 */
class ActorSystemTest {

    private ActorSystem system;

    @BeforeEach
    void setUp() {
        system = new ActorSystem();
    }

    @AfterEach
    void tearDown() {
        system.shutdown();
    }

    /**
     * Forwards everything it receives to a queue the test reads from.
     */
    static class Recorder implements Handler<Object> {
        final BlockingQueue<Object> received = new LinkedBlockingQueue<>();

        @Override
        public void receive(Object message, ActorContext context) {
            received.add(message);
        }

        Object next() throws InterruptedException {
            Object message = received.poll(5, TimeUnit.SECONDS);
            assertNotNull(message, "no message within 5 seconds");
            return message;
        }
    }

    static class Echo implements Handler<String> {
        @Override
        public void receive(String message, ActorContext context) {
            context.getSender().ifPresent(sender -> context.tell(sender, message.toUpperCase()));
        }
    }

    static class FailsOnBoom implements Handler<String> {
        final BlockingQueue<String> processed = new LinkedBlockingQueue<>();

        @Override
        public void receive(String message, ActorContext context) {
            if ("boom".equals(message)) {
                throw new IllegalStateException("boom");
            }
            processed.add(message);
        }
    }

    @Test
    void testTellDeliversInOrder() throws InterruptedException {
        Recorder recorder = new Recorder();
        Pid pid = system.actorOf(recorder).withId("recorder").spawn();

        for (int i = 0; i < 50; i++) {
            pid.tell(i);
        }

        for (int i = 0; i < 50; i++) {
            assertEquals(i, recorder.next());
        }
    }

    @Test
    void testDuplicateIdRejected() {
        system.actorOf(new Recorder()).withId("taken").spawn();

        assertThrows(IllegalStateException.class, () -> system.actorOf(new Recorder()).withId("taken").spawn());
    }

    @Test
    void testAskReceivesReply() throws Exception {
        Pid echo = system.actorOf(new Echo()).spawn();

        String reply = system.<String, String>ask(echo, "hello", Duration.ofSeconds(5)).get(5, TimeUnit.SECONDS);

        assertEquals("HELLO", reply);
    }

    @Test
    void testSenderOnlyVisibleWhileHandlingAsk() throws Exception {
        BlockingQueue<String> seen = new LinkedBlockingQueue<>();
        Pid pid = system.actorOf(new Handler<String>() {
            @Override
            public void receive(String message, ActorContext context) {
                seen.add(message + ":" + context.getSender().isPresent());
                context.getSender().ifPresent(sender -> context.tell(sender, "done"));
            }
        }).spawn();

        assertEquals("done", system.<String, String>ask(pid, "asked", Duration.ofSeconds(5)).get(5, TimeUnit.SECONDS));
        pid.tell("told");

        assertEquals("asked:true", seen.poll(5, TimeUnit.SECONDS));
        assertEquals("told:false", seen.poll(5, TimeUnit.SECONDS));
    }

    @Test
    void testAskTimesOutWithoutReply() {
        Pid silent = system.actorOf(new Recorder()).spawn();

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> system.ask(silent, "anyone?", Duration.ofMillis(100)).get(5, TimeUnit.SECONDS));
        assertInstanceOf(TimeoutException.class, error.getCause());
    }

    @Test
    void testWatcherReceivesTerminated() throws InterruptedException {
        Recorder watcher = new Recorder();
        Pid watcherPid = system.actorOf(watcher).spawn();
        Pid target = system.actorOf(new Recorder()).spawn();

        system.watch(watcherPid, target);
        assertTrue(system.isAlive(target));
        system.stopActor(target);

        assertEquals(new Terminated(target), watcher.next());
        assertFalse(system.isAlive(target));
    }

    @Test
    void testWatchingStoppedActorNotifiesImmediately() throws InterruptedException {
        Recorder watcher = new Recorder();
        Pid watcherPid = system.actorOf(watcher).spawn();
        Pid target = system.actorOf(new Recorder()).spawn();
        system.stopActor(target);

        system.watch(watcherPid, target);

        assertEquals(new Terminated(target), watcher.next());
    }

    @Test
    void testUnwatchedActorIsNotNotified() throws InterruptedException {
        Recorder watcher = new Recorder();
        Pid watcherPid = system.actorOf(watcher).spawn();
        Pid target = system.actorOf(new Recorder()).spawn();

        system.watch(watcherPid, target);
        system.unwatch(watcherPid, target);
        system.stopActor(target);

        assertNull(watcher.received.poll(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void testResumeKeepsProcessing() throws InterruptedException {
        FailsOnBoom handler = new FailsOnBoom();
        Pid pid = system.actorOf(handler).withSupervisionStrategy(SupervisionStrategy.RESUME).spawn();

        pid.tell("one");
        pid.tell("boom");
        pid.tell("two");

        assertEquals("one", handler.processed.poll(5, TimeUnit.SECONDS));
        assertEquals("two", handler.processed.poll(5, TimeUnit.SECONDS));
        assertTrue(system.isAlive(pid));
    }

    @Test
    void testStopStrategyStopsActor() throws InterruptedException {
        FailsOnBoom handler = new FailsOnBoom();
        Pid pid = system.actorOf(handler).withSupervisionStrategy(SupervisionStrategy.STOP).spawn();

        pid.tell("boom");

        long deadline = System.currentTimeMillis() + 5000;
        while (system.isAlive(pid) && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(system.isAlive(pid));
    }

    @Test
    void testSelfMessagesArriveThroughContext() throws InterruptedException {
        BlockingQueue<String> pongs = new LinkedBlockingQueue<>();
        Pid pid = system.actorOf(new Handler<String>() {
            @Override
            public void receive(String message, ActorContext context) {
                if ("ping".equals(message)) {
                    context.tellSelf("pong");
                } else {
                    pongs.add(message);
                }
            }
        }).spawn();

        pid.tell("ping");

        assertEquals("pong", pongs.poll(5, TimeUnit.SECONDS));
    }
}
