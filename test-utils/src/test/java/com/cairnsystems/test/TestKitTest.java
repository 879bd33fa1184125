package com.cairnsystems.test;

import com.cairnsystems.ActorContext;
import com.cairnsystems.Pid;
import com.cairnsystems.handler.Handler;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TestKit, TestProbe and AsyncAssertion.
 */
class TestKitTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    /**
     * Answers a {@code Ping} on the pid it carries.
     */
    record Ping(String text, Pid replyTo) {
    }

    static class PingHandler implements Handler<Ping> {
        @Override
        public void receive(Ping message, ActorContext context) {
            context.tell(message.replyTo(), "pong: " + message.text());
        }
    }

    @Test
    void testProbeCapturesMessages() {
        try (TestKit testKit = TestKit.create()) {
            TestProbe<String> probe = testKit.createProbe();

            probe.ref().tell("test message");

            assertEquals("test message", probe.expectMessage(TIMEOUT));
        }
    }

    @Test
    void testActorRepliesToProbe() {
        try (TestKit testKit = TestKit.create()) {
            Pid actor = testKit.spawn(new PingHandler());
            TestProbe<String> probe = testKit.createProbe();

            actor.tell(new Ping("hello", probe.ref()));

            assertEquals("pong: hello", probe.expectMessage(TIMEOUT));
            probe.expectNoMessage(Duration.ofMillis(100));
        }
    }

    @Test
    void testExpectMessageOfWrongTypeFails() {
        try (TestKit testKit = TestKit.create()) {
            TestProbe<Object> probe = testKit.createProbe();
            probe.ref().tell(42);

            assertThrows(AssertionError.class, () -> probe.expectMessage(String.class, TIMEOUT));
        }
    }

    @Test
    void testReceiveUntilIncludesTerminalMessage() {
        try (TestKit testKit = TestKit.create()) {
            TestProbe<Object> probe = testKit.createProbe();
            probe.ref().tell("a");
            probe.ref().tell("b");
            probe.ref().tell(3L);
            probe.ref().tell("after");

            assertEquals(List.of("a", "b", 3L), probe.receiveUntil(Long.class, TIMEOUT));
            assertEquals("after", probe.expectMessage(TIMEOUT));
        }
    }

    @Test
    void testFishForMessageSkipsOthers() {
        try (TestKit testKit = TestKit.create()) {
            TestProbe<Object> probe = testKit.createProbe();
            probe.ref().tell("noise");
            probe.ref().tell(7);

            assertEquals(7, probe.fishForMessage(Integer.class, TIMEOUT));
        }
    }

    @Test
    void testExpectMessagesTimesOutWhenShort() {
        try (TestKit testKit = TestKit.create()) {
            TestProbe<String> probe = testKit.createProbe();
            probe.ref().tell("only one");

            assertThrows(AssertionError.class, () -> probe.expectMessages(2, Duration.ofMillis(200)));
        }
    }

    @Test
    void testStopWaitsUntilActorIsGone() {
        try (TestKit testKit = TestKit.create()) {
            TestProbe<String> probe = testKit.createProbe("stoppable");

            testKit.stop(probe.ref());

            assertFalse(testKit.system().isAlive(probe.ref()));
        }
    }

    @Test
    void testEventuallyFailsAfterTimeout() {
        assertThrows(AssertionError.class, () -> AsyncAssertion.eventually(() -> false, Duration.ofMillis(100)));
        AsyncAssertion.eventually(() -> true, Duration.ofMillis(100));
    }
}
