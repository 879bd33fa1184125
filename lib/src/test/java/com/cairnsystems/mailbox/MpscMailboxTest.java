package com.cairnsystems.mailbox;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MpscMailbox.
 */
class MpscMailboxTest {

    @Test
    void testFifoOrder() {
        MpscMailbox<Integer> mailbox = new MpscMailbox<>();
        for (int i = 0; i < 10; i++) {
            assertTrue(mailbox.offer(i));
        }

        assertEquals(10, mailbox.size());
        for (int i = 0; i < 10; i++) {
            assertEquals(i, mailbox.poll());
        }
        assertTrue(mailbox.isEmpty());
        assertNull(mailbox.poll());
    }

    @Test
    void testTimedPollWaitsForMessage() throws Exception {
        MpscMailbox<String> mailbox = new MpscMailbox<>();
        ExecutorService producer = Executors.newSingleThreadExecutor();
        try {
            producer.submit(() -> {
                Thread.sleep(50);
                return mailbox.offer("late");
            });

            assertEquals("late", mailbox.poll(5, TimeUnit.SECONDS));
            assertNull(mailbox.poll(20, TimeUnit.MILLISECONDS));
        } finally {
            producer.shutdownNow();
        }
    }

    @Test
    void testDrainToRespectsLimit() {
        MpscMailbox<Integer> mailbox = new MpscMailbox<>(16);
        for (int i = 0; i < 5; i++) {
            mailbox.offer(i);
        }
        List<Integer> drained = new ArrayList<>();

        assertEquals(3, mailbox.drainTo(drained, 3));
        assertEquals(List.of(0, 1, 2), drained);
        assertEquals(2, mailbox.size());

        mailbox.clear();
        assertTrue(mailbox.isEmpty());
    }

    @Test
    void testConcurrentProducers() throws InterruptedException {
        MpscMailbox<Integer> mailbox = new MpscMailbox<>();
        int producers = 4;
        int perProducer = 1_000;
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        CountDownLatch done = new CountDownLatch(producers);
        for (int p = 0; p < producers; p++) {
            pool.execute(() -> {
                for (int i = 0; i < perProducer; i++) {
                    mailbox.offer(i);
                }
                done.countDown();
            });
        }
        assertTrue(done.await(5, TimeUnit.SECONDS));
        pool.shutdown();

        int received = 0;
        while (mailbox.poll() != null) {
            received++;
        }
        assertEquals(producers * perProducer, received);
    }
}
