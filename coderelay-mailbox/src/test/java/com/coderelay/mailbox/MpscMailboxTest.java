package com.coderelay.mailbox;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MpscMailbox:
 * - Power-of-two sizing
 * - Blocking put/take handoff
 * - Many producers, one consumer
 */
class MpscMailboxTest {

    @Test
    void testOfferRejectsNull() {
        MpscMailbox<String> mailbox = new MpscMailbox<>(4);
        assertThrows(NullPointerException.class, () -> mailbox.offer(null));
    }

    @Test
    void testCapacityRoundedToPowerOfTwo() {
        MpscMailbox<String> mailbox = new MpscMailbox<>(5);

        assertEquals(8, mailbox.capacity());
        for (int i = 0; i < 8; i++) {
            assertTrue(mailbox.offer("msg" + i));
        }
        assertFalse(mailbox.offer("overflow"));
        assertEquals(0, mailbox.remainingCapacity());
    }

    @Test
    void testFifoOrder() {
        MpscMailbox<String> mailbox = new MpscMailbox<>(4);

        mailbox.offer("first");
        mailbox.offer("second");

        assertEquals("first", mailbox.poll());
        assertEquals("second", mailbox.poll());
        assertNull(mailbox.poll());
    }

    @Test
    void testPollWithTimeoutOnEmpty() throws InterruptedException {
        MpscMailbox<String> mailbox = new MpscMailbox<>(4);

        long start = System.nanoTime();
        assertNull(mailbox.poll(100, TimeUnit.MILLISECONDS));
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(100));
    }

    @Test
    @Timeout(5)
    void testTakeWakesOnOffer() throws Exception {
        MpscMailbox<String> mailbox = new MpscMailbox<>(4);
        List<String> received = new ArrayList<>();
        CountDownLatch done = new CountDownLatch(1);

        Thread consumer = new Thread(() -> {
            try {
                received.add(mailbox.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        });
        consumer.start();
        Thread.sleep(50);

        mailbox.offer("wake");

        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertEquals(List.of("wake"), received);
    }

    @Test
    @Timeout(5)
    void testPutBlocksUntilConsumerPolls() throws Exception {
        MpscMailbox<String> mailbox = new MpscMailbox<>(2);
        mailbox.put("a");
        mailbox.put("b");

        AtomicBoolean delivered = new AtomicBoolean(false);
        Thread producer = new Thread(() -> {
            try {
                mailbox.put("c");
                delivered.set(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();
        Thread.sleep(100);
        assertFalse(delivered.get());

        assertEquals("a", mailbox.take());
        producer.join(1000);

        assertTrue(delivered.get());
        assertEquals("b", mailbox.poll());
        assertEquals("c", mailbox.poll());
    }

    @Test
    @Timeout(10)
    void testManyProducersSingleConsumer() throws Exception {
        MpscMailbox<Integer> mailbox = new MpscMailbox<>(16);
        int producers = 8;
        int perProducer = 500;
        ExecutorService executor = Executors.newFixedThreadPool(producers);

        for (int p = 0; p < producers; p++) {
            executor.submit(() -> {
                for (int i = 0; i < perProducer; i++) {
                    mailbox.put(i);
                }
                return null;
            });
        }

        int received = 0;
        while (received < producers * perProducer) {
            Integer value = mailbox.poll(1, TimeUnit.SECONDS);
            assertNotNull(value, "consumer starved after " + received + " messages");
            received++;
        }

        assertTrue(mailbox.isEmpty());
        executor.shutdown();
        assertTrue(executor.awaitTermination(1, TimeUnit.SECONDS));
    }
}
