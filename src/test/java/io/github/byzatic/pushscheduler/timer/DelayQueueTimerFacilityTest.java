package io.github.byzatic.pushscheduler.timer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DelayQueueTimerFacilityTest {

    DelayQueueTimerFacility timers;

    @AfterEach
    void tearDown() {
        if (timers != null) timers.close();
    }

    @Test
    void arm_firesAfterDeadline() throws Exception {
        timers = new DelayQueueTimerFacility.Builder().workerThreads(2).build();
        CountDownLatch fired = new CountDownLatch(1);
        Instant deadline = Instant.now().plusMillis(100);
        List<Instant> firedAt = new CopyOnWriteArrayList<>();

        TimerHandle h = timers.arm(deadline, () -> {
            firedAt.add(Instant.now());
            fired.countDown();
        });

        assertTrue(fired.await(2, TimeUnit.SECONDS), "timer did not fire");
        assertFalse(firedAt.get(0).isBefore(deadline), "fired before deadline");
        assertTrue(h.isDone());
        assertFalse(h.cancel());
    }

    @Test
    void pastDeadline_firesImmediately() throws Exception {
        timers = new DelayQueueTimerFacility.Builder().build();
        CountDownLatch fired = new CountDownLatch(1);
        timers.arm(Instant.now().minusSeconds(1), fired::countDown);
        assertTrue(fired.await(1, TimeUnit.SECONDS));
    }

    @Test
    void cancelledTimer_neverFires() throws Exception {
        timers = new DelayQueueTimerFacility.Builder().build();
        AtomicInteger runs = new AtomicInteger();
        TimerHandle h = timers.arm(Instant.now().plusMillis(150), runs::incrementAndGet);

        assertEquals(1, timers.pendingCount());
        assertTrue(h.cancel());
        assertEquals(0, timers.pendingCount());

        Thread.sleep(300);
        assertEquals(0, runs.get());
    }

    @Test
    void slowAction_doesNotDelayOtherTimers() throws Exception {
        timers = new DelayQueueTimerFacility.Builder().workerThreads(2).build();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch second = new CountDownLatch(1);

        timers.arm(Instant.now().plusMillis(20), () -> {
            try {
                release.await(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        timers.arm(Instant.now().plusMillis(60), second::countDown);

        assertTrue(second.await(1, TimeUnit.SECONDS), "second timer waited for the first action");
        release.countDown();
    }

    @Test
    void close_disarmsPending_andRejectsNewTimers() throws Exception {
        timers = new DelayQueueTimerFacility.Builder().build();
        AtomicInteger runs = new AtomicInteger();
        TimerHandle h = timers.arm(Instant.now().plusMillis(100), runs::incrementAndGet);

        timers.close();
        assertTrue(h.isDone());
        assertThrows(IllegalStateException.class, () -> timers.arm(Instant.now(), () -> {}));

        Thread.sleep(200);
        assertEquals(0, runs.get());
    }
}
