package io.github.byzatic.pushscheduler.timer;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class VirtualTimeTest {
    private static final Instant START = Instant.parse("2025-01-10T07:30:00Z");

    @Test
    void timeStandsStill_untilAdvanced() {
        VirtualTime vt = new VirtualTime(START);
        assertEquals(START, vt.now());
        vt.advance(Duration.ofSeconds(61));
        assertEquals(START.plusSeconds(61), vt.now());
    }

    @Test
    void advance_firesDueTimers_inDeadlineOrder_withNowAtDeadline() {
        VirtualTime vt = new VirtualTime(START);
        List<String> fired = new CopyOnWriteArrayList<>();
        List<Instant> seenNow = new CopyOnWriteArrayList<>();

        vt.arm(START.plusSeconds(30), () -> { fired.add("b"); seenNow.add(vt.now()); });
        vt.arm(START.plusSeconds(10), () -> { fired.add("a"); seenNow.add(vt.now()); });
        vt.arm(START.plusSeconds(90), () -> fired.add("c"));

        vt.advance(Duration.ofSeconds(60));

        assertEquals(List.of("a", "b"), fired);
        assertEquals(List.of(START.plusSeconds(10), START.plusSeconds(30)), seenNow);
        assertEquals(1, vt.pendingCount());
        assertEquals(START.plusSeconds(60), vt.now());
    }

    @Test
    void cancelledTimer_neverFires_andSecondCancelIsNoop() {
        VirtualTime vt = new VirtualTime(START);
        List<String> fired = new CopyOnWriteArrayList<>();
        TimerHandle h = vt.arm(START.plusSeconds(5), () -> fired.add("x"));

        assertTrue(h.cancel());
        assertFalse(h.cancel());
        assertTrue(h.isDone());
        vt.advance(Duration.ofMinutes(1));
        assertTrue(fired.isEmpty());
        assertEquals(0, vt.pendingCount());
    }

    @Test
    void cancelAfterFire_returnsFalse() {
        VirtualTime vt = new VirtualTime(START);
        TimerHandle h = vt.arm(START.plusSeconds(1), () -> {});
        vt.advance(Duration.ofSeconds(1));
        assertTrue(h.isDone());
        assertFalse(h.cancel());
    }

    @Test
    void timerArmedFromAction_firesInSameAdvance_whenDue() {
        VirtualTime vt = new VirtualTime(START);
        List<String> fired = new CopyOnWriteArrayList<>();
        vt.arm(START.plusSeconds(1), () -> {
            fired.add("first");
            vt.arm(vt.now().plusSeconds(1), () -> fired.add("second"));
        });
        vt.advance(Duration.ofSeconds(5));
        assertEquals(List.of("first", "second"), fired);
    }

    @Test
    void failingAction_doesNotStopLaterTimers() {
        VirtualTime vt = new VirtualTime(START);
        List<String> fired = new CopyOnWriteArrayList<>();
        vt.arm(START.plusSeconds(1), () -> { throw new IllegalStateException("boom"); });
        vt.arm(START.plusSeconds(2), () -> fired.add("ok"));
        vt.advance(Duration.ofSeconds(3));
        assertEquals(List.of("ok"), fired);
    }

    @Test
    void movingBackward_isRejected() {
        VirtualTime vt = new VirtualTime(START);
        assertThrows(IllegalArgumentException.class, () -> vt.advance(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> vt.advanceTo(START.minusMillis(1)));
    }

    @Test
    void close_disarmsAll_andRejectsNewTimers() {
        VirtualTime vt = new VirtualTime(START);
        List<String> fired = new CopyOnWriteArrayList<>();
        TimerHandle h = vt.arm(START.plusSeconds(1), () -> fired.add("x"));
        vt.close();
        vt.advance(Duration.ofSeconds(2));
        assertTrue(fired.isEmpty());
        assertTrue(h.isDone());
        assertThrows(IllegalStateException.class, () -> vt.arm(START.plusSeconds(10), () -> {}));
    }
}
