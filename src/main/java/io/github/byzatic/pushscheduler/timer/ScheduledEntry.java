package io.github.byzatic.pushscheduler.timer;

import io.github.byzatic.pushscheduler.time_source.TimeSource;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * One armed timer. The state moves ARMED -> FIRED or ARMED -> CANCELLED exactly once.
 */
final class ScheduledEntry implements Delayed, TimerHandle {
    private static final int ARMED = 0;
    private static final int FIRED = 1;
    private static final int CANCELLED = 2;

    final Instant deadline;
    final long sequence;
    final Runnable action;
    private final TimeSource timeSource;
    private final Consumer<ScheduledEntry> onCancel;
    private final AtomicInteger state = new AtomicInteger(ARMED);

    ScheduledEntry(Instant deadline, long sequence, Runnable action, TimeSource timeSource,
                   Consumer<ScheduledEntry> onCancel) {
        this.deadline = deadline;
        this.sequence = sequence;
        this.action = action;
        this.timeSource = timeSource;
        this.onCancel = onCancel;
    }

    boolean markFired() {
        return state.compareAndSet(ARMED, FIRED);
    }

    boolean markCancelled() {
        return state.compareAndSet(ARMED, CANCELLED);
    }

    @Override
    public boolean cancel() {
        if (!markCancelled()) return false;
        onCancel.accept(this);
        return true;
    }

    @Override
    public boolean isDone() {
        return state.get() != ARMED;
    }

    @Override
    public long getDelay(TimeUnit unit) {
        return unit.convert(Duration.between(timeSource.now(), deadline));
    }

    @Override
    public int compareTo(Delayed o) {
        ScheduledEntry other = (ScheduledEntry) o;
        int byDeadline = this.deadline.compareTo(other.deadline);
        return byDeadline != 0 ? byDeadline : Long.compare(this.sequence, other.sequence);
    }
}
