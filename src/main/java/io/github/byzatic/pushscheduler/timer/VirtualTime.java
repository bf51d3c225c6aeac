package io.github.byzatic.pushscheduler.timer;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.pushscheduler.time_source.TimeSource;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Controllable clock that is also its own timer facility.
 * <p>
 * Time stands still until {@link #advance(Duration)} or {@link #advanceTo(Instant)} is called. Advancing
 * runs every timer whose deadline has been reached, in deadline order, on the calling thread; while an
 * action runs, {@link #now()} reports that action's deadline.
 */
@ThreadSafe
public final class VirtualTime implements TimeSource, TimerFacility {
    private final static Logger logger = LoggerFactory.getLogger(VirtualTime.class);

    @GuardedBy("this")
    private Instant now;

    @GuardedBy("this")
    private final PriorityQueue<ScheduledEntry> queue = new PriorityQueue<>();

    @GuardedBy("this")
    private boolean closed = false;

    private final AtomicLong sequence = new AtomicLong();

    public VirtualTime(@NotNull Instant start) {
        this.now = Objects.requireNonNull(start);
    }

    @Override
    public synchronized @NotNull Instant now() {
        return now;
    }

    public void advance(@NotNull Duration duration) {
        if (duration.isNegative()) throw new IllegalArgumentException("Cannot move time backward: " + duration);
        Instant target;
        synchronized (this) {
            target = now.plus(duration);
        }
        advanceTo(target);
    }

    public void advanceTo(@NotNull Instant target) {
        Objects.requireNonNull(target);
        synchronized (this) {
            if (target.isBefore(now)) {
                throw new IllegalArgumentException("Cannot move time backward from " + now + " to " + target);
            }
        }
        ScheduledEntry due;
        while ((due = pollDue(target)) != null) {
            if (!due.markFired()) continue;
            try {
                due.action.run();
            } catch (RuntimeException e) {
                logger.error("Timer action #{} failed", due.sequence, e);
            }
        }
        synchronized (this) {
            if (target.isAfter(now)) now = target;
        }
    }

    private synchronized ScheduledEntry pollDue(Instant target) {
        ScheduledEntry head = queue.peek();
        if (head == null || head.deadline.isAfter(target)) return null;
        queue.poll();
        if (head.deadline.isAfter(now)) now = head.deadline;
        return head;
    }

    @Override
    public synchronized @NotNull TimerHandle arm(@NotNull Instant deadline, @NotNull Runnable action) {
        Objects.requireNonNull(deadline);
        Objects.requireNonNull(action);
        if (closed) throw new IllegalStateException("Timer facility is closed");
        ScheduledEntry entry = new ScheduledEntry(deadline, sequence.incrementAndGet(), action, this, this::remove);
        queue.add(entry);
        return entry;
    }

    private synchronized void remove(ScheduledEntry entry) {
        queue.remove(entry);
    }

    @Override
    public synchronized int pendingCount() {
        return queue.size();
    }

    @Override
    public synchronized void close() {
        closed = true;
        for (ScheduledEntry e : queue) e.markCancelled();
        queue.clear();
    }
}
