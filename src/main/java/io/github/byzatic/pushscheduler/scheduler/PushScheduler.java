package io.github.byzatic.pushscheduler.scheduler;

import com.google.common.annotations.VisibleForTesting;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.pushscheduler.base_exceptions.AlreadyTerminalException;
import io.github.byzatic.pushscheduler.base_exceptions.DeliveryFailureException;
import io.github.byzatic.pushscheduler.base_exceptions.DuplicateJobIdException;
import io.github.byzatic.pushscheduler.base_exceptions.InvalidScheduleException;
import io.github.byzatic.pushscheduler.base_exceptions.JobNotFoundException;
import io.github.byzatic.pushscheduler.base_exceptions.StateConflictException;
import io.github.byzatic.pushscheduler.job.Job;
import io.github.byzatic.pushscheduler.job.JobIdGenerator;
import io.github.byzatic.pushscheduler.job.JobStatus;
import io.github.byzatic.pushscheduler.job_store.InMemoryJobStore;
import io.github.byzatic.pushscheduler.job_store.JobStore;
import io.github.byzatic.pushscheduler.notifier.Notifier;
import io.github.byzatic.pushscheduler.time_source.SystemTimeSource;
import io.github.byzatic.pushscheduler.time_source.TimeSource;
import io.github.byzatic.pushscheduler.timer.DelayQueueTimerFacility;
import io.github.byzatic.pushscheduler.timer.TimerFacility;
import io.github.byzatic.pushscheduler.timer.TimerHandle;
import io.github.byzatic.pushscheduler.timer.VirtualTime;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * PushScheduler
 * - One-shot jobs: each admitted job arms one timer at its trigger time
 * - On fire: SCHEDULED -> COMPLETING, notifier call, then COMPLETED or FAILED
 * - Cancel: SCHEDULED -> CANCELLED, then the timer is disarmed
 * - The store's compare-and-set decides every race between fire and cancel; the timer is only a trigger
 * - Event subscription (scheduled/delivered/delivery failed/cancelled)
 */
@ThreadSafe
public final class PushScheduler implements PushSchedulerInterface {
    private final static Logger logger = LoggerFactory.getLogger(PushScheduler.class);
    static final int MAX_ID_ATTEMPTS = 5;

    private final JobStore store;
    private final TimeSource timeSource;
    private final TimerFacility timers;
    private final Notifier notifier;
    private final JobIdGenerator idGenerator;
    private final List<JobEventListener> listeners;

    private final Map<String, TimerHandle> armed = new ConcurrentHashMap<>();
    private final AtomicBoolean closing = new AtomicBoolean(false);

    private PushScheduler(JobStore store, TimeSource timeSource, TimerFacility timers, Notifier notifier,
                          JobIdGenerator idGenerator, List<JobEventListener> listeners) {
        this.store = store;
        this.timeSource = timeSource;
        this.timers = timers;
        this.notifier = notifier;
        this.idGenerator = idGenerator;
        this.listeners = new CopyOnWriteArrayList<>(listeners);
    }

    public static final class Builder {
        private JobStore store;
        private TimeSource timeSource;
        private TimerFacility timers;
        private Notifier notifier;
        private JobIdGenerator idGenerator = JobIdGenerator.shortUuid();
        private int workerThreads = Math.max(2, Runtime.getRuntime().availableProcessors());
        private final List<JobEventListener> listeners = new CopyOnWriteArrayList<>();

        public Builder jobStore(JobStore store) {
            this.store = Objects.requireNonNull(store);
            return this;
        }

        public Builder timeSource(TimeSource timeSource) {
            this.timeSource = Objects.requireNonNull(timeSource);
            return this;
        }

        public Builder timerFacility(TimerFacility timers) {
            this.timers = Objects.requireNonNull(timers);
            return this;
        }

        /**
         * Uses the same virtual clock as time source and timer facility.
         */
        public Builder virtualTime(VirtualTime virtualTime) {
            Objects.requireNonNull(virtualTime);
            this.timeSource = virtualTime;
            this.timers = virtualTime;
            return this;
        }

        public Builder notifier(Notifier notifier) {
            this.notifier = Objects.requireNonNull(notifier);
            return this;
        }

        public Builder idGenerator(JobIdGenerator idGenerator) {
            this.idGenerator = Objects.requireNonNull(idGenerator);
            return this;
        }

        /**
         * Worker pool size of the default timer facility. Ignored when a facility is supplied.
         */
        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder addListener(JobEventListener l) {
            listeners.add(Objects.requireNonNull(l));
            return this;
        }

        public PushScheduler build() {
            if (notifier == null) throw new IllegalStateException("notifier is required");
            if (store == null) store = new InMemoryJobStore();
            if (timeSource == null) timeSource = new SystemTimeSource();
            if (timers == null) {
                timers = new DelayQueueTimerFacility.Builder()
                        .timeSource(timeSource)
                        .workerThreads(workerThreads)
                        .build();
            }
            return new PushScheduler(store, timeSource, timers, notifier, idGenerator, listeners);
        }
    }

    // ======== Public API ========

    @Override
    public void addListener(@NotNull JobEventListener l) {
        listeners.add(Objects.requireNonNull(l));
    }

    @Override
    public void removeListener(@NotNull JobEventListener l) {
        listeners.remove(l);
    }

    @Override
    public @NotNull Job schedule(@NotNull OffsetDateTime triggerTime, @NotNull String content, @NotNull String credential)
            throws InvalidScheduleException {
        Objects.requireNonNull(triggerTime, "triggerTime");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(credential, "credential");
        if (closing.get()) throw new IllegalStateException("Scheduler is closed");

        Instant now = timeSource.now();
        if (!triggerTime.toInstant().isAfter(now)) {
            throw new InvalidScheduleException(InvalidScheduleException.Reason.NOT_IN_FUTURE,
                    "Trigger time " + triggerTime + " is not after current time " + now);
        }

        Job job = insertNew(triggerTime, content, credential, now);
        String id = job.getId();

        TimerHandle handle;
        try {
            handle = timers.arm(triggerTime.toInstant(), () -> onTimerFired(id));
        } catch (IllegalStateException e) {
            abandon(id);
            throw e;
        }
        armed.put(id, handle);
        // fired or cancelled before the handle was registered
        if (handle.isDone() || store.find(id).map(j -> j.getStatus() != JobStatus.SCHEDULED).orElse(false)) {
            armed.remove(id, handle);
            handle.cancel();
        }

        logger.info("Scheduled job {} at {}", id, triggerTime);
        fire(l -> l.onScheduled(job));
        return job;
    }

    @Override
    public @NotNull Job cancel(@NotNull String jobId) throws JobNotFoundException, AlreadyTerminalException {
        Job current = store.get(jobId);
        if (current.getStatus() != JobStatus.SCHEDULED) {
            throw new AlreadyTerminalException(jobId, current.getStatus());
        }

        Job cancelled;
        try {
            cancelled = store.compareAndSetStatus(jobId, JobStatus.SCHEDULED, JobStatus.CANCELLED, timeSource.now(), null);
        } catch (StateConflictException e) {
            logger.debug("Cancel of job {} lost the race, status is {}", jobId, e.getActual());
            throw new AlreadyTerminalException(jobId, e.getActual());
        }

        TimerHandle handle = armed.remove(jobId);
        if (handle != null) handle.cancel();

        logger.info("Cancelled job {}", jobId);
        fire(l -> l.onCancelled(cancelled));
        return cancelled;
    }

    @Override
    public @NotNull Job get(@NotNull String jobId) throws JobNotFoundException {
        return store.get(jobId);
    }

    @Override
    public @NotNull Optional<Job> find(@NotNull String jobId) {
        return store.find(jobId);
    }

    @Override
    public @NotNull List<Job> list() {
        return store.list();
    }

    @Override
    public int pendingCount() {
        int n = 0;
        for (TimerHandle h : armed.values()) {
            if (!h.isDone()) n++;
        }
        return n;
    }

    @Override
    public boolean isRunning() {
        return !closing.get();
    }

    @Override
    public void close() {
        if (!closing.compareAndSet(false, true)) return;
        for (String id : new ArrayList<>(armed.keySet())) {
            TimerHandle h = armed.remove(id);
            if (h != null) h.cancel();
        }
        long left = store.list().stream().filter(j -> j.getStatus() == JobStatus.SCHEDULED).count();
        if (left > 0) logger.warn("Scheduler closing with {} jobs still scheduled, they will not fire", left);
        timers.close();
    }

    // ======== Internals ========

    private Job insertNew(OffsetDateTime triggerTime, String content, String credential, Instant now) {
        for (int attempt = 1; attempt <= MAX_ID_ATTEMPTS; attempt++) {
            String id = idGenerator.nextId();
            try {
                return store.insert(Job.scheduled(id, triggerTime, content, credential, now));
            } catch (DuplicateJobIdException e) {
                logger.warn("Generated job id {} is already taken, attempt {}/{}", id, attempt, MAX_ID_ATTEMPTS);
            }
        }
        throw new IllegalStateException("Could not generate a unique job id after " + MAX_ID_ATTEMPTS + " attempts");
    }

    // timer could not be armed: the job must not look pending forever
    private void abandon(String id) {
        try {
            store.compareAndSetStatus(id, JobStatus.SCHEDULED, JobStatus.CANCELLED, timeSource.now(), null);
            logger.warn("Job {} cancelled, timer facility refused to arm it", id);
        } catch (JobNotFoundException | StateConflictException e) {
            logger.debug("Job {} already left SCHEDULED", id, e);
        }
    }

    @VisibleForTesting
    void onTimerFired(String jobId) {
        armed.remove(jobId);

        Job job;
        try {
            job = store.compareAndSetStatus(jobId, JobStatus.SCHEDULED, JobStatus.COMPLETING, null, null);
        } catch (StateConflictException e) {
            logger.debug("Job {} not fired, status is already {}", jobId, e.getActual());
            return;
        } catch (JobNotFoundException e) {
            logger.warn("Timer fired for unknown job {}", jobId);
            return;
        }

        logger.info("Job {} triggered, delivering '{}'", jobId, job.getContent());
        Throwable failure = null;
        try {
            notifier.deliver(job.getContent(), job.getCredential());
        } catch (Throwable t) {
            failure = t;
        }

        if (failure == null) {
            complete(job);
        } else {
            fail(job, failure);
            // the job is recorded as FAILED; the JVM-level error still belongs to the caller
            if (failure instanceof VirtualMachineError) throw (VirtualMachineError) failure;
        }
    }

    private void complete(Job job) {
        try {
            Job done = store.compareAndSetStatus(job.getId(), JobStatus.COMPLETING, JobStatus.COMPLETED, timeSource.now(), null);
            logger.info("Job {} delivered", job.getId());
            fire(l -> l.onDelivered(done));
        } catch (JobNotFoundException | StateConflictException e) {
            logger.error("Job {} could not be marked completed", job.getId(), e);
        }
    }

    private void fail(Job job, Throwable failure) {
        String error = failure instanceof DeliveryFailureException ? failure.getMessage() : String.valueOf(failure);
        try {
            Job failed = store.compareAndSetStatus(job.getId(), JobStatus.COMPLETING, JobStatus.FAILED, timeSource.now(), error);
            logger.error("Job {} delivery failed: {}", job.getId(), error);
            fire(l -> l.onDeliveryFailed(failed, failure));
        } catch (JobNotFoundException | StateConflictException e) {
            logger.error("Job {} could not be marked failed", job.getId(), e);
        }
    }

    private void fire(Consumer<JobEventListener> c) {
        for (JobEventListener l : listeners) {
            try {
                c.accept(l);
            } catch (RuntimeException e) {
                logger.warn("Job event listener {} failed", l, e);
            }
        }
    }
}
