package io.github.byzatic.pushscheduler.job_store;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.pushscheduler.base_exceptions.DuplicateJobIdException;
import io.github.byzatic.pushscheduler.base_exceptions.JobNotFoundException;
import io.github.byzatic.pushscheduler.base_exceptions.StateConflictException;
import io.github.byzatic.pushscheduler.job.Job;
import io.github.byzatic.pushscheduler.job.JobStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Unbounded in-memory store. Per-id atomicity comes from {@link ConcurrentHashMap#compute}; nothing
 * is ever evicted, so ids are never reused.
 */
@ThreadSafe
public final class InMemoryJobStore implements JobStore {
    private final ConcurrentHashMap<String, Job> jobs = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public @NotNull Job insert(@NotNull Job job) throws DuplicateJobIdException {
        Objects.requireNonNull(job, "job");
        Job stored = job.withSequence(sequence.incrementAndGet());
        if (jobs.putIfAbsent(job.getId(), stored) != null) {
            throw new DuplicateJobIdException(job.getId());
        }
        return stored;
    }

    @Override
    public @NotNull Job get(@NotNull String id) throws JobNotFoundException {
        Job job = jobs.get(id);
        if (job == null) throw new JobNotFoundException(id);
        return job;
    }

    @Override
    public @NotNull Optional<Job> find(@NotNull String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public @NotNull List<Job> list() {
        List<Job> out = new ArrayList<>(jobs.values());
        out.sort(Comparator.comparingLong(Job::getSequence));
        return ImmutableList.copyOf(out);
    }

    @Override
    public int size() {
        return jobs.size();
    }

    @Override
    public @NotNull Job compareAndSetStatus(@NotNull String id, @NotNull JobStatus expected, @NotNull JobStatus next,
                                            @Nullable Instant completedAt, @Nullable String error)
            throws JobNotFoundException, StateConflictException {
        checkArgument(expected.canTransitionTo(next), "Illegal transition %s -> %s", expected, next);

        // observed status before the transition attempt
        AtomicReference<JobStatus> observed = new AtomicReference<>();
        Job updated = jobs.computeIfPresent(id, (key, current) -> {
            observed.set(current.getStatus());
            return current.getStatus() == expected ? current.withStatus(next, completedAt, error) : current;
        });

        if (updated == null) throw new JobNotFoundException(id);
        if (observed.get() != expected) throw new StateConflictException(id, expected, observed.get());
        return updated;
    }
}
