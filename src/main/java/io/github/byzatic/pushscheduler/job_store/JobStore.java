package io.github.byzatic.pushscheduler.job_store;

import io.github.byzatic.pushscheduler.base_exceptions.DuplicateJobIdException;
import io.github.byzatic.pushscheduler.base_exceptions.JobNotFoundException;
import io.github.byzatic.pushscheduler.base_exceptions.StateConflictException;
import io.github.byzatic.pushscheduler.job.Job;
import io.github.byzatic.pushscheduler.job.JobStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Source of truth for job state. Every method is safe to call from the timer fire path and from
 * API callers at the same time.
 */
public interface JobStore {

    /**
     * @return the stored job, with its insertion sequence assigned
     * @throws DuplicateJobIdException if a job with the same id was ever inserted
     */
    @NotNull Job insert(@NotNull Job job) throws DuplicateJobIdException;

    @NotNull Job get(@NotNull String id) throws JobNotFoundException;

    @NotNull Optional<Job> find(@NotNull String id);

    /**
     * Point-in-time snapshot ordered by insertion.
     */
    @NotNull List<Job> list();

    int size();

    /**
     * Atomically moves a job from {@code expected} to {@code next}.
     *
     * @return the job after the transition
     * @throws JobNotFoundException   if the id is unknown
     * @throws StateConflictException if the current status is not {@code expected}
     * @throws IllegalArgumentException if {@code expected -> next} is not a legal transition
     */
    @NotNull Job compareAndSetStatus(@NotNull String id, @NotNull JobStatus expected, @NotNull JobStatus next,
                                     @Nullable Instant completedAt, @Nullable String error)
            throws JobNotFoundException, StateConflictException;
}
