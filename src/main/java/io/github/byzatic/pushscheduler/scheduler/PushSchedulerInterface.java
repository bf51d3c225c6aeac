package io.github.byzatic.pushscheduler.scheduler;

import io.github.byzatic.pushscheduler.base_exceptions.AlreadyTerminalException;
import io.github.byzatic.pushscheduler.base_exceptions.InvalidScheduleException;
import io.github.byzatic.pushscheduler.base_exceptions.JobNotFoundException;
import io.github.byzatic.pushscheduler.job.Job;
import org.jetbrains.annotations.NotNull;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

public interface PushSchedulerInterface extends AutoCloseable {
    void addListener(@NotNull JobEventListener l);

    void removeListener(@NotNull JobEventListener l);

    /**
     * Admits a one-shot push and arms its timer.
     *
     * @throws InvalidScheduleException if {@code triggerTime} is not strictly after the current time
     * @throws IllegalStateException    if the scheduler was closed
     */
    @NotNull Job schedule(@NotNull OffsetDateTime triggerTime, @NotNull String content, @NotNull String credential)
            throws InvalidScheduleException;

    /**
     * Cancels a job that has not fired yet.
     *
     * @return the job in its cancelled state
     * @throws JobNotFoundException     if no such job exists
     * @throws AlreadyTerminalException if the job already fired, is firing, or was cancelled
     */
    @NotNull Job cancel(@NotNull String jobId) throws JobNotFoundException, AlreadyTerminalException;

    @NotNull Job get(@NotNull String jobId) throws JobNotFoundException;

    @NotNull Optional<Job> find(@NotNull String jobId);

    /**
     * Every job ever admitted, in admission order.
     */
    @NotNull List<Job> list();

    /**
     * Number of jobs whose timer is still armed.
     */
    int pendingCount();

    boolean isRunning();

    @Override
    void close();
}
