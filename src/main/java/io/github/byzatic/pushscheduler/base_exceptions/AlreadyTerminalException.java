package io.github.byzatic.pushscheduler.base_exceptions;

import io.github.byzatic.pushscheduler.job.JobStatus;
import org.jetbrains.annotations.NotNull;

/**
 * Cancel was requested for a job that already fired, is firing, or was cancelled before.
 */
public class AlreadyTerminalException extends PushSchedulerException {
    private final String jobId;
    private final JobStatus status;

    public AlreadyTerminalException(@NotNull String jobId, @NotNull JobStatus status) {
        super("Job " + jobId + " can no longer be cancelled, status " + status);
        this.jobId = jobId;
        this.status = status;
    }

    public @NotNull String getJobId() {
        return jobId;
    }

    public @NotNull JobStatus getStatus() {
        return status;
    }
}
