package io.github.byzatic.pushscheduler.base_exceptions;

import org.jetbrains.annotations.NotNull;

public class DuplicateJobIdException extends PushSchedulerException {
    private final String jobId;

    public DuplicateJobIdException(@NotNull String jobId) {
        super("Job id already in use: " + jobId);
        this.jobId = jobId;
    }

    public @NotNull String getJobId() {
        return jobId;
    }
}
