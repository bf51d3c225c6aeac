package io.github.byzatic.pushscheduler.base_exceptions;

import org.jetbrains.annotations.NotNull;

public class JobNotFoundException extends PushSchedulerException {
    private final String jobId;

    public JobNotFoundException(@NotNull String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public @NotNull String getJobId() {
        return jobId;
    }
}
