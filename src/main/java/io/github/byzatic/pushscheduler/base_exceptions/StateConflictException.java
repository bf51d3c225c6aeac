package io.github.byzatic.pushscheduler.base_exceptions;

import io.github.byzatic.pushscheduler.job.JobStatus;
import org.jetbrains.annotations.NotNull;

/**
 * A compare-and-set on a job status found a different status than expected.
 */
public class StateConflictException extends PushSchedulerException {
    private final String jobId;
    private final JobStatus expected;
    private final JobStatus actual;

    public StateConflictException(@NotNull String jobId, @NotNull JobStatus expected, @NotNull JobStatus actual) {
        super("Job " + jobId + " is " + actual + ", expected " + expected);
        this.jobId = jobId;
        this.expected = expected;
        this.actual = actual;
    }

    public @NotNull String getJobId() {
        return jobId;
    }

    public @NotNull JobStatus getExpected() {
        return expected;
    }

    public @NotNull JobStatus getActual() {
        return actual;
    }
}
