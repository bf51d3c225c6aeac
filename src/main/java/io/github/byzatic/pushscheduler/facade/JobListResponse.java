package io.github.byzatic.pushscheduler.facade;

import java.util.Map;

public final class JobListResponse {
    public final int total;
    /** Insertion ordered. */
    public final Map<String, JobSummary> jobs;
    public final int pendingJobs;

    JobListResponse(int total, Map<String, JobSummary> jobs, int pendingJobs) {
        this.total = total;
        this.jobs = jobs;
        this.pendingJobs = pendingJobs;
    }
}
