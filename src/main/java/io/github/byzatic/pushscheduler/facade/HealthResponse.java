package io.github.byzatic.pushscheduler.facade;

import java.time.Instant;

public final class HealthResponse {
    public final String status;
    public final String scheduler;
    public final int pendingJobs;
    public final Instant timestamp;

    HealthResponse(String status, String scheduler, int pendingJobs, Instant timestamp) {
        this.status = status;
        this.scheduler = scheduler;
        this.pendingJobs = pendingJobs;
        this.timestamp = timestamp;
    }
}
