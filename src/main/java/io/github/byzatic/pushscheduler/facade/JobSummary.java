package io.github.byzatic.pushscheduler.facade;

import io.github.byzatic.pushscheduler.job.Job;

import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * Client view of a job. The credential is never exposed.
 */
public final class JobSummary {
    public final String id;
    public final OffsetDateTime triggerTime;
    public final String content;
    public final String status;
    public final Instant createdAt;
    public final Instant completedAt;
    public final String error;

    JobSummary(Job job) {
        this.id = job.getId();
        this.triggerTime = job.getTriggerTime();
        this.content = job.getContent();
        this.status = job.getStatus().label();
        this.createdAt = job.getCreatedAt();
        this.completedAt = job.getCompletedAt();
        this.error = job.getError();
    }

    @Override
    public String toString() {
        return "JobSummary{id=" + id + ", triggerTime=" + triggerTime + ", status=" + status +
                (error != null ? ", error='" + error + '\'' : "") + '}';
    }
}
