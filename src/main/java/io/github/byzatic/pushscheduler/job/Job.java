package io.github.byzatic.pushscheduler.job;

import com.google.common.base.MoreObjects;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Immutable snapshot of a scheduled push. Status changes produce a new instance.
 */
public final class Job {
    private final String id;
    private final OffsetDateTime triggerTime;
    private final String content;
    private final String credential;
    private final JobStatus status;
    private final Instant createdAt;
    private final Instant completedAt;
    private final String error;
    private final long sequence;

    private Job(String id, OffsetDateTime triggerTime, String content, String credential, JobStatus status,
                Instant createdAt, Instant completedAt, String error, long sequence) {
        this.id = id;
        this.triggerTime = triggerTime;
        this.content = content;
        this.credential = credential;
        this.status = status;
        this.createdAt = createdAt;
        this.completedAt = completedAt;
        this.error = error;
        this.sequence = sequence;
    }

    /**
     * A freshly admitted job in {@link JobStatus#SCHEDULED}.
     */
    public static @NotNull Job scheduled(@NotNull String id, @NotNull OffsetDateTime triggerTime,
                                         @NotNull String content, @NotNull String credential,
                                         @NotNull Instant createdAt) {
        return new Job(
                Objects.requireNonNull(id, "id"),
                Objects.requireNonNull(triggerTime, "triggerTime"),
                Objects.requireNonNull(content, "content"),
                Objects.requireNonNull(credential, "credential"),
                JobStatus.SCHEDULED,
                Objects.requireNonNull(createdAt, "createdAt"),
                null, null, 0L);
    }

    /**
     * Copy carrying the store-assigned insertion number.
     */
    public @NotNull Job withSequence(long sequence) {
        return new Job(id, triggerTime, content, credential, status, createdAt, completedAt, error, sequence);
    }

    /**
     * Copy with a new status. {@code completedAt} and {@code error} are only kept for terminal statuses.
     */
    public @NotNull Job withStatus(@NotNull JobStatus next, @Nullable Instant completedAt, @Nullable String error) {
        boolean terminal = next.isTerminal();
        return new Job(id, triggerTime, content, credential, next, createdAt,
                terminal ? completedAt : null,
                next == JobStatus.FAILED ? error : null,
                sequence);
    }

    public @NotNull String getId() {
        return id;
    }

    public @NotNull OffsetDateTime getTriggerTime() {
        return triggerTime;
    }

    public @NotNull String getContent() {
        return content;
    }

    public @NotNull String getCredential() {
        return credential;
    }

    public @NotNull JobStatus getStatus() {
        return status;
    }

    public @NotNull Instant getCreatedAt() {
        return createdAt;
    }

    public @Nullable Instant getCompletedAt() {
        return completedAt;
    }

    public @Nullable String getError() {
        return error;
    }

    /**
     * Insertion order assigned by the store, 0 before insertion.
     */
    public long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("triggerTime", triggerTime)
                .add("content", content)
                .add("credential", "***")
                .add("status", status)
                .add("createdAt", createdAt)
                .add("completedAt", completedAt)
                .add("error", error)
                .omitNullValues()
                .toString();
    }
}
