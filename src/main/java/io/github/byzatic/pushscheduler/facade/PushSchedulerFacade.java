package io.github.byzatic.pushscheduler.facade;

import com.google.common.collect.ImmutableMap;
import io.github.byzatic.pushscheduler.base_exceptions.AlreadyTerminalException;
import io.github.byzatic.pushscheduler.base_exceptions.InvalidScheduleException;
import io.github.byzatic.pushscheduler.base_exceptions.JobNotFoundException;
import io.github.byzatic.pushscheduler.job.Job;
import io.github.byzatic.pushscheduler.scheduler.PushSchedulerInterface;
import io.github.byzatic.pushscheduler.time_source.TimeSource;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Transport-agnostic entry point. Maps caller requests onto the scheduler and scheduler failures onto
 * {@link ErrorCategory} values.
 */
public final class PushSchedulerFacade {
    private final static Logger logger = LoggerFactory.getLogger(PushSchedulerFacade.class);

    private final PushSchedulerInterface scheduler;
    private final TimeSource timeSource;

    public PushSchedulerFacade(@NotNull PushSchedulerInterface scheduler, @NotNull TimeSource timeSource) {
        this.scheduler = Objects.requireNonNull(scheduler);
        this.timeSource = Objects.requireNonNull(timeSource);
    }

    public @NotNull ScheduleResponse schedule(@NotNull ScheduleRequest request) throws FacadeException {
        if (request.triggerTime == null || request.content == null || request.credential == null) {
            throw new FacadeException(ErrorCategory.INVALID_REQUEST, "triggerTime, content and credential are required");
        }
        OffsetDateTime triggerTime = parseTriggerTime(request.triggerTime);

        Job job;
        try {
            job = scheduler.schedule(triggerTime, request.content, request.credential);
        } catch (InvalidScheduleException e) {
            throw new FacadeException(ErrorCategory.NOT_IN_FUTURE, "Trigger time must be in the future",
                    timeDetails(request.triggerTime), e);
        } catch (IllegalStateException e) {
            // closed scheduler, or no free job id
            throw new FacadeException(ErrorCategory.UNAVAILABLE, "Scheduler unavailable: " + e.getMessage(),
                    ImmutableMap.of(), e);
        }
        return new ScheduleResponse(job.getId(), job.getTriggerTime(), job.getContent(), job.getStatus().label(),
                "Job scheduled, push at " + job.getTriggerTime());
    }

    public @NotNull JobListResponse list() {
        List<Job> jobs = scheduler.list();
        Map<String, JobSummary> byId = new LinkedHashMap<>();
        for (Job job : jobs) byId.put(job.getId(), new JobSummary(job));
        return new JobListResponse(byId.size(), ImmutableMap.copyOf(byId), scheduler.pendingCount());
    }

    public @NotNull JobSummary get(@NotNull String id) throws FacadeException {
        try {
            return new JobSummary(scheduler.get(id));
        } catch (JobNotFoundException e) {
            throw new FacadeException(ErrorCategory.NOT_FOUND, "Job not found: " + id, ImmutableMap.of(), e);
        }
    }

    public @NotNull CancelResponse cancel(@NotNull String id) throws FacadeException {
        try {
            Job job = scheduler.cancel(id);
            return new CancelResponse(job.getId(), job.getStatus().label(), "Job cancelled");
        } catch (JobNotFoundException e) {
            throw new FacadeException(ErrorCategory.NOT_FOUND, "Job not found: " + id, ImmutableMap.of(), e);
        } catch (AlreadyTerminalException e) {
            throw new FacadeException(ErrorCategory.ALREADY_TERMINAL,
                    "Job " + id + " already " + e.getStatus().label(),
                    ImmutableMap.of("status", e.getStatus().label()), e);
        }
    }

    public @NotNull HealthResponse health() {
        boolean running = scheduler.isRunning();
        return new HealthResponse("healthy", running ? "running" : "stopped", scheduler.pendingCount(), timeSource.now());
    }

    private OffsetDateTime parseTriggerTime(String text) throws FacadeException {
        TemporalAccessor parsed;
        try {
            parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
        } catch (DateTimeParseException e) {
            logger.debug("Unparsable trigger time '{}'", text, e);
            throw new FacadeException(ErrorCategory.INVALID_REQUEST, "Trigger time is not an ISO-8601 timestamp",
                    timeDetails(text), e);
        }
        if (parsed instanceof OffsetDateTime) return (OffsetDateTime) parsed;
        throw new FacadeException(ErrorCategory.MISSING_OFFSET, "Trigger time must carry a time zone offset",
                timeDetails(text), null);
    }

    private Map<String, String> timeDetails(String received) {
        return ImmutableMap.of(
                "current_time", timeSource.now().toString(),
                "received_time", received);
    }
}
