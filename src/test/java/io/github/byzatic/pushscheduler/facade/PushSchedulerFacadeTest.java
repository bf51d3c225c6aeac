package io.github.byzatic.pushscheduler.facade;

import io.github.byzatic.pushscheduler.base_exceptions.DeliveryFailureException;
import io.github.byzatic.pushscheduler.notifier.RecordingNotifier;
import io.github.byzatic.pushscheduler.scheduler.PushScheduler;
import io.github.byzatic.pushscheduler.timer.VirtualTime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PushSchedulerFacadeTest {
    // 2025-01-10T15:30:00+08:00
    private static final Instant START = Instant.parse("2025-01-10T07:30:00Z");

    VirtualTime time;
    RecordingNotifier notifier;
    PushScheduler scheduler;
    PushSchedulerFacade facade;

    @BeforeEach
    void setUp() {
        time = new VirtualTime(START);
        notifier = new RecordingNotifier();
        scheduler = new PushScheduler.Builder().virtualTime(time).notifier(notifier).build();
        facade = new PushSchedulerFacade(scheduler, time);
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    void schedule_echoesRequest_withScheduledStatus() throws Exception {
        ScheduleResponse response = facade.schedule(
                new ScheduleRequest("2025-01-10T15:31:00+08:00", "drink water", "k1"));

        assertNotNull(response.id);
        assertEquals(OffsetDateTime.parse("2025-01-10T15:31:00+08:00"), response.triggerTime);
        assertEquals("drink water", response.content);
        assertEquals("scheduled", response.status);
        assertFalse(response.message.isEmpty());
    }

    @Test
    void schedule_zoneIdSuffix_isAccepted() throws Exception {
        ScheduleResponse response = facade.schedule(
                new ScheduleRequest("2025-01-10T15:31:00+08:00[Asia/Shanghai]", "ping", "k1"));
        assertEquals("scheduled", response.status);
    }

    @Test
    void schedule_withoutOffset_isMissingOffset() {
        FacadeException ex = assertThrows(FacadeException.class,
                () -> facade.schedule(new ScheduleRequest("2025-01-10T15:31:00", "ping", "k1")));
        assertEquals(ErrorCategory.MISSING_OFFSET, ex.getCategory());
        assertEquals(400, ex.getCategory().httpStatus());
        assertEquals("2025-01-10T15:31:00", ex.getDetails().get("received_time"));
        assertEquals(0, scheduler.list().size());
    }

    @Test
    void schedule_afterClose_isUnavailable() {
        scheduler.close();

        FacadeException ex = assertThrows(FacadeException.class,
                () -> facade.schedule(new ScheduleRequest("2025-01-10T15:31:00+08:00", "ping", "k1")));
        assertEquals(ErrorCategory.UNAVAILABLE, ex.getCategory());
        assertEquals(503, ex.getCategory().httpStatus());
        assertInstanceOf(IllegalStateException.class, ex.getCause());
        assertEquals(0, scheduler.list().size());
    }

    @Test
    void schedule_garbageTime_isInvalidRequest() {
        FacadeException ex = assertThrows(FacadeException.class,
                () -> facade.schedule(new ScheduleRequest("tomorrow-ish", "ping", "k1")));
        assertEquals(ErrorCategory.INVALID_REQUEST, ex.getCategory());
    }

    @Test
    void schedule_missingField_isInvalidRequest() {
        FacadeException ex = assertThrows(FacadeException.class,
                () -> facade.schedule(new ScheduleRequest("2025-01-10T15:31:00+08:00", "ping", null)));
        assertEquals(ErrorCategory.INVALID_REQUEST, ex.getCategory());
    }

    @Test
    void schedule_pastTime_isNotInFuture_withCurrentTimeDetail() {
        FacadeException ex = assertThrows(FacadeException.class,
                () -> facade.schedule(new ScheduleRequest("2025-01-10T15:29:59+08:00", "ping", "k1")));
        assertEquals(ErrorCategory.NOT_IN_FUTURE, ex.getCategory());
        assertEquals(START.toString(), ex.getDetails().get("current_time"));
        assertEquals(0, scheduler.list().size());
    }

    @Test
    void get_reflectsLifecycle_andNeverExposesCredential() throws Exception {
        notifier.failWith(new DeliveryFailureException("HTTP 500"));
        ScheduleResponse created = facade.schedule(new ScheduleRequest("2025-01-10T15:31:00+08:00", "ping", "secret-k1"));

        assertEquals("scheduled", facade.get(created.id).status);
        time.advance(Duration.ofMinutes(2));

        JobSummary summary = facade.get(created.id);
        assertEquals("failed", summary.status);
        assertEquals("HTTP 500", summary.error);
        assertEquals(START, summary.createdAt);
        assertNotNull(summary.completedAt);
        assertFalse(summary.toString().contains("secret-k1"));
    }

    @Test
    void get_unknown_isNotFound() {
        FacadeException ex = assertThrows(FacadeException.class, () -> facade.get("missing"));
        assertEquals(ErrorCategory.NOT_FOUND, ex.getCategory());
        assertEquals(404, ex.getCategory().httpStatus());
    }

    @Test
    void cancel_thenCancelAgain_isAlreadyTerminal() throws Exception {
        ScheduleResponse created = facade.schedule(new ScheduleRequest("2025-01-10T15:31:00+08:00", "ping", "k1"));

        CancelResponse cancelled = facade.cancel(created.id);
        assertEquals(created.id, cancelled.id);
        assertEquals("cancelled", cancelled.status);

        FacadeException again = assertThrows(FacadeException.class, () -> facade.cancel(created.id));
        assertEquals(ErrorCategory.ALREADY_TERMINAL, again.getCategory());
        assertEquals(409, again.getCategory().httpStatus());
        assertEquals("cancelled", again.getDetails().get("status"));

        FacadeException missing = assertThrows(FacadeException.class, () -> facade.cancel("missing"));
        assertEquals(ErrorCategory.NOT_FOUND, missing.getCategory());

        time.advance(Duration.ofMinutes(5));
        assertTrue(notifier.calls().isEmpty());
    }

    @Test
    void list_countsAllJobs_inAdmissionOrder() throws Exception {
        ScheduleResponse a = facade.schedule(new ScheduleRequest("2025-01-10T15:40:00+08:00", "a", "k"));
        ScheduleResponse b = facade.schedule(new ScheduleRequest("2025-01-10T15:31:00+08:00", "b", "k"));
        time.advance(Duration.ofMinutes(2));

        JobListResponse list = facade.list();
        assertEquals(2, list.total);
        assertEquals(List.of(a.id, b.id), List.copyOf(list.jobs.keySet()));
        assertEquals("scheduled", list.jobs.get(a.id).status);
        assertEquals("completed", list.jobs.get(b.id).status);
        assertEquals(1, list.pendingJobs);
    }

    @Test
    void health_reportsLiveness_andSchedulerState() throws Exception {
        facade.schedule(new ScheduleRequest("2025-01-10T15:31:00+08:00", "ping", "k1"));
        HealthResponse health = facade.health();
        assertEquals("healthy", health.status);
        assertEquals("running", health.scheduler);
        assertEquals(1, health.pendingJobs);
        assertEquals(START, health.timestamp);

        scheduler.close();
        HealthResponse stopped = facade.health();
        assertEquals("healthy", stopped.status);
        assertEquals("stopped", stopped.scheduler);
    }
}
