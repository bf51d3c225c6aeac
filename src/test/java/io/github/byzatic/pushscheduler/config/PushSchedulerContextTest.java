package io.github.byzatic.pushscheduler.config;

import io.github.byzatic.pushscheduler.facade.ScheduleRequest;
import io.github.byzatic.pushscheduler.facade.ScheduleResponse;
import io.github.byzatic.pushscheduler.notifier.RecordingNotifier;
import io.github.byzatic.pushscheduler.timer.VirtualTime;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PushSchedulerContextTest {

    @Test
    void independentContexts_shareNoState() throws Exception {
        VirtualTime timeA = new VirtualTime(Instant.parse("2025-01-10T07:30:00Z"));
        VirtualTime timeB = new VirtualTime(Instant.parse("2025-01-10T07:30:00Z"));
        RecordingNotifier notifierA = new RecordingNotifier();
        RecordingNotifier notifierB = new RecordingNotifier();

        try (PushSchedulerContext a = PushSchedulerContext.create(timeA, notifierA);
             PushSchedulerContext b = PushSchedulerContext.create(timeB, notifierB)) {
            ScheduleResponse created = a.getFacade().schedule(
                    new ScheduleRequest("2025-01-10T15:31:00+08:00", "ping", "k1"));

            assertEquals(1, a.getJobStore().size());
            assertEquals(0, b.getJobStore().size());

            timeA.advance(Duration.ofSeconds(61));
            assertEquals(1, notifierA.calls().size());
            assertTrue(notifierB.calls().isEmpty());
            assertEquals("completed", a.getFacade().get(created.id).status);
            assertSame(timeA, a.getTimeSource());
            assertSame(notifierA, a.getNotifier());
        }
    }

    @Test
    void wallClockContext_buildsFromConfig_andCloses() {
        PushSchedulerConfig config = new PushSchedulerConfig.Builder()
                .baseUrl("http://localhost:1")
                .workerThreads(1)
                .build();
        PushSchedulerContext context = PushSchedulerContext.create(config);
        assertTrue(context.getScheduler().isRunning());
        assertEquals("running", context.getFacade().health().scheduler);
        context.close();
        assertFalse(context.getScheduler().isRunning());
    }
}
