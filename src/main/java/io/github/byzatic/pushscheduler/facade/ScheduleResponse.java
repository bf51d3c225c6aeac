package io.github.byzatic.pushscheduler.facade;

import java.time.OffsetDateTime;

public final class ScheduleResponse {
    public final String id;
    public final OffsetDateTime triggerTime;
    public final String content;
    public final String status;
    public final String message;

    ScheduleResponse(String id, OffsetDateTime triggerTime, String content, String status, String message) {
        this.id = id;
        this.triggerTime = triggerTime;
        this.content = content;
        this.status = status;
        this.message = message;
    }

    @Override
    public String toString() {
        return "ScheduleResponse{id=" + id + ", triggerTime=" + triggerTime + ", status=" + status + '}';
    }
}
