package io.github.byzatic.pushscheduler.facade;

/**
 * Inbound schedule call. {@code triggerTime} is ISO-8601 text and must carry an offset.
 */
public final class ScheduleRequest {
    public final String triggerTime;
    public final String content;
    public final String credential;

    public ScheduleRequest(String triggerTime, String content, String credential) {
        this.triggerTime = triggerTime;
        this.content = content;
        this.credential = credential;
    }
}
