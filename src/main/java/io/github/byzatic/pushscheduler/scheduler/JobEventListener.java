package io.github.byzatic.pushscheduler.scheduler;

import io.github.byzatic.pushscheduler.job.Job;

/**
 * Job lifecycle events. Called on the thread that caused the event; exceptions are logged and ignored.
 */
public interface JobEventListener {
    default void onScheduled(Job job) {
    }

    default void onDelivered(Job job) {
    }

    default void onDeliveryFailed(Job job, Throwable error) {
    }

    default void onCancelled(Job job) {
    }
}
