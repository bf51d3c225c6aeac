package io.github.byzatic.pushscheduler.timer;

/**
 * Handle to one armed timer.
 */
public interface TimerHandle {

    /**
     * Disarms the timer.
     *
     * @return {@code true} if the action will not run because of this call; {@code false} if it
     *         already ran, is running, or was cancelled before. Never throws.
     */
    boolean cancel();

    /**
     * @return {@code true} once the timer fired or was cancelled
     */
    boolean isDone();
}
