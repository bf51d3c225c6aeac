package io.github.byzatic.pushscheduler.notifier;

import io.github.byzatic.pushscheduler.base_exceptions.DeliveryFailureException;
import org.jetbrains.annotations.NotNull;

/**
 * Performs the outbound push for a due job. Implementations hold no shared mutable state and never
 * retry on their own.
 */
@FunctionalInterface
public interface Notifier {

    /**
     * Delivers {@code content} to the endpoint addressed by {@code credential}. Returns normally on success.
     *
     * @throws DeliveryFailureException on any non-success response, transport error or timeout
     */
    void deliver(@NotNull String content, @NotNull String credential) throws DeliveryFailureException;
}
