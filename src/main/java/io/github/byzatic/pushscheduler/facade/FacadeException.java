package io.github.byzatic.pushscheduler.facade;

import com.google.common.collect.ImmutableMap;
import org.jetbrains.annotations.NotNull;

import java.util.Map;

public class FacadeException extends Exception {
    private final ErrorCategory category;
    private final ImmutableMap<String, String> details;

    public FacadeException(@NotNull ErrorCategory category, String message) {
        this(category, message, ImmutableMap.of(), null);
    }

    public FacadeException(@NotNull ErrorCategory category, String message, @NotNull Map<String, String> details,
                           Throwable cause) {
        super(message, cause);
        this.category = category;
        this.details = ImmutableMap.copyOf(details);
    }

    public @NotNull ErrorCategory getCategory() {
        return category;
    }

    /**
     * Extra context for the client, e.g. the server's current time next to the received time.
     */
    public @NotNull Map<String, String> getDetails() {
        return details;
    }
}
