package io.github.byzatic.pushscheduler.job;

import org.jetbrains.annotations.NotNull;

import java.util.UUID;

/**
 * Source of job identifiers.
 */
@FunctionalInterface
public interface JobIdGenerator {

    @NotNull String nextId();

    /**
     * First 8 hex characters of a random UUID. Short enough to read in logs; collisions are
     * rare and rejected by the store, so callers retry.
     */
    static @NotNull JobIdGenerator shortUuid() {
        return () -> UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Full random UUID string.
     */
    static @NotNull JobIdGenerator uuid() {
        return () -> UUID.randomUUID().toString();
    }
}
