package io.github.byzatic.pushscheduler.config;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Settings of a push scheduler instance.
 * <p>
 * {@link #fromEnvironment()} reads each key from the environment, then from system properties, then
 * falls back to the default.
 */
public final class PushSchedulerConfig {
    private final static Logger logger = LoggerFactory.getLogger(PushSchedulerConfig.class);

    public static final String PUSH_BASE_URL = "PUSH_BASE_URL";
    public static final String PUSH_QUERY = "PUSH_QUERY";
    public static final String PUSH_TIMEOUT_SECONDS = "PUSH_TIMEOUT_SECONDS";
    public static final String PUSH_CONNECT_TIMEOUT_SECONDS = "PUSH_CONNECT_TIMEOUT_SECONDS";
    public static final String SCHEDULER_WORKER_THREADS = "SCHEDULER_WORKER_THREADS";

    public static final String DEFAULT_BASE_URL = "https://api.day.app";
    public static final String DEFAULT_QUERY = "level=critical&volume=5";
    public static final int DEFAULT_TIMEOUT_SECONDS = 10;
    public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 5;

    private final String baseUrl;
    private final String query;
    private final Duration requestTimeout;
    private final Duration connectTimeout;
    private final int workerThreads;

    private PushSchedulerConfig(Builder b) {
        this.baseUrl = b.baseUrl;
        this.query = b.query;
        this.requestTimeout = b.requestTimeout;
        this.connectTimeout = b.connectTimeout;
        this.workerThreads = b.workerThreads;
    }

    public static @NotNull PushSchedulerConfig fromEnvironment() {
        return fromLookup(key -> {
            String value = System.getenv(key);
            if (Strings.isNullOrEmpty(value)) value = System.getProperty(key);
            return value;
        });
    }

    @VisibleForTesting
    static @NotNull PushSchedulerConfig fromLookup(@NotNull Function<String, String> lookup) {
        Builder b = new Builder();
        String baseUrl = lookup.apply(PUSH_BASE_URL);
        if (!Strings.isNullOrEmpty(baseUrl)) b.baseUrl(baseUrl);
        // an explicitly empty query disables it
        String query = lookup.apply(PUSH_QUERY);
        if (query != null) b.query(query);
        b.requestTimeout(Duration.ofSeconds(intValue(lookup, PUSH_TIMEOUT_SECONDS, DEFAULT_TIMEOUT_SECONDS)));
        b.connectTimeout(Duration.ofSeconds(intValue(lookup, PUSH_CONNECT_TIMEOUT_SECONDS, DEFAULT_CONNECT_TIMEOUT_SECONDS)));
        b.workerThreads(intValue(lookup, SCHEDULER_WORKER_THREADS, b.workerThreads));
        return b.build();
    }

    private static int intValue(Function<String, String> lookup, String key, int defaultValue) {
        String value = lookup.apply(key);
        if (Strings.isNullOrEmpty(value)) return defaultValue;
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed > 0) return parsed;
            logger.warn("{}={} must be positive, using default {}", key, value, defaultValue);
        } catch (NumberFormatException e) {
            logger.warn("{}={} is not a number, using default {}", key, value, defaultValue);
        }
        return defaultValue;
    }

    public static final class Builder {
        private String baseUrl = DEFAULT_BASE_URL;
        private String query = DEFAULT_QUERY;
        private Duration requestTimeout = Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS);
        private Duration connectTimeout = Duration.ofSeconds(DEFAULT_CONNECT_TIMEOUT_SECONDS);
        private int workerThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

        public Builder baseUrl(@NotNull String baseUrl) {
            this.baseUrl = Objects.requireNonNull(baseUrl);
            return this;
        }

        public Builder query(@NotNull String query) {
            this.query = Objects.requireNonNull(query);
            return this;
        }

        public Builder requestTimeout(@NotNull Duration requestTimeout) {
            this.requestTimeout = Objects.requireNonNull(requestTimeout);
            return this;
        }

        public Builder connectTimeout(@NotNull Duration connectTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout);
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            if (workerThreads < 1) throw new IllegalArgumentException("workerThreads must be >= 1");
            this.workerThreads = workerThreads;
            return this;
        }

        public PushSchedulerConfig build() {
            return new PushSchedulerConfig(this);
        }
    }

    public @NotNull String getBaseUrl() {
        return baseUrl;
    }

    public @NotNull String getQuery() {
        return query;
    }

    public @NotNull Duration getRequestTimeout() {
        return requestTimeout;
    }

    public @NotNull Duration getConnectTimeout() {
        return connectTimeout;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("baseUrl", baseUrl)
                .add("query", query)
                .add("requestTimeout", requestTimeout)
                .add("connectTimeout", connectTimeout)
                .add("workerThreads", workerThreads)
                .toString();
    }
}
