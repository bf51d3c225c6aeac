package io.github.byzatic.pushscheduler.notifier;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import io.github.byzatic.pushscheduler.base_exceptions.DeliveryFailureException;
import io.github.byzatic.pushscheduler.base_exceptions.DeliveryTimedOutException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends {@code GET {baseUrl}/{credential}/{content}[?query]} and treats any 2xx answer as delivered.
 */
public final class HttpPushNotifier implements Notifier {
    private final static Logger logger = LoggerFactory.getLogger(HttpPushNotifier.class);
    private static final Escaper PATH_ESCAPER = UrlEscapers.urlPathSegmentEscaper();

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String query;
    private final Duration requestTimeout;

    private HttpPushNotifier(HttpClient httpClient, String baseUrl, String query, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl;
        this.query = query;
        this.requestTimeout = requestTimeout;
    }

    public static final class Builder {
        private HttpClient httpClient;
        private String baseUrl;
        private String query = "";
        private Duration requestTimeout = Duration.ofSeconds(10);
        private Duration connectTimeout = Duration.ofSeconds(5);

        /**
         * Endpoint root, e.g. {@code https://api.day.app}. A trailing slash is ignored.
         */
        public Builder baseUrl(@NotNull String baseUrl) {
            this.baseUrl = Objects.requireNonNull(baseUrl);
            return this;
        }

        /**
         * Raw query string appended to every request, without the leading {@code ?}.
         */
        public Builder query(@Nullable String query) {
            this.query = Strings.nullToEmpty(query);
            return this;
        }

        public Builder requestTimeout(@NotNull Duration requestTimeout) {
            this.requestTimeout = Objects.requireNonNull(requestTimeout);
            return this;
        }

        /**
         * Ignored when a client is supplied through {@link #httpClient(HttpClient)}.
         */
        public Builder connectTimeout(@NotNull Duration connectTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout);
            return this;
        }

        public Builder httpClient(@NotNull HttpClient httpClient) {
            this.httpClient = Objects.requireNonNull(httpClient);
            return this;
        }

        public HttpPushNotifier build() {
            if (Strings.isNullOrEmpty(baseUrl)) throw new IllegalStateException("baseUrl is required");
            if (httpClient == null) {
                httpClient = HttpClient.newBuilder()
                        .connectTimeout(connectTimeout)
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build();
            }
            String root = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
            return new HttpPushNotifier(httpClient, root, query, requestTimeout);
        }
    }

    @Override
    public void deliver(@NotNull String content, @NotNull String credential) throws DeliveryFailureException {
        URI uri = buildUri(content, credential);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .GET()
                .build();

        // bounds the whole exchange; the request timeout alone only covers the response headers
        CompletableFuture<HttpResponse<Void>> pending = httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding());
        HttpResponse<Void> response;
        try {
            response = pending.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw timedOut(e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof HttpTimeoutException) throw timedOut(cause);
            throw new DeliveryFailureException("Push request failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new DeliveryFailureException("Push request interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new DeliveryFailureException("HTTP " + status);
        }
        logger.debug("Push endpoint answered {}", status);
    }

    private DeliveryTimedOutException timedOut(Throwable cause) {
        return new DeliveryTimedOutException("Push request timed out after " + requestTimeout.toMillis() + " ms", cause);
    }

    @VisibleForTesting
    URI buildUri(String content, String credential) throws DeliveryFailureException {
        StringBuilder sb = new StringBuilder(baseUrl)
                .append('/').append(PATH_ESCAPER.escape(credential))
                .append('/').append(PATH_ESCAPER.escape(content));
        if (!query.isEmpty()) sb.append('?').append(query);
        try {
            return URI.create(sb.toString());
        } catch (IllegalArgumentException e) {
            throw new DeliveryFailureException("Cannot build push URI from base " + baseUrl, e);
        }
    }
}
