package biz.kryukov.dev.healthwatch.checks;

import biz.kryukov.dev.healthwatch.CheckKind;
import biz.kryukov.dev.healthwatch.ErrorCategory;
import biz.kryukov.dev.healthwatch.HealthCheck;
import biz.kryukov.dev.healthwatch.UnhealthyException;
import biz.kryukov.dev.healthwatch.ValidationException;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * HTTP health check: GET against a service endpoint.
 *
 * <p>Backs the storage, auth and edge-function built-ins. By default any 2xx
 * answer is healthy; in reachability mode any HTTP answer at all counts, since
 * the point is only to prove the service is up.</p>
 */
public final class HttpHealthCheck implements HealthCheck {

    static final String USER_AGENT = "healthwatch/0.1.0";

    private final String name;
    private final URI uri;
    private final Duration degradedThreshold;
    private final boolean reachabilityOnly;
    private final Map<String, String> headers;
    private final HttpClient client;

    private HttpHealthCheck(Builder builder) {
        this.name = builder.name;
        this.uri = builder.uri;
        this.degradedThreshold = builder.degradedThreshold;
        this.reachabilityOnly = builder.reachabilityOnly;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.client = HttpClient.newBuilder()
                .connectTimeout(builder.connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void check(Duration timeout) throws Exception {
        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("User-Agent", USER_AGENT)
                .GET();
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            requestBuilder.header(entry.getKey(), entry.getValue());
        }

        HttpResponse<Void> response = client.send(requestBuilder.build(),
                HttpResponse.BodyHandlers.discarding());

        int status = response.statusCode();
        if (reachabilityOnly) {
            return;
        }
        if (status < 200 || status >= 300) {
            String category = status == 401 || status == 403
                    ? ErrorCategory.AUTH_ERROR : ErrorCategory.UNHEALTHY;
            throw new UnhealthyException(name + " check failed: HTTP status " + status, category);
        }
    }

    @Override
    public Duration degradedThreshold() {
        return degradedThreshold;
    }

    /** Returns the checked URI. */
    public URI uri() {
        return uri;
    }

    /** Creates a builder for an arbitrary named HTTP check. */
    public static Builder builder(String name, String url) {
        return new Builder(name, url);
    }

    /** Creates a builder preset with the name and threshold of a built-in check. */
    public static Builder builder(CheckKind kind, String url) {
        Builder b = new Builder(kind.label(), url).degradedThreshold(kind.degradedThreshold());
        if (kind == CheckKind.EDGE_FUNCTIONS) {
            b.reachabilityOnly(true);
        }
        return b;
    }

    /** Builder for {@link HttpHealthCheck}. */
    public static final class Builder {
        private final String name;
        private final URI uri;
        private Duration degradedThreshold;
        private boolean reachabilityOnly;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(String name, String url) {
            this.name = Objects.requireNonNull(name, "name");
            try {
                this.uri = URI.create(Objects.requireNonNull(url, "url"));
            } catch (IllegalArgumentException e) {
                throw new ValidationException("invalid URL for check " + name + ": " + url);
            }
            if (uri.getScheme() == null || !uri.getScheme().startsWith("http")) {
                throw new ValidationException("URL for check " + name + " must be http(s): " + url);
            }
        }

        public Builder degradedThreshold(Duration threshold) {
            this.degradedThreshold = threshold;
            return this;
        }

        /** Treat any HTTP response as success. */
        public Builder reachabilityOnly(boolean reachabilityOnly) {
            this.reachabilityOnly = reachabilityOnly;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers.putAll(headers);
            return this;
        }

        public HttpHealthCheck build() {
            return new HttpHealthCheck(this);
        }
    }
}
