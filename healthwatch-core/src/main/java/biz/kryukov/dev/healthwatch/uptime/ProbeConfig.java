package biz.kryukov.dev.healthwatch.uptime;

import biz.kryukov.dev.healthwatch.ValidationException;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externally reachable endpoint polled on its own interval. Immutable, created via Builder.
 */
public final class ProbeConfig {

    /** Default polling interval: 1 minute. */
    public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(1);
    /** Default request timeout: 30 seconds. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public static final Duration MIN_INTERVAL = Duration.ofSeconds(1);
    public static final Duration MAX_INTERVAL = Duration.ofDays(1);
    public static final Duration MIN_TIMEOUT = Duration.ofMillis(100);
    public static final Duration MAX_TIMEOUT = Duration.ofMinutes(2);

    private final String name;
    private final String url;
    private final ProbeKind kind;
    private final Duration interval;
    private final Duration timeout;
    private final boolean enabled;
    private final List<String> regions;
    private final List<Integer> expectedStatusCodes;
    private final String expectedBodySubstring;
    private final Map<String, String> headers;
    private final AlertPolicy alertPolicy;
    private final SslPolicy sslPolicy;

    private ProbeConfig(Builder builder) {
        this.name = builder.name;
        this.url = builder.url;
        this.kind = builder.kind;
        this.interval = builder.interval;
        this.timeout = builder.timeout;
        this.enabled = builder.enabled;
        this.regions = List.copyOf(builder.regions);
        this.expectedStatusCodes = List.copyOf(builder.expectedStatusCodes);
        this.expectedBodySubstring = builder.expectedBodySubstring;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.alertPolicy = builder.alertPolicy;
        this.sslPolicy = builder.sslPolicy;
    }

    public String name() {
        return name;
    }

    public String url() {
        return url;
    }

    public URI uri() {
        return URI.create(url);
    }

    public ProbeKind kind() {
        return kind;
    }

    public Duration interval() {
        return interval;
    }

    public Duration timeout() {
        return timeout;
    }

    public boolean enabled() {
        return enabled;
    }

    public List<String> regions() {
        return regions;
    }

    public List<Integer> expectedStatusCodes() {
        return expectedStatusCodes;
    }

    /** Substring the response body must contain, or {@code null} for no body check. */
    public String expectedBodySubstring() {
        return expectedBodySubstring;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public AlertPolicy alertPolicy() {
        return alertPolicy;
    }

    /** TLS certificate policy, or {@code null}. */
    public SslPolicy sslPolicy() {
        return sslPolicy;
    }

    /** Creates a builder seeded with this probe's values. */
    public Builder toBuilder() {
        Builder b = new Builder(name, url)
                .kind(kind)
                .interval(interval)
                .timeout(timeout)
                .enabled(enabled)
                .regions(regions)
                .expectedStatusCodes(expectedStatusCodes)
                .expectedBodySubstring(expectedBodySubstring)
                .headers(headers)
                .alertPolicy(alertPolicy);
        b.sslPolicy = sslPolicy;
        return b;
    }

    @Override
    public String toString() {
        return "ProbeConfig{" + name + " " + kind.label() + " " + url + " every "
                + interval.toSeconds() + "s" + (enabled ? "" : " disabled") + "}";
    }

    public static Builder builder(String name, String url) {
        return new Builder(name, url);
    }

    /** Builder for {@link ProbeConfig}. */
    public static final class Builder {
        private final String name;
        private final String url;
        private ProbeKind kind = ProbeKind.HTTP;
        private Duration interval = DEFAULT_INTERVAL;
        private Duration timeout = DEFAULT_TIMEOUT;
        private boolean enabled = true;
        private List<String> regions = new ArrayList<>();
        private List<Integer> expectedStatusCodes = new ArrayList<>(List.of(200));
        private String expectedBodySubstring;
        private Map<String, String> headers = new LinkedHashMap<>();
        private AlertPolicy alertPolicy = AlertPolicy.defaults();
        private SslPolicy sslPolicy;

        private Builder(String name, String url) {
            this.name = name;
            this.url = url;
        }

        public Builder kind(ProbeKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder interval(Duration interval) {
            this.interval = interval;
            return this;
        }

        public Builder intervalSeconds(long seconds) {
            return interval(Duration.ofSeconds(seconds));
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder timeoutSeconds(long seconds) {
            return timeout(Duration.ofSeconds(seconds));
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder regions(List<String> regions) {
            this.regions = new ArrayList<>(regions);
            return this;
        }

        public Builder expectedStatusCodes(List<Integer> codes) {
            this.expectedStatusCodes = new ArrayList<>(codes);
            return this;
        }

        public Builder expectedStatusCodes(Integer... codes) {
            return expectedStatusCodes(List.of(codes));
        }

        public Builder expectedBodySubstring(String substring) {
            this.expectedBodySubstring = substring == null || substring.isEmpty() ? null : substring;
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = new LinkedHashMap<>(headers);
            return this;
        }

        public Builder alertPolicy(AlertPolicy alertPolicy) {
            this.alertPolicy = alertPolicy;
            return this;
        }

        public Builder sslPolicy(boolean checkCertificate, int warnDaysBeforeExpiry) {
            this.sslPolicy = new SslPolicy(checkCertificate, warnDaysBeforeExpiry);
            return this;
        }

        /** Builds and validates the probe. */
        public ProbeConfig build() {
            validate();
            return new ProbeConfig(this);
        }

        private void validate() {
            if (name == null || name.isBlank()) {
                throw new ValidationException("probe name must not be blank");
            }
            if (url == null || url.isBlank()) {
                throw new ValidationException("probe " + name + ": url must not be blank");
            }
            URI uri;
            try {
                uri = URI.create(url);
            } catch (IllegalArgumentException e) {
                throw new ValidationException("probe " + name + ": invalid url " + url);
            }
            if (kind == null) {
                throw new ValidationException("probe " + name + ": kind must be set");
            }
            if (kind.isHttp() && (uri.getScheme() == null || !uri.getScheme().startsWith("http"))) {
                throw new ValidationException(
                        "probe " + name + ": " + kind.label() + " probe needs an http(s) url, got " + url);
            }
            if (interval == null || interval.compareTo(MIN_INTERVAL) < 0
                    || interval.compareTo(MAX_INTERVAL) > 0) {
                throw new ValidationException("probe " + name + ": interval must be between "
                        + MIN_INTERVAL + " and " + MAX_INTERVAL + ", got " + interval);
            }
            if (timeout == null || timeout.compareTo(MIN_TIMEOUT) < 0
                    || timeout.compareTo(MAX_TIMEOUT) > 0) {
                throw new ValidationException("probe " + name + ": timeout must be between "
                        + MIN_TIMEOUT + " and " + MAX_TIMEOUT + ", got " + timeout);
            }
            if (kind.isHttp() && expectedStatusCodes.isEmpty()) {
                throw new ValidationException("probe " + name + ": expectedStatusCodes must not be empty");
            }
            for (Integer code : expectedStatusCodes) {
                if (code == null || code < 100 || code > 599) {
                    throw new ValidationException("probe " + name + ": invalid status code " + code);
                }
            }
            if (alertPolicy == null) {
                throw new ValidationException("probe " + name + ": alertPolicy must be set");
            }
        }
    }
}
