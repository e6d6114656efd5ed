package biz.kryukov.dev.healthwatch;

/**
 * Error category constants recorded with failed checks and probes.
 */
public final class ErrorCategory {

    public static final String TIMEOUT = "timeout";
    public static final String CONNECTION_ERROR = "connection_error";
    public static final String DNS_ERROR = "dns_error";
    public static final String AUTH_ERROR = "auth_error";
    public static final String TLS_ERROR = "tls_error";
    public static final String UNHEALTHY = "unhealthy";
    public static final String DEGRADED = "degraded";
    public static final String REJECTED = "rejected";
    public static final String ERROR = "error";

    private ErrorCategory() {}
}
