package biz.kryukov.dev.healthwatch;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;

/**
 * Classifies check and probe failures into an error category.
 *
 * <p>Classification chain:
 * <ol>
 *   <li>{@link CheckException} with explicit category</li>
 *   <li>Platform exception types (timeout, DNS, connection, TLS)</li>
 *   <li>Wrapped exception cause (recursive)</li>
 *   <li>Fallback: {@link ErrorCategory#ERROR}</li>
 * </ol>
 */
public final class ErrorClassifier {

    private ErrorClassifier() {}

    public static String classify(Throwable err) {
        if (err instanceof CheckException ce) {
            return ce.category();
        }

        String platform = classifyPlatform(err);
        if (platform != null) {
            return platform;
        }

        Throwable cause = err.getCause();
        if (cause != null && cause != err) {
            String inner = classify(cause);
            if (!ErrorCategory.ERROR.equals(inner)) {
                return inner;
            }
        }

        return ErrorCategory.ERROR;
    }

    /** Returns the status a failure maps to: the explicit one for {@link CheckException}, else unhealthy. */
    public static HealthStatus statusOf(Throwable err) {
        if (err instanceof CheckException ce && ce.status() != null) {
            return ce.status();
        }
        return HealthStatus.UNHEALTHY;
    }

    /** Returns the exception message, or the class name if it has none. */
    public static String messageOf(Throwable err) {
        String msg = err.getMessage();
        return msg != null && !msg.isBlank() ? msg : err.getClass().getName();
    }

    private static String classifyPlatform(Throwable err) {
        if (err instanceof SocketTimeoutException
                || err instanceof TimeoutException
                || err instanceof HttpConnectTimeoutException
                || err instanceof HttpTimeoutException) {
            return ErrorCategory.TIMEOUT;
        }
        if (err instanceof UnknownHostException) {
            return ErrorCategory.DNS_ERROR;
        }
        if (err instanceof ConnectException || err instanceof NoRouteToHostException) {
            return ErrorCategory.CONNECTION_ERROR;
        }
        if (err instanceof SSLException) {
            return ErrorCategory.TLS_ERROR;
        }
        return null;
    }
}
