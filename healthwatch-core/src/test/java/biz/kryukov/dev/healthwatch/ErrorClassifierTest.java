package biz.kryukov.dev.healthwatch;

import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLHandshakeException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorClassifierTest {

    @Test
    void checkExceptionCarriesItsCategory() {
        assertEquals(ErrorCategory.AUTH_ERROR,
                ErrorClassifier.classify(new UnhealthyException("denied", ErrorCategory.AUTH_ERROR)));
        assertEquals(ErrorCategory.DEGRADED, ErrorClassifier.classify(new DegradedException("slow")));
        assertEquals(ErrorCategory.TIMEOUT, ErrorClassifier.classify(new CheckTimeoutException("late")));
    }

    @Test
    void platformExceptions() {
        assertEquals(ErrorCategory.TIMEOUT, ErrorClassifier.classify(new SocketTimeoutException()));
        assertEquals(ErrorCategory.TIMEOUT, ErrorClassifier.classify(new TimeoutException()));
        assertEquals(ErrorCategory.DNS_ERROR, ErrorClassifier.classify(new UnknownHostException("nope")));
        assertEquals(ErrorCategory.CONNECTION_ERROR,
                ErrorClassifier.classify(new ConnectException("Connection refused")));
        assertEquals(ErrorCategory.TLS_ERROR,
                ErrorClassifier.classify(new SSLHandshakeException("bad cert")));
    }

    @Test
    void causeChainIsFollowed() {
        IOException wrapped = new IOException("io", new ConnectException("refused"));
        assertEquals(ErrorCategory.CONNECTION_ERROR, ErrorClassifier.classify(wrapped));
    }

    @Test
    void unknownFallsBackToError() {
        assertEquals(ErrorCategory.ERROR, ErrorClassifier.classify(new IllegalStateException("boom")));
    }

    @Test
    void statusOf() {
        assertEquals(HealthStatus.DEGRADED, ErrorClassifier.statusOf(new DegradedException("slow")));
        assertEquals(HealthStatus.UNHEALTHY, ErrorClassifier.statusOf(new RuntimeException()));
    }

    @Test
    void messageFallsBackToClassName() {
        assertEquals("boom", ErrorClassifier.messageOf(new RuntimeException("boom")));
        assertEquals("java.lang.NullPointerException", ErrorClassifier.messageOf(new NullPointerException()));
    }
}
