package biz.kryukov.dev.healthwatch.uptime.probe;

import biz.kryukov.dev.healthwatch.ErrorCategory;
import biz.kryukov.dev.healthwatch.ErrorClassifier;
import biz.kryukov.dev.healthwatch.uptime.ProbeConfig;
import biz.kryukov.dev.healthwatch.uptime.ProbeKind;
import biz.kryukov.dev.healthwatch.uptime.ProbeResult;
import biz.kryukov.dev.healthwatch.uptime.SslPolicy;

import javax.net.ssl.SSLPeerUnverifiedException;
import javax.net.ssl.SSLSession;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes a single probe and classifies the outcome. Never throws.
 *
 * <p>HTTP and SSL probes are up when the status is one of the expected codes and,
 * if a body substring is configured, the body contains it. SSL probes additionally
 * fail when the server certificate expires within the policy's warning window.
 * TCP probes connect a socket, DNS probes resolve the host and Ping probes use
 * {@link InetAddress#isReachable}; their URLs carry the target as
 * {@code tcp://host:port}, {@code dns://host} or {@code ping://host}.</p>
 *
 * <p>DNS and Ping probes run on a small daemon pool owned by the executor, so a hanging
 * resolver costs at most one pool thread per lookup and never delays the probe past its
 * timeout. Lookups beyond {@link #MAX_QUEUED_LOOKUPS} waiting are rejected as failures.</p>
 */
public final class ProbeExecutor implements AutoCloseable {

    static final String USER_AGENT = "healthwatch-uptime/0.1.0";
    static final int DEFAULT_LOOKUP_THREADS = 4;
    static final int MAX_QUEUED_LOOKUPS = 64;

    /** Name resolution seam. */
    @FunctionalInterface
    interface HostResolver {
        InetAddress[] resolve(String host) throws UnknownHostException;
    }

    private final HttpClient client;
    private final HostResolver resolver;
    private final ThreadPoolExecutor lookupPool;

    public ProbeExecutor() {
        this(defaultClient());
    }

    public ProbeExecutor(HttpClient client) {
        this(client, InetAddress::getAllByName, DEFAULT_LOOKUP_THREADS);
    }

    ProbeExecutor(HttpClient client, HostResolver resolver, int lookupThreads) {
        this.client = client;
        this.resolver = resolver;
        this.lookupPool = new ThreadPoolExecutor(lookupThreads, lookupThreads,
                30, TimeUnit.SECONDS, new LinkedBlockingQueue<>(MAX_QUEUED_LOOKUPS),
                daemonFactory("healthwatch-probe-lookup"));
        this.lookupPool.allowCoreThreadTimeOut(true);
    }

    private static HttpClient defaultClient() {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(ProbeConfig.MAX_TIMEOUT)
                .build();
    }

    /** Stops the lookup pool, interrupting abandoned lookups. */
    @Override
    public void close() {
        lookupPool.shutdownNow();
    }

    /** Runs the probe once. */
    public ProbeResult execute(ProbeConfig probe) {
        long startNs = System.nanoTime();
        try {
            return switch (probe.kind()) {
                case HTTP, SSL -> executeHttp(probe, startNs);
                case TCP -> executeTcp(probe, startNs);
                case DNS -> executeDns(probe, startNs);
                case PING -> executePing(probe, startNs);
            };
        } catch (TimeoutException e) {
            return timedOut(probe);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return down(probe, 0, elapsed(startNs), probe.name() + " interrupted",
                    ErrorCategory.ERROR, e);
        } catch (Exception e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            return down(probe, 0, elapsed(startNs), ErrorClassifier.messageOf(cause),
                    ErrorClassifier.classify(cause), cause);
        }
    }

    private ProbeResult executeHttp(ProbeConfig probe, long startNs) throws Exception {
        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .uri(probe.uri())
                .header("User-Agent", USER_AGENT)
                .GET();
        for (Map.Entry<String, String> header : probe.headers().entrySet()) {
            requestBuilder.header(header.getKey(), header.getValue());
        }

        CompletableFuture<HttpResponse<String>> future =
                client.sendAsync(requestBuilder.build(), HttpResponse.BodyHandlers.ofString());
        HttpResponse<String> response;
        try {
            response = future.get(probe.timeout().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof HttpTimeoutException) {
                return timedOut(probe);
            }
            throw e;
        }
        Duration latency = elapsed(startNs);

        int status = response.statusCode();
        if (!probe.expectedStatusCodes().contains(status)) {
            return down(probe, status, latency, "unexpected HTTP status " + status,
                    ErrorCategory.UNHEALTHY, null);
        }
        String expected = probe.expectedBodySubstring();
        if (expected != null && (response.body() == null || !response.body().contains(expected))) {
            return down(probe, status, latency, "response body does not contain '" + expected + "'",
                    ErrorCategory.UNHEALTHY, null);
        }
        if (probe.kind() == ProbeKind.SSL) {
            String certProblem = certificateProblem(probe, response.sslSession());
            if (certProblem != null) {
                return down(probe, status, latency, certProblem, ErrorCategory.TLS_ERROR, null);
            }
        }
        return up(probe, status, latency, "HTTP " + status);
    }

    private ProbeResult executeTcp(ProbeConfig probe, long startNs) throws Exception {
        URI uri = probe.uri();
        int port = portOf(uri);
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(hostOf(uri), port), (int) probe.timeout().toMillis());
        }
        return up(probe, 0, elapsed(startNs), "connected to port " + port);
    }

    private ProbeResult executeDns(ProbeConfig probe, long startNs) throws Exception {
        String host = hostOf(probe.uri());
        InetAddress[] addresses = withinDeadline(probe, () -> resolver.resolve(host));
        return up(probe, 0, elapsed(startNs), host + " resolved to " + addresses.length + " address(es)");
    }

    private ProbeResult executePing(ProbeConfig probe, long startNs) throws Exception {
        String host = hostOf(probe.uri());
        int timeoutMs = (int) probe.timeout().toMillis();
        boolean reachable = withinDeadline(probe,
                () -> resolver.resolve(host)[0].isReachable(timeoutMs));
        if (!reachable) {
            return down(probe, 0, elapsed(startNs), host + " is not reachable",
                    ErrorCategory.CONNECTION_ERROR, null);
        }
        return up(probe, 0, elapsed(startNs), host + " is reachable");
    }

    private <T> T withinDeadline(ProbeConfig probe, Callable<T> task) throws Exception {
        Future<T> future = lookupPool.submit(task);
        try {
            return future.get(probe.timeout().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        }
    }

    /** Returns a description of the certificate problem, or {@code null} if the certificate is fine. */
    static String certificateProblem(ProbeConfig probe, Optional<SSLSession> session) {
        SslPolicy policy = probe.sslPolicy();
        if (policy == null || !policy.checkCertificate()) {
            return null;
        }
        if (session.isEmpty()) {
            return "no TLS session, " + probe.url() + " is not served over https";
        }
        try {
            Certificate[] chain = session.get().getPeerCertificates();
            if (chain.length == 0 || !(chain[0] instanceof X509Certificate leaf)) {
                return "server presented no X.509 certificate";
            }
            return expiryProblem(leaf.getNotAfter().toInstant(), Instant.now(),
                    policy.warnDaysBeforeExpiry());
        } catch (SSLPeerUnverifiedException e) {
            return "peer not verified: " + e.getMessage();
        }
    }

    static String expiryProblem(Instant notAfter, Instant now, int warnDays) {
        long daysLeft = Duration.between(now, notAfter).toDays();
        if (!notAfter.isAfter(now)) {
            return "certificate expired on " + notAfter;
        }
        if (daysLeft < warnDays) {
            return "certificate expires in " + daysLeft + " days";
        }
        return null;
    }

    private static String hostOf(URI uri) {
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("no host in " + uri);
        }
        return uri.getHost();
    }

    private static int portOf(URI uri) {
        if (uri.getPort() > 0) {
            return uri.getPort();
        }
        if ("https".equalsIgnoreCase(uri.getScheme())) {
            return 443;
        }
        if ("http".equalsIgnoreCase(uri.getScheme())) {
            return 80;
        }
        throw new IllegalArgumentException("no port in " + uri);
    }

    private static ProbeResult timedOut(ProbeConfig probe) {
        return down(probe, 0, probe.timeout(),
                probe.name() + " timed out after " + probe.timeout().toMillis() + "ms",
                ErrorCategory.TIMEOUT, null);
    }

    private static ProbeResult up(ProbeConfig probe, int status, Duration latency, String message) {
        return new ProbeResult(probe.name(), probe.kind(), true, status, latency, message,
                null, null, Instant.now());
    }

    private static ProbeResult down(ProbeConfig probe, int status, Duration latency, String message,
                                    String category, Throwable error) {
        return new ProbeResult(probe.name(), probe.kind(), false, status, latency, message,
                category, error, Instant.now());
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static Duration elapsed(long startNs) {
        return Duration.ofNanos(System.nanoTime() - startNs);
    }
}
