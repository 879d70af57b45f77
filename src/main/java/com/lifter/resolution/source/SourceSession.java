package com.lifter.resolution.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Serializes calls to an external source: at most one call is in flight per session,
 * and each call is bounded by a timeout.
 *
 * <p>A call that exceeds the timeout is cancelled and surfaces as
 * {@link SourceUnavailableException}, which verifiers report as INCONCLUSIVE.</p>
 *
 * <pre>
 * try (SourceSession session = new SourceSession("rankings", Duration.ofSeconds(30))) {
 *     DivisionRankingSource source = HttpDivisionRankingSource.builder()
 *         .baseUrl("https://rankings.example.org")
 *         .session(session)
 *         .build();
 * }
 * </pre>
 */
public class SourceSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SourceSession.class);

    private final String name;
    private final Duration callTimeout;
    private final ExecutorService executor;

    public SourceSession(String name, Duration callTimeout) {
        if (callTimeout == null || callTimeout.isNegative() || callTimeout.isZero()) {
            throw new IllegalArgumentException("callTimeout must be positive");
        }
        this.name = name;
        this.callTimeout = callTimeout;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "source-session-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Runs a call on the session thread and waits for it, up to the call timeout.
     *
     * @param operation label used in logs and error messages
     * @throws SourceUnavailableException on timeout, interruption or failure of the call
     */
    public <T> T call(String operation, Callable<T> call) {
        Future<T> future;
        try {
            future = executor.submit(call);
        } catch (RuntimeException e) {
            throw new SourceUnavailableException("Session " + name + " is closed", e);
        }
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("source.timeout session={} operation={} timeoutMs={}", name, operation, callTimeout.toMillis());
            throw new SourceUnavailableException(operation + " timed out after " + callTimeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException(operation + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SourceUnavailableException sue) {
                throw sue;
            }
            throw new SourceUnavailableException(operation + " failed: " + cause.getMessage(), cause);
        }
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        log.debug("source.sessionClosed session={}", name);
    }
}
