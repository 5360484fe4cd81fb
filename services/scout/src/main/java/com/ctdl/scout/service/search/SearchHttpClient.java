package com.ctdl.scout.service.search;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;

/**
 * Shared HTTP session used for search requests.
 * <p>
 * Wraps a jsoup session (cookies persist between pages) and applies the {@link RetryPolicy}
 * to plain {@code http://} endpoints. One instance lives for the whole run and is closed
 * when the application context shuts down.
 */
@Slf4j
public class SearchHttpClient implements AutoCloseable {

    private final Connection session;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private volatile boolean closed;

    public SearchHttpClient(RetryPolicy retryPolicy, Duration timeout) {
        this(retryPolicy, timeout, Sleeper.THREAD);
    }

    public SearchHttpClient(RetryPolicy retryPolicy, Duration timeout, Sleeper sleeper) {
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.session = Jsoup.newSession()
                .timeout((int) timeout.toMillis())
                .ignoreHttpErrors(true)
                .ignoreContentType(true)
                .followRedirects(true);
    }

    /**
     * Issues a GET request. Non-retryable statuses are returned as they are.
     *
     * @throws SearchRequestException on an https failure, or once a retried http call runs out of attempts
     */
    public SearchResponse get(String url, Map<String, String> params, Map<String, String> headers) {
        if (closed) {
            throw new IllegalStateException("Search client has been closed");
        }

        boolean retrying = retryPolicy.appliesTo(url);
        int attempt = 1;
        while (true) {
            try {
                Connection.Response response = execute(url, params, headers);
                int status = response.statusCode();
                if (!retrying || !retryPolicy.isRetryableStatus(status)) {
                    return new SearchResponse(status, response.body());
                }
                if (attempt >= retryPolicy.getMaxAttempts()) {
                    throw new SearchRequestException("Search request to " + url + " failed with status " + status
                            + " after " + attempt + " attempts");
                }
                log.warn("⚠️ Status {} from {}, retrying ({}/{})", status, url, attempt, retryPolicy.getMaxAttempts());
            } catch (IOException e) {
                if (!retrying) {
                    throw new SearchRequestException("Search request to " + url + " failed: " + e.getMessage(), e);
                }
                if (attempt >= retryPolicy.getMaxAttempts()) {
                    throw new SearchRequestException("Search request to " + url + " failed after "
                            + attempt + " attempts: " + e.getMessage(), e);
                }
                log.warn("⚠️ {} for {}, retrying ({}/{})", e.getClass().getSimpleName(), url, attempt, retryPolicy.getMaxAttempts());
            }
            pause(retryPolicy.backoffAfter(attempt));
            attempt++;
        }
    }

    /**
     * Runs one attempt and reads the whole body, so a stall or reset mid-body counts against that attempt.
     */
    private Connection.Response execute(String url, Map<String, String> params, Map<String, String> headers) throws IOException {
        Connection.Response response = session.newRequest()
                .url(url)
                .data(params)
                .headers(headers)
                .method(Connection.Method.GET)
                .execute();
        try {
            return response.bufferUp();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private void pause(Duration backoff) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchRequestException("Interrupted while backing off", e);
        }
    }

    @Override
    public void close() {
        closed = true;
        log.debug("Search client closed");
    }

    @FunctionalInterface
    public interface Sleeper {
        Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }
}
