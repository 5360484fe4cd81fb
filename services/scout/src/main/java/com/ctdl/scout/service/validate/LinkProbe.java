package com.ctdl.scout.service.validate;

import lombok.extern.slf4j.Slf4j;

import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLConnection;
import java.time.Duration;

/**
 * Liveness check for a single link, independent of the search client and its retry policy.
 * <p>
 * Any HTTP answer yields its status code, error statuses included. Every other outcome
 * (unknown host, refused connection, timeout, malformed or non-http URL) yields {@link ValidatedLink#UNREACHABLE}.
 */
@Slf4j
public class LinkProbe {

    private final Duration timeout;
    private final String userAgent;

    public LinkProbe(Duration timeout, String userAgent) {
        this.timeout = timeout;
        this.userAgent = userAgent;
    }

    public int probe(String url) {
        HttpURLConnection connection = null;
        try {
            URL target = new URL(url);
            if (target.getHost() == null || target.getHost().isEmpty()) {
                log.debug("No host in link: {}", url);
                return ValidatedLink.UNREACHABLE;
            }
            URLConnection opened = target.openConnection();
            if (!(opened instanceof HttpURLConnection)) {
                log.debug("Not an http link: {}", url);
                return ValidatedLink.UNREACHABLE;
            }
            connection = (HttpURLConnection) opened;
            connection.setRequestMethod("GET");
            connection.setConnectTimeout((int) timeout.toMillis());
            connection.setReadTimeout((int) timeout.toMillis());
            connection.setRequestProperty("User-Agent", userAgent);

            int code = connection.getResponseCode();
            return code < 0 ? ValidatedLink.UNREACHABLE : code;
        } catch (Exception e) {
            log.debug("Probe failed for {}: {}", url, e.toString());
            return ValidatedLink.UNREACHABLE;
        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }
}
