package com.ctdl.scout.service.download;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLConnection;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;

/**
 * Transfers a single link into the job directory.
 * <p>
 * The body is streamed into a hidden {@code .<name>.part} file next to its final name and moved
 * into place only once it is complete and within the size bounds. A skipped or failed transfer
 * never leaves a file under the final name.
 */
@Slf4j
public class FileDownloader {

    static final int MAX_REDIRECTS = 10;
    private static final int BUFFER_SIZE = 8192;

    private final Duration timeout;
    private final String userAgent;
    private final FileNameResolver fileNameResolver;

    public FileDownloader(Duration timeout, String userAgent, FileNameResolver fileNameResolver) {
        this.timeout = timeout;
        this.userAgent = userAgent;
        this.fileNameResolver = fileNameResolver;
    }

    /**
     * @throws IOException on network or disk errors; the caller decides how to record them
     */
    public DownloadOutcome download(String url, DownloadJob job) throws IOException {
        HttpURLConnection connection = open(url);
        try {
            int redirects = 0;
            int code = connection.getResponseCode();
            while (isRedirect(code)) {
                String location = connection.getHeaderField("Location");
                if (job.noRedirects()) {
                    log.debug("Redirect suppressed for {} -> {}", url, location);
                    return DownloadOutcome.skippedRedirect(url, location);
                }
                if (location == null || ++redirects > MAX_REDIRECTS) {
                    return DownloadOutcome.failed(url, "Unresolvable redirect after " + redirects + " hops");
                }
                URL next = new URL(connection.getURL(), location);
                connection.disconnect();
                connection = open(next.toString());
                code = connection.getResponseCode();
            }

            if (code < 200 || code >= 300) {
                return DownloadOutcome.failed(url, "HTTP " + code);
            }

            long declared = connection.getContentLengthLong();
            if (declared >= 0 && !job.acceptsSize(declared)) {
                return DownloadOutcome.skippedSize(url, declared, "Declared size " + declared + " bytes is outside bounds");
            }

            return store(url, connection, job);
        } finally {
            connection.disconnect();
        }
    }

    private DownloadOutcome store(String url, HttpURLConnection connection, DownloadJob job) throws IOException {
        Path target = fileNameResolver.claim(job.directory(), url);
        Path part = target.resolveSibling("." + target.getFileName() + ".part");
        boolean moved = false;
        try {
            long written = 0;
            try (InputStream in = connection.getInputStream();
                 OutputStream out = Files.newOutputStream(part, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                byte[] buffer = new byte[BUFFER_SIZE];
                int read;
                while ((read = in.read(buffer)) != -1) {
                    written += read;
                    if (written > job.maxBytes()) {
                        return DownloadOutcome.skippedSize(url, written, "Body exceeds " + job.maxSizeKb() + " KB");
                    }
                    out.write(buffer, 0, read);
                }
            }

            if (!job.acceptsSize(written)) {
                return DownloadOutcome.skippedSize(url, written, "Body of " + written + " bytes is below " + job.minSizeKb() + " KB");
            }

            Files.move(part, target, StandardCopyOption.ATOMIC_MOVE);
            moved = true;
            return DownloadOutcome.saved(url, target, written);
        } finally {
            try {
                if (!moved) {
                    Files.deleteIfExists(part);
                }
            } finally {
                fileNameResolver.release(target);
            }
        }
    }

    private HttpURLConnection open(String url) throws IOException {
        URL target = new URL(url);
        if (target.getHost() == null || target.getHost().isEmpty()) {
            throw new IOException("No host in link: " + url);
        }
        URLConnection opened = target.openConnection();
        if (!(opened instanceof HttpURLConnection)) {
            throw new IOException("Not an http link: " + url);
        }
        HttpURLConnection connection = (HttpURLConnection) opened;
        connection.setInstanceFollowRedirects(false);
        connection.setConnectTimeout((int) timeout.toMillis());
        connection.setReadTimeout((int) timeout.toMillis());
        connection.setRequestProperty("User-Agent", userAgent);
        return connection;
    }

    private static boolean isRedirect(int code) {
        return code >= 300 && code < 400 && code != HttpURLConnection.HTTP_NOT_MODIFIED;
    }
}
