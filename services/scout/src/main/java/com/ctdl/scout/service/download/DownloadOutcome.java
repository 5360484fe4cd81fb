package com.ctdl.scout.service.download;

import java.nio.file.Path;

/**
 * What happened to one link.
 */
public record DownloadOutcome(String url, Status status, Path file, long bytes, String message) {

    public enum Status {
        SAVED,
        SKIPPED_SIZE,
        SKIPPED_REDIRECT,
        FAILED
    }

    public static DownloadOutcome saved(String url, Path file, long bytes) {
        return new DownloadOutcome(url, Status.SAVED, file, bytes, null);
    }

    public static DownloadOutcome skippedSize(String url, long bytes, String message) {
        return new DownloadOutcome(url, Status.SKIPPED_SIZE, null, bytes, message);
    }

    public static DownloadOutcome skippedRedirect(String url, String location) {
        return new DownloadOutcome(url, Status.SKIPPED_REDIRECT, null, 0, "Redirects to " + location);
    }

    public static DownloadOutcome failed(String url, String message) {
        return new DownloadOutcome(url, Status.FAILED, null, 0, message);
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED_SIZE || status == Status.SKIPPED_REDIRECT;
    }
}
