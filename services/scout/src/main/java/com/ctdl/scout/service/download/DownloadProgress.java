package com.ctdl.scout.service.download;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thread-safe progress of one download job. Parallel workers record their outcomes here.
 */
public class DownloadProgress {

    private final String directory;
    private final long queuedAt;

    private int totalLinks;
    private int saved;
    private int skipped;
    private int failed;
    private String status;
    private Long startedAt;
    private Long completedAt;
    private final List<DownloadOutcome> outcomes;

    /**
     * Creates a new progress tracker for the given target directory, defaulting the status to {@code queued}.
     */
    public DownloadProgress(String directory) {
        this.directory = directory;
        this.status = "queued";
        this.queuedAt = System.currentTimeMillis();
        this.outcomes = new ArrayList<>();
    }

    private DownloadProgress(DownloadProgress source) {
        this.directory = source.directory;
        this.queuedAt = source.queuedAt;
        this.totalLinks = source.totalLinks;
        this.saved = source.saved;
        this.skipped = source.skipped;
        this.failed = source.failed;
        this.status = source.status;
        this.startedAt = source.startedAt;
        this.completedAt = source.completedAt;
        this.outcomes = new ArrayList<>(source.outcomes);
    }

    public synchronized void markStarted(int totalLinks) {
        this.totalLinks = totalLinks;
        this.startedAt = System.currentTimeMillis();
        this.status = "downloading";
    }

    public synchronized void record(DownloadOutcome outcome) {
        outcomes.add(outcome);
        switch (outcome.status()) {
            case SAVED -> saved++;
            case SKIPPED_SIZE, SKIPPED_REDIRECT -> skipped++;
            case FAILED -> failed++;
        }
    }

    public synchronized void markCompleted() {
        this.status = "completed";
        this.completedAt = System.currentTimeMillis();
    }

    public synchronized DownloadProgress copy() {
        return new DownloadProgress(this);
    }

    public String getDirectory() {
        return directory;
    }

    public long getQueuedAt() {
        return queuedAt;
    }

    public synchronized int getTotalLinks() {
        return totalLinks;
    }

    public synchronized int getCompletedLinks() {
        return saved + skipped + failed;
    }

    public synchronized int getSaved() {
        return saved;
    }

    public synchronized int getSkipped() {
        return skipped;
    }

    public synchronized int getFailed() {
        return failed;
    }

    public synchronized String getStatus() {
        return status;
    }

    public synchronized Long getStartedAt() {
        return startedAt;
    }

    public synchronized Long getCompletedAt() {
        return completedAt;
    }

    /**
     * Outcomes in completion order.
     */
    public synchronized List<DownloadOutcome> getOutcomes() {
        return Collections.unmodifiableList(new ArrayList<>(outcomes));
    }
}
