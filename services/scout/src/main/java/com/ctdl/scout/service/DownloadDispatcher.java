package com.ctdl.scout.service;

import com.ctdl.scout.config.ScoutProperties;
import com.ctdl.scout.service.download.AutoCloseableExecutor;
import com.ctdl.scout.service.download.DownloadJob;
import com.ctdl.scout.service.download.DownloadOutcome;
import com.ctdl.scout.service.download.DownloadProgress;
import com.ctdl.scout.service.download.FileDownloader;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * DownloadDispatcher saves the links of a {@link DownloadJob} into its directory,
 * one after another or through a bounded worker pool.
 * <p>
 * A failing link is logged and recorded; it never stops the other links.
 */
@Service
@RequiredArgsConstructor
public class DownloadDispatcher {

    private final FileDownloader fileDownloader;
    private final ScoutProperties properties;
    private final LoggerService logger;

    public DownloadProgress downloadSeries(DownloadJob job) {
        DownloadProgress progress = start(job);
        for (String url : job.links()) {
            progress.record(downloadOne(url, job));
        }
        return finish(job, progress);
    }

    /**
     * Runs one task per link on {@code scout.download.parallelism} workers and returns once all of them are done.
     */
    public DownloadProgress downloadParallel(DownloadJob job) {
        DownloadProgress progress = start(job);
        int workers = Math.max(1, Math.min(properties.getDownload().getParallelism(), Math.max(1, job.links().size())));
        logger.debug("DISPATCH", "Starting pool with " + workers + " workers for " + job.links().size() + " links");

        try (AutoCloseableExecutor pool = new AutoCloseableExecutor(
                Executors.newFixedThreadPool(workers), properties.getDownload().getShutdownTimeout())) {
            List<Future<?>> tasks = new ArrayList<>();
            for (String url : job.links()) {
                tasks.add(pool.executor().submit(() -> progress.record(downloadOne(url, job))));
            }
            for (Future<?> task : tasks) {
                awaitTask(task);
            }
        }
        return finish(job, progress);
    }

    private DownloadProgress start(DownloadJob job) {
        try {
            Files.createDirectories(job.directory());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create download directory " + job.directory(), e);
        }
        DownloadProgress progress = new DownloadProgress(job.directory().toString());
        progress.markStarted(job.links().size());
        logger.info("DOWNLOAD", "🚀 Downloading " + job.links().size() + " files into " + job.directory().toAbsolutePath());
        return progress;
    }

    private DownloadOutcome downloadOne(String url, DownloadJob job) {
        DownloadOutcome outcome;
        try {
            outcome = fileDownloader.download(url, job);
        } catch (Exception e) {
            logger.error("DOWNLOAD", "❌ Download failed for " + url, e);
            return DownloadOutcome.failed(url, e.getMessage());
        }

        switch (outcome.status()) {
            case SAVED -> logger.info("DOWNLOAD", "📦 Saved " + outcome.file().getFileName() + " (" + outcome.bytes() + " bytes)");
            case SKIPPED_SIZE, SKIPPED_REDIRECT -> logger.info("DOWNLOAD", "⏭️ Skipped " + url + ": " + outcome.message());
            case FAILED -> logger.warn("DOWNLOAD", "⚠️ Could not download " + url + ": " + outcome.message());
        }
        return outcome;
    }

    private void awaitTask(Future<?> task) {
        try {
            task.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("DISPATCH", "⚠️ Interrupted while waiting for downloads");
        } catch (ExecutionException e) {
            logger.error("DISPATCH", "❌ Download task crashed", e.getCause());
        }
    }

    private DownloadProgress finish(DownloadJob job, DownloadProgress progress) {
        progress.markCompleted();
        logger.info("DOWNLOAD", "🏁 Finished " + job.directory() + " | saved=" + progress.getSaved()
                + " | skipped=" + progress.getSkipped() + " | failed=" + progress.getFailed());
        return progress.copy();
    }
}
