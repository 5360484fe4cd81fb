package com.ctdl.scout.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Service;

import java.io.*;
import java.nio.file.*;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Tagged run log for Scout.
 * <p>
 * Every line goes to {@code latest.log} inside the first writable logs directory
 * ({@code $APPDATA/Scout/logs}, {@code ~/.scout/logs}, {@code ./.scout/logs}).
 * INFO, WARN and ERROR lines are echoed to the console, DEBUG lines are file only.
 * Previous runs are archived with a timestamp and only the newest {@value #MAX_LOGS} are kept.
 */
@Slf4j
@Service
public class LoggerService implements InitializingBean, DisposableBean {

    private static final String LATEST_LOG = "latest.log";
    private static final int MAX_LOGS = 5;
    private static final DateTimeFormatter FILE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");
    private static final DateTimeFormatter LOG_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private Path logsPath;
    private BufferedWriter writer;

    @Override
    public void afterPropertiesSet() {
        logsPath = initializeLogsRoot();

        if (logsPath == null) {
            log.warn("⚠️ LoggerService initialized without a writable logs directory. Console output only.");
            return;
        }

        try {
            rotateLogs();
        } catch (IOException e) {
            log.warn("⚠️ Failed to rotate logs at {}. Continuing without rotating existing logs.", logsPath.toAbsolutePath(), e);
        }

        Path latestLogPath = logsPath.resolve(LATEST_LOG);
        try {
            writer = Files.newBufferedWriter(latestLogPath, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            logSystemEnvironment();
            log.debug("📝 LoggerService initialized. Logging to {}", latestLogPath.toAbsolutePath());
        } catch (IOException e) {
            log.warn("⚠️ Failed to open log writer at {}. LoggerService will operate in console-only mode.", latestLogPath.toAbsolutePath(), e);
            writer = null;
        }
    }

    @Override
    public synchronized void destroy() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("⚠️ Failed to close log writer", e);
        } finally {
            writer = null;
        }
    }

    private Path initializeLogsRoot() {
        Path resolved = tryInitialize(resolveAppDataLogsPath(),
                "⚠️ Failed to create APPDATA logs directory at {}. Falling back to user home.");
        if (resolved != null) {
            return resolved;
        }

        resolved = tryInitialize(resolveUserHomeLogsPath(),
                "⚠️ Failed to create user home logs directory at {}. Falling back to working directory.");
        if (resolved != null) {
            return resolved;
        }

        return tryInitialize(resolveWorkingDirectoryLogsPath(),
                "⚠️ Failed to create logs directory at {}. LoggerService will operate in console-only mode.");
    }

    private Path tryInitialize(Path path, String failureMessage) {
        if (path == null) {
            return null;
        }

        try {
            Path created = createDirectories(path);
            log.debug("📁 Using logs directory at {}", created.toAbsolutePath());
            return created;
        } catch (IOException e) {
            log.warn(failureMessage, path.toAbsolutePath(), e);
            return null;
        }
    }

    protected Path createDirectories(Path path) throws IOException {
        return Files.createDirectories(path);
    }

    protected Path resolveAppDataLogsPath() {
        String appData = System.getenv("APPDATA");
        if (appData != null && !appData.isBlank()) {
            return Path.of(appData, "Scout", "logs");
        }
        return null;
    }

    protected Path resolveUserHomeLogsPath() {
        String userHome = System.getProperty("user.home");
        if (userHome != null && !userHome.isBlank()) {
            return Path.of(userHome, ".scout", "logs");
        }
        return null;
    }

    protected Path resolveWorkingDirectoryLogsPath() {
        return Path.of(".scout", "logs");
    }

    private void rotateLogs() throws IOException {
        Path latestLog = logsPath.resolve(LATEST_LOG);
        if (Files.exists(latestLog) && Files.size(latestLog) > 0) {
            String timestamp = LocalDateTime.now().format(FILE_FORMATTER);
            Path archivedLog = logsPath.resolve(timestamp + ".log");
            Files.move(latestLog, archivedLog, StandardCopyOption.REPLACE_EXISTING);
            log.debug("🔄 Rotated log to {}", archivedLog.getFileName());
        }

        try (Stream<Path> files = Files.list(logsPath)
                .filter(p -> p.getFileName().toString().endsWith(".log"))
                .filter(p -> !p.getFileName().toString().equals(LATEST_LOG))
                .sorted(Comparator.comparingLong(this::getFileModifiedTime).reversed())) {

            files.skip(MAX_LOGS)
                    .forEach(p -> {
                        try {
                            Files.delete(p);
                            log.debug("🗑️ Deleted old log file: {}", p.getFileName());
                        } catch (IOException e) {
                            log.warn("⚠️ Failed to delete old log file: {}", p.getFileName(), e);
                        }
                    });
        }
    }

    private long getFileModifiedTime(Path path) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            return 0L;
        }
    }

    private synchronized void write(String level, String tag, String message, boolean console) {
        String logLine = String.format("%s [%s] [%s] %s%n", LocalDateTime.now().format(LOG_FORMATTER), level, tag, message);
        if (writer != null) {
            try {
                writer.write(logLine);
                writer.flush();
            } catch (IOException e) {
                log.error("❌ Failed to write to log file", e);
                writer = null;
            }
        }
        if (console) {
            System.out.print(logLine);
        }
    }

    public void info(String tag, String message) {
        write("INFO", tag, message, true);
    }

    public void warn(String tag, String message) {
        write("WARN", tag, message, true);
    }

    public void error(String tag, String message, Throwable throwable) {
        write("ERROR", tag, message + " | Exception: " + throwable.getMessage(), true);
    }

    public void debug(String tag, String message) {
        write("DEBUG", tag, message, false);
    }

    public Path getLogsPath() {
        return logsPath;
    }

    private void logSystemEnvironment() {
        write("SYSTEM", "USER", System.getProperty("user.name"), false);
        write("SYSTEM", "OS", System.getProperty("os.name") + " " + System.getProperty("os.version"), false);
        write("SYSTEM", "JAVA", System.getProperty("java.version"), false);
    }
}
