package com.ctdl.scout.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(OutputCaptureExtension.class)
class LoggerServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void fallsBackToWorkingDirectoryWhenAccessDenied(CapturedOutput output) {
        Path fallback = tempDir.resolve("fallback");

        LoggerService service = new LoggerService() {
            private int attempts = 0;

            @Override
            protected Path resolveAppDataLogsPath() {
                return Path.of("/denied/appdata");
            }

            @Override
            protected Path resolveUserHomeLogsPath() {
                return Path.of("/denied/userhome");
            }

            @Override
            protected Path resolveWorkingDirectoryLogsPath() {
                return fallback;
            }

            @Override
            protected Path createDirectories(Path path) throws IOException {
                attempts++;
                if (attempts <= 2) {
                    throw new AccessDeniedException(path.toString());
                }
                return Files.createDirectories(path);
            }
        };

        service.afterPropertiesSet();
        service.destroy();

        assertThat(service.getLogsPath()).isEqualTo(fallback);
        assertThat(output).contains("Failed to create APPDATA logs directory");
    }

    @Test
    void writesTaggedLinesAndKeepsDebugOffTheConsole(CapturedOutput output) throws IOException {
        LoggerService service = serviceLoggingTo(tempDir);
        service.afterPropertiesSet();

        service.info("SEARCH", "found 3 links");
        service.debug("VALIDATOR", "probe details");
        service.destroy();

        String logFile = Files.readString(tempDir.resolve("latest.log"));
        assertThat(logFile).contains("[INFO] [SEARCH] found 3 links", "[DEBUG] [VALIDATOR] probe details");
        assertThat(output.getOut()).contains("[INFO] [SEARCH] found 3 links").doesNotContain("probe details");
    }

    @Test
    void rotatesPreviousRun() throws IOException {
        Files.writeString(tempDir.resolve("latest.log"), "previous run\n");

        LoggerService service = serviceLoggingTo(tempDir);
        service.afterPropertiesSet();
        service.destroy();

        try (var files = Files.list(tempDir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .contains("latest.log")
                    .anySatisfy(name -> assertThat(name).matches("\\d{4}-\\d{2}-\\d{2}_\\d{2}-\\d{2}-\\d{2}\\.log"));
        }
        assertThat(Files.readString(tempDir.resolve("latest.log"))).doesNotContain("previous run");
    }

    private static LoggerService serviceLoggingTo(Path logs) {
        return new LoggerService() {
            @Override
            protected Path resolveAppDataLogsPath() {
                return logs;
            }
        };
    }
}
