package com.ctdl.scout.cli;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Feeds the process arguments to {@link ScoutCommand} and keeps its exit code for {@code SpringApplication.exit}.
 */
@Component
@RequiredArgsConstructor
public class ScoutRunner implements CommandLineRunner, ExitCodeGenerator {

    private final ScoutCommand scoutCommand;
    private int exitCode;

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(scoutCommand).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
