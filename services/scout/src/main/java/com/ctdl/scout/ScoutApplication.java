package com.ctdl.scout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * 🔭 Scout Application Entry Point
 *
 * Boots the Spring context and hands the command line over to {@link com.ctdl.scout.cli.ScoutRunner}.
 * The exit code of the run becomes the process exit code.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ScoutApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ScoutApplication.class, args)));
    }
}
