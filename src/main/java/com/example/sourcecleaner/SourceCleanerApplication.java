package com.example.sourcecleaner;

import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Arrays;

@SpringBootApplication
public class SourceCleanerApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(SourceCleanerApplication.class);
        if (isCommandLineRun(args)) {
            application.setWebApplicationType(WebApplicationType.NONE);
            application.setBannerMode(Banner.Mode.OFF);
            System.exit(SpringApplication.exit(application.run(args)));
        }
        application.run(args);
    }

    /** File arguments or {@code --version} select the one-shot command-line mode. */
    static boolean isCommandLineRun(String[] args) {
        return Arrays.stream(args).anyMatch(arg -> !arg.startsWith("--") || arg.equals("--version"));
    }
}
