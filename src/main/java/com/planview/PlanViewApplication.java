package com.planview;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

@SpringBootApplication
public class PlanViewApplication {

    public static void main(String[] args) {
        boolean serveMode = Arrays.asList(args).contains("serve");

        SpringApplicationBuilder builder = new SpringApplicationBuilder(PlanViewApplication.class);

        if (serveMode) {
            // Enable web server for the JSON API
            List<String> properties = new ArrayList<>(List.of(
                    "spring.main.web-application-type=servlet",
                    "spring.main.banner-mode=off"
            ));
            // picocli does not run in serve mode, so hand -f/--file to the API as configuration
            planFileArgument(args).ifPresent(file -> properties.add("planview.file=" + file));
            builder.properties(properties.toArray(String[]::new));
        } else {
            // CLI-only: no web server
            builder.properties(
                    "spring.main.web-application-type=none",
                    "spring.main.banner-mode=off"
            );
        }

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            // CLI app: exit after command execution
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            int exitCode = SpringApplication.exit(ctx, exitCodeGen);
            System.exit(exitCode);
        }
        // In serve mode, the embedded web server keeps the JVM alive
    }

    static Optional<String> planFileArgument(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (("-f".equals(arg) || "--file".equals(arg)) && i + 1 < args.length) {
                return Optional.of(args[i + 1]);
            }
            if (arg.startsWith("--file=")) {
                return Optional.of(arg.substring("--file=".length()));
            }
        }
        return Optional.empty();
    }
}
