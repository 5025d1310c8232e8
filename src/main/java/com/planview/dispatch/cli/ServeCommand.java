package com.planview.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: pv serve
 * <p>
 * Starts the JSON HTTP API over the plan file. The web server is enabled by
 * {@link com.planview.PlanViewApplication#main} detecting "serve" in args,
 * and {@link CliRunner} skips picocli in that mode, so {@link #run()} only
 * matters for {@code --help}. The startup banner is printed once Tomcat is ready.
 * <p>
 * Configure via: {@code SERVER_PORT=9090 pv serve} or {@code --planview.file=other.json}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the plan-view HTTP API")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.info("plan-view API running on port " + port);
        System.out.println();
        System.out.println("  Plan:      http://localhost:" + port + "/api/plan");
        System.out.println("  Next task: http://localhost:" + port + "/api/next");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
