package caseflow;

import caseflow.coordinator.config.CoordinatorConfig;
import caseflow.coordinator.server.CoordinatorNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Entry point: starts the coordinator server and blocks until the JVM shuts down.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();
        int port = config.serverPort();

        log.info("Starting Coordinator server on port {}...", port);
        if (!CoordinatorNettyServer.start(port, config)) {
            log.error("Coordinator server did not start");
            System.exit(1);
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            CoordinatorNettyServer.stop();
            shutdown.countDown();
        }, "caseflow-shutdown"));
        shutdown.await();
    }
}
