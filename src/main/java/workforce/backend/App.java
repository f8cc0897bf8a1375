package workforce.backend;

import workforce.backend.config.BackendConfig;
import workforce.backend.config.Dependencies;
import workforce.backend.server.BackendNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Application entry point.
 *
 * Starts the HTTP server first, then the queue workers, so that jobs
 * produced before a restart are drained as soon as the process is up.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        BackendConfig config = BackendConfig.load();
        Dependencies deps = Dependencies.create(config);
        BackendNettyServer server = new BackendNettyServer(deps.routerHandler());
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Application closing, stopping server...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "workforce-shutdown"));

        try {
            server.start(config.serverHost(), config.serverPort());
            deps.startScheduler();
            deps.ledgerService().registerOnStartup();
        } catch (RuntimeException e) {
            log.error("Startup failed", e);
            server.stop();
            deps.close();
            System.exit(1);
        }

        stopped.await();
    }
}
