package herald.engine;

import herald.engine.config.Dependencies;
import herald.engine.config.HeraldConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Standalone entry point: scheduler plus HTTP API, configured from the environment.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        Dependencies deps = Dependencies.create(HeraldConfig.fromEnv());
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            deps.close();
            stopped.countDown();
        }, "herald-shutdown"));

        deps.startScheduler();
        deps.httpServer().start();
        log.info("Herald engine started");

        stopped.await();
    }
}
