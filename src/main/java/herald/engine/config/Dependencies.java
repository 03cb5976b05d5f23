package herald.engine.config;

import herald.engine.api.v1.HealthController;
import herald.engine.api.v1.TaskController;
import herald.engine.dispatch.Dispatcher;
import herald.engine.dispatch.PublisherRegistry;
import herald.engine.repository.TaskRepository;
import herald.engine.repository.TriggerRepository;
import herald.engine.scheduler.SchedulerEngine;
import herald.engine.server.HeraldHttpServer;
import herald.engine.server.RouterHandler;
import herald.engine.service.TaskService;
import herald.engine.store.Database;
import herald.engine.store.JdbcTaskRepository;
import herald.engine.store.JdbcTriggerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(HeraldConfig.fromEnv());
 * deps.startScheduler();
 * deps.httpServer().start();
 * // ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final HeraldConfig config;
    private final Database database;
    private final TaskRepository taskRepository;
    private final TriggerRepository triggerRepository;
    private final PublisherRegistry publishers;
    private final Dispatcher dispatcher;
    private final TaskService taskService;
    private final SchedulerEngine scheduler;

    private final HealthController healthController;
    private final TaskController taskController;

    // lazy
    private RouterHandler routerHandler;
    private HeraldHttpServer httpServer;

    private Dependencies(HeraldConfig config, PublisherRegistry publishers, Clock clock) {
        this.config = config.validate();

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.taskRepository = new JdbcTaskRepository(database, config.listPageSize(), clock);
        this.triggerRepository = new JdbcTriggerRepository(database);

        // Execution
        this.publishers = publishers;
        this.dispatcher = new Dispatcher(taskRepository, publishers, config.dispatchTimeout());
        this.scheduler = new SchedulerEngine(taskRepository, triggerRepository, dispatcher, config, clock);

        // Services
        this.taskService = new TaskService(taskRepository, triggerRepository, publishers, clock);

        // Controllers
        this.healthController = new HealthController(database, taskRepository, triggerRepository, scheduler);
        this.taskController = new TaskController(taskService);

        log.info("Dependencies initialized; platforms: {}", publishers.platforms());
    }

    /**
     * Create dependencies with the given config. Publishers come from the
     * platforms INI file.
     */
    public static Dependencies create(HeraldConfig config) {
        return create(config, PlatformIniLoader.load(config, new PublisherRegistry()), Clock.systemUTC());
    }

    /**
     * Create dependencies with an explicit publisher registry and clock.
     */
    public static Dependencies create(HeraldConfig config, PublisherRegistry publishers, Clock clock) {
        return new Dependencies(config, publishers, clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(HeraldConfig.fromEnv());
    }

    // Getters
    public HeraldConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public TriggerRepository triggerRepository() {
        return triggerRepository;
    }

    public PublisherRegistry publishers() {
        return publishers;
    }

    public Dispatcher dispatcher() {
        return dispatcher;
    }

    public TaskService taskService() {
        return taskService;
    }

    public SchedulerEngine scheduler() {
        return scheduler;
    }

    /**
     * RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(taskController);
        }
        return routerHandler;
    }

    public synchronized HeraldHttpServer httpServer() {
        if (httpServer == null) {
            httpServer = new HeraldHttpServer(config.serverHost(), config.serverPort(), routerHandler());
        }
        return httpServer;
    }

    /**
     * Start polling triggers and reaping stuck tasks.
     */
    public void startScheduler() {
        scheduler.start();
    }

    public void stopScheduler() {
        scheduler.stop();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (httpServer != null) {
            try {
                httpServer.stop();
            } catch (Exception e) {
                log.warn("Error stopping HTTP server: {}", e.getMessage());
            }
        }

        // scheduler before dispatcher: in-flight dispatches still need the publish pool
        try {
            scheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        dispatcher.close();

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
