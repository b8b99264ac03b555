package taskchain.engine.config;

import taskchain.engine.aggregator.WorkflowAggregator;
import taskchain.engine.api.v1.HealthController;
import taskchain.engine.api.v1.WorkflowController;
import taskchain.engine.executor.TaskExecutor;
import taskchain.engine.job.JobRegistry;
import taskchain.engine.repository.ResultRepository;
import taskchain.engine.repository.TaskRepository;
import taskchain.engine.repository.WorkflowRepository;
import taskchain.engine.resolver.DependencyResolver;
import taskchain.engine.scheduler.TaskScheduler;
import taskchain.engine.server.RouterHandler;
import taskchain.engine.service.WorkflowService;
import taskchain.engine.store.Database;
import taskchain.engine.store.JdbcResultRepository;
import taskchain.engine.store.JdbcTaskRepository;
import taskchain.engine.store.JdbcWorkflowRepository;
import taskchain.jobs.EchoJob;
import taskchain.jobs.PolygonAreaJob;
import taskchain.jobs.ReportGenerationJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all engine components.
 * 
 * Usage:
 * 
 * <pre>
 * Dependencies deps = Dependencies.create(EngineConfig.fromEnv());
 * deps.startScheduler(); // start worker threads
 * deps.workflowService().createWorkflow(definition, clientId, payload);
 * // ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final Database database;
    private final TaskRepository taskRepository;
    private final WorkflowRepository workflowRepository;
    private final ResultRepository resultRepository;
    private final JobRegistry jobRegistry;
    private final DependencyResolver dependencyResolver;
    private final WorkflowAggregator workflowAggregator;
    private final TaskExecutor taskExecutor;
    private final WorkflowService workflowService;
    private final TaskScheduler scheduler;

    // Controllers
    private final HealthController healthController;
    private final WorkflowController workflowController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(EngineConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.taskRepository = new JdbcTaskRepository(database);
        this.workflowRepository = new JdbcWorkflowRepository(database);
        this.resultRepository = new JdbcResultRepository(database);

        // Jobs
        this.jobRegistry = new JobRegistry()
                .register(PolygonAreaJob.TASK_TYPE, new PolygonAreaJob())
                .register(ReportGenerationJob.TASK_TYPE, new ReportGenerationJob(taskRepository, resultRepository))
                .register(EchoJob.TASK_TYPE, new EchoJob());

        // Engine
        this.dependencyResolver = new DependencyResolver();
        this.workflowAggregator = new WorkflowAggregator(workflowRepository, taskRepository, resultRepository);
        this.taskExecutor = new TaskExecutor(taskRepository, resultRepository, jobRegistry, dependencyResolver,
                workflowAggregator);
        this.scheduler = new TaskScheduler(taskRepository, taskExecutor, config);

        // Services
        this.workflowService = new WorkflowService(workflowRepository, taskRepository, resultRepository);

        // Controllers
        this.healthController = new HealthController(database, workflowService, jobRegistry);
        this.workflowController = new WorkflowController(workflowService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(EngineConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(EngineConfig.fromEnv());
    }

    // Getters
    public EngineConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public WorkflowRepository workflowRepository() {
        return workflowRepository;
    }

    public ResultRepository resultRepository() {
        return resultRepository;
    }

    public JobRegistry jobRegistry() {
        return jobRegistry;
    }

    public WorkflowAggregator workflowAggregator() {
        return workflowAggregator;
    }

    public TaskExecutor taskExecutor() {
        return taskExecutor;
    }

    public WorkflowService workflowService() {
        return workflowService;
    }

    public TaskScheduler scheduler() {
        return scheduler;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(workflowController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Start the worker threads and the claim reaper.
     */
    public void startScheduler() {
        scheduler.start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first
        try {
            scheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
