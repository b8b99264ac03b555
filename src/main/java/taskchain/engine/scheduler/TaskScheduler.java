package taskchain.engine.scheduler;

import taskchain.engine.config.EngineConfig;
import taskchain.engine.executor.TaskExecutor;
import taskchain.engine.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the worker loops and the claim reaper on background threads.
 * 
 * Usage:
 * 
 * <pre>
 * TaskScheduler scheduler = new TaskScheduler(taskRepository, executor, config);
 * scheduler.start();
 * // ...
 * scheduler.stop();
 * </pre>
 */
public class TaskScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    private final TaskRepository taskRepository;
    private final TaskExecutor taskExecutor;
    private final EngineConfig config;
    private final ClaimReaper claimReaper;
    private final WorkerLoop syncWorker;
    private final List<WorkerLoop> workers = new ArrayList<>();

    private ExecutorService workerPool;
    private ScheduledExecutorService reaperExecutor;
    private volatile boolean running = false;

    public TaskScheduler(TaskRepository taskRepository, TaskExecutor taskExecutor, EngineConfig config) {
        this.taskRepository = taskRepository;
        this.taskExecutor = taskExecutor;
        this.config = config;
        this.claimReaper = new ClaimReaper(taskRepository, config);
        this.syncWorker = new WorkerLoop(config.workerId() + "-sync", taskRepository, taskExecutor,
                config.pollInterval());
    }

    /**
     * Start the worker threads and the claim reaper.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        AtomicInteger threadIndex = new AtomicInteger();
        workerPool = Executors.newFixedThreadPool(config.workerCount(), r -> {
            Thread t = new Thread(r, "taskchain-worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 1; i <= config.workerCount(); i++) {
            WorkerLoop worker = new WorkerLoop(config.workerId() + "-" + i, taskRepository, taskExecutor,
                    config.pollInterval());
            workers.add(worker);
            workerPool.execute(worker);
        }
        log.info("Started {} worker(s), idle poll every {}ms", config.workerCount(), config.pollInterval().toMillis());

        reaperExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "taskchain-claim-reaper");
            t.setDaemon(true);
            return t;
        });
        long reaperIntervalMs = config.claimReaperInterval().toMillis();
        reaperExecutor.scheduleAtFixedRate(
                claimReaper,
                reaperIntervalMs, // initial delay
                reaperIntervalMs, // interval
                TimeUnit.MILLISECONDS);
        log.info("Claim reaper scheduled every {}ms", reaperIntervalMs);
    }

    /**
     * Stop the workers and the reaper. A task that is mid-execution gets
     * a few seconds to finish before its thread is interrupted.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;
        workers.forEach(WorkerLoop::stop);
        workers.clear();
        workerPool.shutdown();
        reaperExecutor.shutdown();

        try {
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
                log.warn("Workers forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
            reaperExecutor.awaitTermination(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            reaperExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Claim and execute one task on the calling thread.
     *
     * @return true if a task was executed
     */
    public boolean pollOnce() {
        return syncWorker.pollOnce();
    }

    /**
     * Execute queued tasks on the calling thread until none is left.
     *
     * @param maxTasks upper bound on executions
     * @return number of tasks executed
     */
    public int drain(int maxTasks) {
        int executed = 0;
        while (executed < maxTasks && syncWorker.pollOnce()) {
            executed++;
        }
        return executed;
    }
}
