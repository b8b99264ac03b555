package taskchain;

import taskchain.engine.config.Dependencies;
import taskchain.engine.config.EngineConfig;
import taskchain.engine.definition.WorkflowDefinition;
import taskchain.engine.definition.WorkflowDefinitionLoader;
import taskchain.engine.server.EngineHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Entry point. Starts the engine workers and the HTTP API.
 * <p>
 * With {@code --submit <workflow.yml> [payload-file]} a workflow is submitted
 * on startup as client {@code cli}.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws Exception {
        EngineConfig config = EngineConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        EngineHttpServer server = new EngineHttpServer(deps.routerHandler());
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "taskchain-shutdown"));

        server.start(config.serverHost(), config.serverPort());
        deps.startScheduler();

        if (args.length >= 2 && "--submit".equals(args[0])) {
            submit(deps, Path.of(args[1]), args.length >= 3 ? Path.of(args[2]) : null);
        }

        stopped.await();
    }

    private static void submit(Dependencies deps, Path definitionFile, Path payloadFile) throws IOException {
        WorkflowDefinition definition = WorkflowDefinitionLoader.fromFile(definitionFile);
        String payload = payloadFile != null ? Files.readString(payloadFile) : null;
        String workflowId = deps.workflowService().createWorkflow(definition, "cli", payload).id();
        log.info("Submitted workflow {} from {}", workflowId, definitionFile);
    }
}
