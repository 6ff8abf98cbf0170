package deckhand.engine.config;

import deckhand.cluster.OrchestrationApi;
import deckhand.cluster.auth.ClusterCredentials;
import deckhand.cluster.kubernetes.KubernetesApiClient;
import deckhand.engine.execution.StageExecutor;
import deckhand.engine.repository.RunRepository;
import deckhand.engine.schedule.ScheduleService;
import deckhand.engine.service.NamespaceService;
import deckhand.engine.service.SecretService;
import deckhand.engine.service.ServiceDeploymentService;
import deckhand.engine.source.GitProjectSource;
import deckhand.engine.source.ProjectSource;
import deckhand.engine.store.Database;
import deckhand.engine.store.JdbcRunRepository;
import deckhand.engine.workflow.WorkflowRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all engine services around one cluster API.
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(EngineConfig.fromEnv())) {
 *     WorkflowRun run = deps.workflowRunner().run(namespace, repoUrl, branch, null);
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final OrchestrationApi api;
    private final ProjectSource projectSource;
    private final StageExecutor stageExecutor;
    private final ScheduleService scheduleService;
    private final SecretService secretService;
    private final ServiceDeploymentService serviceDeploymentService;
    private final NamespaceService namespaceService;

    // History (lazy-initialized)
    private Database database;
    private RunRepository runRepository;

    private WorkflowRunner workflowRunner;

    private Dependencies(EngineConfig config, OrchestrationApi api, ProjectSource projectSource) {
        this.config = config;
        this.api = api;
        this.projectSource = projectSource;

        log.debug("Initializing dependencies with config: {}", config);

        this.stageExecutor = new StageExecutor(api, config);
        this.scheduleService = new ScheduleService(api, config);
        this.secretService = new SecretService(api);
        this.serviceDeploymentService = new ServiceDeploymentService(api);
        this.namespaceService = new NamespaceService(api, config);
    }

    /**
     * Create dependencies talking to the cluster described by the config.
     */
    public static Dependencies create(EngineConfig config) {
        KubernetesApiClient client = new KubernetesApiClient(ClusterCredentials.resolve(config));
        return new Dependencies(config, client, new GitProjectSource());
    }

    /**
     * Create dependencies around a given cluster API, e.g. a simulated one.
     */
    public static Dependencies create(EngineConfig config, OrchestrationApi api) {
        return new Dependencies(config, api, new GitProjectSource());
    }

    public static Dependencies create(EngineConfig config, OrchestrationApi api, ProjectSource projectSource) {
        return new Dependencies(config, api, projectSource);
    }

    public EngineConfig config() {
        return config;
    }

    public OrchestrationApi api() {
        return api;
    }

    public ProjectSource projectSource() {
        return projectSource;
    }

    public StageExecutor stageExecutor() {
        return stageExecutor;
    }

    public ScheduleService scheduleService() {
        return scheduleService;
    }

    public SecretService secretService() {
        return secretService;
    }

    public ServiceDeploymentService serviceDeploymentService() {
        return serviceDeploymentService;
    }

    public NamespaceService namespaceService() {
        return namespaceService;
    }

    /**
     * Run history store, or null when history is disabled.
     */
    public synchronized RunRepository runRepository() {
        if (!config.historyEnabled()) {
            return null;
        }
        if (runRepository == null) {
            database = new Database(config);
            runRepository = new JdbcRunRepository(database);
        }
        return runRepository;
    }

    public synchronized WorkflowRunner workflowRunner() {
        if (workflowRunner == null) {
            workflowRunner = new WorkflowRunner(projectSource, api, stageExecutor, runRepository(), config);
        }
        return workflowRunner;
    }

    @Override
    public synchronized void close() {
        if (database != null) {
            try {
                database.close();
            } catch (RuntimeException e) {
                log.warn("Error closing database: {}", e.getMessage());
            }
            database = null;
            runRepository = null;
        }
        log.debug("Dependencies closed");
    }
}
