package deckhand.engine.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for engine settings.
 * All settings have sensible defaults. Precedence, lowest first: defaults,
 * INI file, environment variables, command-line options (applied by the CLI
 * through the {@code withX} setters).
 *
 * <pre>
 * [cluster]
 * api_server = https://10.0.0.1:6443
 * token_file = /path/to/token
 * ca_file    = /path/to/ca.crt
 * kubeconfig = ~/.kube/config
 *
 * [engine]
 * poll_interval_ms      = 2000
 * timeout_grace_seconds = 0
 * max_parallel_stages   = 16
 * verify_secrets        = true
 * controller_image      = deckhand/deckhand:latest
 *
 * [history]
 * enabled      = true
 * database_url = jdbc:h2:file:./data/deckhand
 * pool_size    = 4
 * </pre>
 */
public final class EngineConfig {

    public static final String DEFAULT_INI_FILE = "deckhand.ini";

    // Cluster settings
    private String apiServer = null; // null: in-cluster or kubeconfig
    private String tokenFile = null;
    private String caFile = null;
    private String kubeconfig = System.getProperty("user.home") + "/.kube/config";
    private Duration requestTimeout = Duration.ofSeconds(30);

    // Engine settings
    private Duration pollInterval = Duration.ofSeconds(2);
    private Duration timeoutGrace = Duration.ZERO;
    private int maxParallelStages = 16;
    private boolean verifySecrets = true;
    private String controllerImage = "deckhand/deckhand:latest";
    private String stageServiceAccount = "deckhand-stage";
    private String workflowServiceAccount = "deckhand-workflow-controller";
    private String logLevel = null; // null: use the descriptor's level

    // History settings
    private boolean historyEnabled = true;
    private String databaseUrl = "jdbc:h2:file:./data/deckhand;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 4;

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromEnv() {
        return defaults().applyEnv(System.getenv());
    }

    /**
     * Load settings from an INI file on top of the defaults, then apply
     * environment overrides. A missing file is not an error.
     *
     * @throws IllegalArgumentException if the file exists but cannot be parsed
     */
    public static EngineConfig load(File iniFile) {
        EngineConfig config = defaults();
        if (iniFile != null && iniFile.isFile()) {
            config.applyIni(iniFile);
        }
        return config.applyEnv(System.getenv());
    }

    /**
     * Apply settings from an INI file.
     *
     * @throws IllegalArgumentException if the file cannot be read or a value
     *                                  is malformed
     */
    public EngineConfig applyIni(File iniFile) {
        try {
            Ini ini = new Ini(iniFile);

            Profile.Section cluster = ini.get("cluster");
            if (cluster != null) {
                apiServer = opt(cluster, "api_server", apiServer);
                tokenFile = opt(cluster, "token_file", tokenFile);
                caFile = opt(cluster, "ca_file", caFile);
                kubeconfig = expandHome(opt(cluster, "kubeconfig", kubeconfig));
                requestTimeout = Duration.ofSeconds(Long.parseLong(
                        opt(cluster, "request_timeout_seconds", String.valueOf(requestTimeout.toSeconds()))));
            }

            Profile.Section engine = ini.get("engine");
            if (engine != null) {
                pollInterval = Duration.ofMillis(Long.parseLong(
                        opt(engine, "poll_interval_ms", String.valueOf(pollInterval.toMillis()))));
                timeoutGrace = Duration.ofSeconds(Long.parseLong(
                        opt(engine, "timeout_grace_seconds", String.valueOf(timeoutGrace.toSeconds()))));
                maxParallelStages = Integer.parseInt(
                        opt(engine, "max_parallel_stages", String.valueOf(maxParallelStages)));
                verifySecrets = Boolean.parseBoolean(opt(engine, "verify_secrets", String.valueOf(verifySecrets)));
                controllerImage = opt(engine, "controller_image", controllerImage);
                stageServiceAccount = opt(engine, "stage_service_account", stageServiceAccount);
                workflowServiceAccount = opt(engine, "workflow_service_account", workflowServiceAccount);
                logLevel = opt(engine, "log_level", logLevel);
            }

            Profile.Section history = ini.get("history");
            if (history != null) {
                historyEnabled = Boolean.parseBoolean(opt(history, "enabled", String.valueOf(historyEnabled)));
                databaseUrl = opt(history, "database_url", databaseUrl);
                databasePoolSize = Integer.parseInt(opt(history, "pool_size", String.valueOf(databasePoolSize)));
            }
            return this;
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read config file " + iniFile, e);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number in config file " + iniFile + ": " + e.getMessage(), e);
        }
    }

    /**
     * Apply {@code DECKHAND_*} overrides from the given environment.
     */
    public EngineConfig applyEnv(Map<String, String> env) {
        String server = env.get("DECKHAND_API_SERVER");
        if (server != null && !server.isBlank()) {
            apiServer = server;
        }

        String token = env.get("DECKHAND_TOKEN_FILE");
        if (token != null && !token.isBlank()) {
            tokenFile = token;
        }

        String kube = env.get("KUBECONFIG");
        if (kube != null && !kube.isBlank()) {
            kubeconfig = expandHome(kube);
        }

        String poll = env.get("DECKHAND_POLL_INTERVAL_MS");
        if (poll != null && !poll.isBlank()) {
            pollInterval = Duration.ofMillis(Long.parseLong(poll));
        }

        String grace = env.get("DECKHAND_TIMEOUT_GRACE_SECONDS");
        if (grace != null && !grace.isBlank()) {
            timeoutGrace = Duration.ofSeconds(Long.parseLong(grace));
        }

        String image = env.get("DECKHAND_CONTROLLER_IMAGE");
        if (image != null && !image.isBlank()) {
            controllerImage = image;
        }

        String level = env.get("DECKHAND_LOG_LEVEL");
        if (level != null && !level.isBlank()) {
            logLevel = level;
        }

        String dbUrl = env.get("DECKHAND_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            databaseUrl = dbUrl;
        }

        String history = env.get("DECKHAND_HISTORY_ENABLED");
        if (history != null && !history.isBlank()) {
            historyEnabled = Boolean.parseBoolean(history);
        }

        return this;
    }

    // Getters
    public String apiServer() {
        return apiServer;
    }

    public String tokenFile() {
        return tokenFile;
    }

    public String caFile() {
        return caFile;
    }

    public String kubeconfig() {
        return kubeconfig;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    /** Extra time added to every stage deadline before it counts as timed out. */
    public Duration timeoutGrace() {
        return timeoutGrace;
    }

    public int maxParallelStages() {
        return maxParallelStages;
    }

    public boolean verifySecrets() {
        return verifySecrets;
    }

    public String controllerImage() {
        return controllerImage;
    }

    public String stageServiceAccount() {
        return stageServiceAccount;
    }

    public String workflowServiceAccount() {
        return workflowServiceAccount;
    }

    public String logLevel() {
        return logLevel;
    }

    public boolean historyEnabled() {
        return historyEnabled;
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    // Fluent setters for testing/customization
    public EngineConfig withApiServer(String server) {
        this.apiServer = server;
        return this;
    }

    public EngineConfig withKubeconfig(String path) {
        this.kubeconfig = path;
        return this;
    }

    public EngineConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public EngineConfig withTimeoutGrace(Duration grace) {
        this.timeoutGrace = grace;
        return this;
    }

    public EngineConfig withMaxParallelStages(int max) {
        this.maxParallelStages = max;
        return this;
    }

    public EngineConfig withVerifySecrets(boolean verify) {
        this.verifySecrets = verify;
        return this;
    }

    public EngineConfig withControllerImage(String image) {
        this.controllerImage = image;
        return this;
    }

    public EngineConfig withLogLevel(String level) {
        this.logLevel = level;
        return this;
    }

    public EngineConfig withHistoryEnabled(boolean enabled) {
        this.historyEnabled = enabled;
        return this;
    }

    public EngineConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "apiServer='" + apiServer + '\'' +
                ", pollInterval=" + pollInterval +
                ", timeoutGrace=" + timeoutGrace +
                ", maxParallelStages=" + maxParallelStages +
                ", historyEnabled=" + historyEnabled +
                ", databaseUrl='" + databaseUrl + '\'' +
                '}';
    }

    // ===== helpers =====
    private static String expandHome(String path) {
        return path.startsWith("~/") ? System.getProperty("user.home") + path.substring(1) : path;
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }
}
