package deckhand.cluster.auth;

import deckhand.cluster.OrchestrationApiException;
import deckhand.engine.config.EngineConfig;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.ClientBuilder;
import io.kubernetes.client.util.KubeConfig;
import io.kubernetes.client.util.credentials.TokenFileAuthentication;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Builds the API client for the target cluster.
 *
 * <p>
 * Resolution order: explicit {@code [cluster]} settings, the in-cluster
 * service account, then the current context of the kubeconfig file.
 */
public final class ClusterCredentials {

    private static final Logger log = LoggerFactory.getLogger(ClusterCredentials.class);

    static final Path SERVICE_ACCOUNT_DIR = Path.of("/var/run/secrets/kubernetes.io/serviceaccount");

    private ClusterCredentials() {
    }

    public static ApiClient resolve(EngineConfig config) {
        return resolve(config, System.getenv(), SERVICE_ACCOUNT_DIR);
    }

    static ApiClient resolve(EngineConfig config, Map<String, String> env, Path serviceAccountDir) {
        ApiClient client = builder(config, env, serviceAccountDir).build();
        int timeoutMillis = (int) config.requestTimeout().toMillis();
        client.setConnectTimeout(timeoutMillis);
        client.setReadTimeout(timeoutMillis);
        log.info("Kubernetes API client for {}", client.getBasePath());
        return client;
    }

    private static ClientBuilder builder(EngineConfig config, Map<String, String> env, Path serviceAccountDir) {
        if (config.apiServer() != null && !config.apiServer().isBlank()) {
            log.debug("Using API server from configuration: {}", config.apiServer());
            ClientBuilder builder = new ClientBuilder().setBasePath(stripSlash(config.apiServer()));
            if (config.tokenFile() != null) {
                builder.setAuthentication(new TokenFileAuthentication(config.tokenFile()));
            }
            if (config.caFile() != null) {
                builder.setCertificateAuthority(readBytes(Path.of(config.caFile())));
            }
            return builder;
        }

        String host = env.get("KUBERNETES_SERVICE_HOST");
        Path tokenPath = serviceAccountDir.resolve("token");
        if (host != null && Files.isReadable(tokenPath)) {
            String port = env.getOrDefault("KUBERNETES_SERVICE_PORT", "443");
            Path caPath = serviceAccountDir.resolve("ca.crt");
            log.debug("Using in-cluster service account credentials");
            ClientBuilder builder = new ClientBuilder()
                    .setBasePath("https://" + host + ":" + port)
                    .setAuthentication(new TokenFileAuthentication(tokenPath.toString()));
            if (Files.isReadable(caPath)) {
                builder.setCertificateAuthority(readBytes(caPath));
            }
            return builder;
        }

        Path kubeconfig = Path.of(config.kubeconfig());
        if (Files.isReadable(kubeconfig)) {
            return fromKubeconfig(kubeconfig);
        }
        throw new OrchestrationApiException(0,
                "No cluster credentials: set [cluster] api_server, run inside the cluster, or provide "
                        + config.kubeconfig());
    }

    /**
     * Client settings for the current context of a kubeconfig file. Relative
     * certificate and token paths resolve against the file's directory.
     */
    static ClientBuilder fromKubeconfig(Path file) {
        KubeConfig kubeConfig;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            kubeConfig = KubeConfig.loadKubeConfig(reader);
        } catch (IOException | RuntimeException e) {
            throw new OrchestrationApiException("Failed to read kubeconfig " + file, e);
        }
        kubeConfig.setFile(file.toFile());
        if (kubeConfig.getServer() == null) {
            throw new OrchestrationApiException(0,
                    "kubeconfig " + file + " has no server for context '" + kubeConfig.getCurrentContext() + "'");
        }
        try {
            log.debug("Using kubeconfig {} context '{}'", file, kubeConfig.getCurrentContext());
            return ClientBuilder.kubeconfig(kubeConfig);
        } catch (IOException | RuntimeException e) {
            throw new OrchestrationApiException("Failed to load credentials from kubeconfig " + file, e);
        }
    }

    private static byte[] readBytes(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new OrchestrationApiException("Failed to read " + path, e);
        }
    }

    private static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
