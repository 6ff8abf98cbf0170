package deckhand.engine.translate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Naming and labelling conventions for everything the engine creates.
 */
public final class ResourceNames {

    public static final int MAX_NAME_LENGTH = 63;

    public static final String APP_LABEL = "app";
    public static final String APP = "deckhand";
    public static final String PIPELINE_LABEL = "pipeline";
    public static final String STAGE_LABEL = "stage";
    public static final String ATTEMPT_LABEL = "attempt";
    public static final String RUN_ID_LABEL = "run-id";
    public static final String GIT_COMMIT_LABEL = "git-commit";
    public static final String SECRET_GROUP_LABEL = "group";

    private ResourceNames() {
    }

    /**
     * Convert an arbitrary name into a DNS-1123 label: lower case, only
     * {@code [a-z0-9-]}, starting and ending with an alphanumeric.
     *
     * @throws IllegalArgumentException if nothing valid remains
     */
    public static String toValidName(String name) {
        String valid = name.toLowerCase()
                .replaceAll("[^a-z0-9-]", "-")
                .replaceAll("-{2,}", "-")
                .replaceAll("^-+", "")
                .replaceAll("-+$", "");
        if (valid.length() > MAX_NAME_LENGTH) {
            valid = valid.substring(0, MAX_NAME_LENGTH).replaceAll("-+$", "");
        }
        if (valid.isEmpty()) {
            throw new IllegalArgumentException("cannot derive a valid resource name from '" + name + "'");
        }
        return valid;
    }

    /** Name of a service stage's deployment, endpoint and ingress. */
    public static String serviceName(String project, String stage) {
        return toValidName(toValidName(project) + "--" + toValidName(stage));
    }

    /**
     * Name of one batch attempt's job. The run and attempt suffix is kept
     * intact when the name has to be shortened.
     */
    public static String jobName(String project, String stage, String runId, int attempt) {
        String suffix = "-" + toValidName(runId) + "-" + attempt;
        String prefix = toValidName(project) + "--" + toValidName(stage);
        int room = MAX_NAME_LENGTH - suffix.length();
        if (prefix.length() > room) {
            prefix = prefix.substring(0, room).replaceAll("-+$", "");
        }
        return prefix + suffix;
    }

    /** Prefix shared by every job of one stage, across runs. */
    public static String jobNamePrefix(String project, String stage) {
        return toValidName(project) + "--" + toValidName(stage) + "-";
    }

    /** Name of the secret that backs a secret reference. */
    public static String secretName(String group, String secret) {
        return group == null || group.isBlank()
                ? toValidName(secret)
                : toValidName(group + "-" + secret);
    }

    /** Labels identifying every resource of a pipeline. */
    public static Map<String, String> pipelineSelector(String project) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(APP_LABEL, APP);
        labels.put(PIPELINE_LABEL, toValidName(project));
        return labels;
    }

    /** Labels identifying the resources of one stage. */
    public static Map<String, String> stageSelector(String project, String stage) {
        Map<String, String> labels = pipelineSelector(project);
        labels.put(STAGE_LABEL, toValidName(stage));
        return labels;
    }

    /** In-cluster URL of a service stage's endpoint. */
    public static String clusterUrl(String namespace, String serviceName, int port) {
        return "http://" + serviceName + "." + namespace + ".svc.cluster.local:" + port;
    }

    /** External route of a service stage, relative to the ingress host. */
    public static String ingressRoute(String namespace, String serviceName) {
        return "/" + namespace + "/" + serviceName;
    }
}
