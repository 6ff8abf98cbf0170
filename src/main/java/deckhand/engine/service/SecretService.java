package deckhand.engine.service;

import deckhand.cluster.OrchestrationApi;
import deckhand.cluster.model.SecretInfo;
import deckhand.cluster.spec.SecretSpec;
import deckhand.engine.translate.ResourceNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Creates, lists and deletes the secrets that stages reference.
 * A secret in group {@code g} named {@code s} is stored as {@code g-s}, which
 * is the name a stage in a pipeline with {@code secrets_group: g} resolves.
 */
public class SecretService {

    private static final Logger log = LoggerFactory.getLogger(SecretService.class);

    private static final Pattern KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final OrchestrationApi api;

    public SecretService(OrchestrationApi api) {
        this.api = api;
    }

    /**
     * Create or replace a secret.
     *
     * @param group optional group, null for ungrouped secrets
     * @param data  key/value pairs; keys are the environment variable names
     *              stages bind them to
     * @return the stored secret name
     * @throws IllegalArgumentException if the data is empty or a key is not a
     *                                  valid environment variable name
     */
    public String create(String namespace, String group, String name, Map<String, String> data) {
        if (data == null || data.isEmpty()) {
            throw new IllegalArgumentException("secret " + name + " needs at least one KEY=VALUE pair");
        }
        for (String key : data.keySet()) {
            if (!KEY.matcher(key).matches()) {
                throw new IllegalArgumentException("secret key '" + key + "' is not a valid environment variable name");
            }
        }

        String secretName = ResourceNames.secretName(group, name);
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(ResourceNames.APP_LABEL, ResourceNames.APP);
        if (group != null && !group.isBlank()) {
            labels.put(ResourceNames.SECRET_GROUP_LABEL, ResourceNames.toValidName(group));
        }

        api.createSecret(new SecretSpec(namespace, secretName, labels, data));
        log.info("Created secret {} in namespace {} with keys {}", secretName, namespace, data.keySet());
        return secretName;
    }

    public void delete(String namespace, String group, String name) {
        String secretName = ResourceNames.secretName(group, name);
        api.deleteSecret(namespace, secretName);
        log.info("Deleted secret {} from namespace {}", secretName, namespace);
    }

    /**
     * List secret names and keys, optionally within one group.
     */
    public List<SecretInfo> list(String namespace, String group) {
        Map<String, String> selector = new LinkedHashMap<>();
        selector.put(ResourceNames.APP_LABEL, ResourceNames.APP);
        if (group != null && !group.isBlank()) {
            selector.put(ResourceNames.SECRET_GROUP_LABEL, ResourceNames.toValidName(group));
        }
        return api.listSecrets(namespace, selector);
    }
}
