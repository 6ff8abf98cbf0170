package deckhand.engine.execution;

import deckhand.cluster.OrchestrationApi;
import deckhand.cluster.OrchestrationApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Re-emits the log of a stage's most recent pod through the
 * {@code deckhand.podlogs} logger, framed by banner lines.
 * Failing to fetch logs never fails a stage.
 */
public class PodLogRelay {

    private static final Logger log = LoggerFactory.getLogger(PodLogRelay.class);
    private static final Logger podLog = LoggerFactory.getLogger("deckhand.podlogs");

    private final OrchestrationApi api;

    public PodLogRelay(OrchestrationApi api) {
        this.api = api;
    }

    /**
     * @param namespace namespace of the pod
     * @param selector  labels selecting the stage's pods
     * @param title     banner title, e.g. "stage train (attempt 2)"
     * @return true if a log was relayed
     */
    public boolean relay(String namespace, Map<String, String> selector, String title) {
        try {
            Optional<String> pod = api.latestPodName(namespace, selector);
            if (pod.isEmpty()) {
                log.warn("No pod found for {}, cannot relay logs", title);
                return false;
            }
            String text = api.readPodLog(namespace, pod.get());
            podLog.info("---- pod logs for {} [{}] ----", title, pod.get());
            text.lines().forEach(podLog::info);
            podLog.info("---- end of pod logs for {} ----", title);
            return true;
        } catch (OrchestrationApiException e) {
            log.warn("Failed to fetch pod logs for {}: {}", title, e.getMessage());
            return false;
        }
    }
}
