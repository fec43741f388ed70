package com.mchekin.runnerdispatch.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.mchekin.runnerdispatch.dto.Classification;
import org.springframework.stereotype.Component;

/**
 * Maps an inbound GitHub event onto what the controller should do with it. Only events that
 * signal newly queued work become provision candidates; status, comment and pull request
 * traffic on the same hook is acknowledged and dropped.
 */
@Component
public class EventClassifier {

    public Classification classify(String eventType, JsonNode payload) {
        String action = payload.path("action").asText(null);

        if (eventType == null) {
            return Classification.acknowledge("No event type");
        }

        switch (eventType) {
            case "ping":
                return Classification.acknowledge("Ping received");
            case "installation":
            case "installation_repositories":
                return Classification.directoryUpdate("GitHub App event processed");
            case "push":
                JsonNode commits = payload.path("commits");
                if (!commits.isArray() || commits.isEmpty()) {
                    return Classification.ignore("No commits to process");
                }
                return Classification.provisionCandidate(triggerAnnotation(eventType, payload));
            case "workflow_job":
                if (!"queued".equals(action)) {
                    return Classification.ignore("Ignored action: " + action);
                }
                return Classification.provisionCandidate(triggerAnnotation(eventType, payload));
            case "workflow_run":
                if (!"requested".equals(action)) {
                    return Classification.ignore("Ignored action: " + action);
                }
                return Classification.provisionCandidate(triggerAnnotation(eventType, payload));
            default:
                return Classification.acknowledge("Event not handled");
        }
    }

    /**
     * Human-readable cause handed to the runner, e.g. {@code workflow_job-job-build}.
     */
    String triggerAnnotation(String eventType, JsonNode payload) {
        String cause = switch (eventType) {
            case "workflow_job" -> "job-" + payload.path("workflow_job").path("name").asText("unknown");
            case "workflow_run" -> "workflow-" + payload.path("workflow_run").path("name").asText("unknown");
            case "push" -> "push-" + payload.path("ref").asText("").replace("refs/heads/", "");
            default -> eventType;
        };
        return eventType + "-" + cause;
    }
}
