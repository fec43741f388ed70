package com.mchekin.runnerdispatch.dto;

/**
 * @param runId workflow run of a {@code workflow_job} event, null for other events
 */
public record AdmissionRequest(
        Long repositoryId,
        String owner,
        String name,
        String eventType,
        String action,
        Long runId,
        String triggerAnnotation
) {

    public boolean workflowJob() {
        return "workflow_job".equals(eventType);
    }
}
