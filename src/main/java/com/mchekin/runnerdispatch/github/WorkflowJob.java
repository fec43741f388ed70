package com.mchekin.runnerdispatch.github;

public record WorkflowJob(long id, String name, String status) {

    public boolean queued() {
        return "queued".equals(status);
    }

    public boolean inProgress() {
        return "in_progress".equals(status);
    }
}
