package com.mchekin.runnerdispatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * Externally supplied settings for admission, the compute fleet and the GitHub collaborator.
 * Every value can be overridden from the environment, e.g. {@code RUNNER_COMPUTE_CLUSTER}.
 */
@ConfigurationProperties(prefix = "runner")
public record RunnerProperties(
        @DefaultValue Admission admission,
        @DefaultValue Compute compute,
        @DefaultValue GitHub github,
        @DefaultValue Webhook webhook,
        @DefaultValue DeliveryLog deliveryLog
) {

    public record Admission(
            @DefaultValue("15s") Duration cooldown,
            @DefaultValue("60s") Duration ledgerHorizon,
            @DefaultValue("2") int occupancyCeiling
    ) {
    }

    public record Compute(
            @DefaultValue("us-east-1") String region,
            @DefaultValue("github-runners") String cluster,
            @DefaultValue("github-runner-task") String taskFamily,
            @DefaultValue("github-runner") String containerName,
            @DefaultValue List<String> subnets,
            @DefaultValue List<String> securityGroups,
            @DefaultValue("ENABLED") String assignPublicIp,
            @DefaultValue("FARGATE") String launchType,
            @DefaultValue("self-hosted") String runnerLabels,
            @DefaultValue("10s") Duration apiCallTimeout
    ) {
    }

    public record GitHub(
            @DefaultValue("https://api.github.com") String apiBaseUrl,
            String appId,
            String appPrivateKey,
            String appWebhookSecret,
            String fallbackToken,
            @DefaultValue("10s") Duration timeout
    ) {

        public boolean appConfigured() {
            return appId != null && !appId.isBlank()
                    && appPrivateKey != null && !appPrivateKey.isBlank();
        }
    }

    public record Webhook(
            @DefaultValue("http://localhost:8080/webhooks/github") String deliveryUrl,
            @DefaultValue({"push", "workflow_job", "workflow_run"}) List<String> events
    ) {
    }

    public record DeliveryLog(
            @DefaultValue("7d") Duration retention
    ) {
    }
}
