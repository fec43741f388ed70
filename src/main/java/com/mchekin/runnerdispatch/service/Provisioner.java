package com.mchekin.runnerdispatch.service;

import com.mchekin.runnerdispatch.compute.ComputeFleet;
import com.mchekin.runnerdispatch.config.RunnerProperties;
import com.mchekin.runnerdispatch.dto.ProvisionRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Launches a runner task for an accepted admission. Launch failures are logged and swallowed:
 * the webhook sender is not responsible for compute availability and nothing is retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Provisioner {

    private final ComputeFleet computeFleet;
    private final RunnerProperties properties;

    public Optional<String> launch(ProvisionRequest request) {
        String repository = request.owner() + "/" + request.name();

        try {
            String taskArn = computeFleet.launch(environment(request));
            log.info("Runner task created: repository={}, task={}, trigger={}",
                    repository, taskId(taskArn), request.triggerAnnotation());
            return Optional.of(taskArn);
        } catch (RuntimeException e) {
            log.error("Runner task creation failed: repository={}, trigger={}",
                    repository, request.triggerAnnotation(), e);
            return Optional.empty();
        }
    }

    Map<String, String> environment(ProvisionRequest request) {
        Map<String, String> environment = new LinkedHashMap<>();
        environment.put("GH_OWNER", request.owner());
        environment.put("GH_REPO", request.name());
        environment.put("GITHUB_TOKEN", request.credential().token());
        environment.put("RUNNER_TRIGGER", request.triggerAnnotation());
        environment.put("RUNNER_LABELS", properties.compute().runnerLabels());
        return environment;
    }

    private static String taskId(String taskArn) {
        return taskArn.substring(taskArn.lastIndexOf('/') + 1);
    }
}
