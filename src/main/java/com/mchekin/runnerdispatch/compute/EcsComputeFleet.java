package com.mchekin.runnerdispatch.compute;

import com.mchekin.runnerdispatch.config.RunnerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ecs.EcsClient;
import software.amazon.awssdk.services.ecs.model.AssignPublicIp;
import software.amazon.awssdk.services.ecs.model.AwsVpcConfiguration;
import software.amazon.awssdk.services.ecs.model.ContainerOverride;
import software.amazon.awssdk.services.ecs.model.DesiredStatus;
import software.amazon.awssdk.services.ecs.model.KeyValuePair;
import software.amazon.awssdk.services.ecs.model.LaunchType;
import software.amazon.awssdk.services.ecs.model.ListTasksRequest;
import software.amazon.awssdk.services.ecs.model.ListTasksResponse;
import software.amazon.awssdk.services.ecs.model.NetworkConfiguration;
import software.amazon.awssdk.services.ecs.model.RunTaskRequest;
import software.amazon.awssdk.services.ecs.model.RunTaskResponse;
import software.amazon.awssdk.services.ecs.model.TaskOverride;

import java.util.List;
import java.util.Map;

/**
 * Runner fleet backed by ECS tasks of a single task family.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EcsComputeFleet implements ComputeFleet {

    private final EcsClient ecsClient;
    private final RunnerProperties properties;

    @Override
    public FleetOccupancy occupancy() {
        int running = countTasks(DesiredStatus.RUNNING);
        int pending = countTasks(DesiredStatus.PENDING);

        log.debug("Fleet occupancy: cluster={}, family={}, running={}, pending={}",
                properties.compute().cluster(), properties.compute().taskFamily(), running, pending);

        return new FleetOccupancy(running, pending);
    }

    @Override
    public String launch(Map<String, String> environment) {
        RunnerProperties.Compute compute = properties.compute();

        AwsVpcConfiguration.Builder vpc = AwsVpcConfiguration.builder()
                .subnets(compute.subnets())
                .assignPublicIp(AssignPublicIp.fromValue(compute.assignPublicIp()));
        if (!compute.securityGroups().isEmpty()) {
            vpc.securityGroups(compute.securityGroups());
        }

        List<KeyValuePair> variables = environment.entrySet().stream()
                .map(e -> KeyValuePair.builder().name(e.getKey()).value(e.getValue()).build())
                .toList();

        RunTaskRequest request = RunTaskRequest.builder()
                .cluster(compute.cluster())
                .taskDefinition(compute.taskFamily())
                .launchType(LaunchType.fromValue(compute.launchType()))
                .count(1)
                .networkConfiguration(NetworkConfiguration.builder()
                        .awsvpcConfiguration(vpc.build())
                        .build())
                .overrides(TaskOverride.builder()
                        .containerOverrides(ContainerOverride.builder()
                                .name(compute.containerName())
                                .environment(variables)
                                .build())
                        .build())
                .build();

        RunTaskResponse response;
        try {
            response = ecsClient.runTask(request);
        } catch (SdkException e) {
            throw new ComputeLaunchException("RunTask call failed: " + e.getMessage(), e);
        }

        if (!response.hasTasks() || response.tasks().isEmpty()) {
            String reasons = response.hasFailures()
                    ? response.failures().stream().map(f -> f.arn() + ":" + f.reason()).toList().toString()
                    : "no task returned";
            throw new ComputeLaunchException("RunTask launched nothing: " + reasons);
        }

        return response.tasks().get(0).taskArn();
    }

    private int countTasks(DesiredStatus status) {
        int count = 0;
        String nextToken = null;
        do {
            ListTasksResponse page = ecsClient.listTasks(ListTasksRequest.builder()
                    .cluster(properties.compute().cluster())
                    .family(properties.compute().taskFamily())
                    .desiredStatus(status)
                    .nextToken(nextToken)
                    .build());
            count += page.taskArns().size();
            nextToken = page.nextToken();
        } while (nextToken != null);
        return count;
    }
}
