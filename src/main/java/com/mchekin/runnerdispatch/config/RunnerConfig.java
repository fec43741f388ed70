package com.mchekin.runnerdispatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ecs.EcsClient;

import java.net.http.HttpClient;
import java.time.Clock;

@Configuration
public class RunnerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HttpClient gitHubHttpClient(RunnerProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.github().timeout())
                .build();
    }

    @Bean(destroyMethod = "close")
    public EcsClient ecsClient(RunnerProperties properties) {
        RunnerProperties.Compute compute = properties.compute();
        return EcsClient.builder()
                .region(Region.of(compute.region()))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(compute.apiCallTimeout())
                        .build())
                .build();
    }
}
