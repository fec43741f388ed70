package com.mchekin.runnerdispatch;

import com.mchekin.runnerdispatch.compute.ComputeFleet;
import com.mchekin.runnerdispatch.compute.ComputeLaunchException;
import com.mchekin.runnerdispatch.compute.FleetOccupancy;
import com.mchekin.runnerdispatch.domain.DeliveryOutcome;
import com.mchekin.runnerdispatch.domain.WebhookDeliveryLog;
import com.mchekin.runnerdispatch.domain.WebhookRegistration;
import com.mchekin.runnerdispatch.dto.WebhookAck;
import com.mchekin.runnerdispatch.repository.InstallationRepository;
import com.mchekin.runnerdispatch.repository.WebhookDeliveryLogRepository;
import com.mchekin.runnerdispatch.repository.WebhookRegistrationRepository;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest(
        classes = RunnerDispatchApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@Testcontainers(disabledWithoutDocker = true)
class GitHubWebhookIntegrationTest {

    private static final String APP_WEBHOOK_SECRET = "app-webhook-secret";
    private static final String FALLBACK_TOKEN = "ghp_fallback";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:17-alpine")
            .withDatabaseName("runner_dispatch_test")
            .withUsername("test")
            .withPassword("test");

    static final FakeGitHubServer gitHub = new FakeGitHubServer();

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("runner.github.api-base-url", gitHub::url);
        registry.add("runner.github.app-id", () -> "12345");
        registry.add("runner.github.app-private-key", FakeGitHubServer::generatePrivateKeyPem);
        registry.add("runner.github.app-webhook-secret", () -> APP_WEBHOOK_SECRET);
        registry.add("runner.github.fallback-token", () -> FALLBACK_TOKEN);
    }

    @AfterAll
    static void stopGitHub() {
        gitHub.stop();
    }

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private WebhookRegistrationRepository registrationRepository;

    @Autowired
    private WebhookDeliveryLogRepository deliveryLogRepository;

    @Autowired
    private InstallationRepository installationRepository;

    @MockitoBean
    private ComputeFleet computeFleet;

    @BeforeEach
    void setUp() {
        registrationRepository.deleteAll();
        deliveryLogRepository.deleteAll();
        installationRepository.deleteAll();
        gitHub.reset();
    }

    @Test
    void shouldProvisionRunnerForQueuedWorkflowJob() {
        WebhookRegistration registration = createAndSaveRegistration(1001L, "acme", "widgets", "repo-secret");
        when(computeFleet.occupancy()).thenReturn(new FleetOccupancy(0, 0));
        when(computeFleet.launch(anyMap())).thenReturn("arn:aws:ecs:us-east-1:1:task/github-runners/abc");

        ResponseEntity<WebhookAck> response = deliver("workflow_job", "repo-secret", workflowJobQueued(7));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().isOk()).isTrue();
        assertThat(response.getBody().getMessage()).isEqualTo("Runner task created");
        assertThat(response.getBody().getTaskArn()).isEqualTo("arn:aws:ecs:us-east-1:1:task/github-runners/abc");

        Map<String, String> environment = capturedEnvironment();
        assertThat(environment)
                .containsEntry("GH_OWNER", "acme")
                .containsEntry("GH_REPO", "widgets")
                .containsEntry("GITHUB_TOKEN", FALLBACK_TOKEN)
                .containsEntry("RUNNER_TRIGGER", "workflow_job-job-build");

        List<WebhookDeliveryLog> logs = deliveryLogRepository.findAll();
        assertThat(logs).hasSize(1);
        assertThat(logs.get(0).getRegistrationId()).isEqualTo(registration.getId());
        assertThat(logs.get(0).getOutcome()).isEqualTo(DeliveryOutcome.PROVISIONED);
    }

    @Test
    void shouldRejectSecondDeliveryWithinCooldown() {
        createAndSaveRegistration(1002L, "acme", "gadgets", "repo-secret");
        when(computeFleet.occupancy()).thenReturn(new FleetOccupancy(0, 0));
        when(computeFleet.launch(anyMap())).thenReturn("arn:aws:ecs:us-east-1:1:task/github-runners/first");

        ResponseEntity<WebhookAck> first = deliver("push", "repo-secret", pushWithCommit());
        ResponseEntity<WebhookAck> second = deliver("workflow_job", "repo-secret", workflowJobQueued(8));

        assertThat(first.getBody().getMessage()).isEqualTo("Runner task created");
        assertThat(second.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(second.getBody().getMessage()).isEqualTo("Rejected: cooldown-active");
        verify(computeFleet, times(1)).launch(anyMap());
    }

    @Test
    void shouldLaunchOnceForConcurrentDeliveries() throws Exception {
        createAndSaveRegistration(1003L, "acme", "sprockets", "repo-secret");
        when(computeFleet.occupancy()).thenReturn(new FleetOccupancy(0, 0));
        when(computeFleet.launch(anyMap())).thenReturn("arn:aws:ecs:us-east-1:1:task/github-runners/once");

        ExecutorService executor = Executors.newFixedThreadPool(4);
        List<Callable<ResponseEntity<WebhookAck>>> calls = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            calls.add(() -> deliver("workflow_job", "repo-secret", workflowJobQueued(9)));
        }

        List<String> messages = new ArrayList<>();
        for (Future<ResponseEntity<WebhookAck>> future : executor.invokeAll(calls)) {
            messages.add(future.get().getBody().getMessage());
        }
        executor.shutdown();

        assertThat(messages).filteredOn("Runner task created"::equals).hasSize(1);
        assertThat(messages).filteredOn("Rejected: cooldown-active"::equals).hasSize(3);
        verify(computeFleet, times(1)).launch(anyMap());
    }

    @Test
    void shouldSkipWhenActiveRunnersCoverQueue() {
        createAndSaveRegistration(1004L, "acme", "gears", "repo-secret");
        when(computeFleet.occupancy()).thenReturn(new FleetOccupancy(1, 0));
        gitHub.queueJobs(1);

        ResponseEntity<WebhookAck> response = deliver("workflow_job", "repo-secret", workflowJobQueued(10));

        assertThat(response.getBody().getMessage()).isEqualTo("Rejected: sufficient-runners");
        verify(computeFleet, never()).launch(anyMap());
    }

    @Test
    void shouldRejectPushWhenFleetSaturated() {
        createAndSaveRegistration(1005L, "acme", "bolts", "repo-secret");
        when(computeFleet.occupancy()).thenReturn(new FleetOccupancy(2, 0));

        ResponseEntity<WebhookAck> response = deliver("push", "repo-secret", pushWithCommit());

        assertThat(response.getBody().getMessage()).isEqualTo("Rejected: capacity-saturated");
        verify(computeFleet, never()).launch(anyMap());
    }

    @Test
    void shouldAcknowledgeFailedLaunchWithOk() {
        createAndSaveRegistration(1006L, "acme", "nuts", "repo-secret");
        when(computeFleet.occupancy()).thenReturn(new FleetOccupancy(0, 0));
        when(computeFleet.launch(anyMap()))
                .thenThrow(new ComputeLaunchException("no capacity"));

        ResponseEntity<WebhookAck> response = deliver("push", "repo-secret", pushWithCommit());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().getMessage()).isEqualTo("Runner task creation failed");
        assertThat(deliveryLogRepository.findAll().get(0).getOutcome()).isEqualTo(DeliveryOutcome.PROVISION_FAILED);
    }

    @Test
    void shouldReturn401ForInvalidSignature() {
        createAndSaveRegistration(1007L, "acme", "widgets", "repo-secret");

        ResponseEntity<WebhookAck> response = deliver("workflow_job", "not-the-secret", workflowJobQueued(11));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(response.getBody().isOk()).isFalse();
        assertThat(deliveryLogRepository.findAll()).isEmpty();
        verify(computeFleet, never()).occupancy();
    }

    @Test
    void shouldReturn401WhenSignatureMissing() {
        createAndSaveRegistration(1008L, "acme", "widgets", "repo-secret");

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-GitHub-Event", "push");

        ResponseEntity<WebhookAck> response = restTemplate.postForEntity(
                createUrl("/webhooks/github"),
                new HttpEntity<>(pushWithCommit(), headers),
                WebhookAck.class
        );

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
    }

    @Test
    void shouldReturn400ForMalformedPayload() {
        createAndSaveRegistration(1009L, "acme", "widgets", "repo-secret");

        ResponseEntity<WebhookAck> response = deliver("push", "repo-secret", "{\"commits\":[");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void shouldAcknowledgePing() {
        createAndSaveRegistration(1010L, "acme", "widgets", "repo-secret");

        ResponseEntity<WebhookAck> response = deliver("ping", "repo-secret", "{\"zen\":\"Speak like a human.\"}");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().getMessage()).isEqualTo("Ping received");
        verify(computeFleet, never()).occupancy();
    }

    @Test
    void shouldUseInstallationTokenAfterAppInstalled() {
        ResponseEntity<WebhookAck> installed = deliver("installation", APP_WEBHOOK_SECRET,
                "{\"action\":\"created\",\"installation\":" + FakeGitHubServer.installationJson() + "}");

        assertThat(installed.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(installed.getBody().getMessage()).isEqualTo("GitHub App event processed");
        assertThat(installationRepository.findByInstallationId(FakeGitHubServer.INSTALLATION_ID)).isPresent();

        createAndSaveRegistration(1011L, FakeGitHubServer.INSTALLATION_LOGIN, "platform", "repo-secret");
        when(computeFleet.occupancy()).thenReturn(new FleetOccupancy(0, 0));
        when(computeFleet.launch(anyMap())).thenReturn("arn:aws:ecs:us-east-1:1:task/github-runners/inst");

        ResponseEntity<WebhookAck> response = deliver("workflow_job", "repo-secret", workflowJobQueued(12));

        assertThat(response.getBody().getMessage()).isEqualTo("Runner task created");
        assertThat(capturedEnvironment()).containsEntry("GITHUB_TOKEN", FakeGitHubServer.INSTALLATION_TOKEN);
        assertThat(gitHub.authorizationFor("/access_tokens")).startsWith("Bearer ey");
        assertThat(gitHub.authorizationFor("/registration-token"))
                .isEqualTo("Bearer " + FakeGitHubServer.INSTALLATION_TOKEN);
    }

    @Test
    void shouldFallBackAfterAppUninstalled() {
        deliver("installation", APP_WEBHOOK_SECRET,
                "{\"action\":\"created\",\"installation\":" + FakeGitHubServer.installationJson() + "}");
        ResponseEntity<WebhookAck> deleted = deliver("installation", APP_WEBHOOK_SECRET,
                "{\"action\":\"deleted\",\"installation\":" + FakeGitHubServer.installationJson() + "}");

        assertThat(deleted.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(installationRepository.findByInstallationId(FakeGitHubServer.INSTALLATION_ID)).isEmpty();

        createAndSaveRegistration(1012L, FakeGitHubServer.INSTALLATION_LOGIN, "legacy", "repo-secret");
        when(computeFleet.occupancy()).thenReturn(new FleetOccupancy(0, 0));
        when(computeFleet.launch(anyMap())).thenReturn("arn:aws:ecs:us-east-1:1:task/github-runners/fb");

        deliver("push", "repo-secret", pushWithCommit());

        assertThat(capturedEnvironment()).containsEntry("GITHUB_TOKEN", FALLBACK_TOKEN);
    }

    @Test
    void shouldIgnoreCompletedWorkflowJob() {
        createAndSaveRegistration(1013L, "acme", "widgets", "repo-secret");

        ResponseEntity<WebhookAck> response = deliver("workflow_job", "repo-secret",
                "{\"action\":\"completed\",\"workflow_job\":{\"name\":\"build\",\"run_id\":13}}");

        assertThat(response.getBody().getMessage()).isEqualTo("Ignored action: completed");
        assertThat(deliveryLogRepository.findAll().get(0).getOutcome()).isEqualTo(DeliveryOutcome.IGNORED);
        verify(computeFleet, never()).occupancy();
    }

    @SuppressWarnings("unchecked")
    private Map<String, String> capturedEnvironment() {
        ArgumentCaptor<Map<String, String>> captor = ArgumentCaptor.forClass(Map.class);
        verify(computeFleet).launch(captor.capture());
        return captor.getValue();
    }

    private ResponseEntity<WebhookAck> deliver(String event, String secret, String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-GitHub-Event", event);
        headers.set("X-GitHub-Delivery", UUID.randomUUID().toString());
        headers.set("X-Hub-Signature-256", sign(secret, body));

        return restTemplate.postForEntity(
                createUrl("/webhooks/github"),
                new HttpEntity<>(body, headers),
                WebhookAck.class
        );
    }

    private String workflowJobQueued(long runId) {
        return "{\"action\":\"queued\",\"workflow_job\":{\"id\":1,\"name\":\"build\",\"run_id\":" + runId
                + ",\"status\":\"queued\"},\"repository\":{\"id\":1,\"full_name\":\"acme/widgets\"}}";
    }

    private String pushWithCommit() {
        return "{\"ref\":\"refs/heads/main\",\"commits\":[{\"id\":\"6dcb09b5b57875f334f61aebed695e2e4193db5e\"}]}";
    }

    private WebhookRegistration createAndSaveRegistration(Long repositoryId, String owner, String name, String secret) {
        WebhookRegistration registration = WebhookRegistration.builder()
                .repositoryId(repositoryId)
                .owner(owner)
                .name(name)
                .remoteHookId("hook-" + repositoryId)
                .secret(secret)
                .deliveryUrl("http://localhost:" + port + "/webhooks/github")
                .active(true)
                .build();
        return registrationRepository.save(registration);
    }

    private String sign(String secret, String payload) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return "sha256=" + HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    private String createUrl(String path) {
        return "http://localhost:" + port + path;
    }
}
