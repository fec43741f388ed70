package com.mchekin.runnerdispatch.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mchekin.runnerdispatch.config.RunnerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The GitHub REST calls the controller consumes. Every call carries a bearer token and the
 * configured request timeout; any failure surfaces as {@link GitHubApiException}.
 */
@Component
@Slf4j
public class GitHubClient {

    private static final String API_VERSION = "2022-11-28";

    private final HttpClient httpClient;
    private final String apiBaseUrl;
    private final Duration timeout;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new com.fasterxml.jackson.datatype.jsr310.JavaTimeModule());

    public GitHubClient(HttpClient gitHubHttpClient, RunnerProperties properties) {
        this.httpClient = gitHubHttpClient;
        this.apiBaseUrl = stripTrailingSlash(properties.github().apiBaseUrl());
        this.timeout = properties.github().timeout();
    }

    public AccessToken createInstallationToken(String appJwt, long installationId) {
        JsonNode body = send("POST", "/app/installations/" + installationId + "/access_tokens", appJwt, null, 201);
        return toAccessToken(body);
    }

    public List<JsonNode> listInstallations(String appJwt) {
        JsonNode body = send("GET", "/app/installations?per_page=100", appJwt, null, 200);
        List<JsonNode> installations = new ArrayList<>();
        body.forEach(installations::add);
        return installations;
    }

    public List<WorkflowJob> listRunJobs(String token, String owner, String repo, long runId) {
        JsonNode body = send("GET", repoPath(owner, repo) + "/actions/runs/" + runId + "/jobs?per_page=100",
                token, null, 200);
        List<WorkflowJob> jobs = new ArrayList<>();
        for (JsonNode job : body.path("jobs")) {
            jobs.add(new WorkflowJob(job.path("id").asLong(), job.path("name").asText(), job.path("status").asText()));
        }
        return jobs;
    }

    public AccessToken createRegistrationToken(String token, String owner, String repo) {
        JsonNode body = send("POST", repoPath(owner, repo) + "/actions/runners/registration-token", token, null, 201);
        return toAccessToken(body);
    }

    public AccessToken createRemovalToken(String token, String owner, String repo) {
        JsonNode body = send("POST", repoPath(owner, repo) + "/actions/runners/remove-token", token, null, 201);
        return toAccessToken(body);
    }

    /**
     * Creates a JSON repository webhook and returns GitHub's hook id.
     */
    public long createRepositoryWebhook(String token, String owner, String repo, String deliveryUrl,
                                        String secret, List<String> events) {
        Map<String, Object> payload = Map.of(
                "name", "web",
                "active", true,
                "events", events,
                "config", Map.of(
                        "url", deliveryUrl,
                        "content_type", "json",
                        "insecure_ssl", "0",
                        "secret", secret));
        JsonNode body = send("POST", repoPath(owner, repo) + "/hooks", token, payload, 201);
        return body.path("id").asLong();
    }

    private JsonNode send(String method, String path, String token, Object payload, int expectedStatus) {
        String url = apiBaseUrl + path;
        long startTime = System.currentTimeMillis();

        try {
            HttpRequest.BodyPublisher bodyPublisher = payload == null
                    ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .header("Authorization", "Bearer " + token)
                    .header("Accept", "application/vnd.github+json")
                    .header("X-GitHub-Api-Version", API_VERSION)
                    .header("Content-Type", "application/json")
                    .method(method, bodyPublisher)
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            long durationMs = System.currentTimeMillis() - startTime;

            if (response.statusCode() != expectedStatus) {
                log.warn("GitHub call failed: method={}, path={}, status={}, durationMs={}",
                        method, path, response.statusCode(), durationMs);
                throw new GitHubApiException(method + " " + path + " returned " + response.statusCode(),
                        response.statusCode());
            }

            log.debug("GitHub call succeeded: method={}, path={}, durationMs={}", method, path, durationMs);
            String responseBody = response.body();
            return responseBody == null || responseBody.isBlank()
                    ? objectMapper.createObjectNode()
                    : objectMapper.readTree(responseBody);

        } catch (HttpTimeoutException e) {
            throw new GitHubApiException(method + " " + path + " timed out after " + timeout, e);
        } catch (IOException e) {
            throw new GitHubApiException(method + " " + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitHubApiException(method + " " + path + " interrupted", e);
        }
    }

    private AccessToken toAccessToken(JsonNode body) {
        String token = body.path("token").asText(null);
        if (token == null) {
            throw new GitHubApiException("GitHub response did not contain a token", 0);
        }
        String expiresAt = body.path("expires_at").asText(null);
        return new AccessToken(token, expiresAt == null ? null : OffsetDateTime.parse(expiresAt).toInstant());
    }

    private static String repoPath(String owner, String repo) {
        return "/repos/" + owner + "/" + repo;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
