package com.swarmmind.core.external.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.swarmmind.core.external.DiscoveryFilters;
import com.swarmmind.core.external.IssueDiscovery;
import com.swarmmind.core.external.RepositoryDiscovery;
import com.swarmmind.core.metrics.SwarmmindMetrics;
import com.swarmmind.core.model.DiscoveredIssue;
import com.swarmmind.core.model.DiscoveredRepo;
import com.swarmmind.core.model.IssueDifficulty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only client for the GitHub REST search and issues API.
 * <p>
 * Every failure (disabled client, network error, HTTP error, malformed body)
 * is logged and turned into an empty list.
 */
@Service
public class GitHubClient implements RepositoryDiscovery, IssueDiscovery {

    private static final Logger log = LoggerFactory.getLogger(GitHubClient.class);

    static final int MAX_ISSUE_BODY = 2000;

    private final GitHubProperties properties;
    private final SwarmmindMetrics metrics;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private volatile String lastFailure;

    @Autowired
    public GitHubClient(GitHubProperties properties, SwarmmindMetrics metrics) {
        this(properties, metrics, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .build(), new ObjectMapper());
    }

    GitHubClient(GitHubProperties properties, SwarmmindMetrics metrics, HttpClient httpClient,
                 ObjectMapper objectMapper) {
        this.properties = properties;
        this.metrics = metrics;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<DiscoveredRepo> discover(String query, DiscoveryFilters filters) {
        if (!properties.isEnabled() || query == null || query.isBlank()) {
            return List.of();
        }
        StringBuilder q = new StringBuilder(query.trim());
        if (filters.language() != null && !filters.language().isBlank()) {
            q.append(" language:").append(filters.language());
        }
        if (filters.minStars() > 0) {
            q.append(" stars:>=").append(filters.minStars());
        }
        return get("/search/repositories?q=" + encode(q.toString()) + "&sort=stars&per_page=" + filters.limit())
                .map(body -> parseRepos(body.get("items")))
                .orElse(List.of());
    }

    @Override
    public List<DiscoveredRepo> trending(String topic, int sinceDays) {
        if (!properties.isEnabled() || topic == null || topic.isBlank()) {
            return List.of();
        }
        String since = LocalDate.now().minusDays(sinceDays).toString();
        String q = "topic:" + topic.trim() + " created:>=" + since + " stars:>=5";
        return get("/search/repositories?q=" + encode(q) + "&sort=stars&per_page=10")
                .map(body -> parseRepos(body.get("items")))
                .orElse(List.of());
    }

    @Override
    public List<DiscoveredIssue> listIssues(String owner, String repo, int limit) {
        if (!properties.isEnabled()) {
            return List.of();
        }
        return get("/repos/" + encode(owner) + "/" + encode(repo) + "/issues?state=open&per_page=" + limit)
                .map(body -> parseIssues(owner, repo, body))
                .orElse(List.of());
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    /** Message of the most recent failed call, or null if the last call succeeded. */
    public String lastFailure() {
        return lastFailure;
    }

    List<DiscoveredRepo> parseRepos(JsonNode items) {
        if (items == null || !items.isArray()) {
            return List.of();
        }
        List<DiscoveredRepo> repos = new ArrayList<>();
        for (JsonNode item : items) {
            String[] parts = item.path("full_name").asText("").split("/", 2);
            if (parts.length < 2 || parts[0].isBlank() || parts[1].isBlank()) {
                continue;
            }
            List<String> topics = new ArrayList<>();
            item.path("topics").forEach(t -> topics.add(t.asText()));
            repos.add(new DiscoveredRepo(parts[0], parts[1],
                    textOrEmpty(item, "description"),
                    textOrEmpty(item, "language"),
                    item.path("stargazers_count").asInt(0),
                    topics));
        }
        return repos;
    }

    List<DiscoveredIssue> parseIssues(String owner, String repo, JsonNode items) {
        if (items == null || !items.isArray()) {
            return List.of();
        }
        List<DiscoveredIssue> issues = new ArrayList<>();
        for (JsonNode item : items) {
            // the issues endpoint also returns pull requests
            if (item.has("pull_request")) {
                continue;
            }
            List<String> labels = new ArrayList<>();
            item.path("labels").forEach(l -> labels.add(l.path("name").asText("")));
            String body = textOrEmpty(item, "body");
            if (body.length() > MAX_ISSUE_BODY) {
                body = body.substring(0, MAX_ISSUE_BODY);
            }
            issues.add(new DiscoveredIssue(owner, repo, item.path("number").asInt(0),
                    textOrEmpty(item, "title"), body, labels, IssueDifficulty.fromLabels(labels)));
        }
        return issues;
    }

    private Optional<JsonNode> get(String path) {
        try {
            var builder = HttpRequest.newBuilder()
                    .uri(URI.create(properties.getApiUrl() + path))
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .header("Accept", "application/vnd.github+json")
                    .GET();
            if (properties.hasToken()) {
                builder.header("Authorization", "Bearer " + properties.getToken());
            }
            var response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                return failed("GitHub GET %s failed (HTTP %d)".formatted(path, response.statusCode()));
            }
            lastFailure = null;
            return Optional.of(objectMapper.readTree(response.body()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed("GitHub GET " + path + " interrupted");
        } catch (IOException | IllegalArgumentException e) {
            return failed("GitHub GET " + path + " failed: " + e.getMessage());
        }
    }

    private Optional<JsonNode> failed(String message) {
        log.warn(message);
        lastFailure = message;
        metrics.recordExternalFailure("discovery");
        return Optional.empty();
    }

    private static String textOrEmpty(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
