package com.causescore.catalog;

import com.causescore.common.HandleParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Impact-graph GraphQL client over WebClient. Every call is bounded by the configured timeout.
 */
@Component
@Slf4j
public class GraphQlCatalogClient implements CatalogClient {

    private final WebClient webClient;
    private final Duration timeout;

    public GraphQlCatalogClient(WebClient.Builder webClientBuilder, CatalogProperties properties) {
        this.webClient = webClientBuilder.baseUrl(properties.getGraphqlUrl()).build();
        this.timeout = Duration.ofSeconds(properties.getTimeoutSeconds());
    }

    @Override
    public List<CauseWithProjects> getCausesWithProjects(int limit, int offset) {
        JsonNode data = execute("causes", CatalogQueries.CAUSES_WITH_PROJECTS, Map.of("limit", limit, "offset", offset));
        return parseCauses(data);
    }

    @Override
    public List<ProjectFacts> getProjectsByIds(List<String> projectIds) {
        List<ProjectFacts> found = new ArrayList<>();
        for (String id : projectIds) {
            long numericId;
            try {
                numericId = Long.parseLong(id.strip());
            } catch (NumberFormatException e) {
                log.warn("Skipping catalog lookup for non-numeric project id {}", id);
                continue;
            }
            JsonNode project = execute("projectById", CatalogQueries.PROJECT_BY_ID, Map.of("id", numericId))
                    .path("projectById");
            if (project.isObject()) {
                found.add(parseProject(project));
            } else {
                log.debug("Project {} not found in catalog", id);
            }
        }
        return found;
    }

    @Override
    public int reportScores(List<ScoreUpdate> updates) {
        if (updates.isEmpty()) {
            return 0;
        }
        List<Map<String, Object>> payload = updates.stream()
                .map(u -> Map.<String, Object>of("causeId", u.causeId(), "projectId", u.projectId(), "causeScore", u.causeScore()))
                .toList();
        JsonNode data = execute("bulkUpdateCauseProjectEvaluation", CatalogQueries.BULK_UPDATE_EVALUATIONS,
                Map.of("updates", payload));
        return data.path("bulkUpdateCauseProjectEvaluation").size();
    }

    private JsonNode execute(String operation, String query, Map<String, Object> variables) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", query);
        body.put("variables", variables);
        String response;
        try {
            response = webClient.post()
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw new CatalogException("Catalog " + operation + " call failed: " + e.getMessage(), e);
        }
        return parseData(operation, response);
    }

    static JsonNode parseData(String operation, String json) {
        JsonNode root;
        try {
            root = new ObjectMapper().readTree(json == null ? "" : json);
        } catch (Exception e) {
            throw new CatalogException("Unparseable catalog response for " + operation, e);
        }
        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new CatalogException("Catalog " + operation + " returned errors: " + errors.get(0).path("message").asText());
        }
        JsonNode data = root.path("data");
        if (!data.isObject()) {
            throw new CatalogException("Catalog " + operation + " response has no data");
        }
        return data;
    }

    static List<CauseWithProjects> parseCauses(JsonNode data) {
        List<CauseWithProjects> causes = new ArrayList<>();
        for (JsonNode cause : data.path("causes")) {
            List<ProjectFacts> projects = new ArrayList<>();
            for (JsonNode project : cause.path("projects")) {
                projects.add(parseProject(project));
            }
            causes.add(new CauseWithProjects(cause.path("id").asText(), text(cause, "title"), text(cause, "description"), projects));
        }
        return causes;
    }

    static ProjectFacts parseProject(JsonNode p) {
        String twitter = null;
        String farcaster = null;
        for (JsonNode social : p.path("socialMedia")) {
            String type = social.path("type").asText("").toUpperCase(Locale.ROOT);
            String link = social.path("link").asText(null);
            if (twitter == null && (type.equals("X") || type.equals("TWITTER"))) {
                twitter = HandleParser.twitterHandle(link).orElse(null);
            } else if (farcaster == null && type.equals("FARCASTER")) {
                farcaster = HandleParser.farcasterName(link).orElse(null);
            }
        }
        JsonNode update = p.path("projectUpdate");
        Instant lastUpdate = instant(update, "createdAt");
        if (lastUpdate == null) {
            lastUpdate = instant(p, "latestUpdateCreationDate");
        }
        JsonNode rank = p.path("projectPower").path("powerRank");
        JsonNode quality = p.path("qualityScore");
        return new ProjectFacts(
                p.path("id").asText(),
                text(p, "title"),
                text(p, "slug"),
                text(p, "description"),
                text(p.path("status"), "name"),
                quality.isNumber() ? quality.asDouble() : null,
                rank.isNumber() ? rank.asInt() : null,
                lastUpdate,
                text(update, "title"),
                text(update, "content"),
                twitter,
                farcaster);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText() : null;
    }

    private static Instant instant(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
