package tech.noetzold.gateway_api.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import tech.noetzold.gateway_api.config.QueryEngineProperties;
import tech.noetzold.gateway_api.exception.EngineResponseParseException;
import tech.noetzold.gateway_api.exception.EngineTransportException;
import tech.noetzold.gateway_api.model.EngineResponse;
import tech.noetzold.gateway_api.policy.PolicyRegistry;
import tech.noetzold.gateway_api.policy.ResourceViews;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sends one question to the query engine. The role's allowed views travel as the
 * {@code tables} hint, which the engine may ignore; no access decision is made here.
 */
@Slf4j
@Component
public class QueryEngineClient {

    static final String NO_RESPONSE = "No response generated";

    private final WebClient webClient;
    private final QueryEngineProperties props;
    private final PolicyRegistry policyRegistry;
    private final ObjectMapper objectMapper;

    public QueryEngineClient(@Qualifier("engineWebClient") WebClient engineWebClient,
                             QueryEngineProperties props,
                             PolicyRegistry policyRegistry,
                             ObjectMapper objectMapper) {
        this.webClient = engineWebClient;
        this.props = props;
        this.policyRegistry = policyRegistry;
        this.objectMapper = objectMapper;
    }

    public Mono<EngineResponse> dispatch(String question, String role) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("question", question);
        vars.put("tables", toJson(resourceHint(role)));
        vars.put("database", props.getDatabase());

        log.info("Querying engine for role '{}' ({} chars)", role, question.length());

        return webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/answerQuestion")
                            .queryParam("question", "{question}")
                            .queryParam("verbose", "true")
                            .queryParam("tables", "{tables}");
                    if (props.getDatabase() != null && !props.getDatabase().isBlank()) {
                        uriBuilder.queryParam("vdp_database_names", "{database}");
                    }
                    return uriBuilder.build(vars);
                })
                .exchangeToMono(resp -> {
                    HttpStatusCode status = resp.statusCode();
                    if (status.is2xxSuccessful()) {
                        return resp.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(this::parse);
                    }
                    return resp.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(body -> {
                                log.warn("Query engine returned {}: {}", status.value(), body);
                                return Mono.error(new EngineTransportException(status.value(), body));
                            });
                })
                .onErrorMap(WebClientRequestException.class,
                        e -> new EngineTransportException("Failed to reach query engine: " + e.getMessage(), e));
    }

    /** Allowed views for the role, qualified with the configured database when there is one. */
    List<String> resourceHint(String role) {
        String database = props.getDatabase();
        return policyRegistry.allowedResources(role).stream()
                .map(view -> database != null && !database.isBlank() ? database + "." + view : view)
                .toList();
    }

    EngineResponse parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new EngineResponseParseException("Failed to parse response from query engine", e);
        }
        if (root == null || !root.isObject()) {
            throw new EngineResponseParseException("Query engine response is not a JSON object", null);
        }

        List<String> tablesUsed;
        try {
            tablesUsed = ResourceViews.parseTablesUsed(root.get("tables_used"));
        } catch (IllegalArgumentException e) {
            throw new EngineResponseParseException("Unreadable tables_used in query engine response", e);
        }

        JsonNode answerNode = root.path("answer");
        String answer = answerNode.isTextual() && !answerNode.asText().isBlank() ? answerNode.asText() : NO_RESPONSE;
        String sqlQuery = root.path("sql_query").isTextual() ? root.path("sql_query").asText() : null;
        Double totalTime = root.path("total_execution_time").isNumber()
                ? root.path("total_execution_time").asDouble()
                : null;

        log.debug("Engine answered using tables {}", tablesUsed);
        return new EngineResponse(answer, tablesUsed, sqlQuery, totalTime, root.get("tokens"));
    }

    private String toJson(List<String> hint) {
        try {
            return objectMapper.writeValueAsString(hint);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode resource hint", e);
        }
    }
}
