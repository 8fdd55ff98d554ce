package tech.noetzold.gateway_api.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One reply of the query engine, as received. {@code tablesUsed} keeps the engine's own
 * spelling (possibly namespace-prefixed) and order.
 */
public record EngineResponse(
        String answer,
        List<String> tablesUsed,
        String sqlQuery,
        Double totalExecutionTime,
        JsonNode tokens
) {
    public EngineResponse {
        tablesUsed = tablesUsed == null ? List.of() : List.copyOf(tablesUsed);
    }
}
