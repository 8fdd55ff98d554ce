package tech.noetzold.gateway_api.model;

public record EngineHealthResponse(
        boolean configured,
        boolean reachable
) {}
