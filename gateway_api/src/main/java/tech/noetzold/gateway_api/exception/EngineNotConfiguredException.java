package tech.noetzold.gateway_api.exception;

/** Endpoint or credentials for the query engine are missing; the call is never attempted. */
public class EngineNotConfiguredException extends RuntimeException {

    public EngineNotConfiguredException(String message) {
        super(message);
    }
}
