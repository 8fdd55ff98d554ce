package tech.noetzold.gateway_api.exception;

public class EngineResponseParseException extends RuntimeException {

    public EngineResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
