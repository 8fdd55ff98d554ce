package tech.noetzold.gateway_api.exception;

import lombok.Getter;

/**
 * Network failure, timeout or non-2xx status from the query engine.
 * {@code status} is 0 when no HTTP response was received.
 */
@Getter
public class EngineTransportException extends RuntimeException {

    private final int status;
    private final String responseBody;

    public EngineTransportException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.responseBody = null;
    }

    public EngineTransportException(int status, String responseBody) {
        super("Query engine error (" + status + "): " + responseBody);
        this.status = status;
        this.responseBody = responseBody;
    }
}
