package tech.noetzold.gateway_api.controller;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import tech.noetzold.gateway_api.RequestTraceFilter;
import tech.noetzold.gateway_api.exception.EngineNotConfiguredException;
import tech.noetzold.gateway_api.exception.EngineResponseParseException;
import tech.noetzold.gateway_api.exception.EngineTransportException;
import tech.noetzold.gateway_api.exception.InvalidChatRequestException;
import tech.noetzold.gateway_api.exception.PolicyViolationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class ErrorHandler {

    static final String PROCESSING_FAILED = "Failed to process request";

    @ExceptionHandler(PolicyViolationException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Map<String, Object> handlePolicyViolation(PolicyViolationException ex) {
        return body("Access Denied: " + ex.getMessage());
    }

    @ExceptionHandler(EngineNotConfiguredException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleNotConfigured(EngineNotConfiguredException ex) {
        return body(ex.getMessage());
    }

    @ExceptionHandler({EngineTransportException.class, EngineResponseParseException.class})
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleEngineFailure(RuntimeException ex) {
        log.error("Error processing chat: {}", ex.getMessage(), ex);
        return body(PROCESSING_FAILED);
    }

    @ExceptionHandler(InvalidChatRequestException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidRequest(InvalidChatRequestException ex) {
        return body(ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return body("Invalid request: " + details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadable(HttpMessageNotReadableException ex) {
        return body("Invalid request: malformed JSON body");
    }

    private Map<String, Object> body(String error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        String traceId = MDC.get(RequestTraceFilter.MDC_KEY);
        if (traceId != null) {
            body.put("trace_id", traceId);
        }
        return body;
    }
}
