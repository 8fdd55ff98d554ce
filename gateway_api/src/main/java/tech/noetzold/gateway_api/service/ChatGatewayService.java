package tech.noetzold.gateway_api.service;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import tech.noetzold.gateway_api.RequestTraceFilter;
import tech.noetzold.gateway_api.client.QueryEngineClient;
import tech.noetzold.gateway_api.config.QueryEngineProperties;
import tech.noetzold.gateway_api.exception.EngineNotConfiguredException;
import tech.noetzold.gateway_api.exception.EngineResponseParseException;
import tech.noetzold.gateway_api.exception.EngineTransportException;
import tech.noetzold.gateway_api.exception.PolicyViolationException;
import tech.noetzold.gateway_api.model.ChatRequest;
import tech.noetzold.gateway_api.model.ChatResponse;
import tech.noetzold.gateway_api.model.EngineResponse;
import tech.noetzold.gateway_api.policy.PolicyRegistry;
import tech.noetzold.gateway_api.validation.Decision;
import tech.noetzold.gateway_api.validation.DisclosureTransformer;
import tech.noetzold.gateway_api.validation.ResponseValidator;
import tech.noetzold.gateway_api.validation.ValidationOutcome;
import tech.noetzold.gateway_api.validation.ValidationSettlement;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

@Slf4j
@Service
public class ChatGatewayService {

    private static final Duration SETTLE_GRACE = Duration.ofSeconds(2);
    private static final String SOURCE = "query-engine";

    private final QueryEngineClient engineClient;
    private final ResponseValidator validator;
    private final DisclosureTransformer transformer;
    private final AuditService auditService;
    private final PolicyRegistry policyRegistry;
    private final ConversationFormatter formatter;
    private final QueryEngineProperties props;

    public ChatGatewayService(QueryEngineClient engineClient,
                              ResponseValidator validator,
                              DisclosureTransformer transformer,
                              AuditService auditService,
                              PolicyRegistry policyRegistry,
                              ConversationFormatter formatter,
                              QueryEngineProperties props) {
        this.engineClient = engineClient;
        this.validator = validator;
        this.transformer = transformer;
        this.auditService = auditService;
        this.policyRegistry = policyRegistry;
        this.formatter = formatter;
        this.props = props;
    }

    public ChatResponse chat(ChatRequest req) {
        if (!props.isConfigured()) {
            throw new EngineNotConfiguredException("Query engine is not configured. "
                    + "Set query.engine.url, query.engine.username and query.engine.password.");
        }

        String question = formatter.questionFrom(req.getMessages());
        String role = req.getRole();
        if (!policyRegistry.isKnownRole(role)) {
            log.warn("Unknown role '{}' claimed, applying policy of '{}'", role, policyRegistry.getFallbackRole());
        }

        String requestId = currentRequestId();
        long start = System.nanoTime();

        ValidationSettlement settlement = new ValidationSettlement(requestId,
                outcome -> auditService.record(requestId, outcome));

        // success and error both race into the same settlement; only the first one counts
        Disposable call = engineClient.dispatch(question, role)
                .timeout(props.getTimeout())
                .subscribe(
                        response -> settlement.settle(validate(role, response)),
                        error -> settlement.settle(validator.failed(role, error)));

        ValidationOutcome outcome = settlement.await(props.getTimeout().plus(SETTLE_GRACE),
                error -> validator.failed(role, error));
        call.dispose();

        double responseTime = (System.nanoTime() - start) / 1_000_000_000.0;
        log.info("Chat request {} settled as {} in {}s", requestId, outcome.decision(),
                String.format("%.2f", responseTime));

        return toResponse(outcome, responseTime);
    }

    private ValidationOutcome validate(String role, EngineResponse response) {
        try {
            return validator.validate(role, response);
        } catch (RuntimeException e) {
            log.error("Validation failed for role '{}': {}", role, e.getMessage(), e);
            return validator.failed(role, e);
        }
    }

    private ChatResponse toResponse(ValidationOutcome outcome, double responseTime) {
        if (outcome.decision().delivers()) {
            return delivered(outcome, responseTime);
        }
        if (outcome.decision() == Decision.DENY) {
            throw new PolicyViolationException(outcome.appliedRole(), outcome.reason(),
                    outcome.unauthorizedResources());
        }
        throw asFailure(outcome.failure());
    }

    private ChatResponse delivered(ValidationOutcome outcome, double responseTime) {
        EngineResponse engine = outcome.engineResponse();
        return ChatResponse.builder()
                .message(transformer.transform(outcome))
                .tablesUsed(outcome.resourcesUsed())
                .sqlQuery(engine != null ? engine.sqlQuery() : null)
                .decision(outcome.decision().name())
                .model(props.getModelLabel())
                .responseTime(responseTime)
                .source(SOURCE)
                .build();
    }

    private RuntimeException asFailure(Throwable failure) {
        if (failure instanceof EngineTransportException || failure instanceof EngineResponseParseException) {
            return (RuntimeException) failure;
        }
        if (failure instanceof TimeoutException) {
            return new EngineTransportException("Query engine timed out", failure);
        }
        return new EngineTransportException("Query engine call failed: "
                + (failure != null ? failure.getMessage() : "unknown error"), failure);
    }

    private String currentRequestId() {
        String id = MDC.get(RequestTraceFilter.MDC_KEY);
        return id != null ? id : RequestTraceFilter.generateRequestId();
    }
}
