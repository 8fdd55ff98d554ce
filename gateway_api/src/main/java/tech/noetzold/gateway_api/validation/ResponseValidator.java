package tech.noetzold.gateway_api.validation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.noetzold.gateway_api.model.EngineResponse;
import tech.noetzold.gateway_api.policy.AccessPolicyProperties;
import tech.noetzold.gateway_api.policy.PolicyRegistry;
import tech.noetzold.gateway_api.policy.ResourceViews;
import tech.noetzold.gateway_api.policy.UnauthorizedMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Decides what a caller may receive from one engine reply. The engine's resource hint is
 * advisory, so this is the enforcement point: provenance comes only from {@code tables_used},
 * and a real answer without provenance is denied.
 * <p>
 * Pure: no I/O, no state beyond the read-only policy.
 */
@Slf4j
@Component
public class ResponseValidator {

    static final String MISSING_PROVENANCE =
            "the answer could not be verified against the data your role may access";

    private final PolicyRegistry policyRegistry;
    private final UnauthorizedMode unauthorizedMode;
    private final List<Pattern> noAnswerPatterns;

    public ResponseValidator(PolicyRegistry policyRegistry, AccessPolicyProperties properties) {
        this.policyRegistry = policyRegistry;
        this.unauthorizedMode = properties.getUnauthorizedMode();
        this.noAnswerPatterns = properties.getNoAnswerPatterns().stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList();
    }

    public ValidationOutcome validate(String role, EngineResponse response) {
        String appliedRole = policyRegistry.resolveRole(role);
        Set<String> allowed = policyRegistry.allowedResources(appliedRole);
        String answer = response.answer();

        List<String> used = new ArrayList<>(ResourceViews.normalizeAll(response.tablesUsed()));

        if (used.isEmpty()) {
            if (isNoAnswer(answer)) {
                return new ValidationOutcome(Decision.ALLOW, role, appliedRole, allowed.size(), answer,
                        List.of(), List.of(), true, null, response, null);
            }
            return new ValidationOutcome(Decision.DENY, role, appliedRole, allowed.size(), answer,
                    List.of(), List.of(), false, MISSING_PROVENANCE, response, null);
        }

        List<String> unauthorized = used.stream()
                .filter(view -> !allowed.contains(view))
                .toList();

        if (unauthorized.isEmpty()) {
            return new ValidationOutcome(Decision.ALLOW, role, appliedRole, allowed.size(), answer,
                    used, List.of(), false, null, response, null);
        }

        if (unauthorizedMode == UnauthorizedMode.STRICT_DENY) {
            return new ValidationOutcome(Decision.DENY, role, appliedRole, allowed.size(), answer,
                    used, unauthorized, false,
                    "the answer draws on data your role may not access: " + String.join(", ", unauthorized),
                    response, null);
        }
        return new ValidationOutcome(Decision.DISCLAIM, role, appliedRole, allowed.size(), answer,
                used, unauthorized, false, null, response, null);
    }

    /** Outcome for a call that never produced a usable reply (transport, parse or timeout). */
    public ValidationOutcome failed(String role, Throwable failure) {
        String appliedRole = policyRegistry.resolveRole(role);
        int allowedCount = policyRegistry.allowedResources(appliedRole).size();
        String reason = failure instanceof TimeoutException
                ? "query engine timed out"
                : String.valueOf(failure.getMessage());
        return new ValidationOutcome(Decision.ERROR, role, appliedRole, allowedCount, null,
                List.of(), List.of(), false, reason, null, failure);
    }

    /** Blank answers count as "no answer": nothing was disclosed. Patterns match the whole reply. */
    public boolean isNoAnswer(String answer) {
        if (answer == null || answer.isBlank()) {
            return true;
        }
        String reply = answer.strip();
        for (Pattern pattern : noAnswerPatterns) {
            if (pattern.matcher(reply).matches()) {
                return true;
            }
        }
        return false;
    }
}
