package tech.noetzold.gateway_api.validation;

import tech.noetzold.gateway_api.model.EngineResponse;

import java.util.List;

/**
 * Terminal result of validating one engine call. Immutable once built.
 *
 * @param role           role claimed by the caller
 * @param appliedRole    role whose policy was applied (differs on fallback)
 * @param message        the engine's raw answer, untransformed
 * @param noAnswer       the engine explicitly reported that it found nothing
 * @param reason         human-readable reason for DENY and ERROR
 * @param failure        cause of an ERROR outcome
 */
public record ValidationOutcome(
        Decision decision,
        String role,
        String appliedRole,
        int allowedCount,
        String message,
        List<String> resourcesUsed,
        List<String> unauthorizedResources,
        boolean noAnswer,
        String reason,
        EngineResponse engineResponse,
        Throwable failure
) {
    public ValidationOutcome {
        if (decision == null || !decision.isTerminal()) {
            throw new IllegalArgumentException("outcome requires a terminal decision, got " + decision);
        }
        resourcesUsed = resourcesUsed == null ? List.of() : List.copyOf(resourcesUsed);
        unauthorizedResources = unauthorizedResources == null ? List.of() : List.copyOf(unauthorizedResources);
    }
}
