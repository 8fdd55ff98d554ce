package tech.noetzold.gateway_api.exception;

import lombok.Getter;

import java.util.List;

/** The gateway refused to deliver an answer for the caller's role. */
@Getter
public class PolicyViolationException extends RuntimeException {

    private final String role;
    private final List<String> unauthorizedResources;

    public PolicyViolationException(String role, String reason, List<String> unauthorizedResources) {
        super(reason);
        this.role = role;
        this.unauthorizedResources = List.copyOf(unauthorizedResources);
    }
}
