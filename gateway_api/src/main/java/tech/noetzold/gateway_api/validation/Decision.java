package tech.noetzold.gateway_api.validation;

public enum Decision {
    PENDING,
    ALLOW,
    DISCLAIM,
    DENY,
    ERROR;

    public boolean isTerminal() {
        return this != PENDING;
    }

    /** Whether the caller receives an answer for this decision. */
    public boolean delivers() {
        return this == ALLOW || this == DISCLAIM;
    }
}
