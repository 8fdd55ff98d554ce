package tech.noetzold.gateway_api.policy;

/**
 * What to do with an answer whose reported resources include views outside the role's set.
 */
public enum UnauthorizedMode {
    /** Deliver the answer with an advisory suffix. */
    DISCLOSE_WITH_WARNING,
    /** Refuse the answer outright. */
    STRICT_DENY
}
