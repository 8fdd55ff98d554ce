package tech.noetzold.gateway_api.policy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Read-only mapping from caller role to the resource views that role may receive answers from.
 * Built once at start-up; unknown roles fall back to the default role, never to an unrestricted set.
 */
@Slf4j
@Component
public class PolicyRegistry {

    private final Map<String, Set<String>> allowedByRole;
    private final String fallbackRole;

    public PolicyRegistry(AccessPolicyProperties properties) {
        if (properties.getRoles() == null || properties.getRoles().isEmpty()) {
            throw new IllegalStateException("gateway.policy.roles must define at least one role");
        }

        Map<String, Set<String>> loaded = new LinkedHashMap<>();
        properties.getRoles().forEach((role, views) ->
                loaded.put(role, Collections.unmodifiableSet(ResourceViews.normalizeAll(views))));
        this.allowedByRole = Collections.unmodifiableMap(loaded);

        String configuredDefault = properties.getDefaultRole();
        if (configuredDefault != null && !configuredDefault.isBlank()) {
            if (!allowedByRole.containsKey(configuredDefault)) {
                throw new IllegalStateException("gateway.policy.default-role '" + configuredDefault
                        + "' has no entry in gateway.policy.roles");
            }
            this.fallbackRole = configuredDefault;
        } else {
            this.fallbackRole = allowedByRole.entrySet().stream()
                    .min(Comparator.comparingInt(e -> e.getValue().size()))
                    .map(Map.Entry::getKey)
                    .orElseThrow();
        }

        log.info("Access policy loaded: {} roles, fallback role '{}'", allowedByRole.size(), fallbackRole);
    }

    public Set<String> allowedResources(String role) {
        return allowedByRole.get(resolveRole(role));
    }

    /** The role whose policy actually applies to the given claim. */
    public String resolveRole(String role) {
        if (role != null && allowedByRole.containsKey(role)) {
            return role;
        }
        log.debug("Unknown role '{}', applying policy of '{}'", role, fallbackRole);
        return fallbackRole;
    }

    public boolean isKnownRole(String role) {
        return role != null && allowedByRole.containsKey(role);
    }

    public String getFallbackRole() {
        return fallbackRole;
    }
}
