package tech.noetzold.gateway_api.policy;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Role to resource-view policy. Prefix: {@code gateway.policy}. */
@Data
@ConfigurationProperties(prefix = "gateway.policy")
public class AccessPolicyProperties {

    /** Role applied when the caller sends an unknown role. Empty means "most restrictive role". */
    private String defaultRole;

    /** Allowed resource views per role, with or without a namespace prefix. */
    private Map<String, Set<String>> roles = new LinkedHashMap<>();

    private UnauthorizedMode unauthorizedMode = UnauthorizedMode.DISCLOSE_WITH_WARNING;

    /**
     * Case-insensitive patterns recognising an engine reply that found nothing. Each must match the
     * whole trimmed reply, so a real answer that merely mentions "no data" is not a no-answer.
     */
    private List<String> noAnswerPatterns = new ArrayList<>(List.of(
            "(sorry,?\\s*)?(i\\s+)?(couldn['’]?t|could not|was unable to|am unable to|unable to) (find|locate) "
                    + "(an answer|any (relevant )?(answer|information|data|results))"
                    + "( (about|for|on|to) [^.!?;]{1,80})?[.!]?",
            "no (answers?|results?|relevant (information|data|results)|matching (data|results))"
                    + "( (was|were) (found|returned))?( for (your|this|that) question)?[.!]?",
            "no response generated[.!]?",
            "(sorry,?\\s*)?i don['’]?t (know|have (enough )?information( (about|on) [^.!?;]{1,80})?)[.!]?"
    ));
}
