package tech.noetzold.gateway_api.validation;

import org.springframework.stereotype.Component;

/**
 * Produces the message the caller sees for a delivering decision.
 */
@Component
public class DisclosureTransformer {

    public static final String NO_ANSWER_MESSAGE =
            "I couldn't find an answer to that question in the label information available to you. "
                    + "Try rephrasing it, or ask about a specific section of the label.";

    public static final String ADVISORY_SUFFIX =
            "\n\nNote: this answer may include technical or restricted safety information. "
                    + "Please review it with a qualified healthcare professional before acting on it.";

    public String transform(ValidationOutcome outcome) {
        return switch (outcome.decision()) {
            case ALLOW -> outcome.noAnswer() ? NO_ANSWER_MESSAGE : outcome.message();
            case DISCLAIM -> (outcome.message() == null ? "" : outcome.message()) + ADVISORY_SUFFIX;
            default -> throw new IllegalStateException("no message is delivered for decision " + outcome.decision());
        };
    }
}
