package tech.noetzold.gateway_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.gateway_api.exception.InvalidChatRequestException;
import tech.noetzold.gateway_api.model.ChatMessage;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a chat history into the single question the engine understands. The engine is
 * stateless, so a follow-up like "what about pregnancy?" inherits the product name
 * (brand names are written in capitals, e.g. SYMBICORT) from the previous user turn.
 */
@Component
public class ConversationFormatter {

    private static final Pattern PRODUCT_NAME = Pattern.compile("\\b([A-Z][A-Z]+)\\b");

    public String questionFrom(List<ChatMessage> messages) {
        int current = lastUserIndex(messages);
        if (current < 0) {
            throw new InvalidChatRequestException("No user message found");
        }
        String question = messages.get(current).getContent();
        if (question == null || question.isBlank()) {
            throw new InvalidChatRequestException("User message is empty");
        }
        question = question.trim();

        // user, assistant, user: look back one exchange
        if (current >= 2) {
            ChatMessage previous = messages.get(current - 2);
            if ("user".equals(previous.getRole()) && previous.getContent() != null) {
                Matcher product = PRODUCT_NAME.matcher(previous.getContent());
                if (product.find() && !PRODUCT_NAME.matcher(question).find()) {
                    return question + " for " + product.group(1);
                }
            }
        }
        return question;
    }

    private int lastUserIndex(List<ChatMessage> messages) {
        if (messages == null) {
            return -1;
        }
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i) != null && "user".equals(messages.get(i).getRole())) {
                return i;
            }
        }
        return -1;
    }
}
