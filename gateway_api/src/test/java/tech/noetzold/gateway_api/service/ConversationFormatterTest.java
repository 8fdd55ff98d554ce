package tech.noetzold.gateway_api.service;

import org.junit.jupiter.api.Test;
import tech.noetzold.gateway_api.exception.InvalidChatRequestException;
import tech.noetzold.gateway_api.model.ChatMessage;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationFormatterTest {

    private final ConversationFormatter formatter = new ConversationFormatter();

    @Test
    void singleQuestionIsSentAsIs() {
        assertThat(formatter.questionFrom(List.of(new ChatMessage("user", "  What is LIPITOR?  "))))
                .isEqualTo("What is LIPITOR?");
    }

    @Test
    void productNameIsNotAddedTwice() {
        List<ChatMessage> messages = List.of(
                new ChatMessage("user", "Tell me about LIPITOR"),
                new ChatMessage("assistant", "It lowers cholesterol."),
                new ChatMessage("user", "Is CRESTOR similar?"));

        assertThat(formatter.questionFrom(messages)).isEqualTo("Is CRESTOR similar?");
    }

    @Test
    void trailingAssistantMessageIsSkipped() {
        List<ChatMessage> messages = List.of(
                new ChatMessage("user", "Dosing for kids?"),
                new ChatMessage("assistant", "One moment."));

        assertThat(formatter.questionFrom(messages)).isEqualTo("Dosing for kids?");
    }

    @Test
    void emptyUserMessageIsRejected() {
        assertThatThrownBy(() -> formatter.questionFrom(List.of(new ChatMessage("user", " "))))
                .isInstanceOf(InvalidChatRequestException.class);
    }
}
