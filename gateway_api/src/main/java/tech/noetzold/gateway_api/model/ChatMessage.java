package tech.noetzold.gateway_api.model;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatMessage {
    @NotNull
    @Pattern(regexp = "user|assistant", message = "must be 'user' or 'assistant'")
    private String role;
    @NotNull
    private String content;
}
