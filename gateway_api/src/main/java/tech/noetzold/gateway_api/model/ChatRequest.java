package tech.noetzold.gateway_api.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatRequest {
    /** Caller-asserted role; not authenticated here. */
    @NotBlank
    private String role;
    @NotEmpty
    private List<@Valid ChatMessage> messages;
}
