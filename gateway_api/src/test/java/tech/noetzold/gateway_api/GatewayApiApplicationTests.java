package tech.noetzold.gateway_api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import tech.noetzold.gateway_api.model.ChatMessage;
import tech.noetzold.gateway_api.model.ChatRequest;
import tech.noetzold.gateway_api.exception.EngineNotConfiguredException;
import tech.noetzold.gateway_api.policy.PolicyRegistry;
import tech.noetzold.gateway_api.service.ChatGatewayService;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class GatewayApiApplicationTests {

    @Autowired
    private PolicyRegistry policyRegistry;

    @Autowired
    private ChatGatewayService chatService;

    @Test
    void policyIsBoundFromConfiguration() {
        assertThat(policyRegistry.allowedResources("patient")).hasSize(8).doesNotContain("V9");
        assertThat(policyRegistry.allowedResources("physician")).contains("V9");
        assertThat(policyRegistry.getFallbackRole()).isEqualTo("patient");
    }

    @Test
    void chatWithoutEngineConfigurationIsRefused() {
        ChatRequest req = new ChatRequest("patient", List.of(new ChatMessage("user", "What is LIPITOR?")));

        assertThatThrownBy(() -> chatService.chat(req)).isInstanceOf(EngineNotConfiguredException.class);
    }
}
