package tech.noetzold.gateway_api.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;
import tech.noetzold.gateway_api.client.QueryEngineClient;
import tech.noetzold.gateway_api.config.QueryEngineProperties;
import tech.noetzold.gateway_api.exception.EngineNotConfiguredException;
import tech.noetzold.gateway_api.exception.EngineResponseParseException;
import tech.noetzold.gateway_api.exception.EngineTransportException;
import tech.noetzold.gateway_api.exception.InvalidChatRequestException;
import tech.noetzold.gateway_api.exception.PolicyViolationException;
import tech.noetzold.gateway_api.model.ChatMessage;
import tech.noetzold.gateway_api.model.ChatRequest;
import tech.noetzold.gateway_api.model.ChatResponse;
import tech.noetzold.gateway_api.model.EngineResponse;
import tech.noetzold.gateway_api.policy.AccessPolicyProperties;
import tech.noetzold.gateway_api.policy.PolicyRegistry;
import tech.noetzold.gateway_api.validation.Decision;
import tech.noetzold.gateway_api.validation.DisclosureTransformer;
import tech.noetzold.gateway_api.validation.ResponseValidator;
import tech.noetzold.gateway_api.validation.ValidationOutcome;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatGatewayServiceTest {

    private QueryEngineClient engineClient;
    private AuditService auditService;
    private QueryEngineProperties props;
    private ChatGatewayService service;

    @BeforeEach
    void setUp() {
        AccessPolicyProperties policy = new AccessPolicyProperties();
        policy.setDefaultRole("patient");
        policy.setRoles(Map.of(
                "patient", Set.of("V1", "V2", "V3", "V4", "V5", "V6", "V7", "V8"),
                "physician", Set.of("V1", "V2", "V3", "V4", "V5", "V6", "V7", "V8", "V9")));
        PolicyRegistry registry = new PolicyRegistry(policy);

        props = new QueryEngineProperties();
        props.setUrl("http://engine:8008");
        props.setUsername("svc");
        props.setPassword("secret");
        props.setTimeout(Duration.ofSeconds(2));

        engineClient = mock(QueryEngineClient.class);
        auditService = mock(AuditService.class);
        service = new ChatGatewayService(engineClient, new ResponseValidator(registry, policy),
                new DisclosureTransformer(), auditService, registry, new ConversationFormatter(), props);
    }

    private static ChatRequest ask(String role, String question) {
        return new ChatRequest(role, List.of(new ChatMessage("user", question)));
    }

    private void engineReplies(String answer, String... tables) {
        when(engineClient.dispatch(anyString(), anyString()))
                .thenReturn(Mono.just(new EngineResponse(answer, List.of(tables), "SELECT *", 0.8, null)));
    }

    private ValidationOutcome audited() {
        ArgumentCaptor<ValidationOutcome> captor = ArgumentCaptor.forClass(ValidationOutcome.class);
        verify(auditService, times(1)).record(anyString(), captor.capture());
        return captor.getValue();
    }

    @Test
    void scenarioA_restrictedViewIsDeliveredWithAdvisory() {
        engineReplies("V9 contains boxed warnings", "V9");

        ChatResponse resp = service.chat(ask("patient", "What are the risks?"));

        assertThat(resp.getDecision()).isEqualTo("DISCLAIM");
        assertThat(resp.getMessage()).endsWith(DisclosureTransformer.ADVISORY_SUFFIX);
        assertThat(resp.getTablesUsed()).containsExactly("V9");
        assertThat(audited().unauthorizedResources()).containsExactly("V9");
    }

    @Test
    void scenarioB_noAnswerIsRewritten() {
        engineReplies("Sorry, I couldn't find an answer.");

        ChatResponse resp = service.chat(ask("patient", "What about unicorns?"));

        assertThat(resp.getDecision()).isEqualTo("ALLOW");
        assertThat(resp.getMessage()).isEqualTo(DisclosureTransformer.NO_ANSWER_MESSAGE);
        assertThat(resp.getTablesUsed()).isEmpty();
        assertThat(audited().noAnswer()).isTrue();
    }

    @Test
    void scenarioC_answerWithoutProvenanceIsDenied() {
        engineReplies("V3 states that...");

        assertThatThrownBy(() -> service.chat(ask("patient", "What does V3 say?")))
                .isInstanceOf(PolicyViolationException.class);
        assertThat(audited().decision()).isEqualTo(Decision.DENY);
    }

    @Test
    void answerThatOnlyMentionsMissingDataIsStillDenied() {
        engineReplies("V5 reports no data suggesting harm in pregnancy, and the usual dose is 10mg.");

        assertThatThrownBy(() -> service.chat(ask("patient", "Is it safe in pregnancy?")))
                .isInstanceOf(PolicyViolationException.class);
        ValidationOutcome outcome = audited();
        assertThat(outcome.decision()).isEqualTo(Decision.DENY);
        assertThat(outcome.noAnswer()).isFalse();
    }

    @Test
    void scenarioD_unrestrictedRolePassesThrough() {
        engineReplies("Take with food", "V1", "V4");

        ChatResponse resp = service.chat(ask("physician", "How do I take it?"));

        assertThat(resp.getDecision()).isEqualTo("ALLOW");
        assertThat(resp.getMessage()).isEqualTo("Take with food");
        assertThat(resp.getTablesUsed()).containsExactly("V1", "V4");
        assertThat(resp.getSqlQuery()).isEqualTo("SELECT *");
        assertThat(audited().decision()).isEqualTo(Decision.ALLOW);
    }

    @Test
    void transportFailureIsAuditedAsError() {
        when(engineClient.dispatch(anyString(), anyString()))
                .thenReturn(Mono.error(new EngineTransportException(500, "boom")));

        assertThatThrownBy(() -> service.chat(ask("patient", "q")))
                .isInstanceOf(EngineTransportException.class);
        assertThat(audited().decision()).isEqualTo(Decision.ERROR);
    }

    @Test
    void parseFailureIsAuditedAsError() {
        when(engineClient.dispatch(anyString(), anyString()))
                .thenReturn(Mono.error(new EngineResponseParseException("bad json", null)));

        assertThatThrownBy(() -> service.chat(ask("patient", "q")))
                .isInstanceOf(EngineResponseParseException.class);
        assertThat(audited().decision()).isEqualTo(Decision.ERROR);
    }

    @Test
    void silentEngineTimesOutAsErrorNeverAllow() {
        props.setTimeout(Duration.ofMillis(100));
        when(engineClient.dispatch(anyString(), anyString())).thenReturn(Mono.never());

        assertThatThrownBy(() -> service.chat(ask("patient", "q")))
                .isInstanceOf(EngineTransportException.class)
                .hasMessageContaining("timed out");
        assertThat(audited().decision()).isEqualTo(Decision.ERROR);
    }

    @Test
    void unconfiguredEngineIsNeverCalled() {
        props.setPassword("");

        assertThatThrownBy(() -> service.chat(ask("patient", "q")))
                .isInstanceOf(EngineNotConfiguredException.class)
                .hasMessageContaining("not configured");
        verify(engineClient, never()).dispatch(anyString(), anyString());
        verify(auditService, never()).record(anyString(), any());
    }

    @Test
    void requestWithoutUserMessageIsRejected() {
        ChatRequest req = new ChatRequest("patient", List.of(new ChatMessage("assistant", "Hello!")));

        assertThatThrownBy(() -> service.chat(req)).isInstanceOf(InvalidChatRequestException.class);
        verify(engineClient, never()).dispatch(anyString(), anyString());
    }

    @Test
    void followUpQuestionCarriesProductName() {
        engineReplies("Take with food", "V1");
        ChatRequest req = new ChatRequest("patient", List.of(
                new ChatMessage("user", "What is SYMBICORT used for?"),
                new ChatMessage("assistant", "It treats asthma."),
                new ChatMessage("user", "How should it be stored?")));

        service.chat(req);

        verify(engineClient).dispatch(eq("How should it be stored? for SYMBICORT"), eq("patient"));
    }
}
