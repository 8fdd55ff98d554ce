package tech.noetzold.gateway_api.controller;

import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.gateway_api.client.EngineHealthClient;
import tech.noetzold.gateway_api.model.*;
import tech.noetzold.gateway_api.service.AuditService;
import tech.noetzold.gateway_api.service.ChatGatewayService;

import java.util.List;

@RestController
@RequestMapping("/api")
public class ChatController {

    private final ChatGatewayService chatService;
    private final EngineHealthClient healthClient;
    private final AuditService auditService;

    public ChatController(ChatGatewayService chatService,
                          EngineHealthClient healthClient,
                          AuditService auditService) {
        this.chatService = chatService;
        this.healthClient = healthClient;
        this.auditService = auditService;
    }

    @PostMapping("/chat")
    public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest req) {
        return ResponseEntity.ok(chatService.chat(req));
    }

    @GetMapping("/chat/health")
    public EngineHealthResponse health() {
        return new EngineHealthResponse(healthClient.isConfigured(), healthClient.isReachable());
    }

    @GetMapping("/audit")
    public ResponseEntity<List<AuditRecordResponse>> getAuditByRequestId(@RequestParam("request_id") String requestId) {
        List<AuditRecordResponse> records = auditService.findByRequestId(requestId).stream()
                .map(AuditRecordResponse::fromEntity)
                .toList();
        if (records.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(records);
    }
}
