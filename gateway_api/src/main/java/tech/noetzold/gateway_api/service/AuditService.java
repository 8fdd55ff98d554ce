package tech.noetzold.gateway_api.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tech.noetzold.gateway_api.model.AuditRecord;
import tech.noetzold.gateway_api.repository.AuditRecordRepository;
import tech.noetzold.gateway_api.validation.ValidationOutcome;

import java.util.List;

/**
 * Append-only record of every settled gateway decision. Never throws: a failing log or
 * database write must not change what the caller receives.
 */
@Service
public class AuditService {

    private static final Logger logger = LoggerFactory.getLogger(AuditService.class);
    private static final int MAX_DETAIL = 2000;

    private final AuditRecordRepository auditRepo;

    public AuditService(AuditRecordRepository auditRepo) {
        this.auditRepo = auditRepo;
    }

    public void record(String requestId, ValidationOutcome outcome) {
        try {
            logDecision(requestId, outcome);
        } catch (Exception e) {
            logger.error("Audit log line failed for request {}: {}", requestId, e.getMessage());
        }

        try {
            auditRepo.save(AuditRecord.builder()
                    .requestId(requestId)
                    .role(outcome.role())
                    .appliedRole(outcome.appliedRole())
                    .allowedCount(outcome.allowedCount())
                    .resourcesUsed(String.join(",", outcome.resourcesUsed()))
                    .unauthorizedResources(String.join(",", outcome.unauthorizedResources()))
                    .decision(outcome.decision().name())
                    .detail(truncate(outcome.reason()))
                    .build());
        } catch (Exception e) {
            logger.error("Failed to persist audit record for request {}: {}", requestId, e.getMessage(), e);
        }
    }

    public List<AuditRecord> findByRequestId(String requestId) {
        return auditRepo.findByRequestIdOrderByCreatedAtAsc(requestId);
    }

    private void logDecision(String requestId, ValidationOutcome outcome) {
        switch (outcome.decision()) {
            case ALLOW -> logger.info("[AUDIT] request={} role={} applied={} allowed={} used={} decision=ALLOW{}",
                    requestId, outcome.role(), outcome.appliedRole(), outcome.allowedCount(),
                    outcome.resourcesUsed(), outcome.noAnswer() ? " (no answer)" : "");
            case DISCLAIM -> logger.warn("[AUDIT] request={} role={} applied={} allowed={} used={} unauthorized={} decision=DISCLAIM",
                    requestId, outcome.role(), outcome.appliedRole(), outcome.allowedCount(),
                    outcome.resourcesUsed(), outcome.unauthorizedResources());
            case DENY -> logger.warn("[AUDIT] request={} role={} applied={} allowed={} used={} unauthorized={} decision=DENY reason={}",
                    requestId, outcome.role(), outcome.appliedRole(), outcome.allowedCount(),
                    outcome.resourcesUsed(), outcome.unauthorizedResources(), outcome.reason());
            default -> logger.error("[AUDIT] request={} role={} applied={} allowed={} decision={} reason={}",
                    requestId, outcome.role(), outcome.appliedRole(), outcome.allowedCount(),
                    outcome.decision(), outcome.reason());
        }
    }

    private String truncate(String detail) {
        return detail != null ? detail.substring(0, Math.min(MAX_DETAIL, detail.length())) : null;
    }
}
