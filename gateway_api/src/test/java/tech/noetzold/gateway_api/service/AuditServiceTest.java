package tech.noetzold.gateway_api.service;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import tech.noetzold.gateway_api.model.AuditRecord;
import tech.noetzold.gateway_api.repository.AuditRecordRepository;
import tech.noetzold.gateway_api.validation.Decision;
import tech.noetzold.gateway_api.validation.ValidationOutcome;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AuditServiceTest {

    private final AuditRecordRepository repo = mock(AuditRecordRepository.class);
    private final AuditService auditService = new AuditService(repo);

    private static ValidationOutcome disclaimed() {
        return new ValidationOutcome(Decision.DISCLAIM, "patient", "patient", 8, "V9 contains...",
                List.of("V1", "V9"), List.of("V9"), false, null, null, null);
    }

    @Test
    void persistsOneRecordPerDecision() {
        auditService.record("req_1", disclaimed());

        ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
        verify(repo).save(captor.capture());
        AuditRecord saved = captor.getValue();
        assertThat(saved.getRequestId()).isEqualTo("req_1");
        assertThat(saved.getRole()).isEqualTo("patient");
        assertThat(saved.getAllowedCount()).isEqualTo(8);
        assertThat(saved.getResourcesUsed()).isEqualTo("V1,V9");
        assertThat(saved.getUnauthorizedResources()).isEqualTo("V9");
        assertThat(saved.getDecision()).isEqualTo("DISCLAIM");
    }

    @Test
    void storageFailureNeverReachesTheCaller() {
        when(repo.save(any(AuditRecord.class))).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatCode(() -> auditService.record("req_2", disclaimed())).doesNotThrowAnyException();
    }
}
