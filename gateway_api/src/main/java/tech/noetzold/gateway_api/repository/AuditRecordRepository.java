package tech.noetzold.gateway_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.noetzold.gateway_api.model.AuditRecord;

import java.util.List;

public interface AuditRecordRepository extends JpaRepository<AuditRecord, Long> {
    List<AuditRecord> findByRequestIdOrderByCreatedAtAsc(String requestId);
}
