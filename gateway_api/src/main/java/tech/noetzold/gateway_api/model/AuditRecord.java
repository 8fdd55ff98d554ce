package tech.noetzold.gateway_api.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "gateway_audit", indexes = {
        @Index(name = "idx_gateway_audit_request_id", columnList = "request_id")
})
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "request_id", length = 120)
    private String requestId;

    @Column(name = "role", length = 120)
    private String role;

    @Column(name = "applied_role", length = 120, nullable = false)
    private String appliedRole;

    @Column(name = "allowed_count", nullable = false)
    private int allowedCount;

    // comma-separated, normalized view names
    @Column(name = "resources_used", columnDefinition = "text")
    private String resourcesUsed;

    @Column(name = "unauthorized_resources", columnDefinition = "text")
    private String unauthorizedResources;

    @Column(name = "decision", length = 20, nullable = false)
    private String decision; // ALLOW, DISCLAIM, DENY, ERROR

    @Column(name = "detail", columnDefinition = "text")
    private String detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
