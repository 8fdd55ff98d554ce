package tech.noetzold.gateway_api.model;

import lombok.*;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditRecordResponse {
    private String request_id;
    private String role;
    private String applied_role;
    private int allowed_count;
    private List<String> resources_used;
    private List<String> unauthorized_resources;
    private String decision;
    private String detail;
    private Instant created_at;

    public static AuditRecordResponse fromEntity(AuditRecord e) {
        return AuditRecordResponse.builder()
                .request_id(e.getRequestId())
                .role(e.getRole())
                .applied_role(e.getAppliedRole())
                .allowed_count(e.getAllowedCount())
                .resources_used(split(e.getResourcesUsed()))
                .unauthorized_resources(split(e.getUnauthorizedResources()))
                .decision(e.getDecision())
                .detail(e.getDetail())
                .created_at(e.getCreatedAt())
                .build();
    }

    private static List<String> split(String joined) {
        if (joined == null || joined.isBlank()) {
            return List.of();
        }
        return Arrays.stream(joined.split(",")).map(String::trim).toList();
    }
}
