package tech.noetzold.gateway_api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatResponse {
    private String message;
    private List<String> tablesUsed;
    private String sqlQuery;
    private String decision;      // ALLOW or DISCLAIM
    private String model;
    private double responseTime;  // seconds
    private String source;
}
