package tech.noetzold.gateway_api;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import tech.noetzold.gateway_api.config.QueryEngineProperties;

import java.time.Duration;

@Configuration
public class RestConfig {

    // short probe client for connection tests; answerQuestion calls go through engineWebClient
    @Bean
    public RestTemplate engineProbeRestTemplate(RestTemplateBuilder builder, QueryEngineProperties props) {
        RestTemplateBuilder configured = builder
                .setConnectTimeout(props.getConnectTimeout())
                .setReadTimeout(Duration.ofSeconds(5))
                .additionalInterceptors((request, body, execution) -> {
                    request.getHeaders().add("X-Gateway", "gateway_api");
                    return execution.execute(request, body);
                });
        if (props.isConfigured()) {
            configured = configured.basicAuthentication(props.getUsername(), props.getPassword());
        }
        return configured.build();
    }
}
