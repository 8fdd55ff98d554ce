package tech.noetzold.gateway_api.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import tech.noetzold.gateway_api.policy.AccessPolicyProperties;

@Configuration
@EnableConfigurationProperties({QueryEngineProperties.class, AccessPolicyProperties.class})
public class GatewayConfig {
}
