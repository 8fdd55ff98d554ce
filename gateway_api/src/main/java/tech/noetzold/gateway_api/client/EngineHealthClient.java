package tech.noetzold.gateway_api.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import tech.noetzold.gateway_api.config.QueryEngineProperties;

@Service
public class EngineHealthClient {

    private static final Logger logger = LoggerFactory.getLogger(EngineHealthClient.class);

    private final RestTemplate restTemplate;
    private final QueryEngineProperties props;

    public EngineHealthClient(@Qualifier("engineProbeRestTemplate") RestTemplate restTemplate,
                              QueryEngineProperties props) {
        this.restTemplate = restTemplate;
        this.props = props;
    }

    public boolean isConfigured() {
        return props.isConfigured();
    }

    public boolean isReachable() {
        if (!props.isConfigured()) {
            return false;
        }
        try {
            ResponseEntity<String> resp = restTemplate.getForEntity(props.baseUrl() + "/docs", String.class);
            return resp.getStatusCode().is2xxSuccessful();
        } catch (RestClientException e) {
            logger.warn("Query engine connection test failed: {}", e.getMessage());
            return false;
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void testConnectionOnStartup() {
        if (!props.isConfigured()) {
            logger.info("Query engine not configured; chat requests will be answered with 503");
            return;
        }
        if (isReachable()) {
            logger.info("Connected to query engine at {}", props.baseUrl());
        } else {
            logger.warn("Query engine at {} is not reachable yet", props.baseUrl());
        }
    }
}
