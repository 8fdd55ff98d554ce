package tech.noetzold.gateway_api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/** Connection to the natural-language query engine. Prefix: {@code query.engine}. */
@Data
@ConfigurationProperties(prefix = "query.engine")
public class QueryEngineProperties {

    private String url;

    /** Shared by every role; the engine sees the same principal for all callers. */
    private String username;

    private String password;

    /** Virtual database the engine should query; also qualifies the resource hint. */
    private String database;

    private Duration connectTimeout = Duration.ofSeconds(5);

    /** Upper bound for one answerQuestion call, including the response body. */
    private Duration timeout = Duration.ofSeconds(60);

    private String modelLabel = "Query engine";

    public boolean isConfigured() {
        return hasText(url) && hasText(username) && hasText(password);
    }

    /** Base URL without a trailing slash. */
    public String baseUrl() {
        if (url == null) {
            return "";
        }
        return url.replaceAll("/+$", "");
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
