package tech.noetzold.gateway_api;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Tags every request with an id ({@code X-Request-Id} if the caller sent a sane one),
 * exposes it to logging as MDC {@code trace_id} and echoes it back.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestTraceFilter implements Filter {

    public static final String MDC_KEY = "trace_id";
    public static final String HEADER = "X-Request-Id";

    private static final Logger logger = LoggerFactory.getLogger(RequestTraceFilter.class);

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) req;
        HttpServletResponse httpResponse = (HttpServletResponse) res;

        String requestId = resolveRequestId(httpRequest.getHeader(HEADER));
        long startTime = System.currentTimeMillis();

        MDC.put(MDC_KEY, requestId);
        httpResponse.setHeader(HEADER, requestId);
        try {
            chain.doFilter(req, res);
        } finally {
            logger.info("{} {} from {} -> {} in {}ms",
                    httpRequest.getMethod(), httpRequest.getRequestURI(), getClientIpAddress(httpRequest),
                    httpResponse.getStatus(), System.currentTimeMillis() - startTime);
            MDC.remove(MDC_KEY);
        }
    }

    public static String generateRequestId() {
        return "req_" + System.currentTimeMillis() + "_" +
                Integer.toHexString(ThreadLocalRandom.current().nextInt(0x10000));
    }

    private String resolveRequestId(String header) {
        if (header != null && header.matches("[A-Za-z0-9_\\-]{1,100}")) {
            return header;
        }
        return generateRequestId();
    }

    private String getClientIpAddress(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }

        String xRealIp = request.getHeader("X-Real-IP");
        if (xRealIp != null && !xRealIp.isEmpty()) {
            return xRealIp;
        }

        return request.getRemoteAddr();
    }
}
