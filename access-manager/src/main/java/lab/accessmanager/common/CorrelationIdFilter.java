package lab.accessmanager.common;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

@Component
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CALLER_HEADER = "X-Caller";
    public static final String MDC_CORRELATION_ID_KEY = "correlationId";
    public static final String MDC_CALLER_KEY = "caller";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String correlationId = resolveCorrelationId(request.getHeader(CORRELATION_ID_HEADER));
        MDC.put(MDC_CORRELATION_ID_KEY, correlationId);
        MDC.put(MDC_CALLER_KEY, resolveCaller(request.getHeader(CALLER_HEADER)));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_CORRELATION_ID_KEY);
            MDC.remove(MDC_CALLER_KEY);
        }
    }

    private String resolveCorrelationId(String incoming) {
        if (incoming == null) {
            return UUID.randomUUID().toString();
        }
        String trimmed = incoming.trim();
        return trimmed.isEmpty() ? UUID.randomUUID().toString() : trimmed;
    }

    // The header is only echoed into logs here; controllers validate it before it reaches the manager.
    private String resolveCaller(String incoming) {
        if (incoming == null || incoming.isBlank()) {
            return "anonymous";
        }
        return incoming.trim();
    }
}
