package com.clientspaces.quotaservice.infrastructure.web;

import com.clientspaces.observability.CorrelationContext;
import com.clientspaces.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that propagates or generates a correlation ID for every HTTP request.
 *
 * <p>If the client sends {@code X-Correlation-ID} it is reused, otherwise a UUID is generated.
 * The ID is echoed in the response so end users can quote it to support. For tenant-scoped paths
 * ({@code /api/v1/tenants/{tenantId}/...}) the tenant is bound as well, so retry and denial logs
 * carry it in MDC.
 *
 * <p>The filter also runs on async dispatches. Controllers return futures, and the error handler
 * of the dispatch reads the same correlation ID from the request attribute.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    static final String CORRELATION_ID_ATTRIBUTE = CorrelationIdFilter.class.getName() + ".correlationId";

    private static final Pattern TENANT_PATH = Pattern.compile("^/api/v1/tenants/([^/]+)(/.*)?$");

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = (String) request.getAttribute(CORRELATION_ID_ATTRIBUTE);
        if (correlationId == null) {
            correlationId = request.getHeader(CORRELATION_ID_HEADER);
            if (correlationId == null || correlationId.isBlank()) {
                correlationId = UUID.randomUUID().toString();
            }
            request.setAttribute(CORRELATION_ID_ATTRIBUTE, correlationId);
            response.setHeader(CORRELATION_ID_HEADER, correlationId);
        }

        CorrelationContextHolder.set(new CorrelationContext(correlationId, tenantOf(request), null));
        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            CorrelationContextHolder.clear();
        }
    }

    static String tenantOf(HttpServletRequest request) {
        String path = request.getRequestURI();
        if (path == null) {
            return null;
        }
        Matcher matcher = TENANT_PATH.matcher(path.substring(request.getContextPath().length()));
        return matcher.matches() ? matcher.group(1) : null;
    }
}
