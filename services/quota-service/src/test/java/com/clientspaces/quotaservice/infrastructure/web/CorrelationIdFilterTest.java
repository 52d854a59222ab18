package com.clientspaces.quotaservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.clientspaces.observability.CorrelationContext;
import com.clientspaces.observability.CorrelationContextHolder;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    private static FilterChain capturing(AtomicReference<CorrelationContext> captured) {
        return (req, resp) -> captured.set(CorrelationContextHolder.get().orElse(null));
    }

    @Test
    @DisplayName("generates correlation ID when none provided")
    void generatesCorrelationIdWhenNoneProvided() throws Exception {
        var response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest(), response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID")).isNotBlank();
    }

    @Test
    @DisplayName("propagates existing correlation ID from header")
    void propagatesExistingCorrelationId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "test-abc-123");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID")).isEqualTo("test-abc-123");
    }

    @Test
    @DisplayName("binds the tenant from a tenant-scoped path")
    void bindsTenantFromPath() throws Exception {
        var captured = new AtomicReference<CorrelationContext>();
        var request = new MockHttpServletRequest("POST", "/api/v1/tenants/acme/assistant/messages");
        request.addHeader("X-Correlation-ID", "during-chain-123");

        filter.doFilter(request, new MockHttpServletResponse(), capturing(captured));

        assertThat(captured.get().correlationId()).isEqualTo("during-chain-123");
        assertThat(captured.get().tenantId()).isEqualTo("acme");
    }

    @Test
    @DisplayName("leaves the tenant empty outside tenant paths")
    void noTenantOutsideTenantPaths() throws Exception {
        var captured = new AtomicReference<CorrelationContext>();

        filter.doFilter(
                new MockHttpServletRequest("GET", "/actuator/health"),
                new MockHttpServletResponse(),
                capturing(captured));

        assertThat(captured.get().tenantId()).isNull();
    }

    @Test
    @DisplayName("reuses the generated ID on the async dispatch of the same request")
    void reusesIdOnAsyncDispatch() throws Exception {
        var request = new MockHttpServletRequest("POST", "/api/v1/tenants/acme/client-spaces");
        var response = new MockHttpServletResponse();
        filter.doFilter(request, response, (req, resp) -> {});
        String generated = response.getHeader("X-Correlation-ID");

        var captured = new AtomicReference<CorrelationContext>();
        request.setDispatcherType(DispatcherType.ASYNC);
        filter.doFilter(request, response, capturing(captured));

        assertThat(captured.get().correlationId()).isEqualTo(generated);
    }

    @Test
    @DisplayName("clears CorrelationContextHolder after request completes")
    void clearsCorrelationContextAfterRequest() throws Exception {
        filter.doFilter(new MockHttpServletRequest(), new MockHttpServletResponse(), (req, resp) -> {});

        assertThat(CorrelationContextHolder.get()).isEmpty();
    }
}
