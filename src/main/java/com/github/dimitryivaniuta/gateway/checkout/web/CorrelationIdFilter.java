package com.github.dimitryivaniuta.gateway.checkout.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags every request with a correlation id, in the MDC and on the response.
 *
 * <p>Storefront calls usually send {@code X-Correlation-Id}; some proxies only set {@code X-Request-Id}.
 * Payers coming back from the hosted invoice page send neither, so their confirmation gets a fresh id.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

    static final String REQUEST_ID_HEADER = "X-Request-Id";

    public static final String MDC_KEY = "correlationId";

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    /**
     * Correlation id of the request being handled on this thread.
     *
     * @return id, or null outside a request
     */
    public static String current() {
        return MDC.get(MDC_KEY);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String correlationId = Stream.of(request.getHeader(CORRELATION_ID_HEADER), request.getHeader(REQUEST_ID_HEADER))
                .filter(v -> v != null && SAFE_ID.matcher(v).matches())
                .findFirst()
                .orElseGet(() -> UUID.randomUUID().toString());

        MDC.put(MDC_KEY, correlationId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }
}
