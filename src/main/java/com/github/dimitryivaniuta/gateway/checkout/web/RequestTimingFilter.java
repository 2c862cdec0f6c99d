package com.github.dimitryivaniuta.gateway.checkout.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * One access-log line per API call. Server errors are logged at WARN.
 *
 * <p>The query string is never logged: on the confirmation endpoint it carries the checkout token.</p>
 */
@Slf4j
@Component
public class RequestTimingFilter extends OncePerRequestFilter {

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {
        long started = System.nanoTime();
        try {
            chain.doFilter(req, res);
        } finally {
            long ms = (System.nanoTime() - started) / 1_000_000;
            if (res.getStatus() >= 500) {
                log.warn("HTTP {} {} -> {} in {}ms", req.getMethod(), req.getRequestURI(), res.getStatus(), ms);
            } else {
                log.info("HTTP {} {} -> {} in {}ms", req.getMethod(), req.getRequestURI(), res.getStatus(), ms);
            }
        }
    }
}
