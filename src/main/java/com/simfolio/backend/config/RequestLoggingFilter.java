package com.simfolio.backend.config;

import com.simfolio.backend.dto.ApiError;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Access log. Runs inside {@link RequestCorrelationFilter}, so the request ids and the acting
 * user are still in the MDC. Trade submissions get an audit line with their outcome.
 */
@Component
@Slf4j
@Order(Ordered.LOWEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {

    static final String TRADES_PATH = "/api/trades";

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        long start = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            String user = MDC.get("userId") == null ? "-" : MDC.get("userId");
            if (isTradeSubmission(request)) {
                Object errorCode = request.getAttribute(ApiError.ERROR_CODE_ATTRIBUTE);
                log.info("Trade {} user={} status={} errorCode={} ({} ms)", tradeOutcome(response.getStatus()),
                        user, response.getStatus(), errorCode == null ? "-" : errorCode, durationMs);
            } else {
                log.info("HTTP {} {} user={} -> {} ({} ms)", request.getMethod(), request.getRequestURI(), user,
                        response.getStatus(), durationMs);
            }
        }
    }

    static boolean isTradeSubmission(HttpServletRequest request) {
        return HttpMethod.POST.matches(request.getMethod()) && TRADES_PATH.equals(request.getRequestURI());
    }

    static String tradeOutcome(int status) {
        if (status >= 200 && status < 300) {
            return "ACCEPTED";
        }
        if (status >= 400 && status < 500) {
            return "REJECTED";
        }
        return "FAILED";
    }
}
