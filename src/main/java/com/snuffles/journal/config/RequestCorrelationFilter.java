package com.snuffles.journal.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

@Component
public class RequestCorrelationFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String header = request.getHeader(CORRELATION_ID_HEADER);
        String correlationId = (header == null || header.isBlank()) ? UUID.randomUUID().toString() : header;
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        try (CorrelationScope ignored = CorrelationScope.open(correlationId)) {
            filterChain.doFilter(request, response);
        }
    }
}
