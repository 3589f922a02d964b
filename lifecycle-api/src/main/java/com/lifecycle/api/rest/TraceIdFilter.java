package com.lifecycle.api.rest;

import com.lifecycle.engine.logging.LoggingContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Puts a trace ID in the logging context for each request and echoes it
 * back in the response.
 */
@Component
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String TRACE_HEADER = "X-Trace-Id";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        LoggingContext.startTrace(request.getHeader(TRACE_HEADER));
        response.setHeader(TRACE_HEADER, LoggingContext.getTraceId());
        try {
            filterChain.doFilter(request, response);
        } finally {
            LoggingContext.clearAll();
        }
    }
}
