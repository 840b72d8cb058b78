package com.penny.ledger.web;

import com.penny.ledger.config.PennyProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags every request with a trace id. A caller-supplied id is reused when it looks like an id;
 * anything else is replaced so it never reaches the logs verbatim.
 */
@Component
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String MDC_KEY = "trace_id";

    private static final Logger log = LoggerFactory.getLogger(TraceIdFilter.class);
    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    private final String header;

    public TraceIdFilter(PennyProperties properties) {
        this.header = properties.trace().header();
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String traceId = resolveTraceId(request.getHeader(header));
        RequestContextHolder.set(new RequestContextHolder.RequestContext(traceId, request.getMethod(), request.getRequestURI()));
        MDC.put(MDC_KEY, traceId);
        response.setHeader(header, traceId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            log.debug("{} {} -> {}", request.getMethod(), request.getRequestURI(), response.getStatus());
            MDC.remove(MDC_KEY);
            RequestContextHolder.clear();
        }
    }

    static String resolveTraceId(String incoming) {
        if (incoming != null && ACCEPTED_ID.matcher(incoming).matches()) {
            return incoming;
        }
        return UUID.randomUUID().toString();
    }
}
