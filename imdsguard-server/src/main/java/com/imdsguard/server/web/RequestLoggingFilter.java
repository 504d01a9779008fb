package com.imdsguard.server.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Access log for every request the proxy sees, intercepted or forwarded. Request fields are also put in the MDC
 * for the duration of the request so handler log lines carry them.
 */
public class RequestLoggingFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

    static final String MDC_METHOD = "method";
    static final String MDC_PATH = "path";
    static final String MDC_REMOTE_ADDR = "remoteAddr";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String prevMethod = MDC.get(MDC_METHOD);
        String prevPath = MDC.get(MDC_PATH);
        String prevRemote = MDC.get(MDC_REMOTE_ADDR);
        long started = System.nanoTime();
        try {
            MDC.put(MDC_METHOD, request.getMethod());
            MDC.put(MDC_PATH, request.getRequestURI());
            MDC.put(MDC_REMOTE_ADDR, request.getRemoteAddr());
            chain.doFilter(request, response);
        } finally {
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;
            log.info(
                    "processed request: method={}, path={}, remoteAddr={}, status={}, durationMs={}",
                    request.getMethod(),
                    request.getRequestURI(),
                    request.getRemoteAddr(),
                    response.getStatus(),
                    elapsedMs);
            restore(MDC_METHOD, prevMethod);
            restore(MDC_PATH, prevPath);
            restore(MDC_REMOTE_ADDR, prevRemote);
        }
    }

    private static void restore(String key, String prev) {
        if (prev == null) MDC.remove(key);
        else MDC.put(key, prev);
    }
}
