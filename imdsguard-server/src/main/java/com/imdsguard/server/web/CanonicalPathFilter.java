package com.imdsguard.server.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Redirects every request whose raw path is not in canonical form to the canonical path, before any mapping sees
 * it. Routing and forwarding both work on the raw path, so only canonical paths may reach them: otherwise
 * {@code /latest/meta-data/iam/./security-credentials/} would miss the intercepted mappings and reach the real
 * endpoint.
 *
 * <p>Canonical form: no empty segments, no {@code .} or {@code ..} segments (plain or percent-encoded), no
 * {@code ;} path parameters. A trailing slash is kept.
 */
@Slf4j
public class CanonicalPathFilter extends OncePerRequestFilter implements Ordered {

    public static final int ORDER = Ordered.HIGHEST_PRECEDENCE + 10;

    @Override
    public int getOrder() {
        return ORDER;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String raw = request.getRequestURI();
        String canonical = canonicalPath(raw);
        if (raw == null || raw.equals(canonical)) {
            chain.doFilter(request, response);
            return;
        }
        String query = request.getQueryString();
        String location = query != null ? canonical + "?" + query : canonical;
        log.warn("Redirecting non-canonical path: method={}, path={}, location={}", request.getMethod(), raw, location);
        response.setStatus(HttpServletResponse.SC_MOVED_PERMANENTLY);
        response.setHeader("Location", location);
        response.setContentLength(0);
    }

    static String canonicalPath(String rawPath) {
        if (rawPath == null || rawPath.isEmpty()) {
            return "/";
        }
        String[] segments = rawPath.split("/", -1);
        Deque<String> kept = new ArrayDeque<>();
        boolean trailingSlash = false;
        for (int i = 0; i < segments.length; i++) {
            String segment = stripParameters(segments[i]);
            boolean last = i == segments.length - 1;
            if (segment.isEmpty()) {
                trailingSlash = last && i > 0;
                continue;
            }
            String dots = dotSegment(segment);
            if (".".equals(dots)) {
                trailingSlash = false;
            } else if ("..".equals(dots)) {
                kept.pollLast();
                trailingSlash = false;
            } else {
                kept.addLast(segment);
                trailingSlash = false;
            }
        }
        if (kept.isEmpty()) {
            return "/";
        }
        StringBuilder path = new StringBuilder();
        for (String segment : kept) {
            path.append('/').append(segment);
        }
        if (trailingSlash) {
            path.append('/');
        }
        return path.toString();
    }

    private static String stripParameters(String segment) {
        int semicolon = segment.indexOf(';');
        return semicolon < 0 ? segment : segment.substring(0, semicolon);
    }

    /** {@code "."} or {@code ".."} when the segment decodes to one, the segment itself otherwise. */
    private static String dotSegment(String segment) {
        String decoded = segment.toLowerCase(Locale.ROOT).replace("%2e", ".");
        return ".".equals(decoded) || "..".equals(decoded) ? decoded : segment;
    }
}
