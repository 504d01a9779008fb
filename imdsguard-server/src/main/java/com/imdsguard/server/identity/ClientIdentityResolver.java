package com.imdsguard.server.identity;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Derives the calling workload's identity from connection metadata. Pure parsing, no network I/O.
 *
 * <p>Address parsing accepts two forms:
 *
 * <ul>
 *   <li>{@code [host]:port}, the bracketed literal form; the identity is {@code host} without brackets.
 *   <li>{@code host:port}; the port is whatever follows the <em>last</em> colon, so an unbracketed IPv6 address
 *       such as {@code ::1:8080} resolves to {@code ::1}.
 * </ul>
 *
 * Anything without a colon, with an empty host, or with a non-numeric port is rejected.
 */
public class ClientIdentityResolver {

    /** Request parameter that overrides the identity when {@code allowIpQuery} is on. */
    public static final String OVERRIDE_PARAMETER = "ip";

    private final boolean allowIpQuery;

    public ClientIdentityResolver(boolean allowIpQuery) {
        this.allowIpQuery = allowIpQuery;
    }

    public String resolve(HttpServletRequest request) throws MalformedClientAddressException {
        if (allowIpQuery) {
            String override = request.getParameter(OVERRIDE_PARAMETER);
            if (override != null && !override.isEmpty()) {
                return override;
            }
        }
        return parseClientAddress(remoteAddress(request));
    }

    public static String parseClientAddress(String address) throws MalformedClientAddressException {
        if (address == null) {
            throw new MalformedClientAddressException(null);
        }
        String host;
        String port;
        if (address.startsWith("[")) {
            int close = address.indexOf(']');
            if (close < 0 || close + 1 >= address.length() || address.charAt(close + 1) != ':') {
                throw new MalformedClientAddressException(address);
            }
            host = address.substring(1, close);
            port = address.substring(close + 2);
        } else {
            int colon = address.lastIndexOf(':');
            if (colon < 0) {
                throw new MalformedClientAddressException(address);
            }
            host = address.substring(0, colon);
            port = address.substring(colon + 1);
        }
        if (host.isEmpty() || !isNumeric(port)) {
            throw new MalformedClientAddressException(address);
        }
        return host;
    }

    /** Servlet containers report host and port separately; rebuild the {@code address:port} form. */
    static String remoteAddress(HttpServletRequest request) {
        String host = request.getRemoteAddr();
        if (host == null || host.isEmpty()) {
            return host;
        }
        if (host.indexOf(':') >= 0 && !host.startsWith("[")) {
            host = "[" + host + "]";
        }
        return host + ":" + request.getRemotePort();
    }

    private static boolean isNumeric(String port) {
        if (port.isEmpty()) {
            return false;
        }
        for (int i = 0; i < port.length(); i++) {
            char c = port.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
