package com.imdsguard.server.web;

import com.imdsguard.server.guard.RequestLifecycleGuard;
import com.imdsguard.server.handler.CredentialsHandler;
import com.imdsguard.server.handler.RoleHandler;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * The intercepted credential paths. Mapped for every HTTP method so no method can slip a credentials path past
 * the proxy to the real endpoint.
 *
 * <p>The listing mapping is more specific than the credentials mappings ({@code {role}} never matches an empty
 * segment), and both are more specific than the passthrough catch-all.
 */
@RestController
public class SecurityCredentialsController {

    static final String SECURITY_CREDENTIALS = "/{version}/meta-data/iam/security-credentials/";

    private final RequestLifecycleGuard guard;
    private final RoleHandler roleHandler;
    private final CredentialsHandler credentialsHandler;

    public SecurityCredentialsController(
            RequestLifecycleGuard guard, RoleHandler roleHandler, CredentialsHandler credentialsHandler) {
        this.guard = guard;
        this.roleHandler = roleHandler;
        this.credentialsHandler = credentialsHandler;
    }

    @RequestMapping(SECURITY_CREDENTIALS)
    public void roleName(HttpServletRequest request, HttpServletResponse response) throws IOException {
        guard.execute(RoleHandler.NAME, request, response, roleHandler);
    }

    @RequestMapping({SECURITY_CREDENTIALS + "{role}", SECURITY_CREDENTIALS + "{role}/{*rest}"})
    public void credentials(
            @PathVariable("role") String role,
            @PathVariable(name = "rest", required = false) String rest,
            HttpServletRequest request,
            HttpServletResponse response)
            throws IOException {
        guard.execute(CredentialsHandler.NAME, request, response, credentialsHandler.forRole(requestedRole(role, rest)));
    }

    /** Role names may span segments; the whole remainder of the path is the requested role. */
    static String requestedRole(String role, String rest) {
        return rest == null || rest.isEmpty() ? role : role + rest;
    }
}
