package com.imdsguard.server.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imdsguard.api.Credentials;
import com.imdsguard.api.CredentialsException;
import com.imdsguard.api.CredentialsProvider;
import com.imdsguard.server.guard.GuardedHandler;
import com.imdsguard.server.guard.HandlerException;
import com.imdsguard.server.guard.HandlerResult;
import java.time.Instant;

/**
 * Issues credentials for the role named in the path, after checking the caller is entitled to exactly that role.
 * The provider is never called for a role the caller does not hold.
 */
public class CredentialsHandler {

    public static final String NAME = "credentials";

    private final RoleAuthorizer authorizer;
    private final CredentialsProvider credentialsProvider;
    private final ObjectMapper objectMapper;

    public CredentialsHandler(
            RoleAuthorizer authorizer, CredentialsProvider credentialsProvider, ObjectMapper objectMapper) {
        this.authorizer = authorizer;
        this.credentialsProvider = credentialsProvider;
        this.objectMapper = objectMapper;
    }

    public GuardedHandler forRole(String requestedRole) {
        return context -> {
            String identity = context.identity();
            authorizer.requireRole(identity, requestedRole);
            Credentials credentials = fetch(context.deadline(), requestedRole);
            try {
                return HandlerResult.json(objectMapper.writeValueAsBytes(credentials));
            } catch (JsonProcessingException e) {
                throw new HandlerException(500, "internal error", "unable to serialize credentials", e);
            }
        };
    }

    private Credentials fetch(Instant deadline, String role) throws HandlerException {
        try {
            return credentialsProvider.credentialsForRole(deadline, role);
        } catch (CredentialsException e) {
            throw new HandlerException(
                    e.status(), e.getMessage(), "credentials provider failed for role " + role + ": " + e.getMessage(), e);
        }
    }
}
