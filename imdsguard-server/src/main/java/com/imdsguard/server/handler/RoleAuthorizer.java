package com.imdsguard.server.handler;

import com.imdsguard.api.RoleFinder;
import com.imdsguard.api.RoleLookupException;
import com.imdsguard.server.guard.HandlerException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;

/** Role decisions on top of {@link RoleFinder}, shared by the role-listing and credentials handlers. */
@RequiredArgsConstructor
public class RoleAuthorizer {

    private final RoleFinder roleFinder;

    public Optional<String> authorizedRole(String identity) throws HandlerException {
        try {
            return roleFinder.findRoleForIdentity(identity).filter(role -> !role.isEmpty());
        } catch (RoleLookupException e) {
            throw new HandlerException(500, "role lookup failed", "role lookup failed for " + identity, e);
        }
    }

    /** Passes only when the authorized role equals {@code requestedRole} exactly, case included. */
    public void requireRole(String identity, String requestedRole) throws HandlerException {
        Optional<String> authorized = authorizedRole(identity);
        if (authorized.isEmpty() || !authorized.get().equals(requestedRole)) {
            throw new RoleForbiddenException(identity, requestedRole);
        }
    }
}
