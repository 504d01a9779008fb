package com.imdsguard.server.handler;

import com.imdsguard.server.guard.HandlerException;

public class RoleForbiddenException extends HandlerException {

    public RoleForbiddenException(String identity, String requestedRole) {
        super(403, "role forbidden", "identity " + identity + " is not authorized for role " + requestedRole);
    }
}
