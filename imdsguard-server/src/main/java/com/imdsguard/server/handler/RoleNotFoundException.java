package com.imdsguard.server.handler;

import com.imdsguard.server.guard.HandlerException;

public class RoleNotFoundException extends HandlerException {

    public RoleNotFoundException(String identity) {
        super(404, "no role associated with client", "no role for identity " + identity);
    }
}
