package com.imdsguard.server.handler;

import com.imdsguard.server.guard.GuardedHandler;
import com.imdsguard.server.guard.HandlerContext;
import com.imdsguard.server.guard.HandlerException;
import com.imdsguard.server.guard.HandlerResult;

/** Answers the role-listing path with the one role the caller may use. */
public class RoleHandler implements GuardedHandler {

    public static final String NAME = "roleName";

    private final RoleAuthorizer authorizer;

    public RoleHandler(RoleAuthorizer authorizer) {
        this.authorizer = authorizer;
    }

    @Override
    public HandlerResult handle(HandlerContext context) throws HandlerException {
        String identity = context.identity();
        String role = authorizer.authorizedRole(identity).orElseThrow(() -> new RoleNotFoundException(identity));
        return HandlerResult.text(role);
    }
}
