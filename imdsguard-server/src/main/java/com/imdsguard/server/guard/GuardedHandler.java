package com.imdsguard.server.guard;

/**
 * Handler logic run inside {@link RequestLifecycleGuard}. Implementations never write to the response and never
 * manage their own deadline; they return a result or throw.
 */
@FunctionalInterface
public interface GuardedHandler {

    HandlerResult handle(HandlerContext context) throws HandlerException;
}
