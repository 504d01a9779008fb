package com.imdsguard.server.guard;

import com.imdsguard.server.identity.ClientIdentityResolver;
import com.imdsguard.server.identity.MalformedClientAddressException;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * What a guarded handler gets to see of its request: the caller identity and the deadline.
 *
 * <p>The identity is resolved on the request thread before the handler starts. A resolution failure is kept and
 * rethrown from {@link #identity()}, so handlers that do not need an identity (health) are unaffected by it.
 */
public final class HandlerContext {

    private final String identity;
    private final MalformedClientAddressException identityFailure;
    private final Instant deadline;

    private HandlerContext(String identity, MalformedClientAddressException identityFailure, Instant deadline) {
        this.identity = identity;
        this.identityFailure = identityFailure;
        this.deadline = deadline;
    }

    public static HandlerContext of(String identity, Instant deadline) {
        return new HandlerContext(identity, null, deadline);
    }

    static HandlerContext resolve(ClientIdentityResolver resolver, HttpServletRequest request, Instant deadline) {
        try {
            return new HandlerContext(resolver.resolve(request), null, deadline);
        } catch (MalformedClientAddressException e) {
            return new HandlerContext(null, e, deadline);
        }
    }

    public String identity() throws MalformedClientAddressException {
        if (identityFailure != null) {
            throw identityFailure;
        }
        return identity;
    }

    public Optional<String> resolvedIdentity() {
        return Optional.ofNullable(identity);
    }

    public Instant deadline() {
        return deadline;
    }

    /** Time left until the deadline, never negative. */
    public Duration remaining() {
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
