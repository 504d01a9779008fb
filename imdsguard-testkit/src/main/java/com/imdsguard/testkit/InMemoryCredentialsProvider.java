package com.imdsguard.testkit;

import com.imdsguard.api.Credentials;
import com.imdsguard.api.CredentialsException;
import com.imdsguard.api.CredentialsProvider;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Test double that hands out fixed credentials per role and records every role it was asked for.
 *
 * <p>Roles without registered credentials fail with a 500 {@link CredentialsException}. A configured delay is
 * slept before answering, which lets tests drive the caller past its deadline.
 */
public class InMemoryCredentialsProvider implements CredentialsProvider {
    private final Map<String, Credentials> credentials = new ConcurrentHashMap<>();
    private final List<String> requestedRoles = Collections.synchronizedList(new ArrayList<>());
    private volatile Duration delay = Duration.ZERO;
    private volatile CredentialsException failure;

    public InMemoryCredentialsProvider register(String role, Credentials value) {
        credentials.put(role, value);
        return this;
    }

    public InMemoryCredentialsProvider delay(Duration delay) {
        this.delay = delay;
        return this;
    }

    public InMemoryCredentialsProvider failWith(CredentialsException failure) {
        this.failure = failure;
        return this;
    }

    @Override
    public Credentials credentialsForRole(Instant deadline, String roleName) throws CredentialsException {
        requestedRoles.add(roleName);
        if (!delay.isZero()) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new CredentialsException(504, "interrupted while issuing credentials", ie);
            }
        }
        if (failure != null) {
            throw failure;
        }
        Credentials found = credentials.get(roleName);
        if (found == null) {
            throw new CredentialsException("no credentials for role " + roleName);
        }
        return found;
    }

    public List<String> requestedRoles() {
        synchronized (requestedRoles) {
            return List.copyOf(requestedRoles);
        }
    }

    public void clear() {
        requestedRoles.clear();
    }
}
