package com.imdsguard.testkit;

import com.imdsguard.api.RoleFinder;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Test double backed by an identity to role map. */
public class InMemoryRoleFinder implements RoleFinder {
    private final Map<String, String> roles = new ConcurrentHashMap<>();

    public InMemoryRoleFinder assign(String identity, String role) {
        roles.put(identity, role);
        return this;
    }

    public void revoke(String identity) {
        roles.remove(identity);
    }

    @Override
    public Optional<String> findRoleForIdentity(String identity) {
        return Optional.ofNullable(roles.get(identity));
    }
}
