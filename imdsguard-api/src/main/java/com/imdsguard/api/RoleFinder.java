package com.imdsguard.api;

import java.util.Optional;

/**
 * Maps a workload identity (the caller's network address, or an explicit override) to the single role that
 * workload may assume.
 *
 * <p>Implementations are called concurrently from many request threads and must be thread-safe. They must not
 * block for longer than the caller's request deadline; the proxy interrupts the calling thread when the deadline
 * passes.
 */
public interface RoleFinder {

    /**
     * @param identity workload identity, never {@code null}
     * @return the authorized role name, or empty when no role is associated with the identity
     * @throws RoleLookupException when the lookup itself failed (as opposed to finding nothing)
     */
    Optional<String> findRoleForIdentity(String identity) throws RoleLookupException;
}
