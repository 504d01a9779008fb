package com.imdsguard.api;

import java.time.Instant;

/** Issues credentials for a role. Caching and retry policy belong to the implementation. */
public interface CredentialsProvider {

    /**
     * @param deadline absolute point in time after which the caller no longer waits for an answer
     * @param roleName role the caller has already been verified to be entitled to
     * @throws CredentialsException carrying the status and message to return to the workload
     */
    Credentials credentialsForRole(Instant deadline, String roleName) throws CredentialsException;
}
