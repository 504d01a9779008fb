package com.imdsguard.testkit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.imdsguard.api.Credentials;
import com.imdsguard.api.CredentialsException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class InMemoryCredentialsProviderTest {

    private static final Instant DEADLINE = Instant.now().plusSeconds(30);

    private final Credentials issued =
            Credentials.issued("AKIA", "secret", "token", Instant.parse("2026-10-16T12:00:00Z"));
    private final InMemoryCredentialsProvider provider = new InMemoryCredentialsProvider().register("reader", issued);

    @Test
    void returns_registered_credentials_and_records_role() throws Exception {
        assertThat(provider.credentialsForRole(DEADLINE, "reader")).isSameAs(issued);
        assertThat(provider.requestedRoles()).containsExactly("reader");

        provider.clear();
        assertThat(provider.requestedRoles()).isEmpty();
    }

    @Test
    void unknown_role_fails_with_default_status() {
        assertThatThrownBy(() -> provider.credentialsForRole(DEADLINE, "writer"))
                .isInstanceOf(CredentialsException.class)
                .satisfies(e -> assertThat(((CredentialsException) e).status()).isEqualTo(500));
    }

    @Test
    void configured_failure_is_thrown_as_is() {
        CredentialsException throttled = new CredentialsException(503, "throttled");
        provider.failWith(throttled);

        assertThatThrownBy(() -> provider.credentialsForRole(DEADLINE, "reader")).isSameAs(throttled);
    }

    @Test
    void interrupt_during_delay_becomes_504() throws Exception {
        provider.delay(Duration.ofSeconds(10));
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread caller = new Thread(() -> {
            try {
                provider.credentialsForRole(DEADLINE, "reader");
            } catch (CredentialsException e) {
                failure.set(e);
            }
        });

        caller.start();
        Thread.sleep(100);
        caller.interrupt();
        caller.join(5_000);

        assertThat(failure.get()).isInstanceOf(CredentialsException.class);
        assertThat(((CredentialsException) failure.get()).status()).isEqualTo(504);
    }

    @Test
    void role_finder_revoke_removes_assignment() {
        InMemoryRoleFinder roles = new InMemoryRoleFinder().assign("10.0.0.5", "reader");

        roles.revoke("10.0.0.5");

        assertThat(roles.findRoleForIdentity("10.0.0.5")).isEmpty();
    }
}
