package com.imdsguard.server.web;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SecurityCredentialsControllerTest {

    @Test
    void single_segment_role() {
        assertThat(SecurityCredentialsController.requestedRole("billing-reader", null))
                .isEqualTo("billing-reader");
        assertThat(SecurityCredentialsController.requestedRole("billing-reader", "")).isEqualTo("billing-reader");
    }

    @Test
    void remaining_segments_belong_to_the_role() {
        assertThat(SecurityCredentialsController.requestedRole("team", "/billing/reader"))
                .isEqualTo("team/billing/reader");
    }
}
