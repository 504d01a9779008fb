package com.imdsguard.server.guard;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class StatusBucketTest {

    @ParameterizedTest
    @CsvSource({
        "200, 2xx", "204, 2xx", "299, 2xx",
        "301, 3xx",
        "400, 4xx", "403, 4xx", "404, 4xx",
        "500, 5xx", "503, 5xx", "599, 5xx",
        "100, unknown", "199, unknown", "600, unknown", "0, unknown", "-1, unknown"
    })
    void buckets_by_status_class(int status, String label) {
        assertThat(StatusBucket.of(status).label()).isEqualTo(label);
    }
}
