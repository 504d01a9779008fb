package com.imdsguard.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.Objects;

/** Temporary credentials in the shape the EC2 instance-metadata service returns them. */
@JsonPropertyOrder({"Code", "LastUpdated", "Type", "AccessKeyId", "SecretAccessKey", "Token", "Expiration"})
public record Credentials(
        @JsonProperty("Code") String code,
        @JsonProperty("LastUpdated") Instant lastUpdated,
        @JsonProperty("Type") String type,
        @JsonProperty("AccessKeyId") String accessKeyId,
        @JsonProperty("SecretAccessKey") String secretAccessKey,
        @JsonProperty("Token") String token,
        @JsonProperty("Expiration") Instant expiration) {

    public static final String SUCCESS = "Success";
    public static final String TYPE_HMAC = "AWS-HMAC";

    public Credentials {
        Objects.requireNonNull(accessKeyId, "accessKeyId");
        Objects.requireNonNull(secretAccessKey, "secretAccessKey");
    }

    /** Successful session credentials issued now. */
    public static Credentials issued(String accessKeyId, String secretAccessKey, String token, Instant expiration) {
        return new Credentials(SUCCESS, Instant.now(), TYPE_HMAC, accessKeyId, secretAccessKey, token, expiration);
    }
}
