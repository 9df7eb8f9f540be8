package com.bastion.security.token;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;

/**
 * HMAC signing secret together with where and when it was obtained.
 * <p>
 * {@link #toString()} never prints the value.
 *
 * @param value     the shared secret
 * @param source    a human-readable name of the source (e.g. "inline", "ssm:/bastion/jwt")
 * @param fetchedAt when the value was read from its source
 */
public record SigningSecret(String value, String source, Instant fetchedAt) {

    /** HS256 requires a key of at least 256 bits. */
    public static final int MIN_LENGTH_BYTES = 32;

    public SigningSecret {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(fetchedAt, "fetchedAt");
    }

    public byte[] bytes() {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    public boolean isStrongEnough() {
        return bytes().length >= MIN_LENGTH_BYTES;
    }

    /** True if both secrets hold the same key material, regardless of source or fetch time. */
    public boolean sameKeyAs(SigningSecret other) {
        return other != null && value.equals(other.value);
    }

    @Override
    public String toString() {
        return "SigningSecret[source=" + source + ", fetchedAt=" + fetchedAt + "]";
    }
}
