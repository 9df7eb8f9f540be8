package com.bastion.security.token;

import java.time.Instant;

/**
 * Provider for a secret configured inline. Never rotates.
 */
public final class StaticSecretProvider implements SecretProvider {

    private final SigningSecret secret;

    public StaticSecretProvider(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("secret must not be null or blank");
        }
        this.secret = new SigningSecret(secret, "inline", Instant.now());
    }

    @Override
    public SigningSecret current() {
        return secret;
    }
}
