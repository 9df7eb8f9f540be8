package com.bastion.security.middleware;

/**
 * Behaviour of {@link RequestAuthenticator}.
 *
 * @param mode              strict or optional
 * @param headers           header names to read
 * @param ambient           identity for token-less requests in optional mode
 * @param assumeClaimedRole assume the role named by the token's role claim when no role header is sent
 */
public record AuthenticatorSettings(AuthMode mode, AuthHeaders headers, AmbientIdentity ambient,
                                    boolean assumeClaimedRole) {

    public AuthenticatorSettings {
        mode = mode == null ? AuthMode.STRICT : mode;
        headers = headers == null ? AuthHeaders.defaults() : headers;
        ambient = ambient == null ? AmbientIdentity.anonymous() : ambient;
    }

    public static AuthenticatorSettings strict() {
        return new AuthenticatorSettings(AuthMode.STRICT, null, null, false);
    }
}
