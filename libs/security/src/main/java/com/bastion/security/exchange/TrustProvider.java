package com.bastion.security.exchange;

/**
 * Upstream service that exchanges a long-lived identity for short-lived role credentials.
 * <p>
 * Implementations may block; {@link CredentialExchangeManager} bounds every call with a timeout
 * and runs it off the request thread.
 */
@FunctionalInterface
public interface TrustProvider {

    /**
     * @return credentials scoped to {@code request.roleId()}
     * @throws RuntimeException if the provider refuses or cannot be reached
     */
    ScopedCredentials assumeRole(RoleAssumptionRequest request);
}
