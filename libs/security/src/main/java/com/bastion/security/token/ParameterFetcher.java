package com.bastion.security.token;

/**
 * Reads a (decrypted) parameter value from a remote parameter store.
 */
@FunctionalInterface
public interface ParameterFetcher {

    /**
     * @param name   the parameter name or path
     * @param region the region hosting the parameter
     * @return the parameter value
     * @throws RuntimeException on any lookup failure
     */
    String fetch(String name, String region);
}
