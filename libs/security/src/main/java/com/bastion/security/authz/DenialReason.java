package com.bastion.security.authz;

/**
 * Why an {@link AuthorizationDecision} was negative.
 */
public enum DenialReason {
    NOT_AUTHENTICATED,
    UNKNOWN_OPERATION,
    MISSING_PERMISSION,
    RESOURCE_REQUIRED,
    RESOURCE_NOT_AUTHORIZED
}
