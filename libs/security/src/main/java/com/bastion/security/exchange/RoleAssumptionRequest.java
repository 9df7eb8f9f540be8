package com.bastion.security.exchange;

import java.time.Duration;
import java.util.Objects;

/**
 * One call to the trust provider.
 *
 * @param owner          subject on whose behalf the role is assumed
 * @param roleId         role to assume (e.g. an IAM role ARN)
 * @param sessionName    name recorded by the trust provider for the issued session
 * @param sourceIdentity identity recorded alongside the session (nullable)
 * @param duration       requested credential lifetime
 */
public record RoleAssumptionRequest(
        String owner,
        String roleId,
        String sessionName,
        String sourceIdentity,
        Duration duration
) {

    public RoleAssumptionRequest {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(roleId, "roleId");
        Objects.requireNonNull(sessionName, "sessionName");
        Objects.requireNonNull(duration, "duration");
    }
}
