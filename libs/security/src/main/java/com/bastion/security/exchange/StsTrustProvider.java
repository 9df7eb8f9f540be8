package com.bastion.security.exchange;

import com.amazonaws.services.securitytoken.AWSSecurityTokenService;
import com.amazonaws.services.securitytoken.AWSSecurityTokenServiceClientBuilder;
import com.amazonaws.services.securitytoken.model.AssumeRoleRequest;
import com.amazonaws.services.securitytoken.model.AssumeRoleResult;
import com.amazonaws.services.securitytoken.model.Credentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * {@link TrustProvider} backed by AWS STS {@code AssumeRole}.
 * <p>
 * The STS client is built on first use with the default credentials chain, so a gateway that
 * never assumes a role never needs AWS credentials.
 */
public final class StsTrustProvider implements TrustProvider {

    private static final Logger log = LoggerFactory.getLogger(StsTrustProvider.class);

    private final String region;
    private final Supplier<AWSSecurityTokenService> clientFactory;
    private volatile AWSSecurityTokenService client;

    public StsTrustProvider(String region) {
        this(region, () -> AWSSecurityTokenServiceClientBuilder.standard().withRegion(region).build());
    }

    StsTrustProvider(String region, Supplier<AWSSecurityTokenService> clientFactory) {
        this.region = region;
        this.clientFactory = clientFactory;
    }

    @Override
    public ScopedCredentials assumeRole(RoleAssumptionRequest request) {
        AssumeRoleRequest assumeRole = new AssumeRoleRequest()
                .withRoleArn(request.roleId())
                .withRoleSessionName(request.sessionName())
                .withDurationSeconds((int) request.duration().toSeconds());
        if (request.sourceIdentity() != null) {
            assumeRole.withSourceIdentity(request.sourceIdentity());
        }

        log.debug("Assuming role {} as session {}", request.roleId(), request.sessionName());
        AssumeRoleResult result = client().assumeRole(assumeRole);
        Credentials credentials = result.getCredentials();
        if (credentials == null) {
            throw new IllegalStateException("STS returned no credentials for " + request.roleId());
        }
        return new ScopedCredentials(
                credentials.getAccessKeyId(),
                credentials.getSecretAccessKey(),
                credentials.getSessionToken(),
                region,
                credentials.getExpiration() == null ? null : credentials.getExpiration().toInstant(),
                request.roleId());
    }

    private AWSSecurityTokenService client() {
        AWSSecurityTokenService current = client;
        if (current == null) {
            synchronized (this) {
                current = client;
                if (current == null) {
                    current = clientFactory.get();
                    client = current;
                }
            }
        }
        return current;
    }
}
