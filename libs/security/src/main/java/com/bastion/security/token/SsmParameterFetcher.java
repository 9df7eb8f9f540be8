package com.bastion.security.token;

import com.amazonaws.services.simplesystemsmanagement.AWSSimpleSystemsManagement;
import com.amazonaws.services.simplesystemsmanagement.AWSSimpleSystemsManagementClientBuilder;
import com.amazonaws.services.simplesystemsmanagement.model.GetParameterRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * {@link ParameterFetcher} backed by AWS Systems Manager Parameter Store.
 * <p>
 * One client per region, created on first use with the default credentials chain. SecureString
 * parameters are decrypted.
 */
public final class SsmParameterFetcher implements ParameterFetcher {

    private static final Logger log = LoggerFactory.getLogger(SsmParameterFetcher.class);

    private final Map<String, AWSSimpleSystemsManagement> clients = new ConcurrentHashMap<>();
    private final Function<String, AWSSimpleSystemsManagement> clientFactory;

    public SsmParameterFetcher() {
        this(region -> AWSSimpleSystemsManagementClientBuilder.standard().withRegion(region).build());
    }

    SsmParameterFetcher(Function<String, AWSSimpleSystemsManagement> clientFactory) {
        this.clientFactory = clientFactory;
    }

    @Override
    public String fetch(String name, String region) {
        AWSSimpleSystemsManagement client = clients.computeIfAbsent(region, clientFactory);
        log.debug("Fetching parameter {} in {}", name, region);
        return client.getParameter(new GetParameterRequest()
                        .withName(name)
                        .withWithDecryption(true))
                .getParameter()
                .getValue();
    }
}
