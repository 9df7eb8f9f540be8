package com.bastion.gateway;

import com.bastion.gateway.config.BastionAuthProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Bastion auth gateway: validates bearer tokens, keeps per-session identity, isolates each
 * request's identity on its worker thread and gates the {@code /api} endpoints.
 *
 * <p>Configured through {@code bastion.auth.*}; see {@link BastionAuthProperties}. Startup
 * fails when no signing secret is configured.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(BastionAuthProperties.class)
public class AuthGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(AuthGatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AuthGatewayApplication.class, args);
        log.info("Bastion auth gateway started");
    }
}
