package com.bastion.gateway.api;

import com.bastion.security.claims.ClaimSet;
import com.bastion.security.context.AuthContextHolder;
import com.bastion.security.context.RuntimeAuthState;
import com.bastion.security.exchange.ScopedCredentials;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports the identity the current request runs as. Never returns secret material: credentials
 * are described by role, region and expiry only.
 */
@RestController
@RequestMapping("/api/v1/auth")
public class AuthStatusController {

    @GetMapping("/status")
    public Map<String, Object> status() {
        RuntimeAuthState state = AuthContextHolder.current();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("scheme", state.scheme().name());
        body.put("authenticated", state.isAuthenticated());
        body.put("subjectId", state.subjectId());
        body.put("sessionId", state.sessionId());
        body.put("role", state.extras().get("role"));

        ClaimSet claims = state.claims();
        if (claims != null) {
            body.put("level", claims.level().value());
            body.put("expiresAt", claims.expiresAt().toString());
            body.put("permissions", claims.permissions().stream().sorted().toList());
            body.put("resources", claims.resources().stream().sorted().toList());
        } else {
            body.put("permissions", List.of());
            body.put("resources", List.of());
        }

        ScopedCredentials credentials = state.effectiveCredentials();
        if (credentials != null) {
            Map<String, Object> described = new LinkedHashMap<>();
            described.put("roleId", credentials.roleId());
            described.put("region", credentials.region());
            described.put("expiration", credentials.expiration() == null ? null : credentials.expiration().toString());
            body.put("credentials", described);
        }
        return body;
    }
}
