package com.bastion.gateway.api;

import com.bastion.security.authz.AccessGuard;
import com.bastion.security.authz.AuthorizationDecision;
import com.bastion.security.authz.Operation;
import com.bastion.security.exchange.ScopedCredentials;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A protected operation: checks that the caller may access a bucket. Denials surface as 403
 * through {@link com.bastion.gateway.web.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/buckets")
public class BucketAccessController {

    private final AccessGuard accessGuard;

    public BucketAccessController(AccessGuard accessGuard) {
        this.accessGuard = accessGuard;
    }

    @GetMapping("/{bucket}/access")
    public Map<String, Object> access(@PathVariable String bucket) {
        AuthorizationDecision decision = accessGuard.check(Operation.BUCKET_ACCESS_CHECK.operationName(), bucket);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("bucket", bucket);
        body.put("allowed", true);
        ScopedCredentials credentials = decision.credentials();
        body.put("roleId", credentials == null ? null : credentials.roleId());
        return body;
    }
}
