package com.bastion.gateway.api;

import com.bastion.security.authz.AccessGuard;
import com.bastion.security.authz.AuthorizationDecision;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Dry-run authorization: answers whether the caller may perform an operation without performing
 * it. A denial is a normal 200 answer here.
 */
@RestController
@RequestMapping("/api/v1")
public class AuthorizationController {

    private final AccessGuard accessGuard;

    public AuthorizationController(AccessGuard accessGuard) {
        this.accessGuard = accessGuard;
    }

    @PostMapping("/authorize")
    public DecisionResponse authorize(@Valid @RequestBody AuthorizeRequest request) {
        AuthorizationDecision decision = accessGuard.evaluate(request.operation(), request.resource());
        return new DecisionResponse(
                decision.allowed(),
                decision.reason(),
                decision.denialReason() == null ? null : decision.denialReason().name(),
                decision.missingPermissions(),
                decision.credentials() != null);
    }

    /**
     * @param operation operation name, e.g. {@code bucket_objects_list}
     * @param resource  target bucket, if any
     */
    public record AuthorizeRequest(@NotBlank String operation, String resource) {
    }

    public record DecisionResponse(boolean allowed, String reason, String denialReason,
                                   List<String> missingPermissions, boolean credentialsAttached) {
    }
}
