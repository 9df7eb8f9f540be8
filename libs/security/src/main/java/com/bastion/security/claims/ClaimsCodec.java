package com.bastion.security.claims;

import com.bastion.security.AuthErrorCode;
import com.bastion.security.AuthException;
import com.bastion.security.exchange.ScopedCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Expands a verified token payload into a canonical {@link ClaimSet}.
 * <p>
 * Each logical field exists in an expanded form ({@code permissions}, {@code buckets},
 * {@code roles}, {@code scope}, {@code level}) and an abbreviated form ({@code p}, {@code b},
 * {@code r}, {@code s}, {@code l}). The expanded form is used when present and non-empty;
 * otherwise the abbreviated form is decoded. With {@link ClaimPrecedence#REJECT_CONFLICT} both
 * forms are decoded and must agree.
 * <p>
 * The resource bound applies to the distinct names an encoding expands to. Repeated names
 * collapse into one resource and do not count again. A claim whose distinct names exceed the
 * bound fails with {@code DECOMPRESSION_ERROR}; it is never truncated.
 * <p>
 * Stateless and thread-safe.
 */
public final class ClaimsCodec {

    /** Default upper bound on the number of distinct resources a token may grant. */
    public static final int DEFAULT_MAX_RESOURCES = 32;

    public static final String SUBJECT = "sub";
    public static final String EXPIRES_AT = "exp";
    public static final String ISSUED_AT = "iat";
    public static final String ISSUER = "iss";
    public static final String AUDIENCE = "aud";
    public static final String TOKEN_ID = "jti";

    public static final String PERMISSIONS = "permissions";
    public static final String PERMISSIONS_COMPACT = "p";
    public static final String BUCKETS = "buckets";
    public static final String BUCKETS_COMPACT = "b";
    public static final String ROLES = "roles";
    public static final String ROLES_COMPACT = "r";
    public static final String SCOPE = "scope";
    public static final String SCOPE_COMPACT = "s";
    public static final String LEVEL = "level";
    public static final String LEVEL_COMPACT = "l";

    private static final List<String> ROLE_ARN_KEYS = List.of("aws_role_arn", "role_arn", "roleArn");
    private static final List<String> CREDENTIAL_KEYS = List.of("aws_credentials", "credentials");
    private static final String IAM_ROLE_PREFIX = "arn:aws:iam::";

    private static final Logger log = LoggerFactory.getLogger(ClaimsCodec.class);

    private final int maxResources;
    private final ClaimPrecedence precedence;

    public ClaimsCodec() {
        this(DEFAULT_MAX_RESOURCES, ClaimPrecedence.EXPANDED_WINS);
    }

    /**
     * @param maxResources maximum number of distinct resources a token may grant
     * @param precedence   how the expanded and abbreviated forms of a field are reconciled
     */
    public ClaimsCodec(int maxResources, ClaimPrecedence precedence) {
        if (maxResources <= 0) {
            throw new IllegalArgumentException("maxResources must be positive");
        }
        this.maxResources = maxResources;
        this.precedence = Objects.requireNonNull(precedence, "precedence");
    }

    /**
     * Decodes a verified payload.
     *
     * @param payload the payload claims as a JSON-like map
     * @return the canonical claims
     * @throws AuthException MISSING_REQUIRED_CLAIM, MALFORMED_TOKEN or DECOMPRESSION_ERROR
     */
    public ClaimSet decode(Map<String, Object> payload) {
        Objects.requireNonNull(payload, "payload");

        String subject = requiredSubject(payload.get(SUBJECT));
        Instant expiresAt = epochClaim(payload.get(EXPIRES_AT), EXPIRES_AT);
        if (expiresAt == null) {
            throw new AuthException(AuthErrorCode.MISSING_REQUIRED_CLAIM, "Token is missing the 'exp' claim");
        }

        Set<String> permissions = resolve(payload, PERMISSIONS, PERMISSIONS_COMPACT,
                this::expandedPermissions, this::compactPermissions);
        Set<String> resources = resolve(payload, BUCKETS, BUCKETS_COMPACT,
                this::resources, this::resources);
        List<String> roles = resolve(payload, ROLES, ROLES_COMPACT,
                value -> stringValues(value, ROLES), value -> stringValues(value, ROLES_COMPACT));
        String scope = resolve(payload, SCOPE, SCOPE_COMPACT, ClaimsCodec::scope, ClaimsCodec::scope);
        AccessLevel level = resolve(payload, LEVEL, LEVEL_COMPACT, ClaimsCodec::level, ClaimsCodec::level);

        ClaimSet claims = new ClaimSet(
                subject,
                expiresAt,
                epochClaim(payload.get(ISSUED_AT), ISSUED_AT),
                optionalString(payload.get(ISSUER)),
                audience(payload.get(AUDIENCE)),
                optionalString(payload.get(TOKEN_ID)),
                scope,
                level == null ? AccessLevel.READ : level,
                permissions,
                resources,
                roles,
                roleArn(payload, roles),
                embeddedCredentials(payload));
        log.debug("Decoded claims for subject {}: {} permissions, {} resources, level {}",
                subject, claims.permissions().size(), claims.resources().size(), claims.level().value());
        return claims;
    }

    public int maxResources() {
        return maxResources;
    }

    public ClaimPrecedence precedence() {
        return precedence;
    }

    // ---------------------------------------------------------------- precedence

    private <T> T resolve(Map<String, Object> payload, String expandedKey, String compactKey,
                          Function<Object, T> expandedDecoder, Function<Object, T> compactDecoder) {
        Object expanded = payload.get(expandedKey);
        Object compact = payload.get(compactKey);
        boolean hasExpanded = isPresent(expanded);
        boolean hasCompact = isPresent(compact);

        if (hasExpanded && hasCompact && precedence == ClaimPrecedence.REJECT_CONFLICT) {
            T fromExpanded = expandedDecoder.apply(expanded);
            T fromCompact = compactDecoder.apply(compact);
            if (!sameLogicalValue(fromExpanded, fromCompact)) {
                throw AuthException.malformed("Claims '" + expandedKey + "' and '" + compactKey + "' disagree");
            }
            return fromExpanded;
        }
        if (hasExpanded) {
            return expandedDecoder.apply(expanded);
        }
        if (hasCompact) {
            return compactDecoder.apply(compact);
        }
        return expandedDecoder.apply(null);
    }

    private static boolean sameLogicalValue(Object left, Object right) {
        if (left instanceof Collection<?> l && right instanceof Collection<?> r) {
            return Set.copyOf(l).equals(Set.copyOf(r));
        }
        return Objects.equals(left, right);
    }

    private static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String s) {
            return !s.isBlank();
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }

    // ---------------------------------------------------------------- permissions

    private Set<String> expandedPermissions(Object value) {
        return new LinkedHashSet<>(stringValues(value, PERMISSIONS));
    }

    private Set<String> compactPermissions(Object value) {
        Set<String> permissions = new LinkedHashSet<>();
        for (String code : stringValues(value, PERMISSIONS_COMPACT)) {
            String permission = PermissionCodes.expand(code).orElseThrow(() ->
                    AuthException.decompression("Unknown permission code '" + code + "'"));
            permissions.add(permission);
        }
        return permissions;
    }

    // ---------------------------------------------------------------- resources

    private Set<String> resources(Object value) {
        if (value == null) {
            return Set.of();
        }
        ResourceEncoding encoding = ResourceEncoding.parse(value);
        Set<String> resources = new LinkedHashSet<>();
        for (String name : encoding.expand()) {
            resources.add(name);
            if (resources.size() > maxResources) {
                throw AuthException.decompression("Resource claim (" + encoding.type()
                        + ") expands to more than " + maxResources + " resources");
            }
        }
        return resources;
    }

    // ---------------------------------------------------------------- scalar fields

    private static String requiredSubject(Object value) {
        if (!(value instanceof String subject) || subject.isBlank()) {
            throw new AuthException(AuthErrorCode.MISSING_REQUIRED_CLAIM, "Token is missing the 'sub' claim");
        }
        return subject;
    }

    private static Instant epochClaim(Object value, String name) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return Instant.ofEpochSecond(number.longValue());
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        throw AuthException.malformed("Claim '" + name + "' must be a numeric date");
    }

    private static String scope(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String s) {
            return s.strip();
        }
        return String.join(" ", stringValues(value, SCOPE));
    }

    private static AccessLevel level(Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof String s)) {
            throw AuthException.malformed("Claim 'level' must be a string");
        }
        return AccessLevel.fromString(s)
                .orElseThrow(() -> AuthException.malformed("Unknown access level '" + s + "'"));
    }

    private static List<String> audience(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof String s) {
            return List.of(s);
        }
        return stringValues(value, AUDIENCE);
    }

    private static String optionalString(Object value) {
        return value instanceof String s && !s.isBlank() ? s : null;
    }

    /**
     * Reads a claim that may be an array or a space/comma delimited string.
     */
    static List<String> stringValues(Object value, String name) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof String s) {
            List<String> parts = new ArrayList<>();
            for (String part : s.split("[,\\s]+")) {
                if (!part.isEmpty()) {
                    parts.add(part);
                }
            }
            return parts;
        }
        if (value instanceof Collection<?> values) {
            List<String> result = new ArrayList<>(values.size());
            for (Object element : values) {
                if (!(element instanceof String s)) {
                    throw AuthException.malformed("Claim '" + name + "' must contain only strings");
                }
                if (!s.isBlank()) {
                    result.add(s);
                }
            }
            return result;
        }
        throw AuthException.malformed("Claim '" + name + "' must be an array or a string");
    }

    // ---------------------------------------------------------------- role / credentials

    private static String roleArn(Map<String, Object> payload, List<String> roles) {
        for (String key : ROLE_ARN_KEYS) {
            String arn = optionalString(payload.get(key));
            if (arn != null) {
                return arn;
            }
        }
        return roles.stream().filter(role -> role.startsWith(IAM_ROLE_PREFIX)).findFirst().orElse(null);
    }

    private static ScopedCredentials embeddedCredentials(Map<String, Object> payload) {
        for (String key : CREDENTIAL_KEYS) {
            if (payload.get(key) instanceof Map<?, ?> raw) {
                String accessKeyId = optionalString(raw.get("access_key_id"));
                String secretAccessKey = optionalString(raw.get("secret_access_key"));
                if (accessKeyId == null || secretAccessKey == null) {
                    log.debug("Ignoring partial embedded credentials under '{}'", key);
                    continue;
                }
                return new ScopedCredentials(
                        accessKeyId,
                        secretAccessKey,
                        optionalString(raw.get("session_token")),
                        optionalString(raw.get("region")),
                        credentialExpiry(raw.get("expiration")),
                        optionalString(raw.get("role_arn")));
            }
        }
        return null;
    }

    private static Instant credentialExpiry(Object value) {
        if (value instanceof Number number) {
            return Instant.ofEpochSecond(number.longValue());
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Instant.parse(s);
            } catch (DateTimeParseException e) {
                throw AuthException.malformed("Embedded credential expiration is not an ISO-8601 instant");
            }
        }
        return null;
    }
}
