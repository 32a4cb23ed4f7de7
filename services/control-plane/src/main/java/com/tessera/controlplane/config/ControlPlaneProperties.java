package com.tessera.controlplane.config;

import com.tessera.security.permission.Permission;
import com.tessera.security.ratelimit.RateLimitPolicies;
import com.tessera.security.ratelimit.RateLimitPolicy;
import com.tessera.security.ratelimit.RateLimitTier;
import com.tessera.security.tenant.CachingTenantDirectory;
import com.tessera.security.tenant.Tenant;
import com.tessera.security.tenant.TenantStatus;
import com.tessera.security.tenant.TenantTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration of the control plane, bound from the {@code tessera.*} prefix:
 *
 * <pre>
 * tessera:
 *   service-name: control-plane
 *   environment: production
 *   tenant-cache-ttl: 30s
 *   identity:
 *     issuer-url: https://id.example.com
 *     realm: tessera
 *   rate-limit:
 *     store: redis
 *     tiers:
 *       default: { requests-per-minute: 60, burst: 60 }
 *   secrets:
 *     required: [identity-client-secret]
 * </pre>
 *
 * <p>Optional fields get their defaults in the compact constructors, which run before Bean
 * Validation.
 *
 * @param serviceName    name used in logs and as the {@code service} metric tag
 * @param environment    deployment environment; development environments get detailed errors
 * @param tenantCacheTtl how long a tenant lookup is cached, and so how long a suspension can take
 *                       to reach every node
 * @param startupTimeout how long each startup dependency check may take
 * @param tenants        tenants registered at startup
 * @param grpc           settings of the gRPC server interceptors
 */
@ConfigurationProperties(prefix = "tessera")
@Validated
public record ControlPlaneProperties(
        @NotBlank String serviceName,
        String environment,
        @Valid Identity identity,
        Duration tenantCacheTtl,
        @Valid RateLimit rateLimit,
        @Valid Secrets secrets,
        @Valid Cors cors,
        Duration startupTimeout,
        List<@Valid TenantSeed> tenants,
        Grpc grpc) {

    public ControlPlaneProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (identity == null) {
            identity = new Identity(null, null, null, null);
        }
        if (tenantCacheTtl == null || tenantCacheTtl.isNegative() || tenantCacheTtl.isZero()) {
            tenantCacheTtl = CachingTenantDirectory.DEFAULT_TTL;
        }
        if (rateLimit == null) {
            rateLimit = new RateLimit(null, null);
        }
        if (secrets == null) {
            secrets = new Secrets(null, null);
        }
        if (cors == null) {
            cors = new Cors(null);
        }
        if (startupTimeout == null || startupTimeout.isNegative() || startupTimeout.isZero()) {
            startupTimeout = Duration.ofSeconds(5);
        }
        tenants = tenants == null ? List.of() : List.copyOf(tenants);
        if (grpc == null) {
            grpc = new Grpc(null);
        }
    }

    /**
     * The identity provider that signs bearer tokens.
     *
     * @param issuerUrl   base URL of the identity provider
     * @param realm       realm whose public key verifies tokens
     * @param keyCacheTtl how long a fetched signing key is used before it is fetched again
     * @param clockSkew   tolerated clock difference when checking token expiry
     */
    public record Identity(String issuerUrl, String realm, Duration keyCacheTtl, Duration clockSkew) {

        public Identity {
            if (issuerUrl == null || issuerUrl.isBlank()) {
                issuerUrl = "http://localhost:8180";
            }
            if (issuerUrl.endsWith("/")) {
                issuerUrl = issuerUrl.substring(0, issuerUrl.length() - 1);
            }
            if (realm == null || realm.isBlank()) {
                realm = "tessera";
            }
            if (keyCacheTtl == null || keyCacheTtl.isNegative() || keyCacheTtl.isZero()) {
                keyCacheTtl = Duration.ofMinutes(10);
            }
            if (clockSkew == null || clockSkew.isNegative()) {
                clockSkew = Duration.ofSeconds(30);
            }
        }

        /** The {@code iss} claim tokens of this realm carry. */
        public String expectedIssuer() {
            return issuerUrl + "/realms/" + realm;
        }
    }

    /**
     * @param store {@code memory} for a per-node bucket store, {@code redis} for one shared by
     *              every node
     * @param tiers policy per tier name; tiers left out keep their defaults
     */
    public record RateLimit(String store, Map<String, Tier> tiers) {

        public static final String STORE_MEMORY = "memory";
        public static final String STORE_REDIS = "redis";

        public RateLimit {
            if (store == null || store.isBlank()) {
                store = STORE_MEMORY;
            }
            store = store.trim().toLowerCase();
            if (!store.equals(STORE_MEMORY) && !store.equals(STORE_REDIS)) {
                throw new IllegalArgumentException("tessera.rate-limit.store must be memory or redis, was " + store);
            }
            tiers = tiers == null ? Map.of() : Map.copyOf(tiers);
        }

        public boolean usesRedis() {
            return STORE_REDIS.equals(store);
        }

        public RateLimitPolicies toPolicies() {
            Map<RateLimitTier, RateLimitPolicy> policies = new EnumMap<>(RateLimitTier.class);
            tiers.forEach((name, tier) -> {
                RateLimitTier key = RateLimitTier.fromString(name)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown rate limit tier: " + name));
                policies.put(key, tier.toPolicy());
            });
            return RateLimitPolicies.of(policies);
        }
    }

    /**
     * @param requestsPerMinute sustained rate; 0 together with a burst of 0 means unlimited
     * @param burst             bucket capacity; defaults to {@code requestsPerMinute}
     */
    public record Tier(int requestsPerMinute, Integer burst) {

        public Tier {
            if (requestsPerMinute < 0) {
                throw new IllegalArgumentException("requests-per-minute must not be negative");
            }
            if (burst == null) {
                burst = requestsPerMinute;
            }
        }

        RateLimitPolicy toPolicy() {
            return RateLimitPolicy.perMinute(requestsPerMinute, burst);
        }
    }

    /**
     * @param required secrets that must be present for the service to start
     * @param values   secret values for deployments that inject them as configuration
     */
    public record Secrets(List<String> required, Map<String, String> values) {

        public Secrets {
            required = required == null ? List.of() : List.copyOf(required);
            values = values == null ? Map.of() : Map.copyOf(values);
        }
    }

    public record Cors(List<String> allowedOrigins) {

        public Cors {
            if (allowedOrigins == null || allowedOrigins.isEmpty()) {
                allowedOrigins = List.of("http://localhost:3000", "http://localhost:5173");
            }
        }
    }

    /**
     * @param methodPermissions permission required per full method name, as {@code resource:action}
     */
    public record Grpc(Map<String, String> methodPermissions) {

        public Grpc {
            methodPermissions = methodPermissions == null ? Map.of() : Map.copyOf(methodPermissions);
        }

        public Map<String, Permission> permissionsByMethod() {
            Map<String, Permission> permissions = new LinkedHashMap<>();
            methodPermissions.forEach((method, permission) -> permissions.put(method, Permission.parse(permission)));
            return permissions;
        }
    }

    /**
     * A tenant registered at startup.
     */
    public record TenantSeed(@NotBlank String id, @NotBlank String slug, String name, String tier) {

        public Tenant toTenant() {
            TenantTier tenantTier = TenantTier.fromString(tier).orElse(TenantTier.FREE);
            return new Tenant(id, slug, name, TenantStatus.ACTIVE, tenantTier);
        }
    }
}
