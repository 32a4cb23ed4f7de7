package com.tessera.controlplane.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.controlplane.infrastructure.identity.RealmPublicKeyProvider;
import com.tessera.controlplane.infrastructure.redis.RedisTokenBucketStore;
import com.tessera.controlplane.infrastructure.secrets.PropertiesSecretStore;
import com.tessera.observability.MetricFactory;
import com.tessera.observability.SensitiveDataRedactor;
import com.tessera.observability.SpanHelper;
import com.tessera.observability.StartupVerifier;
import com.tessera.security.apikey.ApiKeyLifecycleManager;
import com.tessera.security.apikey.ApiKeyStore;
import com.tessera.security.audit.AuditExporter;
import com.tessera.security.audit.AuditLedger;
import com.tessera.security.audit.AuditLogStore;
import com.tessera.security.credential.BearerTokenVerifier;
import com.tessera.security.credential.CredentialValidator;
import com.tessera.security.credential.SigningKeyProvider;
import com.tessera.security.credential.SigningKeyResolver;
import com.tessera.security.guard.AccessGuard;
import com.tessera.security.guard.PermissionGuard;
import com.tessera.security.memory.InMemoryApiKeyStore;
import com.tessera.security.memory.InMemoryAuditLogStore;
import com.tessera.security.memory.InMemoryPermissionStore;
import com.tessera.security.memory.InMemoryRelationshipPolicyStore;
import com.tessera.security.memory.InMemoryTenantDirectory;
import com.tessera.security.permission.ConditionEvaluator;
import com.tessera.security.permission.PermissionAdministration;
import com.tessera.security.permission.PermissionMatrixSeed;
import com.tessera.security.permission.PermissionResolver;
import com.tessera.security.permission.PermissionStore;
import com.tessera.security.permission.RelationshipPolicyStore;
import com.tessera.security.ratelimit.InMemoryTokenBucketStore;
import com.tessera.security.ratelimit.RateLimiter;
import com.tessera.security.ratelimit.TokenBucketStore;
import com.tessera.security.secrets.SecretStore;
import com.tessera.security.secrets.SecretStoreCheck;
import com.tessera.security.tenant.CachingTenantDirectory;
import com.tessera.security.tenant.TenantAdministration;
import com.tessera.security.tenant.TenantResolver;
import java.net.http.HttpClient;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Wires the tenant, credential, permission, rate-limit and audit components into one
 * {@link AccessGuard}.
 *
 * <p>Stores are the in-memory implementations; only the token buckets can move to Redis, via
 * {@code tessera.rate-limit.store=redis}. Required secrets are verified while the context starts,
 * so a misconfigured node fails before the web server accepts traffic.
 */
@Configuration
public class SecurityCoreConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityCoreConfig.class);

    // Tenants

    @Bean
    public CachingTenantDirectory tenantDirectory(ControlPlaneProperties properties) {
        InMemoryTenantDirectory directory = new InMemoryTenantDirectory();
        properties.tenants().forEach(seed -> directory.save(seed.toTenant()));
        if (!properties.tenants().isEmpty()) {
            log.info("Registered {} tenants from configuration", properties.tenants().size());
        }
        return new CachingTenantDirectory(directory, properties.tenantCacheTtl());
    }

    @Bean
    public TenantResolver tenantResolver(CachingTenantDirectory tenantDirectory) {
        return new TenantResolver(tenantDirectory);
    }

    @Bean
    public TenantAdministration tenantAdministration(CachingTenantDirectory tenantDirectory, AuditLedger auditLedger) {
        return new TenantAdministration(tenantDirectory, auditLedger);
    }

    // Audit

    @Bean
    public AuditLogStore auditLogStore() {
        return new InMemoryAuditLogStore();
    }

    @Bean
    public AuditLedger auditLedger(
            AuditLogStore auditLogStore,
            Clock clock,
            ExecutorService backgroundExecutor,
            SensitiveDataRedactor redactor) {
        return new AuditLedger(auditLogStore, clock, backgroundExecutor, redactor);
    }

    @Bean
    public AuditExporter auditExporter(ObjectMapper objectMapper) {
        return new AuditExporter(objectMapper);
    }

    // API keys and credentials

    @Bean
    public ApiKeyStore apiKeyStore() {
        return new InMemoryApiKeyStore();
    }

    @Bean
    public ApiKeyLifecycleManager apiKeyLifecycleManager(
            ApiKeyStore apiKeyStore,
            CachingTenantDirectory tenantDirectory,
            AuditLedger auditLedger,
            Clock clock,
            ExecutorService backgroundExecutor) {
        return new ApiKeyLifecycleManager(
                apiKeyStore, tenantDirectory, auditLedger, clock, new SecureRandom(), backgroundExecutor);
    }

    @Bean
    public SigningKeyProvider realmPublicKeyProvider(ControlPlaneProperties properties, ObjectMapper objectMapper) {
        ControlPlaneProperties.Identity identity = properties.identity();
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
        return new RealmPublicKeyProvider(
                client, objectMapper, identity.issuerUrl(), identity.realm(), Duration.ofSeconds(5));
    }

    @Bean
    public SigningKeyResolver signingKeyResolver(SigningKeyProvider provider, ControlPlaneProperties properties) {
        return new SigningKeyResolver(provider, properties.identity().keyCacheTtl());
    }

    @Bean
    public BearerTokenVerifier bearerTokenVerifier(
            SigningKeyResolver signingKeyResolver, Clock clock, ControlPlaneProperties properties) {
        ControlPlaneProperties.Identity identity = properties.identity();
        return new BearerTokenVerifier(
                signingKeyResolver, clock, identity.clockSkew(), identity.expectedIssuer());
    }

    @Bean
    public CredentialValidator credentialValidator(
            BearerTokenVerifier bearerTokenVerifier,
            ApiKeyLifecycleManager apiKeyLifecycleManager,
            MetricFactory metrics) {
        return new CredentialValidator(bearerTokenVerifier, apiKeyLifecycleManager, metrics);
    }

    // Permissions

    @Bean
    public PermissionStore permissionStore(ObjectMapper objectMapper) {
        InMemoryPermissionStore store = new InMemoryPermissionStore();
        new PermissionMatrixSeed(objectMapper).seedDefaults(store);
        return store;
    }

    @Bean
    public RelationshipPolicyStore relationshipPolicyStore() {
        return new InMemoryRelationshipPolicyStore();
    }

    @Bean
    public PermissionResolver permissionResolver(
            PermissionStore permissionStore, RelationshipPolicyStore relationshipPolicyStore, Clock clock) {
        return new PermissionResolver(permissionStore, new ConditionEvaluator(), relationshipPolicyStore, clock);
    }

    @Bean
    public PermissionAdministration permissionAdministration(
            PermissionStore permissionStore, AuditLedger auditLedger, Clock clock) {
        return new PermissionAdministration(permissionStore, auditLedger, clock);
    }

    @Bean
    public PermissionGuard permissionGuard(
            PermissionResolver permissionResolver, AuditLedger auditLedger, MetricFactory metrics) {
        return new PermissionGuard(permissionResolver, auditLedger, metrics);
    }

    // Rate limiting

    @Bean
    public TokenBucketStore tokenBucketStore(
            ControlPlaneProperties properties, ObjectProvider<StringRedisTemplate> redisTemplate) {
        if (properties.rateLimit().usesRedis()) {
            log.info("Rate limit buckets are kept in Redis");
            return new RedisTokenBucketStore(redisTemplate.getObject());
        }
        log.info("Rate limit buckets are kept in memory on this node");
        return new InMemoryTokenBucketStore();
    }

    @Bean
    public RateLimiter rateLimiter(
            TokenBucketStore tokenBucketStore, ControlPlaneProperties properties, Clock clock, MetricFactory metrics) {
        return new RateLimiter(tokenBucketStore, properties.rateLimit().toPolicies(), clock, metrics);
    }

    // Guard

    @Bean
    public AccessGuard accessGuard(
            CredentialValidator credentialValidator,
            TenantResolver tenantResolver,
            RateLimiter rateLimiter,
            PermissionGuard permissionGuard,
            SpanHelper spanHelper) {
        return new AccessGuard(credentialValidator, tenantResolver, rateLimiter, permissionGuard, spanHelper);
    }

    // Startup

    @Bean
    public SecretStore secretStore(ControlPlaneProperties properties) {
        return new PropertiesSecretStore(properties.secrets().values());
    }

    /**
     * Runs the startup checks while the bean is created.
     *
     * @throws com.tessera.observability.StartupVerificationException if a required dependency is
     *     unavailable
     */
    @Bean
    public StartupVerifier startupVerifier(SecretStore secretStore, ControlPlaneProperties properties) {
        StartupVerifier verifier = new StartupVerifier(properties.startupTimeout().toMillis())
                .require(SecretStoreCheck.NAME, new SecretStoreCheck(secretStore, properties.secrets().required()));
        verifier.verify();
        return verifier;
    }
}
