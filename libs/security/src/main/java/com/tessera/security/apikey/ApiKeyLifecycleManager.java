package com.tessera.security.apikey;

import com.tessera.observability.SensitiveDataRedactor;
import com.tessera.security.audit.Actor;
import com.tessera.security.audit.AuditAction;
import com.tessera.security.audit.AuditEvent;
import com.tessera.security.audit.AuditLedger;
import com.tessera.security.error.AuthenticationException;
import com.tessera.security.error.ConflictException;
import com.tessera.security.error.NotFoundException;
import com.tessera.security.error.TenantException;
import com.tessera.security.error.ValidationException;
import com.tessera.security.ratelimit.RateLimitTier;
import com.tessera.security.tenant.Tenant;
import com.tessera.security.tenant.TenantDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Issues, validates, rotates and revokes API keys.
 * <p>
 * Only the SHA-256 hash and a short display prefix of a key are stored; the plaintext is handed to
 * the caller once in {@link IssuedApiKey}. Validation always reads the store, so a revocation is
 * visible to the very next check. Rotation can leave the old key usable for a grace period by
 * scheduling its revocation instead of applying it immediately.
 * <p>
 * Every lifecycle change is written to the {@link AuditLedger}.
 */
public final class ApiKeyLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyLifecycleManager.class);

    static final String RESOURCE_TYPE = "api_key";
    static final int MAX_NAME_LENGTH = 100;

    private final ApiKeyStore store;
    private final TenantDirectory tenants;
    private final AuditLedger audit;
    private final Clock clock;
    private final SecureRandom random;
    private final Executor usageExecutor;

    public ApiKeyLifecycleManager(ApiKeyStore store, TenantDirectory tenants, AuditLedger audit, Clock clock,
                                  SecureRandom random, Executor usageExecutor) {
        if (store == null || tenants == null || audit == null || clock == null || random == null
                || usageExecutor == null) {
            throw new IllegalArgumentException("all collaborators are required");
        }
        this.store = store;
        this.tenants = tenants;
        this.audit = audit;
        this.clock = clock;
        this.random = random;
        this.usageExecutor = usageExecutor;
    }

    /**
     * Issues a new key for a tenant.
     *
     * @throws ValidationException if the name, scopes or expiry are invalid
     * @throws TenantException     if the tenant does not exist or already has its maximum number
     *                             of active keys
     */
    public IssuedApiKey generate(GenerateApiKeyCommand command, Actor actor) {
        checkCommand(command);
        Tenant tenant = tenants.findById(command.tenantId())
                .orElseThrow(() -> TenantException.notFound(command.tenantId()));
        Instant now = clock.instant();

        long active = store.countActive(tenant.id(), now);
        int maximum = tenant.tier().maxApiKeys();
        if (active >= maximum) {
            log.info("Tenant {} reached its API key limit ({})", tenant.id(), maximum);
            throw TenantException.limitExceeded(tenant.id(), "api_keys", maximum);
        }

        IssuedApiKey issued = issue(tenant.id(), command.name(), command.scopes(), command.tier(),
                command.expiresIn() == null ? null : now.plus(command.expiresIn()), actor, now);

        audit.append(AuditEvent.builder(AuditAction.KEY_CREATED, RESOURCE_TYPE)
                .tenant(tenant.id())
                .actor(actor)
                .resource(issued.key().id())
                .description("API key '%s' created".formatted(issued.key().name()))
                .newValues(snapshot(issued.key()))
                .build());
        log.info("Issued API key {} ({}) for tenant {}", issued.key().id(), issued.key().prefix(), tenant.id());
        return issued;
    }

    /**
     * Validates a presented key and records its use asynchronously.
     *
     * @throws AuthenticationException with {@code invalid_api_key}, {@code api_key_revoked} or
     *                                 {@code api_key_expired}
     */
    public ApiKey authenticate(String plaintext, String clientIp) {
        ApiKey key = validate(plaintext);
        recordUsageAsync(key, clientIp);
        return key;
    }

    /**
     * Checks a presented key without side effects.
     * <p>
     * Unknown keys and keys whose secret does not match fail identically with
     * {@code invalid_api_key}.
     */
    public ApiKey validate(String plaintext) {
        if (!ApiKeyFormat.isWellFormed(plaintext)) {
            log.debug("Rejected malformed API key {}", SensitiveDataRedactor.fingerprint(plaintext));
            throw AuthenticationException.invalidApiKey();
        }
        ApiKey match = null;
        for (ApiKey candidate : store.findByPrefix(ApiKeyFormat.displayPrefix(plaintext))) {
            if (ApiKeyHasher.matches(plaintext, candidate.secretHash())) {
                match = candidate;
            }
        }
        if (match == null) {
            log.debug("Rejected unknown API key {}", SensitiveDataRedactor.fingerprint(plaintext));
            throw AuthenticationException.invalidApiKey();
        }

        Instant now = clock.instant();
        if (match.isRevokedAt(now)) {
            log.info("Rejected revoked API key {} of tenant {}", match.id(), match.tenantId());
            throw AuthenticationException.apiKeyRevoked();
        }
        if (match.isExpiredAt(now)) {
            log.info("Rejected expired API key {} of tenant {}", match.id(), match.tenantId());
            throw AuthenticationException.apiKeyExpired();
        }
        return match;
    }

    /**
     * Replaces a key with a new one carrying the same name, scopes, tier and remaining lifetime.
     * With a positive grace period the old key keeps validating until {@code now + grace} and is
     * revoked from then on; with a null or zero grace it is revoked immediately. The old key is
     * marked before the replacement is issued, so of two concurrent rotations only one succeeds.
     *
     * @throws NotFoundException if the key does not exist for this tenant
     * @throws ConflictException if the key is already revoked
     */
    public RotationResult rotate(String tenantId, String keyId, Duration grace, Actor actor) {
        if (grace != null && grace.isNegative()) {
            throw new ValidationException("grace period must not be negative");
        }
        Instant now = clock.instant();
        Instant revokeAt = grace == null || grace.isZero() ? now : now.plus(grace);
        AtomicReference<ApiKey> before = new AtomicReference<>();
        ApiKey previous = store.update(tenantId, keyId, stored -> {
            if (stored.revokedAt() != null) {
                throw new ConflictException("API key %s is already revoked or being rotated".formatted(keyId));
            }
            before.set(stored);
            return stored.withRevocation(revokeAt, actor.id(), "rotated");
        });
        ApiKey current = before.get();
        IssuedApiKey replacement = issue(tenantId, current.name(), current.scopes(), current.tier(),
                current.expiresAt(), actor, now);

        Map<String, Object> newValues = new LinkedHashMap<>();
        newValues.put("replacement_key_id", replacement.key().id());
        newValues.put("old_key_revoked_at", revokeAt.toString());
        newValues.put("grace_seconds", grace == null ? 0 : grace.toSeconds());
        audit.append(AuditEvent.builder(AuditAction.KEY_ROTATED, RESOURCE_TYPE)
                .tenant(tenantId)
                .actor(actor)
                .resource(keyId)
                .description("API key '%s' rotated".formatted(current.name()))
                .oldValues(snapshot(current))
                .newValues(newValues)
                .build());
        log.info("Rotated API key {} -> {} for tenant {} (old key valid until {})",
                keyId, replacement.key().id(), tenantId, revokeAt);
        return new RotationResult(replacement, previous);
    }

    /**
     * Revokes a key with immediate effect.
     *
     * @throws NotFoundException if the key does not exist for this tenant
     * @throws ConflictException if the key is already revoked
     */
    public ApiKey revoke(String tenantId, String keyId, Actor actor, String reason) {
        Instant now = clock.instant();
        AtomicReference<ApiKey> before = new AtomicReference<>();
        ApiKey revoked = store.update(tenantId, keyId, stored -> {
            if (stored.isRevokedAt(now)) {
                throw new ConflictException("API key %s is already revoked".formatted(keyId));
            }
            before.set(stored);
            return stored.withRevocation(now, actor.id(), reason == null ? "" : reason);
        });
        ApiKey current = before.get();

        audit.append(AuditEvent.builder(AuditAction.KEY_REVOKED, RESOURCE_TYPE)
                .tenant(tenantId)
                .actor(actor)
                .resource(keyId)
                .description("API key '%s' revoked".formatted(current.name()))
                .oldValues(snapshot(current))
                .newValues(snapshot(revoked))
                .metadata("reason", reason)
                .build());
        log.info("Revoked API key {} for tenant {}", keyId, tenantId);
        return revoked;
    }

    /**
     * Keys of a tenant, newest first.
     *
     * @param includeInactive whether revoked and expired keys are listed
     */
    public List<ApiKey> list(String tenantId, boolean includeInactive) {
        Instant now = clock.instant();
        return store.listByTenant(tenantId).stream()
                .filter(key -> includeInactive || key.isActiveAt(now))
                .sorted(Comparator.comparing(ApiKey::createdAt).reversed())
                .toList();
    }

    public ApiKey get(String tenantId, String keyId) {
        return require(tenantId, keyId);
    }

    public void recordUsage(ApiKey key, String clientIp) {
        store.recordUsage(key.tenantId(), key.id(), clock.instant(), clientIp);
    }

    private void recordUsageAsync(ApiKey key, String clientIp) {
        try {
            usageExecutor.execute(() -> {
                try {
                    recordUsage(key, clientIp);
                } catch (RuntimeException e) {
                    log.warn("Failed to record usage of API key {}", key.id(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Usage recording for API key {} rejected by executor", key.id(), e);
        }
    }

    private IssuedApiKey issue(String tenantId, String name, Set<String> scopes,
                               RateLimitTier tier, Instant expiresAt,
                               Actor actor, Instant now) {
        String plaintext = ApiKeyFormat.newPlaintext(random);
        ApiKey key = new ApiKey(
                UUID.randomUUID().toString(),
                tenantId,
                name,
                ApiKeyFormat.displayPrefix(plaintext),
                ApiKeyHasher.hash(plaintext),
                scopes,
                tier,
                now,
                actor.id(),
                expiresAt,
                null,
                null,
                null,
                null,
                null,
                0);
        store.insert(key);
        return new IssuedApiKey(key, plaintext);
    }

    private ApiKey require(String tenantId, String keyId) {
        return store.findById(tenantId, keyId)
                .orElseThrow(() -> new NotFoundException(RESOURCE_TYPE, keyId));
    }

    private static void checkCommand(GenerateApiKeyCommand command) {
        if (command.tenantId() == null || command.tenantId().isBlank()) {
            throw new ValidationException("tenant_id is required");
        }
        if (command.name() == null || command.name().isBlank()) {
            throw new ValidationException("name is required");
        }
        if (command.name().length() > MAX_NAME_LENGTH) {
            throw new ValidationException("name must be at most %d characters".formatted(MAX_NAME_LENGTH));
        }
        for (String scope : command.scopes()) {
            if (ApiKeyScope.fromString(scope).isEmpty()) {
                throw new ValidationException("unknown scope: " + scope, Map.of("scope", scope));
            }
        }
        if (command.expiresIn() != null && (command.expiresIn().isNegative() || command.expiresIn().isZero())) {
            throw new ValidationException("expiry must be in the future");
        }
    }

    private static Map<String, Object> snapshot(ApiKey key) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", key.name());
        values.put("prefix", key.prefix());
        values.put("scopes", key.scopes().stream().sorted().toList());
        values.put("tier", key.tier().value());
        values.put("expires_at", key.expiresAt() == null ? null : key.expiresAt().toString());
        values.put("revoked_at", key.revokedAt() == null ? null : key.revokedAt().toString());
        return values;
    }
}
