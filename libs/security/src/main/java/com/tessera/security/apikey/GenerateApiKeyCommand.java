package com.tessera.security.apikey;

import com.tessera.security.ratelimit.RateLimitTier;

import java.time.Duration;
import java.util.Set;

/**
 * @param expiresIn lifetime of the key, or null for a key that does not expire
 */
public record GenerateApiKeyCommand(
        String tenantId,
        String name,
        Set<String> scopes,
        RateLimitTier tier,
        Duration expiresIn
) {

    public GenerateApiKeyCommand {
        scopes = scopes == null || scopes.isEmpty() ? Set.of(ApiKeyScope.REALTIME.value()) : Set.copyOf(scopes);
        tier = tier == null ? RateLimitTier.DEFAULT : tier;
    }
}
