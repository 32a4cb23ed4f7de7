package com.tessera.security.tenant;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.security.credential.Principal;
import com.tessera.security.credential.PrincipalType;
import com.tessera.security.ratelimit.RateLimitTier;

import java.util.Base64;
import java.util.List;
import java.util.Set;

/**
 * Encodes a {@link TenantScope} for hand-off to background workers (queue messages, job
 * metadata) as Base64 JSON.
 * <p>
 * Only identities travel: the tenant is carried by id and re-resolved when the worker rebinds,
 * so a tenant suspended after the job was enqueued is refused at execution time.
 */
public final class TenantScopeCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Wire form of a scope.
     */
    public record ScopeTicket(
            @JsonProperty("tenant_id") String tenantId,
            @JsonProperty("principal_id") String principalId,
            @JsonProperty("principal_type") PrincipalType principalType,
            @JsonProperty("roles") List<String> roles,
            @JsonProperty("scopes") Set<String> scopes,
            @JsonProperty("api_key_id") String apiKeyId,
            @JsonProperty("tier") RateLimitTier tier,
            @JsonProperty("request_id") String requestId
    ) {

        public Principal principal() {
            return new Principal(principalId, tenantId, principalType, roles, scopes, apiKeyId, tier);
        }
    }

    private TenantScopeCodec() {
    }

    public static String encode(TenantScope scope) {
        Principal p = scope.principal();
        var ticket = new ScopeTicket(scope.tenantId(), p.id(), p.type(), p.roles(), p.scopes(),
                p.apiKeyId(), p.tier(), scope.requestId());
        try {
            return Base64.getEncoder().encodeToString(MAPPER.writeValueAsBytes(ticket));
        } catch (JsonProcessingException e) {
            throw new ScopeEncodingException("Failed to encode tenant scope", e);
        }
    }

    public static ScopeTicket decode(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new ScopeEncodingException("Encoded tenant scope is empty", null);
        }
        try {
            return MAPPER.readValue(Base64.getDecoder().decode(encoded), ScopeTicket.class);
        } catch (Exception e) {
            throw new ScopeEncodingException("Failed to decode tenant scope", e);
        }
    }

    /**
     * Thrown when a scope cannot be encoded or decoded.
     */
    public static class ScopeEncodingException extends RuntimeException {
        public ScopeEncodingException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
