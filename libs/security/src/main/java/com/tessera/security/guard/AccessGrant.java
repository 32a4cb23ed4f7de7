package com.tessera.security.guard;

import com.tessera.security.ratelimit.RateLimitDecision;
import com.tessera.security.tenant.TenantScope;

/**
 * An admitted request: the scope to bind while serving it and the rate-limit state to report.
 */
public record AccessGrant(TenantScope scope, RateLimitDecision rateLimit) {
}
