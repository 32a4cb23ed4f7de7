package com.tessera.security.tenant;

import java.util.Locale;

/**
 * Tenant identities presented by a request, in precedence order.
 *
 * @param claimTenantId  tenant bound to the verified credential (token claim or API key owner)
 * @param headerTenantId value of the explicit tenant header
 * @param subdomain      leftmost label of the request host, if the host has one
 */
public record TenantHints(String claimTenantId, String headerTenantId, String subdomain) {

    /** Header carrying an explicit tenant id. */
    public static final String TENANT_HEADER = "X-Tenant-ID";

    public TenantHints {
        claimTenantId = blankToNull(claimTenantId);
        headerTenantId = blankToNull(headerTenantId);
        subdomain = blankToNull(subdomain);
    }

    public static TenantHints none() {
        return new TenantHints(null, null, null);
    }

    /**
     * Builds hints from transport values; the host is reduced to its subdomain.
     */
    public static TenantHints fromRequest(String headerTenantId, String host) {
        return new TenantHints(null, headerTenantId, subdomainOf(host));
    }

    public TenantHints withClaim(String tenantId) {
        return new TenantHints(tenantId, headerTenantId, subdomain);
    }

    public boolean isEmpty() {
        return claimTenantId == null && headerTenantId == null && subdomain == null;
    }

    /**
     * Returns the leftmost label of a host with at least three labels ({@code acme.example.com}
     * yields {@code acme}); shorter hosts, IP addresses and {@code www} yield null. A port suffix
     * is ignored.
     */
    public static String subdomainOf(String host) {
        if (host == null || host.isBlank()) {
            return null;
        }
        String hostname = host.trim().toLowerCase(Locale.ROOT);
        int colon = hostname.indexOf(':');
        if (colon >= 0) {
            hostname = hostname.substring(0, colon);
        }
        if (hostname.chars().allMatch(c -> Character.isDigit(c) || c == '.')) {
            return null;
        }
        String[] labels = hostname.split("\\.");
        if (labels.length <= 2 || labels[0].isEmpty() || labels[0].equals("www")) {
            return null;
        }
        return labels[0];
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
