package com.tessera.security.apikey;

/**
 * @param replacement the newly issued key, including its one-time plaintext
 * @param previous    the rotated key, now revoked or scheduled for revocation at the end of the
 *                    grace period
 */
public record RotationResult(IssuedApiKey replacement, ApiKey previous) {
}
