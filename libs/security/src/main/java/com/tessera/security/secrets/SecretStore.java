package com.tessera.security.secrets;

import java.util.Optional;

/**
 * Read access to deployment secrets (signing material, store credentials).
 */
public interface SecretStore {

    /** Whether the backing store can currently be reached. */
    boolean isReachable();

    Optional<String> get(String name);
}
