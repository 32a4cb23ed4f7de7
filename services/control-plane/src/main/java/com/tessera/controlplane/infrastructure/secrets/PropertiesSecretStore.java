package com.tessera.controlplane.infrastructure.secrets;

import com.tessera.security.secrets.SecretStore;
import java.util.Map;
import java.util.Optional;

/**
 * Secret store backed by {@code tessera.secrets.values}, for deployments that inject secrets as
 * environment variables or mounted configuration. Always reachable.
 */
public class PropertiesSecretStore implements SecretStore {

    private final Map<String, String> values;

    public PropertiesSecretStore(Map<String, String> values) {
        this.values = values == null ? Map.of() : Map.copyOf(values);
    }

    @Override
    public boolean isReachable() {
        return true;
    }

    @Override
    public Optional<String> get(String name) {
        return Optional.ofNullable(values.get(name));
    }
}
