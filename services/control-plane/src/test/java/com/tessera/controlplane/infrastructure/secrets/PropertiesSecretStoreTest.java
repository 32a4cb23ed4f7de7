package com.tessera.controlplane.infrastructure.secrets;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PropertiesSecretStore")
class PropertiesSecretStoreTest {

    @Test
    @DisplayName("returns configured values and nothing else")
    void returnsConfiguredValues() {
        var store = new PropertiesSecretStore(Map.of("identity-client-secret", "s3cr3t"));

        assertThat(store.isReachable()).isTrue();
        assertThat(store.get("identity-client-secret")).contains("s3cr3t");
        assertThat(store.get("redis-password")).isEmpty();
    }

    @Test
    @DisplayName("treats missing configuration as an empty store")
    void acceptsNull() {
        assertThat(new PropertiesSecretStore(null).get("anything")).isEmpty();
    }
}
