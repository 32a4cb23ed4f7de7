package com.tessera.controlplane.infrastructure.identity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.security.credential.SigningKeyException;
import com.tessera.security.credential.SigningKeyProvider;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.time.Duration;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches the realm signing key from a Keycloak-style identity provider.
 *
 * <p>{@code GET {issuerUrl}/realms/{realm}} answers with a JSON document whose {@code public_key}
 * field holds the Base64 DER encoding of the realm's RSA key. A realm has one active key, so the
 * {@code kid} is not used to select it and the resolver in front of this provider caches a single
 * entry.
 */
public class RealmPublicKeyProvider implements SigningKeyProvider {

    private static final Logger log = LoggerFactory.getLogger(RealmPublicKeyProvider.class);

    static final String PUBLIC_KEY_FIELD = "public_key";

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final URI realmUri;
    private final Duration timeout;

    public RealmPublicKeyProvider(
            HttpClient client, ObjectMapper mapper, String issuerUrl, String realm, Duration timeout) {
        if (client == null || mapper == null) {
            throw new IllegalArgumentException("client and mapper are required");
        }
        if (issuerUrl == null || issuerUrl.isBlank() || realm == null || realm.isBlank()) {
            throw new IllegalArgumentException("issuerUrl and realm are required");
        }
        String base = issuerUrl.endsWith("/") ? issuerUrl.substring(0, issuerUrl.length() - 1) : issuerUrl;
        this.client = client;
        this.mapper = mapper;
        this.realmUri = URI.create(base + "/realms/" + realm);
        this.timeout = timeout == null ? Duration.ofSeconds(5) : timeout;
    }

    @Override
    public PublicKey fetch(String keyId) {
        HttpRequest request = HttpRequest.newBuilder(realmUri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SigningKeyException("Identity provider unreachable at " + realmUri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SigningKeyException("Interrupted while fetching the realm key", e);
        }
        if (response.statusCode() != 200) {
            log.warn("Identity provider answered {} for {}", response.statusCode(), realmUri);
            throw new SigningKeyException(
                    "Identity provider answered %d for %s".formatted(response.statusCode(), realmUri));
        }
        return parse(response.body());
    }

    @Override
    public boolean selectsByKeyId() {
        return false;
    }

    PublicKey parse(String body) {
        String encoded;
        try {
            JsonNode node = mapper.readTree(body).path(PUBLIC_KEY_FIELD);
            encoded = node.isTextual() ? node.asText() : null;
        } catch (IOException e) {
            throw new SigningKeyException("Realm document is not valid JSON", e);
        }
        if (encoded == null || encoded.isBlank()) {
            throw new SigningKeyException("Realm document has no " + PUBLIC_KEY_FIELD);
        }
        try {
            byte[] der = Base64.getDecoder().decode(encoded.strip());
            return KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new SigningKeyException("Realm public key cannot be decoded", e);
        }
    }

    public URI realmUri() {
        return realmUri;
    }
}
