package com.tessera.security.credential;

/**
 * Kind of authenticated caller.
 */
public enum PrincipalType {

    USER("user"),
    API_KEY("api_key");

    private final String value;

    PrincipalType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
