package com.tessera.security.audit;

public enum ActorType {

    USER("user"),
    API_KEY("api_key"),
    SYSTEM("system");

    private final String value;

    ActorType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
