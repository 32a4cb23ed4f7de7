package com.tessera.security.audit;

import com.tessera.security.credential.Principal;

/**
 * Who performed an audited action.
 *
 * @param id        user id, API key id, or the name of the system component
 * @param type      kind of actor
 * @param ipAddress client address, when known
 */
public record Actor(String id, ActorType type, String ipAddress) {

    public Actor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
    }

    public static Actor of(Principal principal, String ipAddress) {
        return new Actor(principal.id(), principal.isApiKey() ? ActorType.API_KEY : ActorType.USER, ipAddress);
    }

    public static Actor of(Principal principal) {
        return of(principal, null);
    }

    public static Actor system(String component) {
        return new Actor(component, ActorType.SYSTEM, null);
    }
}
