package com.tessera.security.permission;

/**
 * Which rule produced a {@link PermissionDecision}.
 */
public enum DecisionSource {
    OVERRIDE,
    MATRIX,
    RELATIONSHIP,
    NONE
}
