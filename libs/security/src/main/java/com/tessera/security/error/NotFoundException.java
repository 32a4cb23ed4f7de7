package com.tessera.security.error;

import java.util.Map;

/**
 * A tenant-scoped resource does not exist for the requesting tenant. Resources owned by another
 * tenant are reported the same way.
 */
public class NotFoundException extends ControlPlaneException {

    public NotFoundException(String resourceType, String resourceId) {
        super(ErrorCode.NOT_FOUND, "%s not found: %s".formatted(resourceType, resourceId),
                Map.of("resource_type", resourceType, "resource_id", resourceId));
    }
}
