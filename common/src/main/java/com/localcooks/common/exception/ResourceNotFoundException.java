package com.localcooks.common.exception;

/**
 * Thrown when a booking, listing or other addressed resource does not exist. Mapped to 404.
 */
public class ResourceNotFoundException extends BusinessException {

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(String.format("%s with identifier %s not found", resourceType, identifier), "RESOURCE_NOT_FOUND");
    }
}
