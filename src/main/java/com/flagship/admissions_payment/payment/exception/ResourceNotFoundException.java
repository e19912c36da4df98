package com.flagship.admissions_payment.payment.exception;

/**
 * Base type for lookups of an unknown payment, application or user.
 * Mapped to 404 by {@link GlobalExceptionHandler}.
 */
public abstract class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceKey;

    protected ResourceNotFoundException(String resourceType, String resourceKey) {
        super(resourceType + " not found: " + resourceKey);
        this.resourceType = resourceType;
        this.resourceKey = resourceKey;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceKey() {
        return resourceKey;
    }
}
