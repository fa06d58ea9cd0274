package com.cloudname.generator.naming.exception;

/**
 * Raised when a name is requested for a resource kind with no naming template.
 */
public class UnsupportedResourceTypeException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final String resourceType;

    public UnsupportedResourceTypeException(String resourceType) {
        super("Unsupported resource type: " + resourceType);
        this.resourceType = resourceType;
    }

    public String getResourceType() {
        return resourceType;
    }
}
