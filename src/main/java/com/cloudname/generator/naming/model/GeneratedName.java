package com.cloudname.generator.naming.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A name produced for a resource kind, handed to provisioning and upload clients.
 */
@Value
public class GeneratedName {

    @NonNull
    ResourceType resourceType;

    @NonNull
    String name;

    @Override
    public String toString() {
        return resourceType.getArmType() + "=" + name;
    }
}
