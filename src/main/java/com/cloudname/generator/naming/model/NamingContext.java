package com.cloudname.generator.naming.model;

import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Resolved configuration driving every name computed during one deployment
 * or package operation. Built once by the config resolver, never mutated.
 */
@Value
@Builder(toBuilder = true)
public class NamingContext {

    @NonNull
    String serviceName;

    @NonNull
    String region;

    @NonNull
    String stage;

    @NonNull
    String prefix;

    boolean rollbackEnabled;

    @Singular
    Map<ResourceType, String> resourceNameOverrides;

    String resourceGroup;

    String deploymentName;

    Long packageTimestamp;

    public Optional<String> getResourceGroup() {
        return Optional.ofNullable(resourceGroup);
    }

    public Optional<String> getDeploymentName() {
        return Optional.ofNullable(deploymentName);
    }

    public Optional<Long> getPackageTimestamp() {
        return Optional.ofNullable(packageTimestamp);
    }

    public Optional<String> getResourceNameOverride(ResourceType type) {
        return Optional.ofNullable(resourceNameOverrides.get(type));
    }
}
