package com.cloudname.generator.naming.config;

import java.util.Map;

import com.cloudname.generator.naming.model.ResourceType;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Provider section of the service configuration. Every field is optional.
 */
@Data
@Builder
public class ProviderConfig {

    private String region;
    private String stage;
    private String prefix;
    private String resourceGroup;
    private String deploymentName;

    /**
     * Explicit names for individual resources, used verbatim.
     */
    @Singular
    private Map<ResourceType, String> resourceNames;
}
