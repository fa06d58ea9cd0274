package com.cloudname.generator.naming.config;

import java.util.Map;

import com.cloudname.generator.naming.model.ResourceType;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Values given on the command line. They take precedence over the service configuration.
 */
@Value
@Builder
public class CliOverrides {

    public static final CliOverrides NONE = CliOverrides.builder().build();

    String region;
    String stage;
    String resourceGroup;

    @Singular
    Map<ResourceType, String> resourceNames;
}
