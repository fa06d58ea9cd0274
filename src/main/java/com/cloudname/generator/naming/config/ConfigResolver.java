package com.cloudname.generator.naming.config;

import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cloudname.generator.naming.exception.NamingConfigurationException;
import com.cloudname.generator.naming.model.NamingContext;
import com.cloudname.generator.naming.model.ResourceType;

import lombok.NoArgsConstructor;

/**
 * Builds the immutable naming context from the service configuration and
 * command-line overrides, applying defaults for anything left unset.
 */
@NoArgsConstructor
public class ConfigResolver {

    private static final Logger log = LoggerFactory.getLogger(ConfigResolver.class);

    /**
     * @param rawConfig    service configuration; must name the service
     * @param cliOverrides command-line values, may be null
     * @throws NamingConfigurationException if the service name is missing
     */
    public NamingContext resolve(ServiceConfig rawConfig, CliOverrides cliOverrides) {
        if (rawConfig == null || isBlank(rawConfig.getService())) {
            throw new NamingConfigurationException("service name required");
        }
        CliOverrides overrides = cliOverrides != null ? cliOverrides : CliOverrides.NONE;
        ProviderConfig provider = rawConfig.getProvider() != null
                ? rawConfig.getProvider()
                : ProviderConfig.builder().build();

        Map<ResourceType, String> resourceNames = mergeResourceNames(provider.getResourceNames(), overrides.getResourceNames());
        Map<ResourceType, String> cliNames = overrides.getResourceNames() != null ? overrides.getResourceNames() : Map.of();
        Map<ResourceType, String> configuredNames = provider.getResourceNames() != null ? provider.getResourceNames() : Map.of();

        // resource group and deployment names live in their own fields, not in the per-resource map
        String resourceGroup = firstNonBlank(overrides.getResourceGroup(), cliNames.get(ResourceType.RESOURCE_GROUP),
                provider.getResourceGroup(), configuredNames.get(ResourceType.RESOURCE_GROUP));
        String deploymentName = firstNonBlank(cliNames.get(ResourceType.DEPLOYMENT), provider.getDeploymentName(),
                configuredNames.get(ResourceType.DEPLOYMENT));
        resourceNames.remove(ResourceType.RESOURCE_GROUP);
        resourceNames.remove(ResourceType.DEPLOYMENT);

        NamingContext context = NamingContext.builder()
                .serviceName(rawConfig.getService())
                .region(firstNonBlank(overrides.getRegion(), configuredRegion(provider.getRegion())))
                .stage(firstNonBlank(overrides.getStage(), provider.getStage(), NamingDefaults.DEFAULT_STAGE))
                .prefix(firstNonBlank(provider.getPrefix(), NamingDefaults.DEFAULT_PREFIX))
                .resourceGroup(resourceGroup)
                .deploymentName(deploymentName)
                .rollbackEnabled(rawConfig.getDeploy() != null && rawConfig.getDeploy().isRollback())
                .resourceNameOverrides(resourceNames)
                .packageTimestamp(rawConfig.getPackageTimestamp())
                .build();

        log.debug("Resolved naming context: service={}, region={}, stage={}, prefix={}, rollback={}",
                context.getServiceName(), context.getRegion(), context.getStage(), context.getPrefix(),
                context.isRollbackEnabled());
        return context;
    }

    private static String configuredRegion(String region) {
        if (isBlank(region) || NamingDefaults.PLACEHOLDER_REGION.equalsIgnoreCase(region.trim())) {
            return NamingDefaults.DEFAULT_REGION;
        }
        return region;
    }

    private static Map<ResourceType, String> mergeResourceNames(Map<ResourceType, String> configured,
                                                                Map<ResourceType, String> overridden) {
        Map<ResourceType, String> merged = new EnumMap<>(ResourceType.class);
        putNonBlank(merged, configured);
        putNonBlank(merged, overridden);
        return merged;
    }

    private static void putNonBlank(Map<ResourceType, String> target, Map<ResourceType, String> source) {
        if (source == null) {
            return;
        }
        source.forEach((type, name) -> {
            if (type != null && !isBlank(name)) {
                target.put(type, name);
            }
        });
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value;
            }
        }
        return null;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
