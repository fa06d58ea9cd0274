package com.cloudname.generator.naming.model;

import static com.cloudname.generator.naming.model.PartRole.LITERAL_SUFFIX;
import static com.cloudname.generator.naming.model.PartRole.PREFIX;
import static com.cloudname.generator.naming.model.PartRole.REGION;
import static com.cloudname.generator.naming.model.PartRole.SERVICE_HASH;
import static com.cloudname.generator.naming.model.PartRole.STAGE;
import static com.cloudname.generator.naming.model.PartRole.TIMESTAMP;

import java.util.Arrays;

import com.cloudname.generator.naming.exception.UnsupportedResourceTypeException;

import lombok.Getter;

/**
 * Resource kinds the naming service knows how to name, each with its ARM
 * type key and naming template.
 */
@Getter
public enum ResourceType {

    RESOURCE_GROUP("Microsoft.Resources/resourceGroups", ResourceTypeTemplate.builder()
            .role(PREFIX).role(REGION).role(STAGE).role(SERVICE_HASH).role(LITERAL_SUFFIX)
            .literalSuffix("rg")
            .maxLength(90)
            .build()),

    DEPLOYMENT("Microsoft.Resources/deployments", ResourceTypeTemplate.builder()
            .role(PREFIX).role(REGION).role(STAGE).role(SERVICE_HASH).role(LITERAL_SUFFIX).role(TIMESTAMP)
            .literalSuffix("deployment")
            .maxLength(64)
            .charFilter(CharFilter.ALPHANUMERIC_HYPHEN)
            .hashed(true)
            .alwaysBudgeted(true)
            .build()),

    FUNCTION_APP("Microsoft.Web/sites", ResourceTypeTemplate.builder()
            .role(PREFIX).role(REGION).role(STAGE).role(SERVICE_HASH)
            .maxLength(60)
            .charFilter(CharFilter.ALPHANUMERIC_HYPHEN)
            .build()),

    APP_SERVICE_PLAN("Microsoft.Web/serverFarms", configured("asp", 40, CharFilter.ALPHANUMERIC_HYPHEN)),

    HOSTING_ENVIRONMENT("Microsoft.Web/hostingEnvironments", configured("ase", 40, CharFilter.ALPHANUMERIC_HYPHEN)),

    API_MANAGEMENT("Microsoft.ApiManagement/service", configured("apim", 50, CharFilter.ALPHANUMERIC_HYPHEN)),

    APP_INSIGHTS("Microsoft.Insights/components", configured("appinsights", 255, CharFilter.ANY)),

    VIRTUAL_NETWORK("Microsoft.Network/virtualNetworks", configured("vnet", 64, CharFilter.ANY)),

    // Storage accounts: lowercase letters and digits only, no separators
    STORAGE_ACCOUNT("Microsoft.Storage/storageAccounts", ResourceTypeTemplate.builder()
            .role(PREFIX).role(REGION).role(STAGE).role(SERVICE_HASH)
            .maxLength(24)
            .delimiter("")
            .charFilter(CharFilter.ALPHANUMERIC)
            .hashed(true)
            .alwaysBudgeted(true)
            .build());

    private final String armType;
    private final ResourceTypeTemplate template;

    ResourceType(String armType, ResourceTypeTemplate template) {
        this.armType = armType;
        this.template = template;
    }

    /**
     * Looks up a resource kind by its ARM type key (case-insensitive) or by constant name.
     *
     * @throws UnsupportedResourceTypeException if no kind matches
     */
    public static ResourceType fromArmType(String armType) {
        if (armType == null || armType.isBlank()) {
            throw new UnsupportedResourceTypeException(armType);
        }
        String key = armType.trim();
        return Arrays.stream(values())
                .filter(t -> t.armType.equalsIgnoreCase(key) || t.name().equalsIgnoreCase(key))
                .findFirst()
                .orElseThrow(() -> new UnsupportedResourceTypeException(armType));
    }

    private static ResourceTypeTemplate configured(String suffix, int maxLength, CharFilter filter) {
        return ResourceTypeTemplate.builder()
                .role(PREFIX).role(REGION).role(STAGE).role(LITERAL_SUFFIX)
                .literalSuffix(suffix)
                .maxLength(maxLength)
                .charFilter(filter)
                .build();
    }
}
