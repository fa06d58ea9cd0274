package com.cloudname.generator.naming.util;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import lombok.experimental.UtilityClass;

/**
 * Maps Azure region and stage names to the short tokens used inside resource names.
 */
@UtilityClass
public class ShortFormEncoder {

    private static final List<String> KNOWN_REGIONS = List.of(
            "eastus", "eastus2", "westus", "westus2", "westus3", "centralus",
            "northcentralus", "southcentralus", "westcentralus",
            "canadacentral", "canadaeast", "brazilsouth",
            "northeurope", "westeurope", "francecentral", "germanywestcentral",
            "norwayeast", "swedencentral", "switzerlandnorth",
            "uksouth", "ukwest",
            "eastasia", "southeastasia", "japaneast", "japanwest",
            "koreacentral", "koreasouth", "centralindia", "southindia", "westindia",
            "australiaeast", "australiasoutheast", "australiacentral",
            "southafricanorth", "uaenorth");

    private static final Map<String, String> REGION_WORDS = new LinkedHashMap<>();

    static {
        REGION_WORDS.put("north", "n");
        REGION_WORDS.put("south", "s");
        REGION_WORDS.put("east", "e");
        REGION_WORDS.put("west", "w");
        REGION_WORDS.put("central", "c");
    }

    private static final Map<String, String> STAGES = Map.of(
            "dogfood", "df",
            "production", "prod",
            "development", "dev",
            "testing", "test");

    private static final Map<String, String> REGIONS = buildRegionTable();

    /**
     * Returns the short token for a known region (westus -> wus, "North Central US" -> ncus).
     * Unknown regions come back unchanged.
     */
    public static String shortRegion(String region) {
        if (region == null) {
            return "";
        }
        String key = region.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
        return REGIONS.getOrDefault(key, region);
    }

    /**
     * Returns the short token for a known stage (production -> prod). Unknown stages come back unchanged.
     */
    public static String shortStage(String stage) {
        if (stage == null) {
            return "";
        }
        return STAGES.getOrDefault(stage.trim().toLowerCase(Locale.ROOT), stage);
    }

    private static Map<String, String> buildRegionTable() {
        Map<String, String> table = new LinkedHashMap<>();
        for (String region : KNOWN_REGIONS) {
            String shortName = region;
            for (Map.Entry<String, String> word : REGION_WORDS.entrySet()) {
                shortName = shortName.replace(word.getKey(), word.getValue());
            }
            table.put(region, shortName);
        }
        return Map.copyOf(table);
    }
}
