package com.cloudname.generator.naming.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Static naming rules for one resource kind: which parts make up the name,
 * how they are joined, and what the platform allows.
 */
@Value
@Builder
public class ResourceTypeTemplate {

    @Singular
    List<PartRole> roles;

    int maxLength;

    @NonNull
    @Builder.Default
    String delimiter = "-";

    @NonNull
    @Builder.Default
    CharFilter charFilter = CharFilter.ANY;

    /**
     * Fixed text used for the LITERAL_SUFFIX role, e.g. "rg" or "vnet".
     */
    @NonNull
    @Builder.Default
    String literalSuffix = "";

    /**
     * Use the content hash of the service name instead of the raw name.
     */
    boolean hashed;

    /**
     * Run the budget allocator even when the plain composition already fits.
     */
    boolean alwaysBudgeted;
}
