package com.cloudname.generator.naming.config;

/**
 * Defaults and fixed name tokens.
 */
public final class NamingDefaults {

    public static final String DEFAULT_REGION = "westus";

    /**
     * Region the framework fills in when the user set none; treated as unset.
     */
    public static final String PLACEHOLDER_REGION = "us-east-1";

    public static final String DEFAULT_STAGE = "dev";

    public static final String DEFAULT_PREFIX = "sls";

    public static final String DEPLOYMENT_NAME_SUFFIX = "-deployment";

    public static final String ROLLBACK_TIMESTAMP_MARKER = "t";

    public static final String RESOURCE_GROUP_DEPLOYMENT_TOKEN = "rg-deployment";

    public static final String DEPLOYMENT_TOKEN = "deployment";

    public static final String ARTIFACT_TOKEN = "artifact";

    public static final String ARTIFACT_EXTENSION = ".zip";

    private NamingDefaults() {
    }
}
