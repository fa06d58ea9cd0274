package com.cloudname.generator.naming.config;

import lombok.Builder;
import lombok.Data;

/**
 * Raw service configuration as read by the caller, before defaults are applied.
 */
@Data
@Builder
public class ServiceConfig {

    /**
     * Name of the service. Required.
     */
    private String service;

    private ProviderConfig provider;

    private DeployConfig deploy;

    /**
     * Timestamp fixed by an earlier packaging step, epoch milliseconds.
     */
    private Long packageTimestamp;
}
