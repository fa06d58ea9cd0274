package com.cloudname.generator.cli.model;

import java.util.Map;

import com.cloudname.generator.naming.model.ResourceType;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "names" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class NamesOptions {

    @Option(names = { "--service", "-n" }, description = "Name of the service")
    private String service;

    @Option(names = { "--region", "-r" }, description = "Azure region (default: westus)")
    private String region;

    @Option(names = { "--stage", "-s" }, description = "Deployment stage (default: dev)")
    private String stage;

    @Option(names = { "--prefix" }, description = "Prefix for composed resource names (default: sls)")
    private String prefix;

    @Option(names = { "--resource-group", "-g" }, description = "Resource group to deploy into")
    private String resourceGroup;

    @Option(names = { "--deployment-name" }, description = "Explicit ARM deployment name")
    private String deploymentName;

    @Option(names = { "--rollback" }, description = "Append the session timestamp to the deployment name")
    private boolean rollback;

    @Option(names = {
            "--package-timestamp" }, description = "Timestamp (epoch millis) fixed by an earlier package step")
    private Long packageTimestamp;

    @Option(names = { "--resource-name" }, description = "Explicit resource name, e.g. STORAGE_ACCOUNT=mystore (repeatable)")
    private Map<ResourceType, String> resourceNames;

    @Option(names = {
            "--resource-type" }, description = "Print only the name for this ARM type, e.g. Microsoft.Storage/storageAccounts")
    private String resourceType;
}
