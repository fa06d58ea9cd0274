package com.cloudname.generator.cli;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cloudname.generator.cli.model.NamesOptions;
import com.cloudname.generator.cli.output.NamesResultsPrinter;
import com.cloudname.generator.naming.config.CliOverrides;
import com.cloudname.generator.naming.config.ConfigResolver;
import com.cloudname.generator.naming.config.DeployConfig;
import com.cloudname.generator.naming.config.ProviderConfig;
import com.cloudname.generator.naming.config.ServiceConfig;
import com.cloudname.generator.naming.exception.NamingConfigurationException;
import com.cloudname.generator.naming.exception.UnsupportedResourceTypeException;
import com.cloudname.generator.naming.model.NamingContext;
import com.cloudname.generator.naming.model.ResourceType;
import com.cloudname.generator.naming.service.ResourceNamingService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command printing the resource names a deployment would use.
 */
@Command(
        name = "names",
        mixinStandardHelpOptions = true,
        version = "cloud-resource-namer 1.0.0",
        description = "Derives Azure resource, deployment and artifact names for a service."
)
public class NamesCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(NamesCommand.class);

    @Mixin
    private NamesOptions options;

    private final ConfigResolver resolver = new ConfigResolver();
    private final NamesResultsPrinter printer;

    public NamesCommand() {
        this(new NamesResultsPrinter());
    }

    public NamesCommand(NamesResultsPrinter printer) {
        this.printer = printer;
    }

    @Override
    public Integer call() {
        try {
            NamingContext context = resolver.resolve(toServiceConfig(), toOverrides());
            ResourceNamingService naming = new ResourceNamingService(context);

            if (options.getResourceType() != null) {
                ResourceType type = ResourceType.fromArmType(options.getResourceType());
                printer.printName(naming.generate(type));
                return 0;
            }

            printer.printBanner(context);
            printer.printNames(naming.allNames(), naming.artifactName());
            return 0;

        } catch (NamingConfigurationException e) {
            printer.printFailure(e.getErrors());
            return 1;
        } catch (UnsupportedResourceTypeException e) {
            printer.printFailure(List.of(e.getMessage()));
            return 1;
        } catch (Exception e) {
            log.error("Name generation failed with exception", e);
            return 1;
        }
    }

    private ServiceConfig toServiceConfig() {
        // region, stage and resource group are passed as overrides
        return ServiceConfig.builder()
                .service(options.getService())
                .provider(ProviderConfig.builder()
                        .prefix(options.getPrefix())
                        .deploymentName(options.getDeploymentName())
                        .build())
                .deploy(new DeployConfig(options.isRollback()))
                .packageTimestamp(options.getPackageTimestamp())
                .build();
    }

    private CliOverrides toOverrides() {
        Map<ResourceType, String> names = options.getResourceNames() != null ? options.getResourceNames() : Map.of();
        return CliOverrides.builder()
                .region(options.getRegion())
                .stage(options.getStage())
                .resourceGroup(options.getResourceGroup())
                .resourceNames(names)
                .build();
    }
}
