package com.cloudname.generator.cli.output;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cloudname.generator.naming.model.GeneratedName;
import com.cloudname.generator.naming.model.NamingContext;

/**
 * Responsible only for printing CLI output for the "names" command.
 */
public class NamesResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(NamesResultsPrinter.class);

    public void printBanner(NamingContext context) {
        log.info("=================================================");
        log.info("Cloud Resource Name Generator");
        log.info("=================================================");
        log.info("Service: {}", context.getServiceName());
        log.info("Region: {}", context.getRegion());
        log.info("Stage: {}", context.getStage());
        log.info("Prefix: {}", context.getPrefix());
        log.info("Rollback: {}", context.isRollbackEnabled());
        if (!context.getResourceNameOverrides().isEmpty()) {
            log.info("Explicit Names: {}", context.getResourceNameOverrides().keySet());
        }
        log.info("=================================================");
    }

    public void printNames(List<GeneratedName> names, String artifactName) {
        for (GeneratedName name : names) {
            log.info("{}: {}", padRight(name.getResourceType().getArmType()), name.getName());
        }
        log.info("{}: {}", padRight("Artifact"), artifactName);
        log.info("=================================================");
    }

    public void printName(GeneratedName name) {
        log.info("{}", name.getName());
    }

    public void printFailure(List<String> errors) {
        log.error("Name generation failed:");
        errors.forEach(e -> log.error("  {}", e));
    }

    private static String padRight(String s) {
        return String.format("%-36s", s);
    }
}
