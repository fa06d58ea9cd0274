package com.cloudname.generator;

import com.cloudname.generator.cli.NamesCommand;
import picocli.CommandLine;

/**
 * Main entry point for the cloud resource name generator.
 * Prints the names a deployment would use for its Azure resources.
 */
public class NamingApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new NamesCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
