package com.cloudname.generator.naming.exception;

import java.util.List;

/**
 * Raised when the configuration cannot be resolved into a naming context.
 * Holds every problem found so they can be reported together.
 */
public class NamingConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public NamingConfigurationException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public NamingConfigurationException(String error) {
        this(List.of(error));
    }

    public List<String> getErrors() {
        return errors;
    }
}
