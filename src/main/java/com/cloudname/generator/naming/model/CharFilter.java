package com.cloudname.generator.naming.model;

/**
 * Predicate deciding which characters a resource kind accepts in its name.
 */
@FunctionalInterface
public interface CharFilter {

    CharFilter ANY = c -> true;

    CharFilter ALPHANUMERIC = c -> (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');

    CharFilter ALPHANUMERIC_HYPHEN = c -> c == '-' || ALPHANUMERIC.allows(c);

    boolean allows(char c);
}
