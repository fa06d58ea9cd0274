package com.cloudname.generator.naming.model;

/**
 * Role a component plays inside a composed resource name.
 * The budget allocator decides what it may shrink or extend based on the role.
 */
public enum PartRole {
    PREFIX,
    REGION,
    STAGE,
    SERVICE_HASH,
    LITERAL_SUFFIX,
    TIMESTAMP
}
