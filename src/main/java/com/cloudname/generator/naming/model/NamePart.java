package com.cloudname.generator.naming.model;

import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * One component of a resource name.
 *
 * fullValue is the untruncated source the value was cut from. Only the
 * service part uses it, when spare length lets the name grow back.
 */
@Value
public class NamePart {

    @NonNull
    PartRole role;

    @With
    @NonNull
    String value;

    @With
    @NonNull
    String fullValue;

    public static NamePart of(PartRole role, String value) {
        String v = value == null ? "" : value;
        return new NamePart(role, v, v);
    }

    public static NamePart of(PartRole role, String value, String fullValue) {
        return new NamePart(role, value == null ? "" : value, fullValue == null ? "" : fullValue);
    }

    public int length() {
        return value.length();
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }
}
