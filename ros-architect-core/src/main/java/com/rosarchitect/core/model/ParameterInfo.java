package com.rosarchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Global view of one parameter.
 *
 * @param name absolute parameter name
 * @param value value assigned by the launch files, or null
 * @param assigned true if the launch files assign the parameter
 * @param owners nodes declaring the parameter as their own
 * @param readers nodes reading the parameter
 * @param writers nodes writing the parameter
 * @param dynamic true if any node reconfigures the parameter at runtime
 */
public record ParameterInfo(
    String name,
    Object value,
    boolean assigned,
    List<String> owners,
    List<String> readers,
    List<String> writers,
    boolean dynamic
) {
    /**
     * Compact constructor with validation.
     */
    public ParameterInfo {
        Objects.requireNonNull(name, "name must not be null");
        owners = owners == null ? List.of() : List.copyOf(owners);
        readers = readers == null ? List.of() : List.copyOf(readers);
        writers = writers == null ? List.of() : List.copyOf(writers);
    }
}
