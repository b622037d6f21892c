package com.rosarchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A resolved node together with the interfaces its model declared.
 *
 * <p>Unmodeled nodes are stubs: they take part in the graph but declare nothing.
 *
 * @param record resolved launch record
 * @param modeled false when no node model was found for the record
 * @param nodelet true when the node is a nodelet or nodelet manager
 * @param interfaces declarations emitted by the model, in emission order
 * @param diagnostics warnings produced while resolving this node
 */
public record ResolvedNodeInstance(
    ResolvedNodeRecord record,
    boolean modeled,
    boolean nodelet,
    List<InterfaceDeclaration> interfaces,
    List<Diagnostic> diagnostics
) {
    /**
     * Compact constructor with validation.
     */
    public ResolvedNodeInstance {
        Objects.requireNonNull(record, "record must not be null");
        interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * Returns the absolute node name.
     *
     * @return full name of the underlying record
     */
    public String fullName() {
        return record.fullName();
    }
}
