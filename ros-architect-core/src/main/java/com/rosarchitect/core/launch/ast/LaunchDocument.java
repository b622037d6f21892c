package com.rosarchitect.core.launch.ast;

import java.util.List;
import java.util.Objects;

/**
 * A parsed launch file.
 *
 * @param source launch file path
 * @param directives top-level directives in document order
 */
public record LaunchDocument(
    String source,
    List<LaunchDirective> directives
) {
    public LaunchDocument {
        Objects.requireNonNull(source, "source must not be null");
        directives = directives == null ? List.of() : List.copyOf(directives);
    }
}
