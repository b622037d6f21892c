package com.rosarchitect.core.evaluator;

import com.rosarchitect.core.model.ResolvedNodeRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of evaluating a launch file.
 *
 * @param rootSource root launch file
 * @param nodes resolved node records in document order
 * @param parameters parameters assigned by the launch files, in assignment order;
 *                   values are null when they cannot be determined statically
 * @param sources launch files evaluated, in first-visit order
 */
public record LaunchEvaluation(
    String rootSource,
    List<ResolvedNodeRecord> nodes,
    Map<String, Object> parameters,
    List<String> sources
) {
    public LaunchEvaluation {
        Objects.requireNonNull(rootSource, "rootSource must not be null");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
