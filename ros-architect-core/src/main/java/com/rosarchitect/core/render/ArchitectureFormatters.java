package com.rosarchitect.core.render;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Discovers {@link ArchitectureFormatter}s with {@link ServiceLoader}.
 */
public final class ArchitectureFormatters {

    private ArchitectureFormatters() {
        // Utility class
    }

    /**
     * Returns every formatter on the classpath.
     *
     * @return formatters sorted by identifier
     */
    public static List<ArchitectureFormatter> available() {
        return ServiceLoader.load(ArchitectureFormatter.class).stream()
            .map(ServiceLoader.Provider::get)
            .sorted(Comparator.comparing(ArchitectureFormatter::getId))
            .collect(Collectors.toList());
    }

    /**
     * Finds a formatter by identifier.
     *
     * @param id formatter identifier
     * @return formatter, if available
     */
    public static Optional<ArchitectureFormatter> find(String id) {
        return available().stream()
            .filter(formatter -> formatter.getId().equalsIgnoreCase(id))
            .findFirst();
    }
}
