package com.rosarchitect.core.launch;

import java.util.Map;
import java.util.Optional;

/**
 * Capability resolving {@code $(find PKG)} to a package directory.
 */
@FunctionalInterface
public interface PackageLocator {

    /**
     * Locates a package.
     *
     * @param packageName ROS package name
     * @return package directory, or empty if the package is unknown
     */
    Optional<String> locate(String packageName);

    /**
     * Creates a locator over a fixed package map.
     *
     * @param packages package name to directory
     * @return locator
     */
    static PackageLocator of(Map<String, String> packages) {
        Map<String, String> copy = Map.copyOf(packages);
        return packageName -> Optional.ofNullable(copy.get(packageName));
    }

    /**
     * Returns a locator that knows no package.
     *
     * @return empty locator
     */
    static PackageLocator none() {
        return packageName -> Optional.empty();
    }
}
