package com.rosarchitect.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Global view of one service after remapping.
 *
 * <p>A well-formed service has at most one provider. Conflicting providers are all kept
 * so they can be reported.
 *
 * @param name absolute service name
 * @param types distinct declared types, sorted
 * @param providers providing nodes in launch evaluation order
 * @param callers calling nodes in launch evaluation order
 */
public record ServiceInfo(
    String name,
    List<String> types,
    List<String> providers,
    List<String> callers
) {
    /**
     * Compact constructor with validation.
     */
    public ServiceInfo {
        Objects.requireNonNull(name, "name must not be null");
        types = types == null ? List.of() : List.copyOf(types);
        providers = providers == null ? List.of() : List.copyOf(providers);
        callers = callers == null ? List.of() : List.copyOf(callers);
    }

    /**
     * Returns the provider of this service.
     *
     * @return the first provider, or empty if nobody provides the service
     */
    public Optional<String> provider() {
        return providers.isEmpty() ? Optional.empty() : Optional.of(providers.get(0));
    }

    /**
     * Returns true if more than one node provides this service.
     *
     * @return true on a provider conflict
     */
    public boolean hasProviderConflict() {
        return providers.size() > 1;
    }
}
