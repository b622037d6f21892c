package com.rosarchitect.workspace;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.rosarchitect.core.launch.PackageLocator;
import com.rosarchitect.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Resolves {@code $(find PKG)} by scanning workspace directories for {@code package.xml}.
 *
 * <p>The package name is the {@code <name>} element of the manifest, read with Jackson's
 * {@link XmlMapper}. When two manifests declare the same name, the first workspace wins;
 * within one workspace the lexically first path wins.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PackageLocator packages = WorkspacePackageLocator.scan(List.of(Path.of("src")));
 * Optional<String> dir = packages.locate("turtlebot_bringup");
 * }</pre>
 */
public final class WorkspacePackageLocator implements PackageLocator {

    private static final Logger log = LoggerFactory.getLogger(WorkspacePackageLocator.class);
    private static final String MANIFEST_PATTERN = "package.xml";
    private static final XmlMapper XML_MAPPER = new XmlMapper();

    private final Map<String, String> packages;

    private WorkspacePackageLocator(Map<String, String> packages) {
        this.packages = Collections.unmodifiableMap(packages);
    }

    /**
     * Scans workspaces for package manifests.
     *
     * @param workspaces workspace directories, in priority order
     * @return locator over the discovered packages
     * @throws UncheckedIOException if a workspace cannot be walked
     */
    public static WorkspacePackageLocator scan(List<Path> workspaces) {
        Map<String, String> packages = new TreeMap<>();
        for (Path workspace : workspaces) {
            if (!Files.isDirectory(workspace)) {
                log.warn("Workspace directory not found: {}", workspace);
                continue;
            }
            try {
                for (Path manifest : FileUtils.findFiles(workspace, MANIFEST_PATTERN)) {
                    register(packages, manifest);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to scan workspace " + workspace, e);
            }
        }
        log.info("Discovered {} package(s) in {} workspace(s)", packages.size(), workspaces.size());
        return new WorkspacePackageLocator(packages);
    }

    private static void register(Map<String, String> packages, Path manifest) {
        Optional<String> name = readPackageName(manifest);
        if (name.isEmpty()) {
            log.warn("Ignoring manifest without <name>: {}", manifest);
            return;
        }
        String directory = FileUtils.toPortableString(manifest.toAbsolutePath().normalize().getParent());
        String existing = packages.putIfAbsent(name.get(), directory);
        if (existing != null && !existing.equals(directory)) {
            log.warn("Package {} found in {} and {}; using {}", name.get(), existing, directory, existing);
        } else {
            log.debug("Found package {} at {}", name.get(), directory);
        }
    }

    private static Optional<String> readPackageName(Path manifest) {
        try {
            JsonNode root = XML_MAPPER.readTree(manifest.toFile());
            JsonNode name = root == null ? null : root.get("name");
            if (name == null || name.asText().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(name.asText().trim());
        } catch (IOException e) {
            log.warn("Failed to parse package manifest {}: {}", manifest, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<String> locate(String packageName) {
        return Optional.ofNullable(packages.get(packageName));
    }

    /**
     * Returns every discovered package.
     *
     * @return package name to absolute directory, sorted by name
     */
    public Map<String, String> packages() {
        return packages;
    }
}
