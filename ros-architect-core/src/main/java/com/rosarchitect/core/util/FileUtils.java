package com.rosarchitect.core.util;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds files matching a glob pattern starting from a root directory.
     *
     * <p>Example patterns: {@code **}{@code /package.xml}, {@code launch/*.launch}.
     *
     * @param rootPath root directory to search from
     * @param globPattern glob pattern, matched against paths relative to the root
     * @return matching paths in sorted order
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String globPattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);

        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> {
                    Path relativePath = rootPath.relativize(path);
                    return matcher.matches(relativePath) || matcher.matches(path.getFileName());
                })
                .sorted()
                .toList();
        }
    }

    /**
     * Reads a file as a string.
     *
     * @param path path to file
     * @return file content as string
     * @throws IOException if reading fails
     */
    public static String readString(Path path) throws IOException {
        return Files.readString(path);
    }

    /**
     * Returns the path with forward slashes, as used in launch file paths.
     *
     * @param path file system path
     * @return portable path string
     */
    public static String toPortableString(Path path) {
        return path.toString().replace('\\', '/');
    }
}
