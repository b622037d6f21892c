package com.rosarchitect.core.launch;

import java.util.Objects;

/**
 * Content of a launch file or parameter file.
 *
 * @param path canonical path; used as identity for include-cycle detection
 * @param content file content
 */
public record LaunchSource(
    String path,
    String content
) {
    public LaunchSource {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Returns the directory part of the path.
     *
     * @return everything before the last {@code /}, or {@code .} when there is none
     */
    public String directory() {
        int slash = path.lastIndexOf('/');
        if (slash < 0) {
            return ".";
        }
        return slash == 0 ? "/" : path.substring(0, slash);
    }
}
