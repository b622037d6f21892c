package com.rosarchitect.core.launch;

import java.io.IOException;

/**
 * Capability turning a resolved path into file content.
 *
 * <p>Used for the root launch file, included launch files, {@code rosparam} files and
 * {@code param textfile} values. Implementations decide how paths map to storage; the
 * returned {@link LaunchSource#path()} must be stable for the same file so include cycles
 * can be detected.
 */
@FunctionalInterface
public interface LaunchSourceResolver {

    /**
     * Reads a file.
     *
     * @param path resolved path, possibly relative
     * @return file content with its canonical path
     * @throws IOException if the file cannot be read
     */
    LaunchSource resolve(String path) throws IOException;
}
