package com.rosarchitect.workspace;

import com.rosarchitect.core.launch.LaunchSource;
import com.rosarchitect.core.launch.LaunchSourceResolver;
import com.rosarchitect.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads launch, YAML and text files from disk.
 *
 * <p>Relative paths are resolved against a base directory. The returned source path is
 * the normalized absolute path, so the same file reached through different relative
 * paths is recognized when detecting include cycles.
 */
public class FileSystemLaunchSourceResolver implements LaunchSourceResolver {

    private final Path baseDirectory;

    public FileSystemLaunchSourceResolver() {
        this(Paths.get(""));
    }

    public FileSystemLaunchSourceResolver(Path baseDirectory) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
    }

    @Override
    public LaunchSource resolve(String path) throws IOException {
        Path file = baseDirectory.resolve(path).normalize();
        return new LaunchSource(FileUtils.toPortableString(file), FileUtils.readString(file));
    }
}
