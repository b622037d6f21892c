package com.rosarchitect.core.launch;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link LaunchSourceResolver} backed by a map of path to content.
 *
 * <p>Useful for embedding and for tests:
 * <pre>{@code
 * LaunchSourceResolver sources = InMemoryLaunchSourceResolver.builder()
 *     .add("/ws/robot.launch", "<launch>...</launch>")
 *     .build();
 * }</pre>
 */
public final class InMemoryLaunchSourceResolver implements LaunchSourceResolver {

    private final Map<String, String> files;

    private InMemoryLaunchSourceResolver(Map<String, String> files) {
        this.files = Map.copyOf(files);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public LaunchSource resolve(String path) throws IOException {
        String content = files.get(path);
        if (content == null) {
            throw new NoSuchFileException(path);
        }
        return new LaunchSource(path, content);
    }

    /**
     * Builder collecting files.
     */
    public static final class Builder {
        private final Map<String, String> files = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(String path, String content) {
            files.put(path, content);
            return this;
        }

        public InMemoryLaunchSourceResolver build() {
            return new InMemoryLaunchSourceResolver(files);
        }
    }
}
