package com.rosarchitect.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("rosarchitect.yaml");
        Files.writeString(configFile, """
            workspaces:
              - ./src
            models:
              - ./models/navigation.yaml
            environment:
              ROBOT_NAME: turtle
            resolver:
              threads: 4
            output:
              format: json
            launches:
              - filename: ./src/bringup/launch/robot.launch
                arguments:
                  sim: "true"
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.workspaces()).containsExactly("./src");
        assertThat(config.models()).containsExactly("./models/navigation.yaml");
        assertThat(config.environment()).containsEntry("ROBOT_NAME", "turtle");
        assertThat(config.resolver().threads()).isEqualTo(4);
        assertThat(config.output().format()).isEqualTo("json");
        assertThat(config.launches()).singleElement().satisfies(launch -> {
            assertThat(launch.filename()).isEqualTo("./src/bringup/launch/robot.launch");
            assertThat(launch.arguments()).containsEntry("sim", "true");
        });
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("rosarchitect.yaml");
        Files.writeString(configFile, """
            workspaces:
              - ./src
            unknownSection: ignored
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.workspaces()).containsExactly("./src");
        assertThat(config.models()).isEmpty();
        assertThat(config.environment()).isEmpty();
        assertThat(config.resolver().threads()).isEqualTo(1);
        assertThat(config.output().format()).isEqualTo("text");
        assertThat(config.launches()).isEmpty();
    }

    @Test
    void load_nonPositiveThreads_fallsBackToOne() throws IOException {
        Path configFile = tempDir.resolve("rosarchitect.yaml");
        Files.writeString(configFile, """
            resolver:
              threads: 0
            """);

        assertThat(ConfigLoader.load(configFile).resolver().threads()).isEqualTo(1);
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        ProjectConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("rosarchitect.yaml");
        Files.writeString(configFile, "invalid: yaml: syntax: [[[");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_launchWithoutFilename_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("rosarchitect.yaml");
        Files.writeString(configFile, """
            launches:
              - arguments:
                  sim: "true"
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("rosarchitect.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_directoryInsteadOfFile_returnsDefaults() throws IOException {
        Path directory = Files.createDirectory(tempDir.resolve("directory"));

        assertThat(ConfigLoader.load(directory)).isEqualTo(ProjectConfig.defaults());
    }
}
