package com.rosarchitect.cli;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ListCommandTest extends CommandTestSupport {

    @Test
    void listFormats_printsAllFormatters() {
        assertThat(runRaw("list", "formats")).isZero();

        assertThat(out()).contains("Available Formats:", "(ID: text)", "(ID: json)", "(ID: mermaid)", "(ID: acme)");
    }

    @Test
    void listModels_printsBuiltInModels() {
        assertThat(runRaw("list", "models")).isZero();

        assertThat(out()).contains("Available Node Models:", "robot_state_publisher/robot_state_publisher");
    }

    @Test
    void listUnknownType_returnsError() {
        assertThat(runRaw("list", "plugins")).isEqualTo(1);
    }

    @Test
    void noCommand_printsBanner() {
        assertThat(runRaw()).isZero();

        assertThat(out()).contains("ros-architect - Static recovery of ROS launch architectures");
    }

    @Test
    void quiet_suppressesBanner() {
        assertThat(runRaw("--quiet")).isZero();

        assertThat(out()).isEmpty();
    }
}
