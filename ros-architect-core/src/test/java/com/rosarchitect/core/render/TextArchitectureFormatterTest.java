package com.rosarchitect.core.render;

import com.rosarchitect.core.model.Architecture;
import org.junit.jupiter.api.Test;

import static com.rosarchitect.core.TestFixtures.sampleArchitecture;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TextArchitectureFormatter}.
 */
class TextArchitectureFormatterTest {

    private final TextArchitectureFormatter formatter = new TextArchitectureFormatter();

    @Test
    void getId_returnsText() {
        assertThat(formatter.getId()).isEqualTo("text");
    }

    @Test
    void format_listsEverySection() {
        String output = formatter.format(sampleArchitecture());

        assertThat(output).isEqualTo("""
            Launch: /ws/robot.launch

            Nodes (3):
              /robot1/driver [laser/driver]
              /robot1/filter [nodelet/nodelet] (nodelet)
              /monitor [acme/monitor] (unmodeled)

            Topics (1):
              /robot1/scan [sensor_msgs/LaserScan]
                publishers: /robot1/driver
                subscribers: /robot1/filter

            Services (1):
              /robot1/set_mode [std_srvs/SetBool]
                providers: /robot1/driver

            Actions (0):

            Parameters (1):
              /robot1/driver/rate = 10

            Warnings (1):
              UNKNOWN_NODE_MODEL [/monitor]: No node model registered for acme/monitor
            """);
    }

    @Test
    void format_emptyArchitecture_omitsWarnings() {
        String output = formatter.format(new Architecture("empty.launch", null, null, null, null, null, null));

        assertThat(output).startsWith("Launch: empty.launch\n");
        assertThat(output).contains("Nodes (0):");
        assertThat(output).doesNotContain("Warnings");
    }
}
