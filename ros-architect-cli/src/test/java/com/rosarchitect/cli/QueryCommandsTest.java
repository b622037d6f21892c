package com.rosarchitect.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the simulated rostopic, rosservice and rosnode commands.
 */
class QueryCommandsTest extends CommandTestSupport {

    @Nested
    @DisplayName("rostopic")
    class Rostopic {

        @Test
        void list_printsSortedTopics() {
            assertThat(run("rostopic", launchFile.toString(), "list")).isZero();

            assertThat(out().lines()).containsExactly("/robot1/scan");
        }

        @Test
        void info_printsTypePublishersAndSubscribers() {
            assertThat(run("rostopic", launchFile.toString(), "info", "/robot1/scan")).isZero();

            assertThat(out()).isEqualTo("""
                Type: sensor_msgs/LaserScan

                Publishers:
                 * /robot1/driver

                Subscribers:
                 * /robot1/filter
                """);
        }

        @Test
        void type_printsMessageType() {
            assertThat(run("rostopic", launchFile.toString(), "type", "/robot1/scan")).isZero();

            assertThat(out()).isEqualTo("sensor_msgs/LaserScan\n");
        }

        @Test
        void info_unknownTopic_returnsError() {
            assertThat(run("rostopic", launchFile.toString(), "info", "/nope")).isEqualTo(1);

            assertThat(err()).contains("Unknown topic: /nope");
        }

        @Test
        void info_withoutTopic_returnsError() {
            assertThat(run("rostopic", launchFile.toString(), "info")).isEqualTo(1);
        }

        @Test
        void unknownVerb_returnsError() {
            assertThat(run("rostopic", launchFile.toString(), "echo")).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("rosservice")
    class Rosservice {

        @Test
        void list_printsServices() {
            assertThat(run("rosservice", launchFile.toString(), "list")).isZero();

            assertThat(out().lines()).containsExactly("/robot1/driver/set_mode");
        }

        @Test
        void info_printsProvider() {
            assertThat(run("rosservice", launchFile.toString(), "info", "/robot1/driver/set_mode")).isZero();

            assertThat(out()).contains("Type: std_srvs/SetBool", "/robot1/driver");
        }

        @Test
        void info_unknownService_returnsError() {
            assertThat(run("rosservice", launchFile.toString(), "info", "/nope")).isEqualTo(1);

            assertThat(err()).contains("Unknown service: /nope");
        }
    }

    @Nested
    @DisplayName("rosnode")
    class Rosnode {

        @Test
        void list_marksUnmodeledNodes() {
            assertThat(run("rosnode", launchFile.toString(), "list")).isZero();

            assertThat(out().lines()).containsExactly(
                "/robot1/driver", "/robot1/filter", "/robot1/monitor (unmodeled)");
        }

        @Test
        void info_printsInterfaces() {
            assertThat(run("rosnode", launchFile.toString(), "info", "/robot1/driver")).isZero();

            assertThat(out())
                .contains("Node [/robot1/driver]")
                .contains("Executable: laser/driver")
                .contains("Publications:\n * /robot1/scan")
                .contains("Subscriptions:\n None")
                .contains("Services:\n * /robot1/driver/set_mode");
        }

        @Test
        void info_unmodeledNode_saysSo() {
            assertThat(run("rosnode", launchFile.toString(), "info", "/robot1/monitor")).isZero();

            assertThat(out()).contains("Model: none");
        }

        @Test
        void info_unknownNode_returnsError() {
            assertThat(run("rosnode", launchFile.toString(), "info", "/ghost")).isEqualTo(1);

            assertThat(err()).contains("Unknown node: /ghost");
        }
    }
}
