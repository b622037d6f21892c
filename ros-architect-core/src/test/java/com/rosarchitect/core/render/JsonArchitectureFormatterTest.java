package com.rosarchitect.core.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static com.rosarchitect.core.TestFixtures.sampleArchitecture;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link JsonArchitectureFormatter}.
 */
class JsonArchitectureFormatterTest {

    private final JsonArchitectureFormatter formatter = new JsonArchitectureFormatter();

    @Test
    void format_producesParsableDocument() throws IOException {
        JsonNode root = new ObjectMapper().readTree(formatter.format(sampleArchitecture()));

        assertThat(root.get("launchFile").asText()).isEqualTo("/ws/robot.launch");
        assertThat(root.get("nodes")).hasSize(3);
        JsonNode driver = root.get("nodes").get(0);
        assertThat(driver.get("name").asText()).isEqualTo("/robot1/driver");
        assertThat(driver.get("modeled").asBoolean()).isTrue();
        assertThat(driver.get("interfaces").get(0).get("kind").asText()).isEqualTo("TOPIC");
        assertThat(root.get("nodes").get(1).get("nodelet").asBoolean()).isTrue();

        JsonNode scan = root.get("topics").get("/robot1/scan");
        assertThat(scan.get("types").get(0).asText()).isEqualTo("sensor_msgs/LaserScan");
        assertThat(scan.get("subscribers").get(0).asText()).isEqualTo("/robot1/filter");
        assertThat(root.get("services").get("/robot1/set_mode").get("providers")).hasSize(1);
        assertThat(root.get("parameters").get("/robot1/driver/rate").get("value").asInt()).isEqualTo(10);
        assertThat(root.get("warnings").get(0).get("kind").asText()).isEqualTo("UNKNOWN_NODE_MODEL");
    }

    @Test
    void format_isDeterministic() {
        assertThat(formatter.format(sampleArchitecture())).isEqualTo(formatter.format(sampleArchitecture()));
    }
}
