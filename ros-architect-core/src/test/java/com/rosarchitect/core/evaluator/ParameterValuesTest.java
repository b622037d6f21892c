package com.rosarchitect.core.evaluator;

import com.rosarchitect.core.error.LaunchParseException;
import com.rosarchitect.core.model.SourceLocation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParameterValuesTest {

    private static final SourceLocation LOCATION = new SourceLocation("/ws/robot.launch", 4, 3);

    private final ParameterValues values = new ParameterValues();

    @Test
    void convert_untyped_infersIntegerDoubleBooleanOrString() {
        assertThat(values.convert("42", null, LOCATION)).isEqualTo(42);
        assertThat(values.convert("3.5", null, LOCATION)).isEqualTo(3.5);
        assertThat(values.convert("1e3", null, LOCATION)).isEqualTo(1000.0);
        assertThat(values.convert("12345678901", null, LOCATION)).isEqualTo(1.2345678901E10);
        assertThat(values.convert("True", null, LOCATION)).isEqualTo(Boolean.TRUE);
        assertThat(values.convert("laser_link", null, LOCATION)).isEqualTo("laser_link");
    }

    @Test
    void convert_explicitTypes() {
        assertThat(values.convert("007", "str", LOCATION)).isEqualTo("007");
        assertThat(values.convert(" 7 ", "int", LOCATION)).isEqualTo(7);
        assertThat(values.convert("2", "double", LOCATION)).isEqualTo(2.0);
        assertThat(values.convert("1", "bool", LOCATION)).isEqualTo(Boolean.TRUE);
        assertThat(values.convert("[1, 2]", "yaml", LOCATION)).isEqualTo(List.of(1, 2));
    }

    @Test
    void convert_invalidInt_reportsLocation() {
        assertThatThrownBy(() -> values.convert("fast", "int", LOCATION))
            .isInstanceOf(LaunchParseException.class)
            .hasMessageContaining("'fast' is not an int");
    }

    @Test
    void convert_unknownType_throws() {
        assertThatThrownBy(() -> values.convert("x", "complex", LOCATION))
            .isInstanceOf(LaunchParseException.class)
            .hasMessageContaining("Unknown param type 'complex'");
    }

    @Test
    void flatten_yamlDocument_createsOneEntryPerLeaf() {
        Map<String, Object> table = new TreeMap<>();

        values.flatten(table, "/robot1/driver", values.readYaml("""
            rate: 10
            limits:
              min: 0.1
              max: 30.0
            frames: [base, laser]
            """, LOCATION));

        assertThat(table).containsExactly(
            Map.entry("/robot1/driver/frames", List.of("base", "laser")),
            Map.entry("/robot1/driver/limits/max", 30.0),
            Map.entry("/robot1/driver/limits/min", 0.1),
            Map.entry("/robot1/driver/rate", 10));
    }

    @Test
    void delete_removesSubtreeOnly() {
        Map<String, Object> table = new TreeMap<>(Map.of(
            "/a", 1, "/a/b", 2, "/ab", 3));

        assertThat(ParameterValues.delete(table, "/a")).isEqualTo(2);
        assertThat(table).containsOnlyKeys("/ab");
    }

    @Test
    void assign_map_isFlattened() {
        Map<String, Object> table = new TreeMap<>();

        ParameterValues.assign(table, "/gains", Map.of("p", 1.0, "d", 0.5));

        assertThat(table).containsOnlyKeys("/gains/p", "/gains/d");
    }
}
