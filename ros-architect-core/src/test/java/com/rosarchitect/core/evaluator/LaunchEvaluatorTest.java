package com.rosarchitect.core.evaluator;

import com.rosarchitect.core.error.CyclicIncludeException;
import com.rosarchitect.core.error.IncludeResolutionException;
import com.rosarchitect.core.error.LaunchParseException;
import com.rosarchitect.core.error.MissingArgumentException;
import com.rosarchitect.core.error.SubstitutionException;
import com.rosarchitect.core.launch.InMemoryLaunchSourceResolver;
import com.rosarchitect.core.launch.PackageLocator;
import com.rosarchitect.core.model.ResolvedNodeRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Tests for {@link LaunchEvaluator}.
 */
class LaunchEvaluatorTest {

    private static final String ROOT = "/ws/robot.launch";

    private static LaunchEvaluation evaluate(String xml) {
        return evaluate(InMemoryLaunchSourceResolver.builder().add(ROOT, xml), Map.of());
    }

    private static LaunchEvaluation evaluate(String xml, Map<String, String> overrides) {
        return evaluate(InMemoryLaunchSourceResolver.builder().add(ROOT, xml), overrides);
    }

    private static LaunchEvaluation evaluate(InMemoryLaunchSourceResolver.Builder files, Map<String, String> overrides) {
        LaunchEvaluator evaluator = new LaunchEvaluator(files.build(),
            PackageLocator.of(Map.of("bringup", "/ws/src/bringup")), Map.of("ROBOT", "turtle"));
        return evaluator.evaluate(ROOT, overrides);
    }

    private static ResolvedNodeRecord onlyNode(LaunchEvaluation evaluation) {
        assertThat(evaluation.nodes()).hasSize(1);
        return evaluation.nodes().get(0);
    }

    @Nested
    class Arguments {

        @Test
        @DisplayName("Group namespace from an argument default resolves the node name")
        void defaultArgument_namespacesNode() {
            LaunchEvaluation evaluation = evaluate("""
                <launch>
                  <arg name="ns" default="robot1"/>
                  <group ns="$(arg ns)">
                    <node pkg="p" type="driver" name="d"/>
                  </group>
                </launch>
                """);

            ResolvedNodeRecord node = onlyNode(evaluation);
            assertThat(node.fullName()).isEqualTo("/robot1/d");
            assertThat(node.namespace()).isEqualTo("/robot1");
            assertThat(node.name()).isEqualTo("d");
            assertThat(node.packageName()).isEqualTo("p");
            assertThat(node.executable()).isEqualTo("driver");
            assertThat(node.includeChain()).containsExactly(ROOT);
            assertThat(evaluation.rootSource()).isEqualTo(ROOT);
        }

        @Test
        void override_beatsDefault() {
            LaunchEvaluation evaluation = evaluate("""
                <launch>
                  <arg name="ns" default="robot1"/>
                  <node pkg="p" type="driver" name="d" ns="$(arg ns)"/>
                </launch>
                """, Map.of("ns", "robot2"));

            assertThat(onlyNode(evaluation).fullName()).isEqualTo("/robot2/d");
        }

        @Test
        void fixedValue_beatsOverride() {
            LaunchEvaluation evaluation = evaluate("""
                <launch>
                  <arg name="ns" value="fixed"/>
                  <node pkg="p" type="driver" name="d" ns="$(arg ns)"/>
                </launch>
                """, Map.of("ns", "robot2"));

            assertThat(onlyNode(evaluation).fullName()).isEqualTo("/fixed/d");
        }

        @Test
        void requiredArgument_withoutValue_throwsMissingArgument() {
            assertThatThrownBy(() -> evaluate("""
                <launch>
                  <arg name="robot"/>
                  <node pkg="p" type="driver" name="$(arg robot)"/>
                </launch>
                """))
                .isInstanceOf(MissingArgumentException.class)
                .satisfies(e -> {
                    MissingArgumentException missing = (MissingArgumentException) e;
                    assertThat(missing.getArgumentName()).isEqualTo("robot");
                    assertThat(missing.getLocation().line()).isEqualTo(3);
                    assertThat(missing.getIncludeChain()).containsExactly(ROOT);
                });
        }

        @Test
        void requiredArgument_isSatisfiedByOverride() {
            LaunchEvaluation evaluation = evaluate("""
                <launch>
                  <arg name="robot"/>
                  <node pkg="p" type="driver" name="$(arg robot)"/>
                </launch>
                """, Map.of("robot", "scout"));

            assertThat(onlyNode(evaluation).fullName()).isEqualTo("/scout");
        }

        @Test
        void argumentDeclaredInGroup_isNotVisibleAfterGroup() {
            assertThatThrownBy(() -> evaluate("""
                <launch>
                  <group>
                    <arg name="inner" default="x"/>
                  </group>
                  <node pkg="p" type="driver" name="$(arg inner)"/>
                </launch>
                """))
                .isInstanceOf(MissingArgumentException.class);
        }

        @Test
        void redeclaredArgument_throwsParseError() {
            assertThatThrownBy(() -> evaluate("""
                <launch>
                  <arg name="a" default="1"/>
                  <arg name="a" default="2"/>
                  <node pkg="p" type="t" name="n$(arg a)"/>
                </launch>
                """))
                .isInstanceOf(LaunchParseException.class)
                .hasMessageContaining("Argument 'a' is already declared")
                .satisfies(e -> assertThat(((LaunchParseException) e).getLocation().line()).isEqualTo(3));
        }

        @Test
        void argumentOfEnclosingScope_cannotBeRedeclaredInGroup() {
            assertThatThrownBy(() -> evaluate("""
                <launch>
                  <arg name="a" default="1"/>
                  <group ns="g">
                    <arg name="a" default="2"/>
                  </group>
                </launch>
                """))
                .isInstanceOf(LaunchParseException.class)
                .hasMessageContaining("already declared");
        }

        @Test
        void sameArgument_inSiblingGroupsAndIncludedFile_isAllowed() {
            LaunchEvaluation evaluation = evaluate(InMemoryLaunchSourceResolver.builder()
                .add(ROOT, """
                    <launch>
                      <group><arg name="a" default="x"/></group>
                      <group><arg name="a" default="y"/></group>
                      <arg name="a" default="z"/>
                      <include file="/ws/child.launch"/>
                    </launch>
                    """)
                .add("/ws/child.launch", """
                    <launch>
                      <arg name="a" default="child"/>
                      <node pkg="p" type="t" name="$(arg a)"/>
                    </launch>
                    """), Map.of());

            assertThat(onlyNode(evaluation).fullName()).isEqualTo("/child");
        }

        @Test
        void nestedSubstitution_failsWithoutProducingNodes() {
            assertThatThrownBy(() -> evaluate("""
                <launch>
                  <arg name="y" default="v"/>
                  <node pkg="p" type="driver" name="$(optenv NAME $(arg y))"/>
                </launch>
                """))
                .isInstanceOf(LaunchParseException.class)
                .hasMessageContaining("Nested substitution");
        }

        @Test
        void environmentAndFind_resolve() {
            LaunchEvaluation evaluation = evaluate("""
                <launch>
                  <node pkg="p" type="driver" name="$(env ROBOT)" args="$(find bringup)/config $(optenv MISSING none)"/>
                </launch>
                """);

            ResolvedNodeRecord node = onlyNode(evaluation);
            assertThat(node.fullName()).isEqualTo("/turtle");
            assertThat(node.args()).isEqualTo("/ws/src/bringup/config none");
        }

        @Test
        void unknownPackage_throwsSubstitutionException() {
            assertThatThrownBy(() -> evaluate("""
                <launch>
                  <param name="path" value="$(find nowhere)"/>
                </launch>
                """))
                .isInstanceOf(SubstitutionException.class)
                .hasMessageContaining("nowhere");
        }

        @Test
        void anonymousNames_areStablePerBase() {
            LaunchEvaluation evaluation = evaluate("""
                <launch>
                  <node pkg="p" type="t" name="$(anon talker)"/>
                  <node pkg="p" type="t" name="$(anon listener)"/>
                  <param name="who" value="$(anon talker)"/>
                </launch>
                """);

            assertThat(evaluation.nodes())
                .extracting(ResolvedNodeRecord::fullName)
                .containsExactly("/talker_anon1", "/listener_anon2");
            assertThat(evaluation.parameters()).containsEntry("/who", "talker_anon1");
        }
    }

    @Nested
    class Conditions {

        @Test
        void ifAndUnless_selectDirectives() {
            LaunchEvaluation evaluation = evaluate("""
                <launch>
                  <arg name="sim" default="false"/>
                  <node pkg="p" type="t" name="real" unless="$(arg sim)"/>
                  <node pkg="p" type="t" name="simulated" if="$(arg sim)"/>
                </launch>
                """);

            assertThat(onlyNode(evaluation).fullName()).isEqualTo("/real");
        }

        @Test
        void disabledGroup_skipsChildrenEvenWithUnboundArguments() {
            LaunchEvaluation evaluation = evaluate("""
                <launch>
                  <group if="0">
                    <node pkg="p" type="t" name="$(arg undefined)"/>
                  </group>
                  <node pkg="p" type="t" name="kept"/>
                </launch>
                """);

            assertThat(onlyNode(evaluation).fullName()).isEqualTo("/kept");
        }

        @Test
        void disabledArgument_doesNotBind() {
            LaunchEvaluation evaluation = evaluate("""
                <launch>
                  <arg name="name" default="first"/>
                  <arg name="other" default="second" if="false"/>
                  <node pkg="p" type="t" name="$(arg name)"/>
                </launch>
                """);

            assertThat(onlyNode(evaluation).fullName()).isEqualTo("/first");
        }

        @Test
        void nonBooleanCondition_throws() {
            assertThatThrownBy(() -> evaluate("""
                <launch>
                  <node pkg="p" type="t" name="n" if="maybe"/>
                </launch>
                """))
                .isInstanceOf(SubstitutionException.class)
                .hasMessageContaining("maybe");
        }
    }

    @Nested
    class Includes {

        @Test
        void include_appliesNamespaceAndArguments() {
            LaunchEvaluation evaluation = evaluate(InMemoryLaunchSourceResolver.builder()
                .add(ROOT, """
                    <launch>
                      <include file="$(dirname)/sensors.launch" ns="sensors">
                        <arg name="rate" value="20"/>
                      </include>
                    </launch>
                    """)
                .add("/ws/sensors.launch", """
                    <launch>
                      <arg name="rate" default="10"/>
                      <node pkg="p" type="lidar" name="lidar" args="$(arg rate)"/>
                    </launch>
                    """), Map.of());

            ResolvedNodeRecord node = onlyNode(evaluation);
            assertThat(node.fullName()).isEqualTo("/sensors/lidar");
            assertThat(node.args()).isEqualTo("20");
            assertThat(node.includeChain()).containsExactly(ROOT, "/ws/sensors.launch");
            assertThat(evaluation.sources()).containsExactly(ROOT, "/ws/sensors.launch");
        }

        @Test
        void include_withoutArgument_usesIncludedDefault() {
            LaunchEvaluation evaluation = evaluate(InMemoryLaunchSourceResolver.builder()
                .add(ROOT, "<launch><include file=\"/ws/sensors.launch\"/></launch>")
                .add("/ws/sensors.launch", """
                    <launch>
                      <arg name="rate" default="10"/>
                      <node pkg="p" type="lidar" name="lidar" args="$(arg rate)"/>
                    </launch>
                    """), Map.of("rate", "99"));

            assertThat(onlyNode(evaluation).args()).isEqualTo("10");
        }

        @Test
        void passAllArgs_forwardsParentBindings() {
            LaunchEvaluation evaluation = evaluate(InMemoryLaunchSourceResolver.builder()
                .add(ROOT, """
                    <launch>
                      <arg name="rate" default="5"/>
                      <include file="/ws/sensors.launch" pass_all_args="true"/>
                    </launch>
                    """)
                .add("/ws/sensors.launch", """
                    <launch>
                      <arg name="rate" default="10"/>
                      <node pkg="p" type="lidar" name="lidar" args="$(arg rate)"/>
                    </launch>
                    """), Map.of());

            assertThat(onlyNode(evaluation).args()).isEqualTo("5");
        }

        @Test
        void includedTwice_isEvaluatedTwice() {
            LaunchEvaluation evaluation = evaluate(InMemoryLaunchSourceResolver.builder()
                .add(ROOT, """
                    <launch>
                      <include file="/ws/robot_base.launch" ns="left"/>
                      <include file="/ws/robot_base.launch" ns="right"/>
                    </launch>
                    """)
                .add("/ws/robot_base.launch", "<launch><node pkg=\"p\" type=\"base\" name=\"base\"/></launch>"),
                Map.of());

            assertThat(evaluation.nodes())
                .extracting(ResolvedNodeRecord::fullName)
                .containsExactly("/left/base", "/right/base");
            assertThat(evaluation.nodes()).extracting(ResolvedNodeRecord::order).containsExactly(0, 1);
        }

        @Test
        void cyclicInclude_throwsWithChain() {
            InMemoryLaunchSourceResolver.Builder files = InMemoryLaunchSourceResolver.builder()
                .add(ROOT, "<launch><include file=\"/ws/b.launch\"/></launch>")
                .add("/ws/b.launch", "<launch><include file=\"/ws/robot.launch\"/></launch>");

            assertThatThrownBy(() -> evaluate(files, Map.of()))
                .isInstanceOf(CyclicIncludeException.class)
                .satisfies(e -> assertThat(((CyclicIncludeException) e).getIncludeChain())
                    .containsExactly(ROOT, "/ws/b.launch", ROOT));
        }

        @Test
        void missingIncludedFile_throwsIncludeResolution() {
            assertThatThrownBy(() -> evaluate("<launch><include file=\"/ws/missing.launch\"/></launch>"))
                .isInstanceOf(IncludeResolutionException.class)
                .hasMessageContaining("/ws/missing.launch");
        }

        @Test
        void disabledInclude_isNotRead() {
            LaunchEvaluation evaluation = evaluate(
                "<launch><include file=\"/ws/missing.launch\" if=\"false\"/></launch>");

            assertThat(evaluation.nodes()).isEmpty();
            assertThat(evaluation.sources()).containsExactly(ROOT);
        }

        @Test
        void parseErrorInIncludedFile_reportsChain() {
            InMemoryLaunchSourceResolver.Builder files = InMemoryLaunchSourceResolver.builder()
                .add(ROOT, "<launch><include file=\"/ws/broken.launch\"/></launch>")
                .add("/ws/broken.launch", "<launch><node pkg=\"p\"/></launch>");

            assertThatThrownBy(() -> evaluate(files, Map.of()))
                .isInstanceOf(LaunchParseException.class)
                .satisfies(e -> assertThat(((LaunchParseException) e).getIncludeChain())
                    .containsExactly(ROOT, "/ws/broken.launch"));
        }
    }

    @Nested
    class Remaps {

        @Test
        void remapTable_combinesScopeArgsAndNodeEntries() {
            LaunchEvaluation evaluation = evaluate("""
                <launch>
                  <remap from="scan" to="base_scan"/>
                  <node pkg="p" type="t" name="n" args="__name:=ignored cmd:=cmd_vel --verbose">
                    <remap from="odom" to="odometry"/>
                  </node>
                  <remap from="late" to="ignored"/>
                </launch>
                """);

            assertThat(onlyNode(evaluation).remappings()).containsExactly(
                entry("scan", "base_scan"),
                entry("cmd", "cmd_vel"),
                entry("odom", "odometry"));
        }

        @Test
        void nodeRemap_replacesScopeEntryForSameName() {
            LaunchEvaluation evaluation = evaluate("""
                <launch>
                  <remap from="scan" to="base_scan"/>
                  <node pkg="p" type="t" name="n">
                    <remap from="scan" to="front_scan"/>
                  </node>
                </launch>
                """);

            assertThat(onlyNode(evaluation).remappings()).containsExactly(entry("scan", "front_scan"));
        }

        @Test
        void groupRemap_doesNotLeak() {
            LaunchEvaluation evaluation = evaluate("""
                <launch>
                  <group>
                    <remap from="scan" to="base_scan"/>
                  </group>
                  <node pkg="p" type="t" name="n"/>
                </launch>
                """);

            assertThat(onlyNode(evaluation).remappings()).isEmpty();
        }
    }

    @Nested
    class Parameters {

        @Test
        void untypedValues_areInferred() {
            LaunchEvaluation evaluation = evaluate("""
                <launch>
                  <group ns="robot1">
                    <param name="count" value="10"/>
                    <param name="gain" value="1.5"/>
                    <param name="enabled" value="True"/>
                    <param name="label" value="front"/>
                    <param name="/global" value="-3"/>
                  </group>
                </launch>
                """);

            assertThat(evaluation.parameters()).containsExactly(
                entry("/robot1/count", 10),
                entry("/robot1/gain", 1.5),
                entry("/robot1/enabled", true),
                entry("/robot1/label", "front"),
                entry("/global", -3));
        }

        @Test
        void typedValues_areConverted() {
            LaunchEvaluation evaluation = evaluate("""
                <launch>
                  <param name="a" type="str" value="10"/>
                  <param name="b" type="double" value="2"/>
                  <param name="c" type="bool" value="1"/>
                  <param name="d" type="yaml" value="{x: 1, y: [1, 2]}"/>
                </launch>
                """);

            assertThat(evaluation.parameters())
                .containsEntry("/a", "10")
                .containsEntry("/b", 2.0)
                .containsEntry("/c", true)
                .containsEntry("/d/x", 1)
                .containsEntry("/d/y", List.of(1, 2));
        }

        @Test
        void invalidTypedValue_throws() {
            assertThatThrownBy(() -> evaluate("<launch><param name=\"a\" type=\"int\" value=\"ten\"/></launch>"))
                .isInstanceOf(LaunchParseException.class)
                .hasMessageContaining("not an int");
        }

        @Test
        void nodeParameters_arePrivateToTheNode() {
            LaunchEvaluation evaluation = evaluate("""
                <launch>
                  <group ns="robot1">
                    <node pkg="p" type="driver" name="d">
                      <param name="rate" value="5"/>
                      <param name="~frame" value="laser"/>
                    </node>
                  </group>
                </launch>
                """);

            ResolvedNodeRecord node = onlyNode(evaluation);
            assertThat(node.parameters()).containsExactly(
                entry("/robot1/d/rate", 5),
                entry("/robot1/d/frame", "laser"));
            assertThat(evaluation.parameters()).containsAllEntriesOf(node.parameters());
        }

        @Test
        void textFile_isReadAsString() {
            LaunchEvaluation evaluation = evaluate(InMemoryLaunchSourceResolver.builder()
                .add(ROOT, "<launch><param name=\"robot_description\" textfile=\"/ws/robot.urdf\"/></launch>")
                .add("/ws/robot.urdf", "<robot name=\"r\"/>"), Map.of());

            assertThat(evaluation.parameters()).containsEntry("/robot_description", "<robot name=\"r\"/>");
            assertThat(evaluation.sources()).contains("/ws/robot.urdf");
        }

        @Test
        void commandParameter_hasUnknownValue() {
            LaunchEvaluation evaluation = evaluate(
                "<launch><param name=\"robot_description\" command=\"xacro robot.xacro\"/></launch>");

            assertThat(evaluation.parameters()).containsKey("/robot_description");
            assertThat(evaluation.parameters().get("/robot_description")).isNull();
        }

        @Test
        void rosparamLoad_flattensDictionary() {
            LaunchEvaluation evaluation = evaluate("""
                <launch>
                  <rosparam ns="nav">{speed: 1, limits: {max: 2.5, frame: odom}}</rosparam>
                  <rosparam param="waypoints">[1, 2, 3]</rosparam>
                </launch>
                """);

            assertThat(evaluation.parameters())
                .containsEntry("/nav/speed", 1)
                .containsEntry("/nav/limits/max", 2.5)
                .containsEntry("/nav/limits/frame", "odom")
                .containsEntry("/waypoints", List.of(1, 2, 3));
        }

        @Test
        void rosparamLoad_fromFileWithSubstitution() {
            LaunchEvaluation evaluation = evaluate(InMemoryLaunchSourceResolver.builder()
                .add(ROOT, """
                    <launch>
                      <arg name="speed" default="3"/>
                      <rosparam file="$(find bringup)/nav.yaml" subst_value="true"/>
                    </launch>
                    """)
                .add("/ws/src/bringup/nav.yaml", "speed: $(arg speed)\n"), Map.of());

            assertThat(evaluation.parameters()).containsEntry("/speed", 3);
        }

        @Test
        void rosparamDelete_removesSubtree() {
            LaunchEvaluation evaluation = evaluate("""
                <launch>
                  <rosparam>{nav: {speed: 1, limits: {max: 2}}, keep: true}</rosparam>
                  <rosparam command="delete" param="nav/limits"/>
                </launch>
                """);

            assertThat(evaluation.parameters()).containsOnlyKeys("/nav/speed", "/keep");
        }

        @Test
        void rosparamScalarWithoutParam_throws() {
            assertThatThrownBy(() -> evaluate("<launch><rosparam>[1, 2]</rosparam></launch>"))
                .isInstanceOf(LaunchParseException.class)
                .hasMessageContaining("requires a 'param' attribute");
        }

        @Test
        void laterAssignment_wins() {
            LaunchEvaluation evaluation = evaluate("""
                <launch>
                  <param name="rate" value="1"/>
                  <param name="rate" value="2"/>
                </launch>
                """);

            assertThat(evaluation.parameters()).containsExactly(entry("/rate", 2));
        }
    }

    @Test
    void namespacedNodeName_throws() {
        assertThatThrownBy(() -> evaluate("<launch><node pkg=\"p\" type=\"t\" name=\"a/b\"/></launch>"))
            .isInstanceOf(LaunchParseException.class)
            .hasMessageContaining("must not contain a namespace");
    }

    @Test
    void missingRootFile_throwsIncludeResolution() {
        LaunchEvaluator evaluator = new LaunchEvaluator(InMemoryLaunchSourceResolver.builder().build(),
            PackageLocator.none(), Map.of());

        assertThatThrownBy(() -> evaluator.evaluate("/ws/none.launch", Map.of()))
            .isInstanceOf(IncludeResolutionException.class);
    }
}
