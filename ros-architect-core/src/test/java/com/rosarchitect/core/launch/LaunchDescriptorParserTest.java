package com.rosarchitect.core.launch;

import com.rosarchitect.core.error.LaunchParseException;
import com.rosarchitect.core.launch.ast.ArgDirective;
import com.rosarchitect.core.launch.ast.GroupDirective;
import com.rosarchitect.core.launch.ast.IncludeDirective;
import com.rosarchitect.core.launch.ast.LaunchDocument;
import com.rosarchitect.core.launch.ast.LaunchNodeSpec;
import com.rosarchitect.core.launch.ast.ParamDirective;
import com.rosarchitect.core.launch.ast.RemapDirective;
import com.rosarchitect.core.launch.ast.RosParamCommand;
import com.rosarchitect.core.launch.ast.RosParamDirective;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link LaunchDescriptorParser}.
 */
class LaunchDescriptorParserTest {

    private LaunchDescriptorParser parser;

    @BeforeEach
    void setUp() {
        parser = new LaunchDescriptorParser();
    }

    private LaunchDocument parse(String xml) {
        return parser.parse(new LaunchSource("/ws/robot.launch", xml));
    }

    @Test
    @DisplayName("Should keep sibling directives in document order")
    void parse_siblings_keepDocumentOrder() {
        LaunchDocument document = parse("""
            <launch>
              <arg name="ns" default="robot1"/>
              <remap from="scan" to="base_scan"/>
              <param name="rate" value="10"/>
              <group ns="$(arg ns)">
                <node pkg="p" type="driver" name="d"/>
              </group>
              <include file="$(find bringup)/other.launch"/>
            </launch>
            """);

        assertThat(document.source()).isEqualTo("/ws/robot.launch");
        assertThat(document.directives())
            .hasExactlyElementsOfTypes(ArgDirective.class, RemapDirective.class, ParamDirective.class,
                GroupDirective.class, IncludeDirective.class);

        GroupDirective group = (GroupDirective) document.directives().get(3);
        assertThat(group.namespace().render()).isEqualTo("$(arg ns)");
        assertThat(group.children()).singleElement().isInstanceOf(LaunchNodeSpec.class);
    }

    @Test
    @DisplayName("Should attach line numbers to directives")
    void parse_directives_carryLocation() {
        LaunchDocument document = parse("<launch>\n  <arg name=\"a\" default=\"1\"/>\n  <arg name=\"b\" default=\"2\"/>\n</launch>");

        assertThat(document.directives().get(0).location().line()).isEqualTo(2);
        assertThat(document.directives().get(1).location().line()).isEqualTo(3);
        assertThat(document.directives().get(1).location().source()).isEqualTo("/ws/robot.launch");
    }

    @Test
    void parse_node_collectsRemapsAndParameters() {
        LaunchDocument document = parse("""
            <launch>
              <node pkg="p" type="driver" name="d" ns="left" args="--fast scan:=front" if="$(arg sim)">
                <remap from="cmd" to="cmd_vel"/>
                <param name="~rate" value="5"/>
                <rosparam>gain: 2</rosparam>
              </node>
            </launch>
            """);

        LaunchNodeSpec node = (LaunchNodeSpec) document.directives().get(0);
        assertThat(node.packageName().render()).isEqualTo("p");
        assertThat(node.executable().render()).isEqualTo("driver");
        assertThat(node.name().render()).isEqualTo("d");
        assertThat(node.namespace().render()).isEqualTo("left");
        assertThat(node.args().render()).isEqualTo("--fast scan:=front");
        assertThat(node.condition().ifExpression().render()).isEqualTo("$(arg sim)");
        assertThat(node.remaps()).hasSize(1);
        assertThat(node.parameters())
            .hasExactlyElementsOfTypes(ParamDirective.class, RosParamDirective.class);
    }

    @Test
    void parse_rosparam_keepsInlineTextAndCommand() {
        LaunchDocument document = parse("""
            <launch>
              <rosparam command="delete" param="old"/>
              <rosparam subst_value="true">
                speed: $(arg speed)
              </rosparam>
            </launch>
            """);

        RosParamDirective delete = (RosParamDirective) document.directives().get(0);
        RosParamDirective load = (RosParamDirective) document.directives().get(1);
        assertThat(delete.command()).isEqualTo(RosParamCommand.DELETE);
        assertThat(delete.param().render()).isEqualTo("old");
        assertThat(load.command()).isEqualTo(RosParamCommand.LOAD);
        assertThat(load.substituteValue()).isTrue();
        assertThat(load.inlineText()).contains("speed: $(arg speed)");
    }

    @Test
    void parse_include_collectsArguments() {
        LaunchDocument document = parse("""
            <launch>
              <include file="other.launch" ns="sensors" pass_all_args="true">
                <arg name="rate" value="20"/>
              </include>
            </launch>
            """);

        IncludeDirective include = (IncludeDirective) document.directives().get(0);
        assertThat(include.file().render()).isEqualTo("other.launch");
        assertThat(include.namespace().render()).isEqualTo("sensors");
        assertThat(include.passAllArgs().render()).isEqualTo("true");
        assertThat(include.args()).singleElement()
            .satisfies(arg -> assertThat(arg.name()).isEqualTo("rate"));
    }

    @Test
    void parse_ignoredElements_areSkipped() {
        LaunchDocument document = parse("""
            <launch>
              <machine name="m" address="localhost"/>
              <env name="A" value="1"/>
              <node pkg="p" type="t" name="n"/>
            </launch>
            """);

        assertThat(document.directives()).singleElement().isInstanceOf(LaunchNodeSpec.class);
    }

    @Test
    void parse_malformedXml_throwsWithSource() {
        assertThatThrownBy(() -> parse("<launch><node pkg=\"p\"></launch>"))
            .isInstanceOf(LaunchParseException.class)
            .hasMessageContaining("Malformed launch XML")
            .satisfies(e -> assertThat(((LaunchParseException) e).getLocation().source()).isEqualTo("/ws/robot.launch"));
    }

    @Test
    void parse_wrongRoot_throws() {
        assertThatThrownBy(() -> parse("<robot/>"))
            .isInstanceOf(LaunchParseException.class)
            .hasMessageContaining("Root element must be <launch>");
    }

    @Test
    void parse_nodeWithoutName_throws() {
        assertThatThrownBy(() -> parse("<launch><node pkg=\"p\" type=\"t\"/></launch>"))
            .isInstanceOf(LaunchParseException.class)
            .hasMessageContaining("'name'");
    }

    @Test
    void parse_argWithDefaultAndValue_throws() {
        assertThatThrownBy(() -> parse("<launch><arg name=\"a\" default=\"1\" value=\"2\"/></launch>"))
            .isInstanceOf(LaunchParseException.class)
            .hasMessageContaining("both 'default' and 'value'");
    }

    @Test
    void parse_ifAndUnless_throws() {
        assertThatThrownBy(() -> parse("<launch><group if=\"1\" unless=\"0\"/></launch>"))
            .isInstanceOf(LaunchParseException.class)
            .hasMessageContaining("both 'if' and 'unless'");
    }

    @Test
    void parse_paramWithoutValue_throws() {
        assertThatThrownBy(() -> parse("<launch><param name=\"a\"/></launch>"))
            .isInstanceOf(LaunchParseException.class)
            .hasMessageContaining("exactly one of");
    }

    @Test
    void parse_nodeInsideNode_throws() {
        assertThatThrownBy(() -> parse("<launch><node pkg=\"p\" type=\"t\" name=\"a\"><node pkg=\"p\" type=\"t\" name=\"b\"/></node></launch>"))
            .isInstanceOf(LaunchParseException.class)
            .hasMessageContaining("not allowed inside <node>");
    }

    @Test
    void parse_includeArgWithoutValue_throws() {
        assertThatThrownBy(() -> parse("<launch><include file=\"x.launch\"><arg name=\"a\"/></include></launch>"))
            .isInstanceOf(LaunchParseException.class)
            .hasMessageContaining("requires a value");
    }
}
