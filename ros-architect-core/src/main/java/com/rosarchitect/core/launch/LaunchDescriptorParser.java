package com.rosarchitect.core.launch;

import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.rosarchitect.core.error.LaunchParseException;
import com.rosarchitect.core.launch.ast.ArgDirective;
import com.rosarchitect.core.launch.ast.Condition;
import com.rosarchitect.core.launch.ast.GroupDirective;
import com.rosarchitect.core.launch.ast.IncludeDirective;
import com.rosarchitect.core.launch.ast.LaunchDirective;
import com.rosarchitect.core.launch.ast.LaunchDocument;
import com.rosarchitect.core.launch.ast.LaunchNodeSpec;
import com.rosarchitect.core.launch.ast.ParamDirective;
import com.rosarchitect.core.launch.ast.RemapDirective;
import com.rosarchitect.core.launch.ast.RosParamCommand;
import com.rosarchitect.core.launch.ast.RosParamDirective;
import com.rosarchitect.core.model.SourceLocation;
import com.rosarchitect.core.substitution.Expression;
import com.rosarchitect.core.substitution.SubstitutionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parses roslaunch XML into a {@link LaunchDocument}.
 *
 * <p>The XML is read through the StAX reader of Jackson's {@link XmlMapper} so that
 * sibling directives keep their document order and every directive carries a line and
 * column. Attribute values are compiled into {@link Expression}s; includes are kept as
 * {@link IncludeDirective}s and inlined by the evaluator once their path is resolved.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * LaunchDescriptorParser parser = new LaunchDescriptorParser();
 * LaunchDocument document = parser.parse(new LaunchSource("robot.launch", xml));
 * }</pre>
 */
public class LaunchDescriptorParser {

    private static final Logger log = LoggerFactory.getLogger(LaunchDescriptorParser.class);

    private static final String ROOT = "launch";
    private static final Set<String> IGNORED_ELEMENTS = Set.of("env", "machine", "test");

    private final XMLInputFactory inputFactory;

    public LaunchDescriptorParser() {
        this(new XmlMapper());
    }

    /**
     * Creates a parser reusing the StAX factory of the given mapper.
     *
     * @param xmlMapper Jackson XML mapper
     */
    public LaunchDescriptorParser(XmlMapper xmlMapper) {
        this.inputFactory = xmlMapper.getFactory().getXMLInputFactory();
    }

    /**
     * Parses one launch file.
     *
     * @param source launch file content
     * @return parsed document
     * @throws LaunchParseException if the XML is malformed or violates the launch grammar
     */
    public LaunchDocument parse(LaunchSource source) {
        log.debug("Parsing launch file: {}", source.path());
        Element root = readElements(source);

        if (!ROOT.equals(root.name)) {
            throw new LaunchParseException(
                "Root element must be <launch> but was <" + root.name + ">", root.location);
        }

        List<LaunchDirective> directives = parseScope(root);
        log.debug("Parsed {} top-level directives from {}", directives.size(), source.path());
        return new LaunchDocument(source.path(), directives);
    }

    // ==================== XML Reading ====================

    private Element readElements(LaunchSource source) {
        XMLStreamReader reader = null;
        try {
            reader = inputFactory.createXMLStreamReader(new StringReader(source.content()));
            Deque<Element> open = new ArrayDeque<>();
            Element root = null;

            while (reader.hasNext()) {
                int event = reader.next();
                switch (event) {
                    case XMLStreamConstants.START_ELEMENT -> {
                        Element element = new Element(reader.getLocalName(), location(source, reader.getLocation()));
                        for (int i = 0; i < reader.getAttributeCount(); i++) {
                            element.attributes.put(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
                        }
                        if (open.isEmpty()) {
                            root = element;
                        } else {
                            open.peek().children.add(element);
                        }
                        open.push(element);
                    }
                    case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA -> {
                        if (!open.isEmpty()) {
                            open.peek().text.append(reader.getText());
                        }
                    }
                    case XMLStreamConstants.END_ELEMENT -> open.pop();
                    default -> {
                        // comments, processing instructions and whitespace outside elements
                    }
                }
            }

            if (root == null) {
                throw new LaunchParseException("Launch file is empty", SourceLocation.of(source.path()));
            }
            return root;
        } catch (XMLStreamException e) {
            SourceLocation where = e.getLocation() != null
                ? location(source, e.getLocation())
                : SourceLocation.of(source.path());
            throw new LaunchParseException("Malformed launch XML: " + e.getMessage(), where, e);
        } finally {
            close(reader);
        }
    }

    private static SourceLocation location(LaunchSource source, Location location) {
        return new SourceLocation(source.path(), Math.max(location.getLineNumber(), 0),
            Math.max(location.getColumnNumber(), 0));
    }

    private static void close(XMLStreamReader reader) {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (XMLStreamException e) {
            log.debug("Failed to close XML reader: {}", e.getMessage());
        }
    }

    // ==================== Directive Mapping ====================

    private List<LaunchDirective> parseScope(Element scope) {
        List<LaunchDirective> directives = new ArrayList<>();
        for (Element child : scope.children) {
            switch (child.name) {
                case "node" -> directives.add(parseNode(child));
                case "include" -> directives.add(parseInclude(child));
                case "group" -> directives.add(parseGroup(child));
                case "arg" -> directives.add(parseArg(child));
                case "param" -> directives.add(parseParam(child));
                case "rosparam" -> directives.add(parseRosParam(child));
                case "remap" -> directives.add(parseRemap(child));
                case ROOT -> throw new LaunchParseException("Nested <launch> element", child.location);
                default -> skip(child);
            }
        }
        return directives;
    }

    private LaunchNodeSpec parseNode(Element element) {
        List<RemapDirective> remaps = new ArrayList<>();
        List<LaunchDirective> parameters = new ArrayList<>();

        for (Element child : element.children) {
            switch (child.name) {
                case "remap" -> remaps.add(parseRemap(child));
                case "param" -> parameters.add(parseParam(child));
                case "rosparam" -> parameters.add(parseRosParam(child));
                case "node", "include", "group", "arg", ROOT -> throw new LaunchParseException(
                    "<" + child.name + "> is not allowed inside <node>", child.location);
                default -> skip(child);
            }
        }

        return new LaunchNodeSpec(
            required(element, "pkg"),
            required(element, "type"),
            required(element, "name"),
            optional(element, "ns"),
            optional(element, "args"),
            remaps,
            parameters,
            condition(element),
            element.location
        );
    }

    private IncludeDirective parseInclude(Element element) {
        List<ArgDirective> args = new ArrayList<>();
        for (Element child : element.children) {
            if ("arg".equals(child.name)) {
                ArgDirective arg = parseArg(child);
                if (arg.value() == null && arg.defaultValue() == null) {
                    throw new LaunchParseException(
                        "<arg name=\"" + arg.name() + "\"> inside <include> requires a value", child.location);
                }
                args.add(arg);
            } else if (IGNORED_ELEMENTS.contains(child.name)) {
                skip(child);
            } else {
                throw new LaunchParseException(
                    "<" + child.name + "> is not allowed inside <include>", child.location);
            }
        }

        logClearParams(element);
        return new IncludeDirective(
            required(element, "file"),
            optional(element, "ns"),
            optional(element, "pass_all_args"),
            args,
            condition(element),
            element.location
        );
    }

    private GroupDirective parseGroup(Element element) {
        logClearParams(element);
        return new GroupDirective(
            optional(element, "ns"),
            parseScope(element),
            condition(element),
            element.location
        );
    }

    private ArgDirective parseArg(Element element) {
        String name = element.attributes.get("name");
        if (name == null || name.isBlank()) {
            throw new LaunchParseException("<arg> requires a 'name' attribute", element.location);
        }
        if (element.attributes.containsKey("default") && element.attributes.containsKey("value")) {
            throw new LaunchParseException(
                "<arg name=\"" + name + "\"> may not have both 'default' and 'value'", element.location);
        }
        return new ArgDirective(
            name.trim(),
            optional(element, "default"),
            optional(element, "value"),
            condition(element),
            element.location
        );
    }

    private ParamDirective parseParam(Element element) {
        Expression value = optional(element, "value");
        Expression textFile = optional(element, "textfile");
        Expression command = optional(element, "command");
        if (textFile == null && element.attributes.containsKey("binfile")) {
            textFile = optional(element, "binfile");
        }

        int sources = (value != null ? 1 : 0) + (textFile != null ? 1 : 0) + (command != null ? 1 : 0);
        if (sources != 1) {
            throw new LaunchParseException(
                "<param> requires exactly one of 'value', 'textfile', 'binfile' or 'command'", element.location);
        }

        return new ParamDirective(
            required(element, "name"),
            value,
            optional(element, "type"),
            textFile,
            command,
            condition(element),
            element.location
        );
    }

    private RosParamDirective parseRosParam(Element element) {
        String commandText = element.attributes.getOrDefault("command", "load").trim();
        RosParamCommand command;
        try {
            command = RosParamCommand.valueOf(commandText.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new LaunchParseException("Unknown rosparam command '" + commandText + "'", element.location, e);
        }

        String substValue = element.attributes.getOrDefault("subst_value", "false").trim();
        return new RosParamDirective(
            command,
            optional(element, "file"),
            optional(element, "ns"),
            optional(element, "param"),
            element.text.toString(),
            Boolean.parseBoolean(substValue),
            condition(element),
            element.location
        );
    }

    private RemapDirective parseRemap(Element element) {
        return new RemapDirective(
            required(element, "from"),
            required(element, "to"),
            condition(element),
            element.location
        );
    }

    private static Condition condition(Element element) {
        Expression ifExpression = optional(element, "if");
        Expression unlessExpression = optional(element, "unless");
        if (ifExpression != null && unlessExpression != null) {
            throw new LaunchParseException(
                "<" + element.name + "> may not have both 'if' and 'unless'", element.location);
        }
        if (ifExpression == null && unlessExpression == null) {
            return Condition.ALWAYS;
        }
        return new Condition(ifExpression, unlessExpression);
    }

    private static Expression required(Element element, String attribute) {
        String value = element.attributes.get(attribute);
        if (value == null || value.isBlank()) {
            throw new LaunchParseException(
                "<" + element.name + "> requires a '" + attribute + "' attribute", element.location);
        }
        return SubstitutionParser.parse(value.trim(), element.location);
    }

    private static Expression optional(Element element, String attribute) {
        String value = element.attributes.get(attribute);
        return value == null ? null : SubstitutionParser.parse(value.trim(), element.location);
    }

    private static void skip(Element element) {
        if (IGNORED_ELEMENTS.contains(element.name)) {
            log.debug("Ignoring <{}> at {}", element.name, element.location);
        } else {
            log.warn("Skipping unsupported element <{}> at {}", element.name, element.location);
        }
    }

    private static void logClearParams(Element element) {
        if (element.attributes.containsKey("clear_params")) {
            log.debug("clear_params has no effect without a parameter server ({})", element.location);
        }
    }

    /**
     * Mutable element collected while streaming; never escapes the parser.
     */
    private static final class Element {
        private final String name;
        private final SourceLocation location;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<Element> children = new ArrayList<>();
        private final StringBuilder text = new StringBuilder();

        private Element(String name, SourceLocation location) {
            this.name = name;
            this.location = location;
        }
    }
}
