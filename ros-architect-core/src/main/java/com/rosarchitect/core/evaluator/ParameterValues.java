package com.rosarchitect.core.evaluator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.rosarchitect.core.error.LaunchParseException;
import com.rosarchitect.core.model.SourceLocation;
import com.rosarchitect.core.util.RosNames;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Typing of launch parameter values and flattening of YAML parameter documents.
 *
 * <p>Untyped values are converted the way roslaunch does: integer, then floating point,
 * then boolean ({@code true}/{@code false}, any case), otherwise the string itself.
 */
final class ParameterValues {

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern FLOATING = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private final ObjectMapper yamlMapper;

    ParameterValues() {
        this(new YAMLMapper());
    }

    ParameterValues(ObjectMapper yamlMapper) {
        this.yamlMapper = yamlMapper;
    }

    /**
     * Converts a resolved {@code <param value>} according to its {@code type} attribute.
     *
     * @param value resolved value
     * @param type resolved type, or null
     * @param location directive location
     * @return Integer, Long, Double, Boolean, String, or for {@code yaml} any YAML value
     */
    Object convert(String value, String type, SourceLocation location) {
        String normalizedType = type == null ? "" : type.trim().toLowerCase(Locale.ROOT);
        switch (normalizedType) {
            case "" -> {
                return inferType(value);
            }
            case "str", "string" -> {
                return value;
            }
            case "int" -> {
                try {
                    return Integer.parseInt(value.trim());
                } catch (NumberFormatException e) {
                    throw new LaunchParseException("Value '" + value + "' is not an int", location, e);
                }
            }
            case "double", "float" -> {
                try {
                    return Double.parseDouble(value.trim());
                } catch (NumberFormatException e) {
                    throw new LaunchParseException("Value '" + value + "' is not a double", location, e);
                }
            }
            case "bool", "boolean" -> {
                String text = value.trim().toLowerCase(Locale.ROOT);
                if ("true".equals(text) || "1".equals(text)) {
                    return Boolean.TRUE;
                }
                if ("false".equals(text) || "0".equals(text)) {
                    return Boolean.FALSE;
                }
                throw new LaunchParseException("Value '" + value + "' is not a bool", location);
            }
            case "yaml" -> {
                return toValue(readYaml(value, location));
            }
            default -> throw new LaunchParseException("Unknown param type '" + type + "'", location);
        }
    }

    /**
     * Parses a YAML document.
     *
     * @param text YAML text
     * @param location directive location
     * @return document tree, a missing node for an empty document
     */
    JsonNode readYaml(String text, SourceLocation location) {
        try {
            JsonNode node = yamlMapper.readTree(text);
            return node == null ? yamlMapper.missingNode() : node;
        } catch (JsonProcessingException e) {
            throw new LaunchParseException("Invalid YAML: " + e.getOriginalMessage(), location, e);
        }
    }

    /**
     * Assigns a value; mappings are flattened into one entry per leaf.
     *
     * @param table parameter table
     * @param name absolute parameter name
     * @param value value to assign
     */
    static void assign(Map<String, Object> table, String name, Object value) {
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                assign(table, RosNames.join(name, String.valueOf(entry.getKey())), entry.getValue());
            }
            return;
        }
        table.remove(name);
        table.put(name, value);
    }

    /**
     * Removes a parameter and every parameter below it.
     *
     * @param table parameter table
     * @param name absolute parameter name
     * @return number of removed entries
     */
    static int delete(Map<String, Object> table, String name) {
        String prefix = RosNames.ROOT.equals(name) ? name : name + "/";
        int before = table.size();
        table.keySet().removeIf(key -> key.equals(name) || key.startsWith(prefix));
        return before - table.size();
    }

    /**
     * Flattens a YAML tree into a parameter table.
     *
     * @param table parameter table
     * @param namespace absolute namespace the document is loaded into
     * @param node YAML tree
     */
    void flatten(Map<String, Object> table, String namespace, JsonNode node) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                flatten(table, RosNames.resolve(field.getKey(), namespace), field.getValue());
            }
            return;
        }
        assign(table, namespace, toValue(node));
    }

    Object toValue(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            return yamlMapper.convertValue(node, List.class);
        }
        if (node.isObject()) {
            return yamlMapper.convertValue(node, Map.class);
        }
        if (node.isInt()) {
            return node.intValue();
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.asText();
    }

    private static Object inferType(String value) {
        String text = value.trim();
        if (INTEGER.matcher(text).matches() && text.length() < 10) {
            return Integer.parseInt(text);
        }
        if (INTEGER.matcher(text).matches() || FLOATING.matcher(text).matches()) {
            return Double.parseDouble(text);
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if ("true".equals(lower)) {
            return Boolean.TRUE;
        }
        if ("false".equals(lower)) {
            return Boolean.FALSE;
        }
        return value;
    }
}
