package com.rosarchitect.core.render;

import com.rosarchitect.core.model.Architecture;
import com.rosarchitect.core.model.ResolvedNodeInstance;
import com.rosarchitect.core.model.ServiceInfo;
import com.rosarchitect.core.model.TopicInfo;

/**
 * Mermaid flowchart of the node graph, embedded in Markdown.
 *
 * <p>Nodes are boxes, topics hexagons and services rounded boxes. Publishers point to a
 * topic and the topic points to its subscribers; callers point to a service and the
 * service points to its providers. Unmodeled nodes are drawn dashed.
 *
 * @see <a href="https://mermaid.js.org/">Mermaid Documentation</a>
 */
public class MermaidArchitectureFormatter implements ArchitectureFormatter {

    private static final String MARKDOWN_HEADER_PREFIX = "# ";
    private static final String MARKDOWN_NEWLINE = "\n";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";
    private static final String GRAPH_LR = "graph LR\n";

    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";
    private static final String NO_NODES_NODE = "  A[No nodes found]\n";
    private static final String UNMODELED_CLASS = "  classDef unmodeled stroke-dasharray: 5 5\n";

    @Override
    public String getId() {
        return "mermaid";
    }

    @Override
    public String getDisplayName() {
        return "Mermaid Graph (Markdown)";
    }

    @Override
    public String format(Architecture architecture) {
        StringBuilder sb = new StringBuilder();
        sb.append(MARKDOWN_HEADER_PREFIX).append("ROS Graph: ").append(escape(architecture.launchFile()))
            .append(MARKDOWN_NEWLINE.repeat(2));
        sb.append(CODE_BLOCK_START);
        sb.append(GRAPH_LR);

        if (architecture.nodes().isEmpty()) {
            sb.append(NO_NODES_NODE);
        } else {
            appendNodes(sb, architecture);
            appendTopics(sb, architecture);
            appendServices(sb, architecture);
        }

        sb.append(CODE_BLOCK_END);
        return sb.toString();
    }

    private void appendNodes(StringBuilder sb, Architecture architecture) {
        boolean anyUnmodeled = false;
        for (ResolvedNodeInstance node : architecture.nodes()) {
            sb.append("  ").append(nodeId(node.fullName())).append("[\"").append(escape(node.fullName())).append("\"]");
            if (!node.modeled()) {
                sb.append(":::unmodeled");
                anyUnmodeled = true;
            }
            sb.append(MARKDOWN_NEWLINE);
        }
        if (anyUnmodeled) {
            sb.append(UNMODELED_CLASS);
        }
    }

    private void appendTopics(StringBuilder sb, Architecture architecture) {
        for (TopicInfo topic : architecture.topics().values()) {
            String topicId = sanitizeId("t", topic.name());
            sb.append("  ").append(topicId).append("{{\"").append(escape(topic.name())).append("\"}}\n");

            String label = topic.types().isEmpty() ? "message" : String.join(" | ", topic.types());
            for (String publisher : topic.publishers()) {
                sb.append("  ").append(nodeId(publisher)).append(" -->|\"").append(escape(label))
                    .append("\"| ").append(topicId).append(MARKDOWN_NEWLINE);
            }
            for (String subscriber : topic.subscribers()) {
                sb.append("  ").append(topicId).append(" --> ").append(nodeId(subscriber)).append(MARKDOWN_NEWLINE);
            }
        }
    }

    private void appendServices(StringBuilder sb, Architecture architecture) {
        for (ServiceInfo service : architecture.services().values()) {
            String serviceId = sanitizeId("s", service.name());
            sb.append("  ").append(serviceId).append("(\"").append(escape(service.name())).append("\")\n");
            for (String caller : service.callers()) {
                sb.append("  ").append(nodeId(caller)).append(" -.-> ").append(serviceId).append(MARKDOWN_NEWLINE);
            }
            for (String provider : service.providers()) {
                sb.append("  ").append(serviceId).append(" -.-> ").append(nodeId(provider)).append(MARKDOWN_NEWLINE);
            }
        }
    }

    private static String nodeId(String fullName) {
        return sanitizeId("n", fullName);
    }

    /**
     * Builds a Mermaid identifier; the prefix keeps nodes, topics and services with the
     * same name apart.
     */
    private static String sanitizeId(String prefix, String name) {
        return prefix + name.replaceAll(ID_SANITIZATION_PATTERN, "_");
    }

    private static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\"", "'").replace("\n", " ");
    }
}
