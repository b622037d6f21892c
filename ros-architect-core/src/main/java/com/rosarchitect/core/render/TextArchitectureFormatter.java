package com.rosarchitect.core.render;

import com.rosarchitect.core.model.ActionInfo;
import com.rosarchitect.core.model.Architecture;
import com.rosarchitect.core.model.Diagnostic;
import com.rosarchitect.core.model.ParameterInfo;
import com.rosarchitect.core.model.ResolvedNodeInstance;
import com.rosarchitect.core.model.ServiceInfo;
import com.rosarchitect.core.model.TopicInfo;

import java.util.List;

/**
 * Human-readable summary of an architecture.
 */
public class TextArchitectureFormatter implements ArchitectureFormatter {

    private static final String INDENT = "  ";
    private static final String DETAIL_INDENT = "    ";

    @Override
    public String getId() {
        return "text";
    }

    @Override
    public String getDisplayName() {
        return "Plain Text Summary";
    }

    @Override
    public String format(Architecture architecture) {
        StringBuilder sb = new StringBuilder();
        sb.append("Launch: ").append(architecture.launchFile()).append("\n");

        section(sb, "Nodes", architecture.nodes().size());
        for (ResolvedNodeInstance node : architecture.nodes()) {
            sb.append(INDENT).append(node.fullName())
                .append(" [").append(node.record().packageName()).append('/').append(node.record().executable()).append(']');
            if (node.nodelet()) {
                sb.append(" (nodelet)");
            }
            if (!node.modeled()) {
                sb.append(" (unmodeled)");
            }
            sb.append("\n");
        }

        section(sb, "Topics", architecture.topics().size());
        for (TopicInfo topic : architecture.topics().values()) {
            entry(sb, topic.name(), topic.types());
            detail(sb, "publishers", topic.publishers());
            detail(sb, "subscribers", topic.subscribers());
        }

        section(sb, "Services", architecture.services().size());
        for (ServiceInfo service : architecture.services().values()) {
            entry(sb, service.name(), service.types());
            detail(sb, "providers", service.providers());
            detail(sb, "callers", service.callers());
        }

        section(sb, "Actions", architecture.actions().size());
        for (ActionInfo action : architecture.actions().values()) {
            entry(sb, action.name(), action.types());
            detail(sb, "servers", action.servers());
            detail(sb, "clients", action.clients());
        }

        section(sb, "Parameters", architecture.parameters().size());
        for (ParameterInfo parameter : architecture.parameters().values()) {
            sb.append(INDENT).append(parameter.name());
            if (parameter.assigned()) {
                sb.append(" = ").append(parameter.value() == null ? "<unknown>" : parameter.value());
            }
            if (parameter.dynamic()) {
                sb.append(" (dynamic)");
            }
            sb.append("\n");
        }

        if (!architecture.diagnostics().isEmpty()) {
            section(sb, "Warnings", architecture.diagnostics().size());
            for (Diagnostic diagnostic : architecture.diagnostics()) {
                sb.append(INDENT).append(diagnostic).append("\n");
            }
        }
        return sb.toString();
    }

    private static void section(StringBuilder sb, String title, int count) {
        sb.append("\n").append(title).append(" (").append(count).append("):\n");
    }

    private static void entry(StringBuilder sb, String name, List<String> types) {
        sb.append(INDENT).append(name);
        if (!types.isEmpty()) {
            sb.append(" [").append(String.join(" | ", types)).append(']');
        }
        sb.append("\n");
    }

    private static void detail(StringBuilder sb, String label, List<String> nodes) {
        if (!nodes.isEmpty()) {
            sb.append(DETAIL_INDENT).append(label).append(": ").append(String.join(", ", nodes)).append("\n");
        }
    }
}
