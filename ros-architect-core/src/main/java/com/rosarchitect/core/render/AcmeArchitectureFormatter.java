package com.rosarchitect.core.render;

import com.rosarchitect.core.model.ActionInfo;
import com.rosarchitect.core.model.Architecture;
import com.rosarchitect.core.model.ResolvedNodeInstance;
import com.rosarchitect.core.model.ServiceInfo;
import com.rosarchitect.core.model.TopicInfo;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Acme architecture description written against the {@code ROSFam} family.
 *
 * <p>Every node becomes a component with one port per topic, service and action it takes
 * part in. Unmodeled nodes are placeholder components. A topic gets a connector once it
 * has at least two endpoints; services and actions only when both sides are present.
 * Attachments bind component ports to connector roles.
 *
 * <p>The output is not checked against the family; the Acme checker runs separately.
 */
public class AcmeArchitectureFormatter implements ArchitectureFormatter {

    private static final String FAMILY_IMPORT = "import families/ROSFam.acme;\n";
    private static final String DEFAULT_SYSTEM_NAME = "RobotSystem";
    private static final String NAME_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";
    private static final String UNKNOWN_TYPE = "unknown";

    private static final String INDENT = "  ";
    private static final String PORT_INDENT = "    ";
    private static final String PROPERTY_INDENT = "      ";

    @Override
    public String getId() {
        return "acme";
    }

    @Override
    public String getDisplayName() {
        return "Acme Architecture Description";
    }

    @Override
    public String format(Architecture architecture) {
        Map<String, Set<String>> ports = new LinkedHashMap<>();
        for (ResolvedNodeInstance node : architecture.nodes()) {
            ports.put(node.fullName(), new LinkedHashSet<>());
        }
        List<String> connectors = new ArrayList<>();
        List<String> attachments = new ArrayList<>();

        architecture.topics().values().forEach(topic -> addTopic(topic, ports, connectors, attachments));
        architecture.services().values().forEach(service -> addService(service, ports, connectors, attachments));
        architecture.actions().values().forEach(action -> addAction(action, ports, connectors, attachments));

        StringBuilder sb = new StringBuilder();
        sb.append(FAMILY_IMPORT);
        sb.append("system ").append(systemName(architecture.launchFile()))
            .append(" : ROSFam = new ROSFam extended with {\n");
        for (ResolvedNodeInstance node : architecture.nodes()) {
            appendComponent(sb, node, ports.get(node.fullName()), architecture.launchFile());
        }
        connectors.forEach(sb::append);
        attachments.forEach(sb::append);
        sb.append("}\n");
        return sb.toString();
    }

    private void addTopic(TopicInfo topic, Map<String, Set<String>> ports,
                          List<String> connectors, List<String> attachments) {
        String type = typeOf(topic.types());
        String connector = acmeName(topic.name()) + "_conn";
        boolean connected = topic.publishers().size() + topic.subscribers().size() > 1;
        StringBuilder roles = new StringBuilder();

        for (String publisher : topic.publishers()) {
            String port = acmeName(topic.name()) + "_pub";
            addPort(ports, publisher, topicPort(port, "TopicAdvertisePortT", type, topic.name()));
            String role = acmeName(publisher) + "_pub";
            roles.append(role(role, "ROSTopicAdvertiserRoleT"));
            if (connected) {
                attachments.add(attachment(acmeName(publisher), port, connector, role));
            }
        }
        for (String subscriber : topic.subscribers()) {
            String port = acmeName(topic.name()) + "_sub";
            addPort(ports, subscriber, topicPort(port, "TopicSubscribePortT", type, topic.name()));
            String role = acmeName(subscriber) + "_sub";
            roles.append(role(role, "ROSTopicSubscriberRoleT"));
            if (connected) {
                attachments.add(attachment(acmeName(subscriber), port, connector, role));
            }
        }

        if (connected) {
            connectors.add(INDENT + "connector " + connector + " : TopicConnectorT = new TopicConnectorT extended with {\n"
                + roles
                + PORT_INDENT + "property msg_type = \"" + escape(type) + "\";\n"
                + PORT_INDENT + "property topic = \"" + escape(topic.name()) + "\";\n"
                + INDENT + "};\n");
        }
    }

    private void addService(ServiceInfo service, Map<String, Set<String>> ports,
                            List<String> connectors, List<String> attachments) {
        String type = typeOf(service.types());
        String connector = acmeName(service.name()) + "_conn";
        boolean connected = !service.providers().isEmpty() && !service.callers().isEmpty();
        StringBuilder roles = new StringBuilder();

        for (String provider : service.providers()) {
            String port = acmeName(service.name()) + "_svc";
            addPort(ports, provider, PORT_INDENT + "port " + port
                + " : ServiceProviderPortT = new ServiceProviderPortT extended with {\n"
                + PROPERTY_INDENT + "property svc_type : string = \"" + escape(type) + "\";\n"
                + PROPERTY_INDENT + "property name : string = \"" + escape(service.name()) + "\";\n"
                + PROPERTY_INDENT + "property args : string = \"\";\n"
                + PORT_INDENT + "};\n");
            String role = acmeName(provider) + "_prov";
            roles.append(role(role, "ROSServiceProviderRoleT"));
            if (connected) {
                attachments.add(attachment(acmeName(provider), port, connector, role));
            }
        }
        for (String caller : service.callers()) {
            String port = acmeName(service.name()) + "_call";
            addPort(ports, caller, PORT_INDENT + "port " + port
                + " : ServiceClientPortT = new ServiceClientPortT extended with {\n"
                + PROPERTY_INDENT + "property svc_type : string = \"" + escape(type) + "\";\n"
                + PROPERTY_INDENT + "property persistency : boolean = false;\n"
                + PORT_INDENT + "};\n");
            String role = acmeName(caller) + "_call";
            roles.append(role(role, "ROSServiceCallRoleT"));
            if (connected) {
                attachments.add(attachment(acmeName(caller), port, connector, role));
            }
        }

        if (connected) {
            connectors.add(INDENT + "connector " + connector + " : ServiceConnT = new ServiceConnT extended with {\n"
                + roles
                + INDENT + "};\n");
        }
    }

    private void addAction(ActionInfo action, Map<String, Set<String>> ports,
                           List<String> connectors, List<String> attachments) {
        String type = typeOf(action.types());
        String connector = acmeName(action.name()) + "_conn";
        boolean connected = !action.servers().isEmpty() && !action.clients().isEmpty();
        StringBuilder roles = new StringBuilder();

        for (String server : action.servers()) {
            String port = acmeName(action.name()) + "_srvr";
            addPort(ports, server, actionPort(port, "ActionServerPortT", type));
            String role = acmeName(server) + "_srvr";
            roles.append(role(role, "ROSActionResponderRoleT"));
            if (connected) {
                attachments.add(attachment(acmeName(server), port, connector, role));
            }
        }
        for (String client : action.clients()) {
            String port = acmeName(action.name()) + "_cli";
            addPort(ports, client, actionPort(port, "ActionClientPortT", type));
            String role = acmeName(client) + "_cli";
            roles.append(role(role, "ROSActionCallerRoleT"));
            if (connected) {
                attachments.add(attachment(acmeName(client), port, connector, role));
            }
        }

        if (connected) {
            connectors.add(INDENT + "connector " + connector
                + " : ActionServerConnT = new ActionServerConnT extended with {\n"
                + roles
                + INDENT + "};\n");
        }
    }

    private void appendComponent(StringBuilder sb, ResolvedNodeInstance node, Set<String> ports, String launchFile) {
        String family = node.modeled() ? "ROSNodeCompT" : "ROSNodeCompT, PlaceholderT";
        String source = node.record().location() != null ? node.record().location().source() : launchFile;

        sb.append(INDENT).append("component ").append(acmeName(node.fullName()))
            .append(" : ").append(family).append(" = new ").append(family).append(" extended with {\n");
        ports.forEach(sb::append);
        sb.append(PORT_INDENT).append("property name = \"").append(escape(node.fullName())).append("\";\n");
        if (!node.modeled()) {
            sb.append(PORT_INDENT).append("property placeholder = true;\n");
        }
        sb.append(PORT_INDENT).append("property launch_file = \"").append(escape(source)).append("\";\n");
        sb.append(INDENT).append("};\n");
    }

    private static void addPort(Map<String, Set<String>> ports, String node, String port) {
        ports.computeIfAbsent(node, key -> new LinkedHashSet<>()).add(port);
    }

    private static String topicPort(String name, String portType, String type, String topic) {
        return PORT_INDENT + "port " + name + " : " + portType + " = new " + portType + " extended with {\n"
            + PROPERTY_INDENT + "property msg_type = \"" + escape(type) + "\";\n"
            + PROPERTY_INDENT + "property topic = \"" + escape(topic) + "\";\n"
            + PORT_INDENT + "};\n";
    }

    private static String actionPort(String name, String portType, String type) {
        return PORT_INDENT + "port " + name + " : " + portType + " = new " + portType + " extended with {\n"
            + PROPERTY_INDENT + "property action_type : string = \"" + escape(type) + "\";\n"
            + PORT_INDENT + "};\n";
    }

    private static String role(String name, String roleType) {
        return PORT_INDENT + "role " + name + " : " + roleType + " = new " + roleType + ";\n";
    }

    private static String attachment(String component, String port, String connector, String role) {
        return INDENT + "attachment " + component + "." + port + " to " + connector + "." + role + ";\n";
    }

    /**
     * Derives the system name from the launch file name without its extension.
     */
    static String systemName(String launchFile) {
        String fileName = launchFile == null ? "" : launchFile.substring(launchFile.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return base.isEmpty() ? DEFAULT_SYSTEM_NAME : acmeName(base);
    }

    /**
     * Turns a ROS name into an Acme identifier; {@code /robot1/scan} becomes
     * {@code _robot1_scan}.
     */
    static String acmeName(String name) {
        return name.replaceAll(NAME_SANITIZATION_PATTERN, "_");
    }

    // Conflicting types are already reported as diagnostics; the first one is kept.
    private static String typeOf(List<String> types) {
        return types.isEmpty() ? UNKNOWN_TYPE : types.get(0);
    }

    private static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\"", "'").replace("\n", " ");
    }
}
