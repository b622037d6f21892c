package com.rosarchitect.core.query;

import com.rosarchitect.core.error.UnknownNodeException;
import com.rosarchitect.core.error.UnknownServiceException;
import com.rosarchitect.core.error.UnknownTopicException;
import com.rosarchitect.core.model.ActionInfo;
import com.rosarchitect.core.model.Architecture;
import com.rosarchitect.core.model.InterfaceDeclaration;
import com.rosarchitect.core.model.ParameterInfo;
import com.rosarchitect.core.model.ResolvedNodeInstance;
import com.rosarchitect.core.model.ServiceInfo;
import com.rosarchitect.core.model.TopicInfo;
import com.rosarchitect.core.util.RosNames;

import java.util.List;
import java.util.Objects;

/**
 * Read-only questions against a recovered {@link Architecture}, in the spirit of
 * {@code rostopic}, {@code rosservice} and {@code rosnode}.
 *
 * <p>Names passed to the {@code describe} methods are normalized first, so {@code scan}
 * and {@code /scan/} both denote {@code /scan}.
 */
public class ArchitectureQuery {

    private static final String TYPE_SEPARATOR = " | ";

    private final Architecture architecture;

    public ArchitectureQuery(Architecture architecture) {
        this.architecture = Objects.requireNonNull(architecture, "architecture must not be null");
    }

    public Architecture architecture() {
        return architecture;
    }

    // ==================== Topics ====================

    /**
     * Lists every topic.
     *
     * @return sorted absolute topic names
     */
    public List<String> listTopics() {
        return List.copyOf(architecture.topics().keySet());
    }

    /**
     * Describes a topic.
     *
     * @param name topic name
     * @return publishers, subscribers and types
     * @throws UnknownTopicException if no node uses the topic
     */
    public TopicInfo describeTopic(String name) {
        TopicInfo topic = architecture.topics().get(RosNames.normalize(name));
        if (topic == null) {
            throw new UnknownTopicException(name);
        }
        return topic;
    }

    /**
     * Returns the type of a topic.
     *
     * @param name topic name
     * @return the declared type, the sorted types joined by {@code " | "} when they
     *         conflict, or {@code unknown}
     * @throws UnknownTopicException if no node uses the topic
     */
    public String topicType(String name) {
        List<String> types = describeTopic(name).types();
        return types.isEmpty() ? InterfaceDeclaration.UNKNOWN_TYPE : String.join(TYPE_SEPARATOR, types);
    }

    // ==================== Services ====================

    public List<String> listServices() {
        return List.copyOf(architecture.services().keySet());
    }

    /**
     * Describes a service.
     *
     * @param name service name
     * @return provider (all providers on conflict), callers and types
     * @throws UnknownServiceException if no node uses the service
     */
    public ServiceInfo describeService(String name) {
        ServiceInfo service = architecture.services().get(RosNames.normalize(name));
        if (service == null) {
            throw new UnknownServiceException(name);
        }
        return service;
    }

    public String serviceType(String name) {
        List<String> types = describeService(name).types();
        return types.isEmpty() ? InterfaceDeclaration.UNKNOWN_TYPE : String.join(TYPE_SEPARATOR, types);
    }

    // ==================== Actions and Parameters ====================

    public List<ActionInfo> listActions() {
        return List.copyOf(architecture.actions().values());
    }

    public List<ParameterInfo> listParameters() {
        return List.copyOf(architecture.parameters().values());
    }

    // ==================== Nodes ====================

    /**
     * Lists node instances in evaluation order; unmodeled nodes have
     * {@link ResolvedNodeInstance#modeled()} false.
     *
     * @return node instances
     */
    public List<ResolvedNodeInstance> listNodes() {
        return architecture.nodes();
    }

    /**
     * Describes a node.
     *
     * @param name absolute node name
     * @return node instance
     * @throws UnknownNodeException if no node has the name
     */
    public ResolvedNodeInstance describeNode(String name) {
        return architecture.node(RosNames.normalize(name))
            .orElseThrow(() -> new UnknownNodeException(name));
    }

    /**
     * Lists the topics a node publishes, after remapping.
     *
     * @param name absolute node name
     * @return sorted topic names
     * @throws UnknownNodeException if no node has the name
     */
    public List<String> publicationsOf(String name) {
        String node = describeNode(name).fullName();
        return architecture.topics().values().stream()
            .filter(topic -> topic.publishers().contains(node))
            .map(TopicInfo::name)
            .toList();
    }

    public List<String> subscriptionsOf(String name) {
        String node = describeNode(name).fullName();
        return architecture.topics().values().stream()
            .filter(topic -> topic.subscribers().contains(node))
            .map(TopicInfo::name)
            .toList();
    }

    public List<String> servicesOf(String name) {
        String node = describeNode(name).fullName();
        return architecture.services().values().stream()
            .filter(service -> service.providers().contains(node))
            .map(ServiceInfo::name)
            .toList();
    }
}
