package com.rosarchitect.core.nodemodel.descriptor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root of a YAML model descriptor file.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * models:
 *   - package: robot_state_publisher
 *     executable: robot_state_publisher
 *     publishers:
 *       - name: tf
 *         type: tf2_msgs/TFMessage
 *     subscribers:
 *       - name: joint_states
 *         type: sensor_msgs/JointState
 *     parameters:
 *       - name: ~publish_frequency
 *         access: read
 *       - name: ~use_tf_static
 *         access: read
 *     actionServers:
 *       - name: $(param ~action_name move)
 *         type: move_base_msgs/MoveBaseAction
 *         if: $(param ~enable_action false)
 * }</pre>
 *
 * @param models model descriptors
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelDescriptorFile(
    @JsonProperty("models") List<ModelDescriptor> models
) {
    public ModelDescriptorFile {
        models = models == null ? List.of() : List.copyOf(models);
    }

    /**
     * One node model.
     *
     * @param packageName ROS package
     * @param executable executable name
     * @param description optional description
     * @param publishers published topics
     * @param subscribers subscribed topics
     * @param services provided services
     * @param serviceClients called services
     * @param actionServers provided actions
     * @param actionClients used actions
     * @param parameters parameters with their access mode
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ModelDescriptor(
        @JsonProperty("package") String packageName,
        @JsonProperty("executable") String executable,
        @JsonProperty("description") String description,
        @JsonProperty("publishers") List<TemplateDescriptor> publishers,
        @JsonProperty("subscribers") List<TemplateDescriptor> subscribers,
        @JsonProperty("services") List<TemplateDescriptor> services,
        @JsonProperty("serviceClients") List<TemplateDescriptor> serviceClients,
        @JsonProperty("actionServers") List<TemplateDescriptor> actionServers,
        @JsonProperty("actionClients") List<TemplateDescriptor> actionClients,
        @JsonProperty("parameters") List<TemplateDescriptor> parameters
    ) {
        public ModelDescriptor {
            publishers = publishers == null ? List.of() : List.copyOf(publishers);
            subscribers = subscribers == null ? List.of() : List.copyOf(subscribers);
            services = services == null ? List.of() : List.copyOf(services);
            serviceClients = serviceClients == null ? List.of() : List.copyOf(serviceClients);
            actionServers = actionServers == null ? List.of() : List.copyOf(actionServers);
            actionClients = actionClients == null ? List.of() : List.copyOf(actionClients);
            parameters = parameters == null ? List.of() : List.copyOf(parameters);
        }
    }

    /**
     * One interface template. {@code name}, {@code type} and {@code if} may use
     * {@code $(param NAME [default])}.
     *
     * @param name interface name expression
     * @param type type expression, optional
     * @param condition {@code if} expression, optional
     * @param access parameter access: {@code own}, {@code read} (default) or {@code write}
     * @param dynamic whether a parameter is reconfigurable at runtime
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TemplateDescriptor(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("if") String condition,
        @JsonProperty("access") String access,
        @JsonProperty("dynamic") Boolean dynamic
    ) {}
}
