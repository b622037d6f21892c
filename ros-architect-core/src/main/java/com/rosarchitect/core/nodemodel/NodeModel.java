package com.rosarchitect.core.nodemodel;

/**
 * Behavioral model of a node executable.
 *
 * <p>A model is keyed by {@code (package, executable)} and declares the interfaces a
 * node of that type would create, given the node's resolved parameters, arguments and
 * identity. Models are shared between nodes and runs, so implementations must be
 * stateless.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * public void declare(ModelContext context) {
 *     context.subscribe("scan", "sensor_msgs/LaserScan");
 *     if (context.readParameter("~publish_map", true).equals(Boolean.TRUE)) {
 *         context.publish("map", "nav_msgs/OccupancyGrid");
 *     }
 * }
 * }</pre>
 *
 * @see NodeModelRegistry
 * @see ModelContext
 */
public interface NodeModel {

    /**
     * Returns the ROS package of the modeled executable.
     *
     * @return package name
     */
    String getPackageName();

    /**
     * Returns the modeled executable ({@code type} attribute of {@code <node>}).
     *
     * @return executable name
     */
    String getExecutable();

    /**
     * Returns a short description for listings.
     *
     * @return description, the model key by default
     */
    default String getDescription() {
        return key(getPackageName(), getExecutable());
    }

    /**
     * Emits the declarations of one node.
     *
     * @param context resolved node identity and declaration sink
     * @throws ModelEvaluationException if the node's configuration cannot be modeled
     */
    void declare(ModelContext context);

    /**
     * Builds the registry key of a model.
     *
     * @param packageName package name
     * @param executable executable name
     * @return {@code package/executable}
     */
    static String key(String packageName, String executable) {
        return packageName + "/" + executable;
    }
}
