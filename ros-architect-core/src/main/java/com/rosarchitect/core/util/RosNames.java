package com.rosarchitect.core.util;

/**
 * ROS graph name resolution.
 *
 * <p>Rules:
 * <ul>
 *   <li>{@code /scan} is absolute and unaffected by namespaces</li>
 *   <li>{@code ~scan} is private: resolved under the node's own name</li>
 *   <li>{@code scan} is relative: resolved under the node's namespace</li>
 * </ul>
 *
 * <pre>{@code
 * RosNames.resolve("scan", "/robot1", "/robot1/driver");   // "/robot1/scan"
 * RosNames.resolve("~scan", "/robot1", "/robot1/driver");  // "/robot1/driver/scan"
 * RosNames.resolve("/scan", "/robot1", "/robot1/driver");  // "/scan"
 * }</pre>
 */
public final class RosNames {

    /** The root namespace. */
    public static final String ROOT = "/";

    private static final char SEPARATOR = '/';
    private static final char PRIVATE = '~';

    private RosNames() {
        // Utility class
    }

    /**
     * Resolves a name for a node.
     *
     * @param name relative, private or absolute name
     * @param namespace absolute namespace of the node
     * @param nodeFullName absolute name of the node
     * @return normalized absolute name
     */
    public static String resolve(String name, String namespace, String nodeFullName) {
        if (name.isEmpty()) {
            return normalize(namespace);
        }
        char first = name.charAt(0);
        if (first == SEPARATOR) {
            return normalize(name);
        }
        if (first == PRIVATE) {
            return join(nodeFullName, name.substring(1));
        }
        return join(namespace, name);
    }

    /**
     * Resolves a name that is not attached to a node (parameters in groups, namespaces).
     *
     * @param name relative or absolute name
     * @param namespace absolute enclosing namespace
     * @return normalized absolute name
     */
    public static String resolve(String name, String namespace) {
        if (name == null || name.isEmpty()) {
            return normalize(namespace);
        }
        if (name.charAt(0) == SEPARATOR) {
            return normalize(name);
        }
        if (name.charAt(0) == PRIVATE) {
            return join(namespace, name.substring(1));
        }
        return join(namespace, name);
    }

    /**
     * Joins a namespace and a relative name.
     *
     * @param namespace absolute namespace
     * @param name relative name
     * @return normalized absolute name
     */
    public static String join(String namespace, String name) {
        return normalize(namespace + SEPARATOR + name);
    }

    /**
     * Normalizes a name: leading slash, no repeated or trailing slashes.
     *
     * @param name name to normalize
     * @return normalized name, {@code /} for the root namespace
     */
    public static String normalize(String name) {
        StringBuilder sb = new StringBuilder(name.length() + 1);
        sb.append(SEPARATOR);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == SEPARATOR && sb.charAt(sb.length() - 1) == SEPARATOR) {
                continue;
            }
            sb.append(c);
        }
        if (sb.length() > 1 && sb.charAt(sb.length() - 1) == SEPARATOR) {
            sb.setLength(sb.length() - 1);
        }
        return sb.toString();
    }

    /**
     * Returns the last segment of an absolute name.
     *
     * @param fullName absolute name
     * @return base name
     */
    public static String baseName(String fullName) {
        String normalized = normalize(fullName);
        return normalized.substring(normalized.lastIndexOf(SEPARATOR) + 1);
    }

    /**
     * Returns the namespace containing an absolute name.
     *
     * @param fullName absolute name
     * @return parent namespace, {@code /} for top-level names
     */
    public static String parentNamespace(String fullName) {
        String normalized = normalize(fullName);
        int slash = normalized.lastIndexOf(SEPARATOR);
        return slash <= 0 ? ROOT : normalized.substring(0, slash);
    }

    /**
     * Checks whether a name is a valid base name (no namespace separator or private marker).
     *
     * @param name candidate node name
     * @return true if the name can be used as a node base name
     */
    public static boolean isBaseName(String name) {
        return !name.isEmpty() && name.indexOf(SEPARATOR) < 0 && name.charAt(0) != PRIVATE;
    }
}
