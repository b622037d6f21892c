package com.rosarchitect.core.nodemodel;

import com.rosarchitect.core.model.Diagnostic;
import com.rosarchitect.core.model.DiagnosticKind;
import com.rosarchitect.core.model.Direction;
import com.rosarchitect.core.model.InterfaceDeclaration;
import com.rosarchitect.core.model.InterfaceKind;
import com.rosarchitect.core.model.ResolvedNodeRecord;
import com.rosarchitect.core.util.RosNames;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Context handed to a {@link NodeModel} for one resolved node.
 *
 * <p>Exposes the node's identity, arguments and parameter values, and collects the
 * declarations and warnings the model emits. Names are recorded as given (relative,
 * private or absolute); resolution and remapping happen when the architecture is
 * assembled. A context is confined to the thread resolving its node.
 */
public final class ModelContext {

    private final ResolvedNodeRecord record;
    private final Map<String, Object> launchParameters;
    private final List<InterfaceDeclaration> declarations = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Creates a context.
     *
     * @param record resolved launch record of the node
     * @param launchParameters parameters assigned by the launch files
     */
    public ModelContext(ResolvedNodeRecord record, Map<String, Object> launchParameters) {
        this.record = Objects.requireNonNull(record, "record must not be null");
        this.launchParameters = launchParameters == null ? Map.of() : launchParameters;
    }

    public ResolvedNodeRecord record() {
        return record;
    }

    public String name() {
        return record.name();
    }

    public String namespace() {
        return record.namespace();
    }

    public String fullName() {
        return record.fullName();
    }

    public String args() {
        return record.args();
    }

    // ==================== Topics and Services ====================

    public void publish(String topic, String type) {
        declare(InterfaceKind.TOPIC, Direction.PUBLISH, topic, type, false);
    }

    public void subscribe(String topic, String type) {
        declare(InterfaceKind.TOPIC, Direction.SUBSCRIBE, topic, type, false);
    }

    public void provide(String service, String type) {
        declare(InterfaceKind.SERVICE, Direction.PROVIDE, service, type, false);
    }

    public void call(String service, String type) {
        declare(InterfaceKind.SERVICE, Direction.CALL, service, type, false);
    }

    /**
     * Declares an action server. The five action topics ({@code goal}, {@code cancel},
     * {@code status}, {@code feedback}, {@code result}) are derived from the action when
     * the architecture is assembled, after remapping.
     *
     * @param action action namespace
     * @param type action type, e.g. {@code move_base_msgs/MoveBaseAction}
     */
    public void actionServer(String action, String type) {
        declare(InterfaceKind.ACTION, Direction.PROVIDE, action, type, false);
    }

    /**
     * Declares an action client; see {@link #actionServer(String, String)}.
     *
     * @param action action namespace
     * @param type action type
     */
    public void actionClient(String action, String type) {
        declare(InterfaceKind.ACTION, Direction.CALL, action, type, false);
    }

    // ==================== Parameters ====================

    /**
     * Declares a parameter read and returns its value.
     *
     * <p>The value comes from the node's own {@code <param>} children, then from the
     * launch parameter table, then the given default.
     *
     * @param parameter parameter name, usually private ({@code ~rate})
     * @param defaultValue value used when nothing assigns the parameter
     * @return parameter value
     */
    public Object readParameter(String parameter, Object defaultValue) {
        return readParameter(parameter, defaultValue, false);
    }

    /**
     * Declares a parameter read and returns its value.
     *
     * @param parameter parameter name
     * @param defaultValue value used when nothing assigns the parameter
     * @param dynamic whether the node reacts to runtime updates of the parameter
     * @return parameter value
     */
    public Object readParameter(String parameter, Object defaultValue, boolean dynamic) {
        declare(InterfaceKind.PARAMETER, Direction.READ, parameter, null, dynamic);
        return parameterValue(parameter).orElse(defaultValue);
    }

    public void writeParameter(String parameter) {
        declare(InterfaceKind.PARAMETER, Direction.WRITE, parameter, null, false);
    }

    public void ownParameter(String parameter, boolean dynamic) {
        declare(InterfaceKind.PARAMETER, Direction.OWN, parameter, null, dynamic);
    }

    /**
     * Looks up a parameter value without declaring a read.
     *
     * @param parameter parameter name
     * @return value assigned by the launch files, if any
     */
    public Optional<Object> parameterValue(String parameter) {
        String resolved = RosNames.resolve(parameter, record.namespace(), record.fullName());
        if (record.parameters().containsKey(resolved)) {
            return Optional.ofNullable(record.parameters().get(resolved));
        }
        return Optional.ofNullable(launchParameters.get(resolved));
    }

    // ==================== Generic ====================

    /**
     * Records one declaration.
     *
     * @param kind interface kind
     * @param direction role of the node
     * @param name relative, pre-remap name
     * @param type declared type, null when unknown
     * @param dynamic reconfigurable parameter flag
     */
    public void declare(InterfaceKind kind, Direction direction, String name, String type, boolean dynamic) {
        declarations.add(new InterfaceDeclaration(kind, direction, name, type, dynamic));
    }

    /**
     * Records a {@code MODEL_EVALUATION} warning for this node.
     *
     * @param message warning text
     */
    public void warn(String message) {
        diagnostics.add(new Diagnostic(DiagnosticKind.MODEL_EVALUATION, record.fullName(), message,
            record.location()));
    }

    public List<InterfaceDeclaration> declarations() {
        return Collections.unmodifiableList(declarations);
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
