package com.rosarchitect.core.assembler;

import com.rosarchitect.core.error.NodeNameConflictException;
import com.rosarchitect.core.model.ActionInfo;
import com.rosarchitect.core.model.Architecture;
import com.rosarchitect.core.model.Diagnostic;
import com.rosarchitect.core.model.DiagnosticKind;
import com.rosarchitect.core.model.Direction;
import com.rosarchitect.core.model.InterfaceDeclaration;
import com.rosarchitect.core.model.ParameterInfo;
import com.rosarchitect.core.model.ResolvedNodeInstance;
import com.rosarchitect.core.model.ServiceInfo;
import com.rosarchitect.core.model.TopicInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Merges resolved node instances into one {@link Architecture}.
 *
 * <p>Every declaration is resolved against its node and remapped, then indexed by its
 * absolute name. Node lists inside an index entry keep evaluation order. Warnings for
 * conflicting topic types and competing service providers are emitted once per name, in
 * name order, after the warnings produced while resolving the nodes.
 */
public class ArchitectureAssembler {

    private static final Logger log = LoggerFactory.getLogger(ArchitectureAssembler.class);

    /**
     * Assembles the architecture.
     *
     * @param launchFile root launch file
     * @param instances node instances in evaluation order
     * @param launchParameters parameters assigned by the launch files
     * @return immutable architecture
     * @throws NodeNameConflictException if two nodes share an absolute name
     */
    public Architecture assemble(String launchFile, List<ResolvedNodeInstance> instances,
                                 Map<String, Object> launchParameters) {
        checkUniqueNames(instances);

        Map<String, TopicEntry> topics = new TreeMap<>();
        Map<String, ServiceEntry> services = new TreeMap<>();
        Map<String, ActionEntry> actions = new TreeMap<>();
        Map<String, ParameterEntry> parameters = new TreeMap<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        launchParameters.forEach((name, value) -> parameters.computeIfAbsent(name, ParameterEntry::new).assign(value));

        for (ResolvedNodeInstance instance : instances) {
            diagnostics.addAll(instance.diagnostics());
            NameRemapper names = new NameRemapper(instance.record());
            String node = instance.fullName();

            for (InterfaceDeclaration declaration : instance.interfaces()) {
                switch (declaration.kind()) {
                    case TOPIC -> topics.computeIfAbsent(names.remap(declaration.name()), TopicEntry::new)
                        .add(node, declaration);
                    case SERVICE -> services.computeIfAbsent(names.remap(declaration.name()), ServiceEntry::new)
                        .add(node, declaration);
                    case ACTION -> {
                        String action = names.remap(declaration.name());
                        actions.computeIfAbsent(action, ActionEntry::new).add(node, declaration);
                        for (InterfaceDeclaration topic : ActionTopics.expand(action, declaration)) {
                            topics.computeIfAbsent(topic.name(), TopicEntry::new).add(node, topic);
                        }
                    }
                    case PARAMETER -> parameters.computeIfAbsent(names.resolve(declaration.name()), ParameterEntry::new)
                        .add(node, declaration.direction(), declaration.dynamic());
                }
            }
        }

        Map<String, TopicInfo> topicIndex = new TreeMap<>();
        topics.forEach((name, entry) -> topicIndex.put(name, entry.build()));
        Map<String, ServiceInfo> serviceIndex = new TreeMap<>();
        services.forEach((name, entry) -> serviceIndex.put(name, entry.build()));
        Map<String, ActionInfo> actionIndex = new TreeMap<>();
        actions.forEach((name, entry) -> actionIndex.put(name, entry.build()));
        Map<String, ParameterInfo> parameterIndex = new TreeMap<>();
        parameters.forEach((name, entry) -> parameterIndex.put(name, entry.build()));

        for (TopicInfo topic : topicIndex.values()) {
            if (topic.types().size() > 1) {
                diagnostics.add(new Diagnostic(DiagnosticKind.TOPIC_TYPE_MISMATCH, topic.name(),
                    "Topic is declared with types " + String.join(", ", topic.types()), null));
            }
        }
        for (ServiceInfo service : serviceIndex.values()) {
            if (service.hasProviderConflict()) {
                diagnostics.add(new Diagnostic(DiagnosticKind.SERVICE_PROVIDER_CONFLICT, service.name(),
                    "Service is provided by " + String.join(", ", service.providers()), null));
            }
        }

        log.info("Assembled architecture: {} node(s), {} topic(s), {} service(s), {} action(s), {} parameter(s)",
            instances.size(), topicIndex.size(), serviceIndex.size(), actionIndex.size(), parameterIndex.size());
        if (!diagnostics.isEmpty()) {
            log.info("Recovered architecture has {} warning(s)", diagnostics.size());
        }

        return new Architecture(launchFile, instances, topicIndex, serviceIndex, actionIndex, parameterIndex,
            diagnostics);
    }

    private static void checkUniqueNames(List<ResolvedNodeInstance> instances) {
        Map<String, ResolvedNodeInstance> seen = new HashMap<>();
        for (ResolvedNodeInstance instance : instances) {
            ResolvedNodeInstance first = seen.putIfAbsent(instance.fullName(), instance);
            if (first != null) {
                throw new NodeNameConflictException(instance.fullName(), first.record().location(),
                    instance.record().location(), instance.record().includeChain());
            }
        }
    }

    // ==================== Index Entries ====================

    private static final class TopicEntry {
        private final String name;
        private final Set<String> types = new TreeSet<>();
        private final Set<String> publishers = new LinkedHashSet<>();
        private final Set<String> subscribers = new LinkedHashSet<>();

        private TopicEntry(String name) {
            this.name = name;
        }

        private void add(String node, InterfaceDeclaration declaration) {
            addKnownType(types, declaration);
            (declaration.direction() == Direction.PUBLISH ? publishers : subscribers).add(node);
        }

        private TopicInfo build() {
            return new TopicInfo(name, List.copyOf(types), List.copyOf(publishers), List.copyOf(subscribers));
        }
    }

    private static final class ServiceEntry {
        private final String name;
        private final Set<String> types = new TreeSet<>();
        private final Set<String> providers = new LinkedHashSet<>();
        private final Set<String> callers = new LinkedHashSet<>();

        private ServiceEntry(String name) {
            this.name = name;
        }

        private void add(String node, InterfaceDeclaration declaration) {
            addKnownType(types, declaration);
            (declaration.direction() == Direction.PROVIDE ? providers : callers).add(node);
        }

        private ServiceInfo build() {
            return new ServiceInfo(name, List.copyOf(types), List.copyOf(providers), List.copyOf(callers));
        }
    }

    private static final class ActionEntry {
        private final String name;
        private final Set<String> types = new TreeSet<>();
        private final Set<String> servers = new LinkedHashSet<>();
        private final Set<String> clients = new LinkedHashSet<>();

        private ActionEntry(String name) {
            this.name = name;
        }

        private void add(String node, InterfaceDeclaration declaration) {
            addKnownType(types, declaration);
            (declaration.direction() == Direction.PROVIDE ? servers : clients).add(node);
        }

        private ActionInfo build() {
            return new ActionInfo(name, List.copyOf(types), List.copyOf(servers), List.copyOf(clients));
        }
    }

    private static final class ParameterEntry {
        private final String name;
        private Object value;
        private boolean assigned;
        private boolean dynamic;
        private final Set<String> owners = new LinkedHashSet<>();
        private final Set<String> readers = new LinkedHashSet<>();
        private final Set<String> writers = new LinkedHashSet<>();

        private ParameterEntry(String name) {
            this.name = name;
        }

        private void assign(Object assignedValue) {
            this.value = assignedValue;
            this.assigned = true;
        }

        private void add(String node, Direction direction, boolean dynamicParameter) {
            switch (direction) {
                case OWN -> owners.add(node);
                case WRITE -> writers.add(node);
                default -> readers.add(node);
            }
            dynamic |= dynamicParameter;
        }

        private ParameterInfo build() {
            return new ParameterInfo(name, value, assigned, List.copyOf(owners), List.copyOf(readers),
                List.copyOf(writers), dynamic);
        }
    }

    private static void addKnownType(Set<String> types, InterfaceDeclaration declaration) {
        if (declaration.hasKnownType()) {
            types.add(declaration.type());
        }
    }
}
