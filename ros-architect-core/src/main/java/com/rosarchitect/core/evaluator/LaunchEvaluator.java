package com.rosarchitect.core.evaluator;

import com.fasterxml.jackson.databind.JsonNode;
import com.rosarchitect.core.error.CyclicIncludeException;
import com.rosarchitect.core.error.IncludeResolutionException;
import com.rosarchitect.core.error.LaunchParseException;
import com.rosarchitect.core.error.MissingArgumentException;
import com.rosarchitect.core.error.SubstitutionException;
import com.rosarchitect.core.launch.LaunchDescriptorParser;
import com.rosarchitect.core.launch.LaunchSource;
import com.rosarchitect.core.launch.LaunchSourceResolver;
import com.rosarchitect.core.launch.PackageLocator;
import com.rosarchitect.core.launch.ast.ArgDirective;
import com.rosarchitect.core.launch.ast.Condition;
import com.rosarchitect.core.launch.ast.GroupDirective;
import com.rosarchitect.core.launch.ast.IncludeDirective;
import com.rosarchitect.core.launch.ast.LaunchDirective;
import com.rosarchitect.core.launch.ast.LaunchDocument;
import com.rosarchitect.core.launch.ast.LaunchNodeSpec;
import com.rosarchitect.core.launch.ast.ParamDirective;
import com.rosarchitect.core.launch.ast.RemapDirective;
import com.rosarchitect.core.launch.ast.RosParamDirective;
import com.rosarchitect.core.model.ResolvedNodeRecord;
import com.rosarchitect.core.model.SourceLocation;
import com.rosarchitect.core.substitution.BooleanValues;
import com.rosarchitect.core.substitution.Expression;
import com.rosarchitect.core.substitution.SubstitutionContext;
import com.rosarchitect.core.substitution.SubstitutionParser;
import com.rosarchitect.core.util.RosNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Symbolic evaluator for parsed launch files.
 *
 * <p>Walks the directive tree in document order, resolving substitutions against the
 * current {@link EvaluationScope}. {@code <arg>} and {@code <remap>} directives update the
 * scope for the siblings that follow them; groups and includes are evaluated in child
 * scopes that are discarded afterwards. Included files are parsed on first use and cached
 * for the rest of the run.
 *
 * <p>Argument precedence, highest first: the {@code value} attribute, the value passed at
 * the scope site, the {@code default} attribute, a binding inherited from an enclosing
 * scope. Referencing an argument with none of these fails with
 * {@link MissingArgumentException}.
 *
 * <p>Evaluation is single-threaded and deterministic: the same input always produces the
 * same records in the same order.
 */
public class LaunchEvaluator {

    private static final Logger log = LoggerFactory.getLogger(LaunchEvaluator.class);

    private static final String REMAP_OPERATOR = ":=";
    private static final String SPECIAL_ARG_PREFIX = "__";

    private final LaunchSourceResolver sourceResolver;
    private final PackageLocator packageLocator;
    private final Map<String, String> environment;
    private final LaunchDescriptorParser parser;
    private final ParameterValues parameterValues;

    /**
     * Creates an evaluator.
     *
     * @param sourceResolver reads launch, YAML and text files
     * @param packageLocator resolves {@code $(find PKG)}
     * @param environment environment visible to {@code $(env)} and {@code $(optenv)}
     */
    public LaunchEvaluator(LaunchSourceResolver sourceResolver, PackageLocator packageLocator,
                           Map<String, String> environment) {
        this(sourceResolver, packageLocator, environment, new LaunchDescriptorParser());
    }

    public LaunchEvaluator(LaunchSourceResolver sourceResolver, PackageLocator packageLocator,
                           Map<String, String> environment, LaunchDescriptorParser parser) {
        this.sourceResolver = Objects.requireNonNull(sourceResolver, "sourceResolver must not be null");
        this.packageLocator = packageLocator == null ? PackageLocator.none() : packageLocator;
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.parameterValues = new ParameterValues();
    }

    /**
     * Evaluates a root launch file.
     *
     * @param rootPath path of the root launch file
     * @param overrides top-level argument overrides ({@code name:=value} on the command line)
     * @return node records, parameters and visited sources
     * @throws com.rosarchitect.core.error.LaunchException on any fatal launch error
     */
    public LaunchEvaluation evaluate(String rootPath, Map<String, String> overrides) {
        Objects.requireNonNull(rootPath, "rootPath must not be null");
        Run run = new Run();
        LaunchSource root = run.read(rootPath, null, List.of());
        EvaluationScope scope = EvaluationScope.root(root, overrides == null ? Map.of() : overrides);

        log.info("Evaluating launch file: {}", root.path());
        run.evaluateAll(run.parse(root, List.of()).directives(), scope);
        log.info("Evaluated {} node(s) and {} parameter(s) from {} file(s)",
            run.records.size(), run.parameters.size(), run.sources.size());

        return new LaunchEvaluation(root.path(), run.records, run.parameters, new ArrayList<>(run.sources));
    }

    /**
     * Mutable state of one evaluation.
     */
    private final class Run {
        private final List<ResolvedNodeRecord> records = new ArrayList<>();
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private final Map<String, LaunchDocument> parsed = new HashMap<>();
        private final Map<String, String> anonymousNames = new HashMap<>();
        private final Set<String> sources = new LinkedHashSet<>();

        // ==================== Directive Walk ====================

        private EvaluationScope evaluateAll(List<LaunchDirective> directives, EvaluationScope scope) {
            EvaluationScope current = scope;
            for (LaunchDirective directive : directives) {
                current = evaluate(directive, current);
            }
            return current;
        }

        private EvaluationScope evaluate(LaunchDirective directive, EvaluationScope scope) {
            boolean enabled = isEnabled(directive.condition(), directive.location(), scope);

            if (directive instanceof GroupDirective group) {
                enterGroup(group, scope, enabled);
                return scope;
            }
            if (directive instanceof IncludeDirective include) {
                enterInclude(include, scope, enabled);
                return scope;
            }
            if (!enabled || !scope.condition()) {
                log.debug("Skipping disabled directive at {}", directive.location());
                return scope;
            }

            if (directive instanceof ArgDirective arg) {
                return declareArgument(arg, scope);
            } else if (directive instanceof RemapDirective remap) {
                Context context = new Context(scope);
                return scope.withRemap(remap.from().evaluate(context), remap.to().evaluate(context));
            } else if (directive instanceof ParamDirective param) {
                assignParameter(param, scope, scope.namespace(), null);
            } else if (directive instanceof RosParamDirective rosParam) {
                loadRosParam(rosParam, scope, scope.namespace(), null);
            } else if (directive instanceof LaunchNodeSpec node) {
                launchNode(node, scope);
            }
            return scope;
        }

        private boolean isEnabled(Condition condition, SourceLocation location, EvaluationScope scope) {
            if (condition.isAlways() || !scope.condition()) {
                return true;
            }
            Context context = new Context(scope);
            if (condition.ifExpression() != null) {
                return BooleanValues.parse(condition.ifExpression().evaluate(context),
                    location, scope.includeStack());
            }
            return !BooleanValues.parse(condition.unlessExpression().evaluate(context),
                location, scope.includeStack());
        }

        // ==================== Scopes ====================

        private void enterGroup(GroupDirective group, EvaluationScope scope, boolean enabled) {
            String namespace = scope.condition() && enabled ? evaluateOptional(group.namespace(), scope) : null;
            EvaluationScope child = scope.enterGroup(namespace, enabled);
            if (!child.condition()) {
                log.debug("Skipping disabled group at {}", group.location());
                return;
            }
            evaluateAll(group.children(), child);
        }

        private void enterInclude(IncludeDirective include, EvaluationScope scope, boolean enabled) {
            if (!enabled || !scope.condition()) {
                log.debug("Skipping disabled include at {}", include.location());
                return;
            }

            Context context = new Context(scope);
            String path = include.file().evaluate(context);
            String namespace = evaluateOptional(include.namespace(), scope);

            Map<String, String> passed = new LinkedHashMap<>();
            if (include.passAllArgs() != null && BooleanValues.parse(include.passAllArgs().evaluate(context),
                include.location(), scope.includeStack())) {
                passed.putAll(scope.arguments().bindings());
            }
            for (ArgDirective arg : include.args()) {
                if (!isEnabled(arg.condition(), arg.location(), scope)) {
                    continue;
                }
                Expression value = arg.value() != null ? arg.value() : arg.defaultValue();
                passed.put(arg.name(), value.evaluate(context));
            }

            LaunchSource included = read(path, include.location(), scope.includeStack());
            if (scope.includeStack().contains(included.path())) {
                throw new CyclicIncludeException(included.path(), include.location(),
                    scope.includeChainWith(included.path()));
            }

            log.debug("Including {} from {}", included.path(), include.location());
            LaunchDocument document = parse(included, scope.includeChainWith(included.path()));
            evaluateAll(document.directives(), scope.enterInclude(included, namespace, passed, true));
        }

        private EvaluationScope declareArgument(ArgDirective arg, EvaluationScope declaringScope) {
            if (declaringScope.declared().contains(arg.name())) {
                throw new LaunchParseException("Argument '" + arg.name() + "' is already declared in "
                    + declaringScope.source().path(), arg.location(), declaringScope.includeStack());
            }
            EvaluationScope scope = declaringScope.withDeclaration(arg.name());
            Context context = new Context(scope);
            if (arg.value() != null) {
                if (scope.overrides().containsKey(arg.name())) {
                    log.debug("Argument '{}' has a fixed value; ignoring the value passed for it", arg.name());
                }
                return scope.withArgument(arg.name(), arg.value().evaluate(context));
            }
            String passed = scope.overrides().get(arg.name());
            if (passed != null) {
                return scope.withArgument(arg.name(), passed);
            }
            if (arg.defaultValue() != null) {
                return scope.withArgument(arg.name(), arg.defaultValue().evaluate(context));
            }
            // declared without a value: an inherited binding, if any, stays visible
            return scope;
        }

        // ==================== Nodes ====================

        private void launchNode(LaunchNodeSpec spec, EvaluationScope scope) {
            Context context = new Context(scope);
            String packageName = spec.packageName().evaluate(context);
            String executable = spec.executable().evaluate(context);
            String name = spec.name().evaluate(context);
            if (!RosNames.isBaseName(name)) {
                throw new LaunchParseException(
                    "Node name '" + name + "' must not contain a namespace", spec.location(), scope.includeStack());
            }

            String nodeNamespace = evaluateOptional(spec.namespace(), scope);
            String namespace = nodeNamespace == null ? scope.namespace() : RosNames.resolve(nodeNamespace, scope.namespace());
            String fullName = RosNames.join(namespace, name);
            String args = spec.args() == null ? "" : spec.args().evaluate(context).trim();

            Map<String, String> remappings = new LinkedHashMap<>(scope.remaps().entries());
            addArgumentRemaps(args, remappings);
            for (RemapDirective remap : spec.remaps()) {
                if (isEnabled(remap.condition(), remap.location(), scope)) {
                    String from = remap.from().evaluate(context);
                    remappings.remove(from);
                    remappings.put(from, remap.to().evaluate(context));
                }
            }

            Map<String, Object> nodeParameters = new LinkedHashMap<>();
            for (LaunchDirective parameter : spec.parameters()) {
                if (!isEnabled(parameter.condition(), parameter.location(), scope)) {
                    continue;
                }
                if (parameter instanceof ParamDirective param) {
                    assignParameter(param, scope, fullName, nodeParameters);
                } else if (parameter instanceof RosParamDirective rosParam) {
                    loadRosParam(rosParam, scope, fullName, nodeParameters);
                }
            }

            ResolvedNodeRecord record = new ResolvedNodeRecord(records.size(), packageName, executable, name,
                namespace, fullName, args, remappings, nodeParameters, spec.location(), scope.includeStack());
            records.add(record);
            log.debug("Resolved node {} ({}/{}) at {}", fullName, packageName, executable, spec.location());
        }

        private void addArgumentRemaps(String args, Map<String, String> remappings) {
            if (args.isEmpty()) {
                return;
            }
            for (String token : args.split("\\s+")) {
                int operator = token.indexOf(REMAP_OPERATOR);
                if (operator <= 0 || token.startsWith(SPECIAL_ARG_PREFIX)) {
                    continue;
                }
                String from = token.substring(0, operator);
                remappings.remove(from);
                remappings.put(from, token.substring(operator + REMAP_OPERATOR.length()));
            }
        }

        // ==================== Parameters ====================

        private void assignParameter(ParamDirective param, EvaluationScope scope, String namespace,
                                     Map<String, Object> nodeParameters) {
            Context context = new Context(scope);
            String name = RosNames.resolve(param.name().evaluate(context), namespace);
            String type = evaluateOptional(param.type(), scope);

            Object value;
            if (param.value() != null) {
                value = parameterValues.convert(param.value().evaluate(context), type, param.location());
            } else if (param.textFile() != null) {
                String path = param.textFile().evaluate(context);
                value = parameterValues.convert(read(path, param.location(), scope.includeStack()).content(),
                    type == null ? "str" : type, param.location());
            } else {
                log.warn("Parameter {} is set by a command; its value is not determined statically ({})",
                    name, param.location());
                value = null;
            }

            ParameterValues.assign(parameters, name, value);
            if (nodeParameters != null) {
                ParameterValues.assign(nodeParameters, name, value);
            }
        }

        private void loadRosParam(RosParamDirective rosParam, EvaluationScope scope, String namespace,
                                  Map<String, Object> nodeParameters) {
            Context context = new Context(scope);
            String base = rosParam.namespace() == null
                ? namespace
                : RosNames.resolve(rosParam.namespace().evaluate(context), namespace);
            String param = evaluateOptional(rosParam.param(), scope);

            switch (rosParam.command()) {
                case DUMP -> log.debug("Ignoring rosparam dump at {}", rosParam.location());
                case DELETE -> {
                    if (param == null) {
                        throw new LaunchParseException(
                            "rosparam delete requires a 'param' attribute", rosParam.location(), scope.includeStack());
                    }
                    String name = RosNames.resolve(param, base);
                    int removed = ParameterValues.delete(parameters, name);
                    if (nodeParameters != null) {
                        ParameterValues.delete(nodeParameters, name);
                    }
                    log.debug("Deleted {} parameter(s) under {}", removed, name);
                }
                case LOAD -> {
                    String yaml = rosParam.file() != null
                        ? read(rosParam.file().evaluate(context), rosParam.location(), scope.includeStack()).content()
                        : rosParam.inlineText();
                    if (rosParam.substituteValue()) {
                        yaml = SubstitutionParser.parse(yaml, rosParam.location()).evaluate(context);
                    }
                    JsonNode document = parameterValues.readYaml(yaml, rosParam.location());
                    if (document.isMissingNode() || document.isNull()) {
                        log.debug("Empty rosparam document at {}", rosParam.location());
                        return;
                    }
                    if (param == null && !document.isObject()) {
                        throw new LaunchParseException("rosparam with a non-dictionary value requires a 'param' attribute",
                            rosParam.location(), scope.includeStack());
                    }
                    String target = param == null ? base : RosNames.resolve(param, base);
                    parameterValues.flatten(parameters, target, document);
                    if (nodeParameters != null) {
                        parameterValues.flatten(nodeParameters, target, document);
                    }
                }
                default -> throw new IllegalStateException("Unhandled rosparam command: " + rosParam.command());
            }
        }

        // ==================== Sources ====================

        private LaunchSource read(String path, SourceLocation location, List<String> includeChain) {
            try {
                LaunchSource source = sourceResolver.resolve(path);
                sources.add(source.path());
                return source;
            } catch (IOException e) {
                throw new IncludeResolutionException("Cannot read " + path + ": " + e.getMessage(),
                    location, includeChain, e);
            }
        }

        private LaunchDocument parse(LaunchSource source, List<String> includeChain) {
            LaunchDocument cached = parsed.get(source.path());
            if (cached != null) {
                return cached;
            }
            LaunchDocument document;
            try {
                document = parser.parse(source);
            } catch (LaunchParseException e) {
                if (!e.getIncludeChain().isEmpty() || includeChain.isEmpty()) {
                    throw e;
                }
                throw new LaunchParseException(e.getMessage(), e.getLocation(), includeChain);
            }
            parsed.put(source.path(), document);
            return document;
        }

        private String evaluateOptional(Expression expression, EvaluationScope scope) {
            return expression == null ? null : expression.evaluate(new Context(scope));
        }

        /**
         * Substitution lookups against one scope.
         */
        private final class Context implements SubstitutionContext {
            private final EvaluationScope scope;

            private Context(EvaluationScope scope) {
                this.scope = scope;
            }

            @Override
            public String argument(String name, SourceLocation location) {
                return scope.arguments().lookup(name)
                    .orElseThrow(() -> new MissingArgumentException(name, location, scope.includeStack()));
            }

            @Override
            public Optional<String> environment(String variable) {
                return Optional.ofNullable(environment.get(variable));
            }

            @Override
            public String packagePath(String packageName, SourceLocation location) {
                return packageLocator.locate(packageName)
                    .orElseThrow(() -> new SubstitutionException(
                        "Package '" + packageName + "' not found", location, scope.includeStack()));
            }

            @Override
            public String anonymousName(String base, SourceLocation location) {
                String existing = anonymousNames.get(base);
                if (existing != null) {
                    return existing;
                }
                String generated = base + "_anon" + (anonymousNames.size() + 1);
                anonymousNames.put(base, generated);
                return generated;
            }

            @Override
            public String currentDirectory(SourceLocation location) {
                return scope.source().directory();
            }

            @Override
            public List<String> includeChain() {
                return scope.includeStack();
            }
        }
    }
}
