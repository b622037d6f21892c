package com.rosarchitect.core.nodemodel.descriptor;

import com.rosarchitect.core.error.LaunchException;
import com.rosarchitect.core.error.SubstitutionException;
import com.rosarchitect.core.model.InterfaceDeclaration;
import com.rosarchitect.core.model.SourceLocation;
import com.rosarchitect.core.nodemodel.ModelContext;
import com.rosarchitect.core.nodemodel.NodeModel;
import com.rosarchitect.core.substitution.BooleanValues;
import com.rosarchitect.core.substitution.SubstitutionContext;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Declarative node model built from a YAML descriptor.
 *
 * <p>Templates are evaluated in order against the node's parameters. A template whose
 * condition or name cannot be evaluated is dropped with a warning; a type that cannot be
 * evaluated degrades to {@link InterfaceDeclaration#UNKNOWN_TYPE}.
 */
public final class DescriptorNodeModel implements NodeModel {

    private final String packageName;
    private final String executable;
    private final String description;
    private final List<InterfaceTemplate> templates;
    private final String source;

    public DescriptorNodeModel(String packageName, String executable, String description,
                               List<InterfaceTemplate> templates, String source) {
        this.packageName = Objects.requireNonNull(packageName, "packageName must not be null");
        this.executable = Objects.requireNonNull(executable, "executable must not be null");
        this.description = description;
        this.templates = templates == null ? List.of() : List.copyOf(templates);
        this.source = source;
    }

    @Override
    public String getPackageName() {
        return packageName;
    }

    @Override
    public String getExecutable() {
        return executable;
    }

    @Override
    public String getDescription() {
        return description != null ? description : NodeModel.super.getDescription();
    }

    public List<InterfaceTemplate> getTemplates() {
        return templates;
    }

    /**
     * Returns where the descriptor was loaded from.
     *
     * @return descriptor file or classpath resource
     */
    public String getSource() {
        return source;
    }

    @Override
    public void declare(ModelContext context) {
        SubstitutionContext parameters = new ParameterLookup(context);

        for (InterfaceTemplate template : templates) {
            if (template.condition() != null) {
                try {
                    String value = template.condition().evaluate(parameters);
                    if (!BooleanValues.parse(value, SourceLocation.of(source), List.of())) {
                        continue;
                    }
                } catch (LaunchException e) {
                    context.warn("Dropped " + describe(template) + ": condition failed: " + e.getMessage());
                    continue;
                }
            }

            String name;
            try {
                name = template.name().evaluate(parameters);
            } catch (LaunchException e) {
                context.warn("Dropped " + describe(template) + ": name failed: " + e.getMessage());
                continue;
            }
            if (name.isBlank()) {
                context.warn("Dropped " + describe(template) + ": name is empty");
                continue;
            }

            String type = null;
            if (template.type() != null) {
                try {
                    type = template.type().evaluate(parameters);
                } catch (LaunchException e) {
                    context.warn("Type of " + name + " is unknown: " + e.getMessage());
                }
            }

            context.declare(template.kind(), template.direction(), name, type, template.dynamic());
        }
    }

    private static String describe(InterfaceTemplate template) {
        return template.kind().name().toLowerCase(Locale.ROOT) + " '" + template.name().render() + "'";
    }

    /**
     * Resolves {@code $(param NAME [default])} against the node's parameters.
     */
    private static final class ParameterLookup implements SubstitutionContext {
        private final ModelContext context;

        private ParameterLookup(ModelContext context) {
            this.context = context;
        }

        @Override
        public String parameter(String name, String defaultValue, SourceLocation location) {
            return context.parameterValue(name)
                .map(String::valueOf)
                .or(() -> Optional.ofNullable(defaultValue))
                .orElseThrow(() -> new SubstitutionException(
                    "Parameter '" + name + "' is not set and has no default", location));
        }
    }
}
