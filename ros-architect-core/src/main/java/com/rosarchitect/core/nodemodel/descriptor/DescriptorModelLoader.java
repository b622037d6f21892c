package com.rosarchitect.core.nodemodel.descriptor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.rosarchitect.core.error.LaunchException;
import com.rosarchitect.core.model.Direction;
import com.rosarchitect.core.model.InterfaceKind;
import com.rosarchitect.core.model.SourceLocation;
import com.rosarchitect.core.nodemodel.descriptor.ModelDescriptorFile.ModelDescriptor;
import com.rosarchitect.core.nodemodel.descriptor.ModelDescriptorFile.TemplateDescriptor;
import com.rosarchitect.core.substitution.Expression;
import com.rosarchitect.core.substitution.SubstitutionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads {@link DescriptorNodeModel}s from YAML descriptor files.
 *
 * <p>Uses Jackson YAML to read {@link ModelDescriptorFile} records and compiles every
 * template expression up front, so a malformed descriptor fails when it is loaded rather
 * than while a node is resolved.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<DescriptorNodeModel> models = new DescriptorModelLoader().load(Path.of("models/nav.yaml"));
 * }</pre>
 */
public class DescriptorModelLoader {

    private static final Logger log = LoggerFactory.getLogger(DescriptorModelLoader.class);

    private final ObjectMapper yamlMapper;

    public DescriptorModelLoader() {
        this(new ObjectMapper(new YAMLFactory()));
    }

    public DescriptorModelLoader(ObjectMapper yamlMapper) {
        this.yamlMapper = yamlMapper;
    }

    /**
     * Loads a descriptor file.
     *
     * @param path YAML file
     * @return compiled models in file order
     * @throws ModelDescriptorException if the file cannot be read or compiled
     */
    public List<DescriptorNodeModel> load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ModelDescriptorException("Model descriptor not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new ModelDescriptorException("Failed to read model descriptor " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads a descriptor from the classpath.
     *
     * @param resource resource name, e.g. {@code nodemodels/standard-models.yaml}
     * @return compiled models in file order
     * @throws ModelDescriptorException if the resource is missing or invalid
     */
    public List<DescriptorNodeModel> loadResource(String resource) {
        ClassLoader classLoader = DescriptorModelLoader.class.getClassLoader();
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ModelDescriptorException("Model descriptor resource not found: " + resource);
            }
            return load(in, resource);
        } catch (IOException e) {
            throw new ModelDescriptorException("Failed to read model descriptor " + resource + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads a descriptor from a stream.
     *
     * @param in YAML content
     * @param source name used in messages and source locations
     * @return compiled models in file order
     */
    public List<DescriptorNodeModel> load(InputStream in, String source) {
        ModelDescriptorFile file;
        try {
            file = yamlMapper.readValue(in, ModelDescriptorFile.class);
        } catch (IOException e) {
            throw new ModelDescriptorException("Invalid model descriptor " + source + ": " + e.getMessage(), e);
        }
        if (file == null) {
            log.warn("Model descriptor {} is empty", source);
            return List.of();
        }

        List<DescriptorNodeModel> models = new ArrayList<>();
        for (ModelDescriptor descriptor : file.models()) {
            models.add(compile(descriptor, source));
        }
        log.debug("Loaded {} model(s) from {}", models.size(), source);
        return models;
    }

    private DescriptorNodeModel compile(ModelDescriptor descriptor, String source) {
        if (isBlank(descriptor.packageName()) || isBlank(descriptor.executable())) {
            throw new ModelDescriptorException("Model in " + source + " requires 'package' and 'executable'");
        }
        String key = descriptor.packageName() + "/" + descriptor.executable();
        SourceLocation location = SourceLocation.of(source);

        List<InterfaceTemplate> templates = new ArrayList<>();
        addTemplates(templates, descriptor.publishers(), InterfaceKind.TOPIC, Direction.PUBLISH, key, location);
        addTemplates(templates, descriptor.subscribers(), InterfaceKind.TOPIC, Direction.SUBSCRIBE, key, location);
        addTemplates(templates, descriptor.services(), InterfaceKind.SERVICE, Direction.PROVIDE, key, location);
        addTemplates(templates, descriptor.serviceClients(), InterfaceKind.SERVICE, Direction.CALL, key, location);
        addTemplates(templates, descriptor.actionServers(), InterfaceKind.ACTION, Direction.PROVIDE, key, location);
        addTemplates(templates, descriptor.actionClients(), InterfaceKind.ACTION, Direction.CALL, key, location);
        for (TemplateDescriptor parameter : descriptor.parameters()) {
            templates.add(template(parameter, InterfaceKind.PARAMETER, access(parameter, key), key, location));
        }

        return new DescriptorNodeModel(descriptor.packageName(), descriptor.executable(),
            descriptor.description(), templates, source);
    }

    private void addTemplates(List<InterfaceTemplate> templates, List<TemplateDescriptor> descriptors,
                              InterfaceKind kind, Direction direction, String key, SourceLocation location) {
        for (TemplateDescriptor descriptor : descriptors) {
            templates.add(template(descriptor, kind, direction, key, location));
        }
    }

    private InterfaceTemplate template(TemplateDescriptor descriptor, InterfaceKind kind, Direction direction,
                                       String key, SourceLocation location) {
        if (isBlank(descriptor.name())) {
            throw new ModelDescriptorException("Template of " + key + " in " + location.source() + " requires 'name'");
        }
        try {
            return new InterfaceTemplate(
                kind,
                direction,
                SubstitutionParser.parse(descriptor.name(), location),
                compileOptional(descriptor.type(), location),
                compileOptional(descriptor.condition(), location),
                Boolean.TRUE.equals(descriptor.dynamic())
            );
        } catch (LaunchException e) {
            throw new ModelDescriptorException("Invalid expression in model " + key + ": " + e.getMessage(), e);
        }
    }

    private static Direction access(TemplateDescriptor parameter, String key) {
        String access = parameter.access() == null ? "read" : parameter.access().trim().toLowerCase(Locale.ROOT);
        return switch (access) {
            case "read" -> Direction.READ;
            case "write" -> Direction.WRITE;
            case "own" -> Direction.OWN;
            default -> throw new ModelDescriptorException(
                "Unknown parameter access '" + parameter.access() + "' in model " + key);
        };
    }

    private static Expression compileOptional(String text, SourceLocation location) {
        return isBlank(text) ? null : SubstitutionParser.parse(text, location);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
