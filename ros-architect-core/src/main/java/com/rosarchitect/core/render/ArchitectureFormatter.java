package com.rosarchitect.core.render;

import com.rosarchitect.core.model.Architecture;

/**
 * Renders a recovered {@link Architecture} as text.
 *
 * <p>Formatters are discovered via Java Service Provider Interface (SPI). Output must be
 * deterministic: the same architecture always renders to the same bytes.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.rosarchitect.core.render.ArchitectureFormatter}
 *
 * @see ArchitectureFormatters
 */
public interface ArchitectureFormatter {

    /**
     * Returns unique identifier for this formatter.
     *
     * <p>Used with {@code --format}. Should be lowercase (e.g., "text", "json", "mermaid").
     *
     * @return unique formatter identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this formatter.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Renders the architecture.
     *
     * @param architecture recovered architecture
     * @return rendered output
     */
    String format(Architecture architecture);
}
