package com.docformat.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Documentation content attached to a node.
 *
 * <p>Sections keep their insertion order. Labels starting with {@code $} are reserved for
 * sections consumed by other parts of the pipeline and are never rendered as part of a
 * description.
 *
 * @param summary short one-line summary
 * @param description full description body
 * @param sections named sections keyed by label, in declaration order
 */
public record Content(
    ContentNode summary,
    ContentNode description,
    Map<String, ContentNode> sections
) {
    /** Prefix of section labels that are never rendered as part of a description. */
    public static final String RESERVED_PREFIX = "$";

    /** Content of an undocumented node. */
    public static final Content EMPTY = new Content(null, null, null);

    /**
     * Compact constructor with validation.
     */
    public Content {
        if (summary == null) {
            summary = ContentNodes.empty();
        }
        if (description == null) {
            description = ContentNodes.empty();
        }
        sections = sections == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(sections));
    }

    /**
     * Creates content with a summary only.
     *
     * @param summary summary node
     * @return content without description or sections
     */
    public static Content ofSummary(ContentNode summary) {
        Objects.requireNonNull(summary, "summary must not be null");
        return new Content(summary, null, null);
    }

    /**
     * Returns whether there is nothing to show in a description block.
     *
     * <p>The summary is not taken into account; it is rendered separately.
     *
     * @return true if the description is empty and every section is reserved
     */
    public boolean isEmpty() {
        return description.isEmpty() && sections.keySet().stream().allMatch(Content::isReserved);
    }

    /**
     * Returns whether a section label is reserved.
     *
     * @param label section label
     * @return true if the label starts with {@link #RESERVED_PREFIX}
     */
    public static boolean isReserved(String label) {
        return label.startsWith(RESERVED_PREFIX);
    }
}
