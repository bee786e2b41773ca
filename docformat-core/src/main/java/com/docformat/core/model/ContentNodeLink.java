package com.docformat.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Reference to another documentation node.
 *
 * <p>The link target is resolved to a location at render time, relative to the page
 * being rendered.
 *
 * @param node target node
 * @param children link text
 */
public record ContentNodeLink(DocumentationNode node, List<ContentNode> children) implements ContentNode {

    /**
     * Compact constructor with validation.
     */
    public ContentNodeLink {
        Objects.requireNonNull(node, "node must not be null");
        children = children == null ? List.of() : List.copyOf(children);
    }
}
