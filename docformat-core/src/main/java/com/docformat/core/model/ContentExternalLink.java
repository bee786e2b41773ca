package com.docformat.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Link to an external resource.
 *
 * @param href raw link target, embedded as is
 * @param children link text
 */
public record ContentExternalLink(String href, List<ContentNode> children) implements ContentNode {

    /**
     * Compact constructor with validation.
     */
    public ContentExternalLink {
        Objects.requireNonNull(href, "href must not be null");
        children = children == null ? List.of() : List.copyOf(children);
    }
}
