package com.docformat.core.model;

import java.util.List;

/**
 * Strongly emphasized inline text.
 *
 * @param children ordered child nodes
 */
public record ContentStrong(List<ContentNode> children) implements ContentNode {

    public ContentStrong {
        children = children == null ? List.of() : List.copyOf(children);
    }
}
