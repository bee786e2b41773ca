package com.docformat.core.model;

import java.util.List;

/**
 * Emphasized inline text.
 *
 * @param children ordered child nodes
 */
public record ContentEmphasis(List<ContentNode> children) implements ContentNode {

    public ContentEmphasis {
        children = children == null ? List.of() : List.copyOf(children);
    }
}
