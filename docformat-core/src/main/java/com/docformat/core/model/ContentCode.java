package com.docformat.core.model;

import java.util.List;

/**
 * Inline code span.
 *
 * @param children ordered child nodes
 */
public record ContentCode(List<ContentNode> children) implements ContentNode {

    public ContentCode {
        children = children == null ? List.of() : List.copyOf(children);
    }
}
