package com.docformat.core.model;

import java.util.List;

/**
 * Generic container without any formatting of its own.
 *
 * @param children ordered child nodes
 */
public record ContentBlock(List<ContentNode> children) implements ContentNode {

    public ContentBlock {
        children = children == null ? List.of() : List.copyOf(children);
    }
}
