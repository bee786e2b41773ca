package com.docformat.core.model;

import java.util.List;

/**
 * Multi-line code block.
 *
 * @param children ordered child nodes
 */
public record ContentBlockCode(List<ContentNode> children) implements ContentNode {

    public ContentBlockCode {
        children = children == null ? List.of() : List.copyOf(children);
    }
}
