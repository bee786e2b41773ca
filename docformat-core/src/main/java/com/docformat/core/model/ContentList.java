package com.docformat.core.model;

import java.util.List;

/**
 * Unordered list; children are usually {@link ContentListItem}s.
 *
 * @param children ordered child nodes
 */
public record ContentList(List<ContentNode> children) implements ContentNode {

    public ContentList {
        children = children == null ? List.of() : List.copyOf(children);
    }
}
