package com.docformat.core.model;

import java.util.List;

/**
 * Single entry of a {@link ContentList}.
 *
 * @param children ordered child nodes
 */
public record ContentListItem(List<ContentNode> children) implements ContentNode {

    public ContentListItem {
        children = children == null ? List.of() : List.copyOf(children);
    }
}
