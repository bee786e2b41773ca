package com.docformat.core.model;

import java.util.List;

/**
 * Paragraph of text.
 *
 * @param children ordered child nodes
 */
public record ContentParagraph(List<ContentNode> children) implements ContentNode {

    public ContentParagraph {
        children = children == null ? List.of() : List.copyOf(children);
    }
}
