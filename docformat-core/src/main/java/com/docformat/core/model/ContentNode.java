package com.docformat.core.model;

import java.util.List;

/**
 * Node of a structured-text content tree.
 *
 * <p>Leaf variants ({@link ContentText}, {@link ContentSymbol}, {@link ContentKeyword},
 * {@link ContentIdentifier}) hold literal text and have no children. Every other variant is
 * a container holding an ordered sequence of child nodes.
 *
 * <p>Formatters dispatch on the concrete variant; variants they do not recognize are
 * rendered as a plain sequence of their children.
 *
 * @see ContentNodes
 */
public interface ContentNode {

    /**
     * Returns the ordered children of this node.
     *
     * @return children, empty for leaf variants
     */
    List<ContentNode> children();

    /**
     * Returns whether this node has no children.
     *
     * @return true if there are no children
     */
    default boolean isEmpty() {
        return children().isEmpty();
    }
}
