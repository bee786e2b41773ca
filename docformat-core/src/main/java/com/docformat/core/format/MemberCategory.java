package com.docformat.core.format;

import com.docformat.core.model.DocumentationNode;
import com.docformat.core.model.NodeKind;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Member tables rendered below a node's description, in rendering order.
 *
 * <p>The first seven categories partition {@link DocumentationNode#members()}: every member
 * is selected by exactly one of them. {@link #OTHER_MEMBERS} catches every kind not claimed
 * by a named category. The last three list references that are not owned members.
 */
public enum MemberCategory {

    PACKAGES("Packages", node -> node.members(NodeKind.PACKAGE)),

    TYPES("Types", node -> membersOfKinds(node, Kinds.TYPES)),

    CONSTRUCTORS("Constructors", node -> node.members(NodeKind.CONSTRUCTOR)),

    PROPERTIES("Properties", node -> node.members(NodeKind.PROPERTY)),

    FUNCTIONS("Functions", node -> node.members(NodeKind.FUNCTION)),

    ACCESSORS("Accessors", node -> node.members(NodeKind.PROPERTY_ACCESSOR)),

    OTHER_MEMBERS("Other members", node -> membersOfKinds(node, Kinds.OTHER)),

    EXTENSIONS("Extensions", DocumentationNode::extensions),

    INHERITORS("Inheritors", DocumentationNode::inheritors),

    LINKS("Links", DocumentationNode::links);

    private final String caption;
    private final Function<DocumentationNode, List<DocumentationNode>> selector;

    MemberCategory(String caption, Function<DocumentationNode, List<DocumentationNode>> selector) {
        this.caption = caption;
        this.selector = selector;
    }

    /**
     * Returns the section header text.
     *
     * @return caption such as "Functions"
     */
    public String caption() {
        return caption;
    }

    /**
     * Selects the nodes of this category from a node.
     *
     * @param node owner node
     * @return selected nodes in declaration order, possibly empty
     */
    public List<DocumentationNode> select(DocumentationNode node) {
        return selector.apply(node);
    }

    private static List<DocumentationNode> membersOfKinds(DocumentationNode node, Set<NodeKind> kinds) {
        return node.members().stream()
            .filter(member -> kinds.contains(member.kind()))
            .collect(Collectors.toList());
    }

    // Enum constants cannot read static fields of their own enum while initializing.
    private static final class Kinds {
        static final Set<NodeKind> TYPES = EnumSet.of(
            NodeKind.CLASS, NodeKind.INTERFACE, NodeKind.ENUM, NodeKind.OBJECT);

        static final Set<NodeKind> OTHER = EnumSet.complementOf(EnumSet.of(
            NodeKind.PACKAGE,
            NodeKind.CLASS,
            NodeKind.INTERFACE,
            NodeKind.ENUM,
            NodeKind.OBJECT,
            NodeKind.CONSTRUCTOR,
            NodeKind.PROPERTY,
            NodeKind.FUNCTION,
            NodeKind.PROPERTY_ACCESSOR));
    }
}
