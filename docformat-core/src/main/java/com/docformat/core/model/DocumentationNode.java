package com.docformat.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Node of a documentation tree: a module, package, type or member together with its
 * documentation content.
 *
 * <p>The tree is assembled by the model-building stage through {@link #addMember},
 * {@link #addExtension}, {@link #addInheritor} and {@link #addLink}. Formatters treat the
 * assembled tree as read-only; all accessors return unmodifiable views.
 *
 * <p>Nodes use identity equality: two distinct declarations with the same name are
 * different nodes.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * DocumentationNode pkg = new DocumentationNode("com.example", NodeKind.PACKAGE, Content.EMPTY);
 * DocumentationNode parse = new DocumentationNode("parse", NodeKind.FUNCTION,
 *     Content.ofSummary(ContentNodes.text("Parses the input.")));
 * pkg.addMember(parse);
 *
 * parse.path();          // [com.example, parse]
 * parse.qualifiedName(); // com.example.parse
 * }</pre>
 */
public final class DocumentationNode {

    private final String name;
    private final NodeKind kind;
    private final Content content;

    private DocumentationNode owner;
    private final List<DocumentationNode> members = new ArrayList<>();
    private final List<DocumentationNode> extensions = new ArrayList<>();
    private final List<DocumentationNode> inheritors = new ArrayList<>();
    private final List<DocumentationNode> links = new ArrayList<>();

    /**
     * Creates a node without owner or references.
     *
     * @param name simple name, may be empty for an unnamed module
     * @param kind node kind
     * @param content documentation content, {@link Content#EMPTY} if undocumented
     */
    public DocumentationNode(String name, NodeKind kind, Content content) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.content = content == null ? Content.EMPTY : content;
    }

    public String name() {
        return name;
    }

    public NodeKind kind() {
        return kind;
    }

    public Content content() {
        return content;
    }

    /**
     * Returns the summary of this node's content.
     *
     * @return summary content node
     */
    public ContentNode summary() {
        return content.summary();
    }

    public Optional<DocumentationNode> owner() {
        return Optional.ofNullable(owner);
    }

    public List<DocumentationNode> members() {
        return Collections.unmodifiableList(members);
    }

    /**
     * Returns the members of the given kind, in declaration order.
     *
     * @param kind kind to select
     * @return matching members
     */
    public List<DocumentationNode> members(NodeKind kind) {
        return members.stream()
            .filter(member -> member.kind == kind)
            .collect(Collectors.toList());
    }

    public List<DocumentationNode> extensions() {
        return Collections.unmodifiableList(extensions);
    }

    public List<DocumentationNode> inheritors() {
        return Collections.unmodifiableList(inheritors);
    }

    public List<DocumentationNode> links() {
        return Collections.unmodifiableList(links);
    }

    /**
     * Returns the ancestor chain of this node, from the root down to this node inclusive.
     *
     * @return path starting at the root and ending with this node
     */
    public List<DocumentationNode> path() {
        List<DocumentationNode> path = new ArrayList<>();
        for (DocumentationNode node = this; node != null; node = node.owner) {
            path.add(node);
        }
        Collections.reverse(path);
        return Collections.unmodifiableList(path);
    }

    /**
     * Returns the dot-separated names of this node's path, skipping the module root.
     *
     * @return qualified name such as {@code com.example.Parser.parse}
     */
    public String qualifiedName() {
        return path().stream()
            .filter(node -> node.kind != NodeKind.MODULE)
            .map(DocumentationNode::name)
            .filter(segment -> !segment.isEmpty())
            .collect(Collectors.joining("."));
    }

    /**
     * Appends a member and makes this node its owner.
     *
     * @param member child node
     * @return this node
     * @throws IllegalArgumentException if the member already has an owner
     */
    public DocumentationNode addMember(DocumentationNode member) {
        Objects.requireNonNull(member, "member must not be null");
        if (member.owner != null) {
            throw new IllegalArgumentException("Node already has an owner: " + member);
        }
        if (member == this || path().contains(member)) {
            throw new IllegalArgumentException("Node cannot be its own ancestor: " + member);
        }
        member.owner = this;
        members.add(member);
        return this;
    }

    /**
     * Records a node that extends this one without being owned by it.
     *
     * @param extension extension node
     * @return this node
     */
    public DocumentationNode addExtension(DocumentationNode extension) {
        extensions.add(Objects.requireNonNull(extension, "extension must not be null"));
        return this;
    }

    public DocumentationNode addInheritor(DocumentationNode inheritor) {
        inheritors.add(Objects.requireNonNull(inheritor, "inheritor must not be null"));
        return this;
    }

    public DocumentationNode addLink(DocumentationNode link) {
        links.add(Objects.requireNonNull(link, "link must not be null"));
        return this;
    }

    @Override
    public String toString() {
        return kind + " " + qualifiedName();
    }
}
