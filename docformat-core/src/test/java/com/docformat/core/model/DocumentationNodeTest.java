package com.docformat.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DocumentationNode}.
 */
class DocumentationNodeTest {

    @Test
    void path_runsFromRootToNodeInclusive() {
        DocumentationNode module = node("", NodeKind.MODULE);
        DocumentationNode pkg = node("com.example", NodeKind.PACKAGE);
        DocumentationNode type = node("Parser", NodeKind.CLASS);
        DocumentationNode function = node("parse", NodeKind.FUNCTION);
        module.addMember(pkg);
        pkg.addMember(type);
        type.addMember(function);

        assertThat(function.path()).containsExactly(module, pkg, type, function);
        assertThat(module.path()).containsExactly(module);
    }

    @Test
    void qualifiedName_skipsModuleAndJoinsWithDots() {
        DocumentationNode module = node("lib", NodeKind.MODULE);
        DocumentationNode pkg = node("com.example", NodeKind.PACKAGE);
        DocumentationNode type = node("Parser", NodeKind.CLASS);
        module.addMember(pkg);
        pkg.addMember(type);

        assertThat(type.qualifiedName()).isEqualTo("com.example.Parser");
        assertThat(module.qualifiedName()).isEmpty();
        assertThat(type.toString()).isEqualTo("CLASS com.example.Parser");
    }

    @Test
    void addMember_setsOwnerAndKeepsOrder() {
        DocumentationNode type = node("Parser", NodeKind.CLASS);
        DocumentationNode b = node("b", NodeKind.FUNCTION);
        DocumentationNode a = node("a", NodeKind.PROPERTY);

        type.addMember(b).addMember(a);

        assertThat(type.members()).containsExactly(b, a);
        assertThat(a.owner()).contains(type);
        assertThat(type.owner()).isEmpty();
    }

    @Test
    void addMember_whenMemberAlreadyOwned_throwsException() {
        DocumentationNode first = node("First", NodeKind.CLASS);
        DocumentationNode second = node("Second", NodeKind.CLASS);
        DocumentationNode member = node("m", NodeKind.FUNCTION);
        first.addMember(member);

        assertThatThrownBy(() -> second.addMember(member))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("already has an owner");
    }

    @Test
    void addMember_whenMemberIsAncestor_throwsException() {
        DocumentationNode root = node("root", NodeKind.MODULE);
        DocumentationNode child = node("child", NodeKind.PACKAGE);
        root.addMember(child);

        assertThatThrownBy(() -> child.addMember(child))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> node("x", NodeKind.CLASS).addMember(null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void members_byKind_filtersInDeclarationOrder() {
        DocumentationNode type = node("Parser", NodeKind.CLASS);
        DocumentationNode parse = node("parse", NodeKind.FUNCTION);
        DocumentationNode size = node("size", NodeKind.PROPERTY);
        DocumentationNode reset = node("reset", NodeKind.FUNCTION);
        type.addMember(parse).addMember(size).addMember(reset);

        assertThat(type.members(NodeKind.FUNCTION)).containsExactly(parse, reset);
        assertThat(type.members(NodeKind.ENUM)).isEmpty();
    }

    @Test
    void references_doNotChangeOwnership() {
        DocumentationNode type = node("Parser", NodeKind.CLASS);
        DocumentationNode extension = node("parseAll", NodeKind.FUNCTION);
        DocumentationNode inheritor = node("FastParser", NodeKind.CLASS);
        DocumentationNode link = node("Lexer", NodeKind.CLASS);

        type.addExtension(extension).addInheritor(inheritor).addLink(link);

        assertThat(type.extensions()).containsExactly(extension);
        assertThat(type.inheritors()).containsExactly(inheritor);
        assertThat(type.links()).containsExactly(link);
        assertThat(extension.owner()).isEmpty();
        assertThat(type.members()).isEmpty();
    }

    @Test
    void accessors_returnUnmodifiableViews() {
        DocumentationNode type = node("Parser", NodeKind.CLASS);
        DocumentationNode member = node("m", NodeKind.FUNCTION);

        assertThatThrownBy(() -> type.members().add(member)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> type.links().add(member)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> type.path().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void equality_isByIdentity() {
        DocumentationNode one = node("parse", NodeKind.FUNCTION);
        DocumentationNode other = node("parse", NodeKind.FUNCTION);

        assertThat(one).isNotEqualTo(other).isEqualTo(one);
    }

    @Test
    void constructor_withNullContent_usesEmptyContent() {
        DocumentationNode node = new DocumentationNode("x", NodeKind.CLASS, null);

        assertThat(node.content()).isEqualTo(Content.EMPTY);
        assertThat(node.summary().children()).isEmpty();
    }

    private static DocumentationNode node(String name, NodeKind kind) {
        return new DocumentationNode(name, kind, Content.EMPTY);
    }
}
