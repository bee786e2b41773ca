package com.docformat.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.docformat.core.model.ContentNodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Content} and the content node records.
 */
class ContentTest {

    @Test
    void empty_hasEmptyNodesAndNoSections() {
        assertThat(Content.EMPTY.isEmpty()).isTrue();
        assertThat(Content.EMPTY.summary().isEmpty()).isTrue();
        assertThat(Content.EMPTY.sections()).isEmpty();
    }

    @Test
    void isEmpty_ignoresSummary() {
        assertThat(Content.ofSummary(text("Parses input.")).isEmpty()).isTrue();
    }

    @Test
    void isEmpty_falseWithDescription() {
        Content content = new Content(null, paragraph(text("Long text")), null);

        assertThat(content.isEmpty()).isFalse();
    }

    @Test
    void isEmpty_ignoresReservedSections() {
        Content reservedOnly = new Content(null, null, Map.of("$signature", keyword("fun")));
        Content withSection = new Content(null, null, Map.of("Since", text("1.0")));

        assertThat(reservedOnly.isEmpty()).isTrue();
        assertThat(withSection.isEmpty()).isFalse();
    }

    @Test
    void sections_keepInsertionOrderAndAreUnmodifiable() {
        Map<String, ContentNode> sections = new LinkedHashMap<>();
        sections.put("Since", text("1.0"));
        sections.put("Author", text("Jane"));
        sections.put("See also", text("Lexer"));

        Content content = new Content(null, null, sections);
        sections.clear();

        assertThat(content.sections().keySet()).containsExactly("Since", "Author", "See also");
        assertThatThrownBy(() -> content.sections().put("x", text("y")))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void leafNodes_areEmptyOnlyWithoutText() {
        assertThat(text("").isEmpty()).isTrue();
        assertThat(text("a").isEmpty()).isFalse();
        assertThat(keyword("fun").children()).isEmpty();
    }

    @Test
    void containers_areEmptyWithoutChildren() {
        assertThat(block().isEmpty()).isTrue();
        assertThat(paragraph(text("a")).isEmpty()).isFalse();
        assertThat(new ContentStrong(null).children()).isEmpty();
    }

    @Test
    void containers_copyChildren() {
        List<ContentNode> children = new ArrayList<>();
        children.add(text("a"));
        ContentBlock block = new ContentBlock(children);

        children.add(text("b"));

        assertThat(block.children()).containsExactly(text("a"));
    }

    @Test
    void leaves_haveValueEquality() {
        assertThat(text("a")).isEqualTo(text("a"));
        assertThat(identifier("x")).isNotEqualTo(keyword("x"));
    }

    @Test
    void isReserved_checksPrefix() {
        assertThat(Content.isReserved("$signature")).isTrue();
        assertThat(Content.isReserved("Signature")).isFalse();
    }
}
