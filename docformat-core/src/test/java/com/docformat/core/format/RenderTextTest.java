package com.docformat.core.format;

import com.docformat.core.model.ContentNode;
import com.docformat.core.model.DocumentationNode;
import com.docformat.core.model.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.docformat.core.model.ContentNodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for content-tree rendering in {@link StructuredFormatter#renderText}.
 */
class RenderTextTest extends FormatterTestBase {

    @Test
    void plainTextLeaves_renderAsEscapedConcatenation() {
        ContentNode content = block(text("a < b"), text(" & "), block(text("\"c\"")));

        assertThat(formatter.renderText(PAGE, content)).isEqualTo("a &lt; b &amp; &quot;c&quot;");
    }

    @Test
    void alreadyEscapedLookingText_isEscapedExactlyOnce() {
        assertThat(formatter.renderText(PAGE, text("&amp;"))).isEqualTo("&amp;amp;");
    }

    @Test
    void emptySequence_rendersEmptyString() {
        assertThat(formatter.renderText(PAGE, List.of())).isEmpty();
        assertThat(formatter.renderText(PAGE, empty())).isEmpty();
    }

    @Test
    void inlineContainers_wrapEscapedChildrenWithoutEscapingAgain() {
        assertThat(formatter.renderText(PAGE, strong(text("<b>")))).isEqualTo("<strong>&lt;b&gt;</strong>");
        assertThat(formatter.renderText(PAGE, emphasis(text("x")))).isEqualTo("<emph>x</emph>");
        assertThat(formatter.renderText(PAGE, code(text("a < b")))).isEqualTo("<code>a &lt; b</code>");
    }

    @Test
    void signatureLeaves_renderAsClassedSpans() {
        assertThat(formatter.renderText(PAGE, symbol("->"))).isEqualTo("<span class=\"symbol\">-&gt;</span>");
        assertThat(formatter.renderText(PAGE, keyword("val"))).isEqualTo("<span class=\"keyword\">val</span>");
        assertThat(formatter.renderText(PAGE, identifier("x"))).isEqualTo("<span class=\"identifier\">x</span>");
    }

    @Test
    void lists_wrapItems() {
        ContentNode content = list(listItem(text("one")), listItem(text("two")));

        assertThat(formatter.renderText(PAGE, content)).isEqualTo("<ul><li>one</li><li>two</li></ul>");
    }

    @Test
    void paragraph_rendersThroughParagraphHook() {
        assertThat(formatter.renderText(PAGE, paragraph(text("Hello"), strong(text("!")))))
            .isEqualTo("<p>Hello<strong>!</strong></p>\n");
    }

    @Test
    void blockCode_rendersThroughBlockCodeHook() {
        assertThat(formatter.renderText(PAGE, blockCode(text("if (a < b) {}"))))
            .isEqualTo("<pre><code>if (a &lt; b) {}</code></pre>");
    }

    @Test
    void nodeLink_resolvesTargetLocation() {
        DocumentationNode target = new DocumentationNode("Parser", NodeKind.CLASS, null);
        node("p", NodeKind.PACKAGE).addMember(target);

        assertThat(formatter.renderText(PAGE, link(target, text("the parser"))))
            .isEqualTo("<a href=\"p.Parser.html\">the parser</a>");
    }

    @Test
    void externalLink_keepsHrefVerbatimAndEscapesText() {
        ContentNode content = externalLink("https://example.com/?a=1&b=2", text("A & B"));

        assertThat(formatter.renderText(PAGE, content))
            .isEqualTo("<a href=\"https://example.com/?a=1&b=2\">A &amp; B</a>");
    }

    @Test
    void unrecognizedVariant_rendersChildrenOnly() {
        ContentNode custom = () -> List.of(text("a"), strong(text("b")));

        assertThat(formatter.renderText(PAGE, custom)).isEqualTo("a<strong>b</strong>");
    }

    @Test
    void sequence_concatenatesRenderedNodes() {
        assertThat(formatter.renderText(PAGE, List.of(text("a"), keyword("b"))))
            .isEqualTo("a<span class=\"keyword\">b</span>");
    }

    @Test
    void nullContent_throwsException() {
        assertThatThrownBy(() -> formatter.renderText(PAGE, (ContentNode) null))
            .isInstanceOf(NullPointerException.class);
    }
}
