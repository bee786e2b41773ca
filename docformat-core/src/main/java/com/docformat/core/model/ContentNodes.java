package com.docformat.core.model;

import java.util.List;

/**
 * Factory methods for building content trees.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ContentNode signature = ContentNodes.block(
 *     ContentNodes.keyword("fun"),
 *     ContentNodes.symbol(" "),
 *     ContentNodes.identifier("parse"),
 *     ContentNodes.symbol("()")
 * );
 * ContentNode summary = ContentNodes.paragraph(ContentNodes.text("Parses the input."));
 * }</pre>
 */
public final class ContentNodes {

    private ContentNodes() {
    }

    public static ContentText text(String text) {
        return new ContentText(text);
    }

    public static ContentSymbol symbol(String text) {
        return new ContentSymbol(text);
    }

    public static ContentKeyword keyword(String text) {
        return new ContentKeyword(text);
    }

    public static ContentIdentifier identifier(String text) {
        return new ContentIdentifier(text);
    }

    public static ContentStrong strong(ContentNode... children) {
        return new ContentStrong(List.of(children));
    }

    public static ContentCode code(ContentNode... children) {
        return new ContentCode(List.of(children));
    }

    public static ContentEmphasis emphasis(ContentNode... children) {
        return new ContentEmphasis(List.of(children));
    }

    public static ContentList list(ContentNode... items) {
        return new ContentList(List.of(items));
    }

    public static ContentListItem listItem(ContentNode... children) {
        return new ContentListItem(List.of(children));
    }

    public static ContentParagraph paragraph(ContentNode... children) {
        return new ContentParagraph(List.of(children));
    }

    public static ContentBlockCode blockCode(ContentNode... children) {
        return new ContentBlockCode(List.of(children));
    }

    public static ContentBlock block(ContentNode... children) {
        return new ContentBlock(List.of(children));
    }

    public static ContentNodeLink link(DocumentationNode target, ContentNode... children) {
        return new ContentNodeLink(target, List.of(children));
    }

    public static ContentExternalLink externalLink(String href, ContentNode... children) {
        return new ContentExternalLink(href, List.of(children));
    }

    /**
     * Creates an empty generic container.
     *
     * @return empty block
     */
    public static ContentBlock empty() {
        return new ContentBlock(List.of());
    }
}
