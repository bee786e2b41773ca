package com.docformat.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Punctuation inside a rendered signature, such as parentheses or a colon.
 *
 * @param text literal text
 */
public record ContentSymbol(String text) implements ContentNode {

    /**
     * Compact constructor with validation.
     */
    public ContentSymbol {
        Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public List<ContentNode> children() {
        return List.of();
    }

    @Override
    public boolean isEmpty() {
        return text.isEmpty();
    }
}
