package com.docformat.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Identifier inside a rendered signature.
 *
 * @param text literal text
 */
public record ContentIdentifier(String text) implements ContentNode {

    /**
     * Compact constructor with validation.
     */
    public ContentIdentifier {
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
