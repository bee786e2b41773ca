package com.docformat.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Plain text leaf.
 *
 * @param text literal text
 */
public record ContentText(String text) implements ContentNode {

    /**
     * Compact constructor with validation.
     */
    public ContentText {
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
