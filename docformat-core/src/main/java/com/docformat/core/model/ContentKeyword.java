package com.docformat.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Language keyword inside a rendered signature.
 *
 * @param text literal text
 */
public record ContentKeyword(String text) implements ContentNode {

    /**
     * Compact constructor with validation.
     */
    public ContentKeyword {
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
