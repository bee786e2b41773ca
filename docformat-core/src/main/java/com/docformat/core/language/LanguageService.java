package com.docformat.core.language;

import com.docformat.core.model.ContentNode;
import com.docformat.core.model.DocumentationNode;

/**
 * Renders the declaration of a documentation node in the syntax of its source language.
 *
 * <p>The returned content tree is normally built from {@code ContentKeyword},
 * {@code ContentIdentifier} and {@code ContentSymbol} leaves, possibly with
 * {@code ContentNodeLink}s to referenced types.
 */
@FunctionalInterface
public interface LanguageService {

    /**
     * Renders the signature of a node.
     *
     * @param node node to render
     * @return signature content
     */
    ContentNode render(DocumentationNode node);
}
