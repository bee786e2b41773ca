package com.docformat.cli.pipeline;

import java.util.Objects;

/**
 * A rendered documentation page.
 *
 * @param relativePath page path relative to the output directory (e.g., "com.example/index.html")
 * @param content page content
 */
public record GeneratedPage(
    String relativePath,
    String content
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedPage {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
