package com.docformat.core.format;

import com.docformat.core.location.Location;
import com.docformat.core.model.DocumentationNode;

import java.util.List;

/**
 * Renders documentation nodes into one output format.
 *
 * <p>A format service appends to a caller-supplied buffer. Each top-level call should use
 * its own buffer; if a call fails, the partially written buffer should be discarded.
 *
 * @see StructuredFormatter
 */
public interface FormatService {

    /**
     * Returns the file extension of pages produced by this format.
     *
     * @return extension without leading dot (e.g., "html")
     */
    String extension();

    /**
     * Renders the documentation page of the given nodes.
     *
     * @param location location of the page being rendered
     * @param to output buffer
     * @param nodes nodes documented on the page
     */
    void renderTree(Location location, StringBuilder to, List<DocumentationNode> nodes);

    /**
     * Renders an outline (table of contents) entry for the given nodes.
     *
     * @param location location of the outline page
     * @param to output buffer
     * @param nodes nodes to list
     */
    void renderOutline(Location location, StringBuilder to, List<DocumentationNode> nodes);
}
