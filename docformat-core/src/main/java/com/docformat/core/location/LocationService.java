package com.docformat.core.location;

import com.docformat.core.model.DocumentationNode;

/**
 * Resolves where the page of a documentation node lives and how to link to it.
 *
 * <p>Implementations own the page-naming strategy of a pipeline (one folder per package,
 * a single page, an external site, ...). They must be deterministic: the same
 * {@code (from, to, extension)} triple always yields an equal {@link Location}, since
 * formatters group table rows by resolved link.
 *
 * <p>Failures are not recovered by formatters; an exception thrown here aborts the current
 * render call.
 */
public interface LocationService {

    /**
     * Returns the location of the page documenting a node.
     *
     * @param node documented node
     * @param extension file extension of the output format, without leading dot
     * @return page location
     */
    Location location(DocumentationNode node, String extension);

    /**
     * Returns the location of a node's page as seen from another location.
     *
     * @param from location the link appears on
     * @param to link target
     * @param extension file extension of the output format
     * @return location suitable for a link on {@code from}
     */
    Location relativeLocation(Location from, DocumentationNode to, String extension);

    /**
     * Returns the location of a node's page as seen from another node's page.
     *
     * @param from node whose page the link appears on
     * @param to link target
     * @param extension file extension of the output format
     * @return location suitable for a link on the page of {@code from}
     */
    default Location relativeLocation(DocumentationNode from, DocumentationNode to, String extension) {
        return relativeLocation(location(from, extension), to, extension);
    }
}
