package com.docformat.core.location;

import java.util.Objects;

/**
 * Destination of a link, as produced by a {@link LocationService}.
 *
 * @param path link target, relative to the page the link appears on or absolute
 */
public record Location(String path) {

    /**
     * Compact constructor with validation.
     */
    public Location {
        Objects.requireNonNull(path, "path must not be null");
    }
}
