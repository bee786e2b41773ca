package com.docformat.core.format;

import com.docformat.core.location.Location;

import java.util.Objects;

/**
 * A renderable cross-reference: display text plus resolved destination.
 *
 * <p>Compared by value, so two members resolving to the same text and location are
 * treated as the same link.
 *
 * @param text unformatted display text
 * @param location resolved destination
 */
public record FormatLink(String text, Location location) {

    /**
     * Compact constructor with validation.
     */
    public FormatLink {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(location, "location must not be null");
    }
}
