package com.routedoc.model;

import java.util.Locale;

/**
 * Decides which routes are represented in the generated document, based on the scheme marker
 * of their handler metadata.
 */
public enum InclusionMode {

    /**
     * Include everything except handlers attached by a different scheme. Handlers without any
     * marker are included.
     */
    NORMAL,

    /**
     * Include every route regardless of its marker.
     */
    GREEDY,

    /**
     * Include only handlers attached by route-doc itself.
     */
    STRICT;

    /**
     * @param scheme     The handler's scheme marker, or {@code null}.
     * @param ownScheme  The marker route-doc attaches.
     * @return {@code true} if a handler with this marker is left out of the document.
     */
    public boolean bypasses(String scheme, String ownScheme) {
        switch (this) {
            case GREEDY:
                return false;
            case STRICT:
                return !ownScheme.equals(scheme);
            default:
                return scheme != null && !scheme.equals(ownScheme);
        }
    }

    public static InclusionMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown inclusion mode '" + value + "'. Expected one of normal, greedy, strict.", e);
        }
    }
}
