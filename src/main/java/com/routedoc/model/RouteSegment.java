package com.routedoc.model;

/**
 * One piece of a parsed route template. A template such as {@code /items/<int:item_id>/tags}
 * is split into an ordered sequence of static text and dynamic placeholders; the order defines
 * how the normalized path is assembled.
 */
public interface RouteSegment {

    /**
     * Literal text copied verbatim into the normalized path.
     *
     * @param text The static text, never empty.
     */
    record Static(String text) implements RouteSegment {
    }

    /**
     * A placeholder such as {@code <int(min=1):item_id>}.
     *
     * @param converter The converter tag, {@code "default"} when the placeholder names none.
     * @param arguments The raw text between the converter's parentheses, or {@code null}.
     * @param variable  The parameter name.
     */
    record Dynamic(String converter, String arguments, String variable) implements RouteSegment {
    }
}
