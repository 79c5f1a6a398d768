package com.luanvv.clearance.dom;

import java.util.Optional;

/**
 * Read-only view of one element of the rendered page.
 */
public interface DomNode {

    /** First descendant matching {@code selector}, if any. */
    Optional<DomNode> query(String selector);

    /** Attribute value, or {@code null} when the attribute is not set. */
    String attribute(String name);

    /** Text content of the element and its descendants, never {@code null}. */
    String text();

    /** Releases this element and every node obtained through {@link #query}. */
    default void dispose() {
    }
}
