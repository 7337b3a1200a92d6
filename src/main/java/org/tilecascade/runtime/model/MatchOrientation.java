package org.tilecascade.runtime.model;

/**
 * Shape of a detected match. {@link #SQUARE} marks a 2x2 block and is never linear.
 */
public enum MatchOrientation {
    HORIZONTAL,
    VERTICAL,
    SQUARE
}
