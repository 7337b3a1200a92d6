package org.tilecascade.runtime.model;

/**
 * The phase the cascade state machine is in. Only {@link #IDLE} accepts external commands.
 */
public enum GameState {
    /** Ready for player input. */
    IDLE,
    /** Two tiles are being exchanged. */
    SWAPPING,
    /** Matched tiles and activated power-ups are being destroyed. */
    BLASTING,
    /** Tiles are falling into emptied cells. */
    GRAVITY,
    /** New tiles are being spawned into the remaining empty cells. */
    REFILLING,
    /** The settled board is checked for follow-up matches. */
    CASCADING
}
