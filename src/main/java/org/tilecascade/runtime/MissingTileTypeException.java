package org.tilecascade.runtime;

import org.tilecascade.runtime.model.TileType;

/**
 * Raised when a tile is about to be spawned whose type the host's tile catalog does not support.
 * The engine skips that spawn and reports the exception to the listener instead of throwing it.
 */
public class MissingTileTypeException extends RuntimeException {

    private final TileType type;
    private final int x;
    private final int y;

    public MissingTileTypeException(TileType type, int x, int y) {
        super("No tile registered for type " + type + "; spawn at (" + x + "," + y + ") skipped");
        this.type = type;
        this.x = x;
        this.y = y;
    }

    public TileType getType() {
        return type;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }
}
