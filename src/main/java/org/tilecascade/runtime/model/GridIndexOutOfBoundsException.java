package org.tilecascade.runtime.model;

/**
 * Thrown when a strict grid accessor is called with a coordinate outside the board.
 */
public class GridIndexOutOfBoundsException extends IndexOutOfBoundsException {

    private final int x;
    private final int y;

    public GridIndexOutOfBoundsException(int x, int y, int width, int height) {
        super("Coordinate (" + x + "," + y + ") is outside the " + width + "x" + height + " grid");
        this.x = x;
        this.y = y;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }
}
