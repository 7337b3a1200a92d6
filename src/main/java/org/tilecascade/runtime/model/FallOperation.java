package org.tilecascade.runtime.model;

/**
 * One tile falling within its column.
 * @param tile The falling tile.
 * @param x The column.
 * @param fromY The row the tile left.
 * @param toY The row the tile landed on, always below {@code fromY}.
 */
public record FallOperation(Tile tile, int x, int fromY, int toY) {

    public FallOperation {
        if (toY >= fromY) {
            throw new IllegalArgumentException("A fall must move downward: " + fromY + " -> " + toY);
        }
    }

    public int fallDistance() {
        return fromY - toY;
    }
}
