package org.tilecascade.runtime.model;

/**
 * Read-only view of the board used by the pure resolvers.
 */
public interface IGridReader {

    int getWidth();

    int getHeight();

    /**
     * Checks whether a coordinate lies inside the board.
     * @param x The column.
     * @param y The row, 0 being the lowest.
     * @return true if the coordinate is inside, never throws.
     */
    boolean isValid(int x, int y);

    /**
     * Returns the tile at a coordinate, failing on invalid coordinates.
     * @param x The column.
     * @param y The row.
     * @return The tile, or null if the cell is empty.
     * @throws GridIndexOutOfBoundsException if the coordinate is outside the board.
     */
    Tile get(int x, int y);

    /**
     * Returns the tile at a coordinate, treating cells outside the board as empty.
     * @param x The column.
     * @param y The row.
     * @return The tile, or null if the cell is empty or outside the board.
     */
    Tile tileAt(int x, int y);
}
