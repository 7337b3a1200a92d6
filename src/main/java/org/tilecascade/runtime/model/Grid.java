package org.tilecascade.runtime.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.tilecascade.runtime.spi.IRandomProvider;

/**
 * Represents the board, managing the rectangular array of tiles and the tile/slot bijection.
 * <p>
 * Every mutation keeps a tile's stored coordinate equal to the slot that references it, and no tile
 * is referenced by more than one slot. Row 0 is the low edge tiles fall toward.
 */
public class Grid implements IGridReader {
    private final int width;
    private final int height;
    private final Tile[] cells;
    private long nextTileId = 1L;

    /**
     * Creates an empty grid.
     * @param width The number of columns, at least 1.
     * @param height The number of rows, at least 1.
     */
    public Grid(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.cells = new Tile[width * height];
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public boolean isValid(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    private int index(int x, int y) {
        return y * width + x;
    }

    private void checkBounds(int x, int y) {
        if (!isValid(x, y)) {
            throw new GridIndexOutOfBoundsException(x, y, width, height);
        }
    }

    @Override
    public Tile get(int x, int y) {
        checkBounds(x, y);
        return cells[index(x, y)];
    }

    @Override
    public Tile tileAt(int x, int y) {
        if (!isValid(x, y)) {
            return null;
        }
        return cells[index(x, y)];
    }

    public boolean isEmpty(int x, int y) {
        return tileAt(x, y) == null;
    }

    /**
     * Checks whether a tile is currently referenced by its recorded slot.
     * @param tile The tile to check.
     * @return true if the tile is live on this grid.
     */
    public boolean contains(Tile tile) {
        return tile != null && tileAt(tile.getX(), tile.getY()) == tile;
    }

    /**
     * Creates a new tile of the given type in an empty cell.
     * @param x The column.
     * @param y The row.
     * @param type The tile type.
     * @return The created tile.
     * @throws IllegalStateException if the cell is occupied.
     */
    public Tile spawn(int x, int y, TileType type) {
        Objects.requireNonNull(type, "type");
        checkBounds(x, y);
        if (cells[index(x, y)] != null) {
            throw new IllegalStateException("Cannot spawn into occupied cell (" + x + "," + y + ")");
        }
        Tile tile = new Tile(nextTileId++, type, x, y);
        cells[index(x, y)] = tile;
        return tile;
    }

    /**
     * Places a tile into a cell. If the tile is live elsewhere on the grid its old slot is cleared; a
     * different tile occupying the target cell is detached.
     * @param x The column.
     * @param y The row.
     * @param tile The tile to place.
     * @return The detached previous occupant, or null.
     */
    public Tile set(int x, int y, Tile tile) {
        Objects.requireNonNull(tile, "tile");
        checkBounds(x, y);
        Tile previous = cells[index(x, y)];
        if (previous == tile) {
            return null;
        }
        if (contains(tile)) {
            cells[index(tile.getX(), tile.getY())] = null;
        }
        cells[index(x, y)] = tile;
        tile.setPosition(x, y);
        return previous;
    }

    /**
     * Empties a cell.
     * @param x The column.
     * @param y The row.
     * @return The detached tile, or null if the cell was empty.
     */
    public Tile clear(int x, int y) {
        checkBounds(x, y);
        Tile previous = cells[index(x, y)];
        cells[index(x, y)] = null;
        return previous;
    }

    /**
     * Removes a tile from its recorded slot. Stale references are ignored.
     * @param tile The tile to remove.
     * @return true if the tile was live and has been removed.
     */
    public boolean remove(Tile tile) {
        if (!contains(tile)) {
            return false;
        }
        cells[index(tile.getX(), tile.getY())] = null;
        return true;
    }

    /**
     * Moves a tile down its column into an empty cell.
     * @param tile The tile to move.
     * @param toY The target row.
     */
    public void moveTo(Tile tile, int toY) {
        if (!contains(tile)) {
            throw new IllegalStateException("Tile is not on the grid: " + tile);
        }
        checkBounds(tile.getX(), toY);
        if (cells[index(tile.getX(), toY)] != null) {
            throw new IllegalStateException("Target cell (" + tile.getX() + "," + toY + ") is occupied");
        }
        cells[index(tile.getX(), tile.getY())] = null;
        cells[index(tile.getX(), toY)] = tile;
        tile.setPosition(tile.getX(), toY);
    }

    /**
     * Exchanges two live tiles, slots and stored coordinates in one step.
     * @param a The first tile.
     * @param b The second tile.
     */
    public void swap(Tile a, Tile b) {
        if (!contains(a) || !contains(b)) {
            throw new IllegalStateException("Both tiles must be on the grid to swap: " + a + ", " + b);
        }
        int ax = a.getX();
        int ay = a.getY();
        int bx = b.getX();
        int by = b.getY();
        cells[index(ax, ay)] = b;
        cells[index(bx, by)] = a;
        a.setPosition(bx, by);
        b.setPosition(ax, ay);
    }

    /**
     * @return true iff the tiles are orthogonal neighbours (Manhattan distance exactly 1).
     */
    public boolean areAdjacent(Tile a, Tile b) {
        if (a == null || b == null) {
            return false;
        }
        return Math.abs(a.getX() - b.getX()) + Math.abs(a.getY() - b.getY()) == 1;
    }

    public int countEmptyInColumn(int x) {
        checkBounds(x, 0);
        int empty = 0;
        for (int y = 0; y < height; y++) {
            if (cells[index(x, y)] == null) {
                empty++;
            }
        }
        return empty;
    }

    /**
     * Returns all live tiles, column by column from the low edge up.
     * @return A new list of tiles.
     */
    public List<Tile> tiles() {
        List<Tile> result = new ArrayList<>();
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                Tile tile = cells[index(x, y)];
                if (tile != null) {
                    result.add(tile);
                }
            }
        }
        return result;
    }

    /**
     * Fills every empty cell with a uniformly random type from the given list.
     * @param types The candidate types.
     * @param random The source of randomness.
     */
    public void fillRandom(List<TileType> types, IRandomProvider random) {
        if (types == null || types.isEmpty()) {
            throw new IllegalArgumentException("At least one tile type is required to fill the grid.");
        }
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                if (cells[index(x, y)] == null) {
                    spawn(x, y, types.get(random.nextInt(types.size())));
                }
            }
        }
    }
}
