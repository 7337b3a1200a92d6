package org.tilecascade.runtime.blast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.tilecascade.runtime.Config;
import org.tilecascade.runtime.model.IGridReader;
import org.tilecascade.runtime.model.Tile;
import org.tilecascade.runtime.spi.IRandomProvider;

/**
 * Computes the blast path of an activated power-up from the current grid state, keyed on the tile type.
 * <ul>
 *   <li>Horizontal rocket: every occupied cell of its row.</li>
 *   <li>Vertical rocket: every occupied cell of its column.</li>
 *   <li>Snitch: its own cell, the four orthogonal neighbours and one random extra occupied cell
 *       (two for the lucky variant).</li>
 * </ul>
 */
public class BlastPathCalculator {

    private final IRandomProvider random;

    /**
     * @param random Source for the snitch's random extra cells.
     */
    public BlastPathCalculator(IRandomProvider random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Computes the tiles hit by a power-up. The power-up itself is part of its path.
     * @param grid The grid to read.
     * @param powerUp The activated power-up.
     * @param excluded Tiles a snitch must not pick as random extra cells, such as tiles already
     *                 destroyed in the current blast episode.
     * @return The tiles in the path, in a stable order.
     * @throws IllegalArgumentException if the tile is not a power-up.
     */
    public List<Tile> computePath(IGridReader grid, Tile powerUp, Set<Tile> excluded) {
        return switch (powerUp.getType()) {
            case ROCKET_HORIZONTAL -> collectLine(grid, 0, powerUp.getY(), 1, 0);
            case ROCKET_VERTICAL -> collectLine(grid, powerUp.getX(), 0, 0, 1);
            case SNITCH -> collectSnitchPath(grid, powerUp, excluded, Config.SNITCH_RANDOM_CELLS);
            case SNITCH_LUCKY -> collectSnitchPath(grid, powerUp, excluded, Config.LUCKY_SNITCH_RANDOM_CELLS);
            default -> throw new IllegalArgumentException("Tile is not a power-up: " + powerUp);
        };
    }

    private List<Tile> collectLine(IGridReader grid, int startX, int startY, int dx, int dy) {
        List<Tile> tiles = new ArrayList<>();
        for (int x = startX, y = startY; grid.isValid(x, y); x += dx, y += dy) {
            Tile tile = grid.tileAt(x, y);
            if (tile != null) {
                tiles.add(tile);
            }
        }
        return tiles;
    }

    private List<Tile> collectSnitchPath(IGridReader grid, Tile snitch, Set<Tile> excluded, int randomCells) {
        List<Tile> tiles = new ArrayList<>();
        Set<Tile> selected = new HashSet<>();
        tiles.add(snitch);
        selected.add(snitch);

        int[][] offsets = {{0, 1}, {0, -1}, {-1, 0}, {1, 0}};
        for (int[] offset : offsets) {
            Tile neighbour = grid.tileAt(snitch.getX() + offset[0], snitch.getY() + offset[1]);
            if (neighbour != null && selected.add(neighbour)) {
                tiles.add(neighbour);
            }
        }

        Set<Tile> skip = excluded != null ? excluded : Collections.emptySet();
        List<Tile> available = new ArrayList<>();
        for (int x = 0; x < grid.getWidth(); x++) {
            for (int y = 0; y < grid.getHeight(); y++) {
                Tile tile = grid.tileAt(x, y);
                if (tile != null && !selected.contains(tile) && !skip.contains(tile)) {
                    available.add(tile);
                }
            }
        }
        for (int i = 0; i < randomCells && !available.isEmpty(); i++) {
            Tile pick = available.remove(random.nextInt(available.size()));
            tiles.add(pick);
        }
        return tiles;
    }
}
