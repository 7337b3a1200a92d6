package org.tilecascade.runtime.match;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.tilecascade.runtime.Config;
import org.tilecascade.runtime.model.IGridReader;
import org.tilecascade.runtime.model.MatchData;
import org.tilecascade.runtime.model.MatchOrientation;
import org.tilecascade.runtime.model.Tile;
import org.tilecascade.runtime.model.TileType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects runs of three or more identical colored tiles and 2x2 squares of identical colored tiles.
 * <p>
 * Squares are detected first and take precedence: a tile consumed by a square never seeds or extends a
 * linear run, and squares never overlap each other. A tile that belongs to both a horizontal and a
 * vertical run yields two separate matches; merging is left to the blast resolver. Power-ups never
 * take part in a match.
 * <p>
 * The detector only reads the grid and keeps no state between calls.
 */
public class MatchDetector {
    private static final Logger LOG = LoggerFactory.getLogger(MatchDetector.class);

    private final IGridReader grid;

    public MatchDetector(IGridReader grid) {
        this.grid = Objects.requireNonNull(grid, "grid");
    }

    /**
     * Scans the whole board. Pivots are the bottom-left corner of a square and the middle tile of a run.
     * @return The detected matches, squares first, then runs in column-major scan order.
     */
    public List<MatchData> findAllMatches() {
        List<MatchData> matches = new ArrayList<>();
        Set<Tile> squareTiles = new HashSet<>();

        for (int x = 0; x < grid.getWidth() - 1; x++) {
            for (int y = 0; y < grid.getHeight() - 1; y++) {
                MatchData square = trySquareAt(x, y, x, y, squareTiles);
                if (square != null) {
                    matches.add(square);
                    squareTiles.addAll(square.getTiles());
                }
            }
        }

        Set<Tile> processedHorizontal = new HashSet<>();
        Set<Tile> processedVertical = new HashSet<>();
        for (int x = 0; x < grid.getWidth(); x++) {
            for (int y = 0; y < grid.getHeight(); y++) {
                Tile tile = grid.tileAt(x, y);
                if (!isMatchable(tile, squareTiles)) continue;

                if (!processedHorizontal.contains(tile)) {
                    List<Tile> run = collectRun(x, y, 1, 0, tile.getType(), squareTiles);
                    if (run.size() >= Config.MIN_MATCH_LENGTH) {
                        Tile pivot = run.get(run.size() / 2);
                        matches.add(new MatchData(run, MatchOrientation.HORIZONTAL, pivot.getX(), pivot.getY()));
                        processedHorizontal.addAll(run);
                    }
                }
                if (!processedVertical.contains(tile)) {
                    List<Tile> run = collectRun(x, y, 0, 1, tile.getType(), squareTiles);
                    if (run.size() >= Config.MIN_MATCH_LENGTH) {
                        Tile pivot = run.get(run.size() / 2);
                        matches.add(new MatchData(run, MatchOrientation.VERTICAL, pivot.getX(), pivot.getY()));
                        processedVertical.addAll(run);
                    }
                }
            }
        }

        if (!matches.isEmpty()) {
            LOG.debug("Full-board scan found {} match(es)", matches.size());
        }
        return matches;
    }

    /**
     * Scans only the squares and runs that contain one of the given seed cells, typically the two cells
     * of a swap. The pivot of every resulting match is the seed cell that produced it, so a spawned
     * power-up lands where the player moved a tile. Seeds outside the board are ignored.
     * @param positions Seed coordinates as {@code {x, y}} pairs, in priority order.
     * @return The detected matches, squares first.
     */
    public List<MatchData> findMatchesAt(int[]... positions) {
        List<MatchData> matches = new ArrayList<>();
        Set<Tile> squareTiles = new HashSet<>();
        Set<Long> checkedCorners = new HashSet<>();

        for (int[] seed : positions) {
            int px = seed[0];
            int py = seed[1];
            if (!grid.isValid(px, py)) continue;
            int[][] corners = {{px, py}, {px - 1, py}, {px, py - 1}, {px - 1, py - 1}};
            for (int[] corner : corners) {
                if (corner[0] < 0 || corner[1] < 0) continue;
                if (!checkedCorners.add(cornerKey(corner[0], corner[1]))) continue;
                MatchData square = trySquareAt(corner[0], corner[1], px, py, squareTiles);
                if (square != null) {
                    matches.add(square);
                    squareTiles.addAll(square.getTiles());
                }
            }
        }

        Set<Tile> processedHorizontal = new HashSet<>();
        Set<Tile> processedVertical = new HashSet<>();
        for (int[] seed : positions) {
            int px = seed[0];
            int py = seed[1];
            Tile tile = grid.tileAt(px, py);
            if (!isMatchable(tile, squareTiles)) continue;

            if (!processedHorizontal.contains(tile)) {
                List<Tile> run = collectRun(px, py, 1, 0, tile.getType(), squareTiles);
                if (run.size() >= Config.MIN_MATCH_LENGTH) {
                    matches.add(new MatchData(run, MatchOrientation.HORIZONTAL, px, py));
                    processedHorizontal.addAll(run);
                }
            }
            if (!processedVertical.contains(tile)) {
                List<Tile> run = collectRun(px, py, 0, 1, tile.getType(), squareTiles);
                if (run.size() >= Config.MIN_MATCH_LENGTH) {
                    matches.add(new MatchData(run, MatchOrientation.VERTICAL, px, py));
                    processedVertical.addAll(run);
                }
            }
        }

        LOG.debug("Seeded scan over {} position(s) found {} match(es)", positions.length, matches.size());
        return matches;
    }

    /**
     * Tests whether (x, y) is the bottom-left corner of a 2x2 block of one colored type whose tiles are
     * not yet consumed by another square.
     */
    private MatchData trySquareAt(int x, int y, int pivotX, int pivotY, Set<Tile> squareTiles) {
        if (x + Config.SQUARE_SIZE > grid.getWidth() || y + Config.SQUARE_SIZE > grid.getHeight()) {
            return null;
        }
        Tile first = grid.tileAt(x, y);
        if (first == null || !first.getType().isColored()) {
            return null;
        }
        List<Tile> tiles = new ArrayList<>(Config.SQUARE_SIZE * Config.SQUARE_SIZE);
        for (int dy = 0; dy < Config.SQUARE_SIZE; dy++) {
            for (int dx = 0; dx < Config.SQUARE_SIZE; dx++) {
                Tile tile = grid.tileAt(x + dx, y + dy);
                if (tile == null || tile.getType() != first.getType() || squareTiles.contains(tile)) {
                    return null;
                }
                tiles.add(tile);
            }
        }
        return new MatchData(tiles, MatchOrientation.SQUARE, pivotX, pivotY);
    }

    /**
     * Expands from (x, y) backwards then forwards along one axis while the type matches, stopping at
     * empty cells, other types and square-consumed tiles.
     * @return The run ordered from the low end to the high end of the axis.
     */
    private List<Tile> collectRun(int x, int y, int dx, int dy, TileType type, Set<Tile> squareTiles) {
        int startX = x;
        int startY = y;
        while (continuesRun(grid.tileAt(startX - dx, startY - dy), type, squareTiles)) {
            startX -= dx;
            startY -= dy;
        }
        List<Tile> run = new ArrayList<>();
        int cx = startX;
        int cy = startY;
        Tile tile = grid.tileAt(cx, cy);
        while (continuesRun(tile, type, squareTiles)) {
            run.add(tile);
            cx += dx;
            cy += dy;
            tile = grid.tileAt(cx, cy);
        }
        return run;
    }

    private static boolean continuesRun(Tile tile, TileType type, Set<Tile> squareTiles) {
        return tile != null && tile.getType() == type && !squareTiles.contains(tile);
    }

    private static boolean isMatchable(Tile tile, Set<Tile> squareTiles) {
        return tile != null && tile.getType().isColored() && !squareTiles.contains(tile);
    }

    private static long cornerKey(int x, int y) {
        return ((long) x << 32) | (y & 0xffffffffL);
    }
}
