package org.tilecascade.runtime.gravity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.tilecascade.runtime.MissingTileTypeException;
import org.tilecascade.runtime.model.Grid;
import org.tilecascade.runtime.model.IGridReader;
import org.tilecascade.runtime.model.SpawnOperation;
import org.tilecascade.runtime.model.Tile;
import org.tilecascade.runtime.model.TileType;
import org.tilecascade.runtime.spi.IGameEventListener;
import org.tilecascade.runtime.spi.IRandomProvider;
import org.tilecascade.runtime.spi.ITileCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backfills the cells left empty after gravity with uniformly random colored tiles.
 * Power-ups are never produced here.
 */
public class RefillResolver {
    private static final Logger LOG = LoggerFactory.getLogger(RefillResolver.class);

    private final List<TileType> coloredTypes;
    private final IRandomProvider random;
    private final ITileCatalog tileCatalog;
    private final IGameEventListener listener;

    /**
     * @param coloredTypes The configured colored types to draw from.
     * @param random Source for the type draws.
     * @param tileCatalog Decides which types may be spawned.
     * @param listener Receives errors for skipped spawns.
     * @throws IllegalArgumentException if the list is empty or holds a power-up type.
     */
    public RefillResolver(List<TileType> coloredTypes, IRandomProvider random, ITileCatalog tileCatalog,
                          IGameEventListener listener) {
        if (coloredTypes == null || coloredTypes.isEmpty()) {
            throw new IllegalArgumentException("At least one colored type is required for refills.");
        }
        for (TileType type : coloredTypes) {
            if (!type.isColored()) {
                throw new IllegalArgumentException("Refill types must be colored, got " + type);
            }
        }
        this.coloredTypes = List.copyOf(coloredTypes);
        this.random = Objects.requireNonNull(random, "random");
        this.tileCatalog = Objects.requireNonNull(tileCatalog, "tileCatalog");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Computes the spawn operations for the current grid without changing it. Empty cells of each
     * column are ranked from the low edge upward.
     * @param grid The grid to read.
     * @return The spawn operations, column by column.
     */
    public List<SpawnOperation> computeSpawns(IGridReader grid) {
        List<SpawnOperation> spawns = new ArrayList<>();
        for (int x = 0; x < grid.getWidth(); x++) {
            int spawnRank = 0;
            for (int y = 0; y < grid.getHeight(); y++) {
                if (grid.tileAt(x, y) == null) {
                    spawns.add(new SpawnOperation(x, y, spawnRank++));
                }
            }
        }
        return spawns;
    }

    /**
     * Fills every empty cell.
     * @param grid The grid to fill.
     * @return The placements made; cells whose drawn type is unsupported stay empty.
     */
    public List<Placement> refill(Grid grid) {
        List<Placement> placements = new ArrayList<>();
        for (SpawnOperation spawn : computeSpawns(grid)) {
            TileType type = coloredTypes.get(random.nextInt(coloredTypes.size()));
            if (!tileCatalog.supports(type)) {
                MissingTileTypeException error = new MissingTileTypeException(type, spawn.x(), spawn.y());
                LOG.error(error.getMessage());
                listener.onError(error);
                continue;
            }
            placements.add(new Placement(spawn, grid.spawn(spawn.x(), spawn.y(), type)));
        }
        if (!placements.isEmpty()) {
            LOG.debug("Refill spawned {} tile(s)", placements.size());
        }
        return Collections.unmodifiableList(placements);
    }

    /**
     * A spawned tile together with the operation that placed it.
     * @param operation The spawn operation.
     * @param tile The new tile.
     */
    public record Placement(SpawnOperation operation, Tile tile) {
    }
}
