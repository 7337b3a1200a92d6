package org.tilecascade.runtime.blast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.tilecascade.runtime.Config;
import org.tilecascade.runtime.MissingTileTypeException;
import org.tilecascade.runtime.model.Grid;
import org.tilecascade.runtime.model.MatchData;
import org.tilecascade.runtime.model.MatchOrientation;
import org.tilecascade.runtime.model.Tile;
import org.tilecascade.runtime.model.TileType;
import org.tilecascade.runtime.spi.IGameEventListener;
import org.tilecascade.runtime.spi.IRandomProvider;
import org.tilecascade.runtime.spi.ITileCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands matches and power-up activations into the full set of tiles to destroy and power-ups to spawn.
 * <p>
 * Work is processed through a FIFO queue of units instead of recursion. Each unit is either a match or
 * the activation of one power-up. A destroyed power-up that did not originate its unit is activated in
 * turn: its path is captured against the grid before the current batch is removed and enqueued as a new
 * unit. A per-episode processed set guarantees that no tile is destroyed twice, which also terminates
 * chains that reference each other. Spawns are applied once the queue has drained; a cell nominated by
 * several matches receives a single power-up.
 */
public class BlastResolver {
    private static final Logger LOG = LoggerFactory.getLogger(BlastResolver.class);

    private final Grid grid;
    private final BlastPathCalculator pathCalculator;
    private final ITileCatalog tileCatalog;
    private final IRandomProvider random;
    private final IGameEventListener listener;

    /**
     * @param grid The grid to mutate.
     * @param pathCalculator Computes power-up blast paths.
     * @param tileCatalog Decides which power-up types may be spawned.
     * @param random Source for the lucky/regular snitch draw.
     * @param listener Receives activation, removal and spawn events.
     */
    public BlastResolver(Grid grid, BlastPathCalculator pathCalculator, ITileCatalog tileCatalog,
                         IRandomProvider random, IGameEventListener listener) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.pathCalculator = Objects.requireNonNull(pathCalculator, "pathCalculator");
        this.tileCatalog = Objects.requireNonNull(tileCatalog, "tileCatalog");
        this.random = Objects.requireNonNull(random, "random");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Runs one blast episode to completion.
     * @param matches Detected matches to blast, possibly sharing tiles.
     * @param activations Power-ups activated directly, e.g. by a click.
     * @return The removed tiles and spawned power-ups.
     */
    public BlastResult resolve(List<MatchData> matches, List<Tile> activations) {
        Deque<BlastUnit> queue = new ArrayDeque<>();
        Set<Tile> processed = new HashSet<>();
        Map<Long, PendingSpawn> spawns = new LinkedHashMap<>();
        List<Tile> removed = new ArrayList<>();
        List<List<Tile>> waves = new ArrayList<>();
        int activationCount = 0;

        for (MatchData match : matches) {
            queue.add(new BlastUnit(match.getTiles(), match, null));
        }
        for (Tile powerUp : activations) {
            if (!grid.contains(powerUp) || !powerUp.getType().isPowerUp()) {
                LOG.debug("Ignoring activation of {}: not a live power-up", powerUp);
                continue;
            }
            queue.add(activate(powerUp, processed));
            activationCount++;
        }

        while (!queue.isEmpty()) {
            BlastUnit unit = queue.poll();
            Tile kept = null;
            if (unit.match() != null) {
                kept = nominateSpawn(unit.match(), spawns);
            }

            List<Tile> candidates = new ArrayList<>();
            for (Tile tile : unit.tiles()) {
                if (tile == kept || processed.contains(tile)) continue;
                processed.add(tile);
                candidates.add(tile);
            }

            for (Tile tile : candidates) {
                if (tile.getType().isPowerUp() && tile != unit.origin() && grid.contains(tile)) {
                    queue.add(activate(tile, processed));
                    activationCount++;
                }
            }

            List<Tile> wave = new ArrayList<>();
            for (Tile tile : candidates) {
                if (grid.remove(tile)) {
                    wave.add(tile);
                }
            }
            if (!wave.isEmpty()) {
                removed.addAll(wave);
                waves.add(Collections.unmodifiableList(wave));
                listener.onItemsBlasted(Collections.unmodifiableList(wave));
            }
        }

        List<Tile> spawned = applySpawns(spawns, removed);
        LOG.debug("Blast episode removed {} tile(s), activated {} power-up(s), spawned {} power-up(s)",
                removed.size(), activationCount, spawned.size());
        return new BlastResult(Collections.unmodifiableList(removed), Collections.unmodifiableList(waves),
                Collections.unmodifiableList(spawned), activationCount);
    }

    private BlastUnit activate(Tile powerUp, Set<Tile> processed) {
        List<Tile> path = pathCalculator.computePath(grid, powerUp, processed);
        LOG.debug("Activating {} with a path of {} tile(s)", powerUp, path.size());
        listener.onPowerUpActivated(powerUp, Collections.unmodifiableList(path));
        return new BlastUnit(path, null, powerUp);
    }

    /**
     * Registers the power-up a match earns at its pivot.
     * @return The pivot tile spared from destruction because it is replaced at spawn time, or null.
     */
    private Tile nominateSpawn(MatchData match, Map<Long, PendingSpawn> spawns) {
        if (!match.isSnitchMatch() && !match.isPowerUpMatch()) {
            return null;
        }
        long key = cellKey(match.getPivotX(), match.getPivotY());
        if (match.isSnitchMatch()) {
            spawns.putIfAbsent(key, new PendingSpawn(match.getPivotX(), match.getPivotY(), null));
            return null;
        }
        TileType rocket = match.getOrientation() == MatchOrientation.HORIZONTAL
                ? TileType.ROCKET_HORIZONTAL
                : TileType.ROCKET_VERTICAL;
        spawns.putIfAbsent(key, new PendingSpawn(match.getPivotX(), match.getPivotY(), rocket));
        Tile pivotTile = grid.tileAt(match.getPivotX(), match.getPivotY());
        return match.contains(pivotTile) ? pivotTile : null;
    }

    private List<Tile> applySpawns(Map<Long, PendingSpawn> spawns, List<Tile> removed) {
        List<Tile> spawned = new ArrayList<>();
        for (PendingSpawn spawn : spawns.values()) {
            TileType type = spawn.type();
            if (type == null) {
                type = random.nextDouble() < Config.LUCKY_SNITCH_PROBABILITY ? TileType.SNITCH_LUCKY : TileType.SNITCH;
            }
            if (!tileCatalog.supports(type)) {
                MissingTileTypeException error = new MissingTileTypeException(type, spawn.x(), spawn.y());
                LOG.error(error.getMessage());
                listener.onError(error);
                continue;
            }
            Tile replaced = grid.tileAt(spawn.x(), spawn.y());
            if (replaced != null) {
                grid.remove(replaced);
                removed.add(replaced);
            }
            Tile powerUp = grid.spawn(spawn.x(), spawn.y(), type);
            spawned.add(powerUp);
            listener.onPowerUpSpawned(powerUp, replaced);
        }
        return spawned;
    }

    private static long cellKey(int x, int y) {
        return ((long) x << 32) | (y & 0xffffffffL);
    }

    /**
     * One entry of the work queue.
     * @param tiles The tiles the unit hits.
     * @param match The match behind the unit, or null for an activation.
     * @param origin The activated power-up, or null for a match.
     */
    private record BlastUnit(List<Tile> tiles, MatchData match, Tile origin) {
    }

    /**
     * A nominated power-up spawn; a null type stands for a snitch whose variant is drawn at spawn time.
     */
    private record PendingSpawn(int x, int y, TileType type) {
    }
}
