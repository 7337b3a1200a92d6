package org.tilecascade.runtime.gravity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import org.tilecascade.runtime.model.FallOperation;
import org.tilecascade.runtime.model.Grid;
import org.tilecascade.runtime.model.Tile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compacts every column toward row 0, preserving the vertical order of the tiles.
 * <p>
 * Each column is scanned from the low edge upward with a running count of empty cells. A tile found
 * above empty cells falls by that count. Every fall is applied to the grid as soon as it is computed.
 */
public class GravityResolver {
    private static final Logger LOG = LoggerFactory.getLogger(GravityResolver.class);

    /**
     * Applies gravity to all columns.
     * @param grid The grid to compact.
     * @return The applied falls.
     */
    public GravityResult apply(Grid grid) {
        List<FallOperation> falls = new ArrayList<>();
        for (int x = 0; x < grid.getWidth(); x++) {
            int emptyCount = 0;
            for (int y = 0; y < grid.getHeight(); y++) {
                Tile tile = grid.tileAt(x, y);
                if (tile == null) {
                    emptyCount++;
                } else if (emptyCount > 0) {
                    FallOperation fall = new FallOperation(tile, x, y, y - emptyCount);
                    grid.moveTo(tile, fall.toY());
                    falls.add(fall);
                }
            }
        }

        SortedMap<Integer, List<FallOperation>> bySourceRow = new TreeMap<>();
        for (FallOperation fall : falls) {
            bySourceRow.computeIfAbsent(fall.fromY(), k -> new ArrayList<>()).add(fall);
        }
        if (!falls.isEmpty()) {
            LOG.debug("Gravity moved {} tile(s) from {} source row(s)", falls.size(), bySourceRow.size());
        }
        return new GravityResult(Collections.unmodifiableList(falls), Collections.unmodifiableSortedMap(bySourceRow));
    }
}
