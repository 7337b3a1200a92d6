package org.tilecascade.runtime.blast;

import java.util.List;

import org.tilecascade.runtime.model.Tile;

/**
 * Outcome of one blast episode.
 * @param removedTiles Every tile removed from the grid, in removal order and without duplicates. Tiles
 *                     replaced by a spawned power-up are included.
 * @param waves The removal batches, one per processed unit that removed anything.
 * @param spawnedPowerUps The power-ups placed after the queue drained.
 * @param activations The number of power-up activations, clicked and chained.
 */
public record BlastResult(List<Tile> removedTiles, List<List<Tile>> waves, List<Tile> spawnedPowerUps, int activations) {

    public boolean isEmpty() {
        return removedTiles.isEmpty() && spawnedPowerUps.isEmpty();
    }
}
