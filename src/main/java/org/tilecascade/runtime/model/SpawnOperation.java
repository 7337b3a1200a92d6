package org.tilecascade.runtime.model;

/**
 * One empty cell to be refilled.
 * @param x The column.
 * @param y The row.
 * @param spawnRank The order within the column, 0 being the lowest cell to fill.
 */
public record SpawnOperation(int x, int y, int spawnRank) {
}
