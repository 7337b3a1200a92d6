package org.tilecascade.runtime.model;

/**
 * A single occupant of one grid cell. Tiles are created by the {@link Grid} and compare by identity.
 * <p>
 * The stored coordinate is owned by the grid: it is only changed through grid mutations so that it
 * always equals the slot referencing the tile. The {@code moving} flag is raised while an external
 * animation of this tile is in flight; no structural operation may touch the tile until it clears.
 */
public final class Tile {
    private final long id;
    private final TileType type;
    private int x;
    private int y;
    private boolean moving;

    Tile(long id, TileType type, int x, int y) {
        this.id = id;
        this.type = type;
        this.x = x;
        this.y = y;
    }

    public long getId() {
        return id;
    }

    public TileType getType() {
        return type;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public boolean isMoving() {
        return moving;
    }

    /**
     * Raises or clears the in-flight animation flag.
     * @param moving true while an animation of this tile runs.
     */
    public void setMoving(boolean moving) {
        this.moving = moving;
    }

    void setPosition(int x, int y) {
        this.x = x;
        this.y = y;
    }

    @Override
    public String toString() {
        return "Tile#" + id + "[" + type + " @" + x + "," + y + "]";
    }
}
