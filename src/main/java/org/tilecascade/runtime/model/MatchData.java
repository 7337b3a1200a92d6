package org.tilecascade.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

import org.tilecascade.runtime.Config;

/**
 * Immutable result of one detected match: the matched tiles in scan order, the match shape and the
 * pivot cell that receives a spawned power-up.
 */
public final class MatchData {
    private final List<Tile> tiles;
    private final MatchOrientation orientation;
    private final int pivotX;
    private final int pivotY;

    /**
     * Creates a match. Duplicate tiles are collapsed, keeping the first occurrence.
     * @param tiles The matched tiles.
     * @param orientation The match shape.
     * @param pivotX The pivot column.
     * @param pivotY The pivot row.
     */
    public MatchData(List<Tile> tiles, MatchOrientation orientation, int pivotX, int pivotY) {
        Objects.requireNonNull(tiles, "tiles");
        this.tiles = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(tiles)));
        this.orientation = Objects.requireNonNull(orientation, "orientation");
        this.pivotX = pivotX;
        this.pivotY = pivotY;
    }

    public List<Tile> getTiles() {
        return tiles;
    }

    public int getCount() {
        return tiles.size();
    }

    public MatchOrientation getOrientation() {
        return orientation;
    }

    public int getPivotX() {
        return pivotX;
    }

    public int getPivotY() {
        return pivotY;
    }

    /**
     * @return true for a linear match long enough to spawn a rocket.
     */
    public boolean isPowerUpMatch() {
        return orientation != MatchOrientation.SQUARE && tiles.size() >= Config.POWER_UP_MATCH_LENGTH;
    }

    /**
     * @return true for a square match, which spawns a snitch.
     */
    public boolean isSnitchMatch() {
        return orientation == MatchOrientation.SQUARE;
    }

    public boolean contains(Tile tile) {
        return tiles.contains(tile);
    }

    @Override
    public String toString() {
        return "MatchData[" + orientation + " x" + tiles.size() + " pivot=" + pivotX + "," + pivotY + "]";
    }
}
