package org.tilecascade.runtime.model;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The closed set of tile kinds. Colored kinds are matchable; the remaining kinds are power-ups
 * whose blast behaviour is keyed on this tag.
 */
public enum TileType {
    CUBE_RED('R'),
    CUBE_YELLOW('Y'),
    CUBE_GREEN('G'),
    CUBE_BLUE('B'),
    ROCKET_HORIZONTAL('H'),
    ROCKET_VERTICAL('V'),
    SNITCH('S'),
    SNITCH_LUCKY('L');

    private final char symbol;

    TileType(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the single-character symbol used in board dumps and fixtures.
     * @return The symbol.
     */
    public char symbol() {
        return symbol;
    }

    /**
     * @return true for the four matchable cube colors.
     */
    public boolean isColored() {
        return this == CUBE_RED || this == CUBE_YELLOW || this == CUBE_GREEN || this == CUBE_BLUE;
    }

    public boolean isRocket() {
        return this == ROCKET_HORIZONTAL || this == ROCKET_VERTICAL;
    }

    public boolean isSnitch() {
        return this == SNITCH || this == SNITCH_LUCKY;
    }

    public boolean isPowerUp() {
        return isRocket() || isSnitch();
    }

    /**
     * Returns all colored types in declaration order.
     * @return An immutable list of the colored types.
     */
    public static List<TileType> coloredTypes() {
        return Arrays.stream(values()).filter(TileType::isColored).collect(Collectors.toUnmodifiableList());
    }

    /**
     * Resolves a type from its board symbol.
     * @param symbol The symbol, case-sensitive.
     * @return The matching type.
     * @throws IllegalArgumentException if no type uses the symbol.
     */
    public static TileType fromSymbol(char symbol) {
        for (TileType type : values()) {
            if (type.symbol == symbol) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown tile symbol: " + symbol);
    }
}
