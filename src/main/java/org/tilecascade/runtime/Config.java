package org.tilecascade.runtime;

/**
 * Provides the fixed rule constants of the match-3 engine.
 * This final class contains static constants that define match sizes, power-up thresholds
 * and power-up blast shapes. Values that a host may tune live in {@link EngineSettings}.
 * It is not meant to be instantiated.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * The minimum number of identical colored tiles in a row or column that forms a match.
     */
    public static final int MIN_MATCH_LENGTH = 3;

    /**
     * The linear run length from which a match spawns a rocket.
     */
    public static final int POWER_UP_MATCH_LENGTH = 4;

    /**
     * The edge length of a square match that spawns a snitch.
     */
    public static final int SQUARE_SIZE = 2;

    /**
     * The number of random extra cells a regular snitch clears.
     */
    public static final int SNITCH_RANDOM_CELLS = 1;

    /**
     * The number of random extra cells a lucky snitch clears.
     */
    public static final int LUCKY_SNITCH_RANDOM_CELLS = 2;

    /**
     * The probability that a spawned snitch is the lucky variant.
     */
    public static final double LUCKY_SNITCH_PROBABILITY = 0.5;

    /**
     * The cascade depth limit used when the configuration does not provide one.
     */
    public static final int DEFAULT_MAX_CASCADE_DEPTH = 50;

    /**
     * The root path of the engine settings inside the HOCON configuration.
     */
    public static final String ENGINE_CONFIG_PATH = "tilecascade.engine";
}
