package org.tilecascade.runtime;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.typesafe.config.ConfigFactory;
import org.tilecascade.runtime.model.TileType;

/**
 * The configurable surface of the engine: board size, colored tile set, cascade limit, seed, headless
 * mode and the tile types the host supports. Fixed rules live in {@link Config}.
 */
public final class EngineSettings {

    private final int width;
    private final int height;
    private final List<TileType> coloredTypes;
    private final int maxCascadeDepth;
    private final Long seed;
    private final boolean headless;
    private final Set<TileType> supportedTypes;

    /**
     * Creates validated settings.
     * @param width The number of columns, at least 2.
     * @param height The number of rows, at least 2.
     * @param coloredTypes The colored types used for fills and refills.
     * @param maxCascadeDepth The number of automatic cascades allowed after one command, at least 0.
     * @param seed The random seed, or null for a time-based seed.
     * @param headless If true the engine completes its own animation tokens.
     * @param supportedTypes The tile types the host can present, or null for every type.
     */
    public EngineSettings(int width, int height, List<TileType> coloredTypes, int maxCascadeDepth, Long seed,
                          boolean headless, Set<TileType> supportedTypes) {
        if (width < Config.SQUARE_SIZE) {
            throw new IllegalArgumentException("width must be at least " + Config.SQUARE_SIZE + ", got " + width);
        }
        if (height < Config.SQUARE_SIZE) {
            throw new IllegalArgumentException("height must be at least " + Config.SQUARE_SIZE + ", got " + height);
        }
        if (coloredTypes == null || coloredTypes.isEmpty()) {
            throw new IllegalArgumentException("colored-types must contain at least one type");
        }
        for (TileType type : coloredTypes) {
            if (!type.isColored()) {
                throw new IllegalArgumentException("colored-types may only contain colored types, got " + type);
            }
        }
        if (maxCascadeDepth < 0) {
            throw new IllegalArgumentException("max-cascade-depth must not be negative, got " + maxCascadeDepth);
        }
        this.width = width;
        this.height = height;
        this.coloredTypes = List.copyOf(coloredTypes);
        this.maxCascadeDepth = maxCascadeDepth;
        this.seed = seed;
        this.headless = headless;
        if (supportedTypes == null) {
            this.supportedTypes = EnumSet.allOf(TileType.class);
        } else if (supportedTypes.isEmpty()) {
            this.supportedTypes = EnumSet.noneOf(TileType.class);
        } else {
            this.supportedTypes = EnumSet.copyOf(supportedTypes);
        }
    }

    /**
     * Reads settings from a configuration subtree such as {@code tilecascade.engine}.
     * <pre>
     * width = 8
     * height = 8
     * colored-types = [CUBE_RED, CUBE_YELLOW, CUBE_GREEN, CUBE_BLUE]
     * max-cascade-depth = 50
     * seed = 42              # optional
     * headless = false
     * supported-types = [...] # optional, defaults to every type
     * </pre>
     * @param config The engine configuration subtree.
     * @return The validated settings.
     */
    public static EngineSettings fromConfig(com.typesafe.config.Config config) {
        List<TileType> colored = new ArrayList<>();
        for (String name : config.getStringList("colored-types")) {
            colored.add(parseType(name, "colored-types"));
        }
        Set<TileType> supported = EnumSet.allOf(TileType.class);
        if (config.hasPath("supported-types")) {
            supported = EnumSet.noneOf(TileType.class);
            for (String name : config.getStringList("supported-types")) {
                supported.add(parseType(name, "supported-types"));
            }
        }
        return new EngineSettings(
            config.getInt("width"),
            config.getInt("height"),
            colored,
            config.hasPath("max-cascade-depth") ? config.getInt("max-cascade-depth") : Config.DEFAULT_MAX_CASCADE_DEPTH,
            config.hasPath("seed") ? config.getLong("seed") : null,
            config.hasPath("headless") && config.getBoolean("headless"),
            supported
        );
    }

    /**
     * @return The defaults from {@code reference.conf}.
     */
    public static EngineSettings defaults() {
        return fromConfig(ConfigFactory.defaultReference().getConfig(Config.ENGINE_CONFIG_PATH));
    }

    private static TileType parseType(String name, String key) {
        try {
            return TileType.valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown tile type '" + name + "' in " + key, e);
        }
    }

    public EngineSettings withSize(int width, int height) {
        return new EngineSettings(width, height, coloredTypes, maxCascadeDepth, seed, headless, supportedTypes);
    }

    public EngineSettings withSeed(Long seed) {
        return new EngineSettings(width, height, coloredTypes, maxCascadeDepth, seed, headless, supportedTypes);
    }

    public EngineSettings withHeadless(boolean headless) {
        return new EngineSettings(width, height, coloredTypes, maxCascadeDepth, seed, headless, supportedTypes);
    }

    public EngineSettings withMaxCascadeDepth(int maxCascadeDepth) {
        return new EngineSettings(width, height, coloredTypes, maxCascadeDepth, seed, headless, supportedTypes);
    }

    public EngineSettings withColoredTypes(List<TileType> coloredTypes) {
        return new EngineSettings(width, height, coloredTypes, maxCascadeDepth, seed, headless, supportedTypes);
    }

    public EngineSettings withSupportedTypes(Set<TileType> supportedTypes) {
        return new EngineSettings(width, height, coloredTypes, maxCascadeDepth, seed, headless, supportedTypes);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public List<TileType> getColoredTypes() {
        return coloredTypes;
    }

    public int getMaxCascadeDepth() {
        return maxCascadeDepth;
    }

    /**
     * @return The seed, or null if none was configured.
     */
    public Long getSeed() {
        return seed;
    }

    public boolean isHeadless() {
        return headless;
    }

    public Set<TileType> getSupportedTypes() {
        return supportedTypes.isEmpty() ? EnumSet.noneOf(TileType.class) : EnumSet.copyOf(supportedTypes);
    }

    @Override
    public String toString() {
        return "EngineSettings[" + width + "x" + height + ", colors=" + coloredTypes + ", maxCascadeDepth="
                + maxCascadeDepth + ", seed=" + seed + ", headless=" + headless + "]";
    }
}
