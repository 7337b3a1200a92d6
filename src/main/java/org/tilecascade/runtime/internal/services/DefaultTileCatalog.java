package org.tilecascade.runtime.internal.services;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

import org.tilecascade.runtime.model.TileType;
import org.tilecascade.runtime.spi.ITileCatalog;

/**
 * A tile catalog backed by a fixed set of supported types.
 */
public final class DefaultTileCatalog implements ITileCatalog {

    private final EnumSet<TileType> supported;

    public DefaultTileCatalog(Collection<TileType> supported) {
        this.supported = supported.isEmpty() ? EnumSet.noneOf(TileType.class) : EnumSet.copyOf(supported);
    }

    /**
     * @return A catalog that supports every tile type.
     */
    public static DefaultTileCatalog all() {
        return new DefaultTileCatalog(EnumSet.allOf(TileType.class));
    }

    @Override
    public boolean supports(TileType type) {
        return supported.contains(type);
    }

    public Set<TileType> getSupported() {
        return EnumSet.copyOf(supported);
    }
}
