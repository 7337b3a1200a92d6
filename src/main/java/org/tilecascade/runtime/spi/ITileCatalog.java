package org.tilecascade.runtime.spi;

import org.tilecascade.runtime.model.TileType;

/**
 * Registry of the tile types the host can present. The engine consults it before every spawn and
 * skips spawns of unsupported types.
 */
public interface ITileCatalog {

    /**
     * @param type The tile type about to be spawned.
     * @return true if the host has a visual registered for the type.
     */
    boolean supports(TileType type);
}
