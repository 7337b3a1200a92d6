package org.tilecascade.cli.rendering;

import org.tilecascade.runtime.model.IGridReader;
import org.tilecascade.runtime.model.Tile;

/**
 * Renders a board as text, one line per row with the top row first. Empty cells print as '.'.
 */
public final class BoardRenderer {

    private BoardRenderer() {
    }

    public static String render(IGridReader grid) {
        StringBuilder sb = new StringBuilder();
        for (int y = grid.getHeight() - 1; y >= 0; y--) {
            for (int x = 0; x < grid.getWidth(); x++) {
                Tile tile = grid.tileAt(x, y);
                sb.append(tile == null ? '.' : tile.getType().symbol());
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
