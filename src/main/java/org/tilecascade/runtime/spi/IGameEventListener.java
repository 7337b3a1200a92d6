package org.tilecascade.runtime.spi;

import java.util.List;

import org.tilecascade.runtime.PhaseToken;
import org.tilecascade.runtime.model.FallOperation;
import org.tilecascade.runtime.model.GameState;
import org.tilecascade.runtime.model.MatchData;
import org.tilecascade.runtime.model.SpawnOperation;
import org.tilecascade.runtime.model.Tile;

/**
 * Receives the events of the engine. Rendering, animation and scoring collaborators implement the
 * callbacks they care about; every method defaults to a no-op.
 * <p>
 * Within one resolution cycle the events fire in this order: match found, power-up activated,
 * items blasted, power-up spawned, blast completed, gravity started, tile fell, gravity completed,
 * refill started, tile spawned, refill completed. {@link #onGameStateChanged} for the blasting,
 * gravity and refilling phases follows that phase's start event (the last match found, gravity
 * started, refill started); an activation enters blasting before its power-up is reported. The
 * cascading and idle transitions follow refill completed.
 * <p>
 * Exceptions thrown by a callback propagate to the caller of the command or of {@code complete}.
 * The engine abandons the interrupted cycle first and reports a transition to idle.
 * <p>
 * Whenever tiles have been handed to an animation the engine raises their {@code moving} flag and
 * calls {@link #onAwaitingAnimation(PhaseToken)}. The host passes the token back to
 * {@code CascadeStateMachine.complete} once the animations have finished.
 */
public interface IGameEventListener {

    default void onGameStateChanged(GameState previous, GameState current) {}

    default void onSwapStarted(Tile a, Tile b) {}

    default void onSwapCompleted(Tile a, Tile b) {}

    default void onSwapReverted(Tile a, Tile b) {}

    default void onMatchFound(MatchData match) {}

    /**
     * A power-up was triggered, either directly or by a chain reaction.
     * @param powerUp The activated power-up.
     * @param path The tiles in its blast path, captured before removal.
     */
    default void onPowerUpActivated(Tile powerUp, List<Tile> path) {}

    /**
     * Tiles were removed from the grid. The renderer runs their destruction animation.
     * @param tiles The removed tiles, without duplicates.
     */
    default void onItemsBlasted(List<Tile> tiles) {}

    /**
     * @param powerUp The new power-up tile.
     * @param replaced The tile removed from the pivot cell to make room, or null.
     */
    default void onPowerUpSpawned(Tile powerUp, Tile replaced) {}

    default void onBlastCompleted() {}

    default void onGravityStarted() {}

    /**
     * @param fall The applied fall.
     * @param staggerGroup Zero-based index of the fall's source row among all rows that fall.
     */
    default void onTileFell(FallOperation fall, int staggerGroup) {}

    default void onGravityCompleted() {}

    default void onRefillStarted() {}

    default void onTileSpawned(SpawnOperation spawn, Tile tile) {}

    default void onRefillCompleted() {}

    default void onCascadeLimitReached(int depth) {}

    /**
     * A recoverable engine error, such as a spawn skipped for a missing tile type.
     * @param error The error.
     */
    default void onError(RuntimeException error) {}

    default void onAwaitingAnimation(PhaseToken token) {}
}
