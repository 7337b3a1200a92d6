package org.tilecascade.runtime;

import java.util.List;

import org.tilecascade.runtime.model.GameState;
import org.tilecascade.runtime.model.Tile;

/**
 * Completion token for a batch of tiles handed to an external animation. The host returns it through
 * {@link CascadeStateMachine#complete(PhaseToken)} once every tile of the batch has finished moving.
 * @param id Sequence number, unique per engine.
 * @param phase The phase that issued the batch.
 * @param tiles The tiles whose {@code moving} flag is raised until completion.
 */
public record PhaseToken(long id, GameState phase, List<Tile> tiles) {
}
