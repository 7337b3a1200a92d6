package org.tilecascade.runtime;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tilecascade.junit.extensions.logging.ExpectLog;
import org.tilecascade.junit.extensions.logging.LogLevel;
import org.tilecascade.junit.extensions.logging.LogWatchExtension;
import org.tilecascade.runtime.internal.services.DefaultTileCatalog;
import org.tilecascade.runtime.model.GameState;
import org.tilecascade.runtime.model.Grid;
import org.tilecascade.runtime.model.MatchData;
import org.tilecascade.runtime.model.SwapDirection;
import org.tilecascade.runtime.model.Tile;
import org.tilecascade.runtime.model.TileType;
import org.tilecascade.runtime.spi.IGameEventListener;
import org.tilecascade.runtime.testing.BoardFixtures;
import org.tilecascade.runtime.testing.FixedRandomProvider;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Unit tests for {@link CascadeStateMachine}: phase transitions, event order, the animation token
 * protocol and the cascade limit. Boards are built from fixtures and refills are scripted.
 */
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
public class CascadeStateMachineTest {

    /** A swap of (2,0) and (3,0) completes the red run on row 0. */
    private static final String[] SWAP_BOARD = {
            "GBGB",
            "BGBG",
            "RRGR"
    };

    @Mock
    private IGameEventListener listener;

    private static EngineSettings settings(int width, int height, boolean headless, int maxCascadeDepth) {
        return new EngineSettings(width, height, TileType.coloredTypes(), maxCascadeDepth, 1L, headless,
                EnumSet.allOf(TileType.class));
    }

    private CascadeStateMachine machine(Grid grid, boolean headless, int maxCascadeDepth, FixedRandomProvider random) {
        return new CascadeStateMachine(grid, settings(grid.getWidth(), grid.getHeight(), headless, maxCascadeDepth),
                random, DefaultTileCatalog.all(), listener);
    }

    /**
     * Verifies the full event sequence of a successful swap in headless mode, from the swap through
     * blast, gravity and refill back to idle.
     */
    @Test
    @Tag("unit")
    void testSuccessfulSwapRunsFullCycle() {
        Grid grid = BoardFixtures.grid(SWAP_BOARD);
        Tile green = grid.get(2, 0);
        Tile red = grid.get(3, 0);
        // refill draws: CUBE_RED, CUBE_YELLOW, CUBE_RED
        CascadeStateMachine engine = machine(grid, true, 50, new FixedRandomProvider().ints(0, 1, 0));

        assertThat(engine.requestSwap(green, red)).isTrue();

        assertThat(engine.getState()).isEqualTo(GameState.IDLE);
        assertThat(engine.getPendingToken()).isNull();
        assertThat(BoardFixtures.rows(grid)).containsExactly("RYRB", "GBGG", "BGBG");
        assertThat(grid.tiles()).noneMatch(Tile::isMoving);

        InOrder order = inOrder(listener);
        order.verify(listener).onGameStateChanged(GameState.IDLE, GameState.SWAPPING);
        order.verify(listener).onSwapStarted(green, red);
        order.verify(listener).onSwapCompleted(green, red);
        order.verify(listener).onMatchFound(any(MatchData.class));
        order.verify(listener).onGameStateChanged(GameState.SWAPPING, GameState.BLASTING);
        order.verify(listener).onItemsBlasted(anyList());
        order.verify(listener).onBlastCompleted();
        order.verify(listener).onGravityStarted();
        order.verify(listener).onGameStateChanged(GameState.BLASTING, GameState.GRAVITY);
        order.verify(listener, times(6)).onTileFell(any(), anyInt());
        order.verify(listener).onGravityCompleted();
        order.verify(listener).onRefillStarted();
        order.verify(listener).onGameStateChanged(GameState.GRAVITY, GameState.REFILLING);
        order.verify(listener, times(3)).onTileSpawned(any(), any());
        order.verify(listener).onRefillCompleted();
        order.verify(listener).onGameStateChanged(GameState.REFILLING, GameState.CASCADING);
        order.verify(listener).onGameStateChanged(GameState.CASCADING, GameState.IDLE);
        verify(listener, never()).onSwapReverted(any(), any());
        verify(listener, never()).onAwaitingAnimation(any());
    }

    /**
     * Verifies that a swap without a match is reverted, restoring both slots and stored coordinates,
     * with the host completing each animation token.
     */
    @Test
    @Tag("unit")
    void testSwapWithoutMatchIsReverted() {
        Grid grid = BoardFixtures.grid(
                "RGB",
                "GBR",
                "BRG");
        Tile blue = grid.get(0, 0);
        Tile red = grid.get(1, 0);
        CascadeStateMachine engine = machine(grid, false, 50, new FixedRandomProvider());

        assertThat(engine.requestSwap(0, 0, SwapDirection.RIGHT)).isTrue();
        PhaseToken swapToken = engine.getPendingToken();
        assertThat(swapToken.phase()).isEqualTo(GameState.SWAPPING);
        assertThat(swapToken.tiles()).containsExactly(blue, red);
        assertThat(blue.isMoving()).isTrue();
        assertThat(blue.getX()).isEqualTo(1);

        assertThat(engine.complete(swapToken)).isTrue();
        PhaseToken revertToken = engine.getPendingToken();
        assertThat(revertToken).isNotNull().isNotSameAs(swapToken);
        assertThat(engine.getState()).isEqualTo(GameState.SWAPPING);

        assertThat(engine.complete(revertToken)).isTrue();
        assertThat(engine.getState()).isEqualTo(GameState.IDLE);
        assertThat(grid.get(0, 0)).isSameAs(blue);
        assertThat(grid.get(1, 0)).isSameAs(red);
        assertThat(blue.getX()).isZero();
        assertThat(red.getX()).isEqualTo(1);
        assertThat(blue.isMoving()).isFalse();

        InOrder order = inOrder(listener);
        order.verify(listener).onSwapStarted(blue, red);
        order.verify(listener).onSwapCompleted(blue, red);
        order.verify(listener).onSwapReverted(blue, red);
        order.verify(listener).onGameStateChanged(GameState.SWAPPING, GameState.IDLE);
        verify(listener, never()).onMatchFound(any());
        verify(listener, times(2)).onAwaitingAnimation(any());
    }

    /**
     * Verifies that commands are rejected while an animation is pending and that stale or foreign
     * tokens do not advance the machine.
     */
    @Test
    @Tag("unit")
    void testCommandsAndStaleTokensAreRejectedOutsideIdle() {
        Grid grid = BoardFixtures.grid(SWAP_BOARD);
        CascadeStateMachine engine = machine(grid, false, 50, new FixedRandomProvider().ints(0, 1, 0));

        assertThat(engine.requestSwap(2, 0, SwapDirection.RIGHT)).isTrue();
        PhaseToken token = engine.getPendingToken();
        assertThat(engine.canAcceptInput()).isFalse();

        assertThat(engine.requestSwap(0, 1, SwapDirection.UP)).isFalse();
        assertThat(engine.activatePowerUp(0, 0)).isFalse();
        assertThat(engine.settle()).isFalse();
        assertThat(engine.complete(null)).isFalse();
        assertThat(engine.complete(new PhaseToken(token.id(), token.phase(), token.tiles()))).isFalse();
        assertThat(engine.getPendingToken()).isSameAs(token);

        assertThat(engine.complete(token)).isTrue();
        assertThat(engine.complete(token)).isFalse();
        assertThat(engine.getState()).isEqualTo(GameState.BLASTING);
    }

    @Test
    @Tag("unit")
    void testInvalidSwapsAreRejected() {
        Grid grid = BoardFixtures.grid(SWAP_BOARD);
        CascadeStateMachine engine = machine(grid, true, 50, new FixedRandomProvider());

        assertThat(engine.requestSwap(grid.get(0, 0), grid.get(2, 0))).isFalse();
        assertThat(engine.requestSwap(grid.get(0, 0), grid.get(1, 1))).isFalse();
        assertThat(engine.requestSwap(0, 0, SwapDirection.LEFT)).isFalse();
        assertThat(engine.requestSwap(3, 2, SwapDirection.UP)).isFalse();
        assertThat(engine.requestSwap(null, grid.get(0, 0))).isFalse();
        assertThat(engine.getState()).isEqualTo(GameState.IDLE);
        verify(listener, never()).onGameStateChanged(any(), any());
    }

    /**
     * Verifies that a listener completing tokens synchronously from its callback drives the machine to
     * idle without recursion.
     */
    @Test
    @Tag("unit")
    void testTokensCompletedFromCallbackAreQueued() {
        Grid grid = BoardFixtures.grid(SWAP_BOARD);
        CascadeStateMachine[] holder = new CascadeStateMachine[1];
        int[] awaited = new int[1];
        IGameEventListener completing = new IGameEventListener() {
            @Override
            public void onAwaitingAnimation(PhaseToken token) {
                awaited[0]++;
                assertThat(holder[0].complete(token)).isTrue();
            }
        };
        holder[0] = new CascadeStateMachine(grid, settings(4, 3, false, 50),
                new FixedRandomProvider().ints(0, 1, 0), DefaultTileCatalog.all(), completing);

        assertThat(holder[0].requestSwap(2, 0, SwapDirection.RIGHT)).isTrue();

        assertThat(holder[0].getState()).isEqualTo(GameState.IDLE);
        // swap, blast, gravity, refill
        assertThat(awaited[0]).isEqualTo(4);
        assertThat(BoardFixtures.rows(grid)).containsExactly("RYRB", "GBGG", "BGBG");
    }

    /**
     * Verifies that a swap or activation touching a tile that is still animating is rejected without
     * side effects.
     */
    @Test
    @Tag("unit")
    void testCommandsOnMovingTilesAreRejected() {
        Grid grid = BoardFixtures.grid(
                "RGB",
                "GBR",
                "BHG");
        Tile blue = grid.get(0, 0);
        Tile rocket = grid.get(1, 0);
        CascadeStateMachine engine = machine(grid, true, 50, new FixedRandomProvider());
        blue.setMoving(true);
        rocket.setMoving(true);

        assertThat(engine.requestSwap(blue, rocket)).isFalse();
        assertThat(engine.requestSwap(0, 0, SwapDirection.UP)).isFalse();
        assertThat(engine.requestSwap(grid.get(1, 1), rocket)).isFalse();
        assertThat(engine.activatePowerUp(1, 0)).isFalse();

        assertThat(engine.getState()).isEqualTo(GameState.IDLE);
        assertThat(engine.getPendingToken()).isNull();
        assertThat(grid.get(0, 0)).isSameAs(blue);
        assertThat(grid.get(1, 0)).isSameAs(rocket);
        verifyNoInteractions(listener);

        rocket.setMoving(false);
        assertThat(engine.activatePowerUp(1, 0)).isTrue();
    }

    /**
     * Verifies that a failing callback reaches the caller and leaves the engine idle and able to take
     * the next command.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*CascadeStateMachine", messagePattern = ".*Resolution cycle aborted in BLASTING.*")
    void testListenerFailureReturnsEngineToIdle() {
        Grid grid = BoardFixtures.grid(SWAP_BOARD);
        doThrow(new IllegalStateException("renderer failed")).when(listener).onItemsBlasted(anyList());
        CascadeStateMachine engine = machine(grid, true, 50, new FixedRandomProvider());

        assertThatThrownBy(() -> engine.requestSwap(2, 0, SwapDirection.RIGHT))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("renderer failed");

        assertThat(engine.getState()).isEqualTo(GameState.IDLE);
        assertThat(engine.getPendingToken()).isNull();
        assertThat(engine.getCascadeDepth()).isZero();
        assertThat(engine.canAcceptInput()).isTrue();
        assertThat(grid.tiles()).noneMatch(Tile::isMoving);
        verify(listener).onGameStateChanged(GameState.BLASTING, GameState.IDLE);
        verify(listener, never()).onBlastCompleted();

        // (0,2) and (1,2) make no match, so the swap is accepted and reverted
        assertThat(engine.requestSwap(0, 2, SwapDirection.RIGHT)).isTrue();
        assertThat(engine.getState()).isEqualTo(GameState.IDLE);
        verify(listener).onSwapReverted(any(), any());
    }

    @Test
    @Tag("unit")
    void testActivatePowerUp() {
        Grid grid = BoardFixtures.grid(
                "RGB",
                "GBR",
                "BHG");
        Tile rocket = grid.get(1, 0);
        CascadeStateMachine engine = machine(grid, true, 50, new FixedRandomProvider().ints(1, 0, 1));

        assertThat(engine.activatePowerUp(0, 0)).isFalse();
        assertThat(engine.activatePowerUp(5, 0)).isFalse();
        assertThat(engine.activatePowerUp(1, 0)).isTrue();

        assertThat(engine.getState()).isEqualTo(GameState.IDLE);
        assertThat(BoardFixtures.rows(grid)).containsExactly("YRY", "RGB", "GBR");
        verify(listener).onPowerUpActivated(any(), anyList());
        verify(listener, never()).onMatchFound(any());
        verify(listener).onItemsBlasted(argThat(tiles -> tiles.contains(rocket)));
    }

    /**
     * Verifies that cascades stop once the depth limit is exceeded, leaving the pending matches on the
     * board and returning to idle.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*CascadeStateMachine", messagePattern = ".*Max cascade depth.*")
    void testCascadeLimitStopsCascading() {
        Grid grid = BoardFixtures.grid(SWAP_BOARD);
        // every refill draw yields CUBE_RED, so each refilled top row matches again
        CascadeStateMachine engine = machine(grid, true, 3, new FixedRandomProvider());

        assertThat(engine.requestSwap(2, 0, SwapDirection.RIGHT)).isTrue();

        assertThat(engine.getState()).isEqualTo(GameState.IDLE);
        assertThat(engine.getCascadeDepth()).isZero();
        assertThat(BoardFixtures.rows(grid)[0]).isEqualTo("RRRB");
        verify(listener, times(4)).onMatchFound(any());
        verify(listener, times(3)).onGameStateChanged(GameState.CASCADING, GameState.BLASTING);
        verify(listener).onCascadeLimitReached(4);
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*Max cascade depth \\(0\\).*")
    void testZeroCascadeDepthStopsAfterFirstRefill() {
        Grid grid = BoardFixtures.grid(SWAP_BOARD);
        CascadeStateMachine engine = machine(grid, true, 0, new FixedRandomProvider());

        assertThat(engine.requestSwap(2, 0, SwapDirection.RIGHT)).isTrue();

        verify(listener, times(1)).onMatchFound(any());
        verify(listener).onCascadeLimitReached(1);
        assertThat(engine.canAcceptInput()).isTrue();
    }

    /**
     * Verifies that settling resolves matches already present on the board and that a settled board
     * reports nothing to do.
     */
    @Test
    @Tag("unit")
    void testSettleResolvesExistingMatches() {
        Grid grid = BoardFixtures.grid(
                "GBG",
                "BGB",
                "RRR");
        CascadeStateMachine engine = machine(grid, true, 50, new FixedRandomProvider().ints(0, 1, 0));

        assertThat(engine.settle()).isTrue();

        assertThat(engine.getState()).isEqualTo(GameState.IDLE);
        assertThat(BoardFixtures.rows(grid)).containsExactly("RYR", "GBG", "BGB");
        assertThat(engine.settle()).isFalse();
    }

    @Test
    @Tag("unit")
    void testCreateFillsBoardFromSettings() {
        EngineSettings settings = settings(5, 4, true, 50).withSeed(11L);

        CascadeStateMachine engine = CascadeStateMachine.create(settings, null);

        assertThat(engine.getGrid().getWidth()).isEqualTo(5);
        assertThat(engine.getGrid().getHeight()).isEqualTo(4);
        assertThat(engine.getGrid().tiles()).hasSize(20).allMatch(t -> t.getType().isColored());
        assertThat(engine.getState()).isEqualTo(GameState.IDLE);
        assertThat(engine.getSettings()).isSameAs(settings);
    }
}
