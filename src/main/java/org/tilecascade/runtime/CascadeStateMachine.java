package org.tilecascade.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.tilecascade.runtime.blast.BlastPathCalculator;
import org.tilecascade.runtime.blast.BlastResolver;
import org.tilecascade.runtime.blast.BlastResult;
import org.tilecascade.runtime.gravity.GravityResolver;
import org.tilecascade.runtime.gravity.GravityResult;
import org.tilecascade.runtime.gravity.RefillResolver;
import org.tilecascade.runtime.internal.services.DefaultTileCatalog;
import org.tilecascade.runtime.internal.services.SeededRandomProvider;
import org.tilecascade.runtime.match.MatchDetector;
import org.tilecascade.runtime.model.FallOperation;
import org.tilecascade.runtime.model.GameState;
import org.tilecascade.runtime.model.Grid;
import org.tilecascade.runtime.model.MatchData;
import org.tilecascade.runtime.model.SwapDirection;
import org.tilecascade.runtime.model.Tile;
import org.tilecascade.runtime.spi.IGameEventListener;
import org.tilecascade.runtime.spi.IRandomProvider;
import org.tilecascade.runtime.spi.ITileCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the engine: swap, blast, gravity, refill and cascade check, re-entering the blast phase
 * while the settled board still holds matches, up to the configured cascade depth.
 * <p>
 * Only {@link GameState#IDLE} accepts commands; in any other phase commands are rejected without side
 * effects. Every phase that hands tiles to an animation suspends on a {@link PhaseToken} until the host
 * passes it back to {@link #complete(PhaseToken)}. The machine is driven entirely by these calls and owns
 * no threads; completing a token from inside a listener callback is allowed and is queued rather than
 * recursed into.
 */
public class CascadeStateMachine {
    private static final Logger LOG = LoggerFactory.getLogger(CascadeStateMachine.class);

    private final Grid grid;
    private final EngineSettings settings;
    private final IGameEventListener listener;
    private final MatchDetector matchDetector;
    private final BlastResolver blastResolver;
    private final GravityResolver gravityResolver;
    private final RefillResolver refillResolver;

    private final Deque<Runnable> steps = new ArrayDeque<>();
    private boolean driving = false;

    private GameState state = GameState.IDLE;
    private int cascadeDepth = 0;
    private long nextTokenId = 1L;
    private PhaseToken pendingToken;
    private Runnable pendingContinuation;

    /**
     * Creates a state machine over an existing grid.
     * @param grid The board, already filled.
     * @param settings The engine settings.
     * @param random The root random provider; independent streams are derived from it.
     * @param tileCatalog The tile types the host can present.
     * @param listener The event sink, or null to discard events.
     */
    public CascadeStateMachine(Grid grid, EngineSettings settings, IRandomProvider random,
                               ITileCatalog tileCatalog, IGameEventListener listener) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.settings = Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(random, "random");
        Objects.requireNonNull(tileCatalog, "tileCatalog");
        this.listener = listener != null ? listener : new IGameEventListener() {};
        this.matchDetector = new MatchDetector(grid);
        this.blastResolver = new BlastResolver(grid,
                new BlastPathCalculator(random.deriveFor("snitchPath", 0)),
                tileCatalog, random.deriveFor("snitchVariant", 0), this.listener);
        this.gravityResolver = new GravityResolver();
        this.refillResolver = new RefillResolver(settings.getColoredTypes(), random.deriveFor("refill", 0),
                tileCatalog, this.listener);
    }

    /**
     * Creates a grid of the configured size, fills it with random colored tiles and wraps it in a state
     * machine. Matches present after the fill are left for {@link #settle()}.
     * @param settings The engine settings; a null seed selects a time-based one.
     * @param listener The event sink, or null.
     * @return The new state machine in {@link GameState#IDLE}.
     */
    public static CascadeStateMachine create(EngineSettings settings, IGameEventListener listener) {
        long seed = settings.getSeed() != null ? settings.getSeed() : System.nanoTime();
        IRandomProvider random = new SeededRandomProvider(seed);
        Grid grid = new Grid(settings.getWidth(), settings.getHeight());
        grid.fillRandom(settings.getColoredTypes(), random.deriveFor("fill", 0));
        LOG.debug("Created engine {} with seed {}", settings, seed);
        return new CascadeStateMachine(grid, settings, random,
                new DefaultTileCatalog(settings.getSupportedTypes()), listener);
    }

    public Grid getGrid() {
        return grid;
    }

    public EngineSettings getSettings() {
        return settings;
    }

    public MatchDetector getMatchDetector() {
        return matchDetector;
    }

    public GameState getState() {
        return state;
    }

    /**
     * @return The number of automatic cascades run since the last command.
     */
    public int getCascadeDepth() {
        return cascadeDepth;
    }

    /**
     * @return The token the machine is waiting for, or null.
     */
    public PhaseToken getPendingToken() {
        return pendingToken;
    }

    public boolean canAcceptInput() {
        return state == GameState.IDLE;
    }

    /**
     * Requests a swap of two adjacent tiles.
     * @param a The first tile.
     * @param b The second tile.
     * @return true if the swap was accepted, false if it was rejected.
     */
    public boolean requestSwap(Tile a, Tile b) {
        if (!acceptsCommand("swap")) {
            return false;
        }
        if (a == null || b == null || !grid.contains(a) || !grid.contains(b)) {
            return reject("swap", "tiles must both be on the grid");
        }
        if (a.isMoving() || b.isMoving()) {
            return reject("swap", "a tile is still moving");
        }
        if (!grid.areAdjacent(a, b)) {
            return reject("swap", "tiles at (" + a.getX() + "," + a.getY() + ") and (" + b.getX() + "," + b.getY()
                    + ") are not adjacent");
        }
        submit(() -> startSwap(a, b));
        return true;
    }

    /**
     * Requests a swap of the tile at a cell with its neighbour in the given direction.
     * @param x The column of the dragged tile.
     * @param y The row of the dragged tile.
     * @param direction The drag direction.
     * @return true if the swap was accepted.
     */
    public boolean requestSwap(int x, int y, SwapDirection direction) {
        if (!acceptsCommand("swap")) {
            return false;
        }
        Objects.requireNonNull(direction, "direction");
        int tx = x + direction.dx();
        int ty = y + direction.dy();
        if (!grid.isValid(x, y) || !grid.isValid(tx, ty)) {
            return reject("swap", "(" + x + "," + y + ") " + direction + " leaves the grid");
        }
        return requestSwap(grid.get(x, y), grid.get(tx, ty));
    }

    /**
     * Activates the power-up at a cell.
     * @param x The column.
     * @param y The row.
     * @return true if the activation was accepted.
     */
    public boolean activatePowerUp(int x, int y) {
        if (!acceptsCommand("activation")) {
            return false;
        }
        if (!grid.isValid(x, y)) {
            return reject("activation", "(" + x + "," + y + ") is outside the grid");
        }
        Tile tile = grid.get(x, y);
        if (tile == null || !tile.getType().isPowerUp()) {
            return reject("activation", "no power-up at (" + x + "," + y + ")");
        }
        if (tile.isMoving()) {
            return reject("activation", "power-up at (" + x + "," + y + ") is still moving");
        }
        submit(() -> {
            cascadeDepth = 0;
            beginBlast(List.of(), List.of(tile));
        });
        return true;
    }

    /**
     * Resolves matches already present on the board, typically right after the initial fill.
     * @return true if matches were found and a resolution cycle started.
     */
    public boolean settle() {
        if (!acceptsCommand("settle")) {
            return false;
        }
        List<MatchData> matches = matchDetector.findAllMatches();
        if (matches.isEmpty()) {
            return false;
        }
        submit(() -> {
            cascadeDepth = 0;
            beginBlast(matches, List.of());
        });
        return true;
    }

    /**
     * Reports that every tile of an animation batch has finished moving.
     * @param token The token received through {@link IGameEventListener#onAwaitingAnimation(PhaseToken)}.
     * @return true if the token was the one the machine was waiting for.
     */
    public boolean complete(PhaseToken token) {
        if (token == null || token != pendingToken) {
            LOG.debug("Ignoring completion of unknown or stale token {}", token);
            return false;
        }
        Runnable continuation = pendingContinuation;
        pendingToken = null;
        pendingContinuation = null;
        for (Tile tile : token.tiles()) {
            tile.setMoving(false);
        }
        submit(continuation);
        return true;
    }

    private void startSwap(Tile a, Tile b) {
        cascadeDepth = 0;
        setState(GameState.SWAPPING);
        grid.swap(a, b);
        listener.onSwapStarted(a, b);
        await(List.of(a, b), () -> finishSwap(a, b));
    }

    private void finishSwap(Tile a, Tile b) {
        listener.onSwapCompleted(a, b);
        List<MatchData> matches = matchDetector.findMatchesAt(
                new int[]{a.getX(), a.getY()},
                new int[]{b.getX(), b.getY()});
        if (!matches.isEmpty()) {
            beginBlast(matches, List.of());
            return;
        }
        LOG.debug("Swap of {} and {} produced no match, reverting", a, b);
        grid.swap(a, b);
        listener.onSwapReverted(a, b);
        await(List.of(a, b), () -> setState(GameState.IDLE));
    }

    private void beginBlast(List<MatchData> matches, List<Tile> activations) {
        for (MatchData match : matches) {
            listener.onMatchFound(match);
        }
        setState(GameState.BLASTING);
        BlastResult result = blastResolver.resolve(matches, activations);
        List<Tile> animated = new ArrayList<>(result.removedTiles());
        animated.addAll(result.spawnedPowerUps());
        await(animated, this::finishBlast);
    }

    private void finishBlast() {
        listener.onBlastCompleted();
        listener.onGravityStarted();
        setState(GameState.GRAVITY);
        GravityResult result = gravityResolver.apply(grid);
        List<Tile> fallen = new ArrayList<>(result.falls().size());
        int staggerGroup = 0;
        for (Map.Entry<Integer, List<FallOperation>> row : result.bySourceRow().entrySet()) {
            for (FallOperation fall : row.getValue()) {
                listener.onTileFell(fall, staggerGroup);
                fallen.add(fall.tile());
            }
            staggerGroup++;
        }
        await(fallen, this::finishGravity);
    }

    private void finishGravity() {
        listener.onGravityCompleted();
        listener.onRefillStarted();
        setState(GameState.REFILLING);
        List<RefillResolver.Placement> placements = refillResolver.refill(grid);
        List<Tile> spawned = new ArrayList<>(placements.size());
        for (RefillResolver.Placement placement : placements) {
            listener.onTileSpawned(placement.operation(), placement.tile());
            spawned.add(placement.tile());
        }
        await(spawned, this::finishRefill);
    }

    private void finishRefill() {
        listener.onRefillCompleted();
        setState(GameState.CASCADING);
        List<MatchData> matches = matchDetector.findAllMatches();
        if (matches.isEmpty()) {
            LOG.debug("Board settled after {} cascade(s)", cascadeDepth);
            cascadeDepth = 0;
            setState(GameState.IDLE);
            return;
        }
        cascadeDepth++;
        if (cascadeDepth > settings.getMaxCascadeDepth()) {
            LOG.warn("Max cascade depth ({}) reached, discarding {} pending match(es)",
                    settings.getMaxCascadeDepth(), matches.size());
            listener.onCascadeLimitReached(cascadeDepth);
            cascadeDepth = 0;
            setState(GameState.IDLE);
            return;
        }
        beginBlast(matches, List.of());
    }

    /**
     * Suspends until the given tiles finish animating, then runs the continuation. An empty batch or
     * headless mode continues without waiting for the host.
     */
    private void await(List<Tile> tiles, Runnable continuation) {
        if (tiles.isEmpty()) {
            submit(continuation);
            return;
        }
        for (Tile tile : tiles) {
            tile.setMoving(true);
        }
        PhaseToken token = new PhaseToken(nextTokenId++, state, List.copyOf(tiles));
        pendingToken = token;
        pendingContinuation = continuation;
        if (settings.isHeadless()) {
            complete(token);
            return;
        }
        listener.onAwaitingAnimation(token);
    }

    private void submit(Runnable step) {
        steps.add(step);
        if (driving) {
            return;
        }
        driving = true;
        try {
            while (!steps.isEmpty()) {
                steps.poll().run();
            }
        } catch (RuntimeException | Error e) {
            abandonCycle(e);
            throw e;
        } finally {
            driving = false;
            steps.clear();
        }
    }

    /**
     * Drops the interrupted cycle after a step failed so that the next command is accepted again.
     * Tiles already blasted stay removed; the board is left as the failed step found it.
     */
    private void abandonCycle(Throwable cause) {
        LOG.warn("Resolution cycle aborted in {} by {}, returning to {}", state, cause.toString(), GameState.IDLE);
        steps.clear();
        pendingToken = null;
        pendingContinuation = null;
        cascadeDepth = 0;
        for (Tile tile : grid.tiles()) {
            tile.setMoving(false);
        }
        GameState previous = state;
        state = GameState.IDLE;
        if (previous != GameState.IDLE) {
            try {
                listener.onGameStateChanged(previous, GameState.IDLE);
            } catch (RuntimeException suppressed) {
                cause.addSuppressed(suppressed);
            }
        }
    }

    private void setState(GameState newState) {
        if (state == newState) {
            return;
        }
        GameState previous = state;
        state = newState;
        LOG.debug("State changed: {} -> {}", previous, newState);
        listener.onGameStateChanged(previous, newState);
    }

    private boolean acceptsCommand(String command) {
        if (state != GameState.IDLE || pendingToken != null) {
            LOG.debug("Rejected {} request: engine is {}", command, state);
            return false;
        }
        return true;
    }

    private boolean reject(String command, String reason) {
        LOG.debug("Rejected {} request: {}", command, reason);
        return false;
    }
}
