package org.tilecascade.cli.commands;

import com.typesafe.config.Config;
import org.tilecascade.cli.CommandLineInterface;
import org.tilecascade.cli.rendering.BoardRenderer;
import org.tilecascade.cli.trace.EventTraceRecorder;
import org.tilecascade.runtime.CascadeStateMachine;
import org.tilecascade.runtime.EngineSettings;
import org.tilecascade.runtime.internal.services.SeededRandomProvider;
import org.tilecascade.runtime.model.Grid;
import org.tilecascade.runtime.model.SwapDirection;
import org.tilecascade.runtime.model.Tile;
import org.tilecascade.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "simulate",
    description = "Play random moves on a headless board and print a summary"
)
public class SimulateCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(SimulateCommand.class);
    private static final double ACTIVATION_CHANCE = 0.25;
    private static final int ATTEMPTS_PER_MOVE = 100;

    @Option(names = {"-s", "--seed"}, description = "Random seed (default: configured seed or 1)")
    private Long seed;

    @Option(names = {"-m", "--moves"}, description = "Number of moves to play (default: 20)")
    private int moves = 20;

    @Option(names = {"-W", "--width"}, description = "Board width (default: configured)")
    private Integer width;

    @Option(names = {"-H", "--height"}, description = "Board height (default: configured)")
    private Integer height;

    @Option(names = {"-b", "--show-board"}, description = "Print the board before and after the run")
    private boolean showBoard;

    @Option(names = {"-t", "--trace"}, description = "Write the event trace as JSON lines to this file")
    private File traceFile;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        Config config = parent.getConfig();

        EngineSettings settings = EngineSettings.fromConfig(config.getConfig(org.tilecascade.runtime.Config.ENGINE_CONFIG_PATH))
            .withHeadless(true);
        if (width != null || height != null) {
            settings = settings.withSize(width != null ? width : settings.getWidth(),
                height != null ? height : settings.getHeight());
        }
        long effectiveSeed = seed != null ? seed : (settings.getSeed() != null ? settings.getSeed() : 1L);
        settings = settings.withSeed(effectiveSeed);

        EventTraceRecorder recorder = new EventTraceRecorder(traceFile != null);
        CascadeStateMachine engine = CascadeStateMachine.create(settings, recorder);
        LOG.info("Simulating {} move(s) on a {}x{} board with seed {}", moves, settings.getWidth(),
            settings.getHeight(), effectiveSeed);

        if (showBoard) {
            out.println("Initial board:");
            out.print(BoardRenderer.render(engine.getGrid()));
        }
        engine.settle();

        IRandomProvider player = new SeededRandomProvider(effectiveSeed).deriveFor("player", 0);
        int played = 0;
        for (int move = 0; move < moves; move++) {
            if (playMove(engine, player)) {
                played++;
            }
        }

        if (showBoard) {
            out.println("Final board:");
            out.print(BoardRenderer.render(engine.getGrid()));
        }
        out.printf("Moves played: %d of %d%n", played, moves);
        out.printf("Swaps kept: %d, reverted: %d%n",
            recorder.getSwapsCompleted() - recorder.getSwapsReverted(), recorder.getSwapsReverted());
        out.printf("Matches: %d, tiles blasted: %d, cascades: %d%n",
            recorder.getMatchesFound(), recorder.getTilesBlasted(), recorder.getCascades());
        out.printf("Power-ups spawned: %d, activated: %d%n",
            recorder.getPowerUpsSpawned(), recorder.getPowerUpsActivated());
        if (recorder.getCascadeLimitHits() > 0 || recorder.getErrors() > 0) {
            out.printf("Cascade limit hits: %d, errors: %d%n", recorder.getCascadeLimitHits(), recorder.getErrors());
        }
        out.flush();

        if (traceFile != null) {
            Files.write(traceFile.toPath(), recorder.toJsonLines(), StandardCharsets.UTF_8);
            LOG.info("Wrote {} trace event(s) to {}", recorder.getEvents().size(), traceFile.getAbsolutePath());
        }
        return 0;
    }

    /**
     * Activates a random power-up now and then, otherwise swaps a random tile with a random neighbour.
     * @return true if the engine accepted a command.
     */
    private boolean playMove(CascadeStateMachine engine, IRandomProvider player) {
        Grid grid = engine.getGrid();
        List<Tile> powerUps = new ArrayList<>();
        for (Tile tile : grid.tiles()) {
            if (tile.getType().isPowerUp()) {
                powerUps.add(tile);
            }
        }
        if (!powerUps.isEmpty() && player.nextDouble() < ACTIVATION_CHANCE) {
            Tile powerUp = powerUps.get(player.nextInt(powerUps.size()));
            return engine.activatePowerUp(powerUp.getX(), powerUp.getY());
        }
        SwapDirection[] directions = SwapDirection.values();
        for (int attempt = 0; attempt < ATTEMPTS_PER_MOVE; attempt++) {
            int x = player.nextInt(grid.getWidth());
            int y = player.nextInt(grid.getHeight());
            SwapDirection direction = directions[player.nextInt(directions.length)];
            if (engine.requestSwap(x, y, direction)) {
                return true;
            }
        }
        return false;
    }
}
