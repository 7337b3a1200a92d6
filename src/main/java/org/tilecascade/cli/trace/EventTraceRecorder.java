package org.tilecascade.cli.trace;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.tilecascade.runtime.model.FallOperation;
import org.tilecascade.runtime.model.GameState;
import org.tilecascade.runtime.model.MatchData;
import org.tilecascade.runtime.model.SpawnOperation;
import org.tilecascade.runtime.model.Tile;
import org.tilecascade.runtime.spi.IGameEventListener;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records engine events as JSON objects and keeps the counters for the simulation summary.
 * Two runs with the same seed produce identical traces.
 */
public class EventTraceRecorder implements IGameEventListener {

    private final Gson gson = new Gson();
    private final List<JsonObject> events = new ArrayList<>();
    private final boolean recordEvents;

    private int swapsCompleted;
    private int swapsReverted;
    private int matchesFound;
    private int tilesBlasted;
    private int powerUpsSpawned;
    private int powerUpsActivated;
    private int cascades;
    private int cascadeLimitHits;
    private int errors;

    /**
     * @param recordEvents If false only the counters are maintained.
     */
    public EventTraceRecorder(boolean recordEvents) {
        this.recordEvents = recordEvents;
    }

    @Override
    public void onGameStateChanged(GameState previous, GameState current) {
        if (previous == GameState.CASCADING && current == GameState.BLASTING) {
            cascades++;
        }
        JsonObject event = event("stateChanged");
        event.addProperty("from", previous.name());
        event.addProperty("to", current.name());
        record(event);
    }

    @Override
    public void onSwapCompleted(Tile a, Tile b) {
        swapsCompleted++;
        JsonObject event = event("swapCompleted");
        event.add("a", tile(a));
        event.add("b", tile(b));
        record(event);
    }

    @Override
    public void onSwapReverted(Tile a, Tile b) {
        swapsReverted++;
        JsonObject event = event("swapReverted");
        event.add("a", tile(a));
        event.add("b", tile(b));
        record(event);
    }

    @Override
    public void onMatchFound(MatchData match) {
        matchesFound++;
        JsonObject event = event("matchFound");
        event.addProperty("orientation", match.getOrientation().name());
        event.addProperty("pivotX", match.getPivotX());
        event.addProperty("pivotY", match.getPivotY());
        event.add("tiles", tiles(match.getTiles()));
        record(event);
    }

    @Override
    public void onPowerUpActivated(Tile powerUp, List<Tile> path) {
        powerUpsActivated++;
        JsonObject event = event("powerUpActivated");
        event.add("powerUp", tile(powerUp));
        event.add("path", tiles(path));
        record(event);
    }

    @Override
    public void onItemsBlasted(List<Tile> blasted) {
        tilesBlasted += blasted.size();
        JsonObject event = event("itemsBlasted");
        event.add("tiles", tiles(blasted));
        record(event);
    }

    @Override
    public void onPowerUpSpawned(Tile powerUp, Tile replaced) {
        powerUpsSpawned++;
        if (replaced != null) {
            tilesBlasted++;
        }
        JsonObject event = event("powerUpSpawned");
        event.add("powerUp", tile(powerUp));
        if (replaced != null) {
            event.add("replaced", tile(replaced));
        }
        record(event);
    }

    @Override
    public void onTileFell(FallOperation fall, int staggerGroup) {
        JsonObject event = event("tileFell");
        event.addProperty("id", fall.tile().getId());
        event.addProperty("x", fall.x());
        event.addProperty("fromY", fall.fromY());
        event.addProperty("toY", fall.toY());
        event.addProperty("group", staggerGroup);
        record(event);
    }

    @Override
    public void onTileSpawned(SpawnOperation spawn, Tile spawned) {
        JsonObject event = event("tileSpawned");
        event.addProperty("x", spawn.x());
        event.addProperty("y", spawn.y());
        event.addProperty("rank", spawn.spawnRank());
        event.add("tile", tile(spawned));
        record(event);
    }

    @Override
    public void onCascadeLimitReached(int depth) {
        cascadeLimitHits++;
        JsonObject event = event("cascadeLimitReached");
        event.addProperty("depth", depth);
        record(event);
    }

    @Override
    public void onError(RuntimeException error) {
        errors++;
        JsonObject event = event("error");
        event.addProperty("message", error.getMessage());
        record(event);
    }

    /**
     * @return The recorded events, one JSON document per line.
     */
    public List<String> toJsonLines() {
        List<String> lines = new ArrayList<>(events.size());
        for (JsonObject event : events) {
            lines.add(gson.toJson(event));
        }
        return lines;
    }

    public List<JsonObject> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public int getSwapsCompleted() {
        return swapsCompleted;
    }

    public int getSwapsReverted() {
        return swapsReverted;
    }

    public int getMatchesFound() {
        return matchesFound;
    }

    public int getTilesBlasted() {
        return tilesBlasted;
    }

    public int getPowerUpsSpawned() {
        return powerUpsSpawned;
    }

    public int getPowerUpsActivated() {
        return powerUpsActivated;
    }

    public int getCascades() {
        return cascades;
    }

    public int getCascadeLimitHits() {
        return cascadeLimitHits;
    }

    public int getErrors() {
        return errors;
    }

    private JsonObject event(String type) {
        JsonObject event = new JsonObject();
        event.addProperty("event", type);
        return event;
    }

    private void record(JsonObject event) {
        if (recordEvents) {
            events.add(event);
        }
    }

    private static JsonObject tile(Tile tile) {
        JsonObject json = new JsonObject();
        json.addProperty("id", tile.getId());
        json.addProperty("type", tile.getType().name());
        json.addProperty("x", tile.getX());
        json.addProperty("y", tile.getY());
        return json;
    }

    private static JsonArray tiles(List<Tile> tiles) {
        JsonArray array = new JsonArray();
        for (Tile tile : tiles) {
            array.add(tile(tile));
        }
        return array;
    }
}
