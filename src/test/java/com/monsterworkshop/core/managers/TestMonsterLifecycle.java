package com.monsterworkshop.core.managers;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.monsterworkshop.core.domain.entity.Entity;
import com.monsterworkshop.core.domain.entity.EntityKind;
import com.monsterworkshop.core.domain.tick.EntityCreate;
import com.monsterworkshop.core.domain.tick.GameEvent;
import com.monsterworkshop.core.domain.tick.RawIntent;
import com.monsterworkshop.core.domain.tick.TickResult;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.UUID;

public class TestMonsterLifecycle {
    private UUID zoneId;
    private UUID player;
    private ZoneTickEngine engine;

    @Before
    public void setUp() {
        zoneId = UUID.randomUUID();
        player = UUID.randomUUID();
        engine = ZoneFixtures.engine(zoneId);
    }

    // ==========================================================
    // SPAWN
    // ==========================================================
    @Test
    public void spawnGoblinCreatesCommuneAndMonster() {
        TickResult result = tick(List.of(), spawn("goblin", "Mathematics", "science", "Handcrafts"));

        Assert.assertEquals(2, result.creates().size());
        EntityCreate commune = result.creates().get(0);
        Assert.assertEquals(EntityKind.COMMUNE, commune.kind());
        Assert.assertEquals(player, commune.ownerId());
        Assert.assertEquals(950, commune.metadata().get("renown").getAsInt());
        Assert.assertEquals(50, commune.metadata().get("total_renown_spent").getAsInt());

        EntityCreate monster = result.creates().get(1);
        Assert.assertEquals(EntityKind.MONSTER, monster.kind());
        Assert.assertEquals(3, monster.x());
        Assert.assertEquals(3, monster.y());
        Assert.assertEquals(1, monster.width());
        Assert.assertEquals(player, monster.ownerId());

        JsonObject meta = monster.metadata();
        Assert.assertEquals("Gob", meta.get("name").getAsString());
        Assert.assertEquals("goblin", meta.get("monster_type").getAsString());
        Assert.assertEquals(8, meta.getAsJsonObject("stats").get("str").getAsInt());
        Assert.assertEquals(18, meta.getAsJsonObject("stats").get("dex").getAsInt());
        Assert.assertEquals(150, meta.get("body_cap").getAsInt());
        Assert.assertEquals(50, meta.get("mind_cap").getAsInt());
        Assert.assertTrue(meta.get("online").getAsBoolean());
        Assert.assertEquals("2025-01-01T00:00:00", meta.get("created_at").getAsString());
        Assert.assertEquals(0.0, meta.get("total_forgotten").getAsDouble(), 0.0);

        JsonArray transferable = meta.getAsJsonObject("skills").getAsJsonArray("transferable");
        Assert.assertEquals("mathematics", transferable.get(0).getAsString());
        Assert.assertEquals("science", transferable.get(1).getAsString());
        Assert.assertEquals("handcrafts", transferable.get(2).getAsString());

        JsonObject task = meta.getAsJsonObject("current_task");
        Assert.assertFalse(task.get("is_recording").getAsBoolean());
        Assert.assertEquals(0, task.getAsJsonArray("actions").size());

        GameEvent spawned = result.firstEvent("spawned");
        Assert.assertEquals("Spawned Gob", spawned.message());
        Assert.assertEquals(player, spawned.targetPlayerId());
    }

    @Test
    public void spawnTooExpensive() {
        TickResult result = tick(List.of(), spawn("orc", "mathematics", "science", "music"));
        Assert.assertEquals("Not enough renown (1000 < 2000)", result.firstEvent("error").message());
        for (EntityCreate c : result.creates()) {
            Assert.assertNotEquals(EntityKind.MONSTER, c.kind());
        }
    }

    @Test
    public void spawnCostInflatesWithSpending() {
        Entity commune = ZoneFixtures.commune(player, 1000, 10000);
        TickResult result = tick(List.of(commune), spawn("goblin", "mathematics", "science", "music"));

        // multiplier 1 + 10 * 0.1 = 2.0
        JsonObject meta = result.updateFor(commune.getId()).metadata();
        Assert.assertEquals(900, meta.get("renown").getAsInt());
        Assert.assertEquals(10100, meta.get("total_renown_spent").getAsInt());
        Assert.assertEquals(1, result.creates().size());
    }

    @Test
    public void costMultiplierIsCapped() {
        Assert.assertEquals(1.0, EconomyService.costMultiplier(0), 0.0001);
        Assert.assertEquals(1.5, EconomyService.costMultiplier(5000), 0.0001);
        Assert.assertEquals(3.0, EconomyService.costMultiplier(1_000_000), 0.0001);
    }

    @Test
    public void spawnValidation() {
        Assert.assertEquals("Unknown monster type: dragon",
                tick(List.of(), spawn("dragon", "mathematics", "science", "music")).firstEvent("error").message());
        Assert.assertEquals("Must select exactly 3 transferable skills",
                tick(List.of(), spawn("goblin", "mathematics", "science")).firstEvent("error").message());
        Assert.assertEquals("Invalid transferable skills: juggling",
                tick(List.of(), spawn("goblin", "mathematics", "juggling", "science")).firstEvent("error").message());
        Assert.assertEquals("Duplicate transferable skills selected",
                tick(List.of(), spawn("goblin", "science", "Science", "music")).firstEvent("error").message());

        RawIntent notAList = ZoneFixtures.intent(player, "spawn_monster", "monster_type", "goblin", "transferable_skills", "science");
        Assert.assertEquals("Transferable skills must be a list", tick(List.of(), notAList).firstEvent("error").message());
    }

    @Test
    public void rejectedSpawnCreatesNoMonster() {
        TickResult result = tick(List.of(), spawn("goblin", "mathematics"));
        Assert.assertTrue(result.creates().isEmpty());
    }

    @Test
    public void spawnSkipsOccupiedSpawnPoint() {
        Entity blocker = ZoneFixtures.monster(3, 3, UUID.randomUUID());
        TickResult result = tick(List.of(blocker), spawn("goblin", "mathematics", "science", "music"));
        EntityCreate monster = result.creates().get(1);
        Assert.assertEquals(EntityKind.MONSTER, monster.kind());
        Assert.assertEquals(ZoneBootstrapService.FALLBACK_SPAWN.x(), monster.x());
        Assert.assertEquals(ZoneBootstrapService.FALLBACK_SPAWN.y(), monster.y());
    }

    // ==========================================================
    // DISCONNECT
    // ==========================================================
    @Test
    public void ownerDisconnectTakesMonstersOffline() {
        Entity mine = ZoneFixtures.monster(5, 5, player);
        Entity theirs = ZoneFixtures.monster(8, 5, UUID.randomUUID());
        RawIntent intent = ZoneFixtures.intent(UUID.randomUUID(), "owner_disconnect", "player_id", player);
        TickResult result = tick(List.of(mine, theirs), intent);

        Assert.assertFalse(result.updateFor(mine.getId()).metadata().get("online").getAsBoolean());
        Assert.assertNull(result.updateFor(theirs.getId()));
        GameEvent event = result.firstEvent("disconnect");
        Assert.assertEquals("Player disconnected", event.message());
        Assert.assertEquals(player, event.targetPlayerId());
    }

    // ==========================================================
    // RECORDING / AUTOREPEAT
    // ==========================================================
    @Test
    public void recordingStartClearsOldActions() {
        Entity monster = ZoneFixtures.monster(5, 5, player);
        task(monster).getAsJsonArray("actions").add(step("move", 1, 0));
        TickResult result = tick(List.of(monster), ZoneFixtures.intent(player, "recording_start", "monster_id", monster.getId()));

        JsonObject task = result.updateFor(monster.getId()).metadata().getAsJsonObject("current_task");
        Assert.assertTrue(task.get("is_recording").getAsBoolean());
        Assert.assertEquals(0, task.getAsJsonArray("actions").size());
        Assert.assertNotNull(result.firstEvent("recording_started"));
    }

    @Test
    public void recordingStopKeepsActions() {
        Entity monster = ZoneFixtures.monster(5, 5, player);
        task(monster).addProperty("is_recording", true);
        task(monster).getAsJsonArray("actions").add(step("move", 1, 0));
        TickResult result = tick(List.of(monster), ZoneFixtures.intent(player, "recording_stop", "entity_id", monster.getId()));

        JsonObject task = result.updateFor(monster.getId()).metadata().getAsJsonObject("current_task");
        Assert.assertFalse(task.get("is_recording").getAsBoolean());
        Assert.assertEquals(1, task.getAsJsonArray("actions").size());
        Assert.assertNotNull(result.firstEvent("recording_stopped"));
    }

    @Test
    public void autorepeatNeedsActions() {
        Entity monster = ZoneFixtures.monster(5, 5, player);
        TickResult result = tick(List.of(monster), ZoneFixtures.intent(player, "autorepeat_start", "monster_id", monster.getId()));
        Assert.assertEquals("No recorded actions to replay", result.firstEvent("error").message());
        Assert.assertNull(result.updateFor(monster.getId()));
    }

    @Test
    public void autorepeatPlaysFirstStepRightAway() {
        Entity monster = ZoneFixtures.monster(5, 5, player);
        task(monster).getAsJsonArray("actions").add(step("move", 1, 0));
        task(monster).getAsJsonArray("actions").add(step("move", -1, 0));
        TickResult result = tick(List.of(monster), ZoneFixtures.intent(player, "autorepeat_start", "monster_id", monster.getId()));

        Assert.assertNotNull(result.firstEvent("autorepeat_started"));
        Assert.assertNotNull(result.firstEvent("autorepeat_step"));
        Assert.assertEquals(Integer.valueOf(6), result.updateFor(monster.getId()).x());
        JsonObject task = result.updateFor(monster.getId()).metadata().getAsJsonObject("current_task");
        Assert.assertTrue(task.get("is_playing").getAsBoolean());
        Assert.assertEquals(1, task.get("play_index").getAsInt());
    }

    @Test
    public void autorepeatWrapsAround() {
        Entity monster = ZoneFixtures.monster(6, 5, player);
        task(monster).addProperty("is_playing", true);
        task(monster).addProperty("play_index", 1);
        task(monster).getAsJsonArray("actions").add(step("move", 1, 0));
        task(monster).getAsJsonArray("actions").add(step("move", -1, 0));
        TickResult result = tick(List.of(monster));

        Assert.assertEquals(Integer.valueOf(5), result.updateFor(monster.getId()).x());
        Assert.assertEquals(0, result.updateFor(monster.getId()).metadata()
                .getAsJsonObject("current_task").get("play_index").getAsInt());
    }

    @Test
    public void blockedReplayStopsPlayback() {
        Entity monster = ZoneFixtures.monster(5, 5, player);
        Entity wall = ZoneFixtures.monster(6, 5, UUID.randomUUID());
        task(monster).addProperty("is_playing", true);
        task(monster).getAsJsonArray("actions").add(step("move", 1, 0));
        TickResult result = tick(List.of(monster, wall));

        Assert.assertNull(result.updateFor(monster.getId()).x());
        Assert.assertFalse(result.updateFor(monster.getId()).metadata()
                .getAsJsonObject("current_task").get("is_playing").getAsBoolean());
        Assert.assertNull(result.firstEvent("autorepeat_step"));
    }

    @Test
    public void autorepeatReplaysPush() {
        Entity monster = ZoneFixtures.monster(5, 5, player);
        Entity item = ZoneFixtures.item(6, 5, "pebble");
        task(monster).addProperty("is_playing", true);
        task(monster).getAsJsonArray("actions").add(step("push", 1, 0));
        TickResult result = tick(List.of(monster, item));

        Assert.assertEquals(Integer.valueOf(7), result.updateFor(item.getId()).x());
        Assert.assertEquals(Integer.valueOf(6), result.updateFor(monster.getId()).x());
    }

    @Test
    public void autorepeatStop() {
        Entity monster = ZoneFixtures.monster(5, 5, player);
        task(monster).addProperty("is_playing", true);
        task(monster).getAsJsonArray("actions").add(step("move", 1, 0));
        TickResult result = tick(List.of(monster), ZoneFixtures.intent(player, "autorepeat_stop", "monster_id", monster.getId()));

        Assert.assertNotNull(result.firstEvent("autorepeat_stopped"));
        Assert.assertNull(result.updateFor(monster.getId()).x());
        Assert.assertFalse(result.updateFor(monster.getId()).metadata()
                .getAsJsonObject("current_task").get("is_playing").getAsBoolean());
    }

    // ==========================================================
    // OTHER INTENTS
    // ==========================================================
    @Test
    public void interactWithAdjacentEntity() {
        Entity monster = ZoneFixtures.monster(5, 5, player);
        Entity item = ZoneFixtures.item(5, 6, "pebble");
        TickResult result = tick(List.of(monster, item), ZoneFixtures.intent(player, "interact", "monster_id", monster.getId()));
        Assert.assertEquals(item.getId().toString(), result.firstEvent("interact").get("entity_id").getAsString());
    }

    @Test
    public void interactWithNothing() {
        Entity monster = ZoneFixtures.monster(5, 5, player);
        TickResult result = tick(List.of(monster), ZoneFixtures.intent(player, "interact", "monster_id", monster.getId()));
        Assert.assertEquals("Nothing to interact with", result.firstEvent("message").message());
    }

    @Test
    public void unsupportedActionWarns() {
        TickResult result = tick(List.of(), ZoneFixtures.intent(player, "dance"));
        GameEvent warning = result.firstEvent("warning");
        Assert.assertEquals("Unsupported action: dance", warning.message());
        Assert.assertEquals(player, warning.targetPlayerId());
    }

    private TickResult tick(List<Entity> entities, RawIntent... intents) {
        return engine.tick(zoneId, entities, List.of(intents), 1);
    }

    private RawIntent spawn(String type, String... skills) {
        return ZoneFixtures.intent(player, "spawn_monster", "monster_type", type, "name", "Gob", "transferable_skills", skills);
    }

    private static JsonObject task(Entity monster) {
        return monster.getMetadata().getAsJsonObject("current_task");
    }

    private static JsonObject step(String action, int dx, int dy) {
        JsonObject step = new JsonObject();
        step.addProperty("action", action);
        step.addProperty("dx", dx);
        step.addProperty("dy", dy);
        return step;
    }
}
