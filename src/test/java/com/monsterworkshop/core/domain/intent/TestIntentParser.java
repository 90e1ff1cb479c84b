package com.monsterworkshop.core.domain.intent;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.monsterworkshop.core.common.GridPosition;
import com.monsterworkshop.core.domain.tick.RawIntent;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.UUID;

public class TestIntentParser {
    private final UUID player = UUID.randomUUID();

    private Intent parse(String json) {
        JsonObject data = JsonParser.parseString(json).getAsJsonObject();
        return IntentParser.parse(new RawIntent(player, data));
    }

    private static GridPosition delta(String json) {
        return IntentParser.parseDelta(JsonParser.parseString(json).getAsJsonObject());
    }

    @Test
    public void moveAndPushShareOneShape() {
        UUID monster = UUID.randomUUID();
        Intent move = parse("{\"action\":\"move\",\"entity_id\":\"" + monster + "\",\"direction\":\"up\"}");
        Intent push = parse("{\"action\":\"push\",\"entity_id\":\"" + monster + "\",\"dx\":1}");

        Assert.assertTrue(move instanceof Intent.Move);
        Intent.Move m = (Intent.Move) move;
        Assert.assertEquals(player, m.playerId());
        Assert.assertEquals(monster, m.entityId());
        Assert.assertEquals(new GridPosition(0, -1), m.delta());
        Assert.assertEquals(new GridPosition(1, 0), ((Intent.Move) push).delta());
    }

    @Test
    public void deltaRules() {
        // a named direction wins over dx/dy
        Assert.assertEquals(new GridPosition(-1, 0), delta("{\"direction\":\"left\",\"dx\":1}"));
        Assert.assertEquals(new GridPosition(1, -1), delta("{\"dx\":5,\"dy\":-7}"));
        Assert.assertEquals(new GridPosition(0, 1), delta("{\"dy\":1}"));
        Assert.assertEquals(new GridPosition(0, 0), delta("{\"dx\":0.5}"));
        Assert.assertEquals(new GridPosition(0, 0), delta("{\"dx\":1.0}"));
        Assert.assertEquals(new GridPosition(0, 0), delta("{\"dx\":\"1\"}"));
        Assert.assertEquals(new GridPosition(0, 0), delta("{\"dx\":[1]}"));
        Assert.assertEquals(new GridPosition(0, 0), delta("{\"direction\":\"sideways\"}"));
    }

    @Test
    public void spawnDefaults() {
        Intent.SpawnMonster spawn = (Intent.SpawnMonster) parse("{\"action\":\"spawn_monster\"}");
        Assert.assertEquals("goblin", spawn.monsterType());
        Assert.assertEquals("Monster", spawn.name());
        Assert.assertNull(spawn.transferableSkills());

        spawn = (Intent.SpawnMonster) parse("{\"action\":\"spawn_monster\",\"monster_type\":\"ORC\","
                + "\"name\":\"Grok\",\"transferable_skills\":[\"Music\",null,3]}");
        Assert.assertEquals("orc", spawn.monsterType());
        Assert.assertEquals("Grok", spawn.name());
        Assert.assertEquals(List.of("Music", "", "3"), spawn.transferableSkills());
    }

    @Test
    public void monsterIdFallsBackToEntityId() {
        UUID monster = UUID.randomUUID();
        Intent.HitchWagon hitch = (Intent.HitchWagon) parse(
                "{\"action\":\"hitch_wagon\",\"entity_id\":\"" + monster + "\"}");
        Assert.assertEquals(monster, hitch.monsterId());

        UUID other = UUID.randomUUID();
        Intent.RecordingStart rec = (Intent.RecordingStart) parse("{\"action\":\"recording_start\",\"monster_id\":\""
                + other + "\",\"entity_id\":\"" + monster + "\"}");
        Assert.assertEquals(other, rec.monsterId());
    }

    @Test
    public void selectRecipeAndInteract() {
        UUID workshop = UUID.randomUUID();
        Intent.SelectRecipe select = (Intent.SelectRecipe) parse("{\"action\":\"select_recipe\",\"workshop_id\":\""
                + workshop + "\",\"recipe_id\":\"Cotton Thread\"}");
        Assert.assertEquals(workshop, select.workshopId());
        Assert.assertEquals("Cotton Thread", select.recipeId());
        Assert.assertNull(select.monsterId());

        Intent.Interact interact = (Intent.Interact) parse("{\"action\":\"interact\",\"monster_id\":\"not-a-uuid\"}");
        Assert.assertNull(interact.monsterId());
        Assert.assertNull(interact.targetId());
    }

    @Test
    public void unknownAndMissingActions() {
        Intent unknown = parse("{\"action\":\"dance\"}");
        Assert.assertEquals("dance", ((Intent.Unsupported) unknown).action());
        Assert.assertTrue(parse("{\"direction\":\"up\"}") instanceof Intent.Ignored);
        Assert.assertTrue(parse("{\"action\":\"\"}") instanceof Intent.Ignored);
    }

    @Test
    public void disconnectNamesThePlayer() {
        UUID gone = UUID.randomUUID();
        Intent.OwnerDisconnect d = (Intent.OwnerDisconnect) parse(
                "{\"action\":\"owner_disconnect\",\"player_id\":\"" + gone + "\"}");
        Assert.assertEquals(gone, d.disconnectedPlayerId());
    }
}
