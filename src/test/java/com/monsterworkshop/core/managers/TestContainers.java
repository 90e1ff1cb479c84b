package com.monsterworkshop.core.managers;

import com.google.gson.JsonObject;
import com.monsterworkshop.core.domain.entity.Entity;
import com.monsterworkshop.core.domain.tick.EntityUpdate;
import com.monsterworkshop.core.domain.tick.GameEvent;
import com.monsterworkshop.core.domain.tick.RawIntent;
import com.monsterworkshop.core.domain.tick.TickResult;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.UUID;

public class TestContainers {
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
    // WORKSHOPS
    // ==========================================================
    @Test
    public void pushIntoWorkshopStoresInput() {
        Entity monster = ZoneFixtures.monster(9, 5, player);
        Entity workshop = ZoneFixtures.workshop(10, 4, "spinning");
        Entity item = ZoneFixtures.item(10, 5, "pebble");

        TickResult result = tick(List.of(monster, workshop, item), ZoneFixtures.move(player, monster, "right"));

        EntityUpdate itemUpdate = result.updateFor(item.getId());
        Assert.assertEquals(Integer.valueOf(11), itemUpdate.x());
        JsonObject meta = itemUpdate.metadata();
        Assert.assertTrue(meta.get("is_stored").getAsBoolean());
        Assert.assertEquals(workshop.getId().toString(), meta.get("container_id").getAsString());
        Assert.assertEquals("input", meta.get("stored_role").getAsString());
        Assert.assertEquals(monster.getId().toString(), meta.get("last_transporter_monster_id").getAsString());

        Assert.assertEquals(item.getId().toString(),
                result.updateFor(workshop.getId()).metadata().getAsJsonArray("input_item_ids").get(0).getAsString());
        Assert.assertEquals(Integer.valueOf(10), result.updateFor(monster.getId()).x());
        Assert.assertNotNull(result.firstEvent("deposit"));
    }

    @Test
    public void toolGoesIntoToolColumn() {
        Entity monster = ZoneFixtures.monster(9, 5, player);
        Entity workshop = ZoneFixtures.workshop(10, 4, "carpentry");
        Entity hammer = ZoneFixtures.item(10, 5, "stone_hammer");

        TickResult result = tick(List.of(monster, workshop, hammer), ZoneFixtures.move(player, monster, "right"));

        JsonObject meta = result.updateFor(hammer.getId()).metadata();
        Assert.assertEquals("tool", meta.get("stored_role").getAsString());
        Assert.assertEquals(100, meta.get("durability").getAsInt());
        Assert.assertEquals(100, meta.get("max_durability").getAsInt());
        Assert.assertEquals("hammer", meta.getAsJsonArray("tool_tags").get(0).getAsString());
        Assert.assertEquals(1, result.updateFor(workshop.getId()).metadata().getAsJsonArray("tool_item_ids").size());
    }

    @Test
    public void workshopWallCellIsNotASlot() {
        Entity monster = ZoneFixtures.monster(8, 5, player);
        Entity workshop = ZoneFixtures.workshop(10, 4, "spinning");
        Entity item = ZoneFixtures.item(9, 5, "pebble");

        TickResult result = tick(List.of(monster, workshop, item), ZoneFixtures.move(player, monster, "right"));
        Assert.assertTrue(result.updates().isEmpty());
    }

    @Test
    public void occupiedSlotRefusesDeposit() {
        Entity monster = ZoneFixtures.monster(9, 5, player);
        Entity workshop = ZoneFixtures.workshop(10, 4, "spinning");
        Entity stored = ZoneFixtures.storedItem(workshop, 11, 5, "pebble", ContainerService.ROLE_INPUT);
        Entity item = ZoneFixtures.item(10, 5, "pebble");

        TickResult result = tick(List.of(monster, workshop, stored, item), ZoneFixtures.move(player, monster, "right"));
        Assert.assertNull(result.updateFor(item.getId()));
        Assert.assertNull(result.firstEvent("deposit"));
    }

    @Test
    public void gatheringSpotOnlyTakesTools() {
        Entity monster = ZoneFixtures.monster(9, 5, player);
        Entity spot = ZoneFixtures.gatheringSpot(10, 4);
        Entity item = ZoneFixtures.item(10, 5, "pebble");

        TickResult result = tick(List.of(monster, spot, item), ZoneFixtures.move(player, monster, "right"));
        Assert.assertNull(result.updateFor(item.getId()));
    }

    // ==========================================================
    // DISPENSERS
    // ==========================================================
    @Test
    public void dispenserDepositIsReleasedOntoItsCell() {
        Entity monster = ZoneFixtures.monster(5, 5, player);
        Entity item = ZoneFixtures.item(6, 5, "pebble");
        Entity dispenser = ZoneFixtures.dispenser(7, 5, null);

        TickResult result = tick(List.of(monster, item, dispenser), ZoneFixtures.move(player, monster, "right"));

        EntityUpdate itemUpdate = result.updateFor(item.getId());
        Assert.assertEquals(Integer.valueOf(7), itemUpdate.x());
        Assert.assertFalse(itemUpdate.metadata().get("is_stored").getAsBoolean());
        Assert.assertFalse(itemUpdate.metadata().has("container_id"));
        Assert.assertEquals("pebble", result.updateFor(dispenser.getId()).metadata().get("stored_good_type").getAsString());
        Assert.assertEquals(Integer.valueOf(6), result.updateFor(monster.getId()).x());

        GameEvent deposit = result.firstEvent("dispenser_deposit");
        Assert.assertEquals(dispenser.getId().toString(), deposit.get("dispenser_id").getAsString());
    }

    @Test
    public void dispenserKeepsItemWhileCellIsTaken() {
        Entity monster = ZoneFixtures.monster(5, 5, player);
        Entity item = ZoneFixtures.item(6, 5, "pebble");
        Entity dispenser = ZoneFixtures.dispenser(7, 5, null);
        Entity loose = ZoneFixtures.item(7, 5, "pebble");
        loose.getMetadata().addProperty("blocks_movement", false);

        TickResult result = tick(List.of(monster, item, dispenser, loose), ZoneFixtures.move(player, monster, "right"));
        Assert.assertTrue(result.updateFor(item.getId()).metadata().get("is_stored").getAsBoolean());
    }

    @Test
    public void dispenserRejectsOtherGoods() {
        Entity monster = ZoneFixtures.monster(5, 5, player);
        Entity item = ZoneFixtures.item(6, 5, "pebble");
        Entity dispenser = ZoneFixtures.dispenser(7, 5, "timber");

        TickResult result = tick(List.of(monster, item, dispenser), ZoneFixtures.move(player, monster, "right"));
        Assert.assertTrue(result.updates().isEmpty());
    }

    @Test
    public void fullDispenserRejects() {
        Entity monster = ZoneFixtures.monster(5, 5, player);
        Entity item = ZoneFixtures.item(6, 5, "pebble");
        Entity dispenser = ZoneFixtures.dispenser(7, 5, "pebble");
        dispenser.getMetadata().addProperty("capacity", 1);
        Entity stored = ZoneFixtures.storedItem(dispenser, 7, 5, "pebble", null);

        TickResult result = tick(List.of(monster, item, dispenser, stored), ZoneFixtures.move(player, monster, "right"));
        Assert.assertNull(result.updateFor(item.getId()));
        Assert.assertNull(result.firstEvent("dispenser_deposit"));
    }

    // ==========================================================
    // WAGONS
    // ==========================================================
    @Test
    public void hitchAndUnhitch() {
        Entity monster = ZoneFixtures.monster(5, 5, player);
        Entity wagon = ZoneFixtures.wagon(6, 5);

        TickResult hitched = tick(List.of(monster, wagon), wagonIntent("hitch_wagon", monster));
        Assert.assertEquals(wagon.getId().toString(), hitched.updateFor(monster.getId()).metadata()
                .getAsJsonObject("current_task").get("hitched_wagon_id").getAsString());
        Assert.assertEquals(monster.getId().toString(),
                hitched.updateFor(wagon.getId()).metadata().get("hitched_by").getAsString());
        Assert.assertNotNull(hitched.firstEvent("wagon_hitched"));

        monster.getMetadata().getAsJsonObject("current_task").addProperty("hitched_wagon_id", wagon.getId().toString());
        wagon.getMetadata().addProperty("hitched_by", monster.getId().toString());
        TickResult unhitched = tick(List.of(monster, wagon), wagonIntent("unhitch_wagon", monster));
        Assert.assertFalse(unhitched.updateFor(monster.getId()).metadata()
                .getAsJsonObject("current_task").has("hitched_wagon_id"));
        Assert.assertFalse(unhitched.updateFor(wagon.getId()).metadata().has("hitched_by"));
        Assert.assertNotNull(unhitched.firstEvent("wagon_unhitched"));
    }

    @Test
    public void hitchErrors() {
        Entity monster = ZoneFixtures.monster(5, 5, player);
        Assert.assertEquals("No wagon adjacent to monster",
                tick(List.of(monster), wagonIntent("hitch_wagon", monster)).firstEvent("error").message());
        Assert.assertEquals("Monster is not hitched to any wagon",
                tick(List.of(monster), wagonIntent("unhitch_wagon", monster)).firstEvent("error").message());

        Entity wagon = ZoneFixtures.wagon(6, 5);
        wagon.getMetadata().addProperty("hitched_by", UUID.randomUUID().toString());
        Assert.assertEquals("Wagon is already hitched",
                tick(List.of(monster, wagon), wagonIntent("hitch_wagon", monster)).firstEvent("error").message());

        monster.getMetadata().getAsJsonObject("current_task").addProperty("hitched_wagon_id", wagon.getId().toString());
        Assert.assertEquals("Monster is already hitched to a wagon",
                tick(List.of(monster, wagon), wagonIntent("hitch_wagon", monster)).firstEvent("error").message());
    }

    @Test
    public void pushLoadsWagon() {
        Entity monster = ZoneFixtures.monster(5, 5, player);
        Entity item = ZoneFixtures.item(6, 5, "pebble");
        Entity wagon = ZoneFixtures.wagon(7, 5);

        TickResult result = tick(List.of(monster, item, wagon), ZoneFixtures.move(player, monster, "right"));

        JsonObject itemMeta = result.updateFor(item.getId()).metadata();
        Assert.assertTrue(itemMeta.get("is_stored").getAsBoolean());
        Assert.assertEquals("wagon", itemMeta.get("stored_role").getAsString());
        JsonObject wagonMeta = result.updateFor(wagon.getId()).metadata();
        Assert.assertEquals(1, wagonMeta.get("loaded_item_count").getAsInt());
        Assert.assertEquals("pebble", wagonMeta.get("stored_good_type").getAsString());
        Assert.assertNotNull(result.firstEvent("wagon_loaded"));
    }

    @Test
    public void wagonRejectsMixedCargo() {
        Entity monster = ZoneFixtures.monster(5, 5, player);
        Entity item = ZoneFixtures.item(6, 5, "pebble");
        Entity wagon = ZoneFixtures.wagon(7, 5);
        wagon.getMetadata().addProperty("stored_good_type", "timber");

        TickResult result = tick(List.of(monster, item, wagon), ZoneFixtures.move(player, monster, "right"));
        Assert.assertEquals("type_mismatch", result.firstEvent("wagon_reject").get("reason").getAsString());
        Assert.assertNull(result.updateFor(item.getId()));
    }

    @Test
    public void unloadDropsFirstItemNextToWagon() {
        Entity monster = ZoneFixtures.monster(6, 5, player);
        Entity wagon = ZoneFixtures.wagon(7, 5);
        Entity cargo = ZoneFixtures.storedItem(wagon, 7, 5, "pebble", WagonService.ROLE_WAGON);
        monster.getMetadata().getAsJsonObject("current_task").addProperty("hitched_wagon_id", wagon.getId().toString());
        wagon.getMetadata().addProperty("hitched_by", monster.getId().toString());

        TickResult result = tick(List.of(monster, wagon, cargo), wagonIntent("unload_wagon", monster));

        EntityUpdate update = result.updateFor(cargo.getId());
        Assert.assertEquals(Integer.valueOf(6), update.x());
        Assert.assertEquals(Integer.valueOf(4), update.y());
        Assert.assertFalse(update.metadata().get("is_stored").getAsBoolean());
        Assert.assertNotNull(result.firstEvent("wagon_unloaded"));
    }

    @Test
    public void unloadEmptyWagon() {
        Entity monster = ZoneFixtures.monster(6, 5, player);
        Entity wagon = ZoneFixtures.wagon(7, 5);
        monster.getMetadata().getAsJsonObject("current_task").addProperty("hitched_wagon_id", wagon.getId().toString());

        TickResult result = tick(List.of(monster, wagon), wagonIntent("unload_wagon", monster));
        Assert.assertEquals("Wagon has no items to unload", result.firstEvent("error").message());
    }

    @Test
    public void cargoRidesAlong() {
        Entity monster = ZoneFixtures.monster(5, 5, player);
        Entity wagon = ZoneFixtures.wagon(4, 5);
        Entity cargo = ZoneFixtures.storedItem(wagon, 4, 5, "pebble", WagonService.ROLE_WAGON);
        monster.getMetadata().getAsJsonObject("current_task").addProperty("hitched_wagon_id", wagon.getId().toString());

        TickResult result = tick(List.of(monster, wagon, cargo), ZoneFixtures.move(player, monster, "down"));
        Assert.assertEquals(Integer.valueOf(5), result.updateFor(wagon.getId()).x());
        Assert.assertEquals(Integer.valueOf(5), result.updateFor(cargo.getId()).x());
        Assert.assertEquals(Integer.valueOf(5), result.updateFor(cargo.getId()).y());
    }

    private TickResult tick(List<Entity> entities, RawIntent... intents) {
        return engine.tick(zoneId, entities, List.of(intents), 1);
    }

    private RawIntent wagonIntent(String action, Entity monster) {
        return ZoneFixtures.intent(player, action, "monster_id", monster.getId());
    }
}
