package com.monsterworkshop.core.managers;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.monsterworkshop.core.domain.catalog.GameCatalogs;
import com.monsterworkshop.core.domain.catalog.ZoneDefinition;
import com.monsterworkshop.core.domain.entity.Entity;
import com.monsterworkshop.core.domain.entity.EntityKind;
import com.monsterworkshop.core.domain.tick.EntityCreate;
import com.monsterworkshop.core.domain.tick.TickResult;
import com.monsterworkshop.core.infrastructure.InMemoryZoneRepository;
import com.monsterworkshop.core.ports.IZoneRepository;
import com.monsterworkshop.core.ports.ZoneRecord;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Random;
import java.util.UUID;

public class TestZoneTickEngine {

    // ==========================================================
    // ZONE SETUP
    // ==========================================================
    @Test
    public void initializeZonesCreatesMissingZones() {
        InMemoryZoneRepository repo = new InMemoryZoneRepository();
        ZoneTickEngine engine = new ZoneTickEngine(ZoneFixtures.CATALOGS, new Random(1), ZoneFixtures.CLOCK);

        engine.initializeZones(repo);

        ZoneRecord zone = repo.findZoneByName("Starting Village");
        Assert.assertNotNull(zone);
        Assert.assertEquals(60, zone.width());
        Assert.assertEquals(20, zone.height());
        Assert.assertEquals(ZoneTickEngine.ZONE_SOURCE, zone.metadata().get("source").getAsString());
        Assert.assertTrue(engine.getRegisteredZoneIds().contains(zone.id()));
        Assert.assertEquals("Starting Village", engine.getZoneDefinition(zone.id()).name());
    }

    @Test
    public void initializeZonesReusesExistingZone() {
        InMemoryZoneRepository repo = new InMemoryZoneRepository();
        ZoneRecord existing = repo.createZone("Starting Village", 60, 20, new JsonObject());
        ZoneTickEngine engine = new ZoneTickEngine(ZoneFixtures.CATALOGS, new Random(1), ZoneFixtures.CLOCK);

        engine.initializeZones(repo);

        Assert.assertEquals(1, repo.getAll().size());
        Assert.assertEquals(existing.id(), repo.getAll().get(0).id());
        Assert.assertNotNull(engine.getZoneDefinition(existing.id()));
    }

    @Test
    public void withoutZoneDataTheDefaultZoneIsUsed() {
        InMemoryZoneRepository repo = new InMemoryZoneRepository();
        ZoneTickEngine engine = new ZoneTickEngine(GameCatalogs.builtInDefaults(), new Random(1), ZoneFixtures.CLOCK);

        engine.initializeZones(repo);
        Assert.assertNotNull(repo.findZoneByName(ZoneDefinition.DEFAULT_NAME));
    }

    @Test(expected = IllegalStateException.class)
    public void failingRepositoryAbortsStartup() {
        IZoneRepository broken = new IZoneRepository() {
            @Override
            public ZoneRecord findZoneByName(String name) {
                return null;
            }

            @Override
            public ZoneRecord createZone(String name, int width, int height, JsonObject metadata) {
                return null;
            }
        };
        new ZoneTickEngine(ZoneFixtures.CATALOGS, new Random(1), ZoneFixtures.CLOCK).initializeZones(broken);
    }

    @Test
    public void unknownZoneUsesDefaultSize() {
        ZoneTickEngine engine = new ZoneTickEngine(ZoneFixtures.CATALOGS, new Random(1), ZoneFixtures.CLOCK);
        UUID zoneId = UUID.randomUUID();
        Assert.assertEquals(ZoneTickEngine.DEFAULT_ZONE_WIDTH, engine.getZoneSize(zoneId).width());
        Assert.assertNull(engine.getZoneDefinition(zoneId));
        Assert.assertFalse(engine.isInitialized(zoneId));
    }

    // ==========================================================
    // BOOTSTRAP
    // ==========================================================
    @Test
    public void firstTickPopulatesZone() {
        InMemoryZoneRepository repo = new InMemoryZoneRepository();
        ZoneTickEngine engine = new ZoneTickEngine(ZoneFixtures.CATALOGS, new Random(1), ZoneFixtures.CLOCK);
        engine.initializeZones(repo);
        UUID zoneId = repo.findZoneByName("Starting Village").id();

        TickResult result = engine.tick(zoneId, List.of(), List.of(), 1);

        // marker, four walls, nine static entities
        Assert.assertEquals(14, result.creates().size());
        EntityCreate marker = result.creates().get(0);
        Assert.assertEquals(EntityKind.WORLD_MARKER, marker.kind());
        Assert.assertEquals("Starting Village", marker.metadata().get("zone_name").getAsString());
        Assert.assertEquals(60, marker.metadata().get("width").getAsInt());

        int walls = 0;
        for (EntityCreate c : result.creates()) {
            if (c.kind() == EntityKind.TERRAIN_BLOCK) walls++;
            if (c.kind() == EntityKind.GATHERING_SPOT || c.kind() == EntityKind.WORKSHOP) {
                Assert.assertFalse(c.metadata().get("blocks_movement").getAsBoolean());
            }
            if (c.kind() == EntityKind.SIGNPOST) {
                Assert.assertFalse(c.metadata().has("blocks_movement"));
            }
        }
        Assert.assertEquals(4, walls);
        Assert.assertTrue(engine.isInitialized(zoneId));

        TickResult second = engine.tick(zoneId, List.of(), List.of(), 2);
        Assert.assertTrue(second.creates().isEmpty());
    }

    @Test
    public void unregisteredZoneGetsMarkerAndWalls() {
        ZoneTickEngine engine = new ZoneTickEngine(ZoneFixtures.CATALOGS, new Random(1), ZoneFixtures.CLOCK);
        TickResult result = engine.tick(UUID.randomUUID(), List.of(), List.of(), 1);

        Assert.assertEquals(5, result.creates().size());
        JsonObject marker = result.creates().get(0).metadata();
        Assert.assertEquals(ZoneDefinition.DEFAULT_NAME, marker.get("zone_name").getAsString());
        Assert.assertEquals(100, marker.get("width").getAsInt());
        EntityCreate bottom = result.creates().get(2);
        Assert.assertEquals(99, bottom.y());
        Assert.assertEquals(100, bottom.width());
    }

    @Test
    public void existingMarkerSkipsBootstrap() {
        ZoneTickEngine engine = new ZoneTickEngine(ZoneFixtures.CATALOGS, new Random(1), ZoneFixtures.CLOCK);
        UUID zoneId = UUID.randomUUID();
        JsonObject meta = new JsonObject();
        meta.addProperty("kind", "world_marker");
        Entity marker = new Entity(UUID.randomUUID(), 0, 0, 0, 0, null, meta);

        TickResult result = engine.tick(zoneId, List.of(marker), List.of(), 1);
        Assert.assertTrue(result.creates().isEmpty());
        Assert.assertTrue(engine.isInitialized(zoneId));
    }

    @Test
    public void emptyTickProducesEmptyDiff() {
        UUID zoneId = UUID.randomUUID();
        ZoneTickEngine engine = ZoneFixtures.engine(zoneId);
        Entity monster = ZoneFixtures.monster(5, 5, UUID.randomUUID());

        TickResult result = engine.tick(zoneId, List.of(monster), null, 1);
        Assert.assertTrue(result.creates().isEmpty());
        Assert.assertTrue(result.updates().isEmpty());
        Assert.assertTrue(result.deletes().isEmpty());
        Assert.assertTrue(result.events().isEmpty());
        Assert.assertEquals(0, result.extras().size());
    }

    // ==========================================================
    // PLAYER VIEW
    // ==========================================================
    @Test
    public void playerStateDropsOtherPlayersEvents() {
        ZoneTickEngine engine = new ZoneTickEngine(ZoneFixtures.CATALOGS, new Random(1), ZoneFixtures.CLOCK);
        UUID viewer = UUID.randomUUID();
        UUID other = UUID.randomUUID();

        JsonArray events = new JsonArray();
        events.add(event("push", viewer));
        events.add(event("error", other));
        events.add(event("delivery", null));
        JsonObject full = new JsonObject();
        full.add("events", events);
        full.add("entities", new JsonArray());

        JsonObject view = engine.getPlayerState(UUID.randomUUID(), viewer, full);

        JsonArray seen = view.getAsJsonArray("events");
        Assert.assertEquals(2, seen.size());
        Assert.assertEquals("push", seen.get(0).getAsJsonObject().get("type").getAsString());
        Assert.assertEquals("delivery", seen.get(1).getAsJsonObject().get("type").getAsString());
        Assert.assertEquals(viewer.toString(), view.get("viewer_id").getAsString());
        // the shared state is left alone
        Assert.assertEquals(3, full.getAsJsonArray("events").size());
        Assert.assertFalse(full.has("viewer_id"));
    }

    @Test
    public void playerStateWithoutEvents() {
        ZoneTickEngine engine = new ZoneTickEngine(ZoneFixtures.CATALOGS, new Random(1), ZoneFixtures.CLOCK);
        UUID viewer = UUID.randomUUID();
        JsonObject view = engine.getPlayerState(UUID.randomUUID(), viewer, null);
        Assert.assertEquals(viewer.toString(), view.get("viewer_id").getAsString());
        Assert.assertFalse(view.has("events"));
    }

    private static JsonObject event(String type, UUID target) {
        JsonObject e = new JsonObject();
        e.addProperty("type", type);
        if (target != null) e.addProperty("target_player_id", target.toString());
        return e;
    }
}
