package com.monsterworkshop.core.synchronization;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.monsterworkshop.core.domain.catalog.GameCatalogs;
import com.monsterworkshop.core.domain.entity.Entity;
import com.monsterworkshop.core.domain.tick.RawIntent;
import com.monsterworkshop.core.domain.tick.TickResult;
import com.monsterworkshop.core.managers.ZoneTickEngine;
import org.junit.Assert;
import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;
import java.util.UUID;

public class TestZoneTickLoop {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    public void firstTickPopulatesRegisteredZone() {
        ZoneTickEngine engine = new ZoneTickEngine(GameCatalogs.builtInDefaults(), new Random(1), CLOCK);
        ZoneTickLoop loop = new ZoneTickLoop(engine, 1000);
        UUID zoneId = UUID.randomUUID();
        ZoneWorldState zone = loop.register(zoneId);
        Assert.assertSame(zone, loop.register(zoneId));
        Assert.assertSame(zone, loop.getZone(zoneId));

        loop.runTick(1);

        // world marker plus four walls
        Assert.assertEquals(5, zone.size());
        Assert.assertEquals(1, zone.getLastTick());
        Assert.assertFalse(loop.isRunning());
    }

    @Test
    public void queuedSpawnBecomesEntities() {
        ZoneTickEngine engine = new ZoneTickEngine(GameCatalogs.builtInDefaults(), new Random(1), CLOCK);
        ZoneTickLoop loop = new ZoneTickLoop(engine, 1000);
        UUID zoneId = UUID.randomUUID();
        ZoneWorldState zone = loop.register(zoneId);
        loop.runTick(1);

        JsonObject spawn = new JsonObject();
        spawn.addProperty("action", "spawn_monster");
        spawn.addProperty("monster_type", "troll");
        JsonArray skills = new JsonArray();
        skills.add("Music");
        skills.add("Social");
        skills.add("Writing");
        spawn.add("transferable_skills", skills);
        zone.submit(new RawIntent(UUID.randomUUID(), spawn));
        loop.runTick(2);

        // commune and monster
        Assert.assertEquals(7, zone.size());
        Assert.assertTrue(zone.drainIntents().isEmpty());
    }

    @Test
    public void failingZoneDoesNotStopOthers() {
        ZoneTickEngine engine = new ZoneTickEngine(GameCatalogs.builtInDefaults(), new Random(1), CLOCK) {
            @Override
            public TickResult tick(UUID zoneId, List<Entity> entities, List<RawIntent> intents, long tickNumber) {
                if (entities.size() == 1) throw new IllegalStateException("boom");
                return super.tick(zoneId, entities, intents, tickNumber);
            }
        };
        ZoneTickLoop loop = new ZoneTickLoop(engine, 1000);
        ZoneWorldState broken = loop.register(UUID.randomUUID());
        JsonObject meta = new JsonObject();
        meta.addProperty("kind", "signpost");
        broken.put(new Entity(UUID.randomUUID(), 1, 1, 1, 1, null, meta));
        ZoneWorldState healthy = loop.register(UUID.randomUUID());

        loop.runTick(1);

        Assert.assertEquals(1, broken.size());
        Assert.assertEquals(0, broken.getLastTick());
        Assert.assertEquals(5, healthy.size());
    }

    @Test
    public void startAndStop() {
        ZoneTickEngine engine = new ZoneTickEngine(GameCatalogs.builtInDefaults(), new Random(1), CLOCK);
        ZoneTickLoop loop = new ZoneTickLoop(engine, 50);
        loop.start();
        Assert.assertTrue(loop.isRunning());
        loop.stop();
        Assert.assertFalse(loop.isRunning());
    }
}
