package com.monsterworkshop.core.managers;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.GameTime;
import com.monsterworkshop.core.common.GridSize;
import com.monsterworkshop.core.common.JsonFields;
import com.monsterworkshop.core.domain.catalog.GameCatalogs;
import com.monsterworkshop.core.domain.catalog.ZoneDefinition;
import com.monsterworkshop.core.domain.entity.Entity;
import com.monsterworkshop.core.domain.entity.EntityKind;
import com.monsterworkshop.core.domain.intent.IntentParser;
import com.monsterworkshop.core.domain.tick.RawIntent;
import com.monsterworkshop.core.domain.tick.TickResult;
import com.monsterworkshop.core.ports.IZoneRepository;
import com.monsterworkshop.core.ports.ZoneRecord;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Deterministic per-zone simulation step.
 *
 * A tick takes the zone's entities plus the player intents received since the
 * previous tick and returns the diff to apply. Inputs are never mutated.
 * Different zones may be ticked concurrently; a single zone must not be.
 */
public class ZoneTickEngine {

    public static final int DEFAULT_ZONE_WIDTH = 100;
    public static final int DEFAULT_ZONE_HEIGHT = 100;
    public static final String ZONE_SOURCE = "monster_workshop";

    private final GameCatalogs catalogs;
    private final Random defaultRng;
    private final Clock clock;

    private final Map<UUID, ZoneDefinition> zoneDefinitions = new ConcurrentHashMap<>();
    private final Map<UUID, GridSize> zoneSizes = new ConcurrentHashMap<>();
    private final Set<UUID> initializedZones = ConcurrentHashMap.newKeySet();

    // split responsibilities
    private final ZoneGeometry geometry;
    private final ZoneBootstrapService bootstrap;
    private final SkillService skills;
    private final EconomyService economy;
    private final MovementService movement;
    private final AutorepeatService autorepeat;
    private final CraftingService crafting;
    private final ContainerService containers;
    private final IntentDispatcher dispatcher;

    public ZoneTickEngine(GameCatalogs catalogs, Random rng, Clock clock) {
        this.catalogs = catalogs;
        this.defaultRng = rng != null ? rng : new Random();
        this.clock = clock != null ? clock : Clock.systemUTC();

        MonsterAbilities abilities = new MonsterAbilities();
        ShareService shares = new ShareService();

        this.geometry = new ZoneGeometry(catalogs.goodTypes());
        ItemRules items = new ItemRules(catalogs.goodTypes(), abilities);
        this.containers = new ContainerService(catalogs.goodTypes(), geometry, items);
        this.skills = new SkillService(catalogs.skills(), abilities);
        this.economy = new EconomyService(catalogs.monsterTypes(), items, shares);
        this.bootstrap = new ZoneBootstrapService(geometry);

        WagonService wagons = new WagonService(geometry, containers);
        this.movement = new MovementService(geometry, items, abilities, containers, wagons, economy);
        this.autorepeat = new AutorepeatService(geometry, movement);

        CraftingRolls rolls = new CraftingRolls(catalogs.goodTypes(), abilities, skills, items);
        this.crafting = new CraftingService(catalogs.goodTypes(), geometry, items, containers, skills, shares, rolls);

        MonsterService monsters = new MonsterService(catalogs.monsterTypes(), catalogs.skills(), economy, bootstrap);
        this.dispatcher = new IntentDispatcher(geometry, movement, monsters, crafting, wagons);
    }

    public ZoneTickEngine(GameCatalogs catalogs) {
        this(catalogs, new Random(), Clock.systemUTC());
    }

    // ==========================================================
    // ZONE LIFECYCLE
    // ==========================================================

    /**
     * Ensures every known zone exists in the repository and maps its id to the definition.
     * Without loaded definitions the default zone is used.
     */
    public void initializeZones(IZoneRepository repository) {
        List<ZoneDefinition> defs = new ArrayList<>(catalogs.zones());
        if (defs.isEmpty()) defs.add(ZoneDefinition.defaultDefinition());

        for (ZoneDefinition def : defs) {
            String name = def.name() != null ? def.name() : ZoneDefinition.DEFAULT_NAME;
            ZoneRecord zone = repository.findZoneByName(name);
            if (zone == null) {
                JsonObject meta = new JsonObject();
                meta.addProperty("source", ZONE_SOURCE);
                zone = repository.createZone(name, def.width(), def.height(), meta);
                if (zone == null) {
                    throw new IllegalStateException("Zone '" + name + "' could not be found or created");
                }
                System.out.println("🗺️ Created zone '" + name + "' (" + zone.id() + ")");
            } else {
                System.out.println("🗺️ Using existing zone '" + name + "' (" + zone.id() + ")");
            }
            registerZone(zone.id(), def, zone.width(), zone.height());
        }
        System.out.println("✅ Monster Workshop engine initialized (" + zoneDefinitions.size() + " zones)");
    }

    public void registerZone(UUID zoneId, ZoneDefinition def, int width, int height) {
        if (def != null) zoneDefinitions.put(zoneId, def);
        zoneSizes.put(zoneId, new GridSize(width, height));
    }

    /**
     * Skips the first-tick bootstrap for a zone that is known to be populated.
     */
    public void markInitialized(UUID zoneId) {
        initializedZones.add(zoneId);
    }

    public boolean isInitialized(UUID zoneId) {
        return initializedZones.contains(zoneId);
    }

    public ZoneDefinition getZoneDefinition(UUID zoneId) {
        return zoneDefinitions.get(zoneId);
    }

    public GridSize getZoneSize(UUID zoneId) {
        return zoneSizes.getOrDefault(zoneId, new GridSize(DEFAULT_ZONE_WIDTH, DEFAULT_ZONE_HEIGHT));
    }

    public Set<UUID> getRegisteredZoneIds() {
        return Set.copyOf(zoneSizes.keySet());
    }

    // ==========================================================
    // TICK
    // ==========================================================
    public TickResult tick(UUID zoneId, List<Entity> entities, List<RawIntent> intents, long tickNumber) {
        return tick(zoneId, entities, intents, tickNumber, defaultRng);
    }

    public TickResult tick(UUID zoneId, List<Entity> entities, List<RawIntent> intents, long tickNumber, Random rng) {
        GridSize size = getZoneSize(zoneId);
        TickContext ctx = new TickContext(
                zoneDefinitions.get(zoneId),
                size.width(),
                size.height(),
                tickNumber,
                rng,
                GameTime.now(clock),
                entities != null ? entities : List.of()
        );

        if (!initializedZones.contains(zoneId)) {
            if (!ctx.hasWorldMarker()) bootstrap.bootstrap(ctx);
            initializedZones.add(zoneId);
        }

        dispatcher.dispatchAll(ctx, IntentParser.parseAll(intents != null ? intents : List.of()));

        autorepeat.process(ctx);
        crafting.process(ctx);
        processMonsterEconomy(ctx);

        MovementService.clearActivePushes(ctx);
        containers.syncDispensers(ctx);

        return ctx.toResult();
    }

    private void processMonsterEconomy(TickContext ctx) {
        boolean decayTick = SkillService.isDecayTick(ctx.tickNumber());
        for (Entity monster : ctx.snapshot()) {
            if (!monster.is(EntityKind.MONSTER) || !ctx.isLive(monster)) continue;
            if (decayTick) skills.applyDecay(ctx, monster);
            economy.processUpkeep(ctx, monster);
        }
    }

    // ==========================================================
    // PLAYER VIEW
    // ==========================================================

    /**
     * Copy of the zone state as one player sees it: events aimed at other
     * players are dropped and {@code viewer_id} is added.
     */
    public JsonObject getPlayerState(UUID zoneId, UUID playerId, JsonObject fullState) {
        JsonObject state = fullState != null ? fullState.deepCopy() : new JsonObject();
        JsonArray events = JsonFields.getArray(state, "events");
        if (events != null && events.size() > 0) {
            JsonArray filtered = new JsonArray();
            String viewer = String.valueOf(playerId);
            for (JsonElement el : events) {
                if (el.isJsonObject()) {
                    String target = JsonFields.getString(el.getAsJsonObject(), "target_player_id");
                    if (target != null && !target.equals(viewer)) continue;
                }
                filtered.add(el);
            }
            state.add("events", filtered);
        }
        state.addProperty("viewer_id", String.valueOf(playerId));
        return state;
    }
}
