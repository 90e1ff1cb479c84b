package com.monsterworkshop.core.infrastructure;

import com.google.gson.JsonObject;
import com.monsterworkshop.core.ports.IZoneRepository;
import com.monsterworkshop.core.ports.ZoneRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Zone registry kept in memory, for local runs without a database.
 */
public class InMemoryZoneRepository implements IZoneRepository {

    private final Map<String, ZoneRecord> byName = new ConcurrentHashMap<>();

    @Override
    public ZoneRecord findZoneByName(String name) {
        return name == null ? null : byName.get(name);
    }

    @Override
    public ZoneRecord createZone(String name, int width, int height, JsonObject metadata) {
        if (name == null) return null;
        return byName.computeIfAbsent(name, n -> new ZoneRecord(
                UUID.randomUUID(), n, width, height, metadata != null ? metadata.deepCopy() : new JsonObject()));
    }

    public List<ZoneRecord> getAll() {
        return new ArrayList<>(byName.values());
    }
}
