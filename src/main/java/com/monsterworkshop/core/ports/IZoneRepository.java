package com.monsterworkshop.core.ports;

import com.google.gson.JsonObject;

/**
 * Zone registry of the hosting framework, used once at startup.
 */
public interface IZoneRepository {

    // --- LOOKUP ---
    ZoneRecord findZoneByName(String name);

    // --- CREATION ---
    /**
     * @return the stored zone, or null when it could not be created
     */
    ZoneRecord createZone(String name, int width, int height, JsonObject metadata);
}
