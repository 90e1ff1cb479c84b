package com.monsterworkshop.core.infrastructure;

import com.google.gson.JsonObject;
import com.monsterworkshop.core.database.DatabaseManager;
import com.monsterworkshop.core.database.dao.ZoneDAO;
import com.monsterworkshop.core.ports.IZoneRepository;
import com.monsterworkshop.core.ports.ZoneRecord;

public class MariaDBAdapter implements IZoneRepository {

    private final ZoneDAO zoneDAO;

    public MariaDBAdapter(DatabaseManager dbManager) {
        this.zoneDAO = new ZoneDAO(dbManager);
    }

    @Override
    public ZoneRecord findZoneByName(String name) {
        return zoneDAO.findByName(name);
    }

    @Override
    public ZoneRecord createZone(String name, int width, int height, JsonObject metadata) {
        return zoneDAO.insert(name, width, height, metadata);
    }
}
