package com.monsterworkshop.core.database.dao;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.monsterworkshop.core.database.DatabaseManager;
import com.monsterworkshop.core.database.UuidUtils;
import com.monsterworkshop.core.ports.ZoneRecord;

import java.sql.*;
import java.util.UUID;

/**
 * Table {@code zones}: id BINARY(16), name, width, height, metadata (JSON text).
 */
public class ZoneDAO {

    private final DatabaseManager dbManager;

    public ZoneDAO(DatabaseManager dbManager) {
        this.dbManager = dbManager;
    }

    public ZoneRecord findByName(String name) {
        String sql = "SELECT id, name, width, height, metadata FROM zones WHERE name = ? LIMIT 1";
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, name);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) return map(rs);
            }
        } catch (SQLException e) {
            e.printStackTrace();
        }
        return null;
    }

    public ZoneRecord insert(String name, int width, int height, JsonObject metadata) {
        UUID id = UUID.randomUUID();
        String sql = "INSERT INTO zones (id, name, width, height, metadata) VALUES (?, ?, ?, ?, ?)";
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setBytes(1, UuidUtils.asBytes(id));
            stmt.setString(2, name);
            stmt.setInt(3, width);
            stmt.setInt(4, height);
            stmt.setString(5, metadata != null ? metadata.toString() : "{}");

            if (stmt.executeUpdate() > 0) {
                return new ZoneRecord(id, name, width, height, metadata);
            }
        } catch (SQLException e) {
            e.printStackTrace();
        }
        return null;
    }

    private ZoneRecord map(ResultSet rs) throws SQLException {
        return new ZoneRecord(
                UuidUtils.asUuid(rs.getBytes("id")),
                rs.getString("name"),
                rs.getInt("width"),
                rs.getInt("height"),
                parseMetadata(rs.getString("metadata"))
        );
    }

    private static JsonObject parseMetadata(String raw) {
        if (raw == null || raw.isBlank()) return new JsonObject();
        try {
            JsonElement el = JsonParser.parseString(raw);
            return el.isJsonObject() ? el.getAsJsonObject() : new JsonObject();
        } catch (JsonParseException e) {
            System.err.println("[ZoneDAO] Invalid zone metadata: " + e.getMessage());
            return new JsonObject();
        }
    }
}
