package com.monsterworkshop.core.database;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Connection pool for the zone registry tables.
 */
public class DatabaseManager {

    public static final String SCHEMA_RESOURCE = "db/schema.sql";

    private final HikariDataSource dataSource;

    public DatabaseManager(String jdbcUrl, String username, String password) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);
        config.setPoolName("mw-zone-pool");

        // only used at startup for the zone registry
        config.setMaximumPoolSize(4);
        config.setMinimumIdle(1);
        config.setIdleTimeout(30000);
        config.setConnectionTimeout(2000); // fail fast when the DB is down

        this.dataSource = new HikariDataSource(config);
    }

    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Runs the bundled schema script. Every statement is idempotent
     * (CREATE ... IF NOT EXISTS), so this is safe on every start.
     */
    public void ensureSchema() {
        String script = readSchema();
        if (script == null) {
            System.err.println("[DatabaseManager] " + SCHEMA_RESOURCE + " missing from classpath, schema not checked");
            return;
        }
        try (Connection conn = getConnection(); Statement stmt = conn.createStatement()) {
            for (String sql : script.split(";")) {
                if (!sql.isBlank()) stmt.execute(sql.trim());
            }
            System.out.println("🗄️ Zone schema ready");
        } catch (SQLException e) {
            System.err.println("[DatabaseManager] Schema check failed: " + e.getMessage());
            e.printStackTrace();
        }
    }

    private static String readSchema() {
        try (InputStream in = DatabaseManager.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) return null;
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("[DatabaseManager] Cannot read " + SCHEMA_RESOURCE + ": " + e.getMessage());
            return null;
        }
    }

    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
        }
    }
}
