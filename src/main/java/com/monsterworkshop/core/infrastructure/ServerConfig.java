package com.monsterworkshop.core.infrastructure;

/**
 * Values the host needs at startup. {@code seed} is null for a time-based seed,
 * {@code dbUrl} is null when zones live in memory.
 */
public record ServerConfig(
        long tickIntervalMs,
        Long seed,
        String dataDir,
        String dbUrl,
        String dbUser,
        String dbPassword
) {

    public static final long DEFAULT_TICK_INTERVAL_MS = 1000L;

    public static ServerConfig fromCoreConfig() {
        long interval = CoreConfig.getLong("tick.interval.ms", DEFAULT_TICK_INTERVAL_MS);
        if (interval <= 0) {
            System.err.println("❌ Config error for tick.interval.ms: must be positive, using " + DEFAULT_TICK_INTERVAL_MS);
            interval = DEFAULT_TICK_INTERVAL_MS;
        }
        String seedRaw = CoreConfig.getString("engine.seed", null);
        Long seed = seedRaw != null ? CoreConfig.getLong("engine.seed", System.nanoTime()) : null;
        return new ServerConfig(
                interval,
                seed,
                CoreConfig.getString("data.dir", null),
                CoreConfig.getString("db.url", null),
                CoreConfig.getString("db.user", ""),
                CoreConfig.getString("db.password", "")
        );
    }

    public boolean usesDatabase() {
        return dbUrl != null;
    }
}
