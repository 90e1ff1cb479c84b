package com.monsterworkshop.core;

import com.monsterworkshop.core.database.DatabaseManager;
import com.monsterworkshop.core.domain.catalog.GameCatalogs;
import com.monsterworkshop.core.infrastructure.CoreConfig;
import com.monsterworkshop.core.infrastructure.InMemoryZoneRepository;
import com.monsterworkshop.core.infrastructure.MariaDBAdapter;
import com.monsterworkshop.core.infrastructure.ServerConfig;
import com.monsterworkshop.core.managers.ZoneTickEngine;
import com.monsterworkshop.core.ports.IZoneRepository;
import com.monsterworkshop.core.synchronization.ZoneTickLoop;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Random;
import java.util.UUID;

public class Main {

    public static void main(String[] args) throws InterruptedException {
        System.out.println("🐲 Monster Workshop Core Starting...");
        CoreConfig.load();
        ServerConfig config = ServerConfig.fromCoreConfig();

        GameCatalogs catalogs = config.dataDir() != null
                ? GameCatalogs.load(Path.of(config.dataDir()))
                : GameCatalogs.bundled();

        Random rng = config.seed() != null ? new Random(config.seed()) : new Random();
        ZoneTickEngine engine = new ZoneTickEngine(catalogs, rng, Clock.systemUTC());

        DatabaseManager dbManager = null;
        IZoneRepository repository;
        if (config.usesDatabase()) {
            dbManager = new DatabaseManager(config.dbUrl(), config.dbUser(), config.dbPassword());
            dbManager.ensureSchema();
            repository = new MariaDBAdapter(dbManager);
        } else {
            System.out.println("⚠️ db.url not set: zones are kept in memory.");
            repository = new InMemoryZoneRepository();
        }

        try {
            engine.initializeZones(repository);
        } finally {
            // the registry is only needed at startup
            if (dbManager != null) dbManager.close();
        }

        ZoneTickLoop loop = new ZoneTickLoop(engine, config.tickIntervalMs());
        for (UUID zoneId : engine.getRegisteredZoneIds()) {
            loop.register(zoneId);
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                System.out.println("🛑 ShutdownHook: stopping zone loop at tick " + loop.getCurrentTick() + "...");
                loop.stop();
            } catch (Throwable t) {
                t.printStackTrace();
            }
        }, "mw-shutdown"));

        loop.start();

        while (loop.isRunning()) {
            Thread.sleep(10000);
        }
    }
}
