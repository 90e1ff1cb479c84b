package com.monsterworkshop.core.synchronization;

import com.monsterworkshop.core.domain.tick.TickResult;
import com.monsterworkshop.core.managers.ZoneTickEngine;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

public class ZoneTickLoop {

    private final ZoneTickEngine engine;
    private final long intervalMs;
    private final ScheduledExecutorService scheduler;
    private final AtomicLong currentTick = new AtomicLong(0);
    private final Map<UUID, ZoneWorldState> zones = new ConcurrentHashMap<>();

    private volatile boolean running = false;

    public ZoneTickLoop(ZoneTickEngine engine, long intervalMs) {
        this.engine = engine;
        this.intervalMs = intervalMs;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "mw-zone-loop");
            t.setDaemon(true);
            return t;
        });
    }

    public ZoneWorldState register(UUID zoneId) {
        return zones.computeIfAbsent(zoneId, ZoneWorldState::new);
    }

    public ZoneWorldState getZone(UUID zoneId) {
        return zones.get(zoneId);
    }

    public void start() {
        if (running) return;
        running = true;

        scheduler.scheduleAtFixedRate(() -> {
            if (!running) return;

            try {
                runTick(currentTick.incrementAndGet());
            } catch (Throwable t) {
                System.err.println("CRITICAL: Exception in Zone Loop!");
                t.printStackTrace();
            }
        }, 0, intervalMs, TimeUnit.MILLISECONDS);

        System.out.println("🐾 Zone Loop Started (" + intervalMs + " ms/tick, " + zones.size() + " zones).");
    }

    /**
     * One tick over every registered zone. A failing zone is logged and left
     * unchanged; the others still advance.
     */
    public void runTick(long tickNumber) {
        for (ZoneWorldState zone : zones.values()) {
            try {
                TickResult result = engine.tick(zone.getZoneId(), zone.snapshot(), zone.drainIntents(), tickNumber);
                List<UUID> created = zone.apply(result, tickNumber);
                if (!created.isEmpty() && tickNumber == 1) {
                    System.out.println("[ZoneTickLoop] Zone " + zone.getZoneId() + " populated with " + created.size() + " entities");
                }
            } catch (Throwable t) {
                System.err.println("CRITICAL: tick " + tickNumber + " failed for zone " + zone.getZoneId());
                t.printStackTrace();
            }
        }
    }

    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(2, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public long getCurrentTick() {
        return currentTick.get();
    }
}
