package com.monsterworkshop.core.infrastructure;

import org.junit.After;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Properties;

public class TestConfig {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @After
    public void reset() {
        CoreConfig.load(new Properties());
    }

    @Test
    public void defaultsWhenNothingIsConfigured() {
        CoreConfig.load(new Properties());
        ServerConfig config = ServerConfig.fromCoreConfig();
        Assert.assertEquals(ServerConfig.DEFAULT_TICK_INTERVAL_MS, config.tickIntervalMs());
        Assert.assertNull(config.seed());
        Assert.assertNull(config.dataDir());
        Assert.assertFalse(config.usesDatabase());
        Assert.assertEquals("", config.dbUser());
    }

    @Test
    public void valuesFromPropertiesFile() throws Exception {
        File file = tmp.newFile("monsterworkshop.properties");
        Files.writeString(file.toPath(), String.join("\n",
                "tick.interval.ms=250",
                "engine.seed=42",
                "data.dir= /srv/data ",
                "db.url=jdbc:mariadb://localhost:3306/monster_workshop",
                "db.user=mw"), StandardCharsets.UTF_8);

        CoreConfig.load(file.getPath());
        ServerConfig config = ServerConfig.fromCoreConfig();

        Assert.assertEquals(250L, config.tickIntervalMs());
        Assert.assertEquals(Long.valueOf(42L), config.seed());
        Assert.assertEquals("/srv/data", config.dataDir());
        Assert.assertTrue(config.usesDatabase());
        Assert.assertEquals("mw", config.dbUser());
        Assert.assertEquals("", config.dbPassword());
    }

    @Test
    public void badNumbersFallBackToDefaults() {
        Properties p = new Properties();
        p.setProperty("tick.interval.ms", "fast");
        p.setProperty("some.int", "x");
        CoreConfig.load(p);

        Assert.assertEquals(ServerConfig.DEFAULT_TICK_INTERVAL_MS, ServerConfig.fromCoreConfig().tickIntervalMs());
        Assert.assertEquals(7, CoreConfig.getInt("some.int", 7));
    }

    @Test
    public void nonPositiveIntervalIsRejected() {
        Properties p = new Properties();
        p.setProperty("tick.interval.ms", "0");
        CoreConfig.load(p);
        Assert.assertEquals(ServerConfig.DEFAULT_TICK_INTERVAL_MS, ServerConfig.fromCoreConfig().tickIntervalMs());
    }

    @Test
    public void missingFileKeepsDefaults() {
        CoreConfig.load(new File(tmp.getRoot(), "absent.properties").getPath());
        Assert.assertEquals("fallback", CoreConfig.getString("db.url", "fallback"));
    }
}
