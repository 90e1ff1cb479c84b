package com.monsterworkshop.core.domain.catalog;

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.monsterworkshop.core.common.JsonFields;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads catalog files either from an external data directory or, when none is
 * configured (or a file is missing there), from the bundled {@code data/} resources.
 *
 * Bundled zones are listed in {@code data/zones/index.json} since classpath
 * directories cannot be enumerated reliably inside a jar.
 */
public class CatalogLoader {

    private static final String CLASSPATH_ROOT = "data/";

    private final Path dataDir;

    public CatalogLoader(Path dataDir) {
        this.dataDir = dataDir;
    }

    public static CatalogLoader bundled() {
        return new CatalogLoader(null);
    }

    /**
     * File content, or null when it exists nowhere.
     */
    public String read(String relativePath) {
        if (dataDir != null) {
            Path p = dataDir.resolve(relativePath);
            if (Files.isRegularFile(p)) {
                try {
                    return Files.readString(p, StandardCharsets.UTF_8);
                } catch (IOException e) {
                    System.err.println("[CatalogLoader] Cannot read " + p + ": " + e.getMessage());
                    return null;
                }
            }
        }
        return readClasspath(CLASSPATH_ROOT + relativePath);
    }

    public List<ZoneDefinition> loadZones() {
        List<ZoneDefinition> zones = new ArrayList<>();
        if (dataDir != null && Files.isDirectory(dataDir.resolve("zones"))) {
            List<Path> files = new ArrayList<>();
            try (DirectoryStream<Path> ds = Files.newDirectoryStream(dataDir.resolve("zones"), "*.json")) {
                ds.forEach(files::add);
            } catch (IOException e) {
                System.err.println("[CatalogLoader] Cannot list zones in " + dataDir + ": " + e.getMessage());
            }
            files.sort(null);
            for (Path f : files) {
                try {
                    addZone(zones, Files.readString(f, StandardCharsets.UTF_8), f.toString());
                } catch (IOException e) {
                    System.err.println("[CatalogLoader] Cannot read " + f + ": " + e.getMessage());
                }
            }
            return zones;
        }

        String index = readClasspath(CLASSPATH_ROOT + "zones/index.json");
        if (index == null) return zones;
        try {
            JsonElement root = JsonParser.parseString(index);
            if (!root.isJsonArray()) return zones;
            List<String> names = JsonFields.toStringList(root.getAsJsonArray());
            names.sort(null);
            for (String name : names) {
                String content = readClasspath(CLASSPATH_ROOT + "zones/" + name);
                if (content != null) addZone(zones, content, name);
            }
        } catch (JsonParseException e) {
            System.err.println("[CatalogLoader] Invalid zone index: " + e.getMessage());
        }
        return zones;
    }

    private void addZone(List<ZoneDefinition> zones, String content, String source) {
        try {
            JsonElement root = JsonParser.parseString(content);
            if (root.isJsonObject()) {
                zones.add(ZoneDefinition.fromJson(root.getAsJsonObject()));
            } else {
                System.err.println("[CatalogLoader] Invalid zone definition: " + source);
            }
        } catch (JsonParseException e) {
            System.err.println("[CatalogLoader] Invalid zone definition: " + source);
        }
    }

    private String readClasspath(String resource) {
        try (InputStream in = CatalogLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) return null;
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("[CatalogLoader] Cannot read resource " + resource + ": " + e.getMessage());
            return null;
        }
    }
}
