package com.monsterworkshop.core.domain.catalog;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything the engine reads but never writes. Loaded once at startup.
 */
public record GameCatalogs(
        GoodTypeRegistry goodTypes,
        MonsterTypeRegistry monsterTypes,
        SkillCatalog skills,
        List<ZoneDefinition> zones
) {

    public static GameCatalogs load(CatalogLoader loader) {
        String goods = loader.read("tech_tree/good_types.json");
        GoodTypeRegistry goodTypes = goods != null ? GoodTypeRegistry.fromJson(goods) : GoodTypeRegistry.empty();

        String monsters = loader.read("monster_types.json");
        MonsterTypeRegistry monsterTypes = monsters != null ? MonsterTypeRegistry.fromJson(monsters) : MonsterTypeRegistry.defaults();

        String skills = loader.read("skills.json");
        SkillCatalog skillCatalog = skills != null ? SkillCatalog.fromJson(skills) : SkillCatalog.defaults();

        List<ZoneDefinition> zones = loader.loadZones();

        System.out.println("📚 Catalogs loaded: " + goodTypes.size() + " good types, "
                + monsterTypes.all().size() + " monster types, "
                + skillCatalog.transferableSkills().size() + " transferable skills, "
                + zones.size() + " zones");
        return new GameCatalogs(goodTypes, monsterTypes, skillCatalog, List.copyOf(zones));
    }

    public static GameCatalogs load(Path dataDir) {
        return load(new CatalogLoader(dataDir));
    }

    public static GameCatalogs bundled() {
        return load(CatalogLoader.bundled());
    }

    /**
     * Built-in defaults only: no good types, default monsters and skills, no zones.
     */
    public static GameCatalogs builtInDefaults() {
        return new GameCatalogs(GoodTypeRegistry.empty(), MonsterTypeRegistry.defaults(), SkillCatalog.defaults(), List.of());
    }
}
