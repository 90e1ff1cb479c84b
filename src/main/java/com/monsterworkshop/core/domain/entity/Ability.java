package com.monsterworkshop.core.domain.entity;

/**
 * The six ability scores, in the index order recipes refer to them
 * ("relevant_ability_score": 0 = str ... 5 = cha).
 */
public enum Ability {
    STR("str"),
    DEX("dex"),
    CON("con"),
    INT("int"),
    WIS("wis"),
    CHA("cha");

    private final String key;

    Ability(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Out-of-range indices are clamped to the nearest valid score.
     */
    public static Ability fromIndex(int index) {
        Ability[] all = values();
        return all[Math.max(0, Math.min(index, all.length - 1))];
    }
}
