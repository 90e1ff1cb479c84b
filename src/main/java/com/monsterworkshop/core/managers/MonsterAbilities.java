package com.monsterworkshop.core.managers;

import com.monsterworkshop.core.common.GameTime;
import com.monsterworkshop.core.domain.entity.Ability;
import com.monsterworkshop.core.domain.entity.Entity;
import com.monsterworkshop.core.domain.entity.MonsterView;

import java.time.LocalDateTime;

/**
 * Ability scores as the rules see them, including age bonuses.
 *
 * Crafting uses the real-time age (30 / 60 real days), carry capacity the
 * game-time age (30 / 60 game days).
 */
final class MonsterAbilities {

    static final int NEUTRAL_SCORE = 10;
    static final int REAL_AGE_DAYS_FIRST = 30;
    static final int REAL_AGE_DAYS_SECOND = 60;

    int realAgeBonus(Entity monster, LocalDateTime now) {
        MonsterView view = MonsterView.of(monster);
        if (view == null) return 0;
        LocalDateTime created = view.createdAt();
        if (created == null) return 0;
        double days = GameTime.realDaysBetween(created, now);
        if (days >= REAL_AGE_DAYS_SECOND) return 2;
        if (days >= REAL_AGE_DAYS_FIRST) return 1;
        return 0;
    }

    int gameAgeBonus(Entity monster, LocalDateTime now) {
        MonsterView view = MonsterView.of(monster);
        if (view == null) return 0;
        LocalDateTime created = view.createdAt();
        if (created == null) return 0;
        double days = GameTime.gameDaysBetween(created, now);
        if (days >= 60) return 2;
        if (days >= 30) return 1;
        return 0;
    }

    /**
     * Stored score (default 10) plus the real-age bonus; 10 without a monster.
     */
    int effective(Entity monster, Ability ability, LocalDateTime now) {
        MonsterView view = MonsterView.of(monster);
        if (view == null) return NEUTRAL_SCORE;
        return view.stat(ability, NEUTRAL_SCORE) + realAgeBonus(monster, now);
    }

    int effective(Entity monster, int abilityIndex, LocalDateTime now) {
        return effective(monster, Ability.fromIndex(abilityIndex), now);
    }

    /**
     * Heaviest item weight the monster can push.
     */
    int carryCapacity(Entity monster, LocalDateTime now) {
        MonsterView view = MonsterView.of(monster);
        if (view == null) return 0;
        return view.stat(Ability.STR, 8) + gameAgeBonus(monster, now);
    }

    /**
     * Raw charisma (no age bonus), used for the value modifier.
     */
    int rawCharisma(Entity monster) {
        MonsterView view = MonsterView.of(monster);
        return view == null ? NEUTRAL_SCORE : view.stat(Ability.CHA, NEUTRAL_SCORE);
    }
}
