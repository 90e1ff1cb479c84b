package com.monsterworkshop.core.domain.intent;

import com.monsterworkshop.core.common.GridPosition;

import java.util.List;
import java.util.UUID;

/**
 * Closed set of player requests understood by the zone engine.
 * Built once per tick by {@link IntentParser}; ids that fail to parse are null.
 */
public sealed interface Intent {

    UUID playerId();

    // --- MOVEMENT ---
    record Move(UUID playerId, UUID entityId, GridPosition delta) implements Intent {}

    // --- MONSTERS ---
    /**
     * transferableSkills is null when the request did not carry a list.
     */
    record SpawnMonster(UUID playerId, String monsterType, String name, List<String> transferableSkills) implements Intent {}

    record OwnerDisconnect(UUID playerId, UUID disconnectedPlayerId) implements Intent {}

    // --- RECORDING / AUTOREPEAT ---
    record RecordingStart(UUID playerId, UUID monsterId) implements Intent {}

    record RecordingStop(UUID playerId, UUID monsterId) implements Intent {}

    record AutorepeatStart(UUID playerId, UUID monsterId) implements Intent {}

    record AutorepeatStop(UUID playerId, UUID monsterId) implements Intent {}

    // --- CRAFTING ---
    record SelectRecipe(UUID playerId, UUID workshopId, String recipeId, UUID monsterId) implements Intent {}

    record Interact(UUID playerId, UUID monsterId, UUID targetId) implements Intent {}

    // --- WAGONS ---
    record HitchWagon(UUID playerId, UUID monsterId) implements Intent {}

    record UnhitchWagon(UUID playerId, UUID monsterId) implements Intent {}

    record UnloadWagon(UUID playerId, UUID monsterId) implements Intent {}

    // --- FALLBACKS ---
    record Unsupported(UUID playerId, String action) implements Intent {}

    record Ignored(UUID playerId) implements Intent {}
}
