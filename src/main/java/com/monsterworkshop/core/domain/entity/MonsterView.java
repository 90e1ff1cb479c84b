package com.monsterworkshop.core.domain.entity;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.GameTime;
import com.monsterworkshop.core.common.JsonFields;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Typed access to a monster's metadata. Writes go straight into the wrapped
 * entity's bag, so unknown keys survive untouched.
 */
public final class MonsterView {

    private final Entity entity;

    private MonsterView(Entity entity) {
        this.entity = entity;
    }

    /**
     * Null when the entity is not a monster.
     */
    public static MonsterView of(Entity entity) {
        if (entity == null || !entity.is(EntityKind.MONSTER)) return null;
        return new MonsterView(entity);
    }

    public Entity entity() { return entity; }
    public UUID id() { return entity.getId(); }
    public UUID ownerId() { return entity.getOwnerId(); }

    private JsonObject meta() {
        return entity.getMetadata();
    }

    public String name() {
        return JsonFields.getString(meta(), "name", "Monster");
    }

    public String monsterType() {
        String t = JsonFields.getString(meta(), "monster_type");
        return t == null ? "" : t.toLowerCase();
    }

    public int stat(Ability ability, int defaultValue) {
        return JsonFields.getInt(JsonFields.getObject(meta(), "stats"), ability.key(), defaultValue);
    }

    public LocalDateTime createdAt() {
        return GameTime.parse(JsonFields.getString(meta(), "created_at"));
    }

    // ==========================================================
    // CURRENT TASK (recording / autorepeat / wagon)
    // ==========================================================
    public JsonObject currentTask() {
        return JsonFields.getOrCreateObject(meta(), "current_task");
    }

    public boolean isRecording() {
        return JsonFields.isTruthy(JsonFields.getObject(meta(), "current_task"), "is_recording");
    }

    public boolean isPlaying() {
        return JsonFields.isTruthy(JsonFields.getObject(meta(), "current_task"), "is_playing");
    }

    public JsonArray actions() {
        JsonArray arr = JsonFields.getArray(currentTask(), "actions");
        if (arr == null) {
            arr = new JsonArray();
            currentTask().add("actions", arr);
        }
        return arr;
    }

    public int playIndex() {
        return JsonFields.getInt(JsonFields.getObject(meta(), "current_task"), "play_index", 0);
    }

    public UUID hitchedWagonId() {
        return JsonFields.getUuid(JsonFields.getObject(meta(), "current_task"), "hitched_wagon_id");
    }

    // ==========================================================
    // SKILLS
    // ==========================================================
    public JsonObject skills() {
        return JsonFields.getOrCreateObject(meta(), "skills");
    }

    public JsonObject appliedSkills() {
        return JsonFields.getOrCreateObject(skills(), "applied");
    }

    public JsonObject specificSkills() {
        return JsonFields.getOrCreateObject(skills(), "specific");
    }

    public List<String> transferableSkills() {
        return JsonFields.getStringList(JsonFields.getObject(meta(), "skills"), "transferable");
    }

    public double totalForgotten() {
        return JsonFields.getDouble(meta(), "total_forgotten", 0.0);
    }

    public void setTotalForgotten(double value) {
        meta().addProperty("total_forgotten", value);
    }
}
