package com.example.skirmish.model;

import com.example.skirmish.combat.Combatant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A character that can fight: players, and the base for mobiles.
 * Characters of the same faction are allies; everyone else is an enemy.
 */
public class GameCharacter implements Combatant {

    private static final Logger logger = LoggerFactory.getLogger(GameCharacter.class);

    /** Faction shared by all player characters */
    public static final int PLAYER_FACTION = 0;

    /** Default ability bonus for anything not set explicitly */
    public static final int DEFAULT_ABILITY = 1;

    private final String key;
    private int hpMax;
    private int hp;
    private final int faction;

    private final Map<Ability, Integer> abilities = new EnumMap<>(Ability.class);
    private final Equipment equipment = new Equipment();

    private Location location;

    // Where rendered text goes (a client connection for players). Null drops messages.
    private Consumer<String> output;

    private boolean defeated = false;

    public GameCharacter(String key, int hpMax) {
        this(key, hpMax, PLAYER_FACTION);
    }

    public GameCharacter(String key, int hpMax, int faction) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Character key is required");
        }
        this.key = key;
        this.hpMax = hpMax;
        this.hp = hpMax;
        this.faction = faction;
        for (Ability a : Ability.values()) {
            abilities.put(a, DEFAULT_ABILITY);
        }
    }

    @Override
    public String getKey() { return key; }

    // Health

    @Override
    public int getHp() { return hp; }

    @Override
    public void setHp(int hp) { this.hp = hp; }

    @Override
    public int getHpMax() { return hpMax; }

    public void setHpMax(int hpMax) { this.hpMax = hpMax; }

    // Abilities

    /**
     * Ability bonus. ARMOR adds the armor of worn equipment to the base score.
     */
    @Override
    public int getAbility(Ability ability) {
        int base = abilities.getOrDefault(ability, DEFAULT_ABILITY);
        if (ability == Ability.ARMOR) {
            return base + equipment.getArmorBonus();
        }
        return base;
    }

    public void setAbility(Ability ability, int value) {
        abilities.put(ability, value);
    }

    // Equipment

    @Override
    public Equipment getEquipment() { return equipment; }

    // Sides

    public int getFaction() { return faction; }

    @Override
    public boolean isHostileTo(Combatant other) {
        if (other == null || other == this) return false;
        if (other instanceof GameCharacter) {
            return ((GameCharacter) other).faction != this.faction;
        }
        return true;
    }

    // Messaging and location

    public void setOutput(Consumer<String> output) { this.output = output; }

    @Override
    public void sendMessage(String text) {
        if (output != null) {
            output.accept(text);
        }
    }

    @Override
    public Location getLocation() { return location; }

    /**
     * Move to a location, leaving the previous room's occupant list.
     */
    public void setLocation(Location location) {
        if (this.location instanceof Room) {
            ((Room) this.location).removeOccupant(this);
        }
        this.location = location;
        if (location instanceof Room) {
            ((Room) location).addOccupant(this);
        }
    }

    // Combat hooks

    public boolean isDefeated() { return defeated; }

    @Override
    public void atDefeat() {
        defeated = true;
        logger.info("{} was defeated (hp {})", key, hp);
        sendMessage("You have been defeated.");
    }

    @Override
    public String toString() {
        return key + " (" + hp + "/" + hpMax + ")";
    }
}
