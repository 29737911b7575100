package com.example.skirmish.combat;

import com.example.skirmish.model.Ability;
import com.example.skirmish.model.Equipment;
import com.example.skirmish.model.Item;
import com.example.skirmish.model.Location;

/**
 * Anything that can take part in combat.
 * The combat handler only references combatants; health, abilities and equipment
 * are owned and stored by the implementation.
 */
public interface Combatant {

    /** Unique key, also used as the name mapping key in message templates. */
    String getKey();

    default String getName() { return getKey(); }

    int getHp();

    void setHp(int hp);

    int getHpMax();

    /** Ability bonus used in checks (ARMOR includes worn equipment). */
    int getAbility(Ability ability);

    Equipment getEquipment();

    /** The item attacks are made with. */
    default Item getWeapon() {
        return getEquipment().getWeapon();
    }

    /** Whether this combatant fights on a different side than {@code other}. */
    boolean isHostileTo(Combatant other);

    /** Deliver already rendered text to this combatant. */
    void sendMessage(String text);

    /** Where this combatant is, or null when not placed anywhere. */
    Location getLocation();

    /**
     * Take damage. Health may drop below zero.
     */
    default void atDamage(int damage, Combatant attacker) {
        setHp(getHp() - damage);
    }

    /**
     * Restore health up to the maximum.
     * @return the amount actually healed
     */
    default int heal(int amount) {
        int before = getHp();
        setHp(Math.min(getHpMax(), before + amount));
        return Math.max(0, getHp() - before);
    }

    /**
     * Called once when combat removes this combatant for being at zero health or less.
     */
    default void atDefeat() {
    }
}
