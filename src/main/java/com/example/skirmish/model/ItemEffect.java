package com.example.skirmish.model;

import com.example.skirmish.combat.Combatant;
import com.example.skirmish.util.Dice;

/**
 * What happens when an item is used on a target.
 */
@FunctionalInterface
public interface ItemEffect {

    /**
     * Apply the effect.
     * @return a message template describing the outcome (see MessageTemplate), or null for none
     */
    String apply(Item item, Combatant user, Combatant target, Dice dice);
}
