package com.example.skirmish.model;

import com.example.skirmish.combat.Combatant;
import com.example.skirmish.util.Dice;
import com.example.skirmish.util.DiceExpression;

/**
 * Restores health to the target, never above its maximum.
 */
public class HealEffect implements ItemEffect {

    private final DiceExpression amount;

    public HealEffect(String amount) {
        this.amount = DiceExpression.parse(amount);
    }

    @Override
    public String apply(Item item, Combatant user, Combatant target, Dice dice) {
        int healed = target.heal(Math.max(0, amount.roll(dice)));
        return "$Your(" + target.getKey() + ") wounds close for " + healed + " health.";
    }
}
