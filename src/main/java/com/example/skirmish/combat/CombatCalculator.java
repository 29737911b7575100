package com.example.skirmish.combat;

import com.example.skirmish.model.Ability;
import com.example.skirmish.util.Dice;
import com.example.skirmish.util.DiceExpression;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Check and damage rolls.
 *
 * Saving throw: roll the check die, add the bonus, succeed if the total is strictly greater
 * than the target (ties go to the defender). A natural 1 always fails and a natural maximum
 * always succeeds; both are critical.
 *
 * Opposed check: the attacker's ability bonus against a target of the defender's ability + defense base.
 *
 * Advantage rolls the die twice and keeps the higher result; disadvantage keeps the lower.
 * Having both cancels out to a single roll.
 */
public class CombatCalculator {

    private final Dice dice;
    private final CombatConfig config;

    /** Parsed dice notation, weapon damage strings repeat constantly */
    private final Map<String, DiceExpression> expressions = new ConcurrentHashMap<>();

    public CombatCalculator(Dice dice, CombatConfig config) {
        this.dice = dice;
        this.config = config;
    }

    public Dice getDice() { return dice; }

    public CombatConfig getConfig() { return config; }

    /**
     * Roll the check die, honouring advantage and disadvantage.
     */
    public int rollCheckDie(boolean advantage, boolean disadvantage) {
        int sides = config.getDieSides();
        if (advantage && !disadvantage) {
            return Math.max(dice.roll(1, sides), dice.roll(1, sides));
        }
        if (disadvantage && !advantage) {
            return Math.min(dice.roll(1, sides), dice.roll(1, sides));
        }
        return dice.roll(1, sides);
    }

    /**
     * Roll against a fixed target number.
     */
    public CheckResult savingThrow(int bonus, int target, boolean advantage, boolean disadvantage) {
        int roll = rollCheckDie(advantage, disadvantage);
        CheckResult.Quality quality;
        if (roll <= 1) {
            quality = CheckResult.Quality.CRITICAL_FAILURE;
        } else if (roll >= config.getDieSides()) {
            quality = CheckResult.Quality.CRITICAL_SUCCESS;
        } else if (roll + bonus > target) {
            quality = CheckResult.Quality.SUCCESS;
        } else {
            quality = CheckResult.Quality.FAILURE;
        }
        return new CheckResult(roll, bonus, target, quality);
    }

    /**
     * The defender's passive defense against the given ability.
     */
    public int defenseOf(Combatant defender, Ability defenseType) {
        return defender.getAbility(defenseType) + config.getDefenseBase();
    }

    /**
     * Attacker's {@code attackType} check against the defender's {@code defenseType} defense.
     */
    public CheckResult opposedCheck(Combatant attacker, Ability attackType,
                                    Combatant defender, Ability defenseType,
                                    boolean advantage, boolean disadvantage) {
        int bonus = attacker.getAbility(attackType);
        int target = defenseOf(defender, defenseType);
        return savingThrow(bonus, target, advantage, disadvantage);
    }

    /**
     * Roll dice notation such as "1d6" or "2d4+1".
     * @throws IllegalArgumentException for invalid notation
     */
    public int roll(String notation) {
        return expressions.computeIfAbsent(notation, DiceExpression::parse).roll(dice);
    }
}
