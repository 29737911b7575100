package com.example.skirmish.combat.action;

import com.example.skirmish.combat.CheckResult;
import com.example.skirmish.combat.CombatHandler;
import com.example.skirmish.combat.Combatant;
import com.example.skirmish.model.Item;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attack the target with the wielded weapon (or fists).
 *
 * The weapon's attack ability is checked against the target's defense for that weapon
 * (ARMOR for blades, DEX for runestones). A hit deals the weapon's damage roll; a critical
 * hit adds a second damage roll.
 */
public class AttackAction extends CombatAction {

    private static final Logger logger = LoggerFactory.getLogger(AttackAction.class);

    public AttackAction(CombatHandler handler, Combatant combatant, ActionRequest request) {
        super(handler, combatant, request);
    }

    @Override
    public boolean canUse() {
        Combatant target = request.getTarget();
        return target != combatant && isValidTarget(target);
    }

    @Override
    public String getRefusalMessage() {
        return "Your target is no longer there to attack.";
    }

    @Override
    public void execute() {
        Combatant target = request.getTarget();
        Item weapon = combatant.getWeapon();

        CheckResult check = opposedCheck(combatant, weapon.getAttackType(), target, weapon.getDefenseType());
        logger.debug("{} attacks {} with {}: {}", combatant.getKey(), target.getKey(), weapon.getName(), check);

        if (!check.isSuccess()) {
            if (check.getQuality() == CheckResult.Quality.CRITICAL_FAILURE) {
                msg("$You() $conj(stumble), missing " + you(target) + " badly.");
            } else {
                msg("$You() $conj(attack) " + you(target) + " with " + weapon.getName() + " but $conj(miss).");
            }
            return;
        }

        int damage = calculator().roll(weapon.getDamageRoll());
        if (check.getQuality() == CheckResult.Quality.CRITICAL_SUCCESS) {
            damage += calculator().roll(weapon.getDamageRoll());
            msg("$You() $conj(land) a critical hit!");
        }
        damage = Math.max(0, damage);
        target.atDamage(damage, combatant);
        msg("$You() $conj(hit) " + you(target) + " with " + weapon.getName() + " for " + damage + " damage.");

        if (target.getHp() <= 0) {
            msg("$You(" + target.getKey() + ") cannot fight on.");
        }
    }
}
