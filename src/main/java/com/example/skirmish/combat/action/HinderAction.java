package com.example.skirmish.combat.action;

import com.example.skirmish.combat.CheckResult;
import com.example.skirmish.combat.CombatHandler;
import com.example.skirmish.combat.Combatant;
import com.example.skirmish.model.Ability;

/**
 * Block a fleeing combatant. DEX against DEX; success cancels the target's flee attempt.
 * Does nothing against a target that is not fleeing.
 */
public class HinderAction extends CombatAction {

    public HinderAction(CombatHandler handler, Combatant combatant, ActionRequest request) {
        super(handler, combatant, request);
    }

    @Override
    public boolean canUse() {
        Combatant target = request.getTarget();
        return target != combatant && isValidTarget(target);
    }

    @Override
    public String getRefusalMessage() {
        return "There is nobody there to block.";
    }

    @Override
    public void execute() {
        Combatant target = request.getTarget();
        if (!handler.isFleeing(target)) {
            msg("$You() $conj(move) to block " + you(target) + ", but nobody is trying to leave.");
            return;
        }

        CheckResult check = opposedCheck(combatant, Ability.DEX, target, Ability.DEX);
        if (check.isSuccess()) {
            unflee(target);
            msg("$You() $conj(block) " + your(target) + " escape!");
        } else {
            msg("$You() $conj(try) to block " + you(target) + ", but $conj(fail).");
        }
    }
}
