package com.example.skirmish.combat.action;

import com.example.skirmish.combat.CheckResult;
import com.example.skirmish.combat.CombatHandler;
import com.example.skirmish.combat.Combatant;

/**
 * A trick, feint or distraction. The actor's stunt ability is checked against the target's
 * defense ability; on success the recipient gains advantage against the target (or, for a
 * hindering stunt, disadvantage) on its next check against it. Failure changes nothing.
 */
public class StuntAction extends CombatAction {

    public StuntAction(CombatHandler handler, Combatant combatant, ActionRequest request) {
        super(handler, combatant, request);
    }

    @Override
    public boolean canUse() {
        Combatant recipient = request.getRecipient();
        Combatant target = request.getTarget();
        return recipient != null && recipient != target
                && handler.isEngaged(recipient) && isValidTarget(target);
    }

    @Override
    public String getRefusalMessage() {
        return "Your stunt has nobody left to affect.";
    }

    @Override
    public void execute() {
        Combatant recipient = request.getRecipient();
        Combatant target = request.getTarget();

        CheckResult check = opposedCheck(combatant, request.getStuntType(), target, request.getDefenseType());
        if (!check.isSuccess()) {
            msg("$You() $conj(attempt) a stunt against " + you(target) + ", but $conj(fail).");
            return;
        }

        if (request.isAdvantage()) {
            giveAdvantage(recipient, target);
            msg("$You() $conj(perform) a stunt, granting " + you(recipient)
                    + " advantage against " + you(target) + ".");
        } else {
            giveDisadvantage(recipient, target);
            msg("$You() $conj(perform) a stunt, putting " + you(recipient)
                    + " at a disadvantage against " + you(target) + ".");
        }
    }
}
