package com.example.skirmish.combat.action;

import com.example.skirmish.combat.CombatHandler;
import com.example.skirmish.combat.Combatant;

/**
 * Pass the turn. Also what happens when nothing was queued.
 */
public class DoNothingAction extends CombatAction {

    public DoNothingAction(CombatHandler handler, Combatant combatant, ActionRequest request) {
        super(handler, combatant, request);
    }

    @Override
    public void execute() {
        msg("$You() $conj(hold) back, doing nothing this turn.");
    }
}
