package com.example.skirmish.combat.action;

import com.example.skirmish.combat.CombatHandler;
import com.example.skirmish.combat.Combatant;

/**
 * Try to disengage. The first flee starts the attempt; the combatant escapes at the end of a
 * turn once the attempt has lasted longer than the flee timeout, unless hindered first.
 */
public class FleeAction extends CombatAction {

    public FleeAction(CombatHandler handler, Combatant combatant, ActionRequest request) {
        super(handler, combatant, request);
    }

    @Override
    public void execute() {
        if (!handler.isFleeing(combatant)) {
            flee(combatant);
            msg("$You() $conj(try) to break away from the fight!");
        } else {
            msg("$You() $conj(keep) trying to get away!");
        }
    }
}
