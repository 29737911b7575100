package com.example.skirmish.model;

import com.example.skirmish.combat.CombatHandler;
import com.example.skirmish.combat.Combatant;
import com.example.skirmish.combat.action.ActionRequest;
import com.example.skirmish.util.Dice;

import java.util.ArrayList;
import java.util.List;

/**
 * A computer-controlled character (NPC/monster). Picks its own combat action each turn.
 */
public class Mobile extends GameCharacter {

    /** Default faction for monsters */
    public static final int MONSTER_FACTION = 1;

    private boolean idle;          // Never acts in combat (training dummies)
    private int autoflee;          // Flee below this percentage of max HP (0-100)

    public Mobile(String key, int hpMax) {
        this(key, hpMax, MONSTER_FACTION);
    }

    public Mobile(String key, int hpMax, int faction) {
        super(key, hpMax, faction);
    }

    public boolean isIdle() { return idle; }
    public void setIdle(boolean idle) { this.idle = idle; }

    public int getAutoflee() { return autoflee; }

    public void setAutoflee(int autoflee) {
        if (autoflee < 0 || autoflee > 100) {
            throw new IllegalArgumentException("autoflee must be between 0 and 100: " + autoflee);
        }
        this.autoflee = autoflee;
    }

    /**
     * Check if this mobile should flee at its current HP.
     */
    public boolean shouldAutoflee() {
        if (autoflee <= 0 || getHpMax() <= 0) return false;
        return getHp() * 100 / getHpMax() < autoflee;
    }

    /**
     * Decide this turn's action: nothing when idle, flee when hurt past the autoflee
     * threshold, otherwise attack a random enemy still standing.
     */
    public ActionRequest chooseAction(CombatHandler handler, Dice dice) {
        if (idle) {
            return ActionRequest.nothing();
        }
        if (shouldAutoflee()) {
            return ActionRequest.flee();
        }
        List<Combatant> targets = new ArrayList<>();
        for (Combatant enemy : handler.getSides(this).getEnemies()) {
            if (enemy.getHp() > 0) {
                targets.add(enemy);
            }
        }
        if (targets.isEmpty()) {
            return ActionRequest.nothing();
        }
        return ActionRequest.attack(targets.get(dice.roll(0, targets.size() - 1)));
    }
}
