package com.example.skirmish.combat.action;

import com.example.skirmish.combat.CheckResult;
import com.example.skirmish.combat.CombatCalculator;
import com.example.skirmish.combat.CombatHandler;
import com.example.skirmish.combat.Combatant;
import com.example.skirmish.model.Ability;

/**
 * Resolves one queued action for one combatant.
 * A new resolver is built for every request; it lives only for the duration of the turn step.
 */
public abstract class CombatAction {

    protected final CombatHandler handler;
    protected final Combatant combatant;
    protected final ActionRequest request;

    protected CombatAction(CombatHandler handler, Combatant combatant, ActionRequest request) {
        this.handler = handler;
        this.combatant = combatant;
        this.request = request;
    }

    public Combatant getCombatant() { return combatant; }

    public ActionRequest getRequest() { return request; }

    /**
     * Whether the action can still happen given the current state (target still fighting,
     * item not used up, ...). Checked right before {@link #execute()}.
     */
    public boolean canUse() {
        return true;
    }

    /**
     * Message template sent to the actor when {@link #canUse()} is false.
     */
    public String getRefusalMessage() {
        return "You cannot do that right now.";
    }

    /**
     * Apply the action's effect.
     */
    public abstract void execute();

    // ========== Shared helpers ==========

    protected CombatCalculator calculator() {
        return handler.getCalculator();
    }

    /**
     * Opposed check of {@code attacker} against {@code defender}. Consumes any advantage or
     * disadvantage the attacker holds against the defender.
     */
    protected CheckResult opposedCheck(Combatant attacker, Ability attackType, Combatant defender, Ability defenseType) {
        boolean advantage = handler.consumeAdvantage(attacker, defender);
        boolean disadvantage = handler.consumeDisadvantage(attacker, defender);
        return calculator().opposedCheck(attacker, attackType, defender, defenseType, advantage, disadvantage);
    }

    /** Whether the target is still an active participant with health left. */
    protected boolean isValidTarget(Combatant target) {
        return target != null && handler.isEngaged(target) && target.getHp() > 0;
    }

    public void giveAdvantage(Combatant recipient, Combatant target) {
        handler.giveAdvantage(recipient, target);
    }

    public void giveDisadvantage(Combatant recipient, Combatant target) {
        handler.giveDisadvantage(recipient, target);
    }

    public boolean hasAdvantage(Combatant recipient, Combatant target) {
        return handler.hasAdvantage(recipient, target);
    }

    public boolean hasDisadvantage(Combatant recipient, Combatant target) {
        return handler.hasDisadvantage(recipient, target);
    }

    public void loseAdvantage(Combatant recipient, Combatant target) {
        handler.loseAdvantage(recipient, target);
    }

    public void loseDisadvantage(Combatant recipient, Combatant target) {
        handler.loseDisadvantage(recipient, target);
    }

    public void flee(Combatant fleer) {
        handler.flee(fleer);
    }

    public void unflee(Combatant fleer) {
        handler.unflee(fleer);
    }

    /**
     * Broadcast a template to everyone in the fight, with this action's combatant as the source.
     */
    public void msg(String template) {
        handler.msg(template, combatant);
    }

    /** Template reference to a combatant, e.g. {@code $you(goblin)}. */
    protected static String you(Combatant c) {
        return "$you(" + c.getKey() + ")";
    }

    protected static String your(Combatant c) {
        return "$your(" + c.getKey() + ")";
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + combatant.getKey() + ": " + request + "]";
    }
}
