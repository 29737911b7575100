package com.example.skirmish.combat.action;

import com.example.skirmish.combat.CombatHandler;
import com.example.skirmish.combat.Combatant;

/**
 * Every kind of action a combatant can queue, each bound to its resolver.
 */
public enum ActionType {
    NOTHING("nothing", "Do nothing", false, DoNothingAction::new),
    ATTACK("attack", "Attack", true, AttackAction::new),
    STUNT("stunt", "Stunt", true, StuntAction::new),
    USE("use", "Use item", true, UseItemAction::new),
    WIELD("wield", "Wield", true, WieldAction::new),
    FLEE("flee", "Flee", false, FleeAction::new),
    HINDER("hinder", "Hinder", true, HinderAction::new);

    /**
     * Builds the resolver for one queued request.
     */
    @FunctionalInterface
    public interface ResolverFactory {
        CombatAction create(CombatHandler handler, Combatant combatant, ActionRequest request);
    }

    public final String key;
    public final String displayName;
    private final boolean cancelsFlee;
    private final ResolverFactory factory;

    ActionType(String key, String displayName, boolean cancelsFlee, ResolverFactory factory) {
        this.key = key;
        this.displayName = displayName;
        this.cancelsFlee = cancelsFlee;
        this.factory = factory;
    }

    public String getKey() { return key; }
    public String getDisplayName() { return displayName; }

    /** Whether choosing this action abandons the actor's own flee attempt. */
    public boolean cancelsFlee() { return cancelsFlee; }

    public CombatAction createResolver(CombatHandler handler, Combatant combatant, ActionRequest request) {
        return factory.create(handler, combatant, request);
    }
}
