package com.example.skirmish.combat;

/**
 * Lifecycle state of a combat handler.
 */
public enum CombatState {

    /** Accepting combatants and resolving turns */
    ACTIVE("Active"),

    /** Torn down: one side left, everyone fled, or stopped explicitly */
    ENDED("Ended");

    private final String displayName;

    CombatState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
