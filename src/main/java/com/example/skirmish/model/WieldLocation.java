package com.example.skirmish.model;

/**
 * Equipment locations. Each location holds at most one item, except BACKPACK which is
 * unbounded storage for everything not currently worn or wielded.
 *
 * TWO_HANDS is exclusive with WEAPON_HAND and SHIELD_HAND: filling one side clears the other.
 */
public enum WieldLocation {
    WEAPON_HAND(1, "weapon_hand", "Weapon Hand"),
    SHIELD_HAND(2, "shield_hand", "Shield Hand"),
    TWO_HANDS(3, "two_hands", "Two Hands"),
    BODY(4, "body", "Body"),
    HEAD(5, "head", "Head"),
    BACKPACK(6, "backpack", "Backpack");

    public final int id;
    public final String key;
    public final String displayName;

    WieldLocation(int id, String key, String displayName) {
        this.id = id;
        this.key = key;
        this.displayName = displayName;
    }

    public int getId() { return id; }
    public String getKey() { return key; }
    public String getDisplayName() { return displayName; }

    /** Whether this location is held in the hands (can be wielded in combat). */
    public boolean isHand() {
        return this == WEAPON_HAND || this == SHIELD_HAND || this == TWO_HANDS;
    }

    /** Whether this location is a single-item equipment slot. */
    public boolean isSlot() {
        return this != BACKPACK;
    }

    /**
     * Whether an item in this location and one in {@code other} cannot be equipped together.
     */
    public boolean conflictsWith(WieldLocation other) {
        if (other == null || this == BACKPACK || other == BACKPACK) return false;
        if (this == other) return true;
        if (this == TWO_HANDS) return other == WEAPON_HAND || other == SHIELD_HAND;
        if (other == TWO_HANDS) return this == WEAPON_HAND || this == SHIELD_HAND;
        return false;
    }
}
