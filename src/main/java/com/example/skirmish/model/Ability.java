package com.example.skirmish.model;

/**
 * Ability scores used for checks. Scores are bonuses (typically 1-6), not 3-18 attributes.
 * ARMOR is the defense score against weapon attacks.
 */
public enum Ability {
    STR("str", "Strength"),
    DEX("dex", "Dexterity"),
    CON("con", "Constitution"),
    INT("int", "Intelligence"),
    WIS("wis", "Wisdom"),
    CHA("cha", "Charisma"),
    ARMOR("armor", "Armor");

    public final String key;
    public final String displayName;

    Ability(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String getKey() { return key; }
    public String getDisplayName() { return displayName; }
}
