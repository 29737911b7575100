package com.example.skirmish.model;

/**
 * An item that can be wielded, worn or used in combat.
 *
 * Weapons define which ability attacks with them, which ability of the target defends,
 * and their damage dice. Consumables have a limited number of uses and an {@link ItemEffect};
 * they are destroyed when the last use is spent.
 */
public class Item {

    /** Uses value for items that never run out. */
    public static final int UNLIMITED_USES = -1;

    /** What a combatant attacks with when nothing is wielded. */
    public static final Item EMPTY_FISTS = new Item("Empty Fists", WieldLocation.WEAPON_HAND,
            Ability.STR, Ability.ARMOR, "1d4", 0, UNLIMITED_USES, null);

    private final String key;
    private final WieldLocation useSlot;
    private final Ability attackType;
    private final Ability defenseType;
    private final String damageRoll;
    private final int armor;
    private final ItemEffect effect;

    private int uses;
    private boolean destroyed = false;

    public Item(String key, WieldLocation useSlot, Ability attackType, Ability defenseType,
                String damageRoll, int armor, int uses, ItemEffect effect) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Item key is required");
        }
        this.key = key;
        this.useSlot = useSlot != null ? useSlot : WieldLocation.BACKPACK;
        this.attackType = attackType != null ? attackType : Ability.STR;
        this.defenseType = defenseType != null ? defenseType : Ability.ARMOR;
        this.damageRoll = damageRoll != null ? damageRoll : "1d4";
        this.armor = armor;
        this.uses = uses;
        this.effect = effect;
    }

    // Factories

    /** A one-handed strength weapon. */
    public static Item weapon(String key, String damageRoll) {
        return new Item(key, WieldLocation.WEAPON_HAND, Ability.STR, Ability.ARMOR, damageRoll, 0, UNLIMITED_USES, null);
    }

    /** A weapon that needs both hands. */
    public static Item twoHandedWeapon(String key, String damageRoll) {
        return new Item(key, WieldLocation.TWO_HANDS, Ability.STR, Ability.ARMOR, damageRoll, 0, UNLIMITED_USES, null);
    }

    /** A spell rune: held in both hands, attacks with INT against DEX. */
    public static Item runestone(String key, String damageRoll) {
        return new Item(key, WieldLocation.TWO_HANDS, Ability.INT, Ability.DEX, damageRoll, 0, UNLIMITED_USES, null);
    }

    /** Worn protection (shield, body armor, helmet) adding to the wearer's ARMOR. */
    public static Item armor(String key, WieldLocation slot, int armor) {
        return new Item(key, slot, Ability.STR, Ability.ARMOR, "1d4", armor, UNLIMITED_USES, null);
    }

    /** A consumable kept in the backpack. */
    public static Item consumable(String key, int uses, ItemEffect effect) {
        return new Item(key, WieldLocation.BACKPACK, Ability.STR, Ability.ARMOR, "1d4", 0, uses, effect);
    }

    // Identification

    public String getKey() { return key; }

    public String getName() { return key; }

    // Combat properties

    public WieldLocation getUseSlot() { return useSlot; }

    public Ability getAttackType() { return attackType; }

    public Ability getDefenseType() { return defenseType; }

    public String getDamageRoll() { return damageRoll; }

    public int getArmor() { return armor; }

    public ItemEffect getEffect() { return effect; }

    // Uses

    public int getUses() { return uses; }

    public boolean hasUnlimitedUses() { return uses == UNLIMITED_USES; }

    /**
     * Whether the item can still be used: not destroyed, has an effect and uses left.
     */
    public boolean isUsable() {
        return !destroyed && effect != null && (hasUnlimitedUses() || uses > 0);
    }

    /**
     * Spend one use.
     * @return remaining uses ({@link #UNLIMITED_USES} for unlimited items)
     */
    public int consumeUse() {
        if (!hasUnlimitedUses() && uses > 0) {
            uses--;
        }
        return uses;
    }

    // Lifecycle

    public boolean isDestroyed() { return destroyed; }

    public void destroy() { this.destroyed = true; }

    @Override
    public String toString() {
        return "Item[" + key + " @" + useSlot.getKey() + (hasUnlimitedUses() ? "" : ", uses=" + uses)
                + (destroyed ? ", destroyed" : "") + "]";
    }
}
