package com.example.skirmish.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Worn and wielded items of one character, plus the backpack.
 * Slots honour {@link WieldLocation#conflictsWith}: equipping a two-handed item empties both
 * hand slots, and equipping a one-handed item empties the two-hands slot.
 */
public class Equipment {

    private final Map<WieldLocation, Item> slots = new EnumMap<>(WieldLocation.class);
    private final List<Item> backpack = new ArrayList<>();

    public Equipment() {
        for (WieldLocation loc : WieldLocation.values()) {
            if (loc.isSlot()) slots.put(loc, null);
        }
    }

    /**
     * Item in a slot, or null if empty.
     */
    public Item get(WieldLocation location) {
        return slots.get(location);
    }

    /**
     * All slots (empty ones map to null).
     */
    public Map<WieldLocation, Item> getSlots() {
        return Collections.unmodifiableMap(slots);
    }

    public List<Item> getBackpack() {
        return Collections.unmodifiableList(backpack);
    }

    /**
     * Put an item in the backpack.
     */
    public void add(Item item) {
        if (item != null && !backpack.contains(item) && !isEquipped(item)) {
            backpack.add(item);
        }
    }

    /**
     * Remove an item from wherever it is.
     * @return true if the item was carried
     */
    public boolean remove(Item item) {
        for (Map.Entry<WieldLocation, Item> e : slots.entrySet()) {
            if (e.getValue() == item) {
                e.setValue(null);
                return true;
            }
        }
        return backpack.remove(item);
    }

    public boolean contains(Item item) {
        return isEquipped(item) || backpack.contains(item);
    }

    public boolean isEquipped(Item item) {
        return item != null && slots.containsValue(item);
    }

    /**
     * Equip an item into its use slot. Items occupying that slot or a conflicting one
     * are moved to the backpack. Equipping an item that is already in place changes nothing.
     *
     * @return the items that were displaced into the backpack
     */
    public List<Item> move(Item item) {
        if (item == null) {
            throw new IllegalArgumentException("Cannot equip null");
        }
        WieldLocation target = item.getUseSlot();
        if (!target.isSlot()) {
            throw new IllegalArgumentException(item.getName() + " cannot be equipped");
        }
        if (slots.get(target) == item) {
            return Collections.emptyList();
        }
        // item may be equipped elsewhere, or in the backpack
        remove(item);

        List<Item> displaced = new ArrayList<>();
        for (Map.Entry<WieldLocation, Item> e : slots.entrySet()) {
            if (e.getValue() != null && target.conflictsWith(e.getKey())) {
                displaced.add(e.getValue());
                e.setValue(null);
            }
        }
        slots.put(target, item);
        backpack.addAll(displaced);
        return displaced;
    }

    /**
     * The weapon currently used for attacks: a two-handed item, else the weapon hand item,
     * else {@link Item#EMPTY_FISTS}.
     */
    public Item getWeapon() {
        Item twoHands = slots.get(WieldLocation.TWO_HANDS);
        if (twoHands != null) return twoHands;
        Item weaponHand = slots.get(WieldLocation.WEAPON_HAND);
        if (weaponHand != null) return weaponHand;
        return Item.EMPTY_FISTS;
    }

    /**
     * Total armor of everything worn or wielded.
     */
    public int getArmorBonus() {
        int total = 0;
        for (Item item : slots.values()) {
            if (item != null) total += item.getArmor();
        }
        return total;
    }
}
