package com.example.skirmish;

import com.example.skirmish.model.Equipment;
import com.example.skirmish.model.HealEffect;
import com.example.skirmish.model.Item;
import com.example.skirmish.model.WieldLocation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Equipment Tests")
public class EquipmentTest {

    private Equipment equipment;

    @BeforeEach
    void setUp() {
        equipment = new Equipment();
    }

    @Test
    @DisplayName("Empty hands fight with fists")
    void emptyFists() {
        assertSame(Item.EMPTY_FISTS, equipment.getWeapon());
        assertEquals("1d4", Item.EMPTY_FISTS.getDamageRoll());
        assertEquals(0, equipment.getArmorBonus());
    }

    @Test
    @DisplayName("Weapon and shield sit side by side")
    void weaponAndShield() {
        Item sword = Item.weapon("sword", "1d6");
        Item shield = Item.armor("shield", WieldLocation.SHIELD_HAND, 1);

        assertTrue(equipment.move(sword).isEmpty());
        assertTrue(equipment.move(shield).isEmpty());

        assertSame(sword, equipment.getWeapon());
        assertSame(shield, equipment.get(WieldLocation.SHIELD_HAND));
        assertEquals(1, equipment.getArmorBonus());
    }

    @Test
    @DisplayName("Two-handed items push both hands to the backpack")
    void twoHandedDisplacesBothHands() {
        Item sword = Item.weapon("sword", "1d6");
        Item shield = Item.armor("shield", WieldLocation.SHIELD_HAND, 1);
        Item zweihander = Item.twoHandedWeapon("zweihander", "1d10");
        equipment.move(sword);
        equipment.move(shield);

        List<Item> displaced = equipment.move(zweihander);

        assertEquals(List.of(sword, shield), displaced);
        assertNull(equipment.get(WieldLocation.WEAPON_HAND));
        assertNull(equipment.get(WieldLocation.SHIELD_HAND));
        assertSame(zweihander, equipment.getWeapon());
        assertEquals(List.of(sword, shield), equipment.getBackpack());
    }

    @Test
    @DisplayName("Armor in body and head slots adds up")
    void wornArmor() {
        equipment.move(Item.armor("leather", WieldLocation.BODY, 2));
        equipment.move(Item.armor("helmet", WieldLocation.HEAD, 1));
        assertEquals(3, equipment.getArmorBonus());
    }

    @Test
    @DisplayName("Backpack items cannot be equipped")
    void backpackItemCannotBeEquipped() {
        Item potion = Item.consumable("potion", 1, new HealEffect("1d4"));
        assertThrows(IllegalArgumentException.class, () -> equipment.move(potion));
        assertThrows(IllegalArgumentException.class, () -> equipment.move(null));
    }

    @Test
    @DisplayName("Add and remove track the backpack")
    void addRemove() {
        Item sword = Item.weapon("sword", "1d6");
        equipment.add(sword);
        equipment.add(sword);
        assertEquals(1, equipment.getBackpack().size());
        assertTrue(equipment.contains(sword));
        assertFalse(equipment.isEquipped(sword));

        equipment.move(sword);
        assertTrue(equipment.getBackpack().isEmpty());
        assertTrue(equipment.isEquipped(sword));

        assertTrue(equipment.remove(sword));
        assertFalse(equipment.contains(sword));
        assertFalse(equipment.remove(sword));
    }
}
