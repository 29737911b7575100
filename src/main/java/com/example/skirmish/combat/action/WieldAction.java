package com.example.skirmish.combat.action;

import com.example.skirmish.combat.CombatHandler;
import com.example.skirmish.combat.Combatant;
import com.example.skirmish.model.Equipment;
import com.example.skirmish.model.Item;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Swap the wielded weapon or spell rune for one the combatant carries. Whatever the new item displaces goes to the backpack.
 */
public class WieldAction extends CombatAction {

    public WieldAction(CombatHandler handler, Combatant combatant, ActionRequest request) {
        super(handler, combatant, request);
    }

    @Override
    public boolean canUse() {
        Item item = request.getItem();
        return item != null && !item.isDestroyed() && item.getUseSlot().isHand()
                && combatant.getEquipment().contains(item);
    }

    @Override
    public String getRefusalMessage() {
        return "You cannot wield that.";
    }

    @Override
    public void execute() {
        Item item = request.getItem();
        Equipment equipment = combatant.getEquipment();

        if (equipment.get(item.getUseSlot()) == item) {
            msg("$You() already $conj(wield) " + item.getName() + ".");
            return;
        }

        List<Item> displaced = equipment.move(item);
        if (displaced.isEmpty()) {
            msg("$You() $conj(wield) " + item.getName() + ".");
        } else {
            String names = displaced.stream().map(Item::getName).collect(Collectors.joining(" and "));
            msg("$You() $conj(put) away " + names + " and $conj(wield) " + item.getName() + ".");
        }
    }
}
