package com.example.skirmish.combat.action;

import com.example.skirmish.combat.CombatHandler;
import com.example.skirmish.combat.Combatant;
import com.example.skirmish.model.Item;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Use an item (potion, scroll, ...) on a target, or on oneself when no target is given.
 * Each use spends one charge; the item is destroyed when the last one is gone.
 */
public class UseItemAction extends CombatAction {

    private static final Logger logger = LoggerFactory.getLogger(UseItemAction.class);

    public UseItemAction(CombatHandler handler, Combatant combatant, ActionRequest request) {
        super(handler, combatant, request);
    }

    private Combatant target() {
        return request.getTarget() != null ? request.getTarget() : combatant;
    }

    @Override
    public boolean canUse() {
        Item item = request.getItem();
        return item != null && item.isUsable() && combatant.getEquipment().contains(item)
                && handler.isEngaged(target());
    }

    @Override
    public String getRefusalMessage() {
        Item item = request.getItem();
        if (item != null && !item.isUsable()) {
            return "The " + item.getName() + " cannot be used any more.";
        }
        if (item != null && !combatant.getEquipment().contains(item)) {
            return "You are not carrying that.";
        }
        return "There is nobody to use that on.";
    }

    @Override
    public void execute() {
        Item item = request.getItem();
        Combatant target = target();

        if (target == combatant) {
            msg("$You() $conj(use) " + item.getName() + ".");
        } else {
            msg("$You() $conj(use) " + item.getName() + " on " + you(target) + ".");
        }

        String outcome = item.getEffect().apply(item, combatant, target, calculator().getDice());
        if (outcome != null) {
            msg(outcome);
        }

        int remaining = item.consumeUse();
        logger.debug("{} used {} on {}, {} uses left", combatant.getKey(), item.getKey(), target.getKey(), remaining);
        if (!item.hasUnlimitedUses() && remaining <= 0) {
            item.destroy();
            combatant.getEquipment().remove(item);
            msg("$Your() " + item.getName() + " is used up.");
        }
    }
}
