package com.example.skirmish.combat.action;

import com.example.skirmish.combat.Combatant;
import com.example.skirmish.model.Ability;
import com.example.skirmish.model.Item;

import java.util.Objects;

/**
 * An immutable action declaration: what a combatant intends to do this turn.
 * Build one with the static factories; each sets exactly the parameters its action reads.
 */
public final class ActionRequest {

    private static final ActionRequest NOTHING =
            new ActionRequest(ActionType.NOTHING, null, null, null, true, null, null);
    private static final ActionRequest FLEE =
            new ActionRequest(ActionType.FLEE, null, null, null, true, null, null);

    private final ActionType type;
    private final Combatant target;
    private final Combatant recipient;
    private final Item item;
    private final boolean advantage;
    private final Ability stuntType;
    private final Ability defenseType;

    private ActionRequest(ActionType type, Combatant target, Combatant recipient, Item item,
                          boolean advantage, Ability stuntType, Ability defenseType) {
        this.type = type;
        this.target = target;
        this.recipient = recipient;
        this.item = item;
        this.advantage = advantage;
        this.stuntType = stuntType;
        this.defenseType = defenseType;
    }

    // Factories

    public static ActionRequest nothing() {
        return NOTHING;
    }

    public static ActionRequest attack(Combatant target) {
        Objects.requireNonNull(target, "attack needs a target");
        return new ActionRequest(ActionType.ATTACK, target, null, null, true, null, null);
    }

    /**
     * A stunt: if the actor's {@code stuntType} check beats the target's {@code defenseType},
     * the recipient gains advantage (or, with {@code advantage == false}, suffers disadvantage)
     * on its next check against the target.
     */
    public static ActionRequest stunt(Combatant recipient, Combatant target, boolean advantage,
                                      Ability stuntType, Ability defenseType) {
        Objects.requireNonNull(recipient, "stunt needs a recipient");
        Objects.requireNonNull(target, "stunt needs a target");
        Objects.requireNonNull(stuntType, "stunt needs a stunt type");
        Objects.requireNonNull(defenseType, "stunt needs a defense type");
        return new ActionRequest(ActionType.STUNT, target, recipient, null, advantage, stuntType, defenseType);
    }

    /**
     * Use an item on a target; a null target means the user itself.
     */
    public static ActionRequest use(Item item, Combatant target) {
        Objects.requireNonNull(item, "use needs an item");
        return new ActionRequest(ActionType.USE, target, null, item, true, null, null);
    }

    public static ActionRequest wield(Item item) {
        Objects.requireNonNull(item, "wield needs an item");
        return new ActionRequest(ActionType.WIELD, null, null, item, true, null, null);
    }

    public static ActionRequest flee() {
        return FLEE;
    }

    public static ActionRequest hinder(Combatant target) {
        Objects.requireNonNull(target, "hinder needs a target");
        return new ActionRequest(ActionType.HINDER, target, null, null, true, null, null);
    }

    // Accessors

    public ActionType getType() { return type; }
    public Combatant getTarget() { return target; }
    public Combatant getRecipient() { return recipient; }
    public Item getItem() { return item; }
    public boolean isAdvantage() { return advantage; }
    public Ability getStuntType() { return stuntType; }
    public Ability getDefenseType() { return defenseType; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ActionRequest[").append(type.getKey());
        if (target != null) sb.append(", target=").append(target.getKey());
        if (recipient != null) sb.append(", recipient=").append(recipient.getKey());
        if (item != null) sb.append(", item=").append(item.getKey());
        if (type == ActionType.STUNT) {
            sb.append(", ").append(advantage ? "advantage" : "disadvantage")
              .append(", ").append(stuntType).append(" vs ").append(defenseType);
        }
        return sb.append(']').toString();
    }
}
