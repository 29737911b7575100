package com.example.skirmish;

import com.example.skirmish.combat.CombatConfig;
import com.example.skirmish.combat.CombatHandler;
import com.example.skirmish.combat.CombatManager;
import com.example.skirmish.combat.action.ActionRequest;
import com.example.skirmish.combat.action.ActionType;
import com.example.skirmish.combat.action.CombatAction;
import com.example.skirmish.model.Ability;
import com.example.skirmish.model.GameCharacter;
import com.example.skirmish.model.HealEffect;
import com.example.skirmish.model.Item;
import com.example.skirmish.model.Mobile;
import com.example.skirmish.model.Room;
import com.example.skirmish.model.WieldLocation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the action resolvers, run through a live combat handler.
 * Both fighters have every ability at 1, so a defense is 11 and a roll of 10 or less misses.
 */
@DisplayName("Combat Action Tests")
public class CombatActionTest {

    private FixedDice dice;
    private CombatManager manager;
    private GameCharacter player;
    private Mobile monster;
    private final List<String> playerMessages = new ArrayList<>();
    private CombatHandler handler;

    @BeforeEach
    void setUp() {
        dice = new FixedDice(8);
        manager = new CombatManager(CombatConfig.defaults(), dice);
        Room room = new Room(1, "Arena");

        player = new GameCharacter("testchar", 4);
        player.setOutput(playerMessages::add);
        player.setLocation(room);

        monster = new Mobile("testmonster", 4);
        monster.setLocation(room);

        handler = manager.startCombat(player, monster);
    }

    private void run(GameCharacter actor, ActionRequest request) {
        handler.queueAction(actor, request);
        handler.executeNextAction(actor);
    }

    private String lastPlayerMessage() {
        return playerMessages.get(playerMessages.size() - 1);
    }

    // ==================== Helpers ====================

    @Test
    @DisplayName("Resolver helpers manage advantage, disadvantage and fleeing")
    void actionHelpers() {
        CombatAction action = ActionType.NOTHING.createResolver(handler, player, ActionRequest.nothing());

        action.giveAdvantage(player, monster);
        action.giveDisadvantage(monster, player);
        assertTrue(action.hasAdvantage(player, monster));
        assertTrue(action.hasDisadvantage(monster, player));
        assertFalse(action.hasAdvantage(monster, player));

        action.loseAdvantage(player, monster);
        action.loseDisadvantage(monster, player);
        assertFalse(action.hasAdvantage(player, monster));
        assertFalse(action.hasDisadvantage(monster, player));

        action.flee(player);
        assertTrue(handler.isFleeing(player));
        action.unflee(player);
        assertFalse(handler.isFleeing(player));

        action.msg("$You() attack $You(testmonster).");
        assertEquals("You attack testmonster.", lastPlayerMessage());
    }

    @Test
    @DisplayName("Doing nothing changes nothing")
    void doNothing() {
        run(player, ActionRequest.nothing());

        assertEquals(4, player.getHp());
        assertEquals(4, monster.getHp());
        assertEquals("You hold back, doing nothing this turn.", lastPlayerMessage());
    }

    // ==================== Attack ====================

    @Test
    @DisplayName("Attack roll of 8 misses")
    void attackMiss() {
        run(player, ActionRequest.attack(monster));

        assertEquals(4, monster.getHp());
        assertEquals("You attack testmonster with Empty Fists but miss.", lastPlayerMessage());
    }

    @Test
    @DisplayName("Attack roll of 11 hits for the damage roll")
    void attackHit() {
        dice.setValue(11);
        run(player, ActionRequest.attack(monster));

        assertEquals(-7, monster.getHp());
        assertTrue(playerMessages.contains("You hit testmonster with Empty Fists for 11 damage."));
        assertEquals("testmonster cannot fight on.", lastPlayerMessage());
    }

    @Test
    @DisplayName("Killing the last enemy ends and unregisters the combat")
    void attackKillEndsCombat() {
        dice.setValue(11);
        handler.queueAction(player, ActionRequest.attack(monster));
        handler.executeFullTurn();

        assertEquals(-7, monster.getHp());
        assertTrue(monster.isDefeated());
        assertTrue(handler.hasEnded());
        assertFalse(manager.isInCombat(player));
        assertFalse(manager.isInCombat(monster));
        assertTrue(manager.getRegistry().findById(handler.getId()).isEmpty());
    }

    @Test
    @DisplayName("Natural maximum is a critical hit with a second damage roll")
    void attackCritical() {
        dice.setValue(20);
        run(player, ActionRequest.attack(monster));

        assertEquals(4 - 40, monster.getHp());
        assertTrue(playerMessages.contains("You land a critical hit!"));
    }

    @Test
    @DisplayName("Natural 1 is a critical miss")
    void attackCriticalFailure() {
        monster.setAbility(Ability.ARMOR, -20);
        dice.setValue(1);
        run(player, ActionRequest.attack(monster));

        assertEquals(4, monster.getHp());
        assertEquals("You stumble, missing testmonster badly.", lastPlayerMessage());
    }

    @Test
    @DisplayName("Runestones attack with INT against DEX")
    void runestoneAttack() {
        Item runestone = Item.runestone("fire rune", "1d8");
        player.getEquipment().move(runestone);
        player.setAbility(Ability.INT, 4);
        monster.setAbility(Ability.ARMOR, 10);
        dice.setValue(8);

        run(player, ActionRequest.attack(monster));

        // 8 + 4 INT beats 10 + 1 DEX, armor is irrelevant
        assertEquals(4 - 8, monster.getHp());
    }

    @Test
    @DisplayName("Attacking oneself is refused")
    void attackSelfRefused() {
        dice.setValue(11);
        run(player, ActionRequest.attack(player));

        assertEquals(4, player.getHp());
        assertEquals("Your target is no longer there to attack.", lastPlayerMessage());
    }

    @Test
    @DisplayName("Advantage is consumed by the next check against that target")
    void advantageConsumedByAttack() {
        handler.giveAdvantage(player, monster);
        dice.setValue(2);
        dice.queue(5, 15);

        run(player, ActionRequest.attack(monster));

        // best of 5 and 15 hits, then 1d4 rolls 2
        assertEquals(2, monster.getHp());
        assertFalse(handler.hasAdvantage(player, monster));
    }

    @Test
    @DisplayName("Disadvantage keeps the lower roll")
    void disadvantageOnAttack() {
        handler.giveDisadvantage(player, monster);
        dice.queue(15, 5);

        run(player, ActionRequest.attack(monster));

        assertEquals(4, monster.getHp());
        assertFalse(handler.hasDisadvantage(player, monster));
    }

    // ==================== Stunt ====================

    @Test
    @DisplayName("Failed stunt grants nothing")
    void stuntFail() {
        run(player, ActionRequest.stunt(player, monster, true, Ability.STR, Ability.DEX));

        assertFalse(handler.hasAdvantage(player, monster));
        assertTrue(handler.getAdvantages(player).isEmpty());
    }

    @Test
    @DisplayName("Successful stunt grants advantage to the recipient")
    void stuntAdvantage() {
        dice.setValue(11);
        run(player, ActionRequest.stunt(player, monster, true, Ability.STR, Ability.DEX));

        assertTrue(handler.hasAdvantage(player, monster));
        assertFalse(handler.hasAdvantage(monster, player));
    }

    @Test
    @DisplayName("Successful hindering stunt gives the target's side disadvantage")
    void stuntDisadvantage() {
        dice.setValue(11);
        run(player, ActionRequest.stunt(monster, player, false, Ability.STR, Ability.DEX));

        assertTrue(handler.hasDisadvantage(monster, player));
        assertFalse(handler.hasAdvantage(monster, player));
    }

    @Test
    @DisplayName("Stunt with the same recipient and target is refused")
    void stuntSameRecipientAndTarget() {
        dice.setValue(11);
        run(player, ActionRequest.stunt(monster, monster, true, Ability.STR, Ability.DEX));

        assertTrue(handler.getAdvantages(monster).isEmpty());
        assertEquals("Your stunt has nobody left to affect.", lastPlayerMessage());
    }

    // ==================== Use ====================

    @Test
    @DisplayName("Potion heals, spends a use, and is destroyed when empty")
    void useItem() {
        Item potion = Item.consumable("potion", 2, new HealEffect("1d6"));
        player.getEquipment().add(potion);
        player.setHp(1);
        dice.setValue(2);

        run(player, ActionRequest.use(potion, null));
        assertEquals(3, player.getHp());
        assertEquals(1, potion.getUses());
        assertFalse(potion.isDestroyed());

        run(player, ActionRequest.use(potion, null));
        assertEquals(4, player.getHp());
        assertEquals(0, potion.getUses());
        assertTrue(potion.isDestroyed());
        assertFalse(player.getEquipment().contains(potion));

        run(player, ActionRequest.use(potion, null));
        assertEquals("The potion cannot be used any more.", lastPlayerMessage());
    }

    @Test
    @DisplayName("Items can be used on another combatant")
    void useItemOnOther() {
        Item potion = Item.consumable("potion", 1, new HealEffect("1d6"));
        player.getEquipment().add(potion);
        monster.setHp(1);
        dice.setValue(3);

        run(player, ActionRequest.use(potion, monster));

        assertEquals(4, monster.getHp());
        assertTrue(playerMessages.contains("testmonster's wounds close for 3 health."));
    }

    @Test
    @DisplayName("Items the user does not carry cannot be used")
    void useUncarriedItemRefused() {
        Item potion = Item.consumable("potion", 1, new HealEffect("1d6"));
        monster.getEquipment().add(potion);
        player.setHp(1);

        run(player, ActionRequest.use(potion, null));

        assertEquals(1, player.getHp());
        assertEquals(1, potion.getUses());
        assertTrue(monster.getEquipment().contains(potion));
        assertEquals("You are not carrying that.", lastPlayerMessage());
    }

    // ==================== Wield ====================

    @Test
    @DisplayName("Wielding moves displaced items back to the backpack")
    void wieldSequence() {
        Item sword = Item.weapon("sword", "1d6");
        Item zweihander = Item.twoHandedWeapon("zweihander", "1d10");
        Item runestone = Item.runestone("runestone", "1d8");
        player.getEquipment().add(sword);
        player.getEquipment().add(zweihander);
        player.getEquipment().add(runestone);

        run(player, ActionRequest.wield(sword));
        assertSame(sword, player.getEquipment().get(WieldLocation.WEAPON_HAND));
        assertNull(player.getEquipment().get(WieldLocation.TWO_HANDS));
        assertSame(sword, player.getWeapon());

        run(player, ActionRequest.wield(zweihander));
        assertNull(player.getEquipment().get(WieldLocation.WEAPON_HAND));
        assertSame(zweihander, player.getEquipment().get(WieldLocation.TWO_HANDS));
        assertTrue(player.getEquipment().getBackpack().contains(sword));

        run(player, ActionRequest.wield(runestone));
        assertNull(player.getEquipment().get(WieldLocation.WEAPON_HAND));
        assertSame(runestone, player.getEquipment().get(WieldLocation.TWO_HANDS));
        assertTrue(player.getEquipment().getBackpack().contains(zweihander));

        run(player, ActionRequest.wield(sword));
        assertSame(sword, player.getEquipment().get(WieldLocation.WEAPON_HAND));
        assertNull(player.getEquipment().get(WieldLocation.TWO_HANDS));
        assertTrue(player.getEquipment().getBackpack().contains(runestone));
        assertFalse(player.getEquipment().getBackpack().contains(sword));
    }

    @Test
    @DisplayName("Wielding what is already wielded changes nothing")
    void wieldIdempotent() {
        Item sword = Item.weapon("sword", "1d6");
        player.getEquipment().add(sword);

        run(player, ActionRequest.wield(sword));
        run(player, ActionRequest.wield(sword));

        assertSame(sword, player.getEquipment().get(WieldLocation.WEAPON_HAND));
        assertEquals("You already wield sword.", lastPlayerMessage());
    }

    @Test
    @DisplayName("Consumables cannot be wielded")
    void wieldConsumableRefused() {
        Item potion = Item.consumable("potion", 1, new HealEffect("1d6"));
        player.getEquipment().add(potion);

        run(player, ActionRequest.wield(potion));

        assertTrue(player.getEquipment().getBackpack().contains(potion));
        assertEquals("You cannot wield that.", lastPlayerMessage());
    }

    @Test
    @DisplayName("Someone else's weapon cannot be wielded")
    void wieldUncarriedRefused() {
        Item sword = Item.weapon("sword", "1d6");
        monster.getEquipment().move(sword);

        run(player, ActionRequest.wield(sword));

        assertNull(player.getEquipment().get(WieldLocation.WEAPON_HAND));
        assertFalse(player.getEquipment().contains(sword));
        assertSame(sword, monster.getEquipment().get(WieldLocation.WEAPON_HAND));
        assertEquals("You cannot wield that.", lastPlayerMessage());
    }

    // ==================== Flee and hinder ====================

    @Test
    @DisplayName("Fleeing for a full extra turn escapes the fight")
    void fleeEscapes() {
        handler.queueAction(player, ActionRequest.flee());
        handler.executeFullTurn();

        assertTrue(handler.isActive());
        assertEquals(Integer.valueOf(0), handler.getFleeingCombatants().get(player));

        handler.queueAction(player, ActionRequest.flee());
        handler.executeFullTurn();

        assertTrue(playerMessages.contains("You escape from the fight."));
        assertFalse(manager.isInCombat(player));
        assertFalse(player.isDefeated());
        assertTrue(handler.hasEnded());
    }

    @Test
    @DisplayName("Escaped combatants are recorded while others keep fighting")
    void fleeRecordedAsDefeated() {
        GameCharacter friend = new GameCharacter("friend", 4);
        handler.addCombatants(friend);

        handler.queueAction(player, ActionRequest.flee());
        handler.executeFullTurn();
        handler.queueAction(player, ActionRequest.flee());
        handler.executeFullTurn();

        assertTrue(handler.isActive());
        assertTrue(handler.getDefeatedCombatants().contains(player));
        assertFalse(handler.isEngaged(player));
    }

    @Test
    @DisplayName("A successful hinder stops the escape")
    void hinderBlocksFlee() {
        handler.queueAction(player, ActionRequest.flee());
        handler.executeFullTurn();

        dice.setValue(11);
        handler.queueAction(player, ActionRequest.flee());
        handler.queueAction(monster, ActionRequest.hinder(player));
        handler.executeFullTurn();

        assertFalse(handler.isFleeing(player));
        assertTrue(handler.isEngaged(player));
        assertTrue(handler.isActive());
        assertTrue(playerMessages.contains("testmonster blocks your escape!"));
    }

    @Test
    @DisplayName("A failed hinder leaves the flee attempt running")
    void hinderFails() {
        handler.flee(player);

        run(monster, ActionRequest.hinder(player));

        assertTrue(handler.isFleeing(player));
    }

    @Test
    @DisplayName("Hindering someone who is not fleeing does nothing")
    void hinderNotFleeing() {
        dice.setValue(11);
        run(monster, ActionRequest.hinder(player));

        assertFalse(handler.isFleeing(player));
        assertEquals("testmonster moves to block you, but nobody is trying to leave.", lastPlayerMessage());
    }

    @Test
    @DisplayName("Choosing to attack abandons a flee attempt")
    void attackCancelsFlee() {
        handler.flee(player);

        run(player, ActionRequest.attack(monster));

        assertFalse(handler.isFleeing(player));
        assertTrue(playerMessages.contains("You give up trying to flee."));
    }

    @Test
    @DisplayName("Doing nothing keeps a flee attempt running")
    void nothingKeepsFlee() {
        handler.flee(player);

        run(player, ActionRequest.nothing());

        assertTrue(handler.isFleeing(player));
    }
}
