package com.example.skirmish.combat;

import com.example.skirmish.combat.action.ActionRequest;
import com.example.skirmish.combat.action.CombatAction;
import com.example.skirmish.model.Location;
import com.example.skirmish.util.MessageTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One active fight.
 *
 * Each combatant queues at most one action per turn. {@link #executeFullTurn()} resolves the
 * queued actions in the order combatants joined, against the state as it is at that moment:
 * an earlier action can kill a target before the target's own action runs. After everyone has
 * acted, defeated and escaped combatants are removed and the fight ends once no two remaining
 * combatants are hostile to each other.
 *
 * All mutating operations synchronize on the handler, so actions may be queued from other
 * threads while a scheduler drives the turns.
 */
public class CombatHandler {

    private static final Logger logger = LoggerFactory.getLogger(CombatHandler.class);

    private final long id;
    private final CombatRegistry registry;
    private final CombatCalculator calculator;
    private final CombatConfig config;

    private CombatState state = CombatState.ACTIVE;

    /** Combatants in join order, each with its pending action (at most one) */
    private final Map<Combatant, Deque<ActionRequest>> combatants = new LinkedHashMap<>();

    private final AdvantageMatrix advantageMatrix = new AdvantageMatrix();
    private final AdvantageMatrix disadvantageMatrix = new AdvantageMatrix();

    /** Fleeing combatant -> turn the flee attempt started */
    private final Map<Combatant, Integer> fleeingCombatants = new LinkedHashMap<>();

    /** Combatants removed for being defeated or for escaping */
    private final Set<Combatant> defeatedCombatants = new LinkedHashSet<>();

    private int turn = 0;

    private final long startedAt;
    private long turnStartedAt;

    CombatHandler(long id, CombatRegistry registry, CombatCalculator calculator) {
        this.id = id;
        this.registry = registry;
        this.calculator = calculator;
        this.config = calculator.getConfig();
        this.startedAt = System.currentTimeMillis();
        this.turnStartedAt = startedAt;
    }

    /**
     * The handler the combatant is fighting in, or a new one containing just that combatant.
     *
     * @throws IllegalStateException if the combatant's location does not allow combat
     */
    public static CombatHandler getOrCreate(Combatant combatant, CombatRegistry registry, CombatCalculator calculator) {
        synchronized (registry) {
            Optional<CombatHandler> existing = registry.findByCombatant(combatant);
            if (existing.isPresent() && existing.get().isActive()) {
                return existing.get();
            }
            Location location = combatant.getLocation();
            if (location != null && !location.isCombatAllowed()) {
                throw new IllegalStateException("Combat is not allowed where " + combatant.getName() + " is.");
            }
            CombatHandler handler = new CombatHandler(registry.nextId(), registry, calculator);
            registry.registerHandler(handler);
            handler.addCombatants(combatant);
            logger.info("[Combat #{}] Started by {}", handler.id, combatant.getName());
            return handler;
        }
    }

    // ========== Identification ==========

    public long getId() { return id; }

    public CombatState getState() { return state; }

    public boolean isActive() { return state == CombatState.ACTIVE; }

    public boolean hasEnded() { return state == CombatState.ENDED; }

    public int getTurn() { return turn; }

    public long getTurnStartedAt() { return turnStartedAt; }

    public CombatCalculator getCalculator() { return calculator; }

    // ========== Combatants ==========

    /**
     * Add combatants, each with an empty action queue. Combatants already in this fight are skipped.
     *
     * @throws IllegalArgumentException if one of them is fighting in another combat
     * @throws IllegalStateException if this combat has ended
     */
    public synchronized void addCombatants(Combatant... newCombatants) {
        ensureActive();
        for (Combatant c : newCombatants) {
            if (c == null) {
                throw new IllegalArgumentException("Cannot add null combatant");
            }
            Optional<CombatHandler> other = registry.findByCombatant(c);
            if (other.isPresent() && other.get() != this) {
                throw new IllegalArgumentException(c.getName() + " is already fighting in combat #" + other.get().getId());
            }
        }
        for (Combatant c : newCombatants) {
            if (combatants.containsKey(c)) {
                continue;
            }
            if (!registry.bind(c, this)) {
                throw new IllegalArgumentException(c.getName() + " joined another combat");
            }
            combatants.put(c, new ArrayDeque<>(1));
            logger.debug("[Combat #{}] {} joins", id, c.getName());
        }
    }

    /**
     * Remove a combatant from every table and clear its back-reference.
     * Does not check whether the fight should end.
     *
     * @return whether the combatant was in this fight
     */
    public synchronized boolean removeCombatant(Combatant combatant) {
        if (combatants.remove(combatant) == null) {
            return false;
        }
        advantageMatrix.purge(combatant);
        disadvantageMatrix.purge(combatant);
        fleeingCombatants.remove(combatant);
        registry.unbind(combatant, this);
        logger.debug("[Combat #{}] {} leaves", id, combatant.getName());
        return true;
    }

    public synchronized boolean isEngaged(Combatant combatant) {
        return combatant != null && combatants.containsKey(combatant);
    }

    /** Snapshot of the combatants in join order. */
    public synchronized List<Combatant> getCombatants() {
        return new ArrayList<>(combatants.keySet());
    }

    /**
     * The action queued for this turn, if any.
     * @throws IllegalArgumentException if the combatant is not in this fight
     */
    public synchronized Optional<ActionRequest> getPendingAction(Combatant combatant) {
        return Optional.ofNullable(requireCombatant(combatant).peek());
    }

    /**
     * Allies and enemies of a combatant among the other combatants, in join order.
     * @throws IllegalArgumentException if the combatant is not in this fight
     */
    public synchronized Sides getSides(Combatant combatant) {
        requireCombatant(combatant);
        List<Combatant> allies = new ArrayList<>();
        List<Combatant> enemies = new ArrayList<>();
        for (Combatant other : combatants.keySet()) {
            if (other == combatant) continue;
            if (combatant.isHostileTo(other)) {
                enemies.add(other);
            } else {
                allies.add(other);
            }
        }
        return new Sides(allies, enemies);
    }

    /**
     * Whether at least two remaining combatants are hostile to each other.
     */
    public synchronized boolean hasOpposingSides() {
        List<Combatant> live = new ArrayList<>(combatants.keySet());
        for (int i = 0; i < live.size(); i++) {
            for (int j = i + 1; j < live.size(); j++) {
                if (live.get(i).isHostileTo(live.get(j)) || live.get(j).isHostileTo(live.get(i))) {
                    return true;
                }
            }
        }
        return false;
    }

    // ========== Actions ==========

    /**
     * Queue the combatant's action for this turn, replacing any earlier one.
     *
     * @throws IllegalArgumentException if the combatant is not in this fight
     * @throws IllegalStateException if this combat has ended
     */
    public synchronized void queueAction(Combatant combatant, ActionRequest request) {
        ensureActive();
        if (request == null) {
            throw new IllegalArgumentException("Action request is required");
        }
        Deque<ActionRequest> queue = requireCombatant(combatant);
        queue.clear();
        queue.add(request);
        logger.debug("[Combat #{}] {} queued {}", id, combatant.getName(), request);
    }

    /**
     * Whether every combatant has queued an action for this turn.
     */
    public synchronized boolean isTurnReady() {
        if (combatants.isEmpty()) return false;
        for (Deque<ActionRequest> queue : combatants.values()) {
            if (queue.isEmpty()) return false;
        }
        return true;
    }

    /**
     * Resolve the combatant's queued action, or do nothing if none was queued.
     * A resolver that cannot be used (target gone, item used up) reports why and changes nothing;
     * a resolver that fails unexpectedly is logged and does not affect anyone else.
     *
     * @throws IllegalArgumentException if the combatant is not in this fight
     * @throws IllegalStateException if this combat has ended
     */
    public synchronized void executeNextAction(Combatant combatant) {
        ensureActive();
        ActionRequest request = requireCombatant(combatant).poll();
        if (request == null) {
            request = ActionRequest.nothing();
        }
        try {
            if (request.getType().cancelsFlee() && fleeingCombatants.containsKey(combatant)) {
                unflee(combatant);
                msg("$You() $conj(give) up trying to flee.", combatant);
            }

            CombatAction action = request.getType().createResolver(this, combatant, request);
            if (action.canUse()) {
                action.execute();
            } else {
                logger.debug("[Combat #{}] {} cannot use {}", id, combatant.getName(), request);
                combatant.sendMessage(action.getRefusalMessage());
            }
        } catch (RuntimeException e) {
            logger.warn("[Combat #{}] {} failed on {}: {}", id, combatant.getName(), request, e.getMessage(), e);
            notifyFailure(combatant);
        }
    }

    private void notifyFailure(Combatant combatant) {
        try {
            combatant.sendMessage("Your action falters.");
        } catch (RuntimeException e) {
            logger.warn("[Combat #{}] Could not notify {}: {}", id, combatant.getName(), e.getMessage(), e);
        }
    }

    /**
     * Resolve one full turn: every combatant's action in join order, then defeat and escape
     * cleanup, then the end-of-combat check.
     *
     * @throws IllegalStateException if this combat has ended
     */
    public synchronized void executeFullTurn() {
        ensureActive();
        List<Combatant> order = new ArrayList<>(combatants.keySet());
        logger.debug("[Combat #{}] Resolving turn {} for {} combatants", id, turn, order.size());

        for (Combatant c : order) {
            if (!isActive()) {
                return;
            }
            if (!combatants.containsKey(c)) {
                continue;
            }
            if (c.getHp() <= 0) {
                // went down earlier this turn
                combatants.get(c).clear();
                continue;
            }
            executeNextAction(c);
        }
        if (!isActive()) {
            return;
        }

        // unused flags only last for the turn they were given in
        advantageMatrix.clear();
        disadvantageMatrix.clear();

        turn++;
        turnStartedAt = System.currentTimeMillis();
        removeDefeatedAndEscaped();

        if (!hasOpposingSides()) {
            stopCombat();
        }
    }

    private void removeDefeatedAndEscaped() {
        List<Combatant> leaving = new ArrayList<>();
        for (Combatant c : combatants.keySet()) {
            if (c.getHp() <= 0) {
                msg("$You() $conj(collapse), defeated.", c);
                leaving.add(c);
            } else {
                Integer fleeStart = fleeingCombatants.get(c);
                if (fleeStart != null && turn - fleeStart > config.getFleeTimeout()) {
                    msg("$You() $conj(escape) from the fight.", c);
                    leaving.add(c);
                }
            }
        }
        for (Combatant c : leaving) {
            boolean defeated = c.getHp() <= 0;
            defeatedCombatants.add(c);
            removeCombatant(c);
            if (defeated) {
                try {
                    c.atDefeat();
                } catch (RuntimeException e) {
                    logger.warn("[Combat #{}] Defeat hook for {} failed: {}", id, c.getName(), e.getMessage(), e);
                }
                logger.info("[Combat #{}] {} defeated on turn {}", id, c.getName(), turn);
            } else {
                logger.info("[Combat #{}] {} fled on turn {}", id, c.getName(), turn);
            }
        }
    }

    /**
     * Tear down the fight: clear every table and back-reference and mark the handler ended.
     * Calling it again does nothing.
     */
    public synchronized void stopCombat() {
        if (!isActive()) {
            return;
        }
        if (!combatants.isEmpty()) {
            msg("The fight is over.");
        }
        for (Combatant c : combatants.keySet()) {
            registry.unbind(c, this);
        }
        combatants.clear();
        advantageMatrix.clear();
        disadvantageMatrix.clear();
        fleeingCombatants.clear();
        defeatedCombatants.clear();
        state = CombatState.ENDED;
        registry.unregisterHandler(this);
        logger.info("[Combat #{}] Ended after {} turns ({}s)", id, turn,
                (System.currentTimeMillis() - startedAt) / 1000);
    }

    // ========== Advantage / disadvantage ==========

    public synchronized void giveAdvantage(Combatant recipient, Combatant target) {
        requireCombatant(recipient);
        requireCombatant(target);
        advantageMatrix.give(recipient, target);
    }

    public synchronized void giveDisadvantage(Combatant recipient, Combatant target) {
        requireCombatant(recipient);
        requireCombatant(target);
        disadvantageMatrix.give(recipient, target);
    }

    public synchronized boolean hasAdvantage(Combatant recipient, Combatant target) {
        return advantageMatrix.has(recipient, target);
    }

    public synchronized boolean hasDisadvantage(Combatant recipient, Combatant target) {
        return disadvantageMatrix.has(recipient, target);
    }

    public synchronized void loseAdvantage(Combatant recipient, Combatant target) {
        advantageMatrix.consume(recipient, target);
    }

    public synchronized void loseDisadvantage(Combatant recipient, Combatant target) {
        disadvantageMatrix.consume(recipient, target);
    }

    /**
     * Use up the recipient's advantage against the target.
     * @return whether there was one
     */
    public synchronized boolean consumeAdvantage(Combatant recipient, Combatant target) {
        return advantageMatrix.consume(recipient, target);
    }

    /**
     * Use up the recipient's disadvantage against the target.
     * @return whether there was one
     */
    public synchronized boolean consumeDisadvantage(Combatant recipient, Combatant target) {
        return disadvantageMatrix.consume(recipient, target);
    }

    /** Targets the combatant currently has advantage against. */
    public synchronized Set<Combatant> getAdvantages(Combatant recipient) {
        return new LinkedHashSet<>(advantageMatrix.getTargets(recipient));
    }

    /** Targets the combatant currently has disadvantage against. */
    public synchronized Set<Combatant> getDisadvantages(Combatant recipient) {
        return new LinkedHashSet<>(disadvantageMatrix.getTargets(recipient));
    }

    // ========== Fleeing ==========

    /**
     * Start a flee attempt. An attempt already underway keeps its start turn.
     */
    public synchronized void flee(Combatant combatant) {
        requireCombatant(combatant);
        fleeingCombatants.putIfAbsent(combatant, turn);
    }

    public synchronized void unflee(Combatant combatant) {
        fleeingCombatants.remove(combatant);
    }

    public synchronized boolean isFleeing(Combatant combatant) {
        return fleeingCombatants.containsKey(combatant);
    }

    /** Fleeing combatants and the turn each attempt started. */
    public synchronized Map<Combatant, Integer> getFleeingCombatants() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(fleeingCombatants));
    }

    public synchronized Set<Combatant> getDefeatedCombatants() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(defeatedCombatants));
    }

    // ========== Messaging ==========

    public void msg(String text) {
        msg(text, null, Collections.emptyList());
    }

    public void msg(String text, Combatant source) {
        msg(text, source, Collections.emptyList());
    }

    /**
     * Broadcast a message template to everyone in the fight. The room of the first placed
     * combatant relays it (reaching onlookers too); combatants elsewhere or without a location
     * get it directly.
     */
    public synchronized void msg(String text, Combatant source, Collection<? extends Combatant> exclude) {
        Map<String, Combatant> mapping = getNameMapping();
        Location location = null;
        for (Combatant c : combatants.keySet()) {
            if (c.getLocation() != null) {
                location = c.getLocation();
                break;
            }
        }
        if (location != null) {
            try {
                location.broadcast(text, source, exclude, mapping);
            } catch (RuntimeException e) {
                logger.warn("[Combat #{}] Broadcast to {} failed: {}", id, location, e.getMessage(), e);
            }
        }
        for (Combatant c : combatants.keySet()) {
            if (location != null && c.getLocation() == location) continue;
            if (exclude != null && exclude.contains(c)) continue;
            try {
                c.sendMessage(MessageTemplate.render(text, source, c, mapping));
            } catch (RuntimeException e) {
                logger.warn("[Combat #{}] Could not message {}: {}", id, c.getName(), e.getMessage(), e);
            }
        }
    }

    /** Key -> combatant for every combatant, used to resolve message templates. */
    public synchronized Map<String, Combatant> getNameMapping() {
        Map<String, Combatant> mapping = new LinkedHashMap<>();
        for (Combatant c : combatants.keySet()) {
            mapping.put(c.getKey(), c);
        }
        return mapping;
    }

    /**
     * Status of the fight as seen by one combatant.
     */
    public synchronized String getCombatSummary(Combatant viewer) {
        Sides sides = getSides(viewer);
        StringBuilder sb = new StringBuilder();
        sb.append("Turn ").append(turn).append('\n');
        sb.append("You (").append(viewer.getHp()).append(" / ").append(viewer.getHpMax()).append(" health)");
        if (isFleeing(viewer)) sb.append(" [fleeing]");
        sb.append('\n');
        appendSide(sb, "Allies", sides.getAllies());
        appendSide(sb, "Enemies", sides.getEnemies());
        return sb.toString();
    }

    private void appendSide(StringBuilder sb, String label, List<Combatant> side) {
        sb.append(label).append(':');
        if (side.isEmpty()) {
            sb.append(" none\n");
            return;
        }
        for (Combatant c : side) {
            sb.append("\n  ").append(c.getName()).append(" (").append(c.getHp())
              .append(" / ").append(c.getHpMax()).append(" health)");
            if (isFleeing(c)) sb.append(" [fleeing]");
        }
        sb.append('\n');
    }

    // ========== Guards ==========

    private void ensureActive() {
        if (!isActive()) {
            throw new IllegalStateException("Combat #" + id + " has ended");
        }
    }

    private Deque<ActionRequest> requireCombatant(Combatant combatant) {
        Deque<ActionRequest> queue = combatant == null ? null : combatants.get(combatant);
        if (queue == null) {
            throw new IllegalArgumentException((combatant == null ? "null" : combatant.getName())
                    + " is not in combat #" + id);
        }
        return queue;
    }

    @Override
    public String toString() {
        return String.format("Combat #%d [%s] turn %d - %d combatants", id, state.getDisplayName(), turn, combatants.size());
    }

    /**
     * Allies and enemies relative to one combatant.
     */
    public static final class Sides {
        private final List<Combatant> allies;
        private final List<Combatant> enemies;

        public Sides(List<Combatant> allies, List<Combatant> enemies) {
            this.allies = Collections.unmodifiableList(allies);
            this.enemies = Collections.unmodifiableList(enemies);
        }

        public List<Combatant> getAllies() { return allies; }
        public List<Combatant> getEnemies() { return enemies; }
    }
}
