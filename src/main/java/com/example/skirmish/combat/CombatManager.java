package com.example.skirmish.combat;

import com.example.skirmish.combat.action.ActionRequest;
import com.example.skirmish.model.Mobile;
import com.example.skirmish.util.Dice;
import com.example.skirmish.util.RandomDice;
import com.example.skirmish.util.TickService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Owns the registry of active fights and drives them from the tick service.
 * A turn resolves as soon as every combatant has queued an action, or when the turn timeout runs out.
 */
public class CombatManager {

    private static final Logger logger = LoggerFactory.getLogger(CombatManager.class);

    public static final String TICK_TASK = "combat-tick";

    private final CombatConfig config;
    private final CombatCalculator calculator;
    private final CombatRegistry registry = new CombatRegistry();

    public CombatManager() {
        this(CombatConfig.loadFromYamlResource(CombatConfig.DEFAULT_RESOURCE), new RandomDice());
    }

    public CombatManager(CombatConfig config, Dice dice) {
        this.config = config;
        this.calculator = new CombatCalculator(dice, config);
    }

    /**
     * Initialize the combat manager with a tick service.
     */
    public void initialize(TickService tickService) {
        long interval = config.getTickIntervalMs();
        tickService.scheduleAtFixedRate(TICK_TASK, this::tick, interval, interval);
        logger.info("[CombatManager] Initialized with tick service ({})", config);
    }

    public CombatRegistry getRegistry() { return registry; }

    // ========== Starting and joining ==========

    /**
     * The fight the combatant is in, or a new one with just that combatant.
     */
    public CombatHandler getOrCreateHandler(Combatant combatant) {
        return CombatHandler.getOrCreate(combatant, registry, calculator);
    }

    /**
     * Start a fight between two hostile combatants, or pull the defender into the attacker's
     * fight (or the attacker into the defender's) when one of them is already fighting.
     *
     * @throws IllegalArgumentException if the two are not hostile, or are fighting in different combats
     * @throws IllegalStateException if combat is not allowed at the attacker's location
     */
    public CombatHandler startCombat(Combatant attacker, Combatant defender) {
        if (attacker == null || defender == null) {
            throw new IllegalArgumentException("Both combatants are required");
        }
        if (!attacker.isHostileTo(defender)) {
            throw new IllegalArgumentException(attacker.getName() + " is not hostile to " + defender.getName());
        }
        synchronized (registry) {
            Optional<CombatHandler> defenderCombat = registry.findByCombatant(defender);
            CombatHandler handler;
            if (defenderCombat.isPresent() && registry.findByCombatant(attacker).isEmpty()) {
                handler = defenderCombat.get();
            } else {
                handler = getOrCreateHandler(attacker);
            }
            handler.addCombatants(attacker, defender);
            logger.info("[CombatManager] {} attacks {} in combat #{}", attacker.getName(), defender.getName(), handler.getId());
            return handler;
        }
    }

    /**
     * Queue an action for a combatant's current fight.
     *
     * @throws IllegalArgumentException if the combatant is not fighting
     */
    public void queueAction(Combatant combatant, ActionRequest request) {
        CombatHandler handler = registry.findByCombatant(combatant)
                .orElseThrow(() -> new IllegalArgumentException(combatant.getName() + " is not in combat"));
        handler.queueAction(combatant, request);
    }

    public Optional<CombatHandler> getHandler(Combatant combatant) {
        return registry.findByCombatant(combatant);
    }

    public boolean isInCombat(Combatant combatant) {
        return registry.isInCombat(combatant);
    }

    /**
     * End every active fight.
     */
    public void stopAll() {
        for (CombatHandler handler : registry.getActiveHandlers()) {
            handler.stopCombat();
        }
    }

    // ========== Ticks ==========

    /**
     * Main combat tick - called periodically to process all active combats.
     */
    public void tick() {
        tick(System.currentTimeMillis());
    }

    /**
     * Process every active fight as of the given time.
     */
    public void tick(long now) {
        for (CombatHandler handler : registry.getActiveHandlers()) {
            try {
                processHandler(handler, now);
            } catch (RuntimeException e) {
                logger.warn("[CombatManager] Error in combat #{}: {}", handler.getId(), e.getMessage(), e);
            }
        }
    }

    private void processHandler(CombatHandler handler, long now) {
        synchronized (handler) {
            if (!handler.isActive()) {
                return;
            }
            for (Combatant c : handler.getCombatants()) {
                if (c instanceof Mobile && c.getHp() > 0 && handler.getPendingAction(c).isEmpty()) {
                    handler.queueAction(c, ((Mobile) c).chooseAction(handler, calculator.getDice()));
                }
            }
            boolean timedOut = now - handler.getTurnStartedAt() >= config.getTurnTimeoutMs();
            if (handler.isTurnReady() || timedOut) {
                if (timedOut && !handler.isTurnReady()) {
                    logger.debug("[CombatManager] Combat #{} turn {} timed out", handler.getId(), handler.getTurn());
                }
                handler.executeFullTurn();
            }
        }
    }
}
