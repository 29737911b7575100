package com.example.skirmish.combat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks active combat handlers and which handler each combatant belongs to.
 * A combatant is bound to at most one handler at a time.
 */
public class CombatRegistry {

    private static final Logger logger = LoggerFactory.getLogger(CombatRegistry.class);

    /** All active handlers by handler ID */
    private final Map<Long, CombatHandler> handlersById = new ConcurrentHashMap<>();

    /** Quick lookup: combatant -> the handler it fights in */
    private final Map<Combatant, CombatHandler> handlersByCombatant = new ConcurrentHashMap<>();

    private final AtomicLong nextHandlerId = new AtomicLong(1);

    long nextId() {
        return nextHandlerId.getAndIncrement();
    }

    // ========== Handlers ==========

    void registerHandler(CombatHandler handler) {
        handlersById.put(handler.getId(), handler);
        logger.debug("Registered combat #{}", handler.getId());
    }

    void unregisterHandler(CombatHandler handler) {
        if (handlersById.remove(handler.getId(), handler)) {
            handlersByCombatant.values().removeIf(h -> h == handler);
            logger.debug("Unregistered combat #{}", handler.getId());
        }
    }

    public Optional<CombatHandler> findById(long handlerId) {
        return Optional.ofNullable(handlersById.get(handlerId));
    }

    public List<CombatHandler> getActiveHandlers() {
        return new ArrayList<>(handlersById.values());
    }

    public int getActiveHandlerCount() {
        return handlersById.size();
    }

    // ========== Combatants ==========

    /**
     * Bind a combatant to a handler.
     * @return false if the combatant is already bound to a different handler
     */
    boolean bind(Combatant combatant, CombatHandler handler) {
        CombatHandler existing = handlersByCombatant.putIfAbsent(combatant, handler);
        return existing == null || existing == handler;
    }

    void unbind(Combatant combatant, CombatHandler handler) {
        handlersByCombatant.remove(combatant, handler);
    }

    /**
     * The handler a combatant is currently fighting in.
     */
    public Optional<CombatHandler> findByCombatant(Combatant combatant) {
        if (combatant == null) return Optional.empty();
        return Optional.ofNullable(handlersByCombatant.get(combatant));
    }

    public boolean isInCombat(Combatant combatant) {
        return combatant != null && handlersByCombatant.containsKey(combatant);
    }
}
