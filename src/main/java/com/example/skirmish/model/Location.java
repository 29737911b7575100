package com.example.skirmish.model;

import com.example.skirmish.combat.Combatant;

import java.util.Collection;
import java.util.Map;

/**
 * A place that can relay messages to everyone in it.
 */
public interface Location {

    /**
     * Send a message template to every occupant except those excluded.
     * Each occupant receives the template rendered from its own point of view.
     *
     * @param text template (see MessageTemplate)
     * @param source who the message is from, or null
     * @param exclude occupants that should not receive it
     * @param mapping key -> combatant used to resolve keyed tokens
     */
    void broadcast(String text, Combatant source, Collection<? extends Combatant> exclude,
                   Map<String, ? extends Combatant> mapping);

    /** Whether fights may start here. */
    default boolean isCombatAllowed() {
        return true;
    }
}
