package com.example.skirmish.combat;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * One-shot flags per ordered pair (actor, target).
 * A flag is set by a successful stunt and consumed by the next check the actor makes
 * against that target. Flags for one pair never affect another pair.
 *
 * Not thread-safe; the owning handler guards access.
 */
public class AdvantageMatrix {

    private final Map<Combatant, Set<Combatant>> flags = new LinkedHashMap<>();

    public void give(Combatant actor, Combatant target) {
        flags.computeIfAbsent(actor, k -> new LinkedHashSet<>()).add(target);
    }

    public boolean has(Combatant actor, Combatant target) {
        Set<Combatant> row = flags.get(actor);
        return row != null && row.contains(target);
    }

    /**
     * Clear the flag for the pair.
     * @return whether it was set
     */
    public boolean consume(Combatant actor, Combatant target) {
        Set<Combatant> row = flags.get(actor);
        if (row == null) return false;
        boolean had = row.remove(target);
        if (row.isEmpty()) flags.remove(actor);
        return had;
    }

    /**
     * Targets the actor currently holds a flag against (empty if none).
     */
    public Set<Combatant> getTargets(Combatant actor) {
        Set<Combatant> row = flags.get(actor);
        return row == null ? Collections.emptySet() : Collections.unmodifiableSet(row);
    }

    /**
     * Drop every flag held by or against the combatant.
     */
    public void purge(Combatant combatant) {
        flags.remove(combatant);
        Iterator<Map.Entry<Combatant, Set<Combatant>>> it = flags.entrySet().iterator();
        while (it.hasNext()) {
            Set<Combatant> row = it.next().getValue();
            row.remove(combatant);
            if (row.isEmpty()) it.remove();
        }
    }

    public void clear() {
        flags.clear();
    }

    public boolean isEmpty() {
        return flags.isEmpty();
    }

    /** Number of set flags. */
    public int size() {
        int n = 0;
        for (Set<Combatant> row : flags.values()) n += row.size();
        return n;
    }
}
