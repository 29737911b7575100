package com.example.skirmish.model;

import com.example.skirmish.combat.Combatant;
import com.example.skirmish.util.MessageTemplate;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A room holding combatants. Messages are rendered per occupant.
 */
public class Room implements Location {
    private final int id;
    private final String name;
    private final boolean combatAllowed;

    private final List<Combatant> occupants = new CopyOnWriteArrayList<>();

    public Room(int id, String name) {
        this(id, name, true);
    }

    public Room(int id, String name, boolean combatAllowed) {
        this.id = id;
        this.name = name;
        this.combatAllowed = combatAllowed;
    }

    public int getId() { return id; }
    public String getName() { return name; }

    @Override
    public boolean isCombatAllowed() { return combatAllowed; }

    public void addOccupant(Combatant c) {
        if (c != null && !occupants.contains(c)) occupants.add(c);
    }

    public void removeOccupant(Combatant c) {
        occupants.remove(c);
    }

    @Override
    public void broadcast(String text, Combatant source, Collection<? extends Combatant> exclude,
                          Map<String, ? extends Combatant> mapping) {
        if (text == null) return;
        for (Combatant occupant : occupants) {
            if (exclude != null && exclude.contains(occupant)) continue;
            occupant.sendMessage(MessageTemplate.render(text, source, occupant, mapping));
        }
    }

    @Override
    public String toString() {
        return "Room[" + id + " " + name + "]";
    }
}
