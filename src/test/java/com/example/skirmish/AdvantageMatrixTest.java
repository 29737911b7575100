package com.example.skirmish;

import com.example.skirmish.combat.AdvantageMatrix;
import com.example.skirmish.model.GameCharacter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AdvantageMatrix Tests")
public class AdvantageMatrixTest {

    private AdvantageMatrix matrix;
    private GameCharacter a;
    private GameCharacter b;
    private GameCharacter c;

    @BeforeEach
    void setUp() {
        matrix = new AdvantageMatrix();
        a = new GameCharacter("a", 5);
        b = new GameCharacter("b", 5, 1);
        c = new GameCharacter("c", 5, 1);
    }

    @Test
    @DisplayName("Flags are per ordered pair")
    void orderedPairs() {
        matrix.give(a, b);
        assertTrue(matrix.has(a, b));
        assertFalse(matrix.has(b, a));
        assertFalse(matrix.has(a, c));
        assertEquals(1, matrix.size());
    }

    @Test
    @DisplayName("Consuming clears only that flag, once")
    void consume() {
        matrix.give(a, b);
        matrix.give(a, c);

        assertTrue(matrix.consume(a, b));
        assertFalse(matrix.consume(a, b));
        assertTrue(matrix.has(a, c));
        assertEquals(Set.of(c), matrix.getTargets(a));
    }

    @Test
    @DisplayName("Giving twice still leaves one flag")
    void giveIdempotent() {
        matrix.give(a, b);
        matrix.give(a, b);
        assertEquals(1, matrix.size());
    }

    @Test
    @DisplayName("Purging removes flags held by and against a combatant")
    void purge() {
        matrix.give(a, b);
        matrix.give(b, a);
        matrix.give(c, a);
        matrix.give(c, b);

        matrix.purge(a);

        assertFalse(matrix.has(a, b));
        assertFalse(matrix.has(b, a));
        assertFalse(matrix.has(c, a));
        assertTrue(matrix.has(c, b));
        assertTrue(matrix.getTargets(a).isEmpty());
        assertTrue(matrix.getTargets(b).isEmpty());
        assertEquals(1, matrix.size());
    }

    @Test
    void clear() {
        matrix.give(a, b);
        matrix.clear();
        assertTrue(matrix.isEmpty());
    }
}
