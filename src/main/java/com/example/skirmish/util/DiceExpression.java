package com.example.skirmish.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dice notation such as "1d4", "2d6+1" or "1d8-2".
 * Parsed once, rolled any number of times against a {@link Dice}.
 */
public final class DiceExpression {

    private static final Pattern NOTATION = Pattern.compile("^\\s*(\\d*)\\s*[dD]\\s*(\\d+)\\s*(?:([+-])\\s*(\\d+))?\\s*$");

    private final int count;
    private final int sides;
    private final int modifier;

    private DiceExpression(int count, int sides, int modifier) {
        this.count = count;
        this.sides = sides;
        this.modifier = modifier;
    }

    /**
     * Parse dice notation. A missing count means one die ("d6" == "1d6").
     * @throws IllegalArgumentException if the text is not valid notation
     */
    public static DiceExpression parse(String notation) {
        if (notation == null) {
            throw new IllegalArgumentException("Dice notation is null");
        }
        Matcher m = NOTATION.matcher(notation);
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid dice notation: '" + notation + "'");
        }
        int count = m.group(1).isEmpty() ? 1 : Integer.parseInt(m.group(1));
        int sides = Integer.parseInt(m.group(2));
        if (count < 1 || sides < 1) {
            throw new IllegalArgumentException("Dice notation needs at least one die with one side: '" + notation + "'");
        }
        int modifier = 0;
        if (m.group(3) != null) {
            modifier = Integer.parseInt(m.group(4));
            if ("-".equals(m.group(3))) modifier = -modifier;
        }
        return new DiceExpression(count, sides, modifier);
    }

    /**
     * Roll every die and add the modifier.
     */
    public int roll(Dice dice) {
        int total = modifier;
        for (int i = 0; i < count; i++) {
            total += dice.roll(1, sides);
        }
        return total;
    }

    public int getCount() { return count; }
    public int getSides() { return sides; }
    public int getModifier() { return modifier; }

    public int getMinimum() { return count + modifier; }
    public int getMaximum() { return count * sides + modifier; }

    @Override
    public String toString() {
        if (modifier == 0) return count + "d" + sides;
        return count + "d" + sides + (modifier > 0 ? "+" : "") + modifier;
    }
}
