package com.example.skirmish.util;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Default die roller backed by {@link ThreadLocalRandom}.
 */
public class RandomDice implements Dice {

    @Override
    public int roll(int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException("Invalid die range " + min + ".." + max);
        }
        return ThreadLocalRandom.current().nextInt(min, max + 1);
    }
}
