package com.example.skirmish.util;

/**
 * Source of uniformly distributed die rolls.
 * Combat code never owns its randomness; tests substitute a fixed sequence.
 */
@FunctionalInterface
public interface Dice {

    /**
     * Roll an integer in the closed range [min, max].
     */
    int roll(int min, int max);
}
