package com.example.skirmish.combat;

/**
 * Outcome of a d20 check: the natural roll, the bonus added, the target to beat and the quality.
 */
public class CheckResult {

    public enum Quality {
        CRITICAL_FAILURE,
        FAILURE,
        SUCCESS,
        CRITICAL_SUCCESS
    }

    private final int roll;
    private final int bonus;
    private final int target;
    private final Quality quality;

    public CheckResult(int roll, int bonus, int target, Quality quality) {
        this.roll = roll;
        this.bonus = bonus;
        this.target = target;
        this.quality = quality;
    }

    public int getRoll() { return roll; }
    public int getBonus() { return bonus; }
    public int getTarget() { return target; }
    public int getTotal() { return roll + bonus; }
    public Quality getQuality() { return quality; }

    public boolean isSuccess() {
        return quality == Quality.SUCCESS || quality == Quality.CRITICAL_SUCCESS;
    }

    public boolean isCritical() {
        return quality == Quality.CRITICAL_SUCCESS || quality == Quality.CRITICAL_FAILURE;
    }

    @Override
    public String toString() {
        return String.format("CheckResult[%d+%d=%d vs %d, %s]", roll, bonus, getTotal(), target, quality);
    }
}
