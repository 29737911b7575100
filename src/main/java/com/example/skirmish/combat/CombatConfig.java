package com.example.skirmish.combat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Tunable combat numbers, loaded from a YAML resource.
 *
 * <pre>
 * combat:
 *   die_sides: 20          # sides of the check die
 *   defense_base: 10       # added to the defender's ability to form the check target
 *   flee_timeout: 1        # full turns a flee attempt must survive before escaping
 *   turn_timeout_ms: 30000 # turn resolves after this long even if not everyone queued
 *   tick_interval_ms: 500  # how often the manager checks for due turns
 * </pre>
 */
public class CombatConfig {

    private static final Logger logger = LoggerFactory.getLogger(CombatConfig.class);

    public static final String DEFAULT_RESOURCE = "/combat.yaml";

    public static final int DEFAULT_DIE_SIDES = 20;
    public static final int DEFAULT_DEFENSE_BASE = 10;
    public static final int DEFAULT_FLEE_TIMEOUT = 1;
    public static final long DEFAULT_TURN_TIMEOUT_MS = 30_000;
    public static final long DEFAULT_TICK_INTERVAL_MS = 500;

    private final int dieSides;
    private final int defenseBase;
    private final int fleeTimeout;
    private final long turnTimeoutMs;
    private final long tickIntervalMs;

    public CombatConfig(int dieSides, int defenseBase, int fleeTimeout, long turnTimeoutMs, long tickIntervalMs) {
        if (dieSides < 2) throw new IllegalArgumentException("die_sides must be at least 2, got " + dieSides);
        if (fleeTimeout < 0) throw new IllegalArgumentException("flee_timeout cannot be negative, got " + fleeTimeout);
        if (tickIntervalMs <= 0) throw new IllegalArgumentException("tick_interval_ms must be positive, got " + tickIntervalMs);
        this.dieSides = dieSides;
        this.defenseBase = defenseBase;
        this.fleeTimeout = fleeTimeout;
        this.turnTimeoutMs = turnTimeoutMs;
        this.tickIntervalMs = tickIntervalMs;
    }

    public static CombatConfig defaults() {
        return new CombatConfig(DEFAULT_DIE_SIDES, DEFAULT_DEFENSE_BASE, DEFAULT_FLEE_TIMEOUT,
                DEFAULT_TURN_TIMEOUT_MS, DEFAULT_TICK_INTERVAL_MS);
    }

    /**
     * Load settings from a classpath resource. A missing resource, or a missing
     * {@code combat} section or key, falls back to the defaults.
     *
     * @throws IllegalStateException if the resource exists but cannot be read
     */
    public static CombatConfig loadFromYamlResource(String resourcePath) {
        try (InputStream is = CombatConfig.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                logger.warn("Combat config {} not found, using defaults", resourcePath);
                return defaults();
            }
            Yaml yaml = new Yaml();
            Map<String, Object> data = yaml.load(is);
            if (data == null || !(data.get("combat") instanceof Map)) {
                logger.warn("Combat config {} has no 'combat' section, using defaults", resourcePath);
                return defaults();
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> combat = (Map<String, Object>) data.get("combat");
            CombatConfig config = new CombatConfig(
                    parseInt(combat.get("die_sides"), DEFAULT_DIE_SIDES),
                    parseInt(combat.get("defense_base"), DEFAULT_DEFENSE_BASE),
                    parseInt(combat.get("flee_timeout"), DEFAULT_FLEE_TIMEOUT),
                    parseLong(combat.get("turn_timeout_ms"), DEFAULT_TURN_TIMEOUT_MS),
                    parseLong(combat.get("tick_interval_ms"), DEFAULT_TICK_INTERVAL_MS));
            logger.info("Loaded combat config from {}: {}", resourcePath, config);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read combat config " + resourcePath, e);
        }
    }

    private static int parseInt(Object o, int fallback) {
        if (o == null) return fallback;
        if (o instanceof Number) return ((Number) o).intValue();
        try {
            return Integer.parseInt(o.toString().trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid combat config value '{}', using {}", o, fallback);
            return fallback;
        }
    }

    private static long parseLong(Object o, long fallback) {
        if (o == null) return fallback;
        if (o instanceof Number) return ((Number) o).longValue();
        try {
            return Long.parseLong(o.toString().trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid combat config value '{}', using {}", o, fallback);
            return fallback;
        }
    }

    public int getDieSides() { return dieSides; }
    public int getDefenseBase() { return defenseBase; }
    public int getFleeTimeout() { return fleeTimeout; }
    public long getTurnTimeoutMs() { return turnTimeoutMs; }
    public long getTickIntervalMs() { return tickIntervalMs; }

    @Override
    public String toString() {
        return String.format("CombatConfig[d%d, defense %d+, flee %d turns, turn timeout %dms, tick %dms]",
                dieSides, defenseBase, fleeTimeout, turnTimeoutMs, tickIntervalMs);
    }
}
