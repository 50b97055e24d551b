package org.fuelroute.planner;

import java.util.Locale;

/**
 * Refuel planners selectable by configuration.
 */
public enum PlanningStrategy {
    GREEDY {
        @Override
        public RefuelPlanner create(PlannerConfig config) {
            return new GreedyRefuelPlanner(config);
        }
    },
    COST_MINIMAL {
        @Override
        public RefuelPlanner create(PlannerConfig config) {
            return new CostMinimalRefuelPlanner(config);
        }
    };

    public abstract RefuelPlanner create(PlannerConfig config);

    /**
     * Resolves {@code greedy}, {@code cost-minimal} or the enum name, ignoring case.
     */
    public static PlanningStrategy fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("planning strategy id must be non-blank");
        }
        String normalized = id.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("unknown planning strategy: " + id, ex);
        }
    }
}
