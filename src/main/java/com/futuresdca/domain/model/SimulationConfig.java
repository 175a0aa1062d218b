package com.futuresdca.domain.model;

import com.futuresdca.exception.InvalidConfigException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Contract and account parameters for one weekly DCA simulation.
 *
 * <p>All fields must be strictly positive and the maintenance margin must be below the
 * initial margin. {@link #validate()} checks every field and reports all violations at once.
 */
@Value
@Builder(toBuilder = true)
public class SimulationConfig {

    /** Dollars per index point per contract ($2 for MNQ). */
    double contractMultiplier;

    /** Equity required per contract to open a position. */
    double initialMarginPerContract;

    /** Equity required per contract to keep a position open; breaching it forces liquidation. */
    double maintenanceMarginPerContract;

    double commissionPerContract;
    double slippagePerContract;

    /** Hard cap on open contracts. */
    int maxContracts;

    /** Minimum equity as a fraction of position notional for an add to be accepted. */
    double minEquityToNotionalRatio;

    /** Upper bound on single-contract adds attempted per week. */
    int maxContractAddsPerWeek;

    /** Round-trip cost charged on every contract opened or force-closed. */
    public double feePerContract() {
        return commissionPerContract + slippagePerContract;
    }

    /**
     * Checks positivity and ordering constraints.
     *
     * @throws InvalidConfigException naming every offending field
     */
    public void validate() {
        Map<String, Object> violations = new LinkedHashMap<>();
        requirePositive(violations, "contractMultiplier", contractMultiplier);
        requirePositive(violations, "initialMarginPerContract", initialMarginPerContract);
        requirePositive(violations, "maintenanceMarginPerContract", maintenanceMarginPerContract);
        requirePositive(violations, "commissionPerContract", commissionPerContract);
        requirePositive(violations, "slippagePerContract", slippagePerContract);
        requirePositive(violations, "minEquityToNotionalRatio", minEquityToNotionalRatio);
        if (maxContracts < 1) {
            violations.put("maxContracts", "must be >= 1");
        }
        if (maxContractAddsPerWeek < 1) {
            violations.put("maxContractAddsPerWeek", "must be >= 1");
        }
        if (!violations.containsKey("maintenanceMarginPerContract")
                && !violations.containsKey("initialMarginPerContract")
                && maintenanceMarginPerContract >= initialMarginPerContract) {
            violations.put("maintenanceMarginPerContract", "must be less than initialMarginPerContract");
        }
        if (!violations.isEmpty()) {
            throw new InvalidConfigException("Invalid simulation config: " + violations.keySet(), violations);
        }
    }

    private static void requirePositive(Map<String, Object> violations, String field, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            violations.put(field, "must be > 0");
        }
    }
}
