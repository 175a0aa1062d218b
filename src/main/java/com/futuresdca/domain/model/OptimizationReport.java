package com.futuresdca.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Result of a weekly-amount sweep with two independent rankings: {@code topByObjective}
 * follows the requested sort key, {@code topByDollarProfit} always uses the fixed
 * profit tie-break chain.
 */
@Value
@Builder
public class OptimizationReport {

    List<Double> testedGrid;
    List<SweepCandidate> topByObjective;
    List<SweepCandidate> topByDollarProfit;
    OptimizationSummary summary;
}
