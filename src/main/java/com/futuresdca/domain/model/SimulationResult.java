package com.futuresdca.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Immutable outcome of one simulation run. A fresh instance is built per call. */
@Value
@Builder
public class SimulationResult {

    double weeklyAmount;
    List<WeekRecord> weeklyRecords;
    double totalInvested;
    double finalEquity;
    int totalContracts;
    double totalFees;
    int totalLiquidations;

    public int getTotalWeeks() {
        return weeklyRecords.size();
    }
}
