package com.futuresdca.domain.model;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * One row of the weekly simulation ledger, captured after contribution, adds,
 * liquidations and the zero floor have been applied for the week.
 *
 * <p>Values are kept at full double precision; rounding happens only when metrics
 * are reported.
 */
@Value
@Builder
public class WeekRecord {

    /** 1-based week number. */
    int weekIndex;

    LocalDate date;
    double price;
    double contributionAmount;
    int contractsAdded;

    /** Contracts force-closed by the maintenance check this week. */
    int contractsLiquidated;

    int totalContracts;
    double totalInvested;
    double equity;

    /** Equity carried into the week, the base of {@link #timeWeightedReturn}. */
    double equityBeforeContribution;

    double positionNotional;
    double cashBalance;
    double requiredMaintenanceMargin;

    /** Commission and slippage paid this week across adds and liquidations. */
    double feesPaid;

    /** equity - totalInvested */
    double pnl;

    double returnPct;
    double timeWeightedReturn;
}
