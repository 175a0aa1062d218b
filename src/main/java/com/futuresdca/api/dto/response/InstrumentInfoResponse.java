package com.futuresdca.api.dto.response;

import lombok.Builder;
import lombok.Value;

/** Static description of the simulated contract, taken from configuration. */
@Value
@Builder
public class InstrumentInfoResponse {

    String symbol;
    String name;
    double contractMultiplier;
    double pointValueUsd;
    double initialMarginPerContract;
    double maintenanceMarginPerContract;
    double feePerContract;
    int maxContracts;
    String marginModel;
    String tradingHours;
}
