package com.futuresdca.config;

import com.futuresdca.domain.model.SimulationConfig;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Instrument and margin parameters for the simulated futures contract.
 *
 * <p>Properties prefix: {@code futuresdca.simulation.*}. Defaults describe the Micro
 * E-mini NASDAQ-100 (MNQ): $2 per index point, roughly $1,000 initial and $800
 * maintenance margin per contract, $2.50 commission and $1.00 slippage.
 */
@Configuration
@ConfigurationProperties(prefix = "futuresdca.simulation")
@Getter
@Setter
public class SimulationProperties {

    private String symbol = "MNQ=F";
    private String instrumentName = "Micro E-mini NASDAQ-100 Futures";
    private String tradingHours = "Sun 6:00 PM - Fri 5:00 PM ET (daily 5-6 PM pause)";

    private double contractMultiplier = 2.0;
    private double initialMarginPerContract = 1000.0;
    private double maintenanceMarginPerContract = 800.0;
    private double commissionPerContract = 2.50;
    private double slippagePerContract = 1.00;
    private int maxContracts = 100;
    private double minEquityToNotionalRatio = 0.10;
    private int maxContractAddsPerWeek = 5;

    /** Builds the immutable engine config. Validation is left to the engine and optimizer. */
    public SimulationConfig toSimulationConfig() {
        return SimulationConfig.builder()
                .contractMultiplier(contractMultiplier)
                .initialMarginPerContract(initialMarginPerContract)
                .maintenanceMarginPerContract(maintenanceMarginPerContract)
                .commissionPerContract(commissionPerContract)
                .slippagePerContract(slippagePerContract)
                .maxContracts(maxContracts)
                .minEquityToNotionalRatio(minEquityToNotionalRatio)
                .maxContractAddsPerWeek(maxContractAddsPerWeek)
                .build();
    }
}
