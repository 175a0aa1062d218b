package com.futuresdca.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.futuresdca.domain.model.SimulationConfig;
import com.futuresdca.exception.ErrorCode;
import com.futuresdca.exception.InvalidConfigException;
import org.junit.jupiter.api.Test;

class SimulationConfigTest {

    @Test
    void microNasdaqDefaults_areValid() {
        assertThatCode(() -> validConfig().validate()).doesNotThrowAnyException();
        assertThat(validConfig().feePerContract()).isEqualTo(3.5);
    }

    @Test
    void everyViolation_isReported() {
        SimulationConfig config = validConfig().toBuilder()
                .contractMultiplier(0)
                .commissionPerContract(-1)
                .maxContracts(0)
                .maxContractAddsPerWeek(0)
                .build();

        assertThatThrownBy(config::validate)
                .isInstanceOf(InvalidConfigException.class)
                .satisfies(e -> {
                    InvalidConfigException ex = (InvalidConfigException) e;
                    assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.INVALID_CONFIG);
                    assertThat(ex.getDetails())
                            .containsOnlyKeys(
                                    "contractMultiplier", "commissionPerContract", "maxContracts", "maxContractAddsPerWeek");
                });
    }

    @Test
    void maintenanceEqualToInitial_isRejected() {
        SimulationConfig config = validConfig().toBuilder().maintenanceMarginPerContract(1000).build();

        assertThatThrownBy(config::validate)
                .isInstanceOf(InvalidConfigException.class)
                .satisfies(e -> assertThat(((InvalidConfigException) e).getDetails())
                        .containsEntry("maintenanceMarginPerContract", "must be less than initialMarginPerContract"));
    }

    @Test
    void nonFiniteValues_areRejected() {
        SimulationConfig config = validConfig().toBuilder()
                .slippagePerContract(Double.NaN)
                .minEquityToNotionalRatio(Double.POSITIVE_INFINITY)
                .build();

        assertThatThrownBy(config::validate)
                .isInstanceOf(InvalidConfigException.class)
                .satisfies(e -> assertThat(((InvalidConfigException) e).getDetails())
                        .containsKeys("slippagePerContract", "minEquityToNotionalRatio"));
    }

    private static SimulationConfig validConfig() {
        return SimulationConfig.builder()
                .contractMultiplier(2)
                .initialMarginPerContract(1000)
                .maintenanceMarginPerContract(800)
                .commissionPerContract(2.5)
                .slippagePerContract(1.0)
                .maxContracts(100)
                .minEquityToNotionalRatio(0.10)
                .maxContractAddsPerWeek(5)
                .build();
    }
}
