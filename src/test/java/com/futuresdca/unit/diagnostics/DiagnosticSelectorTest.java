package com.futuresdca.unit.diagnostics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.futuresdca.diagnostics.DiagnosticSelector;
import com.futuresdca.domain.model.SimulationResult;
import com.futuresdca.domain.model.WeekRecord;
import com.futuresdca.domain.model.WorstWeekSummary;
import com.futuresdca.exception.InsufficientDataException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DiagnosticSelectorTest {

    private static final LocalDate FIRST_FRIDAY = LocalDate.of(2024, 3, 1);

    private DiagnosticSelector diagnosticSelector;

    @BeforeEach
    void setUp() {
        diagnosticSelector = new DiagnosticSelector();
    }

    @Test
    void picksWeekWithLowestReturn() {
        SimulationResult result = result(-0.35, 2.1, -12.456, -3.0);

        WeekRecord worst = diagnosticSelector.findWorstWeek(result);

        assertThat(worst.getWeekIndex()).isEqualTo(3);
        assertThat(worst.getDate()).isEqualTo(FIRST_FRIDAY.plusWeeks(2));
    }

    @Test
    void tie_earliestWeekWins() {
        SimulationResult result = result(1.0, -5.0, 0.5, -5.0);

        assertThat(diagnosticSelector.findWorstWeek(result).getWeekIndex()).isEqualTo(2);
    }

    @Test
    void describe_roundsReturnToTwoDecimals() {
        SimulationResult result = result(-0.35, 2.1, -12.456, -3.0);

        WorstWeekSummary summary = diagnosticSelector.describeWorstWeek(result);

        assertThat(summary.getDate()).isEqualTo(FIRST_FRIDAY.plusWeeks(2));
        assertThat(summary.getReturnPct()).isEqualByComparingTo(new BigDecimal("-12.46"));
    }

    @Test
    void emptyLedger_throwsInsufficientData() {
        SimulationResult result = SimulationResult.builder().weeklyRecords(List.of()).build();

        assertThatThrownBy(() -> diagnosticSelector.findWorstWeek(result))
                .isInstanceOf(InsufficientDataException.class);
    }

    private static SimulationResult result(double... returnPcts) {
        List<WeekRecord> records = new ArrayList<>();
        for (int i = 0; i < returnPcts.length; i++) {
            records.add(WeekRecord.builder()
                    .weekIndex(i + 1)
                    .date(FIRST_FRIDAY.plusWeeks(i))
                    .returnPct(returnPcts[i])
                    .build());
        }
        return SimulationResult.builder().weeklyRecords(records).build();
    }
}
