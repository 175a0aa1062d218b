package com.futuresdca.diagnostics;

import com.futuresdca.domain.model.SimulationResult;
import com.futuresdca.domain.model.WeekRecord;
import com.futuresdca.domain.model.WorstWeekSummary;
import com.futuresdca.exception.InsufficientDataException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Picks the week that fed the narrative generator: the one with the lowest cumulative
 * return on invested capital. Only the date and return leave this class; explaining
 * the week is the narrative collaborator's job.
 */
@Component
public class DiagnosticSelector {

    /**
     * Returns the record with the minimum {@code returnPct}. The earliest week wins a tie.
     *
     * @throws InsufficientDataException if the result has no records
     */
    public WeekRecord findWorstWeek(SimulationResult result) {
        List<WeekRecord> records = result.getWeeklyRecords();
        if (records == null || records.isEmpty()) {
            throw new InsufficientDataException("Simulation result has no weekly records");
        }

        WeekRecord worst = records.get(0);
        for (WeekRecord record : records) {
            if (record.getReturnPct() < worst.getReturnPct()) {
                worst = record;
            }
        }
        return worst;
    }

    public WorstWeekSummary describeWorstWeek(SimulationResult result) {
        WeekRecord worst = findWorstWeek(result);
        return WorstWeekSummary.builder()
                .date(worst.getDate())
                .returnPct(BigDecimal.valueOf(worst.getReturnPct()).setScale(2, RoundingMode.HALF_UP))
                .build();
    }
}
