package com.futuresdca.api.dto.response;

import com.futuresdca.domain.model.WeekRecord;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EquityCurvePoint {

    LocalDate date;
    double equity;
    double positionNotional;
    double cashBalance;
    double invested;
    double pnl;
    double timeWeightedReturn;
    double prevEquity;

    public static EquityCurvePoint from(WeekRecord record) {
        return EquityCurvePoint.builder()
                .date(record.getDate())
                .equity(record.getEquity())
                .positionNotional(record.getPositionNotional())
                .cashBalance(record.getCashBalance())
                .invested(record.getTotalInvested())
                .pnl(record.getPnl())
                .timeWeightedReturn(record.getTimeWeightedReturn())
                .prevEquity(record.getEquityBeforeContribution())
                .build();
    }
}
