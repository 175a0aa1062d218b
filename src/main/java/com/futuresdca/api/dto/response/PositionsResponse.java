package com.futuresdca.api.dto.response;

import com.futuresdca.domain.model.WeekRecord;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PositionsResponse {

    List<WeekRecord> positions;
    int totalContracts;
    BigDecimal totalInvested;
    BigDecimal finalEquity;
}
