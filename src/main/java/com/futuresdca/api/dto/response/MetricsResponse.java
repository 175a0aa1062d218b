package com.futuresdca.api.dto.response;

import com.futuresdca.domain.model.PerformanceMetrics;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MetricsResponse {

    PerformanceMetrics metrics;
    BigDecimal totalInvested;
    BigDecimal finalEquity;
    BigDecimal totalReturnPct;
    int totalWeeks;
}
