package com.futuresdca.api.dto.request;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.futuresdca.domain.enums.SortKey;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Weekly-amount sweep request. The ordering rule {@code amountMin <= amountMax} is
 * checked by the optimizer, which reports it as an invalid config.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationRequest {

    @NotNull(message = "Minimum amount is required")
    @Positive(message = "Minimum amount must be positive")
    private BigDecimal amountMin;

    @NotNull(message = "Maximum amount is required")
    @Positive(message = "Maximum amount must be positive")
    private BigDecimal amountMax;

    @NotNull(message = "Step size is required")
    @Positive(message = "Step size must be positive")
    private BigDecimal stepSize;

    @Min(value = 1, message = "topN must be at least 1")
    @Builder.Default
    private int topN = 10;

    @NotNull(message = "Sort key is required")
    @Builder.Default
    private SortKey sortKey = SortKey.TOTAL_RETURN;

    @Builder.Default
    private boolean descending = true;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate startDate;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate endDate;
}
