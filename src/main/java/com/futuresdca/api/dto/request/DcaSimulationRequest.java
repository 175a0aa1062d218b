package com.futuresdca.api.dto.request;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Single-amount DCA simulation request. Omitted dates default to the year ending today.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DcaSimulationRequest {

    @NotNull(message = "Weekly amount is required")
    @DecimalMin(value = "100", message = "Weekly amount must be at least 100")
    @DecimalMax(value = "10000", message = "Weekly amount must be at most 10000")
    @Builder.Default
    private BigDecimal weeklyAmount = new BigDecimal("1000");

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate startDate;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate endDate;
}
