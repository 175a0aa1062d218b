package com.futuresdca.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** The only facts about the worst week handed to the narrative generator. */
@Value
@Builder
public class WorstWeekSummary {

    LocalDate date;
    BigDecimal returnPct;
}
