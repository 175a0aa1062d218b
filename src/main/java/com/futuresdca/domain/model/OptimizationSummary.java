package com.futuresdca.domain.model;

import com.futuresdca.domain.enums.SortKey;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OptimizationSummary {

    int gridSize;
    double stepSizeRequested;
    double stepSizeUsed;

    /** True when the step was enlarged to keep the grid within the point limit. */
    boolean gridCapped;

    int candidatesSucceeded;
    int candidatesFailed;

    /** Candidates never started because the sweep deadline passed. */
    int candidatesSkipped;

    boolean deadlineReached;
    int weeks;
    LocalDate startDate;
    LocalDate endDate;
    SortKey sortKey;
    boolean descending;
    long elapsedMillis;
}
