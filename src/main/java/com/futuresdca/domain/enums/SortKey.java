package com.futuresdca.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Objective used to order sweep candidates in the primary ranking. */
@Getter
@RequiredArgsConstructor
public enum SortKey {
    TOTAL_RETURN("totalReturn"),
    SHARPE_RATIO("sharpeRatio"),
    PROFIT_FACTOR("profitFactor"),
    RETURN_PER_INVESTED_DOLLAR("returnPerInvestedDollar");

    private final String wireName;

    @JsonValue
    public String toJson() {
        return wireName;
    }

    /** Accepts either the camelCase wire name or the constant name, case-insensitively. */
    @JsonCreator
    public static SortKey fromValue(String value) {
        return Arrays.stream(values())
                .filter(key -> key.wireName.equalsIgnoreCase(value) || key.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown sort key: " + value));
    }
}
