package com.futuresdca.optimizer;

import com.futuresdca.domain.enums.SortKey;
import com.futuresdca.exception.InvalidConfigException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Grid bounds and ranking options for one sweep. */
@Value
@Builder
public class SweepParameters {

    double amountMin;
    double amountMax;
    double stepSize;
    int topN;
    SortKey sortKey;
    boolean descending;

    /**
     * @throws InvalidConfigException naming every invalid parameter
     */
    public void validate() {
        Map<String, Object> violations = new LinkedHashMap<>();
        if (!(amountMin > 0) || Double.isInfinite(amountMin)) {
            violations.put("amountMin", "must be > 0");
        }
        if (!(amountMax > 0) || Double.isInfinite(amountMax)) {
            violations.put("amountMax", "must be > 0");
        } else if (amountMax < amountMin) {
            violations.put("amountMax", "must be >= amountMin");
        }
        if (!(stepSize > 0) || Double.isInfinite(stepSize)) {
            violations.put("stepSize", "must be > 0");
        }
        if (topN < 1) {
            violations.put("topN", "must be >= 1");
        }
        if (sortKey == null) {
            violations.put("sortKey", "is required");
        }
        if (!violations.isEmpty()) {
            throw new InvalidConfigException("Invalid sweep parameters: " + violations.keySet(), violations);
        }
    }
}
