package com.futuresdca.optimizer;

import com.futuresdca.domain.enums.SortKey;
import com.futuresdca.domain.model.SweepCandidate;
import java.util.Comparator;
import java.util.List;

/**
 * The two orderings of sweep candidates. Both compare the unrounded
 * {@link SweepCandidate.RankingKey} and rely on a stable sort, so candidates that compare
 * equal keep grid order (ascending amount).
 */
public final class SweepRankings {

    /** Size of the dollar-profit ranking, independent of the requested top N. */
    public static final int DOLLAR_PROFIT_TOP_N = 5;

    /** dollarProfit desc, sharpeRatio desc, volatilityAnnualized asc, weeklyAmount asc. */
    public static final Comparator<SweepCandidate> DOLLAR_PROFIT_ORDER = Comparator.comparing(
                    (SweepCandidate c) -> c.getRankingKey().getDollarProfit(), Comparator.reverseOrder())
            .thenComparing(c -> c.getRankingKey().getSharpeRatio(), Comparator.reverseOrder())
            .thenComparingDouble(c -> c.getRankingKey().getVolatilityAnnualized())
            .thenComparingDouble(SweepCandidate::getWeeklyAmount);

    private SweepRankings() {}

    public static List<SweepCandidate> byObjective(
            List<SweepCandidate> candidates, SortKey sortKey, boolean descending, int topN) {
        Comparator<SweepCandidate> order = Comparator.comparingDouble(c -> objectiveValue(c, sortKey));
        if (descending) {
            order = order.reversed();
        }
        return candidates.stream().sorted(order).limit(topN).toList();
    }

    public static List<SweepCandidate> byDollarProfit(List<SweepCandidate> candidates) {
        return candidates.stream()
                .sorted(DOLLAR_PROFIT_ORDER)
                .limit(DOLLAR_PROFIT_TOP_N)
                .toList();
    }

    static double objectiveValue(SweepCandidate candidate, SortKey sortKey) {
        SweepCandidate.RankingKey key = candidate.getRankingKey();
        return switch (sortKey) {
            case TOTAL_RETURN -> key.getTotalReturnPct();
            case SHARPE_RATIO -> key.getSharpeRatio();
            case PROFIT_FACTOR -> key.getProfitFactor();
            case RETURN_PER_INVESTED_DOLLAR -> key.getReturnPerInvestedDollar();
        };
    }
}
