package com.futuresdca.simulation;

import com.futuresdca.domain.model.PricePoint;
import com.futuresdca.domain.model.SimulationConfig;
import com.futuresdca.domain.model.SimulationResult;
import com.futuresdca.domain.model.WeekRecord;
import com.futuresdca.exception.InsufficientDataException;
import com.futuresdca.exception.InvalidConfigException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Simulates weekly dollar-cost averaging into a leveraged futures position.
 *
 * <p>Each week runs the same sequence against a running account:
 * <ol>
 *   <li><b>Mark-to-market:</b> the price change since last week times multiplier times
 *       open contracts is credited to cash and equity.</li>
 *   <li><b>Contribution:</b> the weekly amount is added to cash, equity and total invested.</li>
 *   <li><b>Controlled adds:</b> up to {@code maxContractAddsPerWeek} single-contract buys.
 *       An add needs the account to cover initial margin for the enlarged position, and the
 *       equity left after its fee to cover {@code minEquityToNotionalRatio} of the enlarged
 *       notional. The first rejection or reaching {@code maxContracts} ends the week's adds.</li>
 *   <li><b>Maintenance check:</b> while equity is below maintenance margin for the open
 *       contracts, one contract is force-closed at a fee.</li>
 *   <li><b>Zero floor:</b> a flat account that fees pushed below zero is reset to zero.</li>
 * </ol>
 *
 * <p>Equity is cash plus unrealized P&L already credited by mark-to-market; notional is
 * never debited, only fees. The engine holds no state between calls and uses no clock or
 * random source, so identical inputs give identical ledgers and the optimizer can run it
 * from many threads at once.
 */
@Service
public class SimulationEngine {

    private static final Logger log = LoggerFactory.getLogger(SimulationEngine.class);

    public static final int MIN_PRICE_POINTS = 2;

    /**
     * Runs one full weekly simulation.
     *
     * @param prices weekly closes, ascending by date
     * @param weeklyAmount contribution added every week, must be positive
     * @param config contract and margin parameters
     * @return the per-week ledger and totals
     * @throws InsufficientDataException if fewer than two prices are supplied
     * @throws InvalidConfigException if the amount or any config field is invalid
     */
    public SimulationResult simulate(List<PricePoint> prices, double weeklyAmount, SimulationConfig config) {
        if (!(weeklyAmount > 0) || Double.isInfinite(weeklyAmount)) {
            throw new InvalidConfigException("weeklyAmount", "must be > 0");
        }
        config.validate();
        if (prices == null || prices.size() < MIN_PRICE_POINTS) {
            throw new InsufficientDataException(prices == null ? 0 : prices.size(), MIN_PRICE_POINTS);
        }

        AccountState account = new AccountState(config);
        List<WeekRecord> records = new ArrayList<>(prices.size());

        for (int i = 0; i < prices.size(); i++) {
            PricePoint point = prices.get(i);
            double price = point.closePrice();

            double equityBeforeContribution = account.equity;

            if (i > 0 && account.contracts != 0) {
                account.markToMarket(prices.get(i - 1).closePrice(), price);
            }

            account.contribute(weeklyAmount, i + 1);
            int added = account.addContracts(price);
            int liquidated = account.enforceMaintenance();

            if (liquidated > 0) {
                log.debug(
                        "Week {} ({}): force-closed {} contracts, {} remain, equity {}",
                        i + 1,
                        point.date(),
                        liquidated,
                        account.contracts,
                        account.equity);
            }

            if (account.contracts == 0 && account.equity < 0) {
                account.equity = 0;
                account.cashBalance = 0;
                equityBeforeContribution = 0;
            }

            double pnl = account.equity - account.totalInvested;
            double returnPct = account.totalInvested > 0 ? pnl / account.totalInvested * 100 : 0.0;
            double timeWeightedReturn = equityBeforeContribution > 0
                    ? (account.equity - equityBeforeContribution - weeklyAmount) / equityBeforeContribution
                    : 0.0;

            records.add(WeekRecord.builder()
                    .weekIndex(i + 1)
                    .date(point.date())
                    .price(price)
                    .contributionAmount(weeklyAmount)
                    .contractsAdded(added)
                    .contractsLiquidated(liquidated)
                    .totalContracts(account.contracts)
                    .totalInvested(account.totalInvested)
                    .equity(account.equity)
                    .equityBeforeContribution(equityBeforeContribution)
                    .positionNotional(account.contracts * price * config.getContractMultiplier())
                    .cashBalance(account.cashBalance)
                    .requiredMaintenanceMargin(account.contracts * config.getMaintenanceMarginPerContract())
                    .feesPaid(account.weekFees)
                    .pnl(pnl)
                    .returnPct(returnPct)
                    .timeWeightedReturn(timeWeightedReturn)
                    .build());

            account.closeWeek();
        }

        log.debug(
                "Simulated {} weeks at {}/week: invested={}, equity={}, contracts={}, liquidations={}",
                records.size(),
                weeklyAmount,
                account.totalInvested,
                account.equity,
                account.contracts,
                account.totalLiquidations);

        return SimulationResult.builder()
                .weeklyAmount(weeklyAmount)
                .weeklyRecords(List.copyOf(records))
                .totalInvested(account.totalInvested)
                .finalEquity(account.equity)
                .totalContracts(account.contracts)
                .totalFees(account.totalFees)
                .totalLiquidations(account.totalLiquidations)
                .build();
    }

    /** Mutable account for a single run. Never shared across calls. */
    private static final class AccountState {

        private final SimulationConfig config;
        private final double fee;

        private double cashBalance;
        private double equity;
        private double totalInvested;
        private int contracts;
        private double weekFees;
        private double totalFees;
        private int totalLiquidations;

        private AccountState(SimulationConfig config) {
            this.config = config;
            this.fee = config.feePerContract();
        }

        void markToMarket(double previousPrice, double price) {
            double pnl = (price - previousPrice) * config.getContractMultiplier() * contracts;
            cashBalance += pnl;
            equity += pnl;
        }

        void contribute(double amount, int weekIndex) {
            cashBalance += amount;
            // always exactly weekIndex * amount, no summation drift
            totalInvested = weekIndex * amount;
            equity += amount;
        }

        /**
         * Attempts single-contract adds until one is rejected, the weekly attempt budget is
         * spent, or the contract cap is reached.
         *
         * @return contracts added this week
         */
        int addContracts(double price) {
            int added = 0;
            for (int attempt = 0; attempt < config.getMaxContractAddsPerWeek(); attempt++) {
                if (contracts >= config.getMaxContracts()) {
                    break;
                }
                int contractsAfterAdd = contracts + 1;
                double requiredInitialMargin = contractsAfterAdd * config.getInitialMarginPerContract();
                double notionalAfterAdd = contractsAfterAdd * price * config.getContractMultiplier();
                double equityAfterFees = equity - fee;

                boolean marginCovered = equity >= requiredInitialMargin;
                boolean notionalCovered = equityAfterFees >= notionalAfterAdd * config.getMinEquityToNotionalRatio();
                if (!marginCovered || !notionalCovered) {
                    break;
                }

                chargeFee();
                contracts = contractsAfterAdd;
                added++;
            }
            return added;
        }

        /**
         * Force-closes one contract at a time until equity covers maintenance margin for
         * the remaining position or the position is flat.
         *
         * @return contracts closed
         */
        int enforceMaintenance() {
            int liquidated = 0;
            double requiredMaintenance = contracts * config.getMaintenanceMarginPerContract();
            while (contracts > 0 && equity < requiredMaintenance) {
                chargeFee();
                contracts--;
                liquidated++;
                requiredMaintenance = contracts * config.getMaintenanceMarginPerContract();
            }
            totalLiquidations += liquidated;
            return liquidated;
        }

        void closeWeek() {
            weekFees = 0;
        }

        private void chargeFee() {
            cashBalance -= fee;
            equity -= fee;
            weekFees += fee;
            totalFees += fee;
        }
    }
}
