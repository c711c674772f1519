package com.kotsin.structure.dealer.calculator;

import com.kotsin.structure.dealer.model.FilterConfig;
import com.kotsin.structure.dealer.model.FilterStats;
import com.kotsin.structure.options.model.OptionContract;
import com.kotsin.structure.util.MathUtils;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Drops contracts that cannot contribute a usable exposure.
 *
 * Rules run in a fixed order and a rejected contract is counted once, under the
 * first rule it fails: malformed, expired, DTE exceeded, missing gamma, open
 * interest, volume, spread.
 */
public final class ContractFilter {

    private ContractFilter() {}

    public static Result apply(List<OptionContract> contracts, LocalDate tradingDate, FilterConfig filter) {
        FilterStats stats = new FilterStats();
        List<OptionContract> eligible = new ArrayList<>();
        if (contracts == null) {
            return new Result(eligible, stats);
        }

        for (OptionContract contract : contracts) {
            stats.setTotal(stats.getTotal() + 1);

            if (contract == null || contract.getExpiry() == null || contract.getType() == null
                    || !(contract.getStrike() > 0) || tradingDate == null) {
                stats.setOther(stats.getOther() + 1);
                continue;
            }

            long dte = ChronoUnit.DAYS.between(tradingDate, contract.getExpiry());
            if (dte < 0) {
                stats.setExpired(stats.getExpired() + 1);
                continue;
            }
            if (dte > filter.getMaxDteDays()) {
                stats.setDteExceeded(stats.getDteExceeded() + 1);
                continue;
            }

            if (!MathUtils.isValidNumber(contract.getGamma())) {
                stats.setMissingGamma(stats.getMissingGamma() + 1);
                continue;
            }

            long oi = contract.getOpenInterest();
            if (oi <= 0 || oi < filter.getMinOpenInterest()) {
                stats.setLowOpenInterest(stats.getLowOpenInterest() + 1);
                continue;
            }

            if (contract.getVolume() < filter.getMinVolume()) {
                stats.setLowVolume(stats.getLowVolume() + 1);
                continue;
            }

            if (filter.isSpreadFilterEnabled()) {
                Double spreadPct = spreadPct(contract.getBid(), contract.getAsk());
                if (spreadPct == null || spreadPct > filter.getMaxSpreadPct()) {
                    stats.setWideSpread(stats.getWideSpread() + 1);
                    continue;
                }
            }

            eligible.add(contract);
        }
        return new Result(eligible, stats);
    }

    /**
     * Bid/ask spread as % of mid; null when either quote is missing, non-positive or crossed.
     */
    static Double spreadPct(Double bid, Double ask) {
        if (!MathUtils.isValidNumber(bid) || !MathUtils.isValidNumber(ask)) {
            return null;
        }
        if (bid <= 0 || ask <= 0 || ask < bid) {
            return null;
        }
        double mid = 0.5 * (ask + bid);
        return (ask - bid) / mid * 100.0;
    }

    public record Result(List<OptionContract> eligible, FilterStats stats) {
    }
}
