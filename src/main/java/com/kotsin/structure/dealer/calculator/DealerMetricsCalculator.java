package com.kotsin.structure.dealer.calculator;

import com.kotsin.structure.config.DealerMetricsConfig;
import com.kotsin.structure.dealer.model.DealerConfidence;
import com.kotsin.structure.dealer.model.DealerDiagnostic;
import com.kotsin.structure.dealer.model.DealerMetrics;
import com.kotsin.structure.dealer.model.DealerPosition;
import com.kotsin.structure.dealer.model.FilterConfig;
import com.kotsin.structure.dealer.model.FilterStats;
import com.kotsin.structure.dealer.model.GammaWall;
import com.kotsin.structure.dealer.model.ProcessingStatus;
import com.kotsin.structure.dealer.model.StrikeExposure;
import com.kotsin.structure.options.model.OptionChainSnapshot;
import com.kotsin.structure.options.model.OptionContract;
import com.kotsin.structure.options.model.OptionType;
import com.kotsin.structure.options.model.SpotResolution;
import com.kotsin.structure.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * DealerMetricsCalculator - dealer gamma exposure for one option chain snapshot.
 *
 * KEY ASSUMPTION: dealers carry the opposite side of customer open interest.
 * The sign of each side is configurable ({@code dealer.exposure.sign-convention});
 * the default treats dealers as short calls, so call exposure is negative and
 * put exposure positive.
 *
 * Per contract:
 *   gex = gamma x OI x multiplier x sign                 (PER_CONTRACT)
 *   gex = gamma x OI x multiplier x spot^2 x 0.01 x sign (PER_ONE_PERCENT_MOVE)
 *
 * Aggregates:
 *   strike_gex  = signed sum per strike
 *   gex_net     = sum of strike_gex
 *   gex_total   = sum of |strike_gex|
 *   gamma_flip  = interpolated zero crossing of cumulative strike_gex (ascending strikes)
 *   gex_slope   = change of cumulative strike_gex per point of strike within +/-range of spot
 *   dgpi        = sign(net) x log10(|net| + 1) x scale x slope factor x iv weight, clamped
 *
 * Never throws for data-quality problems: missing spot, empty or fully filtered
 * chains come back as INVALID with diagnostics.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DealerMetricsCalculator {

    private final DealerMetricsConfig config;
    private final DealerStatusClassifier statusClassifier;

    /**
     * Compute metrics for a snapshot. Deterministic and free of I/O.
     *
     * @param snapshot chain at the snapshot time
     * @param spot     resolved spot (may be unresolved)
     * @param filter   effective filter for this run
     */
    public DealerMetrics compute(OptionChainSnapshot snapshot, SpotResolution spot, FilterConfig filter) {
        List<String> diagnostics = new ArrayList<>();
        SpotResolution resolvedSpot = spot != null ? spot : SpotResolution.unresolved(List.of());

        if (snapshot.getOptionsTime() == null && snapshot.isEmpty()) {
            diagnostics.add(DealerDiagnostic.NO_OPTIONS_BEFORE_SNAPSHOT + ":snapshot_time=" + snapshot.getSnapshotTime());
        }

        ContractFilter.Result filtered = ContractFilter.apply(snapshot.getContracts(), snapshot.getTradingDate(), filter);
        List<OptionContract> eligible = filtered.eligible();
        FilterStats stats = filtered.stats();
        int eligibleCount = eligible.size();
        int totalCount = stats.getTotal();

        if (totalCount > 0 && eligibleCount == 0) {
            diagnostics.add(String.format(
                    "%s:max_dte_days=%d,dte_exceeded=%d,low_open_interest=%d,low_volume=%d,wide_spread=%d",
                    DealerDiagnostic.NO_ELIGIBLE_OPTIONS, filter.getMaxDteDays(), stats.getDteExceeded(),
                    stats.getLowOpenInterest(), stats.getLowVolume(), stats.getWideSpread()));
        }

        Exposure exposure;
        ProcessingStatus processingStatus;
        String failureReason;

        if (!resolvedSpot.isResolved()) {
            diagnostics.add(DealerDiagnostic.MISSING_SPOT_PRICE);
            exposure = Exposure.EMPTY;
            processingStatus = ProcessingStatus.FAIL_MISSING_SPOT;
            failureReason = DealerDiagnostic.MISSING_SPOT_PRICE;
            if (totalCount > 0 && eligibleCount > 0) {
                processingStatus = ProcessingStatus.FAIL_SPOT_RESOLUTION;
                failureReason = DealerDiagnostic.SPOT_RESOLUTION_FAILED;
                diagnostics.add(DealerDiagnostic.SPOT_RESOLUTION_FAILED
                        + ":attempted_sources=[" + String.join(",", resolvedSpot.attemptedSources()) + "]");
            }
        } else {
            exposure = computeExposure(eligible, resolvedSpot.price(), filter, snapshot.getIvRank(), stats, diagnostics);
            processingStatus = ProcessingStatus.SUCCESS;
            failureReason = null;
        }

        if (processingStatus == ProcessingStatus.SUCCESS) {
            if (totalCount == 0) {
                processingStatus = ProcessingStatus.FAIL_NO_OPTIONS;
                failureReason = DealerDiagnostic.NO_OPTIONS_AVAILABLE;
                diagnostics.add(DealerDiagnostic.NO_OPTIONS_AVAILABLE);
            } else if (eligibleCount == 0) {
                processingStatus = ProcessingStatus.FAIL_NO_ELIGIBLE_OPTIONS;
                failureReason = DealerDiagnostic.ALL_CONTRACTS_FILTERED;
                diagnostics.add(DealerDiagnostic.ALL_CONTRACTS_FILTERED);
            }
        }

        DealerStatusClassifier.Classification classification = statusClassifier.classify(
                eligibleCount, exposure.gexTotal, exposure.gexNet, exposure.position, exposure.confidence, diagnostics);

        log.debug("[DEALER] {} eligible={}/{} net={} flip={} status={} reason={}",
                snapshot.getSymbol(), eligibleCount, totalCount, exposure.gexNet, exposure.gammaFlip,
                classification.status(), classification.reason().getValue());

        return DealerMetrics.builder()
                .symbol(snapshot.getSymbol())
                .snapshotTime(snapshot.getSnapshotTime())
                .optionsTime(snapshot.getOptionsTime())
                .tradingDate(snapshot.getTradingDate())
                .spotPrice(resolvedSpot.isResolved() ? MathUtils.roundOrNull(resolvedSpot.price(), 4) : null)
                .spotPriceSource(resolvedSpot.source())
                .spotResolutionStrategy(resolvedSpot.strategy())
                .spotAttemptedSources(resolvedSpot.attemptedSources())
                .gexTotal(exposure.gexTotal)
                .gexNet(exposure.gexNet)
                .gammaFlip(exposure.gammaFlip)
                .callWalls(exposure.callWalls)
                .putWalls(exposure.putWalls)
                .gexSlope(exposure.gexSlope)
                .dgpi(exposure.dgpi)
                .strikeGex(exposure.strikeGex)
                .ivRank(MathUtils.roundOrNull(snapshot.getIvRank(), 2))
                .position(exposure.position)
                .confidence(exposure.confidence)
                .dataCompleteness(exposure.completeness)
                .status(classification.status())
                .statusReason(classification.reason())
                .processingStatus(processingStatus)
                .failureReason(failureReason)
                .diagnostics(List.copyOf(diagnostics))
                .eligibleOptionsCount(eligibleCount)
                .totalOptionsCount(totalCount)
                .filterStats(stats)
                .filters(filter)
                .build();
    }

    private Exposure computeExposure(List<OptionContract> eligible, double spot, FilterConfig filter,
                                     Double ivRank, FilterStats stats, List<String> diagnostics) {
        if (eligible.isEmpty()) {
            return Exposure.EMPTY;
        }

        // Signed exposure aggregated per strike, ascending
        TreeMap<Double, Double> strikeGex = new TreeMap<>();
        for (OptionContract contract : eligible) {
            strikeGex.merge(contract.getStrike(), contractExposure(contract, spot), Double::sum);
        }

        double net = 0;
        double total = 0;
        for (double gex : strikeGex.values()) {
            net += gex;
            total += Math.abs(gex);
        }
        if (!MathUtils.isValidNumber(net) || !MathUtils.isValidNumber(total)) {
            return Exposure.EMPTY;
        }

        Double gammaFlip = findGammaFlip(strikeGex);
        if (gammaFlip == null) {
            diagnostics.add(DealerDiagnostic.NO_GAMMA_FLIP);
        }
        Double slope = calculateGexSlope(strikeGex, spot, filter.getGexSlopeRangePct());
        if (slope == null) {
            diagnostics.add(DealerDiagnostic.INSUFFICIENT_SLOPE_POINTS);
        }

        double completeness = completeness(stats);
        Exposure exposure = new Exposure();
        exposure.gexTotal = MathUtils.roundOrNull(total, 2);
        exposure.gexNet = MathUtils.roundOrNull(net, 2);
        exposure.gammaFlip = gammaFlip;
        exposure.gexSlope = slope;
        exposure.dgpi = calculateDgpi(net, slope, ivRank);
        exposure.callWalls = findWalls(eligible, OptionType.CALL, spot, filter.getWallsTopN());
        exposure.putWalls = findWalls(eligible, OptionType.PUT, spot, filter.getWallsTopN());
        exposure.strikeGex = toStrikeExposures(strikeGex);
        exposure.position = determinePosition(net);
        exposure.confidence = determineConfidence(eligible, completeness);
        exposure.completeness = MathUtils.roundOrNull(completeness, 4);
        return exposure;
    }

    double contractExposure(OptionContract contract, double spot) {
        DealerMetricsConfig.ExposureConfig exposureConfig = config.getExposure();
        double gex = contract.getGamma() * contract.getOpenInterest() * exposureConfig.getContractMultiplier();
        if (exposureConfig.getScaling() == DealerMetricsConfig.ExposureScaling.PER_ONE_PERCENT_MOVE) {
            gex *= spot * spot * 0.01;
        }
        int sign = contract.isCall()
                ? exposureConfig.getSignConvention().callSign()
                : exposureConfig.getSignConvention().putSign();
        return gex * sign;
    }

    /**
     * First zero crossing of cumulative strike GEX, interpolated between the two
     * strikes around it. A cumulative that reaches exactly zero flips at that
     * strike. Null when the cumulative curve never crosses zero.
     */
    Double findGammaFlip(TreeMap<Double, Double> strikeGex) {
        if (strikeGex.size() < 2) {
            return null;
        }

        double cumulative = 0;
        Double prevStrike = null;
        double prevCumulative = 0;

        for (Map.Entry<Double, Double> entry : strikeGex.entrySet()) {
            double strike = entry.getKey();
            cumulative += entry.getValue();

            if (prevStrike != null) {
                int prevSign = MathUtils.sign(prevCumulative);
                int sign = MathUtils.sign(cumulative);
                if (prevSign != 0 && sign == 0) {
                    // Cumulative lands exactly on zero at this strike
                    return strike;
                }
                if (prevSign != 0 && prevSign != sign) {
                    double ratio = Math.abs(prevCumulative) / (Math.abs(prevCumulative) + Math.abs(cumulative));
                    double flip = prevStrike + ratio * (strike - prevStrike);
                    Double rounded = MathUtils.roundOrNull(flip, 2);
                    // Rounding must not push the level onto a bracketing strike
                    if (rounded != null && rounded > prevStrike && rounded < strike) {
                        return rounded;
                    }
                    return flip;
                }
            }
            prevStrike = strike;
            prevCumulative = cumulative;
        }
        return null;
    }

    /**
     * Finite difference of cumulative strike GEX across the strikes inside
     * [spot x (1 - range), spot x (1 + range)]. Null with fewer than two strikes in range.
     */
    Double calculateGexSlope(TreeMap<Double, Double> strikeGex, double spot, double rangePct) {
        double lower = spot * (1 - rangePct);
        double upper = spot * (1 + rangePct);

        double cumulative = 0;
        Double firstStrike = null;
        double firstCumulative = 0;
        Double lastStrike = null;
        double lastCumulative = 0;

        for (Map.Entry<Double, Double> entry : strikeGex.entrySet()) {
            cumulative += entry.getValue();
            double strike = entry.getKey();
            if (strike < lower || strike > upper) {
                continue;
            }
            if (firstStrike == null) {
                firstStrike = strike;
                firstCumulative = cumulative;
            }
            lastStrike = strike;
            lastCumulative = cumulative;
        }

        if (firstStrike == null || lastStrike.equals(firstStrike)) {
            return null;
        }
        return MathUtils.roundOrNull((lastCumulative - firstCumulative) / (lastStrike - firstStrike), 4);
    }

    Double calculateDgpi(double net, Double slope, Double ivRank) {
        DealerMetricsConfig.DgpiConfig dgpi = config.getDgpi();

        double base = MathUtils.sign(net) * Math.log10(Math.abs(net) + 1) * dgpi.getLogScale();
        double slopeEffect = slope == null ? 0.0
                : MathUtils.clamp(slope * dgpi.getSlopeCoefficient(), -dgpi.getMaxSlopeEffect(), dgpi.getMaxSlopeEffect());
        double ivWeight = MathUtils.isValidNumber(ivRank)
                ? dgpi.getIvRankBase() + ivRank / dgpi.getIvRankDivisor()
                : 1.0;

        double value = MathUtils.clamp(base * (1 + slopeEffect) * ivWeight, -dgpi.getBound(), dgpi.getBound());
        return MathUtils.roundOrNull(value, 2);
    }

    /**
     * Top N strikes of one side by aggregated open interest, descending. Ties go
     * to the strike nearer spot, then the lower strike.
     */
    List<GammaWall> findWalls(List<OptionContract> eligible, OptionType side, double spot, int topN) {
        double maxMoneyness = config.getWalls().getMaxMoneyness();

        TreeMap<Double, long[]> byStrike = new TreeMap<>();
        for (OptionContract contract : eligible) {
            if (contract.getType() != side || contract.getOpenInterest() <= 0) {
                continue;
            }
            if (maxMoneyness > 0 && Math.abs(contract.getStrike() - spot) / spot > maxMoneyness) {
                continue;
            }
            long[] agg = byStrike.computeIfAbsent(contract.getStrike(), k -> new long[2]);
            agg[0] += contract.getOpenInterest();
            agg[1] += contract.getVolume();
        }

        List<GammaWall> walls = new ArrayList<>();
        byStrike.forEach((strike, agg) -> walls.add(new GammaWall(strike, agg[0], agg[1])));
        walls.sort(Comparator.comparingLong(GammaWall::openInterest).reversed()
                .thenComparingDouble(w -> Math.abs(w.strike() - spot))
                .thenComparingDouble(GammaWall::strike));

        return walls.size() > topN ? List.copyOf(walls.subList(0, topN)) : List.copyOf(walls);
    }

    DealerPosition determinePosition(double net) {
        if (!MathUtils.isValidNumber(net)) {
            return DealerPosition.UNKNOWN;
        }
        if (Math.abs(net) < config.getPosition().getNeutralThreshold()) {
            return DealerPosition.NEUTRAL;
        }
        return net > 0 ? DealerPosition.LONG_GAMMA : DealerPosition.SHORT_GAMMA;
    }

    DealerConfidence determineConfidence(List<OptionContract> eligible, double completeness) {
        DealerMetricsConfig.ConfidenceConfig thresholds = config.getConfidence();
        int count = eligible.size();
        if (count < thresholds.getMinContracts()) {
            return DealerConfidence.INVALID;
        }

        long totalOi = eligible.stream().mapToLong(OptionContract::getOpenInterest).sum();
        if (count >= thresholds.getHighContracts()
                && totalOi >= thresholds.getHighTotalOpenInterest()
                && completeness >= thresholds.getHighCompleteness()) {
            return DealerConfidence.HIGH;
        }
        if (completeness >= thresholds.getMediumCompleteness()) {
            return DealerConfidence.MEDIUM;
        }
        return DealerConfidence.LOW;
    }

    /**
     * Share of supplied contracts that carried a usable gamma.
     */
    static double completeness(FilterStats stats) {
        if (stats.getTotal() == 0) {
            return 0.0;
        }
        return MathUtils.safeDivide(stats.getTotal() - stats.getMissingGamma(), stats.getTotal(), 0.0);
    }

    private static List<StrikeExposure> toStrikeExposures(TreeMap<Double, Double> strikeGex) {
        List<StrikeExposure> result = new ArrayList<>(strikeGex.size());
        strikeGex.forEach((strike, gex) -> result.add(new StrikeExposure(strike, MathUtils.roundOrNull(gex, 2))));
        return List.copyOf(result);
    }

    /**
     * Intermediate exposure values; EMPTY when nothing could be computed.
     */
    private static final class Exposure {
        static final Exposure EMPTY = new Exposure();

        Double gexTotal;
        Double gexNet;
        Double gammaFlip;
        Double gexSlope;
        Double dgpi;
        List<GammaWall> callWalls = List.of();
        List<GammaWall> putWalls = List.of();
        List<StrikeExposure> strikeGex = List.of();
        DealerPosition position = DealerPosition.UNKNOWN;
        DealerConfidence confidence = DealerConfidence.INVALID;
        Double completeness;
    }
}
