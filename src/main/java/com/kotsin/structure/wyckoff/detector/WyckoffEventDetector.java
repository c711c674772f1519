package com.kotsin.structure.wyckoff.detector;

import com.kotsin.structure.config.WyckoffConfig;
import com.kotsin.structure.exception.ValidationException;
import com.kotsin.structure.wyckoff.model.DetectionResult;
import com.kotsin.structure.wyckoff.model.OhlcvBar;
import com.kotsin.structure.wyckoff.model.RegimeState;
import com.kotsin.structure.wyckoff.model.WyckoffEvent;
import com.kotsin.structure.wyckoff.model.WyckoffEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * WyckoffEventDetector - structural events from a daily bar history.
 *
 * Bars are walked in date order. Bars on or before the prior state's evaluated-through date were
 * evaluated by an earlier invocation and only serve as lookback. At most one
 * event is emitted per bar; candidates are tried in the order
 * SC, BC, SPRING, UT, AR, AR_TOP, SOS, SOW and an event type already present
 * in the current regime span is skipped.
 *
 * Every threshold and weight comes from {@link WyckoffConfig}.
 */
@Slf4j
@Component
public class WyckoffEventDetector {

    private static final WyckoffEventType[] PRIORITY = {
            WyckoffEventType.SC,
            WyckoffEventType.BC,
            WyckoffEventType.SPRING,
            WyckoffEventType.UT,
            WyckoffEventType.AR,
            WyckoffEventType.AR_TOP,
            WyckoffEventType.SOS,
            WyckoffEventType.SOW
    };

    /**
     * Detect new events and return the updated state. Pure: the prior state is never modified.
     *
     * @throws ValidationException when bars are not strictly increasing by date
     */
    public DetectionResult detect(List<OhlcvBar> bars, RegimeState priorState, WyckoffConfig config) {
        if (priorState == null) {
            throw new ValidationException("priorState is required");
        }
        validateOrdering(bars, priorState.getSymbol());

        if (bars.size() < config.getMinBars() || bars.size() <= config.getLookbackBars()) {
            log.debug("[WYCKOFF] {} insufficient history: {} bars (min {})",
                    priorState.getSymbol(), bars.size(), config.getMinBars());
            return new DetectionResult(List.of(), priorState);
        }

        Map<LocalDate, Integer> indexByDate = new HashMap<>();
        for (int i = 0; i < bars.size(); i++) {
            indexByDate.put(bars.get(i).getDate(), i);
        }

        LocalDate evaluatedThrough = priorState.lastEvaluatedDate();
        RegimeState state = priorState;
        List<WyckoffEvent> emitted = new ArrayList<>();

        for (int i = config.getLookbackBars(); i < bars.size(); i++) {
            OhlcvBar bar = bars.get(i);
            if (evaluatedThrough != null && !bar.getDate().isAfter(evaluatedThrough)) {
                continue;
            }

            BarStatistics.BarContext ctx = BarStatistics.at(bars, i, config);
            Candidate candidate = evaluate(bars, ctx, state, indexByDate, config);
            if (candidate == null) {
                continue;
            }

            WyckoffEvent event = WyckoffEvent.builder()
                    .symbol(priorState.getSymbol())
                    .date(bar.getDate())
                    .type(candidate.type)
                    .confidence(candidate.score.confidence())
                    .score(candidate.score.score())
                    .priceLevel(candidate.priceLevel)
                    .volumeContext(candidate.context.toVolumeContext())
                    .regimeAfter(RegimeTracker.next(state.getCurrentRegime(), candidate.type))
                    .build();

            if (event.getRegimeAfter() != state.getCurrentRegime()) {
                log.info("[WYCKOFF] {} regime {} -> {} on {} ({})", priorState.getSymbol(),
                        state.getCurrentRegime(), event.getRegimeAfter(), event.getDate(), event.getType());
            }
            state = state.withEvent(event);
            emitted.add(event);
        }

        LocalDate lastDate = bars.get(bars.size() - 1).getDate();
        if (evaluatedThrough == null || lastDate.isAfter(evaluatedThrough)) {
            state = state.withEvaluatedThrough(lastDate);
        }
        return new DetectionResult(emitted, state);
    }

    private Candidate evaluate(List<OhlcvBar> bars, BarStatistics.BarContext ctx, RegimeState state,
                               Map<LocalDate, Integer> indexByDate, WyckoffConfig config) {
        for (WyckoffEventType type : PRIORITY) {
            if (state.spanContains(type)) {
                continue;
            }
            Candidate candidate = switch (type) {
                case SC -> sellingClimax(ctx, config);
                case BC -> buyingClimax(ctx, config);
                case SPRING -> spring(bars, ctx, state, indexByDate, config);
                case UT -> upthrust(bars, ctx, state, indexByDate, config);
                case AR -> automaticRally(ctx, state, indexByDate, config);
                case AR_TOP -> rangeTopTest(ctx, state, indexByDate, config);
                case SOS -> signOfStrength(ctx, state, config);
                case SOW -> signOfWeakness(ctx, state, config);
            };
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }

    // ======================== CLIMAXES ========================

    private Candidate sellingClimax(BarStatistics.BarContext ctx, WyckoffConfig config) {
        WyckoffConfig.ClimaxConfig c = config.getClimax();
        if (ctx.downClose()
                && ctx.volumeRatio() >= c.getMinVolumeRatio()
                && ctx.rangeRatio() >= c.getMinRangeRatio()
                && ctx.momentumOrZero() <= -c.getMinMomentum()
                && ctx.bar().getLow() <= ctx.support()) {
            return new Candidate(WyckoffEventType.SC, ctx.bar().getLow(), ctx,
                    WyckoffScorer.climax(ctx, false, config));
        }
        return null;
    }

    private Candidate buyingClimax(BarStatistics.BarContext ctx, WyckoffConfig config) {
        WyckoffConfig.ClimaxConfig c = config.getClimax();
        if (ctx.upClose()
                && ctx.volumeRatio() >= c.getMinVolumeRatio()
                && ctx.rangeRatio() >= c.getMinRangeRatio()
                && ctx.momentumOrZero() >= c.getMinMomentum()
                && ctx.bar().getHigh() >= ctx.resistance()) {
            return new Candidate(WyckoffEventType.BC, ctx.bar().getHigh(), ctx,
                    WyckoffScorer.climax(ctx, true, config));
        }
        return null;
    }

    // ======================== FALSE BREAKS ========================

    /**
     * Low-volume breach of the SC low that closes back above it within the
     * recovery window. Dated on the recovery bar, priced at the breach low.
     */
    private Candidate spring(List<OhlcvBar> bars, BarStatistics.BarContext ctx, RegimeState state,
                             Map<LocalDate, Integer> indexByDate, WyckoffConfig config) {
        WyckoffEvent sc = state.lastInSpan(WyckoffEventType.SC);
        if (sc == null) {
            return null;
        }
        double floor = sc.getPriceLevel();
        OhlcvBar bar = ctx.bar();
        if (bar.getClose() <= floor) {
            return null;
        }

        int breach = findBreach(bars, ctx.index(), sc, indexByDate, config, true, floor);
        if (breach < 0) {
            return null;
        }
        OhlcvBar breachBar = bars.get(breach);
        double penetration = (floor - breachBar.getLow()) / floor;
        BarStatistics.BarContext breachCtx = BarStatistics.at(bars, breach, config);
        if (penetration > config.getSpring().getMaxPenetrationPct()
                || breachCtx.volumeRatio() > config.getSpring().getMaxVolumeRatio()) {
            return null;
        }
        int barsToRecover = ctx.index() - breach;
        return new Candidate(WyckoffEventType.SPRING, breachBar.getLow(), breachCtx,
                WyckoffScorer.spring(penetration, breachCtx.volumeRatio(), barsToRecover, config));
    }

    /**
     * Mirror of the spring above the BC high.
     */
    private Candidate upthrust(List<OhlcvBar> bars, BarStatistics.BarContext ctx, RegimeState state,
                               Map<LocalDate, Integer> indexByDate, WyckoffConfig config) {
        WyckoffEvent bc = state.lastInSpan(WyckoffEventType.BC);
        if (bc == null) {
            return null;
        }
        double ceiling = bc.getPriceLevel();
        OhlcvBar bar = ctx.bar();
        if (bar.getClose() >= ceiling) {
            return null;
        }

        int breach = findBreach(bars, ctx.index(), bc, indexByDate, config, false, ceiling);
        if (breach < 0) {
            return null;
        }
        OhlcvBar breachBar = bars.get(breach);
        double penetration = (breachBar.getHigh() - ceiling) / ceiling;
        BarStatistics.BarContext breachCtx = BarStatistics.at(bars, breach, config);
        if (penetration > config.getSpring().getMaxPenetrationPct()
                || breachCtx.volumeRatio() > config.getSpring().getMaxVolumeRatio()) {
            return null;
        }
        int barsToRecover = ctx.index() - breach;
        return new Candidate(WyckoffEventType.UT, breachBar.getHigh(), breachCtx,
                WyckoffScorer.spring(penetration, breachCtx.volumeRatio(), barsToRecover, config));
    }

    /**
     * Most extreme breach of {@code level} in the recovery window ending at {@code index},
     * after the anchor event, provided every close from the breach up to the previous bar
     * stayed beyond the level (so {@code index} is the first recovery). -1 when none.
     */
    private int findBreach(List<OhlcvBar> bars, int index, WyckoffEvent anchor, Map<LocalDate, Integer> indexByDate,
                           WyckoffConfig config, boolean below, double level) {
        Integer anchorIndex = indexByDate.get(anchor.getDate());
        int earliest = Math.max(index - config.getSpring().getRecoveryBars(), config.getLookbackBars());
        if (anchorIndex != null) {
            earliest = Math.max(earliest, anchorIndex + 1);
        }

        int breach = -1;
        double extreme = level;
        for (int j = earliest; j <= index; j++) {
            OhlcvBar b = bars.get(j);
            if (!b.getDate().isAfter(anchor.getDate())) {
                continue;
            }
            boolean breached = below ? b.getLow() < extreme : b.getHigh() > extreme;
            if (breached) {
                breach = j;
                extreme = below ? b.getLow() : b.getHigh();
            }
        }
        if (breach < 0) {
            return -1;
        }
        for (int k = breach; k < index; k++) {
            double close = bars.get(k).getClose();
            if (below ? close > level : close < level) {
                return -1;
            }
        }
        return breach;
    }

    // ======================== REACTIONS ========================

    private Candidate automaticRally(BarStatistics.BarContext ctx, RegimeState state,
                                     Map<LocalDate, Integer> indexByDate, WyckoffConfig config) {
        WyckoffEvent sc = state.lastInSpan(WyckoffEventType.SC);
        if (sc == null) {
            return null;
        }
        Integer scIndex = indexByDate.get(sc.getDate());
        if (scIndex == null) {
            return null;
        }
        int barsSince = ctx.index() - scIndex;
        WyckoffConfig.ReactionConfig r = config.getReaction();
        if (barsSince < 1 || barsSince > r.getMaxBarsAfterClimax() || !ctx.upClose()) {
            return null;
        }

        double rally = ctx.bar().getClose() / sc.getPriceLevel() - 1.0;
        if (rally < r.getMinRallyPct()) {
            return null;
        }
        double strength = rally / (r.getMinRallyPct() * config.getNormalisation().getFullRallyMultiple());
        return new Candidate(WyckoffEventType.AR, ctx.bar().getHigh(), ctx,
                WyckoffScorer.reaction(strength, ctx.closeLocation(), config));
    }

    /**
     * Failed test of the range ceiling: the AR high, or the BC high when no AR is in the span.
     */
    private Candidate rangeTopTest(BarStatistics.BarContext ctx, RegimeState state,
                                   Map<LocalDate, Integer> indexByDate, WyckoffConfig config) {
        WyckoffEvent reference = state.lastInSpan(WyckoffEventType.AR);
        if (reference == null) {
            reference = state.lastInSpan(WyckoffEventType.BC);
        }
        if (reference == null) {
            return null;
        }
        Integer refIndex = indexByDate.get(reference.getDate());
        WyckoffConfig.ReactionConfig r = config.getReaction();
        if (refIndex == null || ctx.index() - refIndex < r.getMinBarsAfterReference()) {
            return null;
        }

        double ceiling = reference.getPriceLevel();
        OhlcvBar bar = ctx.bar();
        if (bar.getHigh() < ceiling * (1 - r.getCeilingTolerancePct())
                || bar.getClose() > ceiling
                || ctx.closeLocation() > r.getMaxTestCloseLocation()) {
            return null;
        }
        double distance = Math.abs(bar.getHigh() - ceiling) / ceiling;
        double proximity = 1.0 - distance / (r.getCeilingTolerancePct() * 5);
        return new Candidate(WyckoffEventType.AR_TOP, ceiling, ctx,
                WyckoffScorer.reaction(proximity, 1.0 - ctx.closeLocation(), config));
    }

    // ======================== CONFIRMATIONS ========================

    private Candidate signOfStrength(BarStatistics.BarContext ctx, RegimeState state, WyckoffConfig config) {
        WyckoffEvent ar = state.lastInSpan(WyckoffEventType.AR);
        double ceiling = ar != null ? ar.getPriceLevel() : ctx.resistance();
        WyckoffConfig.BreakoutConfig b = config.getBreakout();
        if (ctx.upClose()
                && ctx.bar().getClose() > ceiling
                && ctx.volumeRatio() >= b.getMinVolumeRatio()
                && ctx.closeLocation() >= b.getSosMinCloseLocation()) {
            return new Candidate(WyckoffEventType.SOS, ctx.bar().getClose(), ctx,
                    WyckoffScorer.breakout(ctx.volumeRatio(), ctx.closeLocation(), config));
        }
        return null;
    }

    private Candidate signOfWeakness(BarStatistics.BarContext ctx, RegimeState state, WyckoffConfig config) {
        WyckoffEvent sc = state.lastInSpan(WyckoffEventType.SC);
        double floor = sc != null ? sc.getPriceLevel() : ctx.support();
        WyckoffConfig.BreakoutConfig b = config.getBreakout();
        if (ctx.downClose()
                && ctx.bar().getClose() < floor
                && ctx.volumeRatio() >= b.getMinVolumeRatio()
                && ctx.closeLocation() <= b.getSowMaxCloseLocation()) {
            return new Candidate(WyckoffEventType.SOW, ctx.bar().getClose(), ctx,
                    WyckoffScorer.breakout(ctx.volumeRatio(), 1.0 - ctx.closeLocation(), config));
        }
        return null;
    }

    // ======================== VALIDATION ========================

    static void validateOrdering(List<OhlcvBar> bars, String symbol) {
        if (bars == null) {
            throw new ValidationException("bars are required for " + symbol);
        }
        LocalDate previous = null;
        for (int i = 0; i < bars.size(); i++) {
            OhlcvBar bar = bars.get(i);
            if (bar == null || bar.getDate() == null) {
                throw new ValidationException(String.format("bar %d of %s has no date", i, symbol));
            }
            if (previous != null && !bar.getDate().isAfter(previous)) {
                throw new ValidationException(String.format(
                        "bars of %s are not strictly increasing: %s follows %s at index %d",
                        symbol, bar.getDate(), previous, i));
            }
            previous = bar.getDate();
        }
    }

    private static final class Candidate {
        final WyckoffEventType type;
        final double priceLevel;
        final BarStatistics.BarContext context;
        final WyckoffScorer.Score score;

        Candidate(WyckoffEventType type, double priceLevel, BarStatistics.BarContext context, WyckoffScorer.Score score) {
            this.type = type;
            this.priceLevel = priceLevel;
            this.context = context;
            this.score = score;
        }
    }
}
