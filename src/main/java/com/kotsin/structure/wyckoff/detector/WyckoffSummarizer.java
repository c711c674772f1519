package com.kotsin.structure.wyckoff.detector;

import com.kotsin.structure.config.WyckoffConfig;
import com.kotsin.structure.wyckoff.model.DetectionResult;
import com.kotsin.structure.wyckoff.model.OhlcvBar;
import com.kotsin.structure.wyckoff.model.RegimeState;
import com.kotsin.structure.wyckoff.model.WyckoffEvent;
import com.kotsin.structure.wyckoff.model.WyckoffEventType;
import com.kotsin.structure.wyckoff.model.WyckoffSummary;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-date view of a detection: events on the snapshot date, primary event,
 * BC / spring scores of the snapshot bar and recently completed sequences.
 * Scores are null when history is too short or the snapshot date has no bar.
 */
@Component
public class WyckoffSummarizer {

    public WyckoffSummary summarize(List<OhlcvBar> bars, DetectionResult detection, LocalDate date, WyckoffConfig config) {
        RegimeState state = detection.newState();
        List<WyckoffEvent> onDate = state.getEventHistory().stream()
                .filter(e -> date.equals(e.getDate()))
                .collect(Collectors.toList());

        WyckoffEventType primary = onDate.stream()
                .max(Comparator.comparingDouble(WyckoffEvent::getScore))
                .map(WyckoffEvent::getType)
                .orElse(null);

        boolean enoughHistory = bars.size() >= config.getMinBars() && bars.size() > config.getLookbackBars();
        // Scores describe the snapshot bar; none when that bar is not loaded yet
        boolean snapshotBar = !bars.isEmpty() && date.equals(bars.get(bars.size() - 1).getDate());
        Double bcScore = null;
        Double springScore = null;
        if (enoughHistory && snapshotBar) {
            int last = bars.size() - 1;
            BarStatistics.BarContext ctx = BarStatistics.at(bars, last, config);
            bcScore = ctx.upClose() ? WyckoffScorer.climax(ctx, true, config).score() : 0.0;
            springScore = onDate.stream()
                    .filter(e -> e.getType() == WyckoffEventType.SPRING)
                    .map(WyckoffEvent::getScore)
                    .findFirst()
                    .orElse(0.0);
        }

        return WyckoffSummary.builder()
                .date(date)
                .regime(state.getCurrentRegime())
                .eventsDetected(onDate.stream().map(WyckoffEvent::getType).collect(Collectors.toList()))
                .primaryEvent(primary)
                .bcScore(bcScore)
                .springScore(springScore)
                .sequences(SequenceDetector.completedAsOf(state.getEventHistory(), date, config.getSequenceMaxDays()))
                .build();
    }
}
