package com.kotsin.structure.wyckoff.detector;

import com.kotsin.structure.config.WyckoffConfig;
import com.kotsin.structure.util.MathUtils;
import com.kotsin.structure.wyckoff.model.OhlcvBar;
import com.kotsin.structure.wyckoff.model.VolumeContext;

import java.util.List;

/**
 * Sub-signals of one bar measured against the trailing lookback window.
 * The window excludes the bar itself.
 */
final class BarStatistics {

    private BarStatistics() {}

    static BarContext at(List<OhlcvBar> bars, int index, WyckoffConfig config) {
        int lookback = config.getLookbackBars();
        OhlcvBar bar = bars.get(index);

        double volumeSum = 0;
        double rangeSum = 0;
        double support = Double.MAX_VALUE;
        double resistance = -Double.MAX_VALUE;
        for (int k = index - lookback; k < index; k++) {
            OhlcvBar b = bars.get(k);
            volumeSum += b.getVolume();
            rangeSum += b.range();
            support = Math.min(support, b.getLow());
            resistance = Math.max(resistance, b.getHigh());
        }
        double avgVolume = volumeSum / lookback;
        double avgRange = rangeSum / lookback;

        Double momentum = null;
        int momentumBars = config.getMomentumBars();
        if (index >= momentumBars) {
            double base = bars.get(index - momentumBars).getClose();
            if (MathUtils.isValidDenominator(base)) {
                momentum = bar.getClose() / base - 1.0;
            }
        }

        return new BarContext(
                index,
                bar,
                bars.get(index - 1).getClose(),
                avgVolume,
                MathUtils.safeDivide(bar.getVolume(), avgVolume, 0.0),
                MathUtils.safeDivide(bar.range(), avgRange, 0.0),
                bar.closeLocation(),
                momentum,
                support,
                resistance);
    }

    /**
     * @param prevClose   close of the previous bar
     * @param support     lowest low of the window
     * @param resistance  highest high of the window
     */
    record BarContext(int index,
                      OhlcvBar bar,
                      double prevClose,
                      double averageVolume,
                      double volumeRatio,
                      double rangeRatio,
                      double closeLocation,
                      Double momentum,
                      double support,
                      double resistance) {

        boolean upClose() {
            return bar.getClose() > prevClose;
        }

        boolean downClose() {
            return bar.getClose() < prevClose;
        }

        double momentumOrZero() {
            return momentum == null ? 0.0 : momentum;
        }

        VolumeContext toVolumeContext() {
            return VolumeContext.builder()
                    .volumeRatio(MathUtils.roundOrNull(volumeRatio, 4))
                    .rangeRatio(MathUtils.roundOrNull(rangeRatio, 4))
                    .closeLocation(MathUtils.roundOrNull(closeLocation, 4))
                    .momentum(MathUtils.roundOrNull(momentum, 4))
                    .volume(bar.getVolume())
                    .averageVolume(MathUtils.roundOrNull(averageVolume, 2))
                    .build();
        }
    }
}
