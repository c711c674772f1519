package com.kotsin.structure.dealer.calculator;

import com.kotsin.structure.config.DealerMetricsConfig;
import com.kotsin.structure.dealer.model.DealerConfidence;
import com.kotsin.structure.dealer.model.DealerDiagnostic;
import com.kotsin.structure.dealer.model.DealerPosition;
import com.kotsin.structure.dealer.model.DealerStatus;
import com.kotsin.structure.dealer.model.StatusReason;
import com.kotsin.structure.util.MathUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives FULL / LIMITED / INVALID from eligible count, GEX null-ness, position and confidence.
 *
 * FULL:    eligible >= full-min AND gex non-null with non-zero total AND position known
 *          AND confidence in {high, medium}
 * LIMITED: eligible >= limited-min AND gex non-null with non-zero total AND position known
 *          AND confidence in {medium, invalid}
 * INVALID: otherwise; the first matching reason in {@link StatusReason} order is reported.
 */
@Component
@RequiredArgsConstructor
public class DealerStatusClassifier {

    private static final Set<DealerConfidence> FULL_CONFIDENCE =
            EnumSet.of(DealerConfidence.HIGH, DealerConfidence.MEDIUM);
    private static final Set<DealerConfidence> LIMITED_CONFIDENCE =
            EnumSet.of(DealerConfidence.MEDIUM, DealerConfidence.INVALID);

    private final DealerMetricsConfig config;

    public Classification classify(int eligibleOptions,
                                   Double gexTotal,
                                   Double gexNet,
                                   DealerPosition position,
                                   DealerConfidence confidence,
                                   Collection<String> diagnostics) {
        boolean gexPresent = MathUtils.isValidNumber(gexTotal) && MathUtils.isValidNumber(gexNet);
        boolean gexNonZero = gexPresent && Math.abs(gexTotal) > 0;
        boolean positionKnown = position != null && position.isKnown();

        if (eligibleOptions >= config.getStatus().getFullMinEligible()
                && gexNonZero
                && positionKnown
                && confidence != null && FULL_CONFIDENCE.contains(confidence)) {
            return new Classification(DealerStatus.FULL, StatusReason.FULL_THRESHOLDS_MET);
        }

        if (eligibleOptions >= config.getStatus().getLimitedMinEligible()
                && gexNonZero
                && positionKnown
                && confidence != null && LIMITED_CONFIDENCE.contains(confidence)) {
            return new Classification(DealerStatus.LIMITED, StatusReason.LIMITED_THRESHOLDS_MET);
        }

        Set<String> codes = diagnostics == null ? Set.of() : diagnostics.stream()
                .map(DealerDiagnostic::codeOf)
                .collect(Collectors.toSet());

        if (eligibleOptions == 0) {
            return invalid(StatusReason.NO_ELIGIBLE_OPTIONS);
        }
        if (!MathUtils.isValidNumber(gexTotal)) {
            return invalid(StatusReason.MISSING_GEX_TOTAL);
        }
        if (!MathUtils.isValidNumber(gexNet)) {
            return invalid(StatusReason.MISSING_GEX_NET);
        }
        if (codes.contains(DealerDiagnostic.MISSING_SPOT_PRICE) || codes.contains(DealerDiagnostic.SPOT_RESOLUTION_FAILED)) {
            return invalid(StatusReason.MISSING_SPOT);
        }
        if (codes.contains(DealerDiagnostic.ALL_CONTRACTS_FILTERED)) {
            return invalid(StatusReason.ALL_CONTRACTS_FILTERED);
        }
        if (codes.contains(DealerDiagnostic.NO_OPTIONS_AVAILABLE)) {
            return invalid(StatusReason.NO_OPTIONS_AVAILABLE);
        }
        return invalid(StatusReason.CRITERIA_NOT_MET);
    }

    private static Classification invalid(StatusReason reason) {
        return new Classification(DealerStatus.INVALID, reason);
    }

    public record Classification(DealerStatus status, StatusReason reason) {
    }
}
