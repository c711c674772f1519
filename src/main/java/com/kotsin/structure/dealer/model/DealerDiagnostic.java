package com.kotsin.structure.dealer.model;

/**
 * Diagnostic codes attached to dealer metrics. Codes may carry a detail suffix
 * after a colon, e.g. {@code no_eligible_options:max_dte_days=90,...}.
 */
public final class DealerDiagnostic {

    public static final String MISSING_SPOT_PRICE = "missing_spot_price";
    public static final String SPOT_RESOLUTION_FAILED = "spot_resolution_failed";
    public static final String NO_OPTIONS_AVAILABLE = "no_options_available";
    public static final String NO_OPTIONS_BEFORE_SNAPSHOT = "no_options_before_snapshot";
    public static final String NO_ELIGIBLE_OPTIONS = "no_eligible_options";
    public static final String ALL_CONTRACTS_FILTERED = "all_contracts_filtered";
    public static final String NO_GAMMA_FLIP = "no_gamma_flip";
    public static final String INSUFFICIENT_SLOPE_POINTS = "insufficient_slope_points";

    private DealerDiagnostic() {}

    /**
     * Code part of a diagnostic, without the detail suffix.
     */
    public static String codeOf(String diagnostic) {
        if (diagnostic == null) {
            return null;
        }
        int idx = diagnostic.indexOf(':');
        return idx < 0 ? diagnostic : diagnostic.substring(0, idx);
    }
}
