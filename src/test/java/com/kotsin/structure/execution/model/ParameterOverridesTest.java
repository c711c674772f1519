package com.kotsin.structure.execution.model;

import com.kotsin.structure.dealer.model.FilterConfig;
import com.kotsin.structure.util.JsonUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ParameterOverrides")
class ParameterOverridesTest {

    private static final FilterConfig DEFAULTS = FilterConfig.builder()
            .maxDteDays(90)
            .minOpenInterest(100)
            .minVolume(1)
            .maxSpreadPct(10.0)
            .wallsTopN(3)
            .gexSlopeRangePct(0.02)
            .build();

    @Test
    @DisplayName("No overrides keeps the defaults")
    void testApplyTo_None() {
        assertEquals(DEFAULTS, ParameterOverrides.NONE.applyTo(DEFAULTS));
    }

    @Test
    @DisplayName("Only the given fields replace the defaults")
    void testApplyTo_Partial() {
        FilterConfig merged = ParameterOverrides.builder()
                .maxDteDays(30)
                .wallsTopN(5)
                .build()
                .applyTo(DEFAULTS);

        assertEquals(30, merged.getMaxDteDays());
        assertEquals(5, merged.getWallsTopN());
        assertEquals(100, merged.getMinOpenInterest());
        assertEquals(10.0, merged.getMaxSpreadPct());
        assertEquals(0.02, merged.getGexSlopeRangePct());
    }

    @Test
    @DisplayName("Non-positive spread override disables the spread filter")
    void testApplyTo_DisableSpread() {
        FilterConfig merged = ParameterOverrides.builder().maxSpreadPct(0.0).build().applyTo(DEFAULTS);

        assertFalse(merged.isSpreadFilterEnabled());
        assertTrue(DEFAULTS.isSpreadFilterEnabled());
    }

    @Test
    @DisplayName("Reads snake_case JSON")
    void testJson() throws Exception {
        ParameterOverrides overrides = JsonUtils.fromJson(
                "{\"max_dte_days\":45,\"spot_override\":512.25,\"gex_slope_range_pct\":0.05}", ParameterOverrides.class);

        assertEquals(45, overrides.getMaxDteDays());
        assertEquals(512.25, overrides.getSpotOverride());
        assertEquals(0.05, overrides.getGexSlopeRangePct());
        assertNull(overrides.getMinOpenInterest());
    }
}
