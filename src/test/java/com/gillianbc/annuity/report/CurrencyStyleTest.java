package com.gillianbc.annuity.report;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CurrencyStyleTest {

    @Test
    @DisplayName("Amounts are grouped with two decimals")
    void format_groupsThousands() {
        assertEquals("R 1,010,352.33", CurrencyStyle.ZAR.format(1_010_352.330912583));
        assertEquals("$ 0.00", CurrencyStyle.USD.format(0));
        assertEquals("£ 5,601.44", CurrencyStyle.GBP.format(5601.44));
    }

    @Test
    @DisplayName("Yen is shown without decimals")
    void format_yenHasNoDecimals() {
        assertEquals("¥ 5,601", CurrencyStyle.JPY.format(5601.44));
    }

    @Test
    @DisplayName("Unknown or missing codes fall back to rand")
    void fromCode_fallsBackToZar() {
        assertEquals(CurrencyStyle.EUR, CurrencyStyle.fromCode("eur"));
        assertEquals(CurrencyStyle.ZAR, CurrencyStyle.fromCode("XYZ"));
        assertEquals(CurrencyStyle.ZAR, CurrencyStyle.fromCode(null));
    }
}
