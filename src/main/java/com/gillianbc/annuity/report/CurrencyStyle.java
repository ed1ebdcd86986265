package com.gillianbc.annuity.report;

import java.util.Locale;

/**
 * Display currencies. Only the symbol and the number of decimals differ; amounts are never converted.
 */
public enum CurrencyStyle {
    ZAR("R", true),
    USD("$", true),
    EUR("€", true),
    GBP("£", true),
    JPY("¥", false),
    CHF("CHF", true),
    CAD("C$", true),
    AUD("A$", true),
    CNY("¥", true),
    INR("₹", true),
    AED("AED", true);

    private final String symbol;
    private final boolean showDecimals;

    CurrencyStyle(String symbol, boolean showDecimals) {
        this.symbol = symbol;
        this.showDecimals = showDecimals;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Looks up a currency by ISO code, falling back to ZAR for anything unknown.
     */
    public static CurrencyStyle fromCode(String code) {
        if (code != null) {
            for (CurrencyStyle style : values()) {
                if (style.name().equalsIgnoreCase(code.trim())) {
                    return style;
                }
            }
        }
        return ZAR;
    }

    /**
     * e.g. "R 1,234.50", or "¥ 1,235" for JPY
     */
    public String format(double amount) {
        return symbol + " " + String.format(Locale.ROOT, showDecimals ? "%,.2f" : "%,.0f", amount);
    }
}
