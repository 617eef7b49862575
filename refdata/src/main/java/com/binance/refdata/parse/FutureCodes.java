package com.binance.refdata.parse;

import com.binance.refdata.FormatException;

/**
 * Turns the expiry embedded in a Binance futures symbol into a CME-style
 * month/year code: {@code BTCUSDT_240329} becomes {@code H4}.
 */
public final class FutureCodes {

    // CME convention, January to December
    static final String MONTH_CODES = "FGHJKMNQUVXZ";

    private FutureCodes() {}

    public static String simplify(String symbol) {
        String[] parts = symbol.split("_", -1);
        if (parts.length != 2) {
            throw new FormatException("expected symbol to split into 2 parts, '" + symbol + "'");
        }
        String date = parts[1];
        if (date.length() != 6) {
            throw new FormatException("expected symbol-date to have len 6, '" + date + "'");
        }

        for (char c : date.toCharArray()) {
            if (c < '0' || c > '9') {
                throw new FormatException("expected YYMMDD digits in symbol-date, '" + date + "'");
            }
        }

        int month = Integer.parseInt(date.substring(2, 4));
        if (month < 1 || month > MONTH_CODES.length()) {
            throw new FormatException("month out of range in symbol-date, '" + date + "'");
        }
        return MONTH_CODES.charAt(month - 1) + date.substring(1, 2);
    }
}
