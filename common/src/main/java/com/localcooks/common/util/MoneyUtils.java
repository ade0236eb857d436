package com.localcooks.common.util;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.util.Currency;
import java.util.Locale;

/**
 * Money helpers. Every amount in the platform is an integer number of cents;
 * nothing here converts through floating point.
 */
public final class MoneyUtils {

    public static final Locale DEFAULT_LOCALE = Locale.CANADA;
    public static final Currency DEFAULT_CURRENCY = Currency.getInstance("CAD");

    private MoneyUtils() {
        // Utility class
    }

    /**
     * Renders cents as a currency string, e.g. {@code 123456 -> "$1,234.56"}.
     */
    public static String formatCents(long amountCents) {
        return formatCents(amountCents, DEFAULT_LOCALE, DEFAULT_CURRENCY);
    }

    public static String formatCents(long amountCents, Locale locale, Currency currency) {
        NumberFormat format = NumberFormat.getCurrencyInstance(locale);
        format.setCurrency(currency);
        format.setMinimumFractionDigits(2);
        format.setMaximumFractionDigits(2);
        return format.format(BigDecimal.valueOf(amountCents, 2));
    }

    /** Null and zero both mean "no charge". */
    public static long centsOrZero(Long amountCents) {
        return amountCents == null ? 0L : amountCents;
    }

    public static long sum(long... amountsCents) {
        long total = 0L;
        for (long amount : amountsCents) {
            total = Math.addExact(total, amount);
        }
        return total;
    }
}
